package lab.commentsearch.search.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String requestId) {
        super("Request not found: " + requestId);
    }
}
