package lab.commentsearch.search.exception;

/**
 * A submission was rejected before any job was created.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }
}
