package lab.commentsearch.search.exception;

public class CommentRetrievalException extends RuntimeException {

    private final Integer statusCode;
    private final boolean retryable;

    public CommentRetrievalException(String message, Integer statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
