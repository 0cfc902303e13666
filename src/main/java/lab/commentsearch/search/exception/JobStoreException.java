package lab.commentsearch.search.exception;

/**
 * The job store could not read or write a record.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
