package jobledger.jobstore.exception;

/**
 * Base class for failures surfaced by the job store. Backend errors are
 * wrapped in this type with the failed operation in the message.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
