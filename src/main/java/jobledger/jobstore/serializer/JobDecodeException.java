package jobledger.jobstore.serializer;

/**
 * A stored job blob could not be turned back into a job.
 */
public class JobDecodeException extends Exception {

    public JobDecodeException(String message) {
        super(message);
    }

    public JobDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
