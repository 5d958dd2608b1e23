package jobledger.jobstore.exception;

/**
 * Thrown when a job is added under an id that is already stored.
 */
public class ConflictingIdException extends JobStoreException {

    private final String jobId;

    public ConflictingIdException(String jobId) {
        super("Job identifier (" + jobId + ") conflicts with an existing job");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
