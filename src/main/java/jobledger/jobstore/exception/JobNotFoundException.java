package jobledger.jobstore.exception;

/**
 * Thrown when a job is updated or removed but no job with that id is stored.
 */
public class JobNotFoundException extends JobStoreException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No job by the id of " + jobId + " was found");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
