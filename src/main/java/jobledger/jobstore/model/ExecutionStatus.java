package jobledger.jobstore.model;

/**
 * Status of the open execution record of a job.
 */
public enum ExecutionStatus {
    /** Job was added to the scheduler */
    ADDED,
    /** Run was submitted to a worker */
    STARTED,
    /** Run finished without error */
    SUCCEEDED,
    /** Run time was missed */
    MISSED,
    /** Run skipped because too many instances were already running */
    MAX_INSTANCES,
    /** Run raised an error */
    ERROR
}
