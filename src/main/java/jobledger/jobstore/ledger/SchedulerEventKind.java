package jobledger.jobstore.ledger;

/**
 * Job lifecycle notifications emitted by the scheduler, with the scheduler's
 * numeric event codes.
 */
public enum SchedulerEventKind {
    JOB_ADDED(1 << 9),
    JOB_REMOVED(1 << 10),
    JOB_MODIFIED(1 << 11),
    JOB_EXECUTED(1 << 12),
    JOB_ERROR(1 << 13),
    JOB_MISSED(1 << 14),
    JOB_SUBMITTED(1 << 15),
    JOB_MAX_INSTANCES(1 << 16);

    private final int code;

    SchedulerEventKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolve a scheduler event code.
     *
     * @throws IllegalArgumentException for a code outside the job event vocabulary
     */
    public static SchedulerEventKind fromCode(int code) {
        for (SchedulerEventKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown scheduler event code: " + code);
    }
}
