package jobledger.jobstore.model;

/**
 * Classification of a job's trigger. Stored for audit only, never used to
 * recompute a schedule.
 */
public enum TriggerKind {
    /** Fires once at a fixed point in time */
    DATE,
    /** Fires on a cron expression */
    CRON,
    /** Fires at a fixed interval */
    INTERVAL
}
