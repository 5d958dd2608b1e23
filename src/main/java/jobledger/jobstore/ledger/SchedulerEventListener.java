package jobledger.jobstore.ledger;

/**
 * Receives job lifecycle events from the scheduler.
 */
@FunctionalInterface
public interface SchedulerEventListener {

    void onEvent(SchedulerEvent event);
}
