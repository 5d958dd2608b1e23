package jobledger.jobstore.ledger;

import jobledger.jobstore.model.ExecutionRecord;
import jobledger.jobstore.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Translates scheduler lifecycle events into execution ledger transitions.
 *
 * <pre>
 * JOB_ADDED          create or reset record: ADDED, run time = event time, trigger kind of the job
 * JOB_SUBMITTED      STARTED
 * JOB_EXECUTED       SUCCEEDED, finished = event time
 * JOB_ERROR          ERROR with exception and traceback
 * JOB_MISSED         MISSED with a synthetic message
 * JOB_MAX_INSTANCES  MAX_INSTANCES with a synthetic message
 * JOB_MODIFIED       run time = job's new next run time
 * </pre>
 *
 * <p>The event time is {@link SchedulerEvent#occurredAt()}, or the ledger clock when
 * the event carries none.
 *
 * <p>An event for a job whose record (or, for ADDED and MODIFIED, the job itself)
 * is gone is logged and skipped: jobs can be removed between an event firing and
 * its delivery. Any other event kind is a wiring error and fails.
 */
public class EventBridge implements SchedulerEventListener {

    private static final Logger log = LoggerFactory.getLogger(EventBridge.class);

    private static final Set<SchedulerEventKind> HANDLED = EnumSet.of(
            SchedulerEventKind.JOB_ADDED,
            SchedulerEventKind.JOB_SUBMITTED,
            SchedulerEventKind.JOB_EXECUTED,
            SchedulerEventKind.JOB_ERROR,
            SchedulerEventKind.JOB_MISSED,
            SchedulerEventKind.JOB_MAX_INSTANCES,
            SchedulerEventKind.JOB_MODIFIED);

    private final ExecutionLedger ledger;
    private final JobLookup jobs;

    public EventBridge(ExecutionLedger ledger, JobLookup jobs) {
        this.ledger = ledger;
        this.jobs = jobs;
    }

    /** Event kinds this bridge must be subscribed to. */
    public static Set<SchedulerEventKind> handledKinds() {
        return EnumSet.copyOf(HANDLED);
    }

    public static boolean handles(SchedulerEventKind kind) {
        return HANDLED.contains(kind);
    }

    /**
     * @throws IllegalStateException if the event kind is not one of {@link #handledKinds()}
     */
    @Override
    public void onEvent(SchedulerEvent event) {
        String jobId = event.jobId();
        Optional<ExecutionRecord> outcome = switch (event.kind()) {
            case JOB_ADDED -> jobs.lookup(jobId)
                    .map(job -> ledger.recordAdded(jobId, job.triggerKind(), event.occurredAt()));
            case JOB_SUBMITTED -> ledger.markStarted(jobId);
            case JOB_EXECUTED -> ledger.markSucceeded(jobId, event.occurredAt());
            case JOB_ERROR -> ledger.markError(jobId, event.exception(),
                    event.exception() != null ? event.traceback() : null);
            case JOB_MISSED -> ledger.markMissed(jobId);
            case JOB_MAX_INSTANCES -> ledger.markMaxInstances(jobId);
            case JOB_MODIFIED -> onModified(jobId);
            default -> throw new IllegalStateException("Don't know how to handle scheduler event '"
                    + event.kind() + "'. Expected one of " + HANDLED);
        };

        if (outcome.isEmpty()) {
            log.warn("Job '{}' no longer exists! Skipping logging of job execution...", jobId);
            return;
        }
        log.debug("Job '{}' {} -> execution {} is {}", jobId, event.kind(), outcome.get().id(), outcome.get().status());
    }

    private Optional<ExecutionRecord> onModified(String jobId) {
        Optional<Job> job = jobs.lookup(jobId);
        if (job.isEmpty()) {
            return Optional.empty();
        }
        return ledger.reschedule(jobId, job.get().nextRunTime());
    }
}
