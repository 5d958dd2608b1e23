package jobledger.jobstore.ledger;

import jobledger.jobstore.model.ExecutionRecord;
import jobledger.jobstore.model.ExecutionStatus;
import jobledger.jobstore.model.TriggerKind;
import jobledger.jobstore.repository.ExecutionRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Status transitions of a job's open execution record.
 * Every {@code mark...} method returns empty when the job has no record, so
 * callers can tell "applied" from "nothing to update".
 */
public class ExecutionLedger {

    private final ExecutionRepository executionRepository;
    private final Clock clock;

    public ExecutionLedger(ExecutionRepository executionRepository) {
        this(executionRepository, Clock.systemUTC());
    }

    public ExecutionLedger(ExecutionRepository executionRepository, Clock clock) {
        this.executionRepository = executionRepository;
        this.clock = clock;
    }

    /**
     * Open a fresh window for a job: create its record, or reset the existing one
     * to ADDED and clear any earlier outcome.
     *
     * @param at when the job was added; the current time when null
     */
    public ExecutionRecord recordAdded(String jobId, TriggerKind triggerKind, Instant at) {
        return executionRepository.upsertLatest(ExecutionRecord.builder()
                .jobId(jobId)
                .status(ExecutionStatus.ADDED)
                .runTime(orNow(at))
                .triggerKind(triggerKind)
                .build());
    }

    public Optional<ExecutionRecord> markStarted(String jobId) {
        return executionRepository.updateLatest(jobId, current -> current.toBuilder()
                .status(ExecutionStatus.STARTED)
                .build());
    }

    /**
     * @param at when the run finished; the current time when null
     */
    public Optional<ExecutionRecord> markSucceeded(String jobId, Instant at) {
        Instant finished = orNow(at);
        return executionRepository.updateLatest(jobId, current -> current.toBuilder()
                .status(ExecutionStatus.SUCCEEDED)
                .finished(finished)
                .build());
    }

    /**
     * @param exception summary of the error; a generic message is stored when null
     * @param traceback detail trace, may be null
     */
    public Optional<ExecutionRecord> markError(String jobId, String exception, String traceback) {
        String message = exception != null ? exception : "Job '" + jobId + "' raised an error!";
        return executionRepository.updateLatest(jobId, current -> current.toBuilder()
                .status(ExecutionStatus.ERROR)
                .exception(message)
                .traceback(traceback)
                .build());
    }

    public Optional<ExecutionRecord> markMissed(String jobId) {
        return executionRepository.updateLatest(jobId, current -> current.toBuilder()
                .status(ExecutionStatus.MISSED)
                .exception("Run time of job '" + jobId + "' was missed!")
                .build());
    }

    public Optional<ExecutionRecord> markMaxInstances(String jobId) {
        return executionRepository.updateLatest(jobId, current -> current.toBuilder()
                .status(ExecutionStatus.MAX_INSTANCES)
                .exception("Job '" + jobId + "' reached its maximum number of running instances!")
                .build());
    }

    /**
     * Move the record's run time to the job's new next run time. A null run time
     * (paused job) keeps the current one.
     */
    public Optional<ExecutionRecord> reschedule(String jobId, Instant nextRunTime) {
        return executionRepository.updateLatest(jobId, current -> nextRunTime == null
                ? current
                : current.toBuilder().runTime(nextRunTime).build());
    }

    public Optional<ExecutionRecord> latest(String jobId) {
        return executionRepository.findLatestByJobId(jobId);
    }

    /** Drop the records of removed jobs. */
    public int forget(Collection<String> jobIds) {
        return executionRepository.deleteByJobIds(jobIds);
    }

    private Instant orNow(Instant at) {
        return at != null ? at : clock.instant();
    }
}
