package jobledger.jobstore.service;

import jobledger.jobstore.exception.ConflictingIdException;
import jobledger.jobstore.exception.JobNotFoundException;
import jobledger.jobstore.ledger.EventBridge;
import jobledger.jobstore.ledger.ExecutionLedger;
import jobledger.jobstore.ledger.SchedulerEventListener;
import jobledger.jobstore.model.Job;
import jobledger.jobstore.model.JobRecord;
import jobledger.jobstore.repository.JobRecordRepository;
import jobledger.jobstore.serializer.JobDecodeException;
import jobledger.jobstore.serializer.JobSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static jobledger.jobstore.service.JobValidation.requireJobId;
import static jobledger.jobstore.service.JobValidation.requireValid;

/**
 * Job store keeping jobs as serialized rows in a relational database.
 *
 * <p>Reads that restore jobs ({@link #lookupJob}, {@link #getDueJobs},
 * {@link #getAllJobs}) <b>delete</b> every row whose state cannot be decoded, so
 * one corrupt row never blocks the scheduler. The failure is logged with the job
 * id and the row is left out of the result.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private final JobRecordRepository jobRecordRepository;
    private final JobSerializer serializer;
    private final EventBridge eventBridge;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public JdbcJobStore(JobRecordRepository jobRecordRepository, JobSerializer serializer, ExecutionLedger ledger) {
        this.jobRecordRepository = jobRecordRepository;
        this.serializer = serializer;
        this.eventBridge = new EventBridge(ledger, this::lookupJob);
    }

    @Override
    public void addJob(Job job) {
        ensureOpen();
        requireValid(job);

        JobRecord record = toRecord(job);
        if (!jobRecordRepository.insert(record)) {
            throw new ConflictingIdException(job.id());
        }
        log.info("Added job {}", record);
    }

    @Override
    public void updateJob(Job job) {
        ensureOpen();
        requireValid(job);

        if (!jobRecordRepository.update(toRecord(job))) {
            throw new JobNotFoundException(job.id());
        }
        log.debug("Updated job {}", job.id());
    }

    @Override
    public void removeJob(String jobId) {
        ensureOpen();
        requireJobId(jobId);

        if (!jobRecordRepository.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Removed job {}", jobId);
    }

    @Override
    public void removeAllJobs() {
        ensureOpen();
        int removed = jobRecordRepository.deleteAll();
        log.info("Removed all jobs ({})", removed);
    }

    /**
     * Quarantines the row (deletes it) if its state cannot be decoded.
     */
    @Override
    public Optional<Job> lookupJob(String jobId) {
        ensureOpen();
        requireJobId(jobId);

        return jobRecordRepository.findById(jobId)
                .flatMap(record -> restore(List.of(record)).stream().findFirst());
    }

    /**
     * Quarantines (deletes) every due row whose state cannot be decoded.
     */
    @Override
    public List<Job> getDueJobs(Instant now) {
        ensureOpen();
        return restore(jobRecordRepository.findDue(now));
    }

    @Override
    public Optional<Instant> getNextRunTime() {
        ensureOpen();
        return jobRecordRepository.findEarliestNextRunTime();
    }

    /**
     * Quarantines (deletes) every row whose state cannot be decoded.
     */
    @Override
    public List<Job> getAllJobs() {
        ensureOpen();
        return restore(jobRecordRepository.findAll());
    }

    @Override
    public SchedulerEventListener eventListener() {
        return eventBridge;
    }

    /**
     * The connection pool belongs to the host and is closed by it.
     */
    @Override
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("Job store shut down");
        }
    }

    // --- Helpers ---

    private JobRecord toRecord(Job job) {
        return new JobRecord(job.id(), job.nextRunTime(), job.triggerKind(), serializer.encode(job));
    }

    private List<Job> restore(List<JobRecord> records) {
        List<Job> jobs = new ArrayList<>(records.size());
        Set<String> failedJobIds = new LinkedHashSet<>();

        for (JobRecord record : records) {
            try {
                jobs.add(decode(record));
            } catch (JobDecodeException e) {
                log.error("Unable to restore job '{}'. Removing it...", record.id(), e);
                failedJobIds.add(record.id());
            }
        }

        if (!failedJobIds.isEmpty()) {
            log.warn("Removing failed jobs: {}", failedJobIds);
            jobRecordRepository.deleteByIds(failedJobIds);
        }

        return jobs;
    }

    private Job decode(JobRecord record) throws JobDecodeException {
        Job job = serializer.decode(record.state());
        if (!record.id().equals(job.id())) {
            throw new JobDecodeException("Stored state belongs to job '" + job.id() + "'");
        }
        return job;
    }

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new IllegalStateException("Job store is shut down");
        }
    }

    @Override
    public String toString() {
        return "JdbcJobStore(serializer=" + serializer + ")";
    }
}
