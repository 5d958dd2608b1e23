package jobledger.jobstore.service;

import jobledger.jobstore.exception.ConflictingIdException;
import jobledger.jobstore.exception.JobNotFoundException;
import jobledger.jobstore.ledger.EventBridge;
import jobledger.jobstore.ledger.ExecutionLedger;
import jobledger.jobstore.ledger.SchedulerEventListener;
import jobledger.jobstore.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static jobledger.jobstore.service.JobValidation.requireJobId;
import static jobledger.jobstore.service.JobValidation.requireValid;

/**
 * Job store holding jobs in process memory. Jobs are lost on restart, but their
 * execution records still go to the relational ledger, which is cleaned up when
 * jobs are removed.
 */
public class MemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryJobStore.class);

    /** Earliest next run time first, paused jobs last, then by id */
    static final Comparator<Job> RUN_ORDER = Comparator
            .comparing(Job::nextRunTime, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(Job::id);

    private final Map<String, Job> jobs = new HashMap<>();
    private final List<Job> ordered = new ArrayList<>(); // sorted by RUN_ORDER
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutionLedger ledger;
    private final EventBridge eventBridge;
    private volatile boolean shutdown = false;

    public MemoryJobStore(ExecutionLedger ledger) {
        this.ledger = ledger;
        this.eventBridge = new EventBridge(ledger, this::lookupJob);
    }

    @Override
    public void addJob(Job job) {
        ensureOpen();
        requireValid(job);

        lock.writeLock().lock();
        try {
            if (jobs.containsKey(job.id())) {
                throw new ConflictingIdException(job.id());
            }
            jobs.put(job.id(), job);
            insertOrdered(job);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Added job {}", job);
    }

    @Override
    public void updateJob(Job job) {
        ensureOpen();
        requireValid(job);

        lock.writeLock().lock();
        try {
            Job old = jobs.get(job.id());
            if (old == null) {
                throw new JobNotFoundException(job.id());
            }
            ordered.remove(indexOf(old));
            jobs.put(job.id(), job);
            insertOrdered(job);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Updated job {}", job.id());
    }

    @Override
    public void removeJob(String jobId) {
        ensureOpen();
        requireJobId(jobId);

        lock.writeLock().lock();
        try {
            Job old = jobs.remove(jobId);
            if (old == null) {
                throw new JobNotFoundException(jobId);
            }
            ordered.remove(indexOf(old));
        } finally {
            lock.writeLock().unlock();
        }
        ledger.forget(List.of(jobId));
        log.info("Removed job {}", jobId);
    }

    @Override
    public void removeAllJobs() {
        ensureOpen();

        List<String> removed;
        lock.writeLock().lock();
        try {
            removed = new ArrayList<>(jobs.keySet());
            jobs.clear();
            ordered.clear();
        } finally {
            lock.writeLock().unlock();
        }
        ledger.forget(removed);
        log.info("Removed all jobs ({})", removed.size());
    }

    @Override
    public Optional<Job> lookupJob(String jobId) {
        ensureOpen();
        requireJobId(jobId);

        lock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(jobId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Job> getDueJobs(Instant now) {
        ensureOpen();

        lock.readLock().lock();
        try {
            List<Job> due = new ArrayList<>();
            for (Job job : ordered) {
                if (job.nextRunTime() == null || job.nextRunTime().isAfter(now)) {
                    break;
                }
                due.add(job);
            }
            return due;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Instant> getNextRunTime() {
        ensureOpen();

        lock.readLock().lock();
        try {
            return ordered.isEmpty() ? Optional.empty() : Optional.ofNullable(ordered.get(0).nextRunTime());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Job> getAllJobs() {
        ensureOpen();

        lock.readLock().lock();
        try {
            return new ArrayList<>(ordered);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public SchedulerEventListener eventListener() {
        return eventBridge;
    }

    @Override
    public void shutdown() {
        if (!shutdown) {
            shutdown = true;
            log.info("Memory job store shut down");
        }
    }

    // --- Helpers ---

    private void insertOrdered(Job job) {
        int index = Collections.binarySearch(ordered, job, RUN_ORDER);
        ordered.add(index < 0 ? -(index + 1) : index, job);
    }

    private int indexOf(Job job) {
        int index = Collections.binarySearch(ordered, job, RUN_ORDER);
        if (index < 0) {
            throw new IllegalStateException("Job " + job.id() + " missing from run order");
        }
        return index;
    }

    private void ensureOpen() {
        if (shutdown) {
            throw new IllegalStateException("Job store is shut down");
        }
    }

    @Override
    public String toString() {
        return "MemoryJobStore(jobs=" + jobs.size() + ")";
    }
}
