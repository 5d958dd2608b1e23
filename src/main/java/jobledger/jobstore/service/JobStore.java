package jobledger.jobstore.service;

import jobledger.jobstore.exception.ConflictingIdException;
import jobledger.jobstore.exception.JobNotFoundException;
import jobledger.jobstore.ledger.SchedulerEventListener;
import jobledger.jobstore.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The job store contract used by the scheduler.
 * Implementations are safe to call from any scheduler thread.
 */
public interface JobStore {

    /**
     * Persist a new job.
     *
     * @throws ConflictingIdException if a job with the same id is stored
     */
    void addJob(Job job);

    /**
     * Replace a stored job (next run time and state).
     *
     * @throws JobNotFoundException if no job with that id is stored
     */
    void updateJob(Job job);

    /**
     * Remove a job and its execution records.
     *
     * @throws JobNotFoundException if no job with that id is stored
     */
    void removeJob(String jobId);

    /**
     * Remove every job and their execution records.
     */
    void removeAllJobs();

    /**
     * @return the job, or empty if it is not stored
     */
    Optional<Job> lookupJob(String jobId);

    /**
     * @return jobs with a next run time at or before {@code now}, earliest first
     */
    List<Job> getDueJobs(Instant now);

    /**
     * @return the earliest next run time of any job, empty if none is scheduled
     */
    Optional<Instant> getNextRunTime();

    /**
     * @return all jobs, earliest next run time first and paused jobs last
     */
    List<Job> getAllJobs();

    /**
     * The sink the scheduler delivers job lifecycle events to.
     */
    SchedulerEventListener eventListener();

    /**
     * Release resources held by the store. Further calls fail with
     * {@link IllegalStateException}.
     */
    void shutdown();
}
