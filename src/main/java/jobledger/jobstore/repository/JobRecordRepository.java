package jobledger.jobstore.repository;

import jobledger.jobstore.model.JobRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for job record persistence.
 * Mutations report "not applied" through their return value; callers decide
 * which error that maps to.
 */
public interface JobRecordRepository {

    /**
     * Find a job record by ID.
     *
     * @param jobId the job ID
     * @return the record if found
     */
    Optional<JobRecord> findById(String jobId);

    /**
     * Find records due to run: {@code next_run_time <= now}, earliest first.
     * Records sharing a run time come back ordered by id.
     *
     * @param now the cut-off instant (inclusive)
     * @return due records
     */
    List<JobRecord> findDue(Instant now);

    /**
     * Earliest next run time across all scheduled (non-paused) records.
     *
     * @return the minimum next run time, empty when nothing is scheduled
     */
    Optional<Instant> findEarliestNextRunTime();

    /**
     * All records ordered by next run time, with paused records last.
     *
     * @return list of all records
     */
    List<JobRecord> findAll();

    /**
     * Insert a new record.
     *
     * @param record the record to insert
     * @return false if a record with the same id already exists
     */
    boolean insert(JobRecord record);

    /**
     * Replace the next run time, trigger kind and state of an existing record.
     *
     * @param record the new values
     * @return false if no record with that id exists
     */
    boolean update(JobRecord record);

    /**
     * Delete a record and its execution records in one transaction.
     *
     * @param jobId the job ID
     * @return false if no record with that id exists
     */
    boolean delete(String jobId);

    /**
     * Delete the given records and their execution records in one transaction.
     * Unknown ids are ignored.
     *
     * @param jobIds job IDs to delete
     * @return number of job records deleted
     */
    int deleteByIds(Collection<String> jobIds);

    /**
     * Delete every record and the execution records belonging to them.
     *
     * @return number of job records deleted
     */
    int deleteAll();
}
