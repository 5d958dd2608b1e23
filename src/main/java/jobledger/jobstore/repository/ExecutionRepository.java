package jobledger.jobstore.repository;

import jobledger.jobstore.model.ExecutionRecord;

import java.util.Collection;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository interface for execution records.
 */
public interface ExecutionRepository {

    /**
     * Most recent execution record of a job.
     *
     * @param jobId the job ID
     * @return the record if any
     */
    Optional<ExecutionRecord> findLatestByJobId(String jobId);

    /**
     * Reset the latest record of {@code fresh.jobId()} to the values of
     * {@code fresh}, or insert {@code fresh} when the job has none yet.
     * Runs in one transaction.
     *
     * @param fresh the new record values
     * @return the stored record
     */
    ExecutionRecord upsertLatest(ExecutionRecord fresh);

    /**
     * Lock the latest record of a job, apply {@code change} and write the result,
     * all in one transaction.
     *
     * @param jobId  the job ID
     * @param change transformation of the current record
     * @return the updated record, empty if the job has no record
     */
    Optional<ExecutionRecord> updateLatest(String jobId, UnaryOperator<ExecutionRecord> change);

    /**
     * Delete all execution records of the given jobs.
     *
     * @param jobIds job IDs
     * @return number of rows deleted
     */
    int deleteByJobIds(Collection<String> jobIds);

    /**
     * Count execution records of a job.
     *
     * @param jobId the job ID
     * @return number of rows
     */
    int countByJobId(String jobId);
}
