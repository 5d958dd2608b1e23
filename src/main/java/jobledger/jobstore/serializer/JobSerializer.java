package jobledger.jobstore.serializer;

import jobledger.jobstore.model.Job;

/**
 * Converts jobs to and from the opaque blob kept in {@code job_records.job_state}.
 * A blob must carry everything needed to rebuild the job without consulting
 * any other record.
 */
public interface JobSerializer {

    /**
     * Encode a job.
     *
     * @param job the job
     * @return the blob
     * @throws IllegalArgumentException if the job holds values the format cannot represent
     */
    byte[] encode(Job job);

    /**
     * Rebuild a job from a blob. Has no side effects besides building the object.
     *
     * @param state the blob
     * @return the job
     * @throws JobDecodeException if the blob cannot be turned back into a job
     */
    Job decode(byte[] state) throws JobDecodeException;
}
