package jobledger.jobstore.service;

import jobledger.jobstore.model.Job;

import java.util.Objects;

/**
 * Argument checks shared by the job store backends.
 */
final class JobValidation {

    private JobValidation() {
    }

    static Job requireValid(Job job) {
        Objects.requireNonNull(job, "job is required");
        requireJobId(job.id());
        return job;
    }

    static String requireJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("Job id must not be blank");
        }
        return jobId;
    }
}
