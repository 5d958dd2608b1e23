package jobledger.jobstore.ledger;

import jobledger.jobstore.model.Job;

import java.util.Optional;

/**
 * Read access to the jobs the events refer to.
 */
@FunctionalInterface
public interface JobLookup {

    Optional<Job> lookup(String jobId);
}
