package jobledger.jobstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The open execution record of a job: what happened to its current run.
 * There is at most one per job id; a new ADDED event resets it.
 */
public final class ExecutionRecord {
    private final Long id; // null until persisted
    private final String jobId;
    private final ExecutionStatus status;
    private final Instant runTime;
    private final TriggerKind triggerKind;
    private final Instant finished;
    private final String exception;
    private final String traceback;
    private final Instant createdAt;
    private final Instant updatedAt;

    private ExecutionRecord(Builder builder) {
        this.id = builder.id;
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.runTime = Objects.requireNonNull(builder.runTime, "runTime is required");
        this.triggerKind = Objects.requireNonNull(builder.triggerKind, "triggerKind is required");
        this.finished = builder.finished;
        this.exception = builder.exception;
        this.traceback = builder.traceback;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public Long id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public ExecutionStatus status() {
        return status;
    }

    public Instant runTime() {
        return runTime;
    }

    public TriggerKind triggerKind() {
        return triggerKind;
    }

    public Instant finished() {
        return finished;
    }

    public String exception() {
        return exception;
    }

    public String traceback() {
        return traceback;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .status(status)
                .runTime(runTime)
                .triggerKind(triggerKind)
                .finished(finished)
                .exception(exception)
                .traceback(traceback)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private String jobId;
        private ExecutionStatus status = ExecutionStatus.ADDED;
        private Instant runTime;
        private TriggerKind triggerKind;
        private Instant finished;
        private String exception;
        private String traceback;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder runTime(Instant runTime) {
            this.runTime = runTime;
            return this;
        }

        public Builder triggerKind(TriggerKind triggerKind) {
            this.triggerKind = triggerKind;
            return this;
        }

        public Builder finished(Instant finished) {
            this.finished = finished;
            return this;
        }

        public Builder exception(String exception) {
            this.exception = exception;
            return this;
        }

        public Builder traceback(String traceback) {
            this.traceback = traceback;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ExecutionRecord build() {
            return new ExecutionRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExecutionRecord that))
            return false;
        return Objects.equals(id, that.id) && jobId.equals(that.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, jobId);
    }

    @Override
    public String toString() {
        return "ExecutionRecord{id=" + id + ", job='" + jobId + "', status=" + status + ", runTime=" + runTime + "}";
    }
}
