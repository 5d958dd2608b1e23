package jobledger.jobstore.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable scheduler job: what to invoke, with which arguments, and when it
 * runs next. Everything here is captured by the job serializer.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String target; // e.g. "com.acme.Reports#nightly"
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final TriggerSpec trigger;
    private final Instant nextRunTime; // null = paused
    private final Duration misfireGraceTime;
    private final boolean coalesce;
    private final int maxInstances;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.trigger = Objects.requireNonNull(builder.trigger, "trigger is required");
        this.name = builder.name != null ? builder.name : builder.target;
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        this.nextRunTime = builder.nextRunTime;
        this.misfireGraceTime = builder.misfireGraceTime;
        this.coalesce = builder.coalesce;
        if (builder.maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be at least 1");
        }
        this.maxInstances = builder.maxInstances;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String target() {
        return target;
    }

    public List<Object> args() {
        return args;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    public TriggerSpec trigger() {
        return trigger;
    }

    public TriggerKind triggerKind() {
        return trigger.kind();
    }

    public Instant nextRunTime() {
        return nextRunTime;
    }

    public Duration misfireGraceTime() {
        return misfireGraceTime;
    }

    public boolean coalesce() {
        return coalesce;
    }

    public int maxInstances() {
        return maxInstances;
    }

    /** A paused job has no next run time */
    public boolean isPaused() {
        return nextRunTime == null;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .target(target)
                .args(args)
                .kwargs(kwargs)
                .trigger(trigger)
                .nextRunTime(nextRunTime)
                .misfireGraceTime(misfireGraceTime)
                .coalesce(coalesce)
                .maxInstances(maxInstances);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String target;
        private List<Object> args = List.of();
        private Map<String, Object> kwargs = Map.of();
        private TriggerSpec trigger;
        private Instant nextRunTime;
        private Duration misfireGraceTime;
        private boolean coalesce = true;
        private int maxInstances = 1;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder args(List<Object> args) {
            this.args = args != null ? args : List.of();
            return this;
        }

        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs != null ? kwargs : Map.of();
            return this;
        }

        public Builder trigger(TriggerSpec trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder nextRunTime(Instant nextRunTime) {
            this.nextRunTime = nextRunTime;
            return this;
        }

        public Builder misfireGraceTime(Duration misfireGraceTime) {
            this.misfireGraceTime = misfireGraceTime;
            return this;
        }

        public Builder coalesce(boolean coalesce) {
            this.coalesce = coalesce;
            return this;
        }

        public Builder maxInstances(int maxInstances) {
            this.maxInstances = maxInstances;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return coalesce == job.coalesce
                && maxInstances == job.maxInstances
                && id.equals(job.id)
                && name.equals(job.name)
                && target.equals(job.target)
                && args.equals(job.args)
                && kwargs.equals(job.kwargs)
                && trigger.equals(job.trigger)
                && Objects.equals(nextRunTime, job.nextRunTime)
                && Objects.equals(misfireGraceTime, job.misfireGraceTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, target, trigger, nextRunTime);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', trigger=" + trigger.kind()
                + ", next=" + (nextRunTime != null ? nextRunTime : "paused") + "}";
    }
}
