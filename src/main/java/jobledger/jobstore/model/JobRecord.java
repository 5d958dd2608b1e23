package jobledger.jobstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted job row. {@code state} is the serializer's opaque blob;
 * a null {@code nextRunTime} means the job is paused.
 */
public record JobRecord(
        String id,
        Instant nextRunTime,
        TriggerKind triggerKind,
        byte[] state
) {
    public JobRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(triggerKind, "triggerKind is required");
        Objects.requireNonNull(state, "state is required");
    }

    public boolean isPaused() {
        return nextRunTime == null;
    }

    @Override
    public String toString() {
        return id + " (" + (nextRunTime != null ? "next run at: " + nextRunTime : "paused") + ")";
    }
}
