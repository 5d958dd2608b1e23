package jobledger.jobstore.model;

import java.util.Map;
import java.util.Objects;

/**
 * Trigger configuration as handed over by the scheduler. The store keeps the
 * fields verbatim and only reads {@link #kind()}.
 */
public record TriggerSpec(TriggerKind kind, Map<String, String> fields) {

    public TriggerSpec {
        Objects.requireNonNull(kind, "kind is required");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static TriggerSpec date(String runDate) {
        return new TriggerSpec(TriggerKind.DATE, Map.of("run_date", runDate));
    }

    public static TriggerSpec cron(String expression) {
        return new TriggerSpec(TriggerKind.CRON, Map.of("expression", expression));
    }

    public static TriggerSpec interval(long seconds) {
        return new TriggerSpec(TriggerKind.INTERVAL, Map.of("seconds", Long.toString(seconds)));
    }
}
