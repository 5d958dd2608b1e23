package jobledger.jobstore.ledger;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Objects;

/**
 * One job lifecycle notification. {@code exception} and {@code traceback} are
 * only meaningful for {@link SchedulerEventKind#JOB_ERROR}. {@code occurredAt}
 * may be null, in which case the receiver stamps the event on delivery.
 */
public record SchedulerEvent(
        SchedulerEventKind kind,
        String jobId,
        String exception,
        String traceback,
        Instant occurredAt
) {
    public SchedulerEvent {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(jobId, "jobId is required");
    }

    public static SchedulerEvent of(SchedulerEventKind kind, String jobId) {
        return new SchedulerEvent(kind, jobId, null, null, null);
    }

    public static SchedulerEvent of(SchedulerEventKind kind, String jobId, Instant occurredAt) {
        return new SchedulerEvent(kind, jobId, null, null, occurredAt);
    }

    public static SchedulerEvent error(String jobId, Throwable error) {
        return new SchedulerEvent(SchedulerEventKind.JOB_ERROR, jobId,
                error != null ? error.toString() : null,
                error != null ? stackTraceOf(error) : null,
                null);
    }

    /** Build an event from the scheduler's numeric code. */
    public static SchedulerEvent fromCode(int code, String jobId, String exception, String traceback) {
        return new SchedulerEvent(SchedulerEventKind.fromCode(code), jobId, exception, traceback, null);
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
