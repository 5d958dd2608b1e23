package jobledger.jobstore.serializer;

import jobledger.jobstore.model.TriggerKind;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of a job. New fields must be optional so that older blobs
 * keep decoding.
 */
record StoredJob(
        int format,
        String id,
        String name,
        String target,
        List<Object> args,
        Map<String, Object> kwargs,
        StoredTrigger trigger,
        String nextRunTime,         // ISO-8601 instant, null = paused
        Long misfireGraceMillis,
        Boolean coalesce,
        Integer maxInstances
) {
    record StoredTrigger(TriggerKind kind, Map<String, String> fields) {}
}
