package jobledger.jobstore.serializer;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jobledger.jobstore.model.Job;
import jobledger.jobstore.model.TriggerSpec;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Job serializer writing a versioned JSON document with Jackson.
 * Unknown properties are ignored and absent optional ones take their defaults,
 * so blobs written before an additive change still decode.
 *
 * <p>Job arguments keep their Java type: every argument value that is not a
 * string, boolean, int or double is written as {@code ["java.lang.Long", 5]}.
 * Arguments are limited to {@link #VALUE_TYPES} and lists and string-keyed maps
 * of them; anything else is rejected on encode, and on decode a type outside
 * that set makes the blob undecodable.
 */
public class JsonJobSerializer implements JobSerializer {

    /** Format version written by this serializer */
    public static final int FORMAT_VERSION = 1;

    /** Scalar argument types that survive a round trip */
    public static final Set<Class<?>> VALUE_TYPES = Set.of(
            String.class, Boolean.class,
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            BigInteger.class, BigDecimal.class, UUID.class,
            Instant.class, LocalDate.class, LocalDateTime.class, LocalTime.class, Duration.class);

    private final ObjectMapper mapper;

    public JsonJobSerializer() {
        this(new ObjectMapper());
    }

    public JsonJobSerializer(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .activateDefaultTyping(argumentTypes(), ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT,
                        JsonTypeInfo.As.WRAPPER_ARRAY);
    }

    private static PolymorphicTypeValidator argumentTypes() {
        BasicPolymorphicTypeValidator.Builder builder = BasicPolymorphicTypeValidator.builder()
                .allowIfSubType(ArrayList.class)
                .allowIfSubType(LinkedHashMap.class);
        for (Class<?> type : VALUE_TYPES) {
            builder.allowIfSubType(type);
        }
        return builder.build();
    }

    @Override
    public byte[] encode(Job job) {
        List<Object> args = new ArrayList<>(job.args().size());
        for (Object arg : job.args()) {
            args.add(storable(job.id(), arg));
        }
        Map<String, Object> kwargs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> kwarg : job.kwargs().entrySet()) {
            kwargs.put(kwarg.getKey(), storable(job.id(), kwarg.getValue()));
        }

        StoredJob stored = new StoredJob(
                FORMAT_VERSION,
                job.id(),
                job.name(),
                job.target(),
                args,
                kwargs,
                new StoredJob.StoredTrigger(job.trigger().kind(), job.trigger().fields()),
                job.nextRunTime() != null ? job.nextRunTime().toString() : null,
                job.misfireGraceTime() != null ? job.misfireGraceTime().toMillis() : null,
                job.coalesce(),
                job.maxInstances());
        try {
            return mapper.writeValueAsBytes(stored);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job '" + job.id() + "' cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Job decode(byte[] state) throws JobDecodeException {
        if (state == null || state.length == 0) {
            throw new JobDecodeException("Job state is empty");
        }

        StoredJob stored;
        try {
            stored = mapper.readValue(state, StoredJob.class);
        } catch (IOException e) {
            throw new JobDecodeException("Job state is not a readable job document", e);
        }

        if (stored.format() > FORMAT_VERSION) {
            throw new JobDecodeException("Job state format " + stored.format()
                    + " is newer than supported format " + FORMAT_VERSION);
        }
        if (stored.trigger() == null || stored.trigger().kind() == null) {
            throw new JobDecodeException("Job state of '" + stored.id() + "' has no trigger");
        }

        try {
            return Job.builder()
                    .id(stored.id())
                    .name(stored.name())
                    .target(stored.target())
                    .args(stored.args())
                    .kwargs(stored.kwargs())
                    .trigger(new TriggerSpec(stored.trigger().kind(), stored.trigger().fields()))
                    .nextRunTime(stored.nextRunTime() != null ? Instant.parse(stored.nextRunTime()) : null)
                    .misfireGraceTime(stored.misfireGraceMillis() != null
                            ? Duration.ofMillis(stored.misfireGraceMillis())
                            : null)
                    .coalesce(stored.coalesce() == null || stored.coalesce())
                    .maxInstances(stored.maxInstances() != null ? stored.maxInstances() : 1)
                    .build();
        } catch (RuntimeException e) {
            // missing required fields or malformed values
            throw new JobDecodeException("Job state of '" + stored.id() + "' is incomplete: " + e.getMessage(), e);
        }
    }

    /**
     * Copy an argument into the containers the decoder produces, rejecting
     * values whose type would not come back.
     */
    private static Object storable(String jobId, Object value) {
        if (value == null || VALUE_TYPES.contains(value.getClass())) {
            return value;
        }
        if (value instanceof List<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(storable(jobId, item));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> entries) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Job '" + jobId + "' has an argument map with non-string key "
                            + entry.getKey());
                }
                copy.put(key, storable(jobId, entry.getValue()));
            }
            return copy;
        }
        throw new IllegalArgumentException("Job '" + jobId + "' has an argument of unsupported type "
                + value.getClass().getName());
    }

    @Override
    public String toString() {
        return "JsonJobSerializer(format=" + FORMAT_VERSION + ")";
    }
}
