package ai.storefront.translator.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An engine event. {@code jobId} is null only for {@link EventType#STARTED} and {@link EventType#STOPPED}.
 */
public record JobEvent(EventType type, Instant timestamp, String jobId, String itemId, Map<String, Object> attributes) {

    public static final String TOTAL = "total";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String PROGRESS = "progress";
    public static final String ERROR = "error";
    public static final String RETRY_COUNT = "retryCount";

    public JobEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static JobEvent started(Instant at) {
        return new JobEvent(EventType.STARTED, at, null, null, Map.of());
    }

    public static JobEvent stopped(Instant at) {
        return new JobEvent(EventType.STOPPED, at, null, null, Map.of());
    }

    public static JobEvent progress(Instant at, String jobId, int total, int completed, int failed, int progress) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TOTAL, total);
        attributes.put(COMPLETED, completed);
        attributes.put(FAILED, failed);
        attributes.put(PROGRESS, progress);
        return new JobEvent(EventType.PROGRESS, at, jobId, null, attributes);
    }

    public static JobEvent jobCompleted(Instant at, String jobId) {
        return new JobEvent(EventType.JOB_COMPLETED, at, jobId, null, Map.of());
    }

    public static JobEvent jobFailed(Instant at, String jobId, String error) {
        return new JobEvent(EventType.JOB_FAILED, at, jobId, null, errorAttribute(error));
    }

    public static JobEvent jobCancelled(Instant at, String jobId) {
        return new JobEvent(EventType.JOB_CANCELLED, at, jobId, null, Map.of());
    }

    public static JobEvent jobRetry(Instant at, String jobId) {
        return new JobEvent(EventType.JOB_RETRY, at, jobId, null, Map.of());
    }

    public static JobEvent itemCompleted(Instant at, String jobId, String itemId) {
        return new JobEvent(EventType.ITEM_COMPLETED, at, jobId, itemId, Map.of());
    }

    public static JobEvent itemCacheHit(Instant at, String jobId, String itemId) {
        return new JobEvent(EventType.ITEM_CACHE_HIT, at, jobId, itemId, Map.of());
    }

    public static JobEvent itemFailed(Instant at, String jobId, String itemId, String error) {
        return new JobEvent(EventType.ITEM_FAILED, at, jobId, itemId, errorAttribute(error));
    }

    public static JobEvent itemRetry(Instant at, String jobId, String itemId, int retryCount) {
        return new JobEvent(EventType.ITEM_RETRY, at, jobId, itemId, Map.of(RETRY_COUNT, retryCount));
    }

    public Optional<String> error() {
        return Optional.ofNullable(attributes.get(ERROR)).map(Object::toString);
    }

    public int intAttribute(String name) {
        Object value = attributes.get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalStateException("Event %s has no numeric attribute %s".formatted(type.wireName(), name));
    }

    private static Map<String, Object> errorAttribute(String error) {
        return Map.of(ERROR, error == null ? "unknown error" : error);
    }
}
