package quarry.engine.queue;

import quarry.engine.model.JobTypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A queue message. The id is chosen by the producer so that enqueueing the
 * same logical message twice is a no-op.
 *
 * @param id      message id, unique while the message is queued
 * @param type    handler type used for dispatch
 * @param jobId   job whose lifecycle the worker pool drives, or null
 * @param payload handler-specific data, serialized as JSON
 */
public record QueueMessage(String id, String type, String jobId, Map<String, Object> payload) {

    public QueueMessage {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /** The message that runs job {@code jobId} with the handler for {@code type} */
    public static QueueMessage forJob(String type, String jobId) {
        return forJob(type, jobId, Map.of());
    }

    public static QueueMessage forJob(String type, String jobId, Map<String, Object> payload) {
        return new QueueMessage(jobIdMessage(jobId), type, jobId, payload);
    }

    /** The completion probe for a fanned-out parent; one per parent */
    public static QueueMessage probe(String parentId) {
        return new QueueMessage("probe:" + parentId, JobTypes.COMPLETION_PROBE, null, Map.of("parent_id", parentId));
    }

    public static String jobIdMessage(String jobId) {
        return "job:" + jobId;
    }

    public QueueMessage withPayload(Map<String, Object> newPayload) {
        return new QueueMessage(id, type, jobId, newPayload);
    }

    /** Copy of the payload with one entry replaced */
    public Map<String, Object> payloadWith(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        copy.put(key, value);
        return copy;
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    public long payloadLong(String key, long defaultValue) {
        Object value = payload.get(key);
        if (value instanceof Number n) {
            return n.longValue();
        }
        return defaultValue;
    }
}
