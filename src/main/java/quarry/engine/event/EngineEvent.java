package quarry.engine.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification about a job. Used for UI/log fan-out only, never for control flow.
 */
public record EngineEvent(Type type, String jobId, Map<String, Object> data, Instant at) {

    public enum Type {
        JOB_CREATED,
        JOB_STATUS_CHANGED,
        JOB_PROGRESS,
        STEP_COMPLETED,
        JOB_COMPLETED,
        JOB_DELETED,
        NOTIFICATION
    }

    public static EngineEvent of(Type type, String jobId, Map<String, Object> data) {
        return new EngineEvent(type, jobId, data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of(), Instant.now());
    }
}
