package quarry.engine.model;

import java.time.Instant;

/**
 * A persisted log line attached to a job.
 */
public record JobLogEntry(long id, String jobId, Level level, String message, Instant createdAt) {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }
}
