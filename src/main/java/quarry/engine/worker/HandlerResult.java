package quarry.engine.worker;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * What the worker pool should do with a message after its handler returned.
 */
public final class HandlerResult {

    public enum Kind {
        /** Complete the message's job, then delete the message */
        COMPLETE,
        /** Delete the message only; the handler already settled the job */
        ACK,
        /** Put the message back with a new payload, visible after a delay */
        RETRY
    }

    private static final HandlerResult COMPLETE = new HandlerResult(Kind.COMPLETE, Duration.ZERO, null);
    private static final HandlerResult ACK = new HandlerResult(Kind.ACK, Duration.ZERO, null);

    private final Kind kind;
    private final Duration delay;
    private final Map<String, Object> payload;

    private HandlerResult(Kind kind, Duration delay, Map<String, Object> payload) {
        this.kind = kind;
        this.delay = delay;
        this.payload = payload;
    }

    public static HandlerResult complete() {
        return COMPLETE;
    }

    public static HandlerResult ack() {
        return ACK;
    }

    /**
     * Re-run the same message later. The job stays RUNNING; this is a planned
     * re-entry and does not count against the redelivery budget.
     */
    public static HandlerResult retryAfter(Duration delay, Map<String, Object> payload) {
        Objects.requireNonNull(delay, "delay is required");
        return new HandlerResult(Kind.RETRY, delay, payload);
    }

    public Kind kind() {
        return kind;
    }

    public Duration delay() {
        return delay;
    }

    /** Payload for RETRY; null keeps the current one */
    public Map<String, Object> payload() {
        return payload;
    }

    @Override
    public String toString() {
        return kind == Kind.RETRY ? "RETRY(" + delay.toMillis() + "ms)" : kind.name();
    }
}
