package quarry.engine.queue;

import java.time.Instant;

/**
 * Exclusive, time-bounded ownership of a received message.
 * Operations with a stale token (lease expired and re-received, or the
 * message was rearmed) are no-ops.
 *
 * @param message      the leased message
 * @param token        lease token
 * @param receiveCount deliveries so far, including this one
 * @param expiresAt    when the message becomes visible again
 */
public record Lease(QueueMessage message, String token, int receiveCount, Instant expiresAt) {

    public String messageId() {
        return message.id();
    }
}
