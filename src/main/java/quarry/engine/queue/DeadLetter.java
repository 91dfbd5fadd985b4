package quarry.engine.queue;

import java.time.Instant;

/**
 * A message moved out of the queue after exceeding its redelivery budget.
 */
public record DeadLetter(QueueMessage message, int receiveCount, String reason, Instant deadAt) {
}
