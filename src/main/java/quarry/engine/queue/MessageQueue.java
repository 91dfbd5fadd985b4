package quarry.engine.queue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable at-least-once queue with leases.
 * A received message stays invisible until its lease expires or it is deleted.
 * Ordering is best-effort FIFO by visibility time.
 */
public interface MessageQueue {

    /**
     * Enqueue for immediate delivery.
     *
     * @return false if a message with the same id is already queued
     */
    default boolean enqueue(QueueMessage message) {
        return enqueueWithDelay(message, Duration.ZERO);
    }

    /**
     * Enqueue, visible after {@code delay}.
     *
     * @return false if a message with the same id is already queued
     */
    boolean enqueueWithDelay(QueueMessage message, Duration delay);

    /**
     * Enqueue, or if a message with the same id exists, reset it: new payload,
     * visible after {@code delay}, receive count cleared. An outstanding lease
     * on the old message is invalidated, so its holder can no longer delete it.
     */
    void enqueueOrRearm(QueueMessage message, Duration delay);

    /**
     * Lease the next visible message.
     *
     * @return the lease, or empty if nothing is visible
     */
    Optional<Lease> receive();

    /**
     * Acknowledge and remove a leased message.
     *
     * @return false if the lease is no longer valid
     */
    boolean delete(Lease lease);

    /**
     * Push the lease expiry to now + {@code duration}.
     *
     * @return false if the lease is no longer valid
     */
    boolean extend(Lease lease, Duration duration);

    /**
     * Give a leased message back, visible after {@code delay}. The receive count is kept.
     *
     * @return false if the lease is no longer valid
     */
    boolean release(Lease lease, Duration delay);

    /**
     * Replace the payload of a leased message and make it visible after {@code delay}.
     * The receive count is reset; this is a planned re-entry, not a failure.
     *
     * @return false if the lease is no longer valid
     */
    boolean requeue(Lease lease, Duration delay, Map<String, Object> payload);

    /**
     * Move a leased message to the dead-letter table.
     *
     * @return false if the lease is no longer valid
     */
    boolean deadLetter(Lease lease, String reason);

    Optional<QueueMessage> find(String messageId);

    int size();

    List<DeadLetter> listDeadLetters(int limit);

    int purgeDeadLetters();
}
