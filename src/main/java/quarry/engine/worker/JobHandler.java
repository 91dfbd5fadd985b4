package quarry.engine.worker;

import quarry.engine.model.JobExecutionException;
import quarry.engine.queue.QueueMessage;

import java.time.Duration;

/**
 * Executes messages of one type.
 *
 * Handlers must be safe to run more than once for the same message: delivery
 * is at-least-once, and a lease can expire while a slow handler is still running.
 */
public interface JobHandler {

    /** Message type this handler serves */
    String type();

    /**
     * Run the message. Throw a retryable {@link JobExecutionException} to have
     * the message redelivered after a backoff, a terminal one to fail the job.
     */
    HandlerResult handle(JobContext context) throws JobExecutionException;

    /**
     * Upper bound for one {@link #handle} call; null uses the engine default.
     */
    default Duration timeout() {
        return null;
    }

    /**
     * Called after the message exhausted its redeliveries and was dead-lettered.
     * The message's own job, if any, has already been failed.
     */
    default void onDeadLetter(QueueMessage message, String reason) {
    }
}
