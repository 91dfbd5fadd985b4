package quarry.engine.scheduler;

import quarry.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background maintenance on a single daemon thread:
 * - RetentionReaper: deletes finished job trees past the retention age
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final RetentionReaper retentionReaper;
    private final EngineConfig config;

    private volatile boolean running = false;

    public Scheduler(RetentionReaper retentionReaper, EngineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "quarry-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.retentionReaper = retentionReaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.retentionInterval().toMillis();
        executor.scheduleAtFixedRate(
                retentionReaper,
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Retention reaper scheduled every {}ms (age {})", intervalMs, config.retentionAge());
    }

    /**
     * Stop the scheduler. A sweep in progress gets the configured shutdown timeout to finish.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();

        Duration grace = config.shutdownTimeout();
        try {
            if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Scheduler stopped");
                return;
            }
            log.warn("Retention sweep still running after {}ms; interrupting", grace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public RetentionReaper retentionReaper() {
        return retentionReaper;
    }
}
