package quarry.engine.worker;

import quarry.engine.config.EngineConfig;
import quarry.engine.model.ErrorKind;
import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobLogEntry;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.queue.Lease;
import quarry.engine.queue.MessageQueue;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobService;
import quarry.engine.util.Errors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of pollers that lease messages and run them through their handlers.
 *
 * Per delivery: resolve the handler, dead-letter if the redelivery budget is
 * spent, load the job and skip it if finished or cancelled, start it if
 * pending, then run the handler under a timeout while the lease is kept alive.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final MessageQueue queue;
    private final JobService jobService;
    private final HandlerRegistry handlers;
    private final EngineConfig config;

    private ExecutorService pollers;
    private ExecutorService handlerThreads;
    private ScheduledExecutorService leaseKeeper;
    private volatile boolean running;

    public WorkerPool(MessageQueue queue, JobService jobService, HandlerRegistry handlers, EngineConfig config) {
        this.queue = queue;
        this.jobService = jobService;
        this.handlers = handlers;
        this.config = config;
        this.handlerThreads = newHandlerThreads();
        this.leaseKeeper = newLeaseKeeper();
    }

    public WorkerPool registerHandler(JobHandler handler) {
        handlers.register(handler);
        return this;
    }

    public void start() {
        start(config.workerConcurrency());
    }

    /**
     * Start {@code workers} pollers. First polls are staggered across one poll interval.
     */
    public synchronized void start(int workers) {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        if (handlerThreads.isShutdown()) {
            handlerThreads = newHandlerThreads();
            leaseKeeper = newLeaseKeeper();
        }

        AtomicInteger counter = new AtomicInteger();
        pollers = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "quarry-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        running = true;
        long stagger = config.pollInterval().toMillis() / workers;
        for (int i = 0; i < workers; i++) {
            long initialDelay = stagger * i;
            pollers.submit(() -> pollLoop(initialDelay));
        }
        log.info("Worker pool started: {} workers, handlers {}", workers, handlers.types());
    }

    /**
     * Stop polling and wait up to {@code timeout} for in-flight handlers.
     * Handlers still running after that are interrupted; their messages are
     * redelivered once the lease expires.
     */
    public synchronized void stop(Duration timeout) {
        if (!running) {
            handlerThreads.shutdown();
            leaseKeeper.shutdownNow();
            return;
        }
        running = false;
        pollers.shutdown();

        try {
            if (!pollers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                pollers.shutdownNow();
                handlerThreads.shutdownNow();
                log.warn("Worker pool forcefully stopped after {}ms", timeout.toMillis());
            } else {
                log.info("Worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            pollers.shutdownNow();
            handlerThreads.shutdownNow();
            Thread.currentThread().interrupt();
        }
        handlerThreads.shutdown();
        leaseKeeper.shutdownNow();
    }

    @Override
    public void close() {
        stop(config.shutdownTimeout());
    }

    public boolean isRunning() {
        return running;
    }

    private void pollLoop(long initialDelayMs) {
        try {
            Thread.sleep(initialDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                if (!processNext()) {
                    Thread.sleep(config.pollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.warn("Worker {} error: {}", Thread.currentThread().getName(), e.getMessage(), e);
                try {
                    Thread.sleep(config.pollInterval().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.debug("Worker {} stopped", Thread.currentThread().getName());
    }

    /**
     * Receive and process one message on the calling thread.
     *
     * @return false if no message was visible
     */
    public boolean processNext() {
        Optional<Lease> lease = queue.receive();
        if (lease.isEmpty()) {
            return false;
        }
        process(lease.get());
        return true;
    }

    void process(Lease lease) {
        QueueMessage message = lease.message();

        // 1. Resolve handler
        Optional<JobHandler> handler = handlers.find(message.type());
        if (handler.isEmpty()) {
            log.warn("No handler for message type {} ({}); dropping", message.type(), message.id());
            queue.delete(lease);
            return;
        }

        // 2. Redelivery budget
        if (lease.receiveCount() > config.maxReceives()) {
            deadLetter(lease, handler.get());
            return;
        }

        // 3. Load and gate the job
        Job job = null;
        if (message.jobId() != null) {
            Optional<JobSnapshot> snapshot = jobService.getJob(message.jobId());
            if (snapshot.isEmpty()) {
                log.debug("Job {} no longer exists; dropping {}", message.jobId(), message.id());
                queue.delete(lease);
                return;
            }
            if (snapshot.get().state().isTerminal()) {
                log.debug("Job {} already {}; acknowledging redelivery", message.jobId(), snapshot.get().status());
                queue.delete(lease);
                jobService.replayFinished(snapshot.get());
                return;
            }
            job = snapshot.get().job();
            if (jobService.isCancelled(job)) {
                cancelJob(job.id());
                queue.delete(lease);
                return;
            }
            if (snapshot.get().status() == JobStatus.PENDING) {
                jobService.start(job.id());
            }
        }

        // 4. Run under timeout with the lease kept alive
        Duration timeout = handler.get().timeout() != null ? handler.get().timeout() : config.jobTimeout();
        JobContext context = new JobContext(lease, job, jobService, Instant.now().plus(timeout));
        run(handler.get(), context, lease, timeout);
    }

    private void run(JobHandler handler, JobContext context, Lease lease, Duration timeout) {
        Job job = context.job();
        long extendEvery = Math.max(1, config.leaseDuration().toMillis() / 2);
        ScheduledFuture<?> extender = leaseKeeper.scheduleAtFixedRate(
                () -> extendLease(lease), extendEvery, extendEvery, TimeUnit.MILLISECONDS);

        Future<HandlerResult> future = handlerThreads.submit(() -> handler.handle(context));
        try {
            HandlerResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            applyResult(result, job, lease);
        } catch (TimeoutException e) {
            context.cancel();
            future.cancel(true);
            String error = "Job timed out after " + timeout.toSeconds() + "s";
            log.warn("{} ({}): {}", error, lease.messageId(), handler.type());
            if (job != null) {
                jobService.fail(job.id(), error);
            }
            queue.delete(lease);
        } catch (ExecutionException e) {
            handleFailure(e.getCause(), job, lease);
        } catch (InterruptedException e) {
            context.cancel();
            future.cancel(true);
            Thread.currentThread().interrupt();
        } finally {
            extender.cancel(false);
        }
    }

    private void applyResult(HandlerResult result, Job job, Lease lease) {
        switch (result.kind()) {
            case COMPLETE -> {
                if (job != null) {
                    jobService.complete(job.id());
                }
                queue.delete(lease);
            }
            case ACK -> queue.delete(lease);
            case RETRY -> {
                if (!queue.requeue(lease, result.delay(),
                        result.payload() != null ? result.payload() : lease.message().payload())) {
                    log.debug("Requeue of {} skipped: lease no longer valid", lease.messageId());
                }
            }
        }
    }

    private void handleFailure(Throwable cause, Job job, Lease lease) {
        if (cause instanceof JobExecutionException jee) {
            if (jee.kind() == ErrorKind.CANCELLED) {
                if (job != null) {
                    cancelJob(job.id());
                }
                queue.delete(lease);
                return;
            }
            if (!jee.isRetryable()) {
                log.warn("Message {} failed permanently ({}): {}", lease.messageId(), jee.kind(), jee.getMessage());
                if (job != null) {
                    jobService.fail(job.id(), jee.getMessage());
                }
                queue.delete(lease);
                return;
            }
        }

        // Retryable and unexpected errors go back to the queue
        Duration backoff = backoff(lease.receiveCount());
        log.warn("Message {} attempt {} failed, retry in {}ms: {}",
                lease.messageId(), lease.receiveCount(), backoff.toMillis(), Errors.describe(cause));
        if (job != null) {
            jobService.log(job.id(), JobLogEntry.Level.WARN,
                    "Attempt " + lease.receiveCount() + " failed: " + Errors.describe(cause));
        }
        queue.release(lease, backoff);
    }

    private void deadLetter(Lease lease, JobHandler handler) {
        QueueMessage message = lease.message();
        String reason = "Exceeded " + config.maxReceives() + " deliveries";
        if (!queue.deadLetter(lease, reason)) {
            return;
        }
        if (message.jobId() != null) {
            jobService.fail(message.jobId(), "Dead-lettered: " + reason);
        }
        try {
            handler.onDeadLetter(message, reason);
        } catch (RuntimeException e) {
            log.error("Dead-letter hook for {} failed", message.id(), e);
        }
    }

    private void cancelJob(String jobId) {
        jobService.getJob(jobId)
                .filter(s -> !s.state().isTerminal())
                .ifPresent(s -> jobService.cancel(jobId));
    }

    private void extendLease(Lease lease) {
        try {
            if (!queue.extend(lease, config.leaseDuration())) {
                log.debug("Lease on {} lost while handler running", lease.messageId());
            }
        } catch (Exception e) {
            log.warn("Failed to extend lease on {}: {}", lease.messageId(), e.getMessage());
        }
    }

    Duration backoff(int receiveCount) {
        long base = config.retryBackoff().toMillis();
        int shift = Math.min(Math.max(receiveCount - 1, 0), 20);
        long millis = Math.min(base << shift, config.maxRetryBackoff().toMillis());
        return Duration.ofMillis(millis);
    }

    private static ExecutorService newHandlerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "quarry-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static ScheduledExecutorService newLeaseKeeper() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "quarry-lease-keeper");
            t.setDaemon(true);
            return t;
        });
    }
}
