package quarry.engine.worker;

import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobLogEntry;
import quarry.engine.queue.Lease;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobService;

import java.time.Instant;

/**
 * Per-delivery view handed to a {@link JobHandler}.
 */
public final class JobContext {

    private final Lease lease;
    private final Job job;
    private final JobService jobService;
    private final Instant deadline;
    private volatile boolean cancelled;

    public JobContext(Lease lease, Job job, JobService jobService, Instant deadline) {
        this.lease = lease;
        this.job = job;
        this.jobService = jobService;
        this.deadline = deadline;
    }

    public QueueMessage message() {
        return lease.message();
    }

    /** Delivery number of this message, starting at 1 */
    public int attempt() {
        return lease.receiveCount();
    }

    /** The job this message drives; null for job-less messages such as probes */
    public Job job() {
        return job;
    }

    public Instant deadline() {
        return deadline;
    }

    /**
     * True once the pool gave up on this run (timeout, shutdown) or the job, its
     * parent or its root was cancelled.
     */
    public boolean isCancelled() {
        return cancelled || (job != null && jobService.isCancelled(job));
    }

    public void throwIfCancelled() throws JobExecutionException {
        if (isCancelled()) {
            throw JobExecutionException.cancelled(job != null ? job.id() : message().id());
        }
    }

    void cancel() {
        cancelled = true;
    }

    public void heartbeat() {
        if (job != null) {
            jobService.heartbeat(job.id());
        }
    }

    public void log(JobLogEntry.Level level, String message) {
        if (job != null) {
            jobService.log(job.id(), level, message);
        }
    }

    public void info(String message) {
        log(JobLogEntry.Level.INFO, message);
    }

    public void warn(String message) {
        log(JobLogEntry.Level.WARN, message);
    }
}
