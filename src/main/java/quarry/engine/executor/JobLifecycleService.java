package quarry.engine.executor;

import quarry.engine.model.Job;
import quarry.engine.model.JobDefinition;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStateException;
import quarry.engine.model.JobTypes;
import quarry.engine.queue.MessageQueue;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobService;
import quarry.engine.util.JobIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * User-facing lifecycle operations: cancel, rerun, copy, delete.
 */
public class JobLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycleService.class);

    private final JobService jobService;
    private final JobExecutor executor;
    private final MessageQueue queue;

    public JobLifecycleService(JobService jobService, JobExecutor executor, MessageQueue queue) {
        this.jobService = jobService;
        this.executor = executor;
        this.queue = queue;
    }

    /**
     * @return true if the job was cancelled by this call, false if it was already terminal
     */
    public boolean cancel(String jobId) {
        return jobService.cancel(jobId);
    }

    /**
     * Run a finished root job again as a new job.
     * A manager is re-executed from the definition snapshot it was started with.
     *
     * @return id of the new job
     * @throws JobStateException NOT_TERMINAL if the job has not finished
     */
    public String rerun(String jobId) {
        JobSnapshot snapshot = jobService.requireJob(jobId);
        if (!snapshot.state().isTerminal()) {
            throw new JobStateException(jobId, JobStateException.Reason.NOT_TERMINAL,
                    "Cannot rerun job " + jobId + " while it is " + snapshot.status());
        }
        Job job = snapshot.job();
        if (!job.isRoot()) {
            throw new IllegalArgumentException("Only root jobs can be rerun: " + jobId);
        }

        String newId;
        if (JobTypes.MANAGER.equals(job.type())) {
            JobDefinition definition = executor.definitionOf(job);
            newId = executor.execute(definition);
        } else {
            newId = JobIds.generate();
            createOrFail(job.toBuilder().id(newId).createdAt(Instant.now()).build());
            queue.enqueue(QueueMessage.forJob(job.type(), newId));
        }
        log.info("Rerun of {} started as {}", jobId, newId);
        return newId;
    }

    /**
     * Create a PENDING copy of a job with the same type and config. The copy is
     * a new root outside the original's tree and is not queued.
     *
     * @return id of the copy
     */
    public String copy(String jobId) {
        Job job = jobService.requireJob(jobId).job();
        String newId = JobIds.generate();
        createOrFail(job.toBuilder()
                .id(newId)
                .parentId(null)
                .managerId(null)
                .depth(0)
                .name(job.name() + " (Copy)")
                .createdAt(Instant.now())
                .build());
        log.info("Copied job {} to {}", jobId, newId);
        return newId;
    }

    /**
     * @return number of jobs deleted
     * @throws JobStateException STILL_RUNNING if the job or a descendant is running
     */
    public int delete(String jobId) {
        return jobService.deleteJob(jobId);
    }

    private void createOrFail(Job job) {
        if (!jobService.createJob(job)) {
            throw new JobStateException(job.id(), JobStateException.Reason.ALREADY_EXISTS,
                    "Job id already taken: " + job.id());
        }
    }
}
