package quarry.engine.worker;

import quarry.engine.model.Job;
import quarry.engine.queue.MessageQueue;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobService;

import java.time.Duration;
import java.util.Map;

/**
 * Creates child jobs and queues their messages. Both steps are idempotent,
 * so a handler re-run after a crash spawns nothing twice.
 */
public class JobSpawner {

    private final JobService jobService;
    private final MessageQueue queue;

    public JobSpawner(JobService jobService, MessageQueue queue) {
        this.jobService = jobService;
        this.queue = queue;
    }

    /**
     * Create a child job under {@code parent} without queueing it.
     */
    public Job create(Job parent, String childId, String type, String name, Map<String, Object> config) {
        return jobService.createChild(parent, childId, type, name, config);
    }

    /**
     * Create a child job and queue it for immediate execution.
     */
    public Job spawn(Job parent, String childId, String type, String name, Map<String, Object> config) {
        return spawn(parent, childId, type, name, config, Duration.ZERO);
    }

    public Job spawn(Job parent, String childId, String type, String name, Map<String, Object> config,
            Duration delay) {
        Job child = create(parent, childId, type, name, config);
        enqueue(child, delay);
        return child;
    }

    /**
     * Queue an existing job. A message already queued for it is left alone.
     */
    public boolean enqueue(Job job, Duration delay) {
        return queue.enqueueWithDelay(QueueMessage.forJob(job.type(), job.id()), delay);
    }
}
