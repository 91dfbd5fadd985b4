package quarry.engine.probe;

import quarry.engine.config.EngineConfig;
import quarry.engine.model.Job;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobTypes;
import quarry.engine.queue.MessageQueue;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobCompletionListener;
import quarry.engine.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Schedules the completion probe of a fanned-out step whenever one of its
 * children finishes and nothing under the step is outstanding any more.
 *
 * There is one probe message per step. Scheduling again rearms it, which also
 * invalidates a probe run that is in flight.
 */
public class ProbeScheduler implements JobCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(ProbeScheduler.class);

    private final JobService jobService;
    private final MessageQueue queue;
    private final EngineConfig config;

    public ProbeScheduler(JobService jobService, MessageQueue queue, EngineConfig config) {
        this.jobService = jobService;
        this.queue = queue;
        this.config = config;
    }

    @Override
    public void onFinished(Job job, JobStatus status) {
        if (job.parentId() == null) {
            return;
        }
        Optional<JobSnapshot> parent = jobService.getJob(job.parentId());
        if (parent.isEmpty() || !JobTypes.STEP.equals(parent.get().job().type())
                || parent.get().status() != JobStatus.RUNNING) {
            return;
        }
        if (parent.get().state().progress().outstanding() == 0) {
            schedule(parent.get().id());
        }
    }

    /**
     * Schedule (or push back) the probe for {@code stepId}.
     */
    public void schedule(String stepId) {
        queue.enqueueOrRearm(QueueMessage.probe(stepId), config.probeDelay());
        log.debug("Completion probe scheduled for {} in {}ms", stepId, config.probeDelay().toMillis());
    }
}
