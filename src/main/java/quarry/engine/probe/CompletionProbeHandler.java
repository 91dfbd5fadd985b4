package quarry.engine.probe;

import quarry.engine.config.EngineConfig;
import quarry.engine.executor.JobExecutor;
import quarry.engine.model.Job;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobState;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobTypes;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobService;
import quarry.engine.worker.HandlerResult;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a fanned-out step is done.
 *
 * A step is done when nothing under it is outstanding and its heartbeat has
 * not moved for the staleness window across two probe runs. Child creation
 * and child transitions touch the heartbeat, so a grandchild spawned just as
 * the outstanding count hit zero keeps the step open.
 *
 * Payload: {@code parent_id}; {@code probing_since} (epoch millis) from the
 * first run on the step, kept across reschedules; {@code idle_since} once the
 * step has been seen idle.
 */
public class CompletionProbeHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(CompletionProbeHandler.class);

    static final String PARENT_ID = "parent_id";
    static final String IDLE_SINCE = "idle_since";
    static final String PROBING_SINCE = "probing_since";

    private final JobService jobService;
    private final JobExecutor executor;
    private final EngineConfig config;

    public CompletionProbeHandler(JobService jobService, JobExecutor executor, EngineConfig config) {
        this.jobService = jobService;
        this.executor = executor;
        this.config = config;
    }

    @Override
    public String type() {
        return JobTypes.COMPLETION_PROBE;
    }

    @Override
    public HandlerResult handle(JobContext context) {
        QueueMessage message = context.message();
        String stepId = message.payloadString(PARENT_ID);
        Optional<JobSnapshot> snapshot = stepId != null ? jobService.getJob(stepId) : Optional.empty();
        if (snapshot.isEmpty()) {
            return HandlerResult.ack();
        }
        if (snapshot.get().state().isTerminal()) {
            // Finished by an earlier run that may have died before the run advanced
            jobService.replayFinished(snapshot.get());
            return HandlerResult.ack();
        }
        if (snapshot.get().status() != JobStatus.RUNNING) {
            return HandlerResult.ack();
        }

        Job step = snapshot.get().job();
        JobState state = snapshot.get().state();
        Instant now = Instant.now();
        Instant startedAt = state.startedAt() != null ? state.startedAt() : step.createdAt();

        // 1. Step timeout
        Duration timeout = executor.stepTimeout(step);
        if (timeout != null && startedAt.plus(timeout).isBefore(now)) {
            cancelOutstanding(stepId);
            executor.failStep(stepId, "Step timed out after " + timeout.toSeconds() + "s");
            return HandlerResult.ack();
        }

        // 2. Max-age guard, counted from the first probe run on this step
        long probingSince = message.payloadLong(PROBING_SINCE, now.toEpochMilli());
        Map<String, Object> payload = message.payloadWith(PROBING_SINCE, probingSince);
        if (Instant.ofEpochMilli(probingSince).plus(config.probeMaxAge()).isBefore(now)) {
            log.warn("Step {} exceeded probe max age {}; completing as possibly incomplete",
                    stepId, config.probeMaxAge());
            cancelOutstanding(stepId);
            jobService.markPossiblyIncomplete(stepId);
            executor.completeStep(stepId);
            return HandlerResult.ack();
        }

        // 3. Still working; the last child to finish schedules a new probe
        if (state.progress().outstanding() > 0) {
            log.debug("Probe for {}: {} outstanding, not ready", stepId, state.progress().outstanding());
            return HandlerResult.ack();
        }

        // 4. Idle: needs two observations across the staleness window
        long idleSince = message.payloadLong(IDLE_SINCE, -1);
        Instant heartbeat = state.lastHeartbeat() != null ? state.lastHeartbeat() : startedAt;
        if (idleSince < 0 || heartbeat.isAfter(Instant.ofEpochMilli(idleSince))) {
            payload.put(IDLE_SINCE, now.toEpochMilli());
            return HandlerResult.retryAfter(config.probeStaleness(), payload);
        }
        Duration age = Duration.between(heartbeat, now);
        if (age.compareTo(config.probeStaleness()) < 0) {
            return HandlerResult.retryAfter(config.probeStaleness().minus(age), payload);
        }

        // 5. Confirmed
        if (executor.completeStep(stepId)) {
            log.info("Step {} complete: {}", stepId, state.progress().progressText());
        }
        return HandlerResult.ack();
    }

    @Override
    public void onDeadLetter(QueueMessage message, String reason) {
        String stepId = message.payloadString(PARENT_ID);
        if (stepId != null) {
            executor.failStep(stepId, "Completion probe dead-lettered: " + reason);
        }
    }

    private void cancelOutstanding(String stepId) {
        for (JobSnapshot child : jobService.listChildren(stepId)) {
            if (!child.state().isTerminal()) {
                jobService.cancel(child.id());
            }
        }
    }
}
