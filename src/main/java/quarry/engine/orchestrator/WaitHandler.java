package quarry.engine.orchestrator;

import quarry.engine.config.EngineConfig;
import quarry.engine.model.Job;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobTypes;
import quarry.engine.service.JobService;
import quarry.engine.worker.HandlerResult;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobHandler;
import quarry.engine.worker.JobSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wait phase: releases tool jobs whose dependencies finished and hands over to
 * review once every tool job is terminal. Between checks the message sits in
 * the queue, so waiting holds no thread.
 *
 * Payload: {@code deadline}, epoch millis after which outstanding tools are cancelled.
 */
public class WaitHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(WaitHandler.class);

    static final String DEADLINE = "deadline";

    private final JobService jobService;
    private final JobSpawner spawner;
    private final EngineConfig config;

    public WaitHandler(JobService jobService, JobSpawner spawner, EngineConfig config) {
        this.jobService = jobService;
        this.spawner = spawner;
        this.config = config;
    }

    @Override
    public String type() {
        return JobTypes.WAIT;
    }

    @Override
    public HandlerResult handle(JobContext context) {
        Job job = context.job();
        Job step = jobService.requireJob(job.parentId()).job();
        int round = job.configInt(OrchestratorJobs.ROUND, 1);
        List<String> toolJobIds = OrchestratorJobs.strings(job.config().get(OrchestratorJobs.TOOL_JOBS));

        Instant now = Instant.now();
        long deadline = context.message().payloadLong(DEADLINE, -1);
        if (deadline < 0) {
            deadline = now.plus(config.toolWaitMax()).toEpochMilli();
        }
        context.heartbeat();

        // 1. Release tools whose dependencies are done
        int outstanding = 0;
        for (String toolJobId : toolJobIds) {
            Optional<JobSnapshot> tool = jobService.getJob(toolJobId);
            if (tool.isEmpty() || tool.get().state().isTerminal()) {
                continue;
            }
            outstanding++;
            if (tool.get().status() == JobStatus.PENDING && dependenciesDone(tool.get().job())) {
                spawner.enqueue(tool.get().job(), Duration.ZERO);
            }
        }

        // 2. Out of time: stop what is left and review what we have
        if (outstanding > 0 && now.toEpochMilli() >= deadline) {
            log.warn("Round {} of {} timed out with {} tool jobs outstanding", round, step.id(), outstanding);
            context.warn("Tool wait timed out; cancelling " + outstanding + " outstanding tool jobs");
            for (String toolJobId : toolJobIds) {
                jobService.getJob(toolJobId)
                        .filter(tool -> !tool.state().isTerminal())
                        .ifPresent(tool -> jobService.cancel(toolJobId));
            }
            outstanding = 0;
        }

        if (outstanding > 0) {
            return HandlerResult.retryAfter(config.toolWaitInterval(),
                    context.message().payloadWith(DEADLINE, deadline));
        }

        // 3. Hand over to review
        Map<String, Object> reviewConfig = OrchestratorJobs.roundConfig(job, round);
        reviewConfig.put(OrchestratorJobs.TOOL_JOBS, toolJobIds);
        spawner.spawn(step, OrchestratorJobs.reviewId(step.id(), round), JobTypes.REVIEW, "Review round " + round,
                reviewConfig);
        context.info("All " + toolJobIds.size() + " tool jobs finished");
        return HandlerResult.complete();
    }

    private boolean dependenciesDone(Job tool) {
        for (String dependency : OrchestratorJobs.strings(tool.config().get(OrchestratorJobs.DEPENDS_ON))) {
            boolean done = jobService.getJob(dependency)
                    .map(snapshot -> snapshot.state().isTerminal())
                    .orElse(true);
            if (!done) {
                return false;
            }
        }
        return true;
    }
}
