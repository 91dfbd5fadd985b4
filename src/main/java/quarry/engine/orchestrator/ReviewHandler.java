package quarry.engine.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobTypes;
import quarry.engine.service.JobService;
import quarry.engine.util.Json;
import quarry.engine.worker.HandlerResult;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobHandler;
import quarry.engine.worker.JobSpawner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Review phase: judges the round's tool results and starts another planning
 * round when the goal was missed and the reviewer suggests recovery actions.
 */
public class ReviewHandler implements JobHandler {

    private final JobService jobService;
    private final Reviewer reviewer;
    private final JobSpawner spawner;

    public ReviewHandler(JobService jobService, Reviewer reviewer, JobSpawner spawner) {
        this.jobService = jobService;
        this.reviewer = reviewer;
        this.spawner = spawner;
    }

    @Override
    public String type() {
        return JobTypes.REVIEW;
    }

    @Override
    public HandlerResult handle(JobContext context) throws JobExecutionException {
        Job job = context.job();
        Job step = jobService.requireJob(job.parentId()).job();
        int round = job.configInt(OrchestratorJobs.ROUND, 1);
        int maxRounds = job.configInt(OrchestratorJobs.MAX_ROUNDS, 1);

        List<Map<String, Object>> results = new ArrayList<>();
        for (String toolJobId : OrchestratorJobs.strings(job.config().get(OrchestratorJobs.TOOL_JOBS))) {
            Optional<JobSnapshot> tool = jobService.getJob(toolJobId);
            if (tool.isEmpty()) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("tool", tool.get().job().name());
            entry.put("status", tool.get().status().name());
            String result = tool.get().state().result();
            entry.put("result", result != null ? readResult(result) : null);
            entry.put("error", tool.get().state().error());
            results.add(entry);
        }

        ReviewResult review = reviewer.review(job.configString(OrchestratorJobs.GOAL), results);
        jobService.recordResult(job.id(), Json.write(review), results.size());
        context.info("Review round " + round + ": goal_achieved=" + review.goalAchieved()
                + " confidence=" + review.confidence() + " " + review.summary());

        if (review.needsRecovery() && round < maxRounds) {
            context.throwIfCancelled();
            OrchestratorJobs.spawnPlanning(spawner, step, OrchestratorJobs.roundConfig(job, round + 1),
                    review.recoveryActions());
            context.info("Starting recovery round " + (round + 1));
        }
        return HandlerResult.complete();
    }

    private static Object readResult(String json) {
        try {
            return Json.MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            return json;
        }
    }
}
