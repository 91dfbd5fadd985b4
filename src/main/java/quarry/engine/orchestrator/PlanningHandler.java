package quarry.engine.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import quarry.engine.config.EngineConfig;
import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobTypes;
import quarry.engine.service.JobService;
import quarry.engine.util.Json;
import quarry.engine.worker.HandlerResult;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobHandler;
import quarry.engine.worker.JobSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Planning phase: turns the goal into tool jobs plus the round's wait job.
 */
public class PlanningHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(PlanningHandler.class);

    private static final TypeReference<List<PlannedCall>> PLAN_TYPE = new TypeReference<>() {
    };

    private final JobService jobService;
    private final Planner planner;
    private final JobSpawner spawner;
    private final EngineConfig config;

    public PlanningHandler(JobService jobService, Planner planner, JobSpawner spawner, EngineConfig config) {
        this.jobService = jobService;
        this.planner = planner;
        this.spawner = spawner;
        this.config = config;
    }

    @Override
    public String type() {
        return JobTypes.PLANNING;
    }

    @Override
    public HandlerResult handle(JobContext context) throws JobExecutionException {
        Job job = context.job();
        Job step = jobService.requireJob(job.parentId()).job();
        int round = job.configInt(OrchestratorJobs.ROUND, 1);

        // 0. The plan is stored before anything is spawned; a redelivery replays it
        List<PlannedCall> calls = savedPlan(job);
        if (calls == null) {
            calls = planner.plan(
                    job.configString(OrchestratorJobs.GOAL),
                    OrchestratorJobs.strings(job.config().get(OrchestratorJobs.TOOLS)),
                    OrchestratorJobs.strings(job.config().get(OrchestratorJobs.RECOVERY)));
            context.throwIfCancelled();
            jobService.recordResult(job.id(), Json.write(calls), calls.size());
        } else {
            log.info("Planning job {} already planned {} calls; reusing the stored plan", job.id(), calls.size());
        }

        // 1. Tool jobs; only those without dependencies are queued now
        Map<String, String> jobIdByCall = new HashMap<>();
        for (PlannedCall call : calls) {
            jobIdByCall.put(call.callId(), OrchestratorJobs.toolId(step.id(), round, call.callId()));
        }
        List<String> toolJobIds = new ArrayList<>();
        for (PlannedCall call : calls) {
            List<String> dependencies = new ArrayList<>();
            for (String dependency : call.dependsOn()) {
                String dependencyJob = jobIdByCall.get(dependency);
                if (dependencyJob == null || dependency.equals(call.callId())) {
                    log.warn("Call {} depends on unknown call {}; ignoring", call.callId(), dependency);
                    continue;
                }
                dependencies.add(dependencyJob);
            }

            Map<String, Object> toolConfig = new LinkedHashMap<>();
            toolConfig.put(OrchestratorJobs.TOOL, call.tool());
            toolConfig.put(OrchestratorJobs.PARAMS, call.params());
            toolConfig.put(OrchestratorJobs.CALL_ID, call.callId());
            toolConfig.put(OrchestratorJobs.DEPENDS_ON, dependencies);
            toolConfig.put(OrchestratorJobs.ROUND, round);

            String toolJobId = jobIdByCall.get(call.callId());
            Job toolJob = spawner.create(step, toolJobId, JobTypes.TOOL_EXECUTION, call.tool(), toolConfig);
            if (dependencies.isEmpty()) {
                spawner.enqueue(toolJob, Duration.ZERO);
            }
            toolJobIds.add(toolJobId);
        }

        // 2. Wait job for this round
        Map<String, Object> waitConfig = OrchestratorJobs.roundConfig(job, round);
        waitConfig.put(OrchestratorJobs.TOOL_JOBS, toolJobIds);
        spawner.spawn(step, OrchestratorJobs.waitId(step.id(), round), JobTypes.WAIT, "Wait round " + round,
                waitConfig, config.toolWaitInterval());

        context.info("Planned " + calls.size() + " tool calls for round " + round);
        return HandlerResult.complete();
    }

    private List<PlannedCall> savedPlan(Job job) throws JobExecutionException {
        String stored = jobService.requireJob(job.id()).state().result();
        if (stored == null || stored.isBlank()) {
            return null;
        }
        try {
            return Json.MAPPER.readValue(stored, PLAN_TYPE);
        } catch (JsonProcessingException e) {
            throw JobExecutionException.fatal("Stored plan of " + job.id() + " is unreadable: " + e.getOriginalMessage(), e);
        }
    }
}
