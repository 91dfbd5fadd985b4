package quarry.engine.orchestrator;

import quarry.engine.config.EngineConfig;
import quarry.engine.executor.StepAction;
import quarry.engine.executor.StepContext;
import quarry.engine.executor.StepOutcome;
import quarry.engine.executor.StepVerdict;
import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobStep;
import quarry.engine.model.JobTypes;
import quarry.engine.model.step.OrchestrateConfig;
import quarry.engine.service.JobService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fan-out step that runs plan, tool, wait and review rounds as child jobs.
 */
public class OrchestrateStepAction implements StepAction {

    public static final String TYPE = "orchestrator";

    private final JobService jobService;
    private final EngineConfig config;

    public OrchestrateStepAction(JobService jobService, EngineConfig config) {
        this.jobService = jobService;
        this.config = config;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String action() {
        return OrchestrateConfig.ACTION;
    }

    @Override
    public StepOutcome run(StepContext context) throws JobExecutionException {
        OrchestrateConfig settings = context.config(OrchestrateConfig.class);
        Map<String, Object> round = new LinkedHashMap<>();
        round.put(OrchestratorJobs.GOAL, settings.goal());
        round.put(OrchestratorJobs.ROUND, 1);
        round.put(OrchestratorJobs.MAX_ROUNDS,
                settings.maxRounds() != null ? settings.maxRounds() : config.maxReviewRounds());
        round.put(OrchestratorJobs.TOOLS, settings.tools());

        context.throwIfCancelled();
        OrchestratorJobs.spawnPlanning(context.spawner(), context.step(), round, List.of());
        context.info("Orchestrating goal: " + settings.goal());
        return StepOutcome.FANNED_OUT;
    }

    /**
     * The step fails when the planning job of its last round failed.
     */
    @Override
    public StepVerdict settle(Job step, JobStep definition) {
        JobSnapshot lastPlanning = null;
        for (JobSnapshot child : jobService.listChildren(step.id())) {
            if (JobTypes.PLANNING.equals(child.job().type())
                    && (lastPlanning == null || round(child) > round(lastPlanning))) {
                lastPlanning = child;
            }
        }
        if (lastPlanning != null && lastPlanning.status() == JobStatus.FAILED) {
            return StepVerdict.fail("Planning failed: " + lastPlanning.state().error());
        }
        return StepVerdict.ok();
    }

    private static int round(JobSnapshot snapshot) {
        return snapshot.job().configInt(OrchestratorJobs.ROUND, 0);
    }
}
