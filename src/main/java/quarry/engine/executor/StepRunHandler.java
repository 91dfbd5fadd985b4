package quarry.engine.executor;

import quarry.engine.config.EngineConfig;
import quarry.engine.model.ErrorKind;
import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobStep;
import quarry.engine.model.JobTypes;
import quarry.engine.probe.ProbeScheduler;
import quarry.engine.service.JobService;
import quarry.engine.util.Errors;
import quarry.engine.util.JobIds;
import quarry.engine.worker.HandlerResult;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobHandler;
import quarry.engine.worker.JobSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runs one step job: checks its dependencies, runs its action and applies
 * the step's on_error policy.
 *
 * Payload: {@code attempt}, the 1-based attempt number under the RETRY policy.
 */
public class StepRunHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(StepRunHandler.class);

    static final String ATTEMPT = "attempt";

    private final JobService jobService;
    private final JobExecutor executor;
    private final StepActionRegistry actions;
    private final ProbeScheduler probes;
    private final JobSpawner spawner;
    private final EngineConfig config;

    public StepRunHandler(JobService jobService,
            JobExecutor executor,
            StepActionRegistry actions,
            ProbeScheduler probes,
            JobSpawner spawner,
            EngineConfig config) {
        this.jobService = jobService;
        this.executor = executor;
        this.actions = actions;
        this.probes = probes;
        this.spawner = spawner;
        this.config = config;
    }

    @Override
    public String type() {
        return JobTypes.STEP;
    }

    @Override
    public HandlerResult handle(JobContext context) throws JobExecutionException {
        Job step = context.job();
        JobStep definition = executor.stepDefinitionOf(step);

        // 1. Dependencies
        Optional<HandlerResult> waiting = checkDependencies(step, definition);
        if (waiting.isPresent()) {
            return waiting.get();
        }

        StepAction action = actions.resolve(definition)
                .orElseThrow(() -> JobExecutionException.invalid(
                        "No action " + definition.action() + " for step type " + definition.type()));

        // 2. Run
        int attempt = (int) context.message().payloadLong(ATTEMPT, 1);
        context.info("Running step " + definition.name() + " (" + definition.type() + "/" + definition.action()
                + ", attempt " + attempt + ")");
        try {
            context.throwIfCancelled();
            StepOutcome outcome = action.run(new StepContext(step, definition, context, spawner));
            if (outcome == StepOutcome.FANNED_OUT) {
                probes.schedule(step.id());
            } else {
                executor.completeStep(step.id());
            }
            return HandlerResult.ack();
        } catch (JobExecutionException e) {
            if (e.kind() == ErrorKind.CANCELLED) {
                throw e;
            }
            return onError(context, step, definition, attempt, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Step {} action {} threw", step.id(), definition.action(), e);
            return onError(context, step, definition, attempt, ErrorKind.FATAL, Errors.describe(e));
        }
    }

    private HandlerResult onError(JobContext context, Job step, JobStep definition, int attempt,
            ErrorKind kind, String error) {
        boolean retry = definition.onError() == JobStep.OnError.RETRY
                && kind != ErrorKind.VALIDATION
                && attempt < definition.maxAttempts();
        if (retry) {
            Duration delay = definition.backoff().multipliedBy(1L << Math.min(attempt - 1, 16));
            log.warn("Step {} attempt {}/{} failed, retrying in {}ms: {}",
                    step.id(), attempt, definition.maxAttempts(), delay.toMillis(), error);
            context.warn("Attempt " + attempt + " failed: " + error);
            return HandlerResult.retryAfter(delay, context.message().payloadWith(ATTEMPT, attempt + 1));
        }
        if (definition.onError() == JobStep.OnError.RETRY) {
            error = "Failed after " + attempt + " attempts: " + error;
        }
        executor.failStep(step.id(), error);
        return HandlerResult.ack();
    }

    private Optional<HandlerResult> checkDependencies(Job step, JobStep definition) throws JobExecutionException {
        if (definition.depends().isEmpty()) {
            return Optional.empty();
        }
        List<JobStep> steps = jobService.getJob(step.parentId())
                .map(manager -> executor.definitionOf(manager.job()).steps())
                .orElse(List.of());
        for (String dependency : definition.depends()) {
            int index = indexOf(steps, dependency);
            if (index < 0) {
                throw JobExecutionException.invalid("Unknown dependency: " + dependency);
            }
            Optional<JobSnapshot> upstream = jobService.getJob(JobIds.step(step.parentId(), index));
            JobStatus status = upstream.map(JobSnapshot::status).orElse(null);
            if (status == JobStatus.COMPLETED) {
                continue;
            }
            if (status == null || status.isTerminal()) {
                throw JobExecutionException.invalid("Dependency " + dependency + " did not complete ("
                        + status + ")");
            }
            log.debug("Step {} waiting on {}", step.id(), dependency);
            return Optional.of(HandlerResult.retryAfter(config.pollInterval(), null));
        }
        return Optional.empty();
    }

    private static int indexOf(List<JobStep> steps, String name) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
