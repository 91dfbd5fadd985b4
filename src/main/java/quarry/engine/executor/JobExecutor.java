package quarry.engine.executor;

import quarry.engine.event.EngineEvent;
import quarry.engine.event.EventPublisher;
import quarry.engine.model.ErrorTolerance;
import quarry.engine.model.Job;
import quarry.engine.model.JobDefinition;
import quarry.engine.model.JobLogEntry;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStateException;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobStep;
import quarry.engine.model.JobTypes;
import quarry.engine.model.JobValidationException;
import quarry.engine.queue.MessageQueue;
import quarry.engine.queue.QueueMessage;
import quarry.engine.repository.JobDefinitionStore;
import quarry.engine.service.JobCompletionListener;
import quarry.engine.service.JobService;
import quarry.engine.util.JobIds;
import quarry.engine.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs job definitions: one manager job with one step job per ordered step.
 *
 * Steps run one at a time. A step advances the run when it reaches a terminal
 * state; the executor reacts to that through {@link #onFinished}, so it does
 * not matter whether the step was completed inline, by the completion probe,
 * or failed by the worker pool.
 */
public class JobExecutor implements JobCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final String CONFIG_DEFINITION_ID = "definition_id";
    static final String CONFIG_DEFINITION = "definition";
    static final String CONFIG_CHAIN = "chain";
    static final String CONFIG_STEP_INDEX = "step_index";
    static final String CONFIG_STEP = "step";

    private final JobService jobService;
    private final JobDefinitionStore definitions;
    private final MessageQueue queue;
    private final StepActionRegistry actions;
    private final DefinitionValidator validator;
    private final EventPublisher events;

    public JobExecutor(JobService jobService,
            JobDefinitionStore definitions,
            MessageQueue queue,
            StepActionRegistry actions,
            EventPublisher events) {
        this.jobService = jobService;
        this.definitions = definitions;
        this.queue = queue;
        this.actions = actions;
        this.validator = new DefinitionValidator(actions);
        this.events = events;
    }

    public DefinitionValidator validator() {
        return validator;
    }

    /**
     * Validate and store a definition.
     *
     * @throws JobValidationException if the definition is invalid
     */
    public void saveDefinition(JobDefinition definition) {
        validator.validate(definition);
        definitions.save(definition);
        log.info("Saved job definition {} ({} steps)", definition.id(), definition.steps().size());
    }

    // --- Execution ---

    /**
     * Execute a stored definition.
     *
     * @return the manager job id
     * @throws JobValidationException if the definition is missing, disabled or invalid
     */
    public String execute(String definitionId) {
        JobDefinition definition = definitions.findById(definitionId)
                .orElseThrow(() -> new JobValidationException("Job definition not found: " + definitionId));
        if (!definition.enabledFlag()) {
            throw new JobValidationException("Job definition is disabled: " + definitionId);
        }
        return execute(definition);
    }

    /**
     * Execute a definition under a freshly generated manager id.
     *
     * @throws JobStateException ALREADY_EXISTS if the generated id is taken
     */
    public String execute(JobDefinition definition) {
        return execute(definition, JobIds.generate(), List.of(), true);
    }

    /**
     * Execute a definition under a caller-chosen manager id. Executing the same
     * id twice is a no-op the second time.
     *
     * @return the manager job id
     */
    public String execute(JobDefinition definition, String managerId) {
        return execute(definition, managerId, List.of(), false);
    }

    private String execute(JobDefinition definition, String managerId, List<String> chain, boolean fresh) {
        validator.validate(definition);
        if (fresh && jobService.getJob(managerId).isPresent()) {
            throw new JobStateException(managerId, JobStateException.Reason.ALREADY_EXISTS,
                    "Job id already taken: " + managerId);
        }

        List<String> newChain = new ArrayList<>(chain);
        newChain.add(definition.id());

        // 1. Pre-jobs, fire-and-forget
        runChained(definition.preJobs(), managerId + "-pre-", newChain, "Pre-job");

        // 2. Manager
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(CONFIG_DEFINITION_ID, definition.id());
        config.put(CONFIG_DEFINITION, definition.toJson());
        config.put(CONFIG_CHAIN, newChain);
        Job manager = Job.builder()
                .id(managerId)
                .type(JobTypes.MANAGER)
                .name(definition.name())
                .config(config)
                .depth(JobTypes.MANAGER_DEPTH)
                .createdAt(Instant.now())
                .build();
        if (!jobService.createJob(manager)) {
            if (fresh) {
                throw new JobStateException(managerId, JobStateException.Reason.ALREADY_EXISTS,
                        "Job id already taken: " + managerId);
            }
            log.info("Manager {} already exists; not executing {} again", managerId, definition.id());
            return managerId;
        }
        jobService.start(managerId);

        // 3. Steps
        List<JobStep> steps = definition.steps();
        for (int i = 0; i < steps.size(); i++) {
            Map<String, Object> stepConfig = new LinkedHashMap<>();
            stepConfig.put(CONFIG_STEP_INDEX, i);
            stepConfig.put(CONFIG_STEP, Json.write(steps.get(i)));
            jobService.createChild(manager, JobIds.step(managerId, i), JobTypes.STEP, steps.get(i).name(), stepConfig);
        }

        // 4. First step
        queue.enqueue(QueueMessage.forJob(JobTypes.STEP, JobIds.step(managerId, 0)));
        jobService.log(managerId, JobLogEntry.Level.INFO,
                "Started " + definition.id() + " with " + steps.size() + " steps");
        log.info("Executing definition {} as manager {} ({} steps)", definition.id(), managerId, steps.size());
        return managerId;
    }

    private void runChained(List<String> ids, String idPrefix, List<String> chain, String label) {
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            if (chain.contains(id)) {
                log.warn("{} {} skipped: it would start a cycle {}", label, id, chain);
                continue;
            }
            Optional<JobDefinition> definition = definitions.findById(id);
            if (definition.isEmpty()) {
                log.warn("{} {} skipped: definition not found", label, id);
                continue;
            }
            if (!definition.get().enabledFlag()) {
                log.warn("{} {} skipped: definition disabled", label, id);
                continue;
            }
            try {
                String managerId = execute(definition.get(), idPrefix + i, chain, false);
                log.info("{} {} started as {}", label, id, managerId);
            } catch (JobValidationException e) {
                log.warn("{} {} skipped: {}", label, id, e.getMessage());
            }
        }
    }

    // --- Step completion ---

    /**
     * Complete a running step after giving its action the last word.
     *
     * @return true if this call completed the step
     */
    public boolean completeStep(String stepId) {
        Optional<JobSnapshot> snapshot = jobService.getJob(stepId);
        if (snapshot.isEmpty() || snapshot.get().status() != JobStatus.RUNNING) {
            return false;
        }
        Job step = snapshot.get().job();
        JobStep definition = stepDefinitionOf(step);
        StepVerdict verdict = actions.resolve(definition)
                .map(action -> action.settle(step, definition))
                .orElse(StepVerdict.ok());
        if (verdict.failed()) {
            return failStep(stepId, verdict.error());
        }
        return jobService.complete(stepId);
    }

    /**
     * Fail a step. What happens to the run is decided by the step's on_error policy.
     *
     * @return true if this call failed the step
     */
    public boolean failStep(String stepId, String error) {
        return jobService.fail(stepId, error);
    }

    @Override
    public void onFinished(Job job, JobStatus status) {
        switch (job.type()) {
            case JobTypes.STEP -> onStepFinished(job, status);
            case JobTypes.MANAGER -> onManagerFinished(job, status);
            default -> {
                if (status == JobStatus.FAILED && job.depth() >= JobTypes.WORK_DEPTH) {
                    checkErrorTolerance(job);
                }
            }
        }
    }

    private void onStepFinished(Job step, JobStatus status) {
        if (status == JobStatus.COMPLETED) {
            events.publish(EngineEvent.of(EngineEvent.Type.STEP_COMPLETED, step.id(),
                    Map.of("manager_id", step.rootId(), "name", step.name())));
            advance(step);
        } else if (status == JobStatus.FAILED) {
            JobStep definition = stepDefinitionOf(step);
            if (definition.onError() == JobStep.OnError.CONTINUE) {
                jobService.log(step.rootId(), JobLogEntry.Level.WARN,
                        "Step " + step.name() + " failed; continuing");
                advance(step);
            } else {
                failRun(step);
            }
        }
    }

    private void advance(Job step) {
        Optional<JobSnapshot> manager = jobService.getJob(step.parentId());
        if (manager.isEmpty() || manager.get().state().isTerminal()) {
            return;
        }
        int index = step.configInt(CONFIG_STEP_INDEX, 0);
        JobDefinition definition = definitionOf(manager.get().job());

        if (index + 1 < definition.steps().size()) {
            String nextId = JobIds.step(step.parentId(), index + 1);
            jobService.getJob(nextId)
                    .filter(next -> next.status() == JobStatus.PENDING)
                    .ifPresent(next -> queue.enqueue(QueueMessage.forJob(JobTypes.STEP, nextId)));
            return;
        }

        if (jobService.complete(step.parentId())) {
            log.info("Manager {} completed", step.parentId());
        }
    }

    private void failRun(Job step) {
        String managerId = step.parentId();
        String error = "Step " + step.name() + " failed";
        Optional<JobSnapshot> failed = jobService.getJob(step.id());
        if (failed.isPresent() && failed.get().state().error() != null) {
            error += ": " + failed.get().state().error();
        }
        if (!jobService.fail(managerId, error)) {
            return;
        }
        for (JobSnapshot sibling : jobService.listChildren(managerId)) {
            if (!sibling.state().isTerminal()) {
                jobService.cancel(sibling.id());
            }
        }
    }

    private void onManagerFinished(Job manager, JobStatus status) {
        events.publish(EngineEvent.of(EngineEvent.Type.JOB_COMPLETED, manager.id(),
                Map.of("status", status.name(), "definition_id", String.valueOf(manager.configString(CONFIG_DEFINITION_ID)))));
        if (status != JobStatus.COMPLETED) {
            return;
        }
        JobDefinition definition = definitionOf(manager);
        runChained(definition.postJobs(), manager.id() + "-post-", chainOf(manager), "Post-job");
    }

    private void checkErrorTolerance(Job job) {
        Optional<JobSnapshot> manager = jobService.getJob(job.rootId());
        if (manager.isEmpty() || manager.get().state().isTerminal()
                || !JobTypes.MANAGER.equals(manager.get().job().type())) {
            return;
        }
        ErrorTolerance tolerance = definitionOf(manager.get().job()).errorTolerance();
        if (tolerance == null || tolerance.maxChildFailures() <= 0) {
            return;
        }
        int failed = manager.get().state().progress().failed();
        if (failed < tolerance.maxChildFailures()) {
            return;
        }

        String managerId = manager.get().id();
        switch (tolerance.failureAction()) {
            case STOP_ALL -> {
                log.warn("Manager {} reached {} failed jobs; stopping", managerId, failed);
                jobService.log(managerId, JobLogEntry.Level.ERROR,
                        "Error tolerance exceeded (" + failed + " failures); cancelling");
                jobService.cancel(managerId);
            }
            case MARK_WARNING -> {
                if (failed == tolerance.maxChildFailures()) {
                    jobService.log(managerId, JobLogEntry.Level.WARN,
                            "Error tolerance reached: " + failed + " failed jobs");
                }
            }
            case CONTINUE -> {
            }
        }
    }

    // --- Definition snapshots ---

    /** Definition snapshot a manager was started with */
    public JobDefinition definitionOf(Job manager) {
        String json = manager.configString(CONFIG_DEFINITION);
        if (json == null) {
            throw new JobValidationException("Job " + manager.id() + " carries no definition");
        }
        return JobDefinition.fromJson(json);
    }

    /** Step definition a step job was created from */
    public JobStep stepDefinitionOf(Job step) {
        String json = step.configString(CONFIG_STEP);
        if (json == null) {
            throw new JobValidationException("Job " + step.id() + " carries no step definition");
        }
        return Json.read(json, JobStep.class);
    }

    /** Step timeout, falling back to the definition's; null if neither sets one */
    public Duration stepTimeout(Job step) {
        Duration timeout = stepDefinitionOf(step).timeout();
        if (timeout != null) {
            return timeout;
        }
        return jobService.getJob(step.rootId())
                .map(manager -> definitionOf(manager.job()).timeout())
                .orElse(null);
    }

    private static List<String> chainOf(Job manager) {
        List<String> chain = new ArrayList<>();
        if (manager.config().get(CONFIG_CHAIN) instanceof List<?> list) {
            for (Object id : list) {
                if (id != null) {
                    chain.add(id.toString());
                }
            }
        }
        return chain;
    }
}
