package quarry.engine.executor;

import quarry.engine.model.JobDefinition;
import quarry.engine.model.JobStep;
import quarry.engine.model.JobValidationException;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks a definition before it is saved or executed.
 */
public class DefinitionValidator {

    private final StepActionRegistry actions;

    public DefinitionValidator(StepActionRegistry actions) {
        this.actions = actions;
    }

    /**
     * @throws JobValidationException describing the first problem found
     */
    public void validate(JobDefinition definition) {
        if (definition.id() == null || definition.id().isBlank()) {
            throw new JobValidationException("Definition id is required");
        }
        if (definition.steps().isEmpty()) {
            throw new JobValidationException("Definition " + definition.id() + " has no steps");
        }
        if (definition.preJobs().contains(definition.id()) || definition.postJobs().contains(definition.id())) {
            throw new JobValidationException("Definition " + definition.id() + " chains to itself");
        }

        Set<String> earlier = new HashSet<>();
        for (JobStep step : definition.steps()) {
            String name = step.name();
            if (name == null || name.isBlank()) {
                throw new JobValidationException("Step name is required");
            }
            if (earlier.contains(name)) {
                throw new JobValidationException("Duplicate step name: " + name);
            }
            if (step.config() == null) {
                throw new JobValidationException("Step " + name + " has no config");
            }
            if (actions.resolve(step).isEmpty()) {
                throw new JobValidationException("Step " + name + ": no action " + step.action()
                        + " for type " + step.type());
            }
            step.config().validate();
            if (step.maxAttempts() < 1) {
                throw new JobValidationException("Step " + name + ": max_attempts must be >= 1");
            }
            for (String dependency : step.depends()) {
                if (!earlier.contains(dependency)) {
                    throw new JobValidationException("Step " + name + " depends on unknown or later step: "
                            + dependency);
                }
            }
            earlier.add(name);
        }
    }
}
