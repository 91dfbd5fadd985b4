package quarry.engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;
import quarry.engine.model.JobValidationException;

import java.util.List;

/**
 * Orchestrator step: plan tool calls for a goal, run them as jobs, review the outcome.
 */
public record OrchestrateConfig(
        @JsonProperty("goal") String goal,
        @JsonProperty("tools") List<String> tools,
        @JsonProperty("max_rounds") Integer maxRounds) implements StepConfig {

    public static final String ACTION = "orchestrate";

    public OrchestrateConfig {
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public void validate() {
        if (goal == null || goal.isBlank()) {
            throw new JobValidationException("orchestrate: goal is required");
        }
        if (maxRounds != null && maxRounds < 1) {
            throw new JobValidationException("orchestrate: max_rounds must be >= 1");
        }
    }
}
