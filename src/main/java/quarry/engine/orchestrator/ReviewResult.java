package quarry.engine.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reviewer verdict on one orchestration round.
 */
public record ReviewResult(
        @JsonProperty("goal_achieved") boolean goalAchieved,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("summary") String summary,
        @JsonProperty("missing_data") List<String> missingData,
        @JsonProperty("recovery_actions") List<String> recoveryActions) {

    public ReviewResult {
        summary = summary != null ? summary : "";
        missingData = missingData != null ? List.copyOf(missingData) : List.of();
        recoveryActions = recoveryActions != null ? List.copyOf(recoveryActions) : List.of();
    }

    public boolean needsRecovery() {
        return !goalAchieved && !recoveryActions.isEmpty();
    }
}
