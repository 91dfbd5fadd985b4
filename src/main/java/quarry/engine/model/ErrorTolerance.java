package quarry.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How many failed work jobs a run tolerates before reacting.
 * {@code maxChildFailures <= 0} disables the check.
 */
public record ErrorTolerance(
        @JsonProperty("max_child_failures") int maxChildFailures,
        @JsonProperty("failure_action") FailureAction failureAction) {

    public ErrorTolerance {
        failureAction = failureAction != null ? failureAction : FailureAction.CONTINUE;
    }

    public enum FailureAction {
        /** Cancel the whole run */
        @JsonProperty("stop_all")
        STOP_ALL,
        /** Ignore */
        @JsonProperty("continue")
        CONTINUE,
        /** Log a warning on the manager */
        @JsonProperty("mark_warning")
        MARK_WARNING
    }
}
