package quarry.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import quarry.engine.model.step.StepConfig;

import java.time.Duration;
import java.util.List;

/**
 * One ordered step of a job definition. The handler is resolved by
 * ({@code type}, {@code config.action}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStep(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("description") String description,
        @JsonProperty("config") StepConfig config,
        @JsonProperty("on_error") OnError onError,
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("backoff") Duration backoff,
        @JsonProperty("timeout") Duration timeout,
        @JsonProperty("depends") List<String> depends) {

    public JobStep {
        onError = onError != null ? onError : OnError.FAIL;
        maxAttempts = maxAttempts != null ? maxAttempts : 3;
        backoff = backoff != null ? backoff : Duration.ofSeconds(5);
        depends = depends != null ? List.copyOf(depends) : List.of();
    }

    public static JobStep of(String name, String type, StepConfig config) {
        return new JobStep(name, type, null, config, null, null, null, null, null);
    }

    public JobStep withOnError(OnError policy, int attempts, Duration retryBackoff) {
        return new JobStep(name, type, description, config, policy, attempts, retryBackoff, timeout, depends);
    }

    public JobStep withTimeout(Duration stepTimeout) {
        return new JobStep(name, type, description, config, onError, maxAttempts, backoff, stepTimeout, depends);
    }

    public JobStep withDepends(List<String> stepNames) {
        return new JobStep(name, type, description, config, onError, maxAttempts, backoff, timeout, stepNames);
    }

    public String action() {
        return config != null ? config.action() : null;
    }

    /** Step failure policy */
    public enum OnError {
        /** Fail the step and the whole run */
        @JsonProperty("fail")
        FAIL,
        /** Fail the step, keep running the next steps */
        @JsonProperty("continue")
        CONTINUE,
        /** Retry with exponential backoff up to max_attempts, then fail */
        @JsonProperty("retry")
        RETRY
    }
}
