package quarry.engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Notify step: publish a notification event.
 */
public record NotifyConfig(
        @JsonProperty("channel") String channel,
        @JsonProperty("message") String message) implements StepConfig {

    public static final String ACTION = "notify";

    public NotifyConfig {
        channel = channel != null && !channel.isBlank() ? channel : "default";
        message = message != null ? message : "";
    }

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public void validate() {
        // channel and message have defaults
    }
}
