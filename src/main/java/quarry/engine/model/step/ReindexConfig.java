package quarry.engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reindex step: rebuild the full-text index inline.
 */
public record ReindexConfig(
        @JsonProperty("index") String index,
        @JsonProperty("full_rebuild") Boolean fullRebuild) implements StepConfig {

    public static final String ACTION = "reindex";

    public ReindexConfig {
        index = index != null && !index.isBlank() ? index : "documents";
        fullRebuild = fullRebuild != null ? fullRebuild : Boolean.TRUE;
    }

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public void validate() {
        // nothing required
    }
}
