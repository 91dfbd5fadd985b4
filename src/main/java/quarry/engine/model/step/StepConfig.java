package quarry.engine.model.step;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed step configuration, discriminated by its {@code action} property.
 * Unknown actions are rejected when the definition is parsed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CrawlConfig.class, name = CrawlConfig.ACTION),
        @JsonSubTypes.Type(value = ReindexConfig.class, name = ReindexConfig.ACTION),
        @JsonSubTypes.Type(value = OrchestrateConfig.class, name = OrchestrateConfig.ACTION),
        @JsonSubTypes.Type(value = NotifyConfig.class, name = NotifyConfig.ACTION)
})
public interface StepConfig {

    /** Action name, the discriminant of this config */
    String action();

    /**
     * Check required fields and value ranges.
     *
     * @throws quarry.engine.model.JobValidationException if the config is unusable
     */
    void validate();
}
