package quarry.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import quarry.engine.util.Json;

import java.time.Duration;
import java.util.List;

/**
 * A reusable job definition: ordered steps plus pre/post job chaining.
 * Post-jobs and pre-jobs are definition ids resolved at run time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("description") String description,
        @JsonProperty("steps") List<JobStep> steps,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("timeout") Duration timeout,
        @JsonProperty("pre_jobs") List<String> preJobs,
        @JsonProperty("post_jobs") List<String> postJobs,
        @JsonProperty("error_tolerance") ErrorTolerance errorTolerance,
        @JsonProperty("tags") List<String> tags) {

    public JobDefinition {
        name = name != null ? name : id;
        steps = steps != null ? List.copyOf(steps) : List.of();
        enabled = enabled != null ? enabled : Boolean.TRUE;
        preJobs = preJobs != null ? List.copyOf(preJobs) : List.of();
        postJobs = postJobs != null ? List.copyOf(postJobs) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static JobDefinition of(String id, String type, List<JobStep> steps) {
        return new JobDefinition(id, id, type, null, steps, true, null, null, null, null, null);
    }

    public JobDefinition withPostJobs(List<String> ids) {
        return new JobDefinition(id, name, type, description, steps, enabled, timeout, preJobs, ids, errorTolerance, tags);
    }

    public JobDefinition withPreJobs(List<String> ids) {
        return new JobDefinition(id, name, type, description, steps, enabled, timeout, ids, postJobs, errorTolerance, tags);
    }

    public JobDefinition withEnabled(boolean on) {
        return new JobDefinition(id, name, type, description, steps, on, timeout, preJobs, postJobs, errorTolerance, tags);
    }

    public JobDefinition withErrorTolerance(ErrorTolerance tolerance) {
        return new JobDefinition(id, name, type, description, steps, enabled, timeout, preJobs, postJobs, tolerance, tags);
    }

    public boolean enabledFlag() {
        return Boolean.TRUE.equals(enabled);
    }

    public String toJson() {
        return Json.write(this);
    }

    /**
     * Parse a stored or submitted definition.
     *
     * @throws JobValidationException on malformed JSON or an unknown step action
     */
    public static JobDefinition fromJson(String json) {
        try {
            return Json.MAPPER.readValue(json, JobDefinition.class);
        } catch (InvalidTypeIdException e) {
            String action = e.getTypeId();
            throw new JobValidationException(action == null || action.isBlank()
                    ? "Step config is missing its action"
                    : "Unknown step action: " + action, e);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Invalid job definition: " + e.getOriginalMessage(), e);
        }
    }
}
