package quarry.engine.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import quarry.engine.model.JobExecutionException;
import quarry.engine.util.Json;

import java.util.List;
import java.util.Map;

/**
 * Asks the model whether a round's tool results achieve the goal.
 */
public class Reviewer {

    static final String SYSTEM_PROMPT = """
            You review the results of tool calls made to achieve a goal.
            Answer with JSON only, following the given schema.
            """;

    static final Map<String, Object> OUTPUT_SCHEMA = Map.of(
            "type", "object",
            "required", List.of("goal_achieved", "confidence", "summary"),
            "properties", Map.of(
                    "goal_achieved", Map.of("type", "boolean"),
                    "confidence", Map.of("type", "number"),
                    "summary", Map.of("type", "string"),
                    "missing_data", Map.of("type", "array", "items", Map.of("type", "string")),
                    "recovery_actions", Map.of("type", "array", "items", Map.of("type", "string"))));

    private final LlmClient llm;

    public Reviewer(LlmClient llm) {
        this.llm = llm;
    }

    /**
     * @param results one entry per tool job: tool, status, result and error
     * @throws JobExecutionException retryable on transient model errors; terminal on malformed output
     */
    public ReviewResult review(String goal, List<Map<String, Object>> results) throws JobExecutionException {
        String user = "Goal: " + goal + "\n\nTool results:\n" + Json.write(results);
        ChatResponse response;
        try {
            response = llm.chat(new ChatRequest(SYSTEM_PROMPT, user, List.of(), false, OUTPUT_SCHEMA));
        } catch (LlmException e) {
            if (e.isRetryable()) {
                throw JobExecutionException.retryable("Review call failed: " + e.getMessage(), e);
            }
            throw JobExecutionException.fatal("Review call failed: " + e.getMessage(), e);
        }

        String content = response.content().strip();
        if (content.isEmpty()) {
            throw JobExecutionException.invalid("Malformed review: empty answer");
        }
        try {
            return Json.MAPPER.readValue(content, ReviewResult.class);
        } catch (JsonProcessingException e) {
            throw JobExecutionException.invalid("Malformed review: " + e.getOriginalMessage());
        }
    }
}
