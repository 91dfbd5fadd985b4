package quarry.engine.orchestrator;

import java.util.List;
import java.util.Map;

/**
 * One chat turn.
 *
 * @param system          system instructions
 * @param user            user content
 * @param tools           tools the model may call
 * @param toolUseRequired force the model to answer with tool calls
 * @param outputSchema    JSON schema the text answer must follow, or null
 */
public record ChatRequest(String system, String user, List<ToolSpec> tools, boolean toolUseRequired,
        Map<String, Object> outputSchema) {

    public ChatRequest {
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
