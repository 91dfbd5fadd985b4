package quarry.engine.orchestrator;

import java.util.List;

/**
 * Model answer: free text, tool calls, or both.
 */
public record ChatResponse(String content, List<ToolCall> toolCalls) {

    public ChatResponse {
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }
}
