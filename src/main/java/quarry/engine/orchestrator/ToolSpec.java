package quarry.engine.orchestrator;

import java.util.Map;

/**
 * Tool description offered to the model.
 *
 * @param parameters JSON schema of the arguments
 */
public record ToolSpec(String name, String description, Map<String, Object> parameters) {
}
