package quarry.engine.orchestrator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One tool call of a plan.
 *
 * @param callId    id of the call within the plan
 * @param tool      tool name
 * @param params    tool arguments, without {@code depends_on}
 * @param dependsOn call ids that must finish first
 */
public record PlannedCall(String callId, String tool, Map<String, Object> params, List<String> dependsOn) {

    public PlannedCall {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }
}
