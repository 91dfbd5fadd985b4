package quarry.engine.orchestrator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools by name.
 */
public class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry(Collection<? extends Tool> tools) {
        tools.forEach(this::register);
    }

    public synchronized ToolRegistry register(Tool tool) {
        tools.put(tool.name(), tool);
        return this;
    }

    public synchronized Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Specs of the allowed tools; an empty allow-list means all tools.
     */
    public synchronized List<ToolSpec> specs(List<String> allowed) {
        List<ToolSpec> specs = new ArrayList<>();
        for (Tool tool : tools.values()) {
            if (allowed.isEmpty() || allowed.contains(tool.name())) {
                specs.add(tool.spec());
            }
        }
        return specs;
    }
}
