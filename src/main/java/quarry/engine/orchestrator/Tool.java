package quarry.engine.orchestrator;

import java.io.IOException;
import java.util.Map;

/**
 * Something the orchestrator can call on the model's behalf.
 */
public interface Tool {

    ToolSpec spec();

    default String name() {
        return spec().name();
    }

    /**
     * @return a JSON-serializable result
     * @throws IOException on a transient failure; the call is retried
     * @throws IllegalArgumentException on bad arguments; the call fails
     */
    Object execute(Map<String, Object> arguments) throws IOException;
}
