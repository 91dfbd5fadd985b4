package quarry.engine.executor;

import quarry.engine.model.JobStep;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves step actions by (type, action).
 */
public class StepActionRegistry {

    private final Map<String, StepAction> actions = new ConcurrentHashMap<>();

    public StepActionRegistry register(StepAction action) {
        actions.put(key(action.type(), action.action()), action);
        return this;
    }

    public Optional<StepAction> resolve(String type, String action) {
        if (type == null || action == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(actions.get(key(type, action)));
    }

    public Optional<StepAction> resolve(JobStep step) {
        return resolve(step.type(), step.action());
    }

    public Set<String> keys() {
        return Set.copyOf(actions.keySet());
    }

    private static String key(String type, String action) {
        return type + ":" + action;
    }
}
