package quarry.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message type to handler lookup.
 */
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    public HandlerRegistry register(JobHandler handler) {
        JobHandler previous = handlers.put(handler.type(), handler);
        if (previous != null && previous != handler) {
            log.warn("Handler for type {} replaced: {} -> {}", handler.type(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
        return this;
    }

    public Optional<JobHandler> find(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Set<String> types() {
        return Set.copyOf(handlers.keySet());
    }
}
