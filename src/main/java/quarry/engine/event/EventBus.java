package quarry.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process event bus. Listeners run synchronously on the publishing thread;
 * a failing listener is logged and never affects the publisher.
 */
public final class EventBus implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<EngineEvent.Type, CopyOnWriteArrayList<Consumer<EngineEvent>>> listeners = new EnumMap<>(
            EngineEvent.Type.class);

    public EventBus() {
        for (EngineEvent.Type type : EngineEvent.Type.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public void publish(EngineEvent event) {
        for (var listener : listeners.get(event.type())) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed for {} on job {}: {}", event.type(), event.jobId(), e.getMessage());
            }
        }
    }

    @Override
    public Runnable subscribe(EngineEvent.Type type, Consumer<EngineEvent> listener) {
        var list = listeners.get(type);
        list.add(listener);
        return () -> list.remove(listener);
    }
}
