package quarry.engine.event;

import java.util.function.Consumer;

/**
 * Publish/subscribe for engine notifications.
 */
public interface EventPublisher {

    void publish(EngineEvent event);

    /**
     * Subscribe to one event type.
     *
     * @return a handle that removes the subscription when run
     */
    Runnable subscribe(EngineEvent.Type type, Consumer<EngineEvent> listener);
}
