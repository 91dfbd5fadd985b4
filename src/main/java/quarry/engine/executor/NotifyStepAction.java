package quarry.engine.executor;

import quarry.engine.event.EngineEvent;
import quarry.engine.event.EventPublisher;
import quarry.engine.model.step.NotifyConfig;

import java.util.Map;

/**
 * Inline step: publish a notification event.
 */
public class NotifyStepAction implements StepAction {

    public static final String TYPE = "notifier";

    private final EventPublisher events;

    public NotifyStepAction(EventPublisher events) {
        this.events = events;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String action() {
        return NotifyConfig.ACTION;
    }

    @Override
    public StepOutcome run(StepContext context) {
        NotifyConfig config = context.config(NotifyConfig.class);
        events.publish(EngineEvent.of(EngineEvent.Type.NOTIFICATION, context.step().id(),
                Map.of("channel", config.channel(),
                        "message", config.message(),
                        "manager_id", context.managerId())));
        context.info("Notified " + config.channel());
        return StepOutcome.COMPLETED;
    }
}
