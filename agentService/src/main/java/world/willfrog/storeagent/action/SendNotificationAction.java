package world.willfrog.storeagent.action;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.integration.NotificationDispatcher;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queues a notification for the store or a customer. Payload needs at least {@code type} and {@code message}.
 */
@Component
@RequiredArgsConstructor
public class SendNotificationAction implements ActionHandler {

    private final NotificationDispatcher dispatcher;

    @Override
    public String getType() {
        return ActionTypes.SEND_NOTIFICATION;
    }

    @Override
    public String getDescription() {
        return "Send a notification to the store or a customer";
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        return PayloadValues.string(payload, "type") != null && PayloadValues.string(payload, "message") != null;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Map<String, Object> notification = new LinkedHashMap<>(payload);
        notification.put("action_id", action.getId());
        notification.put("agent_slug", action.getAgentSlug());
        String reference = dispatcher.dispatch(action.getStoreId(), notification);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reference", reference);
        data.put("type", payload.get("type"));
        return ActionResult.success("Notification queued", new LinkedHashMap<>(), data);
    }
}
