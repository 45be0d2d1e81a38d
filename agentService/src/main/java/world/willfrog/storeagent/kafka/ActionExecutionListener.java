package world.willfrog.storeagent.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.action.ActionResult;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.service.ActionExecutor;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.Map;

/**
 * Executes actions published by the dispatcher in kafka mode. Redelivery is harmless: the executor's claim
 * turns a second delivery into a skip.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionExecutionListener {

    private final ActionExecutor actionExecutor;
    private final JsonSupport json;

    @KafkaListener(topics = "${store-agent.dispatch.topic:store_agent_action_execute}",
            groupId = "${store-agent.dispatch.consumer-group:store-agent-action-executor}",
            autoStartup = "${store-agent.dispatch.consumer-enabled:true}")
    public void listenActionExecution(String message, Acknowledgment acknowledgment) {
        try {
            Map<String, Object> payload = json.toMap(message);
            Long actionId = PayloadValues.longValue(payload, "action_id");
            if (actionId == null) {
                log.warn("Ignore action dispatch without action_id: {}", message);
                return;
            }
            ActionResult result = actionExecutor.execute(actionId);
            log.debug("Action dispatch handled actionId={} success={} skipped={}", actionId, result.isSuccess(), result.isSkipped());
        } catch (Exception e) {
            log.error("Failed to handle action dispatch: {}", message, e);
        } finally {
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
        }
    }
}
