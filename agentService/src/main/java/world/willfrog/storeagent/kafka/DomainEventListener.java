package world.willfrog.storeagent.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.service.AgentOrchestrator;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.Map;

/**
 * Consumes {@code {store_id, event, payload}} domain events and offers them to the store's agents.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DomainEventListener {

    private final AgentOrchestrator orchestrator;
    private final JsonSupport json;

    @KafkaListener(topics = "${store-agent.events.topic:store_domain_event}",
            groupId = "${store-agent.events.consumer-group:store-agent-event-dispatcher}",
            autoStartup = "${store-agent.events.consumer-enabled:true}")
    public void listenDomainEvent(String message, Acknowledgment acknowledgment) {
        try {
            Map<String, Object> envelope = json.toMap(message);
            Long storeId = PayloadValues.longValue(envelope, "store_id");
            String event = PayloadValues.string(envelope, "event");
            if (storeId == null || event == null) {
                log.warn("Ignore domain event without store_id or event: {}", message);
                return;
            }
            orchestrator.dispatchEvent(storeId, event, PayloadValues.map(envelope, "payload"));
        } catch (Exception e) {
            log.error("Failed to handle domain event: {}", message, e);
        } finally {
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
        }
    }
}
