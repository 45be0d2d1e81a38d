package world.willfrog.storeagent.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.config.StoreAgentProperties;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final JsonSupport json;
    private final StoreAgentProperties properties;

    public KafkaNotificationDispatcher(KafkaTemplate<String, String> kafkaTemplate,
                                       JsonSupport json,
                                       StoreAgentProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.json = json;
        this.properties = properties;
    }

    @Override
    public String dispatch(Long storeId, Map<String, Object> notification) {
        String reference = UUID.randomUUID().toString().replace("-", "");
        if (!properties.getNotification().isProducerEnabled()) {
            log.info("Notification producer disabled, skip publish storeId={} ref={}", storeId, reference);
            return reference;
        }
        Map<String, Object> message = new LinkedHashMap<>(notification);
        message.put("store_id", storeId);
        message.put("reference", reference);
        kafkaTemplate.send(properties.getNotification().getTopic(), String.valueOf(storeId), json.toJson(message));
        return reference;
    }
}
