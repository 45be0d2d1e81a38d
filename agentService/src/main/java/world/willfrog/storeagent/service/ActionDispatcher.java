package world.willfrog.storeagent.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.config.StoreAgentProperties;
import world.willfrog.storeagent.mapper.AgentActionMapper;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands auto-executable actions to the executor once their run has finished.
 * <p>
 * inline mode submits to the local dispatch pool; kafka mode publishes {@code {action_id, store_id}} for
 * {@code ActionExecutionListener}. Either way the executor's claim keeps redelivery harmless.
 */
@Slf4j
@Service
public class ActionDispatcher {

    private final AgentActionMapper actionMapper;
    private final ActionExecutor actionExecutor;
    private final ExecutorService actionDispatchExecutor;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final StoreAgentProperties properties;
    private final JsonSupport json;

    public ActionDispatcher(AgentActionMapper actionMapper,
                            ActionExecutor actionExecutor,
                            @Qualifier("actionDispatchExecutor") ExecutorService actionDispatchExecutor,
                            KafkaTemplate<String, String> kafkaTemplate,
                            StoreAgentProperties properties,
                            JsonSupport json) {
        this.actionMapper = actionMapper;
        this.actionExecutor = actionExecutor;
        this.actionDispatchExecutor = actionDispatchExecutor;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.json = json;
    }

    /**
     * @return number of actions handed over
     */
    public int dispatchRun(Long storeId, Long runId) {
        List<Long> actionIds = actionMapper.listAutoExecutableIds(runId);
        if (actionIds.isEmpty()) {
            return 0;
        }
        int dispatched = 0;
        for (Long actionId : actionIds) {
            if (dispatch(storeId, actionId)) {
                dispatched++;
            }
        }
        log.info("Dispatched auto actions runId={} count={} mode={}", runId, dispatched, properties.getDispatch().getMode());
        return dispatched;
    }

    public boolean dispatch(Long storeId, Long actionId) {
        if (properties.isKafkaDispatch()) {
            return publish(storeId, actionId);
        }
        try {
            actionDispatchExecutor.submit(() -> {
                try {
                    actionExecutor.execute(actionId);
                } catch (Exception e) {
                    log.error("Inline action execution failed actionId={}", actionId, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            // stays PENDING and can be executed by a later approve or manual dispatch
            log.warn("Dispatch pool rejected action actionId={}", actionId);
            return false;
        }
    }

    private boolean publish(Long storeId, Long actionId) {
        if (!properties.getDispatch().isProducerEnabled()) {
            log.info("Action dispatch producer disabled, skip publish actionId={}", actionId);
            return false;
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("action_id", actionId);
        message.put("store_id", storeId);
        try {
            kafkaTemplate.send(properties.getDispatch().getTopic(), String.valueOf(actionId), json.toJson(message));
            return true;
        } catch (Exception e) {
            log.error("Publish action dispatch failed actionId={}", actionId, e);
            return false;
        }
    }
}
