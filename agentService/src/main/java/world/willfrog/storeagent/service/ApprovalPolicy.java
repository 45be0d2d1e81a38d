package world.willfrog.storeagent.service;

import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionHandler;
import world.willfrog.storeagent.entity.StoreAgent;

import java.util.Map;

/**
 * The approval gate. Evaluated once per action, when it is proposed; the result is persisted as
 * {@code requires_approval} and the executor's claim statement enforces it.
 */
@Component
public class ApprovalPolicy {

    /**
     * @param agentHint the proposing agent's own threshold check (e.g. price above a $ limit)
     */
    public boolean requiresApproval(StoreAgent storeAgent,
                                    ActionHandler handler,
                                    Map<String, Object> payload,
                                    boolean agentHint) {
        if (storeAgent != null && storeAgent.requiresApproval()) {
            return true;
        }
        if (agentHint) {
            return true;
        }
        return handler.requiresApproval(storeAgent, payload == null ? Map.of() : payload);
    }
}
