package world.willfrog.storeagent.action;

import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.StoreAgent;

import java.util.Map;

/**
 * Performs one category of side effect for an AgentAction.
 * <p>
 * Handlers may assume they are invoked at most once per action; the executor guarantees it by claiming
 * the action row before calling {@link #execute}.
 */
public interface ActionHandler {

    String getType();

    String getDescription();

    /**
     * Action-specific approval heuristic. The store-level policy is applied on top by the approval policy.
     */
    default boolean requiresApproval(StoreAgent storeAgent, Map<String, Object> payload) {
        return false;
    }

    /**
     * Structural precondition; {@link #execute} is never called when this returns false.
     */
    boolean validatePayload(Map<String, Object> payload);

    /**
     * Performs the side effect. A successful result must carry the "before" state it replaced.
     * Throwing is equivalent to returning a failure.
     */
    ActionResult execute(AgentAction action, Map<String, Object> payload);

    default boolean supportsRollback() {
        return false;
    }

    /**
     * Best-effort compensation from the before values captured at execution.
     *
     * @return true when the compensation was applied
     */
    default boolean rollback(AgentAction action, Map<String, Object> payload, Map<String, Object> result) {
        return false;
    }
}
