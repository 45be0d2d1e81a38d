package world.willfrog.storeagent.action;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * What an agent wants done; turned into a PENDING AgentAction by the proposal service.
 */
@Getter
@Builder
public class ProposedAction {
    private final String actionType;
    private final String targetType;
    private final String targetId;
    private final Map<String, Object> payload;
    /** Agent-level reason to force approval (e.g. value above a configured threshold). */
    private final boolean approvalHint;
}
