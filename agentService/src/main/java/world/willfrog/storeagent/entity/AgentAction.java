package world.willfrog.storeagent.entity;

import lombok.Data;
import world.willfrog.storeagent.model.AgentActionStatus;

import java.time.OffsetDateTime;

/**
 * One proposed side effect. The target is polymorphic: {@code targetType} names the entity kind
 * (product, platform_listing, store_marketplace, customer) and {@code targetId} its key.
 */
@Data
public class AgentAction {
    private Long id;
    private Long agentRunId;
    private Long storeId;
    private String agentSlug;
    private String actionType;
    private String targetType;
    private String targetId;
    private AgentActionStatus status;
    private Boolean requiresApproval;

    // JSON strings
    private String payload;
    private String result;

    private String errorMessage;
    private Long approvedBy;
    private OffsetDateTime approvedAt;
    private OffsetDateTime executedAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
