package world.willfrog.storeagent.entity;

import lombok.Data;
import world.willfrog.storeagent.model.PermissionLevel;

import java.time.OffsetDateTime;

/**
 * Per-store enablement of an agent. Disabled rather than deleted to stop scheduling.
 */
@Data
public class StoreAgent {
    private Long id;
    private Long storeId;
    private String agentSlug;
    private Boolean enabled;
    private PermissionLevel permissionLevel;
    private String config; // JSON overrides
    private OffsetDateTime lastRunAt;
    private OffsetDateTime nextRunAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public boolean isActive() {
        return Boolean.TRUE.equals(enabled) && permissionLevel != PermissionLevel.BLOCK;
    }

    public boolean requiresApproval() {
        return permissionLevel == PermissionLevel.APPROVE;
    }
}
