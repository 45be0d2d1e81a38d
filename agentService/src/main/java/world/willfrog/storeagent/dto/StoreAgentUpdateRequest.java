package world.willfrog.storeagent.dto;

import lombok.Data;

import java.util.Map;

/**
 * Partial update of a store's agent settings; null fields are left unchanged.
 */
@Data
public class StoreAgentUpdateRequest {
    private Boolean enabled;
    /** auto, approve or block */
    private String permissionLevel;
    private Map<String, Object> config;
}
