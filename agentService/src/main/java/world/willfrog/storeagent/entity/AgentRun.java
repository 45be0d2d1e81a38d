package world.willfrog.storeagent.entity;

import lombok.Data;
import world.willfrog.storeagent.model.AgentRunStatus;
import world.willfrog.storeagent.model.TriggerType;

import java.time.OffsetDateTime;

@Data
public class AgentRun {
    private Long id;
    private Long storeId;
    private Long storeAgentId;
    private String agentSlug;
    private TriggerType triggerType;
    private AgentRunStatus status;

    // JSON strings
    private String triggerData;
    private String summary;

    private String errorMessage;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime createdAt;
}
