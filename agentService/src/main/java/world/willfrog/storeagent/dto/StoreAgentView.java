package world.willfrog.storeagent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import world.willfrog.storeagent.agent.ConfigField;
import world.willfrog.storeagent.entity.AgentRun;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoreAgentView {
    private String slug;
    private String name;
    private String description;
    private String type;
    private boolean enabled;
    private String permissionLevel;
    private OffsetDateTime lastRunAt;
    private OffsetDateTime nextRunAt;
    private List<String> subscribedEvents;

    // detail only
    private Map<String, Object> config;
    private Map<String, Object> overrides;
    private Map<String, ConfigField> configSchema;
    private List<AgentRun> recentRuns;
}
