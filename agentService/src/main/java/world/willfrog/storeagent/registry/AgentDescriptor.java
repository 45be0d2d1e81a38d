package world.willfrog.storeagent.registry;

import lombok.Builder;
import lombok.Data;
import world.willfrog.storeagent.agent.ConfigField;
import world.willfrog.storeagent.model.AgentType;

import java.util.List;
import java.util.Map;

/**
 * What settings screens need to render an agent; the registry never renders anything itself.
 */
@Data
@Builder
public class AgentDescriptor {
    private String slug;
    private String name;
    private String description;
    private AgentType type;
    private Map<String, Object> defaultConfig;
    private Map<String, ConfigField> configSchema;
    private List<String> subscribedEvents;
}
