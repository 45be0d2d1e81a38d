package world.willfrog.storeagent.registry;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionHandler;
import world.willfrog.storeagent.agent.Agent;
import world.willfrog.storeagent.exception.ConfigurationException;
import world.willfrog.storeagent.exception.NotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Slug -> agent and type -> action handler lookup, filled once at boot.
 * <p>
 * Registration validates the implementation and rejects duplicates; lookups of unknown keys fail with
 * {@link NotFoundException}.
 */
@Slf4j
@Component
public class AgentRegistry {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, ActionHandler> actions = new ConcurrentHashMap<>();

    public void registerAgent(Agent agent) {
        if (agent == null) {
            throw new ConfigurationException("agent implementation is null");
        }
        String slug = agent.getSlug();
        if (StringUtils.isBlank(slug)) {
            throw new ConfigurationException("agent " + agent.getClass().getSimpleName() + " has no slug");
        }
        if (StringUtils.isBlank(agent.getName()) || agent.getType() == null) {
            throw new ConfigurationException("agent " + slug + " must declare a name and a type");
        }
        Map<String, Object> defaults = agent.getDefaultConfig();
        if (defaults == null || agent.getConfigSchema() == null) {
            throw new ConfigurationException("agent " + slug + " must declare default config and schema");
        }
        for (String key : agent.getConfigSchema().keySet()) {
            if (!defaults.containsKey(key)) {
                throw new ConfigurationException(String.format("agent %s schema key %s has no default", slug, key));
            }
        }
        Agent existing = agents.putIfAbsent(slug, agent);
        if (existing != null) {
            throw new ConfigurationException(String.format("duplicate agent slug %s: %s and %s",
                    slug, existing.getClass().getSimpleName(), agent.getClass().getSimpleName()));
        }
        log.info("Registered agent slug={} type={}", slug, agent.getType());
    }

    public void registerAction(ActionHandler handler) {
        if (handler == null) {
            throw new ConfigurationException("action implementation is null");
        }
        String type = handler.getType();
        if (StringUtils.isBlank(type)) {
            throw new ConfigurationException("action " + handler.getClass().getSimpleName() + " has no type");
        }
        ActionHandler existing = actions.putIfAbsent(type, handler);
        if (existing != null) {
            throw new ConfigurationException(String.format("duplicate action type %s: %s and %s",
                    type, existing.getClass().getSimpleName(), handler.getClass().getSimpleName()));
        }
        log.info("Registered action type={} rollback={}", type, handler.supportsRollback());
    }

    public Agent getAgent(String slug) {
        Agent agent = slug == null ? null : agents.get(slug);
        if (agent == null) {
            throw NotFoundException.agent(slug);
        }
        return agent;
    }

    public Optional<Agent> findAgent(String slug) {
        return slug == null ? Optional.empty() : Optional.ofNullable(agents.get(slug));
    }

    public ActionHandler getAction(String type) {
        ActionHandler handler = type == null ? null : actions.get(type);
        if (handler == null) {
            throw NotFoundException.actionType(type);
        }
        return handler;
    }

    public Optional<ActionHandler> findAction(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(actions.get(type));
    }

    public Collection<Agent> agents() {
        return List.copyOf(agents.values());
    }

    public List<AgentDescriptor> listAgents() {
        List<AgentDescriptor> descriptors = new ArrayList<>();
        for (Agent agent : agents.values()) {
            descriptors.add(AgentDescriptor.builder()
                    .slug(agent.getSlug())
                    .name(agent.getName())
                    .description(agent.getDescription())
                    .type(agent.getType())
                    .defaultConfig(agent.getDefaultConfig())
                    .configSchema(agent.getConfigSchema())
                    .subscribedEvents(agent.getSubscribedEvents())
                    .build());
        }
        descriptors.sort(Comparator.comparing(AgentDescriptor::getName));
        return descriptors;
    }
}
