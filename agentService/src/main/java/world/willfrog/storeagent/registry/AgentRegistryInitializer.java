package world.willfrog.storeagent.registry;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionHandler;
import world.willfrog.storeagent.agent.Agent;

import java.util.List;

/**
 * Registers every agent and action bean at startup; a bad or duplicate registration stops the context.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentRegistryInitializer {

    private final AgentRegistry registry;
    private final List<Agent> agents;
    private final List<ActionHandler> actions;

    @PostConstruct
    public void registerAll() {
        actions.forEach(registry::registerAction);
        agents.forEach(registry::registerAgent);
        log.info("Agent registry ready: agents={} actions={}", agents.size(), actions.size());
    }
}
