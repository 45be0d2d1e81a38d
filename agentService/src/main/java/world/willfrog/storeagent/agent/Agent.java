package world.willfrog.storeagent.agent;

import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.model.AgentType;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A pluggable proposal strategy.
 * <p>
 * {@link #run} only reads data and external signals and records intended changes as AgentAction rows;
 * it never performs the side effect itself. Execution is the job of the action handlers behind the approval gate.
 */
public interface Agent {

    String getSlug();

    String getName();

    String getDescription();

    AgentType getType();

    /**
     * Every key an agent reads from its {@link AgentConfig} must be declared here.
     */
    Map<String, Object> getDefaultConfig();

    Map<String, ConfigField> getConfigSchema();

    /**
     * Gate checked before a run is created: enablement, permission, required integrations.
     */
    boolean canRun(StoreAgent storeAgent);

    /**
     * Proposes actions for one store. Per-entity failures are recorded in the result and processing continues;
     * a setup failure throws and aborts the run.
     */
    AgentRunResult run(AgentRun run, StoreAgent storeAgent);

    /**
     * Interval between scheduled runs for this store's configuration.
     */
    Duration getCadence(StoreAgent storeAgent);

    default List<String> getSubscribedEvents() {
        return List.of();
    }

    /**
     * Decides whether a domain event warrants an event-triggered run. The run itself goes through the runner,
     * so it is audited and single-flight like any other.
     */
    default EventReaction handleEvent(String event, Map<String, Object> payload, StoreAgent storeAgent) {
        return EventReaction.ignore("no event handling");
    }
}
