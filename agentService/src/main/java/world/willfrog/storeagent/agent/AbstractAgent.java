package world.willfrog.storeagent.agent;

import org.apache.commons.lang3.StringUtils;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.StoreAgent;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared plumbing for agents: typed config, proposal persistence, trigger scope and cadence.
 */
public abstract class AbstractAgent implements Agent {

    protected static final String RUN_FREQUENCY = "run_frequency";

    protected final AgentSupport support;

    protected AbstractAgent(AgentSupport support) {
        this.support = support;
    }

    @Override
    public boolean canRun(StoreAgent storeAgent) {
        return storeAgent != null && storeAgent.isActive();
    }

    @Override
    public Duration getCadence(StoreAgent storeAgent) {
        if (!getDefaultConfig().containsKey(RUN_FREQUENCY)) {
            return Duration.ofDays(1);
        }
        return Cadences.of(config(storeAgent).getString(RUN_FREQUENCY));
    }

    protected AgentConfig config(StoreAgent storeAgent) {
        return support.getConfigResolver().resolve(this, storeAgent);
    }

    /**
     * @return true when a new action row was created, false when an open one already covers the target
     */
    protected boolean propose(AgentRun run, StoreAgent storeAgent, ProposedAction proposal) {
        return support.getProposalService().propose(run, storeAgent, proposal).isPresent();
    }

    /**
     * Scope handed over by an event reaction; empty for scheduled and manual runs.
     */
    protected Map<String, Object> triggerScope(AgentRun run) {
        if (run == null || StringUtils.isBlank(run.getTriggerData())) {
            return Map.of();
        }
        return PayloadValues.map(support.getJson().toMap(run.getTriggerData()), "scope");
    }

    protected static Map<String, Object> entityError(String entity, Object id, Exception e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put(entity, id);
        error.put("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        return error;
    }
}
