package world.willfrog.storeagent.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.model.AgentRunStatus;
import world.willfrog.storeagent.model.PermissionLevel;
import world.willfrog.storeagent.model.TriggerType;
import world.willfrog.storeagent.service.ActionProposalService;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.Map;

/**
 * Shared builders for agent tests.
 */
final class AgentFixtures {

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final JsonSupport JSON = new JsonSupport(MAPPER);

    private AgentFixtures() {
    }

    static AgentSupport support(ActionProposalService proposalService) {
        return new AgentSupport(new AgentConfigResolver(MAPPER), proposalService, JSON);
    }

    static StoreAgent storeAgent(Long storeId, String slug, String configJson) {
        StoreAgent storeAgent = new StoreAgent();
        storeAgent.setId(100L);
        storeAgent.setStoreId(storeId);
        storeAgent.setAgentSlug(slug);
        storeAgent.setEnabled(true);
        storeAgent.setPermissionLevel(PermissionLevel.AUTO);
        storeAgent.setConfig(configJson);
        return storeAgent;
    }

    static AgentRun run(Long storeId, String slug) {
        AgentRun run = new AgentRun();
        run.setId(500L);
        run.setStoreId(storeId);
        run.setAgentSlug(slug);
        run.setStatus(AgentRunStatus.RUNNING);
        run.setTriggerType(TriggerType.SCHEDULE);
        return run;
    }

    static AgentRun eventRun(Long storeId, String slug, Map<String, Object> scope) {
        AgentRun run = run(storeId, slug);
        run.setTriggerType(TriggerType.EVENT);
        run.setTriggerData(JSON.toJson(Map.of("event", "test.event", "payload", Map.of(), "scope", scope)));
        return run;
    }
}
