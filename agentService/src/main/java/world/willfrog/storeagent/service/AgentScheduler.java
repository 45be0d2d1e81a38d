package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.config.StoreAgentProperties;

/**
 * The periodic tick. Cadence lives in {@code store_agent.next_run_at}, so the tick only has to be frequent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentScheduler {

    private final AgentOrchestrator orchestrator;
    private final StoreAgentProperties properties;

    @Scheduled(cron = "${store-agent.scheduler.tick-cron:0 * * * * *}")
    public void tick() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        try {
            orchestrator.runScheduledAgents();
        } catch (Exception e) {
            log.error("Scheduled tick failed", e);
        }
    }
}
