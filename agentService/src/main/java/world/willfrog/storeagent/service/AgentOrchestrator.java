package world.willfrog.storeagent.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.agent.Agent;
import world.willfrog.storeagent.agent.EventReaction;
import world.willfrog.storeagent.config.StoreAgentProperties;
import world.willfrog.storeagent.dto.DispatchSummary;
import world.willfrog.storeagent.dto.RunOutcome;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.mapper.StoreAgentMapper;
import world.willfrog.storeagent.model.AgentType;
import world.willfrog.storeagent.model.TriggerType;
import world.willfrog.storeagent.registry.AgentRegistry;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Entry point for the periodic tick and the event bus. Fans work out over independent (store, agent) pairs;
 * a failure in one pair is recorded in its outcome and never reaches the others.
 */
@Slf4j
@Service
public class AgentOrchestrator {

    private final AgentRegistry registry;
    private final StoreAgentMapper storeAgentMapper;
    private final AgentRunner runner;
    private final ExecutorService agentRunExecutor;
    private final StoreAgentProperties properties;

    public AgentOrchestrator(AgentRegistry registry,
                             StoreAgentMapper storeAgentMapper,
                             AgentRunner runner,
                             @Qualifier("agentRunExecutor") ExecutorService agentRunExecutor,
                             StoreAgentProperties properties) {
        this.registry = registry;
        this.storeAgentMapper = storeAgentMapper;
        this.runner = runner;
        this.agentRunExecutor = agentRunExecutor;
        this.properties = properties;
    }

    /**
     * Runs every enabled (store, agent) pair whose next run is due. Event-triggered agents only run on events.
     */
    public DispatchSummary runScheduledAgents() {
        OffsetDateTime now = OffsetDateTime.now();
        List<StoreAgent> due = storeAgentMapper.listDue(now, properties.getScheduler().getBatchSize());
        List<CompletableFuture<RunOutcome>> futures = new ArrayList<>();
        for (StoreAgent storeAgent : due) {
            Optional<Agent> agent = registry.findAgent(storeAgent.getAgentSlug());
            if (agent.isPresent() && agent.get().getType() == AgentType.EVENT_TRIGGERED) {
                // keep it out of the due list; events run it regardless of next_run_at
                storeAgentMapper.markRan(storeAgent.getId(), storeAgent.getLastRunAt(), now.plus(Duration.ofDays(1)));
                continue;
            }
            futures.add(submit(storeAgent, () -> runner.runFor(storeAgent, TriggerType.SCHEDULE, Map.of())));
        }
        DispatchSummary summary = collect(futures);
        summary.setConsidered(due.size());
        log.info("Scheduled tick done due={} completed={} failed={} skipped={}",
                due.size(), summary.getCompleted(), summary.getFailed(), summary.getSkipped());
        return summary;
    }

    /**
     * Offers a domain event to every enabled agent of the store that subscribes to it.
     */
    public DispatchSummary dispatchEvent(Long storeId, String event, Map<String, Object> payload) {
        Map<String, Object> eventPayload = payload == null ? Map.of() : payload;
        List<StoreAgent> storeAgents = storeAgentMapper.listEnabledByStore(storeId);
        List<CompletableFuture<RunOutcome>> futures = new ArrayList<>();
        int considered = 0;
        for (StoreAgent storeAgent : storeAgents) {
            Optional<Agent> resolved = registry.findAgent(storeAgent.getAgentSlug());
            if (resolved.isEmpty() || !resolved.get().getSubscribedEvents().contains(event)) {
                continue;
            }
            considered++;
            Agent agent = resolved.get();
            futures.add(submit(storeAgent, () -> react(agent, storeAgent, event, eventPayload)));
        }
        DispatchSummary summary = collect(futures);
        summary.setConsidered(considered);
        log.info("Event dispatched storeId={} event={} subscribers={} runs={} failed={}",
                storeId, event, considered, summary.getCompleted(), summary.getFailed());
        return summary;
    }

    private RunOutcome react(Agent agent, StoreAgent storeAgent, String event, Map<String, Object> payload) {
        if (!agent.canRun(storeAgent)) {
            return RunOutcome.notRun(storeAgent.getStoreId(), agent.getSlug(), RunOutcome.SKIPPED, "agent cannot run for this store");
        }
        EventReaction reaction = agent.handleEvent(event, payload, storeAgent);
        if (reaction == null || !reaction.isRunRequested()) {
            String reason = reaction == null ? "no reaction" : reaction.getReason();
            log.debug("Event ignored storeId={} agent={} event={} reason={}", storeAgent.getStoreId(), agent.getSlug(), event, reason);
            return RunOutcome.notRun(storeAgent.getStoreId(), agent.getSlug(), RunOutcome.SKIPPED, reason);
        }
        Map<String, Object> triggerData = new LinkedHashMap<>();
        triggerData.put("event", event);
        triggerData.put("payload", payload);
        triggerData.put("scope", reaction.getScope());
        return runner.runFor(storeAgent, TriggerType.EVENT, triggerData);
    }

    private CompletableFuture<RunOutcome> submit(StoreAgent storeAgent, Supplier<RunOutcome> work) {
        return CompletableFuture.supplyAsync(work, agentRunExecutor)
                .exceptionally(e -> {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("Agent dispatch failed storeId={} agent={}", storeAgent.getStoreId(), storeAgent.getAgentSlug(), cause);
                    String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
                    return RunOutcome.notRun(storeAgent.getStoreId(), storeAgent.getAgentSlug(), RunOutcome.FAILED, message);
                });
    }

    private DispatchSummary collect(List<CompletableFuture<RunOutcome>> futures) {
        List<RunOutcome> outcomes = new ArrayList<>();
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        for (CompletableFuture<RunOutcome> future : futures) {
            RunOutcome outcome = future.join();
            outcomes.add(outcome);
            switch (outcome.getStatus()) {
                case RunOutcome.COMPLETED -> completed++;
                case RunOutcome.FAILED -> failed++;
                default -> skipped++;
            }
        }
        return DispatchSummary.builder()
                .completed(completed)
                .failed(failed)
                .skipped(skipped)
                .outcomes(outcomes)
                .build();
    }
}
