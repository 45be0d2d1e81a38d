package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.agent.Agent;
import world.willfrog.storeagent.agent.AgentRunResult;
import world.willfrog.storeagent.dto.RunOutcome;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.NotFoundException;
import world.willfrog.storeagent.mapper.AgentRunMapper;
import world.willfrog.storeagent.mapper.StoreAgentMapper;
import world.willfrog.storeagent.model.AgentRunStatus;
import world.willfrog.storeagent.model.TriggerType;
import world.willfrog.storeagent.registry.AgentRegistry;
import world.willfrog.storeagent.support.JsonSupport;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one agent for one store: gate, single-flight lock, audited run row, failure boundary, cadence
 * bookkeeping, then hand-off of auto-executable proposals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunner {

    private final AgentRegistry registry;
    private final AgentRunMapper runMapper;
    private final StoreAgentMapper storeAgentMapper;
    private final RunLock runLock;
    private final ActionDispatcher dispatcher;
    private final JsonSupport json;

    public RunOutcome runFor(StoreAgent storeAgent, TriggerType triggerType, Map<String, Object> triggerData) {
        Long storeId = storeAgent.getStoreId();
        String slug = storeAgent.getAgentSlug();
        Optional<Agent> resolved = registry.findAgent(slug);
        if (resolved.isPresent() && !resolved.get().canRun(storeAgent)) {
            log.info("Agent cannot run, skip storeId={} agent={}", storeId, slug);
            if (triggerType == TriggerType.SCHEDULE) {
                deferSchedule(storeAgent, resolved.get());
            }
            return RunOutcome.notRun(storeId, slug, RunOutcome.SKIPPED, "agent cannot run for this store");
        }

        Optional<String> token = runLock.tryAcquire(storeId, slug);
        if (token.isEmpty()) {
            log.info("Agent already running, skip storeId={} agent={} trigger={}", storeId, slug, triggerType);
            return RunOutcome.notRun(storeId, slug, RunOutcome.LOCKED, "a run of this agent is already in progress");
        }

        OffsetDateTime startedAt = OffsetDateTime.now();
        try {
            AgentRun run = start(storeAgent, triggerType, triggerData, startedAt);
            RunOutcome outcome = resolved.isPresent()
                    ? invoke(resolved.get(), run, storeAgent)
                    : unknownAgent(run, slug);
            dispatchProposals(run);
            return outcome;
        } finally {
            markRan(storeAgent, resolved.orElse(null), startedAt);
            runLock.release(storeId, slug, token.get());
        }
    }

    private AgentRun start(StoreAgent storeAgent, TriggerType triggerType, Map<String, Object> triggerData,
                           OffsetDateTime startedAt) {
        AgentRun run = new AgentRun();
        run.setStoreId(storeAgent.getStoreId());
        run.setStoreAgentId(storeAgent.getId());
        run.setAgentSlug(storeAgent.getAgentSlug());
        run.setTriggerType(triggerType);
        run.setStatus(AgentRunStatus.RUNNING);
        run.setTriggerData(triggerData == null || triggerData.isEmpty() ? null : json.toJson(triggerData));
        run.setStartedAt(startedAt);
        runMapper.insert(run);
        log.info("Agent run started runId={} storeId={} agent={} trigger={}",
                run.getId(), run.getStoreId(), run.getAgentSlug(), triggerType);
        return run;
    }

    private RunOutcome invoke(Agent agent, AgentRun run, StoreAgent storeAgent) {
        AgentRunResult result;
        try {
            result = agent.run(run, storeAgent);
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Agent run failed runId={} storeId={} agent={}", run.getId(), run.getStoreId(), agent.getSlug(), e);
            finish(run, AgentRunStatus.FAILED, null, message);
            return outcome(run, RunOutcome.FAILED, message, 0);
        }
        if (result == null) {
            finish(run, AgentRunStatus.FAILED, null, "agent returned no result");
            return outcome(run, RunOutcome.FAILED, "agent returned no result", 0);
        }
        String summary = json.toJson(result.toSummary());
        if (!result.isSuccess()) {
            finish(run, AgentRunStatus.FAILED, summary, result.getMessage());
            log.warn("Agent run reported failure runId={} agent={} message={}", run.getId(), agent.getSlug(), result.getMessage());
            return outcome(run, RunOutcome.FAILED, result.getMessage(), result.getActionsCreated());
        }
        finish(run, AgentRunStatus.COMPLETED, summary, null);
        log.info("Agent run completed runId={} agent={} actionsCreated={} skipped={}",
                run.getId(), agent.getSlug(), result.getActionsCreated(), result.isSkipped());
        return outcome(run, RunOutcome.COMPLETED, result.getMessage(), result.getActionsCreated());
    }

    /**
     * Proposals made before a failure remain valid, so they are dispatched for failed runs too.
     */
    private void dispatchProposals(AgentRun run) {
        try {
            dispatcher.dispatchRun(run.getStoreId(), run.getId());
        } catch (Exception e) {
            log.error("Dispatch auto actions failed runId={}", run.getId(), e);
        }
    }

    private RunOutcome unknownAgent(AgentRun run, String slug) {
        String message = NotFoundException.agent(slug).getMessage();
        log.error("Agent run failed, unknown slug runId={} agent={}", run.getId(), slug);
        finish(run, AgentRunStatus.FAILED, null, message);
        return outcome(run, RunOutcome.FAILED, message, 0);
    }

    private void finish(AgentRun run, AgentRunStatus status, String summary, String errorMessage) {
        int updated = runMapper.finish(run.getId(), status, summary,
                StringUtils.abbreviate(errorMessage, ActionExecutor.MAX_ERROR_LENGTH), OffsetDateTime.now());
        if (updated == 0) {
            log.warn("Run already terminal, keep reconciled status runId={} attempted={}", run.getId(), status);
        }
    }

    /**
     * Always advances the schedule, so a permanently failing agent is retried on its cadence instead of every tick.
     */
    private void markRan(StoreAgent storeAgent, Agent agent, OffsetDateTime ranAt) {
        try {
            storeAgentMapper.markRan(storeAgent.getId(), ranAt, ranAt.plus(cadenceOf(storeAgent, agent)));
        } catch (Exception e) {
            log.error("Mark store agent ran failed storeAgentId={}", storeAgent.getId(), e);
        }
    }

    /**
     * A pair that cannot run stays out of the due list for one cadence; last_run_at is left as it was.
     */
    private void deferSchedule(StoreAgent storeAgent, Agent agent) {
        OffsetDateTime nextRunAt = OffsetDateTime.now().plus(cadenceOf(storeAgent, agent));
        try {
            storeAgentMapper.markRan(storeAgent.getId(), storeAgent.getLastRunAt(), nextRunAt);
        } catch (Exception e) {
            log.error("Defer store agent schedule failed storeAgentId={}", storeAgent.getId(), e);
        }
    }

    private Duration cadenceOf(StoreAgent storeAgent, Agent agent) {
        if (agent == null) {
            return Duration.ofDays(1);
        }
        try {
            Duration cadence = agent.getCadence(storeAgent);
            return cadence == null ? Duration.ofDays(1) : cadence;
        } catch (Exception e) {
            log.warn("Cadence unavailable, use one day storeId={} agent={} error={}",
                    storeAgent.getStoreId(), storeAgent.getAgentSlug(), e.getMessage());
            return Duration.ofDays(1);
        }
    }

    private static RunOutcome outcome(AgentRun run, String status, String message, int actionsCreated) {
        return RunOutcome.builder()
                .storeId(run.getStoreId())
                .agentSlug(run.getAgentSlug())
                .runId(run.getId())
                .status(status)
                .message(message)
                .actionsCreated(actionsCreated)
                .build();
    }
}
