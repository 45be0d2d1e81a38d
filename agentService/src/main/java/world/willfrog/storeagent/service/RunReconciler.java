package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.config.StoreAgentProperties;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.mapper.AgentActionMapper;
import world.willfrog.storeagent.mapper.AgentRunMapper;
import world.willfrog.storeagent.model.AgentRunStatus;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Sweeps rows left non-terminal by a crash or a timeout.
 * <ul>
 *   <li>RUNNING runs older than {@code run.stale-after-minutes} become FAILED.</li>
 *   <li>EXECUTING actions older than {@code action.stale-executing-minutes} become FAILED. Whether the effect
 *   happened is unknown, so they are never re-executed automatically.</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunReconciler {

    private final AgentRunMapper runMapper;
    private final AgentActionMapper actionMapper;
    private final StoreAgentProperties properties;

    @Scheduled(cron = "${store-agent.run.reconcile-cron:30 */5 * * * *}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Reconciliation sweep failed", e);
        }
    }

    /**
     * @return number of runs and actions failed by this sweep
     */
    public int sweep() {
        OffsetDateTime now = OffsetDateTime.now();
        long staleMinutes = properties.getRun().getStaleAfterMinutes();
        List<AgentRun> stale = runMapper.listStaleRunning(now.minusMinutes(staleMinutes),
                properties.getRun().getReconcileBatchSize());
        int runs = 0;
        for (AgentRun run : stale) {
            String message = "abandoned: exceeded " + staleMinutes + " minutes";
            if (runMapper.finish(run.getId(), AgentRunStatus.FAILED, null, message, now) > 0) {
                runs++;
                log.warn("Reconciled abandoned run runId={} storeId={} agent={} startedAt={}",
                        run.getId(), run.getStoreId(), run.getAgentSlug(), run.getStartedAt());
            }
        }

        long executingMinutes = properties.getAction().getStaleExecutingMinutes();
        int actions = actionMapper.failStaleExecuting(now.minusMinutes(executingMinutes),
                "execution outcome unknown: executing longer than " + executingMinutes + " minutes", now);
        if (runs > 0 || actions > 0) {
            log.info("Reconciliation sweep done runs={} actions={}", runs, actions);
        }
        return runs + actions;
    }
}
