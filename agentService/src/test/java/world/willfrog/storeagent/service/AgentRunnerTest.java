package world.willfrog.storeagent.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.agent.Agent;
import world.willfrog.storeagent.agent.AgentRunResult;
import world.willfrog.storeagent.dto.RunOutcome;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.RunFailureException;
import world.willfrog.storeagent.mapper.AgentRunMapper;
import world.willfrog.storeagent.mapper.StoreAgentMapper;
import world.willfrog.storeagent.model.AgentRunStatus;
import world.willfrog.storeagent.model.AgentType;
import world.willfrog.storeagent.model.PermissionLevel;
import world.willfrog.storeagent.model.TriggerType;
import world.willfrog.storeagent.registry.AgentRegistry;
import world.willfrog.storeagent.support.JsonSupport;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentRunnerTest {

    @Mock
    private AgentRunMapper runMapper;
    @Mock
    private StoreAgentMapper storeAgentMapper;
    @Mock
    private RunLock runLock;
    @Mock
    private ActionDispatcher dispatcher;
    @Mock
    private Agent agent;

    private AgentRunner runner;
    private StoreAgent storeAgent;

    @BeforeEach
    void setUp() {
        lenient().when(agent.getSlug()).thenReturn("pricing");
        lenient().when(agent.getName()).thenReturn("Pricing");
        lenient().when(agent.getType()).thenReturn(AgentType.BACKGROUND);
        lenient().when(agent.getDefaultConfig()).thenReturn(Map.of());
        lenient().when(agent.getConfigSchema()).thenReturn(Map.of());
        AgentRegistry registry = new AgentRegistry();
        registry.registerAgent(agent);
        runner = new AgentRunner(registry, runMapper, storeAgentMapper, runLock, dispatcher,
                new JsonSupport(new ObjectMapper()));

        storeAgent = new StoreAgent();
        storeAgent.setId(100L);
        storeAgent.setStoreId(1L);
        storeAgent.setAgentSlug("pricing");
        storeAgent.setEnabled(true);
        storeAgent.setPermissionLevel(PermissionLevel.AUTO);

        lenient().doAnswer(invocation -> {
            AgentRun run = invocation.getArgument(0);
            run.setId(500L);
            return 1;
        }).when(runMapper).insert(any(AgentRun.class));
        lenient().when(runMapper.finish(anyLong(), any(), any(), any(), any())).thenReturn(1);
    }

    @Test
    void runFor_whenAgentCannotRun_shouldNotCreateRunButDeferNextSchedule() {
        OffsetDateTime lastRunAt = OffsetDateTime.now().minusDays(3);
        storeAgent.setLastRunAt(lastRunAt);
        when(agent.canRun(storeAgent)).thenReturn(false);
        when(agent.getCadence(storeAgent)).thenReturn(Duration.ofHours(6));

        OffsetDateTime before = OffsetDateTime.now();
        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.SCHEDULE, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.SKIPPED);
        assertThat(outcome.getRunId()).isNull();
        verify(runLock, never()).tryAcquire(anyLong(), anyString());
        verify(runMapper, never()).insert(any());

        ArgumentCaptor<OffsetDateTime> next = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(storeAgentMapper).markRan(eq(100L), eq(lastRunAt), next.capture());
        assertThat(next.getValue()).isAfterOrEqualTo(before.plusHours(6));
        assertThat(next.getValue()).isBefore(before.plusHours(7));
    }

    @Test
    void runFor_whenAgentCannotRunOnManualTrigger_shouldLeaveScheduleAlone() {
        when(agent.canRun(storeAgent)).thenReturn(false);

        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.MANUAL, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.SKIPPED);
        verify(storeAgentMapper, never()).markRan(anyLong(), any(), any());
    }

    @Test
    void runFor_whenPairLocked_shouldReportLockedWithoutRun() {
        when(agent.canRun(storeAgent)).thenReturn(true);
        when(runLock.tryAcquire(1L, "pricing")).thenReturn(Optional.empty());

        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.MANUAL, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.LOCKED);
        verify(runMapper, never()).insert(any());
        verify(storeAgentMapper, never()).markRan(anyLong(), any(), any());
        verify(runLock, never()).release(anyLong(), anyString(), anyString());
    }

    @Test
    void runFor_whenAgentSucceeds_shouldCompleteRunAndAdvanceSchedule() {
        when(agent.canRun(storeAgent)).thenReturn(true);
        when(runLock.tryAcquire(1L, "pricing")).thenReturn(Optional.of("token-1"));
        when(agent.run(any(AgentRun.class), eq(storeAgent)))
                .thenReturn(AgentRunResult.success(Map.of("products_analyzed", 3), 2));
        when(agent.getCadence(storeAgent)).thenReturn(Duration.ofDays(7));

        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.SCHEDULE, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.COMPLETED);
        assertThat(outcome.getRunId()).isEqualTo(500L);
        assertThat(outcome.getActionsCreated()).isEqualTo(2);

        ArgumentCaptor<AgentRun> inserted = ArgumentCaptor.forClass(AgentRun.class);
        verify(runMapper).insert(inserted.capture());
        assertThat(inserted.getValue().getStatus()).isEqualTo(AgentRunStatus.RUNNING);
        assertThat(inserted.getValue().getTriggerType()).isEqualTo(TriggerType.SCHEDULE);

        ArgumentCaptor<String> summary = ArgumentCaptor.forClass(String.class);
        verify(runMapper).finish(eq(500L), eq(AgentRunStatus.COMPLETED), summary.capture(), isNull(), any());
        assertThat(summary.getValue()).contains("\"actions_created\":2");

        ArgumentCaptor<OffsetDateTime> last = ArgumentCaptor.forClass(OffsetDateTime.class);
        ArgumentCaptor<OffsetDateTime> next = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(storeAgentMapper).markRan(eq(100L), last.capture(), next.capture());
        assertThat(Duration.between(last.getValue(), next.getValue())).isEqualTo(Duration.ofDays(7));

        verify(dispatcher).dispatchRun(1L, 500L);
        verify(runLock).release(1L, "pricing", "token-1");
    }

    @Test
    void runFor_whenAgentThrows_shouldFailRunAndStillReleaseLock() {
        when(agent.canRun(storeAgent)).thenReturn(true);
        when(runLock.tryAcquire(1L, "pricing")).thenReturn(Optional.of("token-2"));
        when(agent.run(any(AgentRun.class), eq(storeAgent))).thenThrow(new RunFailureException("inventory unavailable"));
        when(agent.getCadence(storeAgent)).thenReturn(Duration.ofDays(1));

        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.SCHEDULE, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.FAILED);
        assertThat(outcome.getMessage()).isEqualTo("inventory unavailable");
        verify(runMapper).finish(eq(500L), eq(AgentRunStatus.FAILED), isNull(), eq("inventory unavailable"), any());
        verify(storeAgentMapper).markRan(eq(100L), any(), any());
        verify(dispatcher).dispatchRun(1L, 500L);
        verify(runLock).release(1L, "pricing", "token-2");
    }

    @Test
    void runFor_whenAgentReportsFailure_shouldKeepSummaryOnFailedRun() {
        when(agent.canRun(storeAgent)).thenReturn(true);
        when(runLock.tryAcquire(1L, "pricing")).thenReturn(Optional.of("token-3"));
        when(agent.run(any(AgentRun.class), eq(storeAgent))).thenReturn(AgentRunResult.failure("no marketplace connected"));
        when(agent.getCadence(storeAgent)).thenReturn(Duration.ofDays(1));

        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.MANUAL, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.FAILED);
        verify(runMapper).finish(eq(500L), eq(AgentRunStatus.FAILED), anyString(), eq("no marketplace connected"), any());
    }

    @Test
    void runFor_whenSlugUnregistered_shouldRecordFailedRun() {
        storeAgent.setAgentSlug("ghost");
        when(runLock.tryAcquire(1L, "ghost")).thenReturn(Optional.of("token-4"));

        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.MANUAL, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.FAILED);
        assertThat(outcome.getMessage()).isEqualTo("agent not registered: ghost");
        verify(runMapper).finish(eq(500L), eq(AgentRunStatus.FAILED), isNull(), eq("agent not registered: ghost"), any());
        verify(storeAgentMapper).markRan(eq(100L), any(), any());
        verify(runLock).release(1L, "ghost", "token-4");
    }

    @Test
    void runFor_whenDispatchFails_shouldKeepCompletedOutcome() {
        when(agent.canRun(storeAgent)).thenReturn(true);
        when(runLock.tryAcquire(1L, "pricing")).thenReturn(Optional.of("token-5"));
        when(agent.run(any(AgentRun.class), eq(storeAgent))).thenReturn(AgentRunResult.success(Map.of(), 1));
        when(agent.getCadence(storeAgent)).thenReturn(Duration.ofDays(1));
        when(dispatcher.dispatchRun(1L, 500L)).thenThrow(new IllegalStateException("pool closed"));

        RunOutcome outcome = runner.runFor(storeAgent, TriggerType.SCHEDULE, Map.of());

        assertThat(outcome.getStatus()).isEqualTo(RunOutcome.COMPLETED);
        verify(runLock).release(1L, "pricing", "token-5");
    }

    @Test
    void runFor_withTriggerData_shouldPersistItAsJson() {
        when(agent.canRun(storeAgent)).thenReturn(true);
        when(runLock.tryAcquire(1L, "pricing")).thenReturn(Optional.of("token-6"));
        when(agent.run(any(AgentRun.class), eq(storeAgent))).thenReturn(AgentRunResult.skipped("nothing to do"));
        when(agent.getCadence(storeAgent)).thenReturn(Duration.ofDays(1));

        runner.runFor(storeAgent, TriggerType.EVENT, Map.of("event", "order.created"));

        ArgumentCaptor<AgentRun> inserted = ArgumentCaptor.forClass(AgentRun.class);
        verify(runMapper).insert(inserted.capture());
        assertThat(inserted.getValue().getTriggerData()).isEqualTo("{\"event\":\"order.created\"}");
    }
}
