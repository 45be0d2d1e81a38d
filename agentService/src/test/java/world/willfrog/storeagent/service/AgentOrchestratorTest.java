package world.willfrog.storeagent.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.agent.Agent;
import world.willfrog.storeagent.agent.EventReaction;
import world.willfrog.storeagent.config.StoreAgentProperties;
import world.willfrog.storeagent.dto.DispatchSummary;
import world.willfrog.storeagent.dto.RunOutcome;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.mapper.StoreAgentMapper;
import world.willfrog.storeagent.model.AgentType;
import world.willfrog.storeagent.model.PermissionLevel;
import world.willfrog.storeagent.model.TriggerType;
import world.willfrog.storeagent.registry.AgentRegistry;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentOrchestratorTest {

    @Mock
    private StoreAgentMapper storeAgentMapper;
    @Mock
    private AgentRunner runner;

    private ExecutorService pool;
    private AgentRegistry registry;
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        registry = new AgentRegistry();
        registry.registerAgent(agent("pricing", AgentType.BACKGROUND, List.of()));
        registry.registerAgent(agent("channel-sync", AgentType.BACKGROUND, List.of("inventory.changed")));
        registry.registerAgent(agent("new-item-researcher", AgentType.EVENT_TRIGGERED, List.of("product.created")));
        orchestrator = new AgentOrchestrator(registry, storeAgentMapper, runner, pool, new StoreAgentProperties());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void runScheduledAgents_shouldIsolateFailuresBetweenPairs() {
        StoreAgent healthy = storeAgent(1L, 1L, "pricing");
        StoreAgent broken = storeAgent(2L, 2L, "pricing");
        when(storeAgentMapper.listDue(any(OffsetDateTime.class), anyInt())).thenReturn(List.of(healthy, broken));
        when(runner.runFor(eq(healthy), eq(TriggerType.SCHEDULE), anyMap()))
                .thenReturn(RunOutcome.builder().storeId(1L).agentSlug("pricing").runId(10L)
                        .status(RunOutcome.COMPLETED).build());
        when(runner.runFor(eq(broken), eq(TriggerType.SCHEDULE), anyMap()))
                .thenThrow(new IllegalStateException("redis down"));

        DispatchSummary summary = orchestrator.runScheduledAgents();

        assertThat(summary.getConsidered()).isEqualTo(2);
        assertThat(summary.getCompleted()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getOutcomes())
                .filteredOn(outcome -> outcome.getStoreId().equals(2L))
                .extracting(RunOutcome::getMessage)
                .containsExactly("redis down");
    }

    @Test
    void runScheduledAgents_shouldPushEventTriggeredAgentsOutOfTheDueList() {
        StoreAgent researcher = storeAgent(3L, 1L, "new-item-researcher");
        when(storeAgentMapper.listDue(any(OffsetDateTime.class), anyInt())).thenReturn(List.of(researcher));

        DispatchSummary summary = orchestrator.runScheduledAgents();

        assertThat(summary.getCompleted()).isZero();
        verify(runner, never()).runFor(any(), any(), anyMap());
        ArgumentCaptor<OffsetDateTime> next = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(storeAgentMapper).markRan(eq(3L), any(), next.capture());
        assertThat(next.getValue()).isAfter(OffsetDateTime.now().plus(Duration.ofHours(23)));
    }

    @Test
    void runScheduledAgents_shouldCountLockedAsSkipped() {
        StoreAgent pair = storeAgent(4L, 1L, "pricing");
        when(storeAgentMapper.listDue(any(OffsetDateTime.class), anyInt())).thenReturn(List.of(pair));
        when(runner.runFor(eq(pair), eq(TriggerType.SCHEDULE), anyMap()))
                .thenReturn(RunOutcome.notRun(1L, "pricing", RunOutcome.LOCKED, "in progress"));

        DispatchSummary summary = orchestrator.runScheduledAgents();

        assertThat(summary.getSkipped()).isEqualTo(1);
    }

    @SuppressWarnings("unchecked")
    @Test
    void dispatchEvent_shouldRunOnlySubscribersThatRequestARun() {
        StoreAgent sync = storeAgent(5L, 7L, "channel-sync");
        StoreAgent pricing = storeAgent(6L, 7L, "pricing");
        when(storeAgentMapper.listEnabledByStore(7L)).thenReturn(List.of(sync, pricing));
        Agent channelSync = registry.getAgent("channel-sync");
        when(channelSync.canRun(sync)).thenReturn(true);
        when(channelSync.handleEvent(eq("inventory.changed"), anyMap(), eq(sync)))
                .thenReturn(EventReaction.run(Map.of("product_ids", List.of(42))));
        when(runner.runFor(eq(sync), eq(TriggerType.EVENT), anyMap()))
                .thenReturn(RunOutcome.builder().storeId(7L).agentSlug("channel-sync").runId(11L)
                        .status(RunOutcome.COMPLETED).build());

        DispatchSummary summary = orchestrator.dispatchEvent(7L, "inventory.changed", Map.of("product_id", 42));

        assertThat(summary.getConsidered()).isEqualTo(1);
        assertThat(summary.getCompleted()).isEqualTo(1);
        ArgumentCaptor<Map<String, Object>> triggerData = ArgumentCaptor.forClass(Map.class);
        verify(runner).runFor(eq(sync), eq(TriggerType.EVENT), triggerData.capture());
        assertThat(triggerData.getValue())
                .containsEntry("event", "inventory.changed")
                .containsEntry("scope", Map.of("product_ids", List.of(42)));
        verify(runner, never()).runFor(eq(pricing), any(), anyMap());
    }

    @Test
    void dispatchEvent_whenAgentIgnoresEvent_shouldSkipWithoutRun() {
        StoreAgent sync = storeAgent(5L, 7L, "channel-sync");
        when(storeAgentMapper.listEnabledByStore(7L)).thenReturn(List.of(sync));
        Agent channelSync = registry.getAgent("channel-sync");
        when(channelSync.canRun(sync)).thenReturn(true);
        when(channelSync.handleEvent(eq("inventory.changed"), anyMap(), eq(sync)))
                .thenReturn(EventReaction.ignore("no listing for product"));

        DispatchSummary summary = orchestrator.dispatchEvent(7L, "inventory.changed", null);

        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(summary.getOutcomes()).extracting(RunOutcome::getMessage).containsExactly("no listing for product");
        verify(runner, never()).runFor(any(), any(), anyMap());
    }

    private static Agent agent(String slug, AgentType type, List<String> events) {
        Agent agent = mock(Agent.class);
        lenient().when(agent.getSlug()).thenReturn(slug);
        lenient().when(agent.getName()).thenReturn(slug);
        lenient().when(agent.getType()).thenReturn(type);
        lenient().when(agent.getDefaultConfig()).thenReturn(Map.of());
        lenient().when(agent.getConfigSchema()).thenReturn(Map.of());
        lenient().when(agent.getSubscribedEvents()).thenReturn(events);
        return agent;
    }

    private static StoreAgent storeAgent(Long id, Long storeId, String slug) {
        StoreAgent storeAgent = new StoreAgent();
        storeAgent.setId(id);
        storeAgent.setStoreId(storeId);
        storeAgent.setAgentSlug(slug);
        storeAgent.setEnabled(true);
        storeAgent.setPermissionLevel(PermissionLevel.AUTO);
        return storeAgent;
    }
}
