package world.willfrog.storeagent.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.action.ActionHandler;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.NotFoundException;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.mapper.AgentActionMapper;
import world.willfrog.storeagent.model.AgentActionStatus;
import world.willfrog.storeagent.model.PermissionLevel;
import world.willfrog.storeagent.registry.AgentRegistry;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActionProposalServiceTest {

    @Mock
    private AgentActionMapper actionMapper;
    @Mock
    private ActionHandler handler;

    private ActionProposalService service;
    private AgentRun run;
    private StoreAgent storeAgent;

    @BeforeEach
    void setUp() {
        lenient().when(handler.getType()).thenReturn("markdown_schedule");
        lenient().when(handler.validatePayload(any())).thenReturn(true);
        AgentRegistry registry = new AgentRegistry();
        registry.registerAction(handler);
        service = new ActionProposalService(actionMapper, registry, new ApprovalPolicy(),
                new JsonSupport(new ObjectMapper()));

        run = new AgentRun();
        run.setId(500L);
        run.setStoreId(1L);
        run.setAgentSlug("dead-stock");
        storeAgent = new StoreAgent();
        storeAgent.setStoreId(1L);
        storeAgent.setEnabled(true);
        storeAgent.setPermissionLevel(PermissionLevel.AUTO);
    }

    @Test
    void propose_shouldPersistPendingActionWithEvaluatedApproval() {
        when(actionMapper.countOpenForTarget(1L, "markdown_schedule", "product", "42")).thenReturn(0);
        when(handler.requiresApproval(storeAgent, Map.of("discount_pct", 30))).thenReturn(false);

        Optional<AgentAction> created = service.propose(run, storeAgent, proposal(false));

        assertThat(created).isPresent();
        ArgumentCaptor<AgentAction> inserted = ArgumentCaptor.forClass(AgentAction.class);
        verify(actionMapper).insert(inserted.capture());
        AgentAction action = inserted.getValue();
        assertThat(action.getStatus()).isEqualTo(AgentActionStatus.PENDING);
        assertThat(action.getRequiresApproval()).isFalse();
        assertThat(action.getAgentRunId()).isEqualTo(500L);
        assertThat(action.getPayload()).isEqualTo("{\"discount_pct\":30}");
    }

    @Test
    void propose_whenTargetHasOpenAction_shouldNotDuplicate() {
        when(actionMapper.countOpenForTarget(1L, "markdown_schedule", "product", "42")).thenReturn(1);

        assertThat(service.propose(run, storeAgent, proposal(false))).isEmpty();
        verify(actionMapper, never()).insert(any());
    }

    @Test
    void propose_withApprovalHint_shouldRequireApproval() {
        when(actionMapper.countOpenForTarget(1L, "markdown_schedule", "product", "42")).thenReturn(0);

        AgentAction action = service.propose(run, storeAgent, proposal(true)).orElseThrow();

        assertThat(action.getRequiresApproval()).isTrue();
    }

    @Test
    void propose_withUnknownType_shouldFail() {
        ProposedAction unknown = ProposedAction.builder()
                .actionType("teleport").targetType("product").targetId("1").payload(Map.of()).build();

        assertThatThrownBy(() -> service.propose(run, storeAgent, unknown)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void propose_whenHandlerRejectsPayload_shouldFailBeforePersisting() {
        when(handler.validatePayload(Map.of("discount_pct", 30))).thenReturn(false);

        assertThatThrownBy(() -> service.propose(run, storeAgent, proposal(false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("invalid payload for markdown_schedule");
        verify(actionMapper, never()).countOpenForTarget(any(), any(), any(), any());
        verify(actionMapper, never()).insert(any());
    }

    private static ProposedAction proposal(boolean hint) {
        return ProposedAction.builder()
                .actionType("markdown_schedule")
                .targetType("product")
                .targetId("42")
                .payload(Map.of("discount_pct", 30))
                .approvalHint(hint)
                .build();
    }
}
