package world.willfrog.storeagent.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.common.dto.ResponseCode;
import world.willfrog.storeagent.common.dto.ResponseWrapper;
import world.willfrog.storeagent.dto.ActionDecision;
import world.willfrog.storeagent.dto.ActionListResponse;
import world.willfrog.storeagent.dto.BulkActionRequest;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.handler.GlobalExceptionHandler;
import world.willfrog.storeagent.service.ActionExecutor;
import world.willfrog.storeagent.service.AgentActivityService;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentActionControllerTest {

    @Mock
    private AgentActivityService activityService;
    @Mock
    private ActionExecutor actionExecutor;

    private AgentActionController controller;

    @BeforeEach
    void setUp() {
        controller = new AgentActionController(activityService, actionExecutor);
    }

    @Test
    void list_shouldWrapActivityResult() {
        ActionListResponse listing = ActionListResponse.builder()
                .items(List.of()).counts(Map.of("pending", 0)).limit(20).offset(0).build();
        when(activityService.listActions(1L, "pending", 20, 0)).thenReturn(listing);

        ResponseWrapper<ActionListResponse> response = controller.list(1L, "pending", 20, 0);

        assertTrue(response.isSuccess());
        assertSame(listing, response.getData());
    }

    @Test
    void approve_shouldPassUserAndExecuteFlag() {
        ActionDecision decision = ActionDecision.builder().actionId(5L).status("approved").applied(true).build();
        when(actionExecutor.approve(1L, 5L, 42L, false)).thenReturn(decision);

        ResponseWrapper<ActionDecision> response = controller.approve(1L, 42L, 5L, false);

        assertEquals("approved", response.getData().getStatus());
    }

    @Test
    void bulkReject_shouldForwardIds() {
        BulkActionRequest request = new BulkActionRequest();
        request.setActionIds(List.of(5L, 6L));
        when(actionExecutor.bulkReject(1L, List.of(5L, 6L), 42L)).thenReturn(List.of());

        controller.bulkReject(1L, 42L, request);

        verify(actionExecutor).bulkReject(1L, List.of(5L, 6L), 42L);
    }

    @Test
    void reject_whenNotPending_shouldMapToParamError() {
        when(actionExecutor.reject(1L, 5L, 42L)).thenThrow(new ValidationException("action 5 is executed, not pending"));

        ValidationException error = assertThrows(ValidationException.class, () -> controller.reject(1L, 42L, 5L));
        ResponseWrapper<Void> response = new GlobalExceptionHandler().handleBizException(error);

        assertFalse(response.isSuccess());
        assertEquals(ResponseCode.PARAM_ERROR.getCode(), response.getCode());
        assertEquals("action 5 is executed, not pending", response.getMessage());
    }
}
