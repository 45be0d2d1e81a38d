package world.willfrog.storeagent.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;
import world.willfrog.storeagent.action.ActionResult;
import world.willfrog.storeagent.service.ActionExecutor;
import world.willfrog.storeagent.support.JsonSupport;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActionExecutionListenerTest {

    @Mock
    private ActionExecutor actionExecutor;
    @Mock
    private Acknowledgment acknowledgment;

    private ActionExecutionListener listener;

    @BeforeEach
    void setUp() {
        listener = new ActionExecutionListener(actionExecutor, new JsonSupport(new ObjectMapper()));
    }

    @Test
    void listenActionExecution_shouldExecuteById() {
        when(actionExecutor.execute(3L)).thenReturn(ActionResult.skipped("action 3 is already being handled"));

        listener.listenActionExecution("{\"action_id\":3,\"store_id\":7}", acknowledgment);

        verify(actionExecutor).execute(3L);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void listenActionExecution_withMalformedMessage_shouldAcknowledgeWithoutExecuting() {
        listener.listenActionExecution("not json", acknowledgment);

        verify(actionExecutor, never()).execute(anyLong());
        verify(acknowledgment).acknowledge();
    }
}
