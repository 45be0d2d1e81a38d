package world.willfrog.storeagent.action;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.mapper.ProductMapper;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarkdownScheduleActionTest {

    @Mock
    private ProductMapper productMapper;

    private MarkdownScheduleAction handler;

    @BeforeEach
    void setUp() {
        handler = new MarkdownScheduleAction(productMapper);
    }

    @Test
    void requiresApproval_shouldStartAtDeepDiscount() {
        assertThat(handler.requiresApproval(null, Map.of("discount_percent", 30))).isTrue();
        assertThat(handler.requiresApproval(null, Map.of("discount_percent", 40))).isTrue();
        assertThat(handler.requiresApproval(null, Map.of("discount_percent", 20))).isFalse();
    }

    @Test
    void validatePayload_shouldNeedBeforePositivePriceAndDiscount() {
        Map<String, Object> valid = Map.of(
                "before", Map.of("price", 80),
                "after", Map.of("price", 48),
                "discount_percent", 40);
        assertThat(handler.validatePayload(valid)).isTrue();
        assertThat(handler.validatePayload(Map.of("after", Map.of("price", 48), "discount_percent", 40))).isFalse();
        assertThat(handler.validatePayload(Map.of(
                "before", Map.of("price", 80), "after", Map.of("price", 0), "discount_percent", 40))).isFalse();
    }

    @Test
    void execute_shouldApplyMarkdownAndKeepOldPrice() {
        Product product = new Product();
        product.setId(12L);
        product.setPrice(new BigDecimal("80.00"));
        when(productMapper.findById(12L)).thenReturn(product);

        ActionResult result = handler.execute(action(), Map.of(
                "after", Map.of("price", new BigDecimal("48.00")),
                "discount_percent", 40,
                "tier", "dead_stock"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Marked down 40% to $48.00");
        assertThat(result.getBefore()).containsEntry("price", new BigDecimal("80.00"));
        assertThat(result.getData()).containsEntry("tier", "dead_stock");
        verify(productMapper).updatePrice(12L, new BigDecimal("48.00"));
    }

    @Test
    void execute_whenProductGone_shouldFail() {
        when(productMapper.findById(12L)).thenReturn(null);

        ActionResult result = handler.execute(action(), Map.of("after", Map.of("price", 48), "discount_percent", 40));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("product not found: 12");
        verify(productMapper, never()).updatePrice(any(), any());
    }

    @Test
    void rollback_withoutBeforePrice_shouldNotTouchProduct() {
        assertThat(handler.supportsRollback()).isTrue();
        assertThat(handler.rollback(action(), Map.of(), Map.of("before", Map.of()))).isFalse();
        verify(productMapper, never()).updatePrice(any(), any());
    }

    private static AgentAction action() {
        AgentAction action = new AgentAction();
        action.setId(2L);
        action.setStoreId(1L);
        action.setActionType(ActionTypes.MARKDOWN_SCHEDULE);
        action.setTargetId("12");
        return action;
    }
}
