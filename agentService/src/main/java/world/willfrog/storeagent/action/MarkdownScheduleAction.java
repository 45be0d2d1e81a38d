package world.willfrog.storeagent.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.mapper.ProductMapper;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies a dead-stock markdown to a product's price.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarkdownScheduleAction implements ActionHandler {

    /** Discounts at or above this percentage always need a human. */
    static final BigDecimal DEEP_DISCOUNT_PERCENT = new BigDecimal("30");

    private final ProductMapper productMapper;

    @Override
    public String getType() {
        return ActionTypes.MARKDOWN_SCHEDULE;
    }

    @Override
    public String getDescription() {
        return "Mark down slow-moving inventory";
    }

    @Override
    public boolean requiresApproval(StoreAgent storeAgent, Map<String, Object> payload) {
        BigDecimal discount = PayloadValues.decimal(payload, "discount_percent");
        return discount != null && discount.compareTo(DEEP_DISCOUNT_PERCENT) >= 0;
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        BigDecimal discount = PayloadValues.decimal(payload, "discount_percent");
        BigDecimal after = PayloadValues.decimal(PayloadValues.map(payload, "after"), "price");
        return PayloadValues.has(payload, "before")
                && after != null && after.signum() > 0
                && discount != null && discount.signum() > 0;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long productId = Long.valueOf(action.getTargetId());
        Product product = productMapper.findById(productId);
        if (product == null) {
            return ActionResult.failure("product not found: " + productId);
        }
        BigDecimal newPrice = PayloadValues.decimal(PayloadValues.map(payload, "after"), "price");
        productMapper.updatePrice(productId, newPrice);

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("price", product.getPrice());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("product_id", productId);
        data.put("old_price", product.getPrice());
        data.put("new_price", newPrice);
        data.put("discount_percent", PayloadValues.decimal(payload, "discount_percent"));
        data.put("tier", payload.get("tier"));
        log.info("Markdown applied productId={} {} -> {} discount={}%", productId, product.getPrice(), newPrice,
                payload.get("discount_percent"));
        return ActionResult.success(String.format("Marked down %s%% to $%s", payload.get("discount_percent"), newPrice),
                before, data);
    }

    @Override
    public boolean supportsRollback() {
        return true;
    }

    @Override
    public boolean rollback(AgentAction action, Map<String, Object> payload, Map<String, Object> result) {
        BigDecimal oldPrice = PayloadValues.decimal(PayloadValues.map(result, "before"), "price");
        return oldPrice != null && productMapper.updatePrice(Long.valueOf(action.getTargetId()), oldPrice) > 0;
    }
}
