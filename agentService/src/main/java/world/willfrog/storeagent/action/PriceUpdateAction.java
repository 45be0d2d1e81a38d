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
 * Sets a product's base price.
 * <p>
 * Payload: {@code before.price}, {@code after.price}, optionally {@code approval_threshold} (prices above it
 * need approval) plus the market context the proposing agent recorded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceUpdateAction implements ActionHandler {

    private final ProductMapper productMapper;

    @Override
    public String getType() {
        return ActionTypes.PRICE_UPDATE;
    }

    @Override
    public String getDescription() {
        return "Update a product's base price";
    }

    @Override
    public boolean requiresApproval(StoreAgent storeAgent, Map<String, Object> payload) {
        BigDecimal threshold = PayloadValues.decimal(payload, "approval_threshold");
        BigDecimal price = PayloadValues.decimal(PayloadValues.map(payload, "after"), "price");
        return threshold != null && price != null && price.compareTo(threshold) > 0;
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        BigDecimal price = PayloadValues.decimal(PayloadValues.map(payload, "after"), "price");
        return price != null && price.signum() > 0;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long productId = Long.valueOf(action.getTargetId());
        Product product = productMapper.findById(productId);
        if (product == null) {
            return ActionResult.failure("product not found: " + productId);
        }
        BigDecimal oldPrice = product.getPrice();
        BigDecimal newPrice = PayloadValues.decimal(PayloadValues.map(payload, "after"), "price");
        if (productMapper.updatePrice(productId, newPrice) == 0) {
            return ActionResult.failure("product price not updated: " + productId);
        }

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("price", oldPrice);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("product_id", productId);
        data.put("old_price", oldPrice);
        data.put("new_price", newPrice);
        log.info("Price updated productId={} {} -> {}", productId, oldPrice, newPrice);
        return ActionResult.success(String.format("Price updated from $%s to $%s", oldPrice, newPrice), before, data);
    }

    @Override
    public boolean supportsRollback() {
        return true;
    }

    @Override
    public boolean rollback(AgentAction action, Map<String, Object> payload, Map<String, Object> result) {
        BigDecimal oldPrice = PayloadValues.decimal(PayloadValues.map(result, "before"), "price");
        if (oldPrice == null) {
            return false;
        }
        return productMapper.updatePrice(Long.valueOf(action.getTargetId()), oldPrice) > 0;
    }
}
