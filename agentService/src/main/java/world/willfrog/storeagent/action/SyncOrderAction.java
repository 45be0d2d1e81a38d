package world.willfrog.storeagent.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.PlatformOrder;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.mapper.PlatformOrderMapper;
import world.willfrog.storeagent.mapper.ProductMapper;
import world.willfrog.storeagent.support.JsonSupport;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports a marketplace order, or refreshes the statuses of one already imported.
 * <p>
 * A new order decrements local stock for every line item whose sku is known; rollback restores that
 * stock and removes the imported order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncOrderAction implements ActionHandler {

    private static final String CREATED = "created";
    private static final String UPDATED = "updated";

    private final PlatformOrderMapper orderMapper;
    private final ProductMapper productMapper;
    private final JsonSupport json;

    @Override
    public String getType() {
        return ActionTypes.SYNC_ORDER;
    }

    @Override
    public String getDescription() {
        return "Import or update a marketplace order";
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        Map<String, Object> order = PayloadValues.map(payload, "order_data");
        return PayloadValues.longValue(payload, "marketplace_id") != null
                && PayloadValues.string(order, "external_id") != null
                && PayloadValues.string(order, "status") != null
                && PayloadValues.decimal(order, "total") != null;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long marketplaceId = PayloadValues.longValue(payload, "marketplace_id");
        Map<String, Object> orderData = PayloadValues.map(payload, "order_data");
        String externalId = PayloadValues.string(orderData, "external_id");

        PlatformOrder existing = orderMapper.findByExternalId(marketplaceId, externalId);
        if (existing != null) {
            orderMapper.updateStatus(existing.getId(), PayloadValues.string(orderData, "status"),
                    PayloadValues.string(orderData, "fulfillment_status"), PayloadValues.string(orderData, "payment_status"));
            Map<String, Object> before = new LinkedHashMap<>();
            before.put("status", existing.getStatus());
            before.put("fulfillment_status", existing.getFulfillmentStatus());
            before.put("payment_status", existing.getPaymentStatus());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("action", UPDATED);
            data.put("platform_order_id", existing.getId());
            data.put("external_order_id", externalId);
            return ActionResult.success("Order " + externalId + " updated", before, data);
        }

        PlatformOrder order = toOrder(action.getStoreId(), marketplaceId, orderData);
        orderMapper.insert(order);
        List<Map<String, Object>> adjustments = new ArrayList<>();
        for (Map<String, Object> item : PayloadValues.mapList(orderData, "line_items")) {
            String sku = PayloadValues.string(item, "sku");
            Integer quantity = PayloadValues.integer(item, "quantity");
            if (sku == null || quantity == null || quantity <= 0) {
                continue;
            }
            Product product = productMapper.findBySku(action.getStoreId(), sku);
            if (product == null) {
                log.warn("Order line item sku not found storeId={} sku={} order={}", action.getStoreId(), sku, externalId);
                continue;
            }
            productMapper.adjustQuantity(product.getId(), -quantity);
            adjustments.add(Map.of("product_id", product.getId(), "sku", sku, "quantity", quantity));
        }

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("order_existed", false);
        before.put("inventory_adjustments", adjustments);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", CREATED);
        data.put("platform_order_id", order.getId());
        data.put("external_order_id", externalId);
        data.put("items_adjusted", adjustments.size());
        log.info("Order imported storeId={} marketplaceId={} externalId={} itemsAdjusted={}",
                action.getStoreId(), marketplaceId, externalId, adjustments.size());
        return ActionResult.success("Order " + externalId + " imported", before, data);
    }

    @Override
    public boolean supportsRollback() {
        return true;
    }

    @Override
    public boolean rollback(AgentAction action, Map<String, Object> payload, Map<String, Object> result) {
        Map<String, Object> data = PayloadValues.map(result, "data");
        if (!CREATED.equals(PayloadValues.string(data, "action"))) {
            return false;
        }
        for (Map<String, Object> adjustment : PayloadValues.mapList(PayloadValues.map(result, "before"), "inventory_adjustments")) {
            Long productId = PayloadValues.longValue(adjustment, "product_id");
            Integer quantity = PayloadValues.integer(adjustment, "quantity");
            if (productId != null && quantity != null) {
                productMapper.adjustQuantity(productId, quantity);
            }
        }
        Long orderId = PayloadValues.longValue(data, "platform_order_id");
        return orderId != null && orderMapper.deleteById(orderId) > 0;
    }

    private PlatformOrder toOrder(Long storeId, Long marketplaceId, Map<String, Object> data) {
        PlatformOrder order = new PlatformOrder();
        order.setStoreId(storeId);
        order.setMarketplaceId(marketplaceId);
        order.setExternalOrderId(PayloadValues.string(data, "external_id"));
        order.setExternalOrderNumber(PayloadValues.string(data, "order_number"));
        order.setStatus(PayloadValues.string(data, "status"));
        order.setFulfillmentStatus(PayloadValues.string(data, "fulfillment_status"));
        order.setPaymentStatus(PayloadValues.string(data, "payment_status"));
        order.setTotal(PayloadValues.decimal(data, "total"));
        order.setSubtotal(PayloadValues.decimal(data, "subtotal"));
        order.setShippingCost(PayloadValues.decimal(data, "shipping_cost"));
        order.setTax(PayloadValues.decimal(data, "tax"));
        order.setDiscount(PayloadValues.decimal(data, "discount"));
        order.setCurrency(PayloadValues.string(data, "currency"));
        order.setCustomerData(json.toJson(PayloadValues.map(data, "customer")));
        order.setShippingAddress(json.toJson(PayloadValues.map(data, "shipping_address")));
        order.setLineItems(json.toJson(PayloadValues.list(data, "line_items")));
        order.setOrderedAt(parseTime(PayloadValues.string(data, "ordered_at")));
        order.setLastSyncedAt(OffsetDateTime.now());
        return order;
    }

    private OffsetDateTime parseTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable order timestamp {}", value);
            return null;
        }
    }
}
