package world.willfrog.storeagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.PlatformListing;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.integration.ExternalOrder;
import world.willfrog.storeagent.integration.PlatformConnectorManager;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.PlatformOrderMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;
import world.willfrog.storeagent.model.AgentType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps marketplace quantities, orders and (optionally) prices in line with the store.
 * <p>
 * Quantity and price changes are batched into one action per marketplace; each unseen order becomes its
 * own action keyed by marketplace and external id.
 */
@Slf4j
@Component
public class ChannelSyncAgent extends AbstractAgent {

    static final String SLUG = "channel-sync";

    /** Listings scanned per marketplace and run. */
    private static final int LISTING_SCAN_LIMIT = 5000;
    private static final BigDecimal MIN_PRICE_DRIFT = new BigDecimal("0.01");

    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformListingMapper listingMapper;
    private final PlatformOrderMapper orderMapper;
    private final PlatformConnectorManager connectorManager;

    public ChannelSyncAgent(AgentSupport support,
                            StoreMarketplaceMapper marketplaceMapper,
                            PlatformListingMapper listingMapper,
                            PlatformOrderMapper orderMapper,
                            PlatformConnectorManager connectorManager) {
        super(support);
        this.marketplaceMapper = marketplaceMapper;
        this.listingMapper = listingMapper;
        this.orderMapper = orderMapper;
        this.connectorManager = connectorManager;
    }

    @Override
    public String getSlug() {
        return SLUG;
    }

    @Override
    public String getName() {
        return "Channel Sync";
    }

    @Override
    public String getDescription() {
        return "Keeps inventory, pricing and orders synchronized across connected marketplaces";
    }

    @Override
    public AgentType getType() {
        return AgentType.REACTIVE;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("sync_inventory", true);
        defaults.put("sync_orders", true);
        defaults.put("sync_pricing", false);
        defaults.put("inventory_buffer", 2);
        defaults.put("order_lookback_hours", 24);
        defaults.put("sync_frequency_minutes", 15);
        defaults.put("low_stock_threshold", 5);
        defaults.put("notify_on_out_of_stock", true);
        return defaults;
    }

    @Override
    public Map<String, ConfigField> getConfigSchema() {
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("sync_inventory", ConfigField.bool("Sync Inventory", "Push inventory levels to all channels"));
        schema.put("sync_orders", ConfigField.bool("Sync Orders", "Import orders from connected marketplaces"));
        schema.put("sync_pricing", ConfigField.bool("Sync Pricing", "Keep prices consistent across channels"));
        schema.put("inventory_buffer", ConfigField.number("Inventory Buffer", "Units reserved to prevent overselling", 0, 1000));
        schema.put("order_lookback_hours", ConfigField.number("Order Lookback (hours)", "How far back to look for new orders", 1, 720));
        schema.put("sync_frequency_minutes", ConfigField.number("Sync Frequency (minutes)", "Minutes between runs", 5, 1440));
        schema.put("low_stock_threshold", ConfigField.number("Low Stock Threshold", "Count listings at or below this level", 0, 1000));
        schema.put("notify_on_out_of_stock", ConfigField.bool("Out of Stock Notifications", "Notify when a listing runs out"));
        return schema;
    }

    @Override
    public boolean canRun(StoreAgent storeAgent) {
        return super.canRun(storeAgent) && marketplaceMapper.countActiveByStore(storeAgent.getStoreId()) > 0;
    }

    @Override
    public Duration getCadence(StoreAgent storeAgent) {
        return Duration.ofMinutes(config(storeAgent).getInt("sync_frequency_minutes"));
    }

    @Override
    public List<String> getSubscribedEvents() {
        return List.of("product.inventory_updated", "product.price_updated", "order.created", "order.fulfilled",
                "marketplace.connected");
    }

    @Override
    public EventReaction handleEvent(String event, Map<String, Object> payload, StoreAgent storeAgent) {
        Map<String, Object> scope = new LinkedHashMap<>();
        switch (event) {
            case "product.inventory_updated", "product.price_updated" -> {
                Long productId = PayloadValues.longValue(payload, "product_id");
                if (productId == null) {
                    return EventReaction.ignore("event carries no product_id");
                }
                scope.put("product_id", productId);
            }
            case "marketplace.connected" -> {
                Long marketplaceId = PayloadValues.longValue(payload, "marketplace_id");
                if (marketplaceId != null) {
                    scope.put("marketplace_id", marketplaceId);
                }
            }
            default -> {
                // order events: full pass
            }
        }
        return EventReaction.run(scope);
    }

    @Override
    public AgentRunResult run(AgentRun run, StoreAgent storeAgent) {
        AgentConfig config = config(storeAgent);
        Map<String, Object> scope = triggerScope(run);
        Long scopedMarketplace = PayloadValues.longValue(scope, "marketplace_id");
        List<StoreMarketplace> marketplaces = marketplaceMapper.listActiveByStore(storeAgent.getStoreId()).stream()
                .filter(marketplace -> scopedMarketplace == null || scopedMarketplace.equals(marketplace.getId()))
                .toList();
        if (marketplaces.isEmpty()) {
            return AgentRunResult.success(Map.of("message", "No active marketplace connections found"), 0);
        }

        SyncTotals totals = new SyncTotals();
        List<String> errors = new ArrayList<>();
        Map<String, Object> byPlatform = new LinkedHashMap<>();
        for (StoreMarketplace marketplace : marketplaces) {
            Map<String, Object> platformResult = new LinkedHashMap<>();
            List<String> platformErrors = new ArrayList<>();
            try {
                List<PlatformListing> listings = listingMapper.listActiveByMarketplace(marketplace.getId(), LISTING_SCAN_LIMIT)
                        .stream()
                        .filter(listing -> inScope(listing, scope))
                        .toList();
                if (config.getBoolean("sync_inventory")) {
                    platformResult.put("inventory_synced", syncInventory(run, storeAgent, marketplace, listings, config, totals));
                }
                if (config.getBoolean("sync_orders") && !scope.containsKey("product_id")) {
                    try {
                        platformResult.put("orders_imported", syncOrders(run, storeAgent, marketplace, config, totals,
                                platformErrors));
                    } catch (RuntimeException e) {
                        log.warn("Order import failed storeId={} marketplaceId={}: {}",
                                storeAgent.getStoreId(), marketplace.getId(), e.getMessage());
                        platformErrors.add("orders: " + e.getMessage());
                    }
                }
                if (config.getBoolean("sync_pricing")) {
                    platformResult.put("price_updates", syncPricing(run, storeAgent, marketplace, listings, totals));
                }
            } catch (RuntimeException e) {
                log.warn("Channel sync failed storeId={} marketplaceId={}: {}",
                        storeAgent.getStoreId(), marketplace.getId(), e.getMessage());
                platformErrors.add(e.getMessage());
            }
            platformResult.put("errors", platformErrors);
            platformErrors.forEach(error -> errors.add(marketplace.getPlatform() + ": " + error));
            byPlatform.put(marketplace.getPlatform(), platformResult);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("inventory_synced", totals.inventorySynced);
        data.put("orders_imported", totals.ordersImported);
        data.put("price_updates", totals.priceUpdates);
        data.put("low_stock_alerts", totals.lowStock);
        data.put("out_of_stock", totals.outOfStock);
        data.put("errors", errors);
        data.put("by_platform", byPlatform);
        return AgentRunResult.success(data, totals.actions);
    }

    private int syncInventory(AgentRun run, StoreAgent storeAgent, StoreMarketplace marketplace,
                              List<PlatformListing> listings, AgentConfig config, SyncTotals totals) {
        int buffer = config.getInt("inventory_buffer");
        int lowStockThreshold = config.getInt("low_stock_threshold");
        boolean notifyOutOfStock = config.getBoolean("notify_on_out_of_stock");

        List<Map<String, Object>> updates = new ArrayList<>();
        for (PlatformListing listing : listings) {
            int onHand = listing.getProductQuantity() == null ? 0 : listing.getProductQuantity();
            int available = Math.max(0, onHand - buffer);
            if (Objects.equals(listing.getPlatformQuantity(), available)) {
                continue;
            }
            Map<String, Object> update = new LinkedHashMap<>();
            update.put("listing_id", listing.getId());
            update.put("product_id", listing.getProductId());
            update.put("sku", listing.getSku());
            update.put("external_id", listing.getExternalListingId());
            update.put("old_quantity", listing.getPlatformQuantity());
            update.put("new_quantity", available);
            updates.add(update);

            if (available == 0) {
                totals.outOfStock++;
                if (notifyOutOfStock && propose(run, storeAgent, outOfStockNotice(marketplace, listing))) {
                    totals.actions++;
                }
            } else if (available <= lowStockThreshold) {
                totals.lowStock++;
            }
        }
        if (updates.isEmpty()) {
            return 0;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("marketplace_id", marketplace.getId());
        payload.put("platform", marketplace.getPlatform());
        payload.put("updates", updates);
        boolean created = propose(run, storeAgent, ProposedAction.builder()
                .actionType(ActionTypes.SYNC_INVENTORY)
                .targetType(ActionTargets.STORE_MARKETPLACE)
                .targetId(String.valueOf(marketplace.getId()))
                .payload(payload)
                .build());
        if (!created) {
            return 0;
        }
        totals.actions++;
        totals.inventorySynced += updates.size();
        return updates.size();
    }

    private int syncOrders(AgentRun run, StoreAgent storeAgent, StoreMarketplace marketplace,
                           AgentConfig config, SyncTotals totals, List<String> platformErrors) {
        OffsetDateTime since = OffsetDateTime.now().minusHours(config.getInt("order_lookback_hours"));
        List<ExternalOrder> orders = connectorManager.connectorFor(marketplace).getOrders(since);
        int imported = 0;
        for (ExternalOrder order : orders == null ? List.<ExternalOrder>of() : orders) {
            if (order.getExternalId() == null
                    || orderMapper.findByExternalId(marketplace.getId(), order.getExternalId()) != null) {
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("marketplace_id", marketplace.getId());
            payload.put("platform", marketplace.getPlatform());
            payload.put("order_data", orderData(order));
            boolean created;
            try {
                created = propose(run, storeAgent, ProposedAction.builder()
                        .actionType(ActionTypes.SYNC_ORDER)
                        .targetType(ActionTargets.EXTERNAL_ORDER)
                        .targetId(ActionTargets.externalOrderKey(marketplace.getId(), order.getExternalId()))
                        .payload(payload)
                        .build());
            } catch (ValidationException e) {
                log.warn("Order not importable storeId={} marketplaceId={} externalId={}: {}",
                        storeAgent.getStoreId(), marketplace.getId(), order.getExternalId(), e.getMessage());
                platformErrors.add("order " + order.getExternalId() + ": " + e.getMessage());
                continue;
            }
            if (created) {
                imported++;
                totals.actions++;
            }
        }
        totals.ordersImported += imported;
        return imported;
    }

    private int syncPricing(AgentRun run, StoreAgent storeAgent, StoreMarketplace marketplace,
                            List<PlatformListing> listings, SyncTotals totals) {
        List<Map<String, Object>> updates = new ArrayList<>();
        for (PlatformListing listing : listings) {
            if (listing.getProductPrice() == null || listing.getProductPrice().signum() <= 0) {
                continue;
            }
            BigDecimal platformPrice = listing.getPlatformPrice() == null ? BigDecimal.ZERO : listing.getPlatformPrice();
            if (platformPrice.subtract(listing.getProductPrice()).abs().compareTo(MIN_PRICE_DRIFT) <= 0) {
                continue;
            }
            Map<String, Object> update = new LinkedHashMap<>();
            update.put("listing_id", listing.getId());
            update.put("product_id", listing.getProductId());
            update.put("sku", listing.getSku());
            update.put("external_id", listing.getExternalListingId());
            update.put("old_price", listing.getPlatformPrice());
            update.put("new_price", listing.getProductPrice());
            updates.add(update);
        }
        if (updates.isEmpty()) {
            return 0;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("marketplace_id", marketplace.getId());
        payload.put("platform", marketplace.getPlatform());
        payload.put("updates", updates);
        boolean created = propose(run, storeAgent, ProposedAction.builder()
                .actionType(ActionTypes.SYNC_PRICING)
                .targetType(ActionTargets.STORE_MARKETPLACE)
                .targetId(String.valueOf(marketplace.getId()))
                .payload(payload)
                .build());
        if (!created) {
            return 0;
        }
        totals.actions++;
        totals.priceUpdates += updates.size();
        return updates.size();
    }

    private static ProposedAction outOfStockNotice(StoreMarketplace marketplace, PlatformListing listing) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "out_of_stock");
        payload.put("platform", marketplace.getPlatform());
        payload.put("product_id", listing.getProductId());
        payload.put("product_title", listing.getProductTitle());
        payload.put("message", String.format("Product '%s' is now out of stock on %s",
                listing.getProductTitle(), marketplace.getPlatform()));
        return ProposedAction.builder()
                .actionType(ActionTypes.SEND_NOTIFICATION)
                .targetType(ActionTargets.PRODUCT)
                .targetId(String.valueOf(listing.getProductId()))
                .payload(payload)
                .build();
    }

    private static Map<String, Object> orderData(ExternalOrder order) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("external_id", order.getExternalId());
        data.put("order_number", order.getOrderNumber());
        data.put("status", order.getStatus());
        data.put("fulfillment_status", order.getFulfillmentStatus());
        data.put("payment_status", order.getPaymentStatus());
        data.put("total", order.getTotal());
        data.put("subtotal", order.getSubtotal());
        data.put("shipping_cost", order.getShippingCost());
        data.put("tax", order.getTax());
        data.put("discount", order.getDiscount());
        data.put("currency", order.getCurrency());
        data.put("customer", order.getCustomer());
        data.put("shipping_address", order.getShippingAddress());
        data.put("line_items", order.getLineItems());
        data.put("ordered_at", order.getOrderedAt());
        return data;
    }

    private static boolean inScope(PlatformListing listing, Map<String, Object> scope) {
        Long productId = PayloadValues.longValue(scope, "product_id");
        return productId == null || productId.equals(listing.getProductId());
    }

    private static final class SyncTotals {
        private int inventorySynced;
        private int ordersImported;
        private int priceUpdates;
        private int lowStock;
        private int outOfStock;
        private int actions;
    }
}
