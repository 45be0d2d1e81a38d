package world.willfrog.storeagent.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.integration.InventoryUpdate;
import world.willfrog.storeagent.integration.PlatformConnector;
import world.willfrog.storeagent.integration.PlatformConnectorManager;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes local quantities to one marketplace in a single bulk call.
 * <p>
 * Payload: {@code marketplace_id}, {@code platform} and {@code updates}, each with listing_id, product_id, sku,
 * external_id, old_quantity and new_quantity. The listing's recorded platform quantity is only moved for skus
 * the platform accepted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncInventoryAction implements ActionHandler {

    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformListingMapper listingMapper;
    private final PlatformConnectorManager connectorManager;

    @Override
    public String getType() {
        return ActionTypes.SYNC_INVENTORY;
    }

    @Override
    public String getDescription() {
        return "Sync inventory quantities to a marketplace";
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        if (PayloadValues.longValue(payload, "marketplace_id") == null) {
            return false;
        }
        List<Map<String, Object>> updates = PayloadValues.mapList(payload, "updates");
        if (updates.isEmpty()) {
            return false;
        }
        for (Map<String, Object> update : updates) {
            if (PayloadValues.string(update, "sku") == null || PayloadValues.integer(update, "new_quantity") == null) {
                return false;
            }
        }
        return true;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long marketplaceId = PayloadValues.longValue(payload, "marketplace_id");
        StoreMarketplace marketplace = marketplaceMapper.findById(marketplaceId);
        if (marketplace == null) {
            return ActionResult.failure("marketplace not found: " + marketplaceId);
        }
        List<Map<String, Object>> updates = PayloadValues.mapList(payload, "updates");
        List<InventoryUpdate> pushes = new ArrayList<>(updates.size());
        for (Map<String, Object> update : updates) {
            pushes.add(new InventoryUpdate(PayloadValues.string(update, "sku"),
                    PayloadValues.string(update, "external_id"),
                    PayloadValues.integer(update, "new_quantity")));
        }

        PlatformConnector connector = connectorManager.connectorFor(marketplace);
        Map<String, Boolean> accepted = connector.bulkUpdateInventory(pushes);
        Map<String, Boolean> outcome = accepted == null ? Map.of() : accepted;

        OffsetDateTime now = OffsetDateTime.now();
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<Map<String, Object>> previous = new ArrayList<>();
        for (Map<String, Object> update : updates) {
            String sku = PayloadValues.string(update, "sku");
            if (!Boolean.TRUE.equals(outcome.get(sku))) {
                failed.add(sku);
                continue;
            }
            succeeded.add(sku);
            Long listingId = PayloadValues.longValue(update, "listing_id");
            if (listingId != null) {
                listingMapper.updateQuantity(listingId, PayloadValues.integer(update, "new_quantity"), now);
            }
            Map<String, Object> prior = new LinkedHashMap<>();
            prior.put("listing_id", listingId);
            prior.put("sku", sku);
            prior.put("external_id", update.get("external_id"));
            prior.put("quantity", update.get("old_quantity"));
            previous.add(prior);
        }

        String message = String.format("%d successful, %d failed", succeeded.size(), failed.size());
        log.info("Inventory sync marketplaceId={} platform={} {}", marketplaceId, marketplace.getPlatform(), message);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("marketplace_id", marketplaceId);
        data.put("platform", marketplace.getPlatform());
        data.put("succeeded", succeeded);
        data.put("failed", failed);
        if (succeeded.isEmpty()) {
            return ActionResult.failure(message, data);
        }
        marketplaceMapper.touchSync(marketplaceId, now);
        Map<String, Object> before = new LinkedHashMap<>();
        before.put("listings", previous);
        return ActionResult.success(message, before, data);
    }

    @Override
    public boolean supportsRollback() {
        return true;
    }

    @Override
    public boolean rollback(AgentAction action, Map<String, Object> payload, Map<String, Object> result) {
        List<Map<String, Object>> previous = PayloadValues.mapList(PayloadValues.map(result, "before"), "listings");
        StoreMarketplace marketplace = marketplaceMapper.findById(PayloadValues.longValue(payload, "marketplace_id"));
        if (previous.isEmpty() || marketplace == null) {
            return false;
        }
        List<InventoryUpdate> restores = new ArrayList<>();
        for (Map<String, Object> prior : previous) {
            Integer quantity = PayloadValues.integer(prior, "quantity");
            if (quantity != null) {
                restores.add(new InventoryUpdate(PayloadValues.string(prior, "sku"),
                        PayloadValues.string(prior, "external_id"), quantity));
            }
        }
        Map<String, Boolean> accepted = connectorManager.connectorFor(marketplace).bulkUpdateInventory(restores);
        OffsetDateTime now = OffsetDateTime.now();
        boolean all = true;
        for (Map<String, Object> prior : previous) {
            String sku = PayloadValues.string(prior, "sku");
            Long listingId = PayloadValues.longValue(prior, "listing_id");
            Integer quantity = PayloadValues.integer(prior, "quantity");
            if (accepted != null && Boolean.TRUE.equals(accepted.get(sku)) && listingId != null && quantity != null) {
                listingMapper.updateQuantity(listingId, quantity, now);
            } else {
                all = false;
            }
        }
        return all;
    }
}
