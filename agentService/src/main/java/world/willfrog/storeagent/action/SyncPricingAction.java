package world.willfrog.storeagent.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.PlatformListing;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.integration.PlatformConnector;
import world.willfrog.storeagent.integration.PlatformConnectorManager;
import world.willfrog.storeagent.integration.PlatformProduct;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;
import world.willfrog.storeagent.support.JsonSupport;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligns platform prices of one marketplace with local base prices. Always reviewed by a human.
 * <p>
 * Payload: {@code marketplace_id}, {@code platform} and {@code updates}, each with listing_id, sku,
 * external_id, old_price and new_price.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncPricingAction implements ActionHandler {

    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformListingMapper listingMapper;
    private final PlatformConnectorManager connectorManager;
    private final JsonSupport json;

    @Override
    public String getType() {
        return ActionTypes.SYNC_PRICING;
    }

    @Override
    public String getDescription() {
        return "Sync base prices to a marketplace";
    }

    @Override
    public boolean requiresApproval(StoreAgent storeAgent, Map<String, Object> payload) {
        return true;
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        List<Map<String, Object>> updates = PayloadValues.mapList(payload, "updates");
        if (PayloadValues.longValue(payload, "marketplace_id") == null || updates.isEmpty()) {
            return false;
        }
        return updates.stream().allMatch(update -> PayloadValues.string(update, "external_id") != null
                && PayloadValues.decimal(update, "new_price") != null
                && PayloadValues.decimal(update, "new_price").signum() > 0);
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long marketplaceId = PayloadValues.longValue(payload, "marketplace_id");
        StoreMarketplace marketplace = marketplaceMapper.findById(marketplaceId);
        if (marketplace == null) {
            return ActionResult.failure("marketplace not found: " + marketplaceId);
        }
        PlatformConnector connector = connectorManager.connectorFor(marketplace);
        OffsetDateTime now = OffsetDateTime.now();
        List<Map<String, Object>> previous = new ArrayList<>();
        List<Map<String, Object>> errors = new ArrayList<>();
        int updated = 0;
        for (Map<String, Object> update : PayloadValues.mapList(payload, "updates")) {
            String externalId = PayloadValues.string(update, "external_id");
            BigDecimal newPrice = PayloadValues.decimal(update, "new_price");
            try {
                if (!connector.updateProduct(externalId, PlatformProduct.builder().price(newPrice).build())) {
                    errors.add(Map.of("external_id", externalId, "error", "platform rejected price"));
                    continue;
                }
            } catch (RuntimeException e) {
                log.warn("Price sync failed marketplaceId={} externalId={}: {}", marketplaceId, externalId, e.getMessage());
                errors.add(Map.of("external_id", externalId, "error", String.valueOf(e.getMessage())));
                continue;
            }
            updated++;
            Long listingId = PayloadValues.longValue(update, "listing_id");
            if (listingId != null) {
                PlatformListing listing = listingMapper.findById(listingId);
                String platformData = listing == null ? null : listing.getPlatformData();
                listingMapper.updatePricing(listingId, newPrice, platformData, now);
            }
            Map<String, Object> prior = new LinkedHashMap<>();
            prior.put("listing_id", listingId);
            prior.put("external_id", externalId);
            prior.put("price", update.get("old_price"));
            previous.add(prior);
        }

        String message = String.format("%d prices synced, %d failed", updated, errors.size());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("marketplace_id", marketplaceId);
        data.put("platform", marketplace.getPlatform());
        data.put("updated", updated);
        data.put("errors", errors);
        if (updated == 0) {
            return ActionResult.failure(message, data);
        }
        Map<String, Object> before = new LinkedHashMap<>();
        before.put("listings", previous);
        log.info("Pricing sync marketplaceId={} {}", marketplaceId, json.toJson(data));
        return ActionResult.success(message, before, data);
    }
}
