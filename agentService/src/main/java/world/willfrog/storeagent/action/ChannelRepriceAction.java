package world.willfrog.storeagent.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.PlatformListing;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.integration.PlatformConnectorManager;
import world.willfrog.storeagent.integration.PlatformProduct;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;
import world.willfrog.storeagent.support.JsonSupport;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Changes the price of one listing on its platform, independently of the product's base price.
 * <p>
 * Payload: platform, listing_id, product_id, current_price, new_price, change_percent, reason,
 * competitor_data, margin_info and {@code major_change}, set by the proposer when the change crosses
 * its major-change threshold.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChannelRepriceAction implements ActionHandler {

    private final PlatformListingMapper listingMapper;
    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformConnectorManager connectorManager;
    private final JsonSupport json;

    @Override
    public String getType() {
        return ActionTypes.CHANNEL_REPRICE;
    }

    @Override
    public String getDescription() {
        return "Reprice a listing on its marketplace";
    }

    @Override
    public boolean requiresApproval(StoreAgent storeAgent, Map<String, Object> payload) {
        return PayloadValues.bool(payload, "major_change", false);
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        BigDecimal newPrice = PayloadValues.decimal(payload, "new_price");
        return PayloadValues.longValue(payload, "listing_id") != null && newPrice != null && newPrice.signum() > 0;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long listingId = PayloadValues.longValue(payload, "listing_id");
        BigDecimal newPrice = PayloadValues.decimal(payload, "new_price");
        PlatformListing listing = listingMapper.findById(listingId);
        if (listing == null) {
            return ActionResult.failure("listing not found: " + listingId);
        }
        BigDecimal oldPrice = listing.getPlatformPrice();
        if (!pushPrice(listing, newPrice)) {
            return ActionResult.failure("platform rejected price for listing " + listingId);
        }

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("platform_price", oldPrice);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("listing_id", listingId);
        data.put("platform", payload.get("platform"));
        data.put("old_price", oldPrice);
        data.put("new_price", newPrice);
        data.put("change_percent", payload.get("change_percent"));
        data.put("reason", payload.get("reason"));
        log.info("Listing repriced listingId={} platform={} {} -> {}", listingId, payload.get("platform"), oldPrice, newPrice);
        return ActionResult.success(String.format("Repriced listing %s from $%s to $%s", listingId, oldPrice, newPrice),
                before, data);
    }

    @Override
    public boolean supportsRollback() {
        return true;
    }

    @Override
    public boolean rollback(AgentAction action, Map<String, Object> payload, Map<String, Object> result) {
        BigDecimal oldPrice = PayloadValues.decimal(PayloadValues.map(result, "before"), "platform_price");
        PlatformListing listing = listingMapper.findById(PayloadValues.longValue(payload, "listing_id"));
        if (oldPrice == null || listing == null) {
            return false;
        }
        return pushPrice(listing, oldPrice);
    }

    private boolean pushPrice(PlatformListing listing, BigDecimal price) {
        StoreMarketplace marketplace = marketplaceMapper.findById(listing.getMarketplaceId());
        if (marketplace == null) {
            return false;
        }
        boolean accepted = connectorManager.connectorFor(marketplace)
                .updateProduct(listing.getExternalListingId(), PlatformProduct.builder().price(price).build());
        if (!accepted) {
            return false;
        }
        Map<String, Object> platformData = json.toMap(listing.getPlatformData());
        platformData.put("price", price);
        listingMapper.updatePricing(listing.getId(), price, json.toJson(platformData), OffsetDateTime.now());
        return true;
    }
}
