package world.willfrog.storeagent.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
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

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-publishes an existing listing from the product's current data.
 * <p>
 * Payload: {@code marketplace_id}, {@code product_id}, optional {@code existing_listing_id},
 * {@code transformed_product} and {@code require_approval_for_publish}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateListingAction implements ActionHandler {

    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformListingMapper listingMapper;
    private final PlatformConnectorManager connectorManager;
    private final JsonSupport json;

    @Override
    public String getType() {
        return ActionTypes.UPDATE_LISTING;
    }

    @Override
    public String getDescription() {
        return "Update an existing marketplace listing";
    }

    @Override
    public boolean requiresApproval(StoreAgent storeAgent, Map<String, Object> payload) {
        return PayloadValues.bool(payload, "require_approval_for_publish", true);
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        Map<String, Object> product = PayloadValues.map(payload, "transformed_product");
        return PayloadValues.longValue(payload, "marketplace_id") != null
                && PayloadValues.string(product, "title") != null
                && PayloadValues.decimal(product, "price") != null;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long marketplaceId = PayloadValues.longValue(payload, "marketplace_id");
        StoreMarketplace marketplace = marketplaceMapper.findById(marketplaceId);
        if (marketplace == null) {
            return ActionResult.failure("marketplace not found: " + marketplaceId);
        }
        PlatformListing listing = findListing(marketplaceId, payload);
        if (listing == null) {
            return ActionResult.failure("listing not found for marketplace " + marketplaceId);
        }
        if (StringUtils.isBlank(listing.getExternalListingId())) {
            return ActionResult.failure("listing " + listing.getId() + " has no external id");
        }

        PlatformProduct product = json.mapper().convertValue(PayloadValues.map(payload, "transformed_product"),
                PlatformProduct.class);
        if (!connectorManager.connectorFor(marketplace).updateProduct(listing.getExternalListingId(), product)) {
            return ActionResult.failure("platform rejected listing update " + listing.getExternalListingId());
        }
        listingMapper.updateSnapshot(listing.getId(), product.getPrice(), product.getQuantity(), json.toJson(product),
                OffsetDateTime.now());

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("listing_id", listing.getId());
        before.put("platform_price", listing.getPlatformPrice());
        before.put("platform_quantity", listing.getPlatformQuantity());
        before.put("platform_data", json.toMap(listing.getPlatformData()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("listing_id", listing.getId());
        data.put("external_id", listing.getExternalListingId());
        data.put("platform", marketplace.getPlatform());
        log.info("Listing updated listingId={} externalId={}", listing.getId(), listing.getExternalListingId());
        return ActionResult.success("Listing updated on " + marketplace.getPlatform(), before, data);
    }

    @Override
    public boolean supportsRollback() {
        return true;
    }

    @Override
    public boolean rollback(AgentAction action, Map<String, Object> payload, Map<String, Object> result) {
        Map<String, Object> before = PayloadValues.map(result, "before");
        Long listingId = PayloadValues.longValue(before, "listing_id");
        Map<String, Object> previousData = PayloadValues.map(before, "platform_data");
        if (listingId == null || previousData.isEmpty()) {
            return false;
        }
        PlatformListing listing = listingMapper.findById(listingId);
        StoreMarketplace marketplace = listing == null ? null : marketplaceMapper.findById(listing.getMarketplaceId());
        if (marketplace == null) {
            return false;
        }
        PlatformProduct previous = json.mapper().convertValue(previousData, PlatformProduct.class);
        if (!connectorManager.connectorFor(marketplace).updateProduct(listing.getExternalListingId(), previous)) {
            return false;
        }
        listingMapper.updateSnapshot(listingId, PayloadValues.decimal(before, "platform_price"),
                PayloadValues.integer(before, "platform_quantity"), json.toJson(previousData), OffsetDateTime.now());
        return true;
    }

    private PlatformListing findListing(Long marketplaceId, Map<String, Object> payload) {
        Long listingId = PayloadValues.longValue(payload, "existing_listing_id");
        if (listingId != null) {
            return listingMapper.findById(listingId);
        }
        Long productId = PayloadValues.longValue(payload, "product_id");
        return productId == null ? null : listingMapper.findByMarketplaceAndProduct(marketplaceId, productId);
    }
}
