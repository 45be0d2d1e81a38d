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
 * Publishes a product on a marketplace it is not listed on yet.
 * <p>
 * Payload: {@code marketplace_id}, {@code product_id}, {@code platform}, {@code transformed_product}
 * and {@code require_approval_for_publish}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CreateListingAction implements ActionHandler {

    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformListingMapper listingMapper;
    private final PlatformConnectorManager connectorManager;
    private final JsonSupport json;

    @Override
    public String getType() {
        return ActionTypes.CREATE_LISTING;
    }

    @Override
    public String getDescription() {
        return "Create a marketplace listing for a product";
    }

    @Override
    public boolean requiresApproval(StoreAgent storeAgent, Map<String, Object> payload) {
        return PayloadValues.bool(payload, "require_approval_for_publish", true);
    }

    @Override
    public boolean validatePayload(Map<String, Object> payload) {
        Map<String, Object> product = PayloadValues.map(payload, "transformed_product");
        return PayloadValues.longValue(payload, "marketplace_id") != null
                && PayloadValues.longValue(payload, "product_id") != null
                && PayloadValues.string(product, "title") != null
                && PayloadValues.decimal(product, "price") != null;
    }

    @Override
    public ActionResult execute(AgentAction action, Map<String, Object> payload) {
        Long marketplaceId = PayloadValues.longValue(payload, "marketplace_id");
        Long productId = PayloadValues.longValue(payload, "product_id");
        StoreMarketplace marketplace = marketplaceMapper.findById(marketplaceId);
        if (marketplace == null) {
            return ActionResult.failure("marketplace not found: " + marketplaceId);
        }
        if (listingMapper.findByMarketplaceAndProduct(marketplaceId, productId) != null) {
            return ActionResult.failure(String.format("product %s already listed on marketplace %s", productId, marketplaceId));
        }
        PlatformProduct product = json.mapper().convertValue(PayloadValues.map(payload, "transformed_product"),
                PlatformProduct.class);
        String externalId = connectorManager.connectorFor(marketplace).createProduct(product);
        if (StringUtils.isBlank(externalId)) {
            return ActionResult.failure("platform did not return a listing id");
        }

        PlatformListing listing = new PlatformListing();
        listing.setStoreId(action.getStoreId());
        listing.setProductId(productId);
        listing.setMarketplaceId(marketplaceId);
        listing.setExternalListingId(externalId);
        listing.setPlatformPrice(product.getPrice());
        listing.setPlatformQuantity(product.getQuantity());
        listing.setStatus("active");
        listing.setPlatformData(json.toJson(product));
        listing.setLastSyncedAt(OffsetDateTime.now());
        listingMapper.insert(listing);

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("listing_existed", false);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("listing_id", listing.getId());
        data.put("external_id", externalId);
        data.put("platform", marketplace.getPlatform());
        log.info("Listing created productId={} marketplaceId={} externalId={}", productId, marketplaceId, externalId);
        return ActionResult.success("Listing created on " + marketplace.getPlatform(), before, data);
    }
}
