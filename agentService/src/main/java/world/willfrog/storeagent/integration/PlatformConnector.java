package world.willfrog.storeagent.integration;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability surface of one marketplace connection. Wire protocols live in the implementations.
 */
public interface PlatformConnector {

    List<ExternalOrder> getOrders(OffsetDateTime since);

    Optional<ExternalOrder> getOrder(String externalId);

    /**
     * @return the external listing id, or null when the platform refused the listing
     */
    String createProduct(PlatformProduct product);

    boolean updateProduct(String externalId, PlatformProduct product);

    /**
     * @return sku -> whether the platform accepted that sku's quantity
     */
    Map<String, Boolean> bulkUpdateInventory(List<InventoryUpdate> updates);

    default CompetitivePricing getCompetitivePricing(String externalId) {
        return CompetitivePricing.empty();
    }
}
