package world.willfrog.storeagent.integration;

import world.willfrog.storeagent.entity.StoreMarketplace;

/**
 * Creates connectors for one platform (amazon, walmart, shopify, ...). Register implementations as beans.
 */
public interface PlatformConnectorProvider {

    String platform();

    PlatformConnector create(StoreMarketplace marketplace);
}
