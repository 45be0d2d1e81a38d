package world.willfrog.storeagent.integration;

import world.willfrog.storeagent.entity.Product;

/**
 * Maps a local product to a platform's listing representation.
 */
public interface ListingTransformer {

    PlatformProduct transform(Product product, String platform);
}
