package world.willfrog.storeagent.integration;

/**
 * Fallback when no price-intelligence provider is wired; every search reports an error so pricing runs
 * record the products as skipped.
 */
public class UnconfiguredPriceSearchClient implements PriceSearchClient {

    @Override
    public PriceSearchResult searchPrices(Long storeId, PriceSearchCriteria criteria) {
        return PriceSearchResult.error("price search provider not configured");
    }
}
