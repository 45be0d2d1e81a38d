package world.willfrog.storeagent.integration;

public interface PriceSearchClient {

    PriceSearchResult searchPrices(Long storeId, PriceSearchCriteria criteria);
}
