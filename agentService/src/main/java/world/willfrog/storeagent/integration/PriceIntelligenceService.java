package world.willfrog.storeagent.integration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.exception.ExternalServiceException;

import java.time.Duration;

@Service
public class PriceIntelligenceService {

    private static final String SERVICE = "price-search";

    private final PriceSearchClient client;
    private final ExternalCallGuard guard;

    @Value("${store-agent.timeouts.price-search-seconds:15}")
    private long timeoutSeconds = 15;

    public PriceIntelligenceService(PriceSearchClient client, ExternalCallGuard guard) {
        this.client = client;
        this.guard = guard;
    }

    /**
     * @throws ExternalServiceException when the provider errors, times out or returns no usable median
     */
    public MarketSummary marketSummary(Long storeId, PriceSearchCriteria criteria) {
        PriceSearchResult result = guard.call(SERVICE, Duration.ofSeconds(timeoutSeconds),
                () -> client.searchPrices(storeId, criteria));
        if (result == null) {
            throw new ExternalServiceException(SERVICE, "empty response");
        }
        if (result.getError() != null) {
            throw new ExternalServiceException(SERVICE, result.getError());
        }
        MarketSummary summary = result.getSummary();
        if (summary == null || summary.getMedian() == null || summary.getMedian().signum() <= 0) {
            throw new ExternalServiceException(SERVICE, "no market median for " + criteria.getTitle());
        }
        return summary;
    }
}
