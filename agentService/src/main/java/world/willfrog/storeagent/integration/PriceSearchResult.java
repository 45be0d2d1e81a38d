package world.willfrog.storeagent.integration;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either a summary or an error, as reported by the price-intelligence provider.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceSearchResult {
    private MarketSummary summary;
    private String error;

    public static PriceSearchResult of(MarketSummary summary) {
        return new PriceSearchResult(summary, null);
    }

    public static PriceSearchResult error(String error) {
        return new PriceSearchResult(null, error);
    }
}
