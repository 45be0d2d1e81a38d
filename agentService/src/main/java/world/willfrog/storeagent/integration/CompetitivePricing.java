package world.willfrog.storeagent.integration;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class CompetitivePricing {
    private BigDecimal lowestPrice;
    private BigDecimal buyBoxPrice;
    private BigDecimal averagePrice;
    private Integer sellerCount;

    public static CompetitivePricing empty() {
        return CompetitivePricing.builder().build();
    }
}
