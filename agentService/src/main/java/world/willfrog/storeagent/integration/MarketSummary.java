package world.willfrog.storeagent.integration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketSummary {
    private BigDecimal min;
    private BigDecimal max;
    private BigDecimal median;
    private Integer count;
}
