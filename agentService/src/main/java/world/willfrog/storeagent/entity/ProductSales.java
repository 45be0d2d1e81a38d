package world.willfrog.storeagent.entity;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Per-product revenue over the current window with the previous window alongside.
 */
@Data
public class ProductSales {
    private Long productId;
    private String title;
    private String sku;
    private Long categoryId;
    private BigDecimal revenue;
    private Integer unitsSold;
    private BigDecimal previousRevenue;
    private Integer listedChannels;
    private Integer quantityOnHand;
}
