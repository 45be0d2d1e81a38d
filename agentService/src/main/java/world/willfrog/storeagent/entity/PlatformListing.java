package world.willfrog.storeagent.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class PlatformListing {
    private Long id;
    private Long storeId;
    private Long productId;
    private Long marketplaceId;
    private String externalListingId;
    private BigDecimal platformPrice;
    private Integer platformQuantity;
    private String status;
    private String platformData; // JSON
    private OffsetDateTime lastSyncedAt;

    // joined from product
    private String sku;
    private String productTitle;
    private BigDecimal productPrice;
    private BigDecimal productCost;
    private Integer productQuantity;
}
