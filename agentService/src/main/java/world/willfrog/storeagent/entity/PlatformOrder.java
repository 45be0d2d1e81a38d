package world.willfrog.storeagent.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class PlatformOrder {
    private Long id;
    private Long storeId;
    private Long marketplaceId;
    private String externalOrderId;
    private String externalOrderNumber;
    private String status;
    private String fulfillmentStatus;
    private String paymentStatus;
    private BigDecimal total;
    private BigDecimal subtotal;
    private BigDecimal shippingCost;
    private BigDecimal tax;
    private BigDecimal discount;
    private String currency;

    // JSON strings
    private String customerData;
    private String shippingAddress;
    private String lineItems;

    private OffsetDateTime orderedAt;
    private OffsetDateTime lastSyncedAt;
}
