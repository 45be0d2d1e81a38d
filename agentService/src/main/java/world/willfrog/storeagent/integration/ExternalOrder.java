package world.willfrog.storeagent.integration;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class ExternalOrder {
    private String externalId;
    private String orderNumber;
    private String status;
    private String fulfillmentStatus;
    private String paymentStatus;
    private BigDecimal total;
    private BigDecimal subtotal;
    private BigDecimal shippingCost;
    private BigDecimal tax;
    private BigDecimal discount;
    private String currency;
    private Map<String, Object> customer;
    private Map<String, Object> shippingAddress;
    private List<Map<String, Object>> lineItems;
    /** ISO-8601 */
    private String orderedAt;
}
