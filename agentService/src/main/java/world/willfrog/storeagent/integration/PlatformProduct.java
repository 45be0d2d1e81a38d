package world.willfrog.storeagent.integration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Marketplace-neutral listing representation handed to connectors.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlatformProduct {
    private String externalId;
    private String title;
    private String description;
    private String sku;
    private String barcode;
    private BigDecimal price;
    private BigDecimal compareAtPrice;
    private Integer quantity;
    private BigDecimal weight;
    private String weightUnit;
    private String brand;
    private String category;
    private List<String> images;
    private Map<String, Object> attributes;
    private String condition;
    private String status;
    private Map<String, Object> metadata;
}
