package world.willfrog.storeagent.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class Product {
    private Long id;
    private Long storeId;
    private String sku;
    private String barcode;
    private String title;
    private String description;
    private String brand;
    private Long categoryId;
    private String categoryName;
    private String condition;
    private String status;
    private BigDecimal price;
    private BigDecimal cost;
    private Integer quantity;
    private BigDecimal weight;
    private String images; // JSON array of urls
    private OffsetDateTime lastPriceCheckAt;
    private OffsetDateTime lastSoldAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
