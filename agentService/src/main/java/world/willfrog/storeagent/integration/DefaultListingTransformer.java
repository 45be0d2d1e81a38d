package world.willfrog.storeagent.integration;

import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
@RequiredArgsConstructor
public class DefaultListingTransformer implements ListingTransformer {

    /** Title limits per platform; others are left untouched. */
    private static final Map<String, Integer> TITLE_LIMITS = Map.of(
            "amazon", 200,
            "walmart", 150,
            "ebay", 80,
            "etsy", 140
    );

    private final JsonSupport json;

    @Override
    public PlatformProduct transform(Product product, String platform) {
        String title = StringUtils.defaultString(product.getTitle());
        Integer limit = platform == null ? null : TITLE_LIMITS.get(platform.toLowerCase());
        if (limit != null) {
            title = StringUtils.abbreviate(title, limit);
        }
        List<String> images = json.toList(product.getImages()).stream()
                .filter(Objects::nonNull)
                .map(String::valueOf)
                .toList();
        return PlatformProduct.builder()
                .title(title)
                .description(StringUtils.defaultString(product.getDescription()))
                .sku(product.getSku())
                .barcode(product.getBarcode())
                .price(product.getPrice())
                .quantity(product.getQuantity() == null ? 0 : product.getQuantity())
                .weight(product.getWeight())
                .weightUnit("lb")
                .brand(product.getBrand())
                .category(product.getCategoryName())
                .images(images)
                .attributes(Map.of())
                .condition(StringUtils.defaultIfBlank(product.getCondition(), "new"))
                .status("active")
                .metadata(product.getId() == null ? Map.of() : Map.of("product_id", product.getId()))
                .build();
    }
}
