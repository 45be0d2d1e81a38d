package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.PlatformListing;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface PlatformListingMapper {

    int insert(PlatformListing listing);

    PlatformListing findById(@Param("id") Long id);

    PlatformListing findByMarketplaceAndProduct(@Param("marketplaceId") Long marketplaceId,
                                                @Param("productId") Long productId);

    /**
     * Active listings of a marketplace joined with their product's sku, price, cost and quantity.
     */
    List<PlatformListing> listActiveByMarketplace(@Param("marketplaceId") Long marketplaceId,
                                                  @Param("limit") int limit);

    List<PlatformListing> listActiveByProduct(@Param("productId") Long productId);

    int updateQuantity(@Param("id") Long id,
                       @Param("quantity") int quantity,
                       @Param("syncedAt") OffsetDateTime syncedAt);

    int updatePricing(@Param("id") Long id,
                      @Param("price") BigDecimal price,
                      @Param("platformData") String platformData,
                      @Param("syncedAt") OffsetDateTime syncedAt);

    int updateSnapshot(@Param("id") Long id,
                       @Param("price") BigDecimal price,
                       @Param("quantity") Integer quantity,
                       @Param("platformData") String platformData,
                       @Param("syncedAt") OffsetDateTime syncedAt);

    int deleteById(@Param("id") Long id);
}
