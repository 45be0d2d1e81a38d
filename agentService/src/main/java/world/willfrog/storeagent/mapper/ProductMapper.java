package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.Product;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface ProductMapper {

    Product findById(@Param("id") Long id);

    Product findBySku(@Param("storeId") Long storeId, @Param("sku") String sku);

    /**
     * Active priced products never checked or last checked before {@code checkedBefore}, oldest check first.
     */
    List<Product> listPriceCheckCandidates(@Param("storeId") Long storeId,
                                           @Param("checkedBefore") OffsetDateTime checkedBefore,
                                           @Param("limit") int limit);

    /**
     * In-stock products not sold (or created, if never sold) since {@code idleSince}, highest stock value first.
     */
    List<Product> listIdleInventory(@Param("storeId") Long storeId,
                                    @Param("idleSince") OffsetDateTime idleSince,
                                    @Param("excludeCategories") List<String> excludeCategories,
                                    @Param("minValue") BigDecimal minValue,
                                    @Param("limit") int limit);

    List<Product> listListable(@Param("storeId") Long storeId, @Param("limit") int limit);

    int updatePrice(@Param("id") Long id, @Param("price") BigDecimal price);

    int touchPriceCheck(@Param("id") Long id, @Param("checkedAt") OffsetDateTime checkedAt);

    int updateQuantityBySku(@Param("storeId") Long storeId,
                            @Param("sku") String sku,
                            @Param("quantity") int quantity);

    int adjustQuantity(@Param("id") Long id, @Param("delta") int delta);
}
