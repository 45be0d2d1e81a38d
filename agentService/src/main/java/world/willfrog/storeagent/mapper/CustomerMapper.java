package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.Customer;

import java.util.List;

@Mapper
public interface CustomerMapper {

    /**
     * Marketing-opted-in customers with at least {@code minPurchases} past purchases in the category,
     * most purchases first.
     */
    List<Customer> listByCategoryAffinity(@Param("storeId") Long storeId,
                                          @Param("categoryId") Long categoryId,
                                          @Param("minPurchases") int minPurchases,
                                          @Param("limit") int limit);
}
