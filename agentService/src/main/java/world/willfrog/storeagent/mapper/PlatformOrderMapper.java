package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.PlatformOrder;

@Mapper
public interface PlatformOrderMapper {

    int insert(PlatformOrder order);

    PlatformOrder findById(@Param("id") Long id);

    PlatformOrder findByExternalId(@Param("marketplaceId") Long marketplaceId,
                                   @Param("externalOrderId") String externalOrderId);

    int updateStatus(@Param("id") Long id,
                     @Param("status") String status,
                     @Param("fulfillmentStatus") String fulfillmentStatus,
                     @Param("paymentStatus") String paymentStatus);

    int deleteById(@Param("id") Long id);
}
