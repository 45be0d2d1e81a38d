package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.StoreMarketplace;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface StoreMarketplaceMapper {

    StoreMarketplace findById(@Param("id") Long id);

    List<StoreMarketplace> listActiveByStore(@Param("storeId") Long storeId);

    int countActiveByStore(@Param("storeId") Long storeId);

    int touchSync(@Param("id") Long id, @Param("syncedAt") OffsetDateTime syncedAt);
}
