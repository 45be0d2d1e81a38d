package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.StoreAgent;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface StoreAgentMapper {

    int insert(StoreAgent storeAgent);

    StoreAgent findById(@Param("id") Long id);

    StoreAgent findByStoreAndSlug(@Param("storeId") Long storeId, @Param("agentSlug") String agentSlug);

    List<StoreAgent> listByStore(@Param("storeId") Long storeId);

    /**
     * Enabled, non-blocked rows whose next_run_at is unset or not after {@code now}.
     */
    List<StoreAgent> listDue(@Param("now") OffsetDateTime now, @Param("limit") int limit);

    List<StoreAgent> listEnabledByStore(@Param("storeId") Long storeId);

    int updateSettings(StoreAgent storeAgent);

    int markRan(@Param("id") Long id,
                @Param("lastRunAt") OffsetDateTime lastRunAt,
                @Param("nextRunAt") OffsetDateTime nextRunAt);
}
