package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.ChannelSales;
import world.willfrog.storeagent.entity.ProductSales;
import world.willfrog.storeagent.entity.SalesTotals;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface SalesReportMapper {

    SalesTotals totals(@Param("storeId") Long storeId,
                       @Param("from") OffsetDateTime from,
                       @Param("to") OffsetDateTime to);

    List<ChannelSales> channelSales(@Param("storeId") Long storeId,
                                    @Param("from") OffsetDateTime from,
                                    @Param("to") OffsetDateTime to);

    /**
     * Revenue per product for [from, to) with the revenue of [previousFrom, from) alongside.
     */
    List<ProductSales> productSales(@Param("storeId") Long storeId,
                                    @Param("previousFrom") OffsetDateTime previousFrom,
                                    @Param("from") OffsetDateTime from,
                                    @Param("to") OffsetDateTime to);
}
