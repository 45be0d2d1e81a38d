package world.willfrog.storeagent.entity;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class ChannelSales {
    private String channel;
    private BigDecimal revenue;
    private Integer orderCount;
}
