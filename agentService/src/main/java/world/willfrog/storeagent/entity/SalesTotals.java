package world.willfrog.storeagent.entity;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class SalesTotals {
    private BigDecimal revenue;
    private Integer orderCount;
    private Integer unitsSold;
}
