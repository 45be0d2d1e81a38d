package world.willfrog.storeagent.entity;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class StoreMarketplace {
    private Long id;
    private Long storeId;
    private String platform;
    private String name;
    private Boolean active;
    private String settings; // JSON
    private OffsetDateTime lastSyncAt;
}
