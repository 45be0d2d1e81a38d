package world.willfrog.storeagent.integration;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryUpdate {
    private String sku;
    private String externalId;
    private int quantity;
}
