package world.willfrog.storeagent.entity;

import lombok.Data;

@Data
public class Customer {
    private Long id;
    private Long storeId;
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private Boolean receivesMarketing;
    /** Purchases in the matched category, filled by category-affinity queries. */
    private Integer purchaseCount;
}
