package world.willfrog.storeagent.integration;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class PriceSearchCriteria {
    private String title;
    private String category;
    private String brand;
    private String condition;
    private Map<String, Object> attributes;
}
