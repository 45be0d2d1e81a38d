package world.willfrog.storeagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import world.willfrog.storeagent.entity.AgentAction;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionListResponse {
    private List<AgentAction> items;
    /** status (lower case) -> count for the store */
    private Map<String, Integer> counts;
    private int limit;
    private int offset;
}
