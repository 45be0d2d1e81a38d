package world.willfrog.storeagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of one approve, reject, execute or rollback request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionDecision {
    private Long actionId;
    private String status;
    private boolean applied;
    private String message;
    private Map<String, Object> result;
}
