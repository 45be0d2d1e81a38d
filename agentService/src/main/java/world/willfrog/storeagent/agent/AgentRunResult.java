package world.willfrog.storeagent.agent;

import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
public class AgentRunResult {
    private final boolean success;
    private final boolean skipped;
    private final String message;
    private final Map<String, Object> data;
    private final int actionsCreated;

    public static AgentRunResult success(Map<String, Object> data, int actionsCreated) {
        return AgentRunResult.builder()
                .success(true)
                .data(data == null ? Map.of() : data)
                .actionsCreated(actionsCreated)
                .build();
    }

    public static AgentRunResult failure(String message) {
        return AgentRunResult.builder()
                .success(false)
                .message(message)
                .data(Map.of())
                .build();
    }

    public static AgentRunResult skipped(String reason) {
        return AgentRunResult.builder()
                .success(true)
                .skipped(true)
                .message(reason)
                .data(Map.of())
                .build();
    }

    /**
     * Summary persisted on the run row.
     */
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>(data == null ? Map.of() : data);
        summary.put("actions_created", actionsCreated);
        if (message != null) {
            summary.put("message", message);
        }
        return summary;
    }
}
