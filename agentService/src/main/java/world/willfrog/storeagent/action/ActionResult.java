package world.willfrog.storeagent.action;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActionResult {
    private final boolean success;
    private final boolean skipped;
    private final String message;
    /** State replaced by the effect, kept for rollback. */
    private final Map<String, Object> before;
    private final Map<String, Object> data;

    public static ActionResult success(String message, Map<String, Object> before, Map<String, Object> data) {
        if (before == null) {
            throw new IllegalArgumentException("successful action results must capture the before state");
        }
        return new ActionResult(true, false, message, before, data == null ? Map.of() : data);
    }

    public static ActionResult failure(String message) {
        return new ActionResult(false, false, message, Map.of(), Map.of());
    }

    public static ActionResult failure(String message, Map<String, Object> data) {
        return new ActionResult(false, false, message, Map.of(), data == null ? Map.of() : data);
    }

    /**
     * Nothing was done because the action was not in an executable state.
     */
    public static ActionResult skipped(String message) {
        return new ActionResult(false, true, message, Map.of(), Map.of());
    }

    public Map<String, Object> toResultMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", success);
        result.put("message", message);
        result.put("before", before);
        result.put("data", data);
        return result;
    }
}
