package world.willfrog.storeagent.agent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EventReaction {
    private final boolean runRequested;
    /** Handed to the run as trigger data, narrowing what it processes. */
    private final Map<String, Object> scope;
    private final String reason;

    public static EventReaction run(Map<String, Object> scope) {
        return new EventReaction(true, scope == null ? Map.of() : scope, null);
    }

    public static EventReaction ignore(String reason) {
        return new EventReaction(false, Map.of(), reason);
    }
}
