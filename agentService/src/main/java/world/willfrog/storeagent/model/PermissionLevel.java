package world.willfrog.storeagent.model;

/**
 * Store-level autonomy granted to an agent.
 */
public enum PermissionLevel {
    /** Actions execute automatically unless the action itself asks for approval. */
    AUTO,
    /** Every proposed action waits for a human decision. */
    APPROVE,
    /** The agent is neither scheduled nor given events. */
    BLOCK;

    public static PermissionLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        return PermissionLevel.valueOf(value.trim().toUpperCase());
    }
}
