package world.willfrog.storeagent.model;

/**
 * AgentAction lifecycle.
 * <ul>
 *   <li>PENDING -> APPROVED -> EXECUTING -> EXECUTED | FAILED</li>
 *   <li>PENDING -> REJECTED</li>
 *   <li>PENDING -> EXECUTING -> EXECUTED | FAILED (no approval needed)</li>
 * </ul>
 * EXECUTING is the claimed, in-progress state held while the handler runs.
 */
public enum AgentActionStatus {
    PENDING,
    APPROVED,
    EXECUTING,
    EXECUTED,
    FAILED,
    REJECTED;

    public boolean isTerminal() {
        return this == EXECUTED || this == FAILED || this == REJECTED;
    }

    public boolean isExecutable() {
        return this == PENDING || this == APPROVED;
    }

    public static AgentActionStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return AgentActionStatus.valueOf(value.trim().toUpperCase());
    }
}
