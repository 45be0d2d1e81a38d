package world.willfrog.storeagent.model;

/**
 * AgentRun lifecycle: RUNNING moves exactly once to COMPLETED or FAILED.
 */
public enum AgentRunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
