package world.willfrog.storeagent.model;

/**
 * Scheduling metadata only; the engine does not branch on it.
 */
public enum AgentType {
    BACKGROUND,
    REACTIVE,
    PROACTIVE,
    EVENT_TRIGGERED,
    GOAL_ORIENTED
}
