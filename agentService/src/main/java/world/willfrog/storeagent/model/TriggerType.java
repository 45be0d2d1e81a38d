package world.willfrog.storeagent.model;

public enum TriggerType {
    SCHEDULE,
    EVENT,
    MANUAL
}
