package world.willfrog.storeagent.integration;

import java.util.Map;

/**
 * Fire-and-forget delivery. A return means "queued", not delivered.
 */
public interface NotificationDispatcher {

    /**
     * @return a reference for the queued notification
     */
    String dispatch(Long storeId, Map<String, Object> notification);
}
