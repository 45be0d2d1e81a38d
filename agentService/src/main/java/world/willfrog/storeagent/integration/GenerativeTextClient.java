package world.willfrog.storeagent.integration;

import java.util.Map;

/**
 * Best-effort structured text generation. Callers must tolerate failure.
 */
public interface GenerativeTextClient {

    Map<String, Object> generateJson(String prompt, Map<String, Object> schema);
}
