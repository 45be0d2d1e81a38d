package world.willfrog.storeagent.integration;

import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.exception.ExternalServiceException;
import world.willfrog.storeagent.support.JsonSupport;

import java.time.Duration;
import java.util.Map;

@Slf4j
@Component
public class LangChainGenerativeTextClient implements GenerativeTextClient {

    private static final String SERVICE = "generative-text";

    private final ChatLanguageModel chatLanguageModel;
    private final ExternalCallGuard guard;
    private final JsonSupport json;

    @Value("${store-agent.timeouts.generative-seconds:60}")
    private long timeoutSeconds = 60;

    public LangChainGenerativeTextClient(ChatLanguageModel chatLanguageModel, ExternalCallGuard guard, JsonSupport json) {
        this.chatLanguageModel = chatLanguageModel;
        this.guard = guard;
        this.json = json;
    }

    @Override
    public Map<String, Object> generateJson(String prompt, Map<String, Object> schema) {
        String request = prompt
                + "\n\nRespond with a single JSON object matching this JSON schema, without markdown fences:\n"
                + json.toJson(schema);
        String raw = guard.call(SERVICE, Duration.ofSeconds(timeoutSeconds), () -> chatLanguageModel.generate(request));
        String body = stripFences(raw);
        if (StringUtils.isBlank(body) || !body.startsWith("{")) {
            throw new ExternalServiceException(SERVICE, "response is not a JSON object");
        }
        Map<String, Object> parsed = json.toMap(body);
        if (parsed.isEmpty()) {
            throw new ExternalServiceException(SERVICE, "response could not be parsed");
        }
        return parsed;
    }

    static String stripFences(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }
}
