package world.willfrog.storeagent.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AiConfig {

    @Value("${langchain4j.open-ai.api-key:}")
    private String openAiApiKey;

    @Value("${langchain4j.open-ai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${langchain4j.open-ai.model-name:gpt-4o-mini}")
    private String modelName;

    @Value("${langchain4j.open-ai.max-tokens:2048}")
    private Integer maxTokens;

    @Value("${langchain4j.open-ai.temperature:0.3}")
    private Double temperature;

    @Value("${store-agent.timeouts.generative-seconds:60}")
    private long timeoutSeconds;

    @Bean
    public ChatLanguageModel chatLanguageModel() {
        // an empty key still builds; calls fail and the insight step falls back
        return OpenAiChatModel.builder()
                .apiKey(openAiApiKey.isBlank() ? "unset" : openAiApiKey)
                .baseUrl(openAiBaseUrl)
                .modelName(modelName)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
