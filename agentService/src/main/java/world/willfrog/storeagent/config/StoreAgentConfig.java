package world.willfrog.storeagent.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StoreAgentProperties.class)
public class StoreAgentConfig {
}
