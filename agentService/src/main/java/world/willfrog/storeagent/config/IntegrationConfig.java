package world.willfrog.storeagent.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import world.willfrog.storeagent.integration.PriceSearchClient;
import world.willfrog.storeagent.integration.UnconfiguredPriceSearchClient;

@Configuration
public class IntegrationConfig {

    @Bean
    @ConditionalOnMissingBean(PriceSearchClient.class)
    public PriceSearchClient priceSearchClient() {
        return new UnconfiguredPriceSearchClient();
    }
}
