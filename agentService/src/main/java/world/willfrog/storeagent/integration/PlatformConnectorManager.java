package world.willfrog.storeagent.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.config.StoreAgentProperties;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.exception.ExternalServiceException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the connector of a marketplace connection. Every returned connector is wrapped so each call
 * carries the configured connector timeout.
 */
@Slf4j
@Component
public class PlatformConnectorManager {

    private final Map<String, PlatformConnectorProvider> providers = new HashMap<>();
    private final ExternalCallGuard guard;
    private final StoreAgentProperties properties;

    public PlatformConnectorManager(List<PlatformConnectorProvider> providers,
                                    ExternalCallGuard guard,
                                    StoreAgentProperties properties) {
        for (PlatformConnectorProvider provider : providers) {
            this.providers.put(provider.platform().toLowerCase(Locale.ROOT), provider);
        }
        this.guard = guard;
        this.properties = properties;
        log.info("Platform connectors available: {}", this.providers.keySet());
    }

    public PlatformConnector connectorFor(StoreMarketplace marketplace) {
        String platform = marketplace.getPlatform() == null ? "" : marketplace.getPlatform().toLowerCase(Locale.ROOT);
        PlatformConnectorProvider provider = providers.get(platform);
        if (provider == null) {
            throw new ExternalServiceException("connector:" + platform, "no connector registered for platform");
        }
        Duration timeout = Duration.ofSeconds(properties.getTimeouts().getConnectorSeconds());
        return new GuardedConnector("connector:" + platform, provider.create(marketplace), guard, timeout);
    }

    private record GuardedConnector(String service,
                                    PlatformConnector delegate,
                                    ExternalCallGuard guard,
                                    Duration timeout) implements PlatformConnector {

        @Override
        public List<ExternalOrder> getOrders(OffsetDateTime since) {
            return guard.call(service, timeout, () -> delegate.getOrders(since));
        }

        @Override
        public Optional<ExternalOrder> getOrder(String externalId) {
            return guard.call(service, timeout, () -> delegate.getOrder(externalId));
        }

        @Override
        public String createProduct(PlatformProduct product) {
            return guard.call(service, timeout, () -> delegate.createProduct(product));
        }

        @Override
        public boolean updateProduct(String externalId, PlatformProduct product) {
            return guard.call(service, timeout, () -> delegate.updateProduct(externalId, product));
        }

        @Override
        public Map<String, Boolean> bulkUpdateInventory(List<InventoryUpdate> updates) {
            return guard.call(service, timeout, () -> delegate.bulkUpdateInventory(updates));
        }

        @Override
        public CompetitivePricing getCompetitivePricing(String externalId) {
            return guard.call(service, timeout, () -> delegate.getCompetitivePricing(externalId));
        }
    }
}
