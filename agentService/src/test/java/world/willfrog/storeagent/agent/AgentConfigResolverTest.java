package world.willfrog.storeagent.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.ConfigurationException;
import world.willfrog.storeagent.exception.ValidationException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentConfigResolverTest {

    private final AgentConfigResolver resolver = new AgentConfigResolver(AgentFixtures.MAPPER);
    private Agent agent;

    @BeforeEach
    void setUp() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("min_margin_pct", 15);
        defaults.put("strategy", "match");
        defaults.put("channels", List.of("amazon"));
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("min_margin_pct", ConfigField.number("Minimum margin", "Percent", 0, 90));
        schema.put("strategy", ConfigField.select("Strategy", "Pricing strategy",
                Map.of("match", "Match", "undercut", "Undercut")));
        schema.put("channels", ConfigField.multiselect("Channels", "Marketplaces",
                Map.of("amazon", "Amazon", "ebay", "eBay")));
        agent = mock(Agent.class);
        when(agent.getSlug()).thenReturn("pricing");
        when(agent.getDefaultConfig()).thenReturn(defaults);
        when(agent.getConfigSchema()).thenReturn(schema);
    }

    @Test
    void resolve_shouldOverlayValidOverridesAndIgnoreUnknownKeys() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, "pricing",
                "{\"min_margin_pct\":25,\"legacy_flag\":true}");

        AgentConfig config = resolver.resolve(agent, storeAgent);

        assertThat(config.getDecimal("min_margin_pct")).isEqualByComparingTo(new BigDecimal("25"));
        assertThat(config.getString("strategy")).isEqualTo("match");
        assertThat(config.asMap()).doesNotContainKey("legacy_flag");
    }

    @Test
    void resolve_withOutOfRangeOverride_shouldFail() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, "pricing", "{\"min_margin_pct\":120}");

        assertThatThrownBy(() -> resolver.resolve(agent, storeAgent))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("min_margin_pct must be <= 90");
    }

    @Test
    void validateOverrides_shouldRejectUnknownKeysAndBadOptions() {
        Map<String, Object> overrides = Map.of("legacy_flag", true, "channels", List.of("amazon", "etsy"));

        assertThatThrownBy(() -> resolver.validateOverrides(agent, overrides))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown key legacy_flag")
                .hasMessageContaining("contains unsupported value etsy");
    }

    @Test
    void parseOverrides_withMalformedJson_shouldFail() {
        assertThatThrownBy(() -> resolver.parseOverrides("[1,2"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void config_readingUndeclaredKey_shouldFailLoudly() {
        AgentConfig config = AgentConfig.defaultsOf(agent);

        assertThat(config.getStringList("channels")).containsExactly("amazon");
        assertThatThrownBy(() -> config.getInt("max_discount"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("undeclared config key max_discount");
    }
}
