package world.willfrog.storeagent.agent;

import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.exception.ConfigurationException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Effective configuration of one agent for one store: defaults overlaid with validated store overrides.
 * <p>
 * Reads are restricted to keys the agent declares in its defaults, so a typo or an undeclared key
 * fails loudly instead of silently falling back.
 */
public class AgentConfig {

    private final String agentSlug;
    private final Map<String, Object> defaults;
    private final Map<String, Object> values;

    public AgentConfig(String agentSlug, Map<String, Object> defaults, Map<String, Object> overrides) {
        this.agentSlug = agentSlug;
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        if (overrides != null) {
            overrides.forEach((key, value) -> {
                if (value != null && defaults.containsKey(key)) {
                    merged.put(key, value);
                }
            });
        }
        this.values = Collections.unmodifiableMap(merged);
    }

    public static AgentConfig defaultsOf(Agent agent) {
        return new AgentConfig(agent.getSlug(), agent.getDefaultConfig(), Map.of());
    }

    public int getInt(String key) {
        BigDecimal value = PayloadValues.toDecimal(require(key));
        if (value == null) {
            throw new ConfigurationException(String.format("agent %s config %s is not numeric", agentSlug, key));
        }
        return value.intValue();
    }

    public BigDecimal getDecimal(String key) {
        BigDecimal value = PayloadValues.toDecimal(require(key));
        if (value == null) {
            throw new ConfigurationException(String.format("agent %s config %s is not numeric", agentSlug, key));
        }
        return value;
    }

    public boolean getBoolean(String key) {
        Object value = require(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(value));
    }

    public String getString(String key) {
        Object value = require(key);
        return value == null ? null : String.valueOf(value);
    }

    public List<String> getStringList(String key) {
        Object value = require(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).map(String::valueOf).toList();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = require(key);
        if (!(value instanceof Map<?, ?>)) {
            return Map.of();
        }
        return (Map<String, Object>) value;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String key) {
        if (!defaults.containsKey(key)) {
            throw new ConfigurationException(String.format("agent %s reads undeclared config key %s", agentSlug, key));
        }
        return values.get(key);
    }
}
