package world.willfrog.storeagent.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.ValidationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link AgentConfig} from an agent's defaults and a store's JSON overrides, validating the overrides
 * against the agent's schema.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentConfigResolver {

    private final ObjectMapper objectMapper;

    public AgentConfig resolve(Agent agent, StoreAgent storeAgent) {
        Map<String, Object> overrides = parseOverrides(storeAgent == null ? null : storeAgent.getConfig());
        Map<String, Object> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            if (!agent.getDefaultConfig().containsKey(entry.getKey())) {
                log.warn("Ignore unknown config override agent={} storeId={} key={}",
                        agent.getSlug(), storeAgent.getStoreId(), entry.getKey());
                continue;
            }
            accepted.put(entry.getKey(), entry.getValue());
        }
        List<String> errors = validateValues(agent, accepted);
        if (!errors.isEmpty()) {
            throw new ValidationException(String.format("invalid config for agent %s: %s", agent.getSlug(), String.join("; ", errors)));
        }
        return new AgentConfig(agent.getSlug(), agent.getDefaultConfig(), accepted);
    }

    /**
     * Strict check used when a store saves overrides: unknown keys are rejected too.
     */
    public void validateOverrides(Agent agent, Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return;
        }
        List<String> errors = new ArrayList<>();
        for (String key : overrides.keySet()) {
            if (!agent.getDefaultConfig().containsKey(key)) {
                errors.add("unknown key " + key);
            }
        }
        errors.addAll(validateValues(agent, overrides));
        if (!errors.isEmpty()) {
            throw new ValidationException(String.format("invalid config for agent %s: %s", agent.getSlug(), String.join("; ", errors)));
        }
    }

    public Map<String, Object> parseOverrides(String json) {
        if (StringUtils.isBlank(json)) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (Exception e) {
            throw new ValidationException("config overrides are not a JSON object: " + e.getMessage());
        }
    }

    private List<String> validateValues(Agent agent, Map<String, Object> values) {
        List<String> errors = new ArrayList<>();
        Map<String, ConfigField> schema = agent.getConfigSchema();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            ConfigField field = schema.get(entry.getKey());
            Object value = entry.getValue();
            if (field == null || value == null) {
                continue;
            }
            String error = check(field, value);
            if (error != null) {
                errors.add(entry.getKey() + " " + error);
            }
        }
        return errors;
    }

    private String check(ConfigField field, Object value) {
        switch (field.getType()) {
            case NUMBER -> {
                BigDecimal number = PayloadValues.toDecimal(value);
                if (number == null || value instanceof Boolean) {
                    return "must be a number";
                }
                if (field.getMin() != null && number.compareTo(field.getMin()) < 0) {
                    return "must be >= " + field.getMin();
                }
                if (field.getMax() != null && number.compareTo(field.getMax()) > 0) {
                    return "must be <= " + field.getMax();
                }
                return null;
            }
            case BOOLEAN -> {
                return value instanceof Boolean ? null : "must be a boolean";
            }
            case STRING -> {
                return value instanceof String ? null : "must be a string";
            }
            case SELECT -> {
                if (field.getOptions() != null && !field.getOptions().containsKey(String.valueOf(value))) {
                    return "must be one of " + field.getOptions().keySet();
                }
                return null;
            }
            case MULTISELECT -> {
                if (!(value instanceof List<?> list)) {
                    return "must be a list";
                }
                if (field.getOptions() != null) {
                    for (Object item : list) {
                        if (!field.getOptions().containsKey(String.valueOf(item))) {
                            return "contains unsupported value " + item;
                        }
                    }
                }
                return null;
            }
            case ARRAY -> {
                return value instanceof List ? null : "must be a list";
            }
            case OBJECT -> {
                return value instanceof Map ? null : "must be an object";
            }
            default -> {
                return null;
            }
        }
    }
}
