package world.willfrog.storeagent.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Schema entry describing one agent config key, read by settings UIs and used to validate store overrides.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfigField {

    public enum Type { NUMBER, BOOLEAN, STRING, SELECT, MULTISELECT, ARRAY, OBJECT }

    private final Type type;
    private final String label;
    private final String description;
    /** value -> label, SELECT and MULTISELECT only */
    private final Map<String, String> options;
    private final BigDecimal min;
    private final BigDecimal max;

    public static ConfigField number(String label, String description) {
        return ConfigField.builder().type(Type.NUMBER).label(label).description(description).build();
    }

    public static ConfigField number(String label, String description, int min, int max) {
        return ConfigField.builder().type(Type.NUMBER).label(label).description(description)
                .min(BigDecimal.valueOf(min)).max(BigDecimal.valueOf(max)).build();
    }

    public static ConfigField bool(String label, String description) {
        return ConfigField.builder().type(Type.BOOLEAN).label(label).description(description).build();
    }

    public static ConfigField select(String label, String description, Map<String, String> options) {
        return ConfigField.builder().type(Type.SELECT).label(label).description(description).options(options).build();
    }

    public static ConfigField multiselect(String label, String description, Map<String, String> options) {
        return ConfigField.builder().type(Type.MULTISELECT).label(label).description(description).options(options).build();
    }

    public static ConfigField array(String label, String description) {
        return ConfigField.builder().type(Type.ARRAY).label(label).description(description).build();
    }

    public static ConfigField object(String label, String description) {
        return ConfigField.builder().type(Type.OBJECT).label(label).description(description).build();
    }
}
