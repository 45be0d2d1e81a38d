package world.willfrog.storeagent.common.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over loosely-typed JSON maps (action payloads, event payloads, connector results).
 * <p>
 * Missing keys and unparseable values resolve to {@code null} (or the given fallback) instead of throwing;
 * callers that need a value to be present validate that separately.
 */
public final class PayloadValues {

    private PayloadValues() {
    }

    public static boolean has(Map<String, Object> map, String key) {
        return map != null && map.get(key) != null;
    }

    public static String string(Map<String, Object> map, String key) {
        if (!has(map, key)) {
            return null;
        }
        String value = String.valueOf(map.get(key));
        return StringUtils.isBlank(value) ? null : value;
    }

    public static BigDecimal decimal(Map<String, Object> map, String key) {
        if (!has(map, key)) {
            return null;
        }
        return toDecimal(map.get(key));
    }

    public static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        String text = String.valueOf(value).trim();
        if (!NumberUtils.isCreatable(text)) {
            return null;
        }
        return new BigDecimal(text);
    }

    public static Integer integer(Map<String, Object> map, String key) {
        BigDecimal value = decimal(map, key);
        return value == null ? null : value.intValue();
    }

    public static Long longValue(Map<String, Object> map, String key) {
        BigDecimal value = decimal(map, key);
        return value == null ? null : value.longValue();
    }

    public static boolean bool(Map<String, Object> map, String key, boolean fallback) {
        if (!has(map, key)) {
            return fallback;
        }
        Object value = map.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(value));
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> map, String key) {
        if (!has(map, key) || !(map.get(key) instanceof Map)) {
            return Collections.emptyMap();
        }
        return (Map<String, Object>) map.get(key);
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Map<String, Object> map, String key) {
        if (!has(map, key) || !(map.get(key) instanceof List)) {
            return Collections.emptyList();
        }
        return (List<Object>) map.get(key);
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> mapList(Map<String, Object> map, String key) {
        return list(map, key).stream()
                .filter(item -> item instanceof Map)
                .map(item -> (Map<String, Object>) item)
                .toList();
    }
}
