package world.willfrog.storeagent.support;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON columns are stored as text; this is the one place they are (de)serialised.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonSupport {

    private final ObjectMapper objectMapper;

    public String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException("failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses a JSON object; blank or malformed input yields an empty mutable map.
     */
    public Map<String, Object> toMap(String json) {
        if (StringUtils.isBlank(json)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> map = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            return map == null ? new LinkedHashMap<>() : map;
        } catch (Exception e) {
            log.warn("Parse json object failed: {}", StringUtils.abbreviate(json, 200));
            return new LinkedHashMap<>();
        }
    }

    public List<Object> toList(String json) {
        if (StringUtils.isBlank(json)) {
            return List.of();
        }
        try {
            List<Object> list = objectMapper.readValue(json, new TypeReference<List<Object>>() {});
            return list == null ? List.of() : list;
        } catch (Exception e) {
            log.warn("Parse json array failed: {}", StringUtils.abbreviate(json, 200));
            return List.of();
        }
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }
}
