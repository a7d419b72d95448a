package authkit.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Helpers for the loosely typed JSON objects exchanged with authorization servers
 * and stored in credential and config files.
 */
public final class JsonMaps {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonMaps() {}

    /**
     * Parse a JSON object.
     *
     * @param json the JSON text
     * @return the object as an ordered map
     * @throws JsonProcessingException if the text is not a JSON object
     */
    public static Map<String, Object> parseObject(String json) throws JsonProcessingException {
        final var parsed = OBJECT_MAPPER.readValue(json, MAP_TYPE);
        if (parsed == null) {
            throw new IllegalArgumentException("JSON document is null, expected an object");
        }
        return parsed;
    }

    /**
     * Parse a JSON object, returning empty for anything that is not an object.
     */
    public static Optional<Map<String, Object>> tryParseObject(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parseObject(json));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static String toJson(Map<String, ?> map) {
        try {
            return OBJECT_MAPPER.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON object", e);
        }
    }

    public static Optional<String> string(Map<String, ?> map, String key) {
        final var value = map.get(key);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    public static Optional<Long> number(Map<String, ?> map, String key) {
        final var value = map.get(key);
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Read a string list that may be stored as a JSON array or as a single
     * space separated string.
     */
    public static List<String> stringList(Map<String, ?> map, String key) {
        final var value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> c) {
            final var result = new ArrayList<String>(c.size());
            for (var item : c) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return List.copyOf(result);
        }
        final var text = value.toString().trim();
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(text.split("\\s+"));
    }

    /**
     * Copy a map, dropping null values.
     */
    public static Map<String, Object> withoutNulls(Map<String, ?> map) {
        final var copy = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
