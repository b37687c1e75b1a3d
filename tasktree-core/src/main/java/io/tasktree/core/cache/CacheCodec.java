package io.tasktree.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Objects;

/// JSON encoding of {@link CacheEntry} values.
///
/// Data is decoded into plain JSON values (maps, lists, strings, numbers,
/// booleans) unless a target type is given.
public final class CacheCodec {

    private static final ObjectMapper MAPPER =
            JsonMapper.builder()
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .build();

    private CacheCodec() {}

    /// @param entry the entry, not null
    /// @return the JSON text, never null
    /// @throws IllegalArgumentException if the data cannot be serialized
    public static String encode(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        try {
            return MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode cache entry", e);
        }
    }

    /// @param json the stored text, not null
    /// @param dataType type to decode the data into, or null for plain JSON values
    /// @return the entry, never null
    /// @throws IllegalArgumentException if the text is not a cache entry
    public static CacheEntry decode(String json, Class<?> dataType) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Not a cache entry: " + json);
            }
            JsonNode validator = node.get("validator");
            JsonNode data = node.get("data");
            Class<?> target = dataType != null ? dataType : Object.class;
            Object value = data == null || data.isNull() ? null : MAPPER.treeToValue(data, target);
            return new CacheEntry(
                    validator == null || validator.isNull() ? null : validator.asText(), value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode cache entry", e);
        }
    }
}
