package io.tasktree.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tasktree.core.trace.TraceNode;
import java.util.Map;
import java.util.Objects;

/// Converts trace trees to and from JSON.
///
/// Traces are written in their {@link TraceNode#toRecord() record} form, the
/// shape the trace viewer reads. Reading yields either that plain map form or
/// a typed {@link TraceRecord}.
///
/// ### Usage
/// {@snippet :
/// String json = TraceSerializer.toJson(context.getTraceRoot());
/// TraceRecord record = TraceSerializer.fromJson(json);
/// double spent = record.totalCost();
/// }
///
/// @implNote Thread-safe. One configured mapper is shared by all calls.
public final class TraceSerializer {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = createMapper();

    private TraceSerializer() {}

    /// Serializes a trace tree to pretty-printed JSON.
    ///
    /// @param root the span to serialize with its subtree, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(TraceNode root) {
        Objects.requireNonNull(root, "root must not be null");
        return toJson(root.toRecord());
    }

    /// Serializes a trace record to pretty-printed JSON.
    ///
    /// @param record a record as produced by {@link TraceNode#toRecord()}, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails, for example
    ///         because an attribute value is not serializable
    public static String toJson(Map<String, Object> record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize trace: " + e.getMessage(), e);
        }
    }

    /// Deserializes a trace into its typed view.
    ///
    /// @param json JSON text, not null
    /// @return the root span, never null
    /// @throws IllegalArgumentException if the text is not a valid trace
    public static TraceRecord fromJson(String json) {
        try {
            return MAPPER.readValue(json, TraceRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize trace: " + e.getMessage(), e);
        }
    }

    /// Deserializes a trace into the plain map form.
    ///
    /// @param json JSON text, not null
    /// @return the record, never null
    /// @throws IllegalArgumentException if the text is not a JSON object
    public static Map<String, Object> recordFromJson(String json) {
        try {
            return MAPPER.readValue(json, RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize trace: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for trace serialization.
    ///
    /// Registers:
    /// - `JavaTimeModule` for `Instant` fields of {@link TraceRecord}
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled, so newer records stay readable
    /// - timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
