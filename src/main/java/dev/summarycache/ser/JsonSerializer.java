package dev.summarycache.ser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Jackson-backed serializer. Instants are written as ISO-8601 strings; unknown properties are ignored so
 * older binaries can read payloads written by newer ones.
 */
public class JsonSerializer<T> implements Serializer<T> {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Override
    public byte[] serialize(T value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize value to JSON", e);
        }
    }

    @Override
    public T deserialize(byte[] bytes, Class<T> type) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (Exception e) {
            throw new RuntimeException("Failed to deserialize JSON to type " + type.getName(), e);
        }
    }

    /**
     * Parses without binding, for structural inspection of stored payloads.
     *
     * @throws IOException if the bytes are not well-formed JSON
     */
    public static JsonNode readTree(byte[] bytes) throws IOException {
        JsonNode node = MAPPER.readTree(bytes);
        if (node == null || node.isMissingNode()) {
            throw new IOException("Empty JSON payload");
        }
        return node;
    }

    public static <V> V treeToValue(JsonNode node, Class<V> type) throws JsonProcessingException {
        return MAPPER.treeToValue(node, type);
    }
}
