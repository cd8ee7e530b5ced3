package com.atlas.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/**
 * JSON reading and writing for webhook bodies and stream payloads.
 * <p>
 * Payloads are loosely shaped, so they are read as a {@link JsonNode} tree and individual fields
 * are pulled out by the caller. The {@code JavaTimeModule} writes {@code Instant} as ISO 8601.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Parses a JSON document.
     *
     * @throws EventSerializationException if the text is not valid JSON
     */
    public static JsonNode readTree(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            return node == null ? MAPPER.createObjectNode() : node;
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Malformed JSON payload", e);
        }
    }

    /**
     * Parses a raw request body.
     *
     * @throws EventSerializationException if the bytes are not valid JSON
     */
    public static JsonNode readTree(byte[] body) {
        if (body == null || body.length == 0) {
            return MAPPER.createObjectNode();
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            return node == null ? MAPPER.createObjectNode() : node;
        } catch (IOException e) {
            throw new EventSerializationException("Malformed JSON body", e);
        }
    }

    /**
     * Serializes any value to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
