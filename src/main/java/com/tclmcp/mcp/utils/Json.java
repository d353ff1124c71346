package com.tclmcp.mcp.utils;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper singleton for JSON serialization.
 * Configured with NON_NULL inclusion, snake_case naming and ISO-8601 timestamps.
 */
public final class Json {
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
        (PropertyNamingStrategies.SnakeCaseStrategy) PropertyNamingStrategies.SNAKE_CASE;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .setPropertyNamingStrategy(SNAKE_CASE);

    private Json() {}

    /**
     * Convert a camelCase string to snake_case.
     */
    public static String toSnakeCase(final String camel) {
        return SNAKE_CASE.translate(camel);
    }

    /**
     * Serialize an object to a JSON string.
     *
     * @throws RuntimeException if serialization fails
     */
    public static String serialize(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization failed", e);
        }
    }

    /**
     * Serialize an object to an indented JSON string.
     *
     * @throws RuntimeException if serialization fails
     */
    public static String serializePretty(final Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization failed", e);
        }
    }

    /**
     * Write an object as indented JSON to a file, replacing its contents.
     */
    public static void writeFile(final Path file, final Object value) throws IOException {
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
    }

    /**
     * Read a JSON file into the given type.
     */
    public static <T> T readFile(final Path file, final Class<T> type) throws IOException {
        return MAPPER.readValue(file.toFile(), type);
    }

    /**
     * Deserialize a JSON string to the given type.
     *
     * @throws RuntimeException if deserialization fails
     */
    public static <T> T readValue(final String json, final Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON deserialization failed", e);
        }
    }

    /**
     * Convert a value (e.g. a JsonNode) to the given type using Jackson conversion.
     */
    public static <T> T convertValue(final Object value, final Class<T> type) {
        return MAPPER.convertValue(value, type);
    }

    /**
     * Convert a value to a generic type, e.g. {@code new TypeReference<Map<String, Object>>() {}}.
     */
    public static <T> T convertValue(final Object value, final TypeReference<T> type) {
        return MAPPER.convertValue(value, type);
    }

    /**
     * Convert a JsonNode to a possibly generic Java type, such as a method parameter's
     * {@code List<ParameterDefinition>}.
     *
     * @throws IllegalArgumentException if the node does not fit the type
     */
    public static Object convertToType(final JsonNode node, final Type type) {
        return MAPPER.convertValue(node, MAPPER.getTypeFactory().constructType(type));
    }

    /**
     * Parse a JSON string into a JsonNode tree.
     *
     * @return the parsed JsonNode, or null if the input is null or empty
     * @throws RuntimeException if parsing fails
     */
    public static JsonNode readTree(final String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON parsing failed", e);
        }
    }

    /**
     * Fresh empty object node, for callers that pass no parameters.
     */
    public static ObjectNode emptyObject() {
        return JsonNodeFactory.instance.objectNode();
    }
}
