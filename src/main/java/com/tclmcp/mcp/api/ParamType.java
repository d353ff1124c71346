package com.tclmcp.mcp.api;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.tclmcp.mcp.utils.Json;

/**
 * JSON Schema types of tool arguments, for both built-in tools (inferred from
 * Java parameter types) and Tcl tools (from the loose {@code type_name} labels
 * of their parameter definitions).
 */
public enum ParamType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String jsonSchemaType;

    ParamType(String jsonSchemaType) {
        this.jsonSchemaType = jsonSchemaType;
    }

    public String jsonSchemaType() {
        return jsonSchemaType;
    }

    /**
     * Infer ParamType from a Java reflection Type.
     */
    public static ParamType inferFrom(Type javaType) {
        if (javaType == String.class) return STRING;
        if (javaType == int.class || javaType == Integer.class) return INTEGER;
        if (javaType == long.class || javaType == Long.class) return INTEGER;
        if (javaType == double.class || javaType == Double.class) return NUMBER;
        if (javaType == boolean.class || javaType == Boolean.class) return BOOLEAN;

        final Type raw = javaType instanceof ParameterizedType pt ? pt.getRawType() : javaType;
        if (raw instanceof Class<?> c) {
            if (c.isArray() || Collection.class.isAssignableFrom(c)) return ARRAY;
            if (Map.class.isAssignableFrom(c) || JsonNode.class.isAssignableFrom(c)) return OBJECT;
        }

        // Fallback
        return STRING;
    }

    /**
     * Map a Tcl tool's declared type label to a schema type. Unknown or missing labels are strings.
     */
    public static ParamType fromTypeName(String typeName) {
        if (typeName == null) {
            return STRING;
        }
        return switch (typeName.strip().toLowerCase()) {
            case "integer", "int" -> INTEGER;
            case "number", "float", "double" -> NUMBER;
            case "boolean", "bool" -> BOOLEAN;
            case "array", "list" -> ARRAY;
            case "object", "dict" -> OBJECT;
            default -> STRING;
        };
    }

    /**
     * Build the JSON Schema fragment for one argument of this type.
     *
     * @param itemType element type for arrays, or null
     * @param defaultValue default to advertise, or null
     */
    public Map<String, Object> toJsonSchemaMap(String description, Class<?> itemType, JsonNode defaultValue) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", jsonSchemaType);
        if (description != null && !description.isEmpty()) {
            schema.put("description", description);
        }
        if (this == ARRAY && itemType != null) {
            schema.put("items", itemType == String.class
                ? Map.of("type", "string")
                : Json.convertValue(SchemaGenerator.itemSchema(itemType), Map.class));
        }
        if (defaultValue != null) {
            schema.put("default", defaultValue);
        }
        return schema;
    }
}
