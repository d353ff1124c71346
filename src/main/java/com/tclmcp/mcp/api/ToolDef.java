package com.tclmcp.mcp.api;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tclmcp.mcp.errors.ErrorType;
import com.tclmcp.mcp.model.ErrorOutput;
import com.tclmcp.mcp.model.ToolOutput;
import com.tclmcp.mcp.utils.Json;

/**
 * Runtime tool definition built from an @McpTool-annotated method via reflection.
 * Holds the metadata needed to list the tool and to call it with JSON arguments.
 */
public class ToolDef {
    private final String name;              // encoded tool name
    private final String description;       // full description including auto-generated Parameters section
    private final boolean privileged;
    private final List<ToolParamDef> params;
    private final Method method;
    private final Class<?> responseType;    // response record type for schema generation

    private ToolDef(final String name, final String rawDescription, final boolean privileged,
                    final List<ToolParamDef> params, final Method method, final Class<?> responseType) {
        this.name = name;
        this.privileged = privileged;
        this.params = params;
        this.method = method;
        this.responseType = responseType;
        this.description = buildFullDescription(rawDescription, params);
    }

    /**
     * Build a ToolDef from an annotated method using reflection.
     */
    public static ToolDef fromMethod(final Method method, final McpTool annotation) {
        if (!ToolOutput.class.isAssignableFrom(method.getReturnType())) {
            throw new IllegalArgumentException("@McpTool method " + method.getName() + " must return ToolOutput");
        }
        method.setAccessible(true);

        final java.lang.reflect.Parameter[] javaParams = method.getParameters();
        final Type[] genericTypes = method.getGenericParameterTypes();

        final List<ToolParamDef> paramDefs = new ArrayList<>();
        for (int i = 0; i < javaParams.length; i++) {
            final Param paramAnn = javaParams[i].getAnnotation(Param.class);
            if (paramAnn == null) {
                throw new IllegalArgumentException("Parameter " + javaParams[i].getName() + " of "
                    + method.getName() + " is missing @Param");
            }
            final String paramName = paramAnn.name().isEmpty()
                ? Json.toSnakeCase(javaParams[i].getName())
                : paramAnn.name();
            final boolean required = paramAnn.defaultValue().equals(Param.REQUIRED);
            final JsonNode defaultValue = required ? null : parseDefault(paramAnn.defaultValue());

            paramDefs.add(new ToolParamDef(paramName, ParamType.inferFrom(genericTypes[i]), genericTypes[i],
                required, defaultValue, paramAnn.value()));
        }

        return new ToolDef(annotation.name(), annotation.description(), annotation.privileged(),
            List.copyOf(paramDefs), method, annotation.responseType());
    }

    /**
     * Convert the JSON arguments to the method's parameter types and call it.
     * Missing required or malformed arguments are reported as an {@link ErrorOutput}
     * without invoking the method.
     */
    public ToolOutput invoke(final Object target, final JsonNode arguments) {
        final JsonNode args = arguments != null && arguments.isObject() ? arguments : Json.emptyObject();
        final Object[] values = new Object[params.size()];
        for (int i = 0; i < params.size(); i++) {
            final ToolParamDef p = params.get(i);
            JsonNode node = args.get(p.name());
            if (node == null || node.isNull()) {
                if (p.required()) {
                    return new ErrorOutput(ErrorType.MISSING_PARAMETER, "Missing required parameter: " + p.name());
                }
                node = p.defaultValue();
            }
            if (node == null) {
                continue;
            }
            try {
                values[i] = Json.convertToType(node, p.javaType());
            } catch (IllegalArgumentException e) {
                return new ErrorOutput(ErrorType.INVALID_ARGUMENT,
                    "Invalid value for parameter '" + p.name() + "': " + e.getMessage());
            }
        }

        try {
            return (ToolOutput) method.invoke(target, values);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot call tool method " + method.getName(), e);
        } catch (InvocationTargetException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Tool " + name + " failed", cause);
        }
    }

    /**
     * Listing entry for this tool.
     */
    public ToolDescriptor toDescriptor() {
        return new ToolDescriptor(name, description, buildInputSchemaMap(),
            SchemaGenerator.generateSchema(responseType));
    }

    /**
     * Build the input schema as a Map for Jackson serialization.
     */
    Map<String, Object> buildInputSchemaMap() {
        final Map<String, Object> properties = new LinkedHashMap<>();
        for (final ToolParamDef p : params) {
            properties.put(p.name(), p.type().toJsonSchemaMap(p.description(), itemType(p.javaType()),
                p.defaultValue()));
        }
        final List<String> required = params.stream()
            .filter(ToolParamDef::required)
            .map(ToolParamDef::name)
            .toList();
        return ToolDescriptor.objectSchema(properties, required);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public boolean isPrivileged() { return privileged; }
    public List<ToolParamDef> getParams() { return params; }

    private static Class<?> itemType(final Type javaType) {
        if (javaType instanceof ParameterizedType pt && pt.getActualTypeArguments().length == 1
                && pt.getActualTypeArguments()[0] instanceof Class<?> c) {
            return c;
        }
        if (javaType instanceof Class<?> c && c.isArray()) {
            return c.getComponentType();
        }
        return null;
    }

    private static String buildFullDescription(final String rawDescription, final List<ToolParamDef> params) {
        if (params.isEmpty()) return rawDescription;

        final StringBuilder sb = new StringBuilder(rawDescription);
        sb.append("\n\n    Parameters:\n");
        for (final ToolParamDef p : params) {
            sb.append("        ").append(p.name()).append(": ").append(p.description());
            if (!p.required() && p.defaultValue() != null) {
                sb.append(" (default: ").append(p.defaultValue().isTextual()
                    ? p.defaultValue().asText() : p.defaultValue().toString()).append(")");
            }
            sb.append("\n");
        }
        return sb.toString().stripTrailing();
    }

    // JSON objects and arrays are parsed, anything else is a string; empty means no default
    private static JsonNode parseDefault(final String defaultStr) {
        if (defaultStr.isEmpty()) return null;
        final char first = defaultStr.charAt(0);
        if (first == '{' || first == '[') {
            return Json.readTree(defaultStr);
        }
        return TextNode.valueOf(defaultStr);
    }
}
