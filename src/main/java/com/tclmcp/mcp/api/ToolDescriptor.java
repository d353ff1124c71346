package com.tclmcp.mcp.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.tclmcp.mcp.model.ParameterDefinition;
import com.tclmcp.mcp.model.ToolDefinition;

/**
 * One entry of a tools listing: protocol name, description and JSON Schemas.
 */
public record ToolDescriptor(
    String name,
    String description,
    @JsonProperty("inputSchema") Map<String, Object> inputSchema,
    @JsonProperty("outputSchema") JsonNode outputSchema
) {
    /**
     * Descriptor of a Tcl tool, with an input schema built from its declared parameters.
     */
    public static ToolDescriptor forTool(ToolDefinition tool) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        for (final ParameterDefinition param : tool.parameters()) {
            properties.put(param.name(),
                ParamType.fromTypeName(param.typeName()).toJsonSchemaMap(param.description(), null, null));
        }
        final List<String> required = tool.parameters().stream()
            .filter(ParameterDefinition::required)
            .map(ParameterDefinition::name)
            .toList();
        return new ToolDescriptor(tool.path().toEncodedName(), tool.description(),
            objectSchema(properties, required), null);
    }

    static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("$schema", SchemaGenerator.SCHEMA_URI);
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }
}
