package com.tclmcp.mcp.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfig;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;
import com.tclmcp.mcp.utils.Json;

/**
 * Generates JSON Schemas from Java record types using victools/jsonschema-generator.
 * Property names follow the snake_case naming {@link Json} serializes with.
 */
public final class SchemaGenerator {
    public static final String SCHEMA_URI = SchemaVersion.DRAFT_2020_12.getIdentifier();

    private static final com.github.victools.jsonschema.generator.SchemaGenerator GENERATOR;

    static {
        final JacksonModule jacksonModule = new JacksonModule(JacksonOption.RESPECT_JSONPROPERTY_REQUIRED);
        final SchemaGeneratorConfigBuilder configBuilder =
            new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .with(jacksonModule)
                .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT);
        // Schema property names match the snake_case Json serializes with
        configBuilder.forFields()
            .withPropertyNameOverrideResolver(field -> Json.toSnakeCase(field.getDeclaredName()));
        final SchemaGeneratorConfig config = configBuilder.build();
        GENERATOR = new com.github.victools.jsonschema.generator.SchemaGenerator(config);
    }

    private SchemaGenerator() {}

    /**
     * Top-level schema for a response type.
     *
     * @return the schema, or null if responseType is Void
     */
    public static ObjectNode generateSchema(final Class<?> responseType) {
        if (responseType == Void.class || responseType == void.class) {
            return null;
        }
        return GENERATOR.generateSchema(responseType);
    }

    /**
     * Schema for a type nested inside another schema, without the {@code $schema} keyword.
     */
    public static ObjectNode itemSchema(final Class<?> type) {
        final ObjectNode schema = GENERATOR.generateSchema(type);
        schema.remove("$schema");
        return schema;
    }
}
