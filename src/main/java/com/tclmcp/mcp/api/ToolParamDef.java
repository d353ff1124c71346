package com.tclmcp.mcp.api;

import java.lang.reflect.Type;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runtime definition of a single tool argument, built from @Param annotation + reflection.
 */
public record ToolParamDef(
    String name,           // argument key in the call's JSON object
    ParamType type,        // inferred from Java type
    Type javaType,         // target of JSON conversion at call time
    boolean required,      // true if no defaultValue specified
    JsonNode defaultValue, // parsed default, or null
    String description     // from @Param.value()
) {}
