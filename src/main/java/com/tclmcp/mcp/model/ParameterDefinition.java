package com.tclmcp.mcp.model;

/**
 * Declared parameter of a tool. Bound to a same-named Tcl variable at execution time.
 */
public record ParameterDefinition(
    String name,           // Tcl variable name
    String description,
    boolean required,      // execution fails before evaluation when absent
    String typeName        // loose label (string, number, ...) used for schemas only
) {
    public static ParameterDefinition required(String name, String typeName, String description) {
        return new ParameterDefinition(name, description, true, typeName);
    }

    public static ParameterDefinition optional(String name, String typeName, String description) {
        return new ParameterDefinition(name, description, false, typeName);
    }
}
