package com.tclmcp.mcp.model;

import java.util.List;

import com.tclmcp.mcp.namespace.ToolPath;

/**
 * A tool: its address, description, Tcl script body and declared parameters.
 */
public record ToolDefinition(
    ToolPath path,
    String description,
    String script,
    List<ParameterDefinition> parameters
) {
    public ToolDefinition {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
