package com.tclmcp.mcp.model;

import java.nio.file.Path;
import java.util.List;

import com.tclmcp.mcp.namespace.ToolPath;

/**
 * Tool found on disk. Only the file reference is kept; the body is read when the tool runs.
 */
public record DiscoveredTool(
    ToolPath path,
    String description,
    Path filePath,
    List<ParameterDefinition> parameters
) {
    public DiscoveredTool {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * View as a definition whose script is a placeholder pointing at the source file.
     */
    public ToolDefinition toDefinition() {
        return new ToolDefinition(path, description, "# Tool loaded from: " + filePath, parameters);
    }
}
