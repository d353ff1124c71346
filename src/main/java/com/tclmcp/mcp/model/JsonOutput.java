package com.tclmcp.mcp.model;

import com.tclmcp.mcp.utils.Json;

/**
 * Output for tools that return structured data.
 * The data object is serialized to JSON via Jackson.
 */
public record JsonOutput(Object data) implements ToolOutput {

    @Override
    public String toStructuredJson() {
        return Json.serialize(data);
    }

    @Override
    public String toDisplayText() {
        return Json.serializePretty(data);
    }
}
