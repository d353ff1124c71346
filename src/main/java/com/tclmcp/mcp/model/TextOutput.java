package com.tclmcp.mcp.model;

import java.util.Map;

import com.tclmcp.mcp.utils.Json;

/**
 * Output for tools that return free-form text (script results, confirmations).
 */
public record TextOutput(String text) implements ToolOutput {

    @Override
    public String toStructuredJson() {
        return Json.serialize(Map.of("text", text));
    }

    @Override
    public String toDisplayText() {
        return text;
    }
}
