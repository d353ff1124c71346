package com.tclmcp.mcp.persistence;

import com.tclmcp.mcp.model.ToolDefinition;

/**
 * On-disk document for one tool: {@code {metadata, tool}}.
 */
public record PersistedTool(ToolMetadata metadata, ToolDefinition tool) {}
