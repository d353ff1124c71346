package com.tclmcp.mcp.persistence;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serialized form of {@code index.json}: entries keyed by canonical path string.
 */
public record ToolIndex(Map<String, ToolIndexEntry> tools, Instant lastUpdated) {

    public ToolIndex {
        tools = tools == null ? new TreeMap<>() : new TreeMap<>(tools);
    }

    public static ToolIndex empty() {
        return new ToolIndex(new TreeMap<>(), Instant.EPOCH);
    }
}
