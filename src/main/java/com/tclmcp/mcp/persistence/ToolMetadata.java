package com.tclmcp.mcp.persistence;

import java.time.Instant;

/**
 * Bookkeeping stored alongside each persisted tool.
 */
public record ToolMetadata(
    String id,             // stable across re-saves of the same path
    Instant createdAt,
    Instant updatedAt,
    String checksum,       // checksum of the script body
    int fileVersion        // incremented on every save
) {}
