package com.tclmcp.mcp.persistence;

import java.nio.file.Path;
import java.time.Instant;

import com.tclmcp.mcp.namespace.ToolPath;

/**
 * Index row pointing from a canonical path to its tool document.
 */
public record ToolIndexEntry(ToolPath path, Path filePath, String checksum, Instant updatedAt) {}
