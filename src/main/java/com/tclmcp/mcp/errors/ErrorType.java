package com.tclmcp.mcp.errors;

/**
 * Categories of failures reported across the tool box boundary.
 */
public enum ErrorType {
    PATH_FORMAT,
    NAMESPACE_VIOLATION,
    DUPLICATE_TOOL,
    NOT_FOUND,
    MISSING_PARAMETER,
    INVALID_ARGUMENT,
    INTERPRETER,
    PERSISTENCE,
    DISCOVERY_IO,
    NOT_PRIVILEGED,
    INTERNAL
}
