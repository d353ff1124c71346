package com.tclmcp.mcp.errors;

/**
 * Thrown when a tool path or encoded tool name is malformed.
 */
public class PathFormatException extends ToolException {
    private static final long serialVersionUID = 1L;

    public PathFormatException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.PATH_FORMAT;
    }
}
