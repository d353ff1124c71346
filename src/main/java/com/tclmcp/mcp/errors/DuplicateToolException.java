package com.tclmcp.mcp.errors;

/**
 * Thrown when adding a tool whose path is already registered.
 */
public class DuplicateToolException extends ToolException {
    private static final long serialVersionUID = 1L;

    public DuplicateToolException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.DUPLICATE_TOOL;
    }
}
