package com.tclmcp.mcp.errors;

/**
 * Thrown when no tool is registered under the requested path.
 */
public class ToolNotFoundException extends ToolException {
    private static final long serialVersionUID = 1L;

    public ToolNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.NOT_FOUND;
    }
}
