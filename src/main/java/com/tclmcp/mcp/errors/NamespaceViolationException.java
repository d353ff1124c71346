package com.tclmcp.mcp.errors;

/**
 * Thrown when a caller tries to create or remove a tool outside a user namespace.
 */
public class NamespaceViolationException extends ToolException {
    private static final long serialVersionUID = 1L;

    public NamespaceViolationException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.NAMESPACE_VIOLATION;
    }
}
