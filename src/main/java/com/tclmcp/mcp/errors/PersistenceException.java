package com.tclmcp.mcp.errors;

/**
 * I/O or serialization failure in the file-backed tool store.
 */
public class PersistenceException extends ToolException {
    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.PERSISTENCE;
    }
}
