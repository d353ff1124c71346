package com.tclmcp.mcp.errors;

/**
 * Base class for every failure the tool engine reports to callers.
 * Each subclass carries a fixed {@link ErrorType} so the boundary can map it
 * to a typed error without inspecting messages.
 */
public abstract class ToolException extends Exception {
    private static final long serialVersionUID = 1L;

    protected ToolException(String message) {
        super(message);
    }

    protected ToolException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the error category of this failure
     */
    public abstract ErrorType getErrorType();
}
