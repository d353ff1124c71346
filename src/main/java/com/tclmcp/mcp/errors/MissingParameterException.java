package com.tclmcp.mcp.errors;

/**
 * Thrown when a required tool parameter was not supplied. The script is never evaluated.
 */
public class MissingParameterException extends ToolException {
    private static final long serialVersionUID = 1L;

    public MissingParameterException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.MISSING_PARAMETER;
    }
}
