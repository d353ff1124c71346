package com.tclmcp.mcp.errors;

/**
 * Failure reported by the Tcl runtime while evaluating a script. The message is the runtime's own.
 */
public class InterpreterException extends ToolException {
    private static final long serialVersionUID = 1L;

    public InterpreterException(String message) {
        super(message);
    }

    public InterpreterException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INTERPRETER;
    }
}
