package com.tclmcp.mcp.interp;

/**
 * Script-level error raised while evaluating Tcl. Converted to an
 * {@link com.tclmcp.mcp.errors.InterpreterException} at the runtime boundary.
 */
class TclError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    TclError(String message) {
        super(message, null, false, false);
    }
}
