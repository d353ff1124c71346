package com.tclmcp.mcp.errors;

/**
 * I/O failure while scanning the tools directory. Aborts only the current scan.
 */
public class DiscoveryException extends ToolException {
    private static final long serialVersionUID = 1L;

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.DISCOVERY_IO;
    }
}
