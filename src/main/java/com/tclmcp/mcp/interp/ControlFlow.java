package com.tclmcp.mcp.interp;

/**
 * Non-error completion codes of Tcl: {@code break}, {@code continue} and {@code return}.
 * Unwinds the Java stack up to the loop or procedure that handles it.
 */
final class ControlFlow extends RuntimeException {
    private static final long serialVersionUID = 1L;

    enum Code { RETURN, BREAK, CONTINUE }

    private final Code code;
    private final String value;

    private ControlFlow(Code code, String value) {
        super(code.name(), null, false, false);
        this.code = code;
        this.value = value;
    }

    static ControlFlow returning(String value) {
        return new ControlFlow(Code.RETURN, value);
    }

    static ControlFlow breaking() {
        return new ControlFlow(Code.BREAK, "");
    }

    static ControlFlow continuing() {
        return new ControlFlow(Code.CONTINUE, "");
    }

    Code code() {
        return code;
    }

    String value() {
        return value;
    }
}
