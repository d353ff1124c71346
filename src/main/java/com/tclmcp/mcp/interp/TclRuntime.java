package com.tclmcp.mcp.interp;

import java.util.List;

import com.tclmcp.mcp.errors.InterpreterException;

/**
 * Capability surface of a Tcl interpreter. Implementations are not thread-safe;
 * the executor is the only caller.
 */
public interface TclRuntime {

    /**
     * Evaluate a script.
     *
     * @return the result of the last command, or the captured output when that result is empty
     * @throws InterpreterException if evaluation fails
     */
    String eval(String script) throws InterpreterException;

    /** Set a global scalar variable. */
    void setVar(String name, String value);

    /**
     * Read a global scalar variable.
     *
     * @throws InterpreterException if the variable does not exist
     */
    String getVar(String name) throws InterpreterException;

    boolean hasCommand(String name);

    String name();

    String version();

    List<String> features();

    /** True when scripts cannot reach the filesystem, processes or network. */
    boolean isSafe();
}
