package com.tclmcp.mcp.model;

/**
 * Sealed interface for typed tool box results.
 * Each subtype defines its own structured JSON shape and display text format.
 */
public sealed interface ToolOutput permits TextOutput, JsonOutput, ErrorOutput {

    /** Return the structured JSON representation of this output. */
    String toStructuredJson();

    /** Return the human-readable display text. */
    String toDisplayText();

    /** True unless this output reports a failure. */
    default boolean isSuccess() {
        return true;
    }
}
