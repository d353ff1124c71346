package com.tclmcp.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link TclToolBox} method as a built-in MCP tool.
 * {@link ToolRegistry} discovers annotated methods at startup and derives the
 * tool's input schema from the method's {@link Param}-annotated parameters.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpTool {
    /** Protocol-safe tool name, the encoded form of the tool's path (e.g. {@code bin___tcl_execute}). */
    String name();

    /** Tool description text. A Parameters: section is auto-appended from @Param annotations. */
    String description();

    /** If true, the tool is hidden from and refused to non-privileged callers. */
    boolean privileged() default false;

    /** Record type of a JSON result, used to derive outputSchema. Void.class means plain text. */
    Class<?> responseType() default Void.class;
}
