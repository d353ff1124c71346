package com.tclmcp.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotates a parameter of an @McpTool method with its description and optional default.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {
    /** Sentinel value indicating the parameter is required (no default). */
    String REQUIRED = "\0__REQUIRED__";

    /** Parameter description shown to MCP clients. */
    String value();

    /** Default value as JSON text (bare text is taken as a string), or {@link #REQUIRED}. */
    String defaultValue() default REQUIRED;

    /** Override argument name (empty = snake_case of the Java parameter name). */
    String name() default "";
}
