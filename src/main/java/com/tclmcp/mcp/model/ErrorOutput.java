package com.tclmcp.mcp.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.tclmcp.mcp.errors.ErrorType;
import com.tclmcp.mcp.errors.ToolException;
import com.tclmcp.mcp.utils.Json;

/**
 * Output for a failed call: the error category plus the message shown to the caller.
 */
public record ErrorOutput(ErrorType errorType, String message) implements ToolOutput {

    public static ErrorOutput of(ToolException e) {
        return new ErrorOutput(e.getErrorType(), e.getMessage());
    }

    @Override
    public String toStructuredJson() {
        final Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);
        error.put("error_type", errorType.name());
        error.put("message", message);
        return Json.serialize(error);
    }

    @Override
    public String toDisplayText() {
        return message;
    }

    @Override
    public boolean isSuccess() {
        return false;
    }
}
