package com.tclmcp.mcp.api;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.tclmcp.mcp.errors.ErrorType;
import com.tclmcp.mcp.errors.PathFormatException;
import com.tclmcp.mcp.errors.ToolException;
import com.tclmcp.mcp.model.ErrorOutput;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.model.ToolOutput;
import com.tclmcp.mcp.namespace.Namespace;
import com.tclmcp.mcp.namespace.ToolPath;
import com.tclmcp.mcp.telemetry.TelemetryLogger;
import com.tclmcp.mcp.utils.Json;

/**
 * Routes tool calls by encoded name and builds the tools listing.
 *
 * <p>Built-in tools are the {@link McpTool} methods of {@link TclToolBox};
 * any other name is decoded as a tool path and run through the executor.
 * Privileged tools are hidden from and refused to a non-privileged registry.
 * Every call is recorded with the {@link TelemetryLogger}.
 */
public class ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    static final String NOT_PRIVILEGED_MESSAGE = "Tool management requires privileged mode";

    private static final TypeReference<Map<String, Object>> PARAMETER_MAP = new TypeReference<>() {};

    private final TclToolBox toolBox;
    private final boolean privileged;
    private final TelemetryLogger telemetryLogger;
    private final Map<String, ToolDef> builtins;

    public ToolRegistry(TclToolBox toolBox, boolean privileged, TelemetryLogger telemetryLogger) {
        this.toolBox = toolBox;
        this.privileged = privileged;
        this.telemetryLogger = telemetryLogger;
        this.builtins = scan(toolBox.getClass());
        log.info("Registered {} built-in tools (privileged: {})", builtins.size(), privileged);
    }

    private static Map<String, ToolDef> scan(Class<?> type) {
        final List<Method> methods = new ArrayList<>();
        for (final Method method : type.getMethods()) {
            if (method.isAnnotationPresent(McpTool.class)) {
                methods.add(method);
            }
        }
        methods.sort(Comparator.comparing(m -> m.getAnnotation(McpTool.class).name()));

        final Map<String, ToolDef> defs = new LinkedHashMap<>();
        for (final Method method : methods) {
            final ToolDef def = ToolDef.fromMethod(method, method.getAnnotation(McpTool.class));
            if (defs.putIfAbsent(def.getName(), def) != null) {
                throw new IllegalStateException("Duplicate tool name " + def.getName());
            }
        }
        return Collections.unmodifiableMap(defs);
    }

    /**
     * Descriptors of every tool this caller may use: built-ins first, then
     * custom and discovered tools.
     */
    public List<ToolDescriptor> listTools() {
        final List<ToolDescriptor> descriptors = new ArrayList<>();
        for (final ToolDef def : builtins.values()) {
            if (privileged || !def.isPrivileged()) {
                descriptors.add(def.toDescriptor());
            }
        }
        try {
            final List<ToolDefinition> tools = new ArrayList<>(toolBox.toolDefinitions());
            tools.sort(Comparator.comparing(ToolDefinition::path));
            for (final ToolDefinition tool : tools) {
                if (privileged || tool.path().namespace().kind() != Namespace.Kind.SBIN) {
                    descriptors.add(ToolDescriptor.forTool(tool));
                }
            }
        } catch (ToolException e) {
            log.warn("Failed to list custom tools: {}", e.getMessage());
        }
        return descriptors;
    }

    /**
     * Call a tool by encoded name. Never throws: failures come back as {@link ErrorOutput}.
     */
    public ToolOutput call(String name, JsonNode arguments) {
        final long startTime = telemetryLogger.logToolStart(name, toParameterMap(arguments));
        ToolOutput output;
        try {
            output = dispatch(name, arguments);
        } catch (RuntimeException e) {
            log.error("Tool {} failed unexpectedly", name, e);
            output = new ErrorOutput(ErrorType.INTERNAL, "Internal error: " + e.getMessage());
        }

        if (output instanceof ErrorOutput error) {
            telemetryLogger.logToolFailure(name, startTime, error.errorType().name(), error.message());
        } else {
            telemetryLogger.logToolSuccess(name, startTime, output.toStructuredJson());
        }
        return output;
    }

    public boolean isPrivileged() {
        return privileged;
    }

    Map<String, ToolDef> builtins() {
        return builtins;
    }

    private ToolOutput dispatch(String name, JsonNode arguments) {
        final ToolDef builtin = builtins.get(name);
        if (builtin != null) {
            if (builtin.isPrivileged() && !privileged) {
                return new ErrorOutput(ErrorType.NOT_PRIVILEGED, NOT_PRIVILEGED_MESSAGE);
            }
            return builtin.invoke(toolBox, arguments);
        }

        final ToolPath path;
        try {
            path = ToolPath.fromEncodedName(name);
        } catch (PathFormatException e) {
            log.debug("Unroutable tool name {}: {}", name, e.getMessage());
            return new ErrorOutput(ErrorType.NOT_FOUND, "Tool '" + name + "' not found");
        }
        if (path.namespace().kind() == Namespace.Kind.USER) {
            return toolBox.executeCustomTool(name, arguments);
        }
        if (path.namespace().kind() == Namespace.Kind.SBIN && !privileged) {
            return new ErrorOutput(ErrorType.NOT_PRIVILEGED, NOT_PRIVILEGED_MESSAGE);
        }
        return toolBox.execTool(path.toString(), arguments);
    }

    private static Map<String, Object> toParameterMap(JsonNode arguments) {
        if (arguments == null || !arguments.isObject()) {
            return Map.of();
        }
        return Json.convertValue(arguments, PARAMETER_MAP);
    }
}
