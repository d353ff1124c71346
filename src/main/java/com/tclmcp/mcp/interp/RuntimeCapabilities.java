package com.tclmcp.mcp.interp;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a runtime can do, as reported to callers deciding which scripts to send.
 */
public record RuntimeCapabilities(
    String runtimeName,
    String runtimeVersion,
    List<String> features,
    @JsonProperty("is_safe") boolean safe,
    Map<String, List<String>> commandCategories,
    List<String> limitations,
    List<String> privilegedCommands
) {
    private static final Map<String, List<String>> CATEGORIES = categories();

    private static final List<String> SAFE_LIMITATIONS = List.of(
        "No file I/O operations",
        "No system command execution",
        "No package loading",
        "No networking capabilities");

    private static final List<String> TOOL_MANAGEMENT_COMMANDS = List.of(
        "tcl_tool_add",
        "tcl_tool_remove",
        "tcl_tool_list");

    private static Map<String, List<String>> categories() {
        final Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("core", List.of("set", "unset", "incr", "append", "expr", "if", "while", "for",
            "foreach", "proc", "return", "break", "continue", "eval", "info", "puts"));
        categories.put("error", List.of("error", "catch"));
        categories.put("string", List.of("string", "split", "join", "concat", "format", "regexp"));
        categories.put("list", List.of("list", "llength", "lindex", "lrange", "lappend", "lsort", "lsearch"));
        categories.put("array", List.of("array"));
        return categories;
    }

    /**
     * Capabilities of {@code runtime}. Categories list only commands the runtime actually provides.
     */
    public static RuntimeCapabilities describe(TclRuntime runtime, boolean privileged) {
        final Map<String, List<String>> available = new LinkedHashMap<>();
        CATEGORIES.forEach((category, names) -> {
            final List<String> present = names.stream().filter(runtime::hasCommand).toList();
            if (!present.isEmpty()) {
                available.put(category, present);
            }
        });

        return new RuntimeCapabilities(
            runtime.name(),
            runtime.version(),
            List.copyOf(runtime.features()),
            runtime.isSafe(),
            available,
            runtime.isSafe() ? SAFE_LIMITATIONS : List.of(),
            privileged ? TOOL_MANAGEMENT_COMMANDS : List.of());
    }
}
