package com.tclmcp.mcp.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.tclmcp.mcp.errors.ErrorType;
import com.tclmcp.mcp.errors.PathFormatException;
import com.tclmcp.mcp.errors.ToolException;
import com.tclmcp.mcp.executor.TclExecutor;
import com.tclmcp.mcp.interp.RuntimeCapabilities;
import com.tclmcp.mcp.model.ErrorOutput;
import com.tclmcp.mcp.model.JsonOutput;
import com.tclmcp.mcp.model.ParameterDefinition;
import com.tclmcp.mcp.model.TextOutput;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.model.ToolOutput;
import com.tclmcp.mcp.namespace.ToolPath;

/**
 * Built-in tools, each a thin adapter from JSON arguments to one executor
 * command. Executor failures come back as {@link ErrorOutput}s carrying the
 * failure's {@link ErrorType} and message.
 */
public class TclToolBox {
    private static final Logger log = LoggerFactory.getLogger(TclToolBox.class);

    static final List<String> REFERENCE_TOPICS =
        List.of("overview", "basic_syntax", "commands", "examples", "links", "capabilities");
    private static final String REFERENCE_RESOURCE_DIR = "docs/tcl_reference/";

    private final TclExecutor executor;
    private final RuntimeCapabilities capabilities;

    public TclToolBox(TclExecutor executor, RuntimeCapabilities capabilities) {
        this.executor = executor;
        this.capabilities = capabilities;
    }

    @McpTool(name = "bin___tcl_execute", description = """
        Execute a Tcl script and return its result.

        The result is the value of the last command, or the text written with puts
        when that value is empty.

        Example: tcl_execute("expr {2 + 3}") -> 5 """)
    public ToolOutput tclExecute(
            @Param("Tcl script to evaluate") String script) {
        return text(executor.execute(script));
    }

    @McpTool(name = "sbin___tcl_tool_add", privileged = true, description = """
        Add a new Tcl tool to the user's namespace and persist it.

        Declared parameters are bound to same-named Tcl variables before the script runs.

        Example: tcl_tool_add("bob", "math", "add", "1.0", "Add numbers", "expr {$a + $b}", [...]) """)
    public ToolOutput tclToolAdd(
            @Param("Owning user namespace") String user,
            @Param(value = "Package the tool belongs to", name = "package") String packageName,
            @Param("Tool name") String name,
            @Param(value = "Tool version", defaultValue = "latest") String version,
            @Param("Description shown in tool listings") String description,
            @Param("Tcl script body") String script,
            @Param(value = "Declared parameters (name, description, required, type_name)", defaultValue = "[]")
                List<ParameterDefinition> parameters) {
        final ToolPath path;
        try {
            path = ToolPath.user(user, packageName, name, version);
        } catch (IllegalArgumentException e) {
            return new ErrorOutput(ErrorType.PATH_FORMAT, "Invalid tool path: " + e.getMessage());
        }
        return text(executor.addTool(path, description, script, parameters));
    }

    @McpTool(name = "sbin___tcl_tool_remove", privileged = true, description = """
        Remove a user tool from memory and from storage.

        Example: tcl_tool_remove("/bob/math/add:1.0") """)
    public ToolOutput tclToolRemove(
            @Param("Canonical tool path, e.g. /alice/utils/reverse_string:1.0") String path) {
        try {
            return text(executor.removeTool(ToolPath.parse(path)));
        } catch (PathFormatException e) {
            return ErrorOutput.of(e);
        }
    }

    @McpTool(name = "bin___tcl_tool_list", description = """
        List available tools as canonical paths, sorted.

        Returns: JSON array of paths

        Example: tcl_tool_list("bob") -> ["/bob/math/add:1.0"] """)
    public ToolOutput tclToolList(
            @Param(value = "Namespace to list: bin, sbin, docs or a user id", defaultValue = "") String namespace,
            @Param(value = "Substring the path must contain", defaultValue = "") String filter) {
        try {
            return new JsonOutput(await(executor.listTools(blankToNull(namespace), blankToNull(filter))));
        } catch (ToolException e) {
            return ErrorOutput.of(e);
        }
    }

    @McpTool(name = "bin___exec_tool", description = """
        Execute any tool by its canonical path.

        The parameters object is also exposed to user tools as the Tcl array params.

        Example: exec_tool("/bob/math/add:1.0", {"a": 2, "b": 3}) -> 5 """)
    public ToolOutput execTool(
            @Param("Canonical tool path") String toolPath,
            @Param(value = "Tool arguments", defaultValue = "{}") JsonNode params) {
        return text(executor.execTool(toolPath, params));
    }

    @McpTool(name = "bin___discover_tools", description = """
        Scan the tools directory for Tcl scripts and register them.

        Discovery is additive: tools found earlier stay registered. """)
    public ToolOutput discoverTools() {
        return text(executor.discoverTools());
    }

    @McpTool(name = "docs___tcl_reference", description = """
        Tcl reference for writing tool scripts against this interpreter.

        Topics: overview, basic_syntax, commands, examples, links, capabilities """)
    public ToolOutput tclReference(
            @Param(value = "Reference topic", defaultValue = "overview") String topic) {
        if ("capabilities".equals(topic)) {
            return new JsonOutput(capabilities);
        }
        if (!REFERENCE_TOPICS.contains(topic)) {
            return new ErrorOutput(ErrorType.NOT_FOUND,
                "Unknown topic '" + topic + "'. Available topics: " + String.join(", ", REFERENCE_TOPICS));
        }
        final String resource = REFERENCE_RESOURCE_DIR + topic + ".md";
        try (InputStream in = TclToolBox.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return new ErrorOutput(ErrorType.INTERNAL, "Reference resource missing: " + resource);
            }
            return new TextOutput(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Failed to read reference resource {}", resource, e);
            return new ErrorOutput(ErrorType.INTERNAL, "Failed to read reference topic '" + topic + "'");
        }
    }

    /**
     * Run a user tool addressed by its encoded name.
     */
    public ToolOutput executeCustomTool(String encodedName, JsonNode params) {
        try {
            return text(executor.executeCustomTool(ToolPath.fromEncodedName(encodedName), params));
        } catch (PathFormatException e) {
            return ErrorOutput.of(e);
        }
    }

    /**
     * Custom and discovered tool definitions.
     */
    public List<ToolDefinition> toolDefinitions() throws ToolException {
        return await(executor.getToolDefinitions());
    }

    public ToolOutput getToolDefinitions() {
        try {
            return new JsonOutput(toolDefinitions());
        } catch (ToolException e) {
            return ErrorOutput.of(e);
        }
    }

    public ToolOutput initializePersistence() {
        return text(executor.initializePersistence());
    }

    public RuntimeCapabilities capabilities() {
        return capabilities;
    }

    private static ToolOutput text(CompletableFuture<String> reply) {
        try {
            return new TextOutput(await(reply));
        } catch (ToolException e) {
            return ErrorOutput.of(e);
        }
    }

    private static <T> T await(CompletableFuture<T> reply) throws ToolException {
        try {
            return reply.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the Tcl executor", e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ToolException te) {
                throw te;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Tcl executor failed", cause);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
