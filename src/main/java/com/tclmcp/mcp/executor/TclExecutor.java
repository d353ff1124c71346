package com.tclmcp.mcp.executor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.tclmcp.mcp.discovery.ToolDiscovery;
import com.tclmcp.mcp.errors.DiscoveryException;
import com.tclmcp.mcp.errors.DuplicateToolException;
import com.tclmcp.mcp.errors.InterpreterException;
import com.tclmcp.mcp.errors.MissingParameterException;
import com.tclmcp.mcp.errors.NamespaceViolationException;
import com.tclmcp.mcp.errors.PersistenceException;
import com.tclmcp.mcp.errors.ToolException;
import com.tclmcp.mcp.errors.ToolNotFoundException;
import com.tclmcp.mcp.interp.TclRuntime;
import com.tclmcp.mcp.model.DiscoveredTool;
import com.tclmcp.mcp.model.ParameterDefinition;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.namespace.Namespace;
import com.tclmcp.mcp.namespace.ToolPath;
import com.tclmcp.mcp.persistence.FilePersistence;
import com.tclmcp.mcp.utils.Json;

/**
 * Single owner of the Tcl interpreter and the tool tables.
 *
 * <p>Every operation is queued and handled, one at a time, on a dedicated
 * thread; the public methods only enqueue a command and hand back the future
 * its result will complete. Submitting blocks while the queue is full. Failures
 * complete the future exceptionally with a {@link ToolException}.
 *
 * <p>A single instance should be created, {@link #start() started} once, and
 * {@link #close() closed} on shutdown.
 */
public class TclExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TclExecutor.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 100;

    /** Built-in tools, always listed. */
    public static final List<ToolPath> SYSTEM_TOOLS = List.of(
        ToolPath.bin("tcl_execute"),
        ToolPath.sbin("tcl_tool_add"),
        ToolPath.sbin("tcl_tool_remove"),
        ToolPath.bin("tcl_tool_list"),
        ToolPath.bin("exec_tool"),
        ToolPath.bin("discover_tools"),
        ToolPath.docs("tcl_reference"));

    private static final String EXECUTE_PATH = "/bin/tcl_execute";
    private static final String LIST_PATH = "/bin/tcl_tool_list";
    private static final String PARAMS_ARRAY = "params";
    private static final long OFFER_POLL_MILLIS = 50;

    private final TclRuntime runtime;
    private final ToolDiscovery discovery;
    private final PersistenceFactory persistenceFactory;
    private final BlockingQueue<TclCommand> queue;
    private final Thread worker;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    // Set once the worker has stopped taking commands
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    // Confined to the worker thread
    private final Map<ToolPath, ToolDefinition> customTools = new HashMap<>();
    private final Map<ToolPath, DiscoveredTool> discoveredTools = new HashMap<>();
    private FilePersistence persistence;
    private boolean persistenceAttempted;

    /**
     * @param runtime interpreter this executor takes exclusive ownership of
     * @param discovery scanner used by {@link #discoverTools()}
     * @param persistenceFactory opens the tool store on first use
     * @param queueCapacity maximum number of pending commands
     */
    public TclExecutor(TclRuntime runtime, ToolDiscovery discovery, PersistenceFactory persistenceFactory,
                       int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive, got " + queueCapacity);
        }
        this.runtime = runtime;
        this.discovery = discovery;
        this.persistenceFactory = persistenceFactory;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.worker = new Thread(this::runLoop, "tcl-executor");
        this.worker.setDaemon(true);
    }

    /**
     * Start the worker thread. Idempotent.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            worker.start();
            log.info("Tcl executor started on runtime {} {}", runtime.name(), runtime.version());
        }
    }

    // ---------------------------------------------------------------------
    // Public API: enqueue and return the reply future
    // ---------------------------------------------------------------------

    public CompletableFuture<String> execute(String script) {
        final CompletableFuture<String> reply = new CompletableFuture<>();
        return submit(new TclCommand.Execute(script, reply), reply);
    }

    public CompletableFuture<String> addTool(ToolPath path, String description, String script,
                                             List<ParameterDefinition> parameters) {
        final CompletableFuture<String> reply = new CompletableFuture<>();
        return submit(new TclCommand.AddTool(path, description, script, parameters, reply), reply);
    }

    public CompletableFuture<String> removeTool(ToolPath path) {
        final CompletableFuture<String> reply = new CompletableFuture<>();
        return submit(new TclCommand.RemoveTool(path, reply), reply);
    }

    /**
     * @param namespace keyword or user id to restrict to, or null
     * @param filter substring the canonical path must contain, or null
     */
    public CompletableFuture<List<String>> listTools(String namespace, String filter) {
        final CompletableFuture<List<String>> reply = new CompletableFuture<>();
        return submit(new TclCommand.ListTools(namespace, filter, reply), reply);
    }

    public CompletableFuture<String> executeCustomTool(ToolPath path, JsonNode params) {
        final CompletableFuture<String> reply = new CompletableFuture<>();
        return submit(new TclCommand.ExecuteCustomTool(path, params, reply), reply);
    }

    public CompletableFuture<List<ToolDefinition>> getToolDefinitions() {
        final CompletableFuture<List<ToolDefinition>> reply = new CompletableFuture<>();
        return submit(new TclCommand.GetToolDefinitions(reply), reply);
    }

    public CompletableFuture<String> initializePersistence() {
        final CompletableFuture<String> reply = new CompletableFuture<>();
        return submit(new TclCommand.InitializePersistence(reply), reply);
    }

    public CompletableFuture<String> execTool(String toolPath, JsonNode params) {
        final CompletableFuture<String> reply = new CompletableFuture<>();
        return submit(new TclCommand.ExecTool(toolPath, params, reply), reply);
    }

    public CompletableFuture<String> discoverTools() {
        final CompletableFuture<String> reply = new CompletableFuture<>();
        return submit(new TclCommand.DiscoverTools(reply), reply);
    }

    /**
     * Stop the worker after every command queued before this call has been handled.
     * Commands submitted later, or still waiting for queue space, fail with
     * {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        if (!started.get()) {
            stopped.set(true);
            rejectPending();
            return;
        }
        final CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            queue.put(new TclCommand.Shutdown(done));
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the Tcl executor to stop");
        }
        log.info("Tcl executor stopped");
    }

    private <T> CompletableFuture<T> submit(TclCommand command, CompletableFuture<T> reply) {
        try {
            while (!shutdown.get()) {
                if (queue.offer(command, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    // The worker may have drained the queue between the check and the offer
                    if (stopped.get() && queue.remove(command)) {
                        reject(command);
                    }
                    return reply;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reply.completeExceptionally(e);
            return reply;
        }
        reject(command);
        return reply;
    }

    private void rejectPending() {
        TclCommand pending;
        while ((pending = queue.poll()) != null) {
            reject(pending);
        }
    }

    private static void reject(TclCommand command) {
        command.reply().completeExceptionally(new IllegalStateException("Tcl executor is shut down"));
    }

    // ---------------------------------------------------------------------
    // Worker loop
    // ---------------------------------------------------------------------

    private void runLoop() {
        while (true) {
            final TclCommand command;
            try {
                command = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Tcl executor interrupted, stopping");
                stopped.set(true);
                rejectPending();
                return;
            }
            if (command instanceof TclCommand.Shutdown stop) {
                stopped.set(true);
                rejectPending();
                stop.reply().complete(null);
                return;
            }
            log.debug("Handling {}", command.getClass().getSimpleName());
            dispatch(command);
        }
    }

    private void dispatch(TclCommand command) {
        if (command instanceof TclCommand.Execute c) {
            reply(c.reply(), () -> executeScript(c.script()));
        } else if (command instanceof TclCommand.AddTool c) {
            reply(c.reply(), () -> handleAddTool(c.path(), c.description(), c.script(), c.parameters()));
        } else if (command instanceof TclCommand.RemoveTool c) {
            reply(c.reply(), () -> handleRemoveTool(c.path()));
        } else if (command instanceof TclCommand.ListTools c) {
            reply(c.reply(), () -> handleListTools(c.namespace(), c.filter()));
        } else if (command instanceof TclCommand.ExecuteCustomTool c) {
            reply(c.reply(), () -> handleExecuteCustomTool(c.path(), c.params()));
        } else if (command instanceof TclCommand.GetToolDefinitions c) {
            reply(c.reply(), this::handleGetToolDefinitions);
        } else if (command instanceof TclCommand.InitializePersistence c) {
            reply(c.reply(), this::handleInitializePersistence);
        } else if (command instanceof TclCommand.ExecTool c) {
            reply(c.reply(), () -> handleExecTool(c.toolPath(), c.params()));
        } else if (command instanceof TclCommand.DiscoverTools c) {
            reply(c.reply(), this::handleDiscoverTools);
        }
    }

    @FunctionalInterface
    private interface Handler<T> {
        T handle() throws ToolException;
    }

    private static <T> void reply(CompletableFuture<T> reply, Handler<T> handler) {
        try {
            reply.complete(handler.handle());
        } catch (ToolException e) {
            log.debug("Command failed: {}", e.getMessage());
            reply.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in Tcl executor", e);
            reply.completeExceptionally(e);
        }
    }

    // ---------------------------------------------------------------------
    // Handlers, run on the worker thread only
    // ---------------------------------------------------------------------

    private String executeScript(String script) throws InterpreterException {
        return runtime.eval(script);
    }

    private String handleAddTool(ToolPath path, String description, String script,
                                 List<ParameterDefinition> parameters) throws ToolException {
        if (path.namespace().isSystem()) {
            throw new NamespaceViolationException("Can only add tools to user namespace, not " + path);
        }

        if (persistence == null && !persistenceAttempted) {
            persistenceAttempted = true;
            try {
                openPersistence();
            } catch (PersistenceException e) {
                log.warn("Failed to initialize persistence, keeping tools in memory only: {}", e.getMessage());
            }
        }

        if (customTools.containsKey(path)) {
            throw new DuplicateToolException("Tool '" + path + "' already exists");
        }

        final ToolDefinition tool = new ToolDefinition(path, description, script, parameters);
        boolean persisted = false;
        if (persistence != null) {
            try {
                persistence.save(tool);
                persisted = true;
            } catch (PersistenceException e) {
                log.warn("Failed to persist tool {}: {}", path, e.getMessage());
            }
        }
        customTools.put(path, tool);

        return persisted
            ? "Tool '" + path + "' added successfully and persisted"
            : "Tool '" + path + "' added to memory (persistence unavailable)";
    }

    private String handleRemoveTool(ToolPath path) throws ToolException {
        if (path.isSystem()) {
            throw new NamespaceViolationException("Cannot remove system tool '" + path + "'");
        }

        final boolean removedFromMemory = customTools.remove(path) != null;
        boolean removedFromStorage = false;
        if (persistence != null) {
            try {
                removedFromStorage = persistence.delete(path);
            } catch (PersistenceException e) {
                log.warn("Failed to remove tool {} from storage: {}", path, e.getMessage());
            }
        }

        if (removedFromMemory || removedFromStorage) {
            return "Tool '" + path + "' removed successfully";
        }
        throw new ToolNotFoundException("Tool '" + path + "' not found");
    }

    private List<String> handleListTools(String namespace, String filter) {
        final TreeSet<String> tools = new TreeSet<>();
        final List<ToolPath> candidates = new ArrayList<>(SYSTEM_TOOLS);
        candidates.addAll(customTools.keySet());
        candidates.addAll(discoveredTools.keySet());
        for (final ToolPath path : candidates) {
            if (namespace != null && !path.namespace().matches(namespace)) {
                continue;
            }
            final String canonical = path.toString();
            if (filter == null || canonical.contains(filter)) {
                tools.add(canonical);
            }
        }
        return new ArrayList<>(tools);
    }

    private String handleExecuteCustomTool(ToolPath path, JsonNode params) throws ToolException {
        final ToolDefinition tool = customTools.get(path);
        if (tool == null) {
            final DiscoveredTool discovered = discoveredTools.get(path);
            if (discovered == null) {
                throw new ToolNotFoundException("Tool '" + path + "' not found");
            }
            return runDiscovered(discovered, params);
        }
        final StringBuilder script = bindDeclared(tool.parameters(), params);
        script.append(tool.script());
        return executeScript(script.toString());
    }

    private List<ToolDefinition> handleGetToolDefinitions() {
        final List<ToolDefinition> tools = new ArrayList<>(customTools.values());
        discoveredTools.values().forEach(discovered -> tools.add(discovered.toDefinition()));
        return tools;
    }

    private String handleInitializePersistence() throws PersistenceException {
        if (persistence != null) {
            return "Persistence already initialized";
        }
        final int loaded = openPersistence();
        return "Persistence initialized. Loaded " + loaded + " tools from storage.";
    }

    private String handleExecTool(String toolPath, JsonNode params) throws ToolException {
        final ToolPath path = ToolPath.parse(toolPath);

        final ToolDefinition custom = customTools.get(path);
        if (custom != null) {
            // A declared parameter named like the array is only reachable as $params(params)
            final StringBuilder script = bindDeclared(custom.parameters(), params, PARAMS_ARRAY);
            script.append("array set ").append(PARAMS_ARRAY).append(" {}\n");
            final Iterator<Map.Entry<String, JsonNode>> fields = asObject(params).fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                script.append("set ").append(stringLiteral(PARAMS_ARRAY + "(" + field.getKey() + ")"))
                    .append(' ').append(toTclLiteral(field.getValue())).append('\n');
            }
            script.append(custom.script());
            return executeScript(script.toString());
        }

        final DiscoveredTool discovered = discoveredTools.get(path);
        if (discovered != null) {
            return runDiscovered(discovered, params);
        }

        switch (toolPath) {
            case EXECUTE_PATH -> {
                final JsonNode script = asObject(params).get("script");
                if (script == null || !script.isTextual()) {
                    throw new MissingParameterException("Missing required parameter: script");
                }
                return executeScript(script.asText());
            }
            case LIST_PATH -> {
                final JsonNode object = asObject(params);
                return String.join("\n", handleListTools(textOrNull(object, "namespace"), textOrNull(object, "filter")));
            }
            default -> throw new ToolNotFoundException("Tool '" + toolPath + "' not found");
        }
    }

    private String runDiscovered(DiscoveredTool discovered, JsonNode params) throws ToolException {
        final String body;
        try {
            body = Files.readString(discovered.filePath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DiscoveryException("Failed to read tool script " + discovered.filePath(), e);
        }
        final StringBuilder script = bindDeclared(discovered.parameters(), params);
        script.append(body);
        return executeScript(script.toString());
    }

        private String handleDiscoverTools() throws DiscoveryException {
        final List<DiscoveredTool> found = discovery.discoverTools();
        for (final DiscoveredTool tool : found) {
            discoveredTools.put(tool.path(), tool);
        }
        return "Discovered " + found.size() + " tools from filesystem";
    }

    /**
     * Open the store and load its user tools into the custom table.
     *
     * @return number of tools loaded
     */
    private int openPersistence() throws PersistenceException {
        final FilePersistence store = persistenceFactory.open();
        int loaded = 0;
        for (final ToolDefinition tool : store.list(null)) {
            if (tool.path().namespace().kind() == Namespace.Kind.USER) {
                if (customTools.putIfAbsent(tool.path(), tool) == null) {
                    loaded++;
                }
            }
        }
        persistence = store;
        log.info("Persistence initialized at {}, loaded {} tools", store.getStorageDir(), loaded);
        return loaded;
    }

    // ---------------------------------------------------------------------
    // Parameter binding
    // ---------------------------------------------------------------------

    /**
     * Check every required parameter, then build the {@code set} prelude for the
     * declared parameters that were supplied.
     */
    static StringBuilder bindDeclared(List<ParameterDefinition> declared, JsonNode params)
        throws MissingParameterException {
        return bindDeclared(declared, params, null);
    }

    /**
     * As {@link #bindDeclared(List, JsonNode)}, leaving the variable {@code reserved}
     * unset even when a parameter of that name is declared.
     */
    static StringBuilder bindDeclared(List<ParameterDefinition> declared, JsonNode params, String reserved)
        throws MissingParameterException {
        final JsonNode object = asObject(params);
        for (final ParameterDefinition param : declared) {
            if (param.required() && !object.has(param.name())) {
                throw new MissingParameterException("Missing required parameter: " + param.name());
            }
        }
        final StringBuilder script = new StringBuilder();
        for (final ParameterDefinition param : declared) {
            final JsonNode value = object.get(param.name());
            if (value != null && !param.name().equals(reserved)) {
                script.append("set ").append(stringLiteral(param.name()))
                    .append(' ').append(toTclLiteral(value)).append('\n');
            }
        }
        return script;
    }

    /**
     * Tcl source text for a JSON value: strings become double-quoted words that
     * evaluate to exactly the original text, everything else uses its JSON form.
     */
    static String toTclLiteral(JsonNode value) {
        if (value.isTextual()) {
            return stringLiteral(value.asText());
        }
        return stringLiteral(value.toString());
    }

    private static String stringLiteral(String text) {
        final StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '"', '\\', '$', '[', ']' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static JsonNode asObject(JsonNode params) {
        return params != null && params.isObject() ? params : Json.emptyObject();
    }

    private static String textOrNull(JsonNode object, String field) {
        final JsonNode value = object.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
