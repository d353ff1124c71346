package com.tclmcp.mcp;

import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tclmcp.mcp.api.TclToolBox;
import com.tclmcp.mcp.api.ToolRegistry;
import com.tclmcp.mcp.discovery.ToolDiscovery;
import com.tclmcp.mcp.executor.TclExecutor;
import com.tclmcp.mcp.interp.RuntimeCapabilities;
import com.tclmcp.mcp.interp.TclRuntime;
import com.tclmcp.mcp.persistence.FilePersistence;
import com.tclmcp.mcp.telemetry.TelemetryLogger;

/**
 * Assembles the interpreter, executor, tool box and telemetry, and manages
 * their lifecycle. A transport calls {@link #getRegistry()} to list and call tools.
 */
public class TclMcpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TclMcpServer.class);

    private final ServerConfig config;
    private final TclExecutor executor;
    private final TelemetryLogger telemetryLogger;
    private final TclToolBox toolBox;
    private final ToolRegistry registry;
    private boolean running;

    public TclMcpServer(ServerConfig config) {
        this.config = config;
        final TclRuntime runtime = config.runtime().create();
        this.executor = new TclExecutor(runtime, new ToolDiscovery(config.toolsDir()),
            () -> new FilePersistence(config.storageDir()), config.queueCapacity());
        this.telemetryLogger = new TelemetryLogger(config.telemetryDir(), config.telemetryEnabled());
        this.toolBox = new TclToolBox(executor, RuntimeCapabilities.describe(runtime, config.privileged()));
        this.registry = new ToolRegistry(toolBox, config.privileged(), telemetryLogger);
    }

    /**
     * Start the executor and open persistence. A persistence failure is logged
     * and the server keeps tools in memory.
     */
    public synchronized void start() {
        if (running) {
            log.info("Tcl MCP server already running");
            return;
        }
        executor.start();
        telemetryLogger.init();
        try {
            log.info(executor.initializePersistence().get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while initializing persistence");
        } catch (ExecutionException e) {
            log.warn("Persistence unavailable, tools are kept in memory only: {}", e.getCause().getMessage());
        }
        running = true;
        log.info("Tcl MCP server started (runtime: {}, privileged: {}, tools dir: {})",
            config.runtime().configName(), config.privileged(), config.toolsDir());
    }

    /**
     * Stop the executor, then write the telemetry summary.
     */
    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        log.info("Stopping Tcl MCP server...");
        executor.close();
        telemetryLogger.shutdown();
        running = false;
        log.info("Tcl MCP server stopped.");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public TclToolBox getToolBox() {
        return toolBox;
    }

    public ServerConfig getConfig() {
        return config;
    }
}
