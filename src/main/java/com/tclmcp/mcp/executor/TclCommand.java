package com.tclmcp.mcp.executor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.tclmcp.mcp.model.ParameterDefinition;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.namespace.ToolPath;

/**
 * Messages accepted by {@link TclExecutor}. Each carries the future its result is delivered on.
 */
sealed interface TclCommand {

    CompletableFuture<?> reply();

    record Execute(String script, CompletableFuture<String> reply) implements TclCommand {}

    record AddTool(ToolPath path, String description, String script, List<ParameterDefinition> parameters,
                   CompletableFuture<String> reply) implements TclCommand {}

    record RemoveTool(ToolPath path, CompletableFuture<String> reply) implements TclCommand {}

    record ListTools(String namespace, String filter, CompletableFuture<List<String>> reply)
        implements TclCommand {}

    record ExecuteCustomTool(ToolPath path, JsonNode params, CompletableFuture<String> reply)
        implements TclCommand {}

    record GetToolDefinitions(CompletableFuture<List<ToolDefinition>> reply) implements TclCommand {}

    record InitializePersistence(CompletableFuture<String> reply) implements TclCommand {}

    record ExecTool(String toolPath, JsonNode params, CompletableFuture<String> reply) implements TclCommand {}

    record DiscoverTools(CompletableFuture<String> reply) implements TclCommand {}

    record Shutdown(CompletableFuture<Void> reply) implements TclCommand {}
}
