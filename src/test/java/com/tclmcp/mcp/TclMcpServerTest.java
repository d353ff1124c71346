package com.tclmcp.mcp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tclmcp.mcp.api.ToolRegistry;
import com.tclmcp.mcp.errors.ErrorType;
import com.tclmcp.mcp.interp.RuntimeType;
import com.tclmcp.mcp.model.ErrorOutput;
import com.tclmcp.mcp.model.JsonOutput;
import com.tclmcp.mcp.model.TextOutput;
import com.tclmcp.mcp.model.ToolOutput;
import com.tclmcp.mcp.utils.Json;

class TclMcpServerTest {

    @TempDir
    Path tempDir;

    private ServerConfig config(boolean privileged) {
        return new ServerConfig(tempDir.resolve("storage"), tempDir.resolve("tools"), RuntimeType.EMBEDDED,
            16, privileged, true, tempDir.resolve("telemetry"));
    }

    private static final String ADD_ARGS = "{\"user\":\"bob\",\"package\":\"math\",\"name\":\"add\",\"version\":\"1.0\","
        + "\"description\":\"Add two numbers\",\"script\":\"expr {$a + $b}\","
        + "\"parameters\":[{\"name\":\"a\",\"description\":\"A\",\"required\":true,\"type_name\":\"number\"},"
        + "{\"name\":\"b\",\"description\":\"B\",\"required\":true,\"type_name\":\"number\"}]}";

    @Test
    void testToolLifecycle() {
        try (TclMcpServer server = new TclMcpServer(config(true))) {
            // Given
            server.start();
            final ToolRegistry registry = server.getRegistry();

            // When
            final ToolOutput added = registry.call("sbin___tcl_tool_add", Json.readTree(ADD_ARGS));
            final ToolOutput sum = registry.call("user_bob__math___add__v1_0", Json.readTree("{\"a\":2,\"b\":3}"));
            final ToolOutput listed = registry.call("bin___tcl_tool_list", Json.readTree("{\"namespace\":\"bob\"}"));
            final ToolOutput removed = registry.call("sbin___tcl_tool_remove",
                Json.readTree("{\"path\":\"/bob/math/add:1.0\"}"));
            final ToolOutput afterRemove = registry.call("user_bob__math___add__v1_0",
                Json.readTree("{\"a\":2,\"b\":3}"));

            // Then
            assertEquals(new TextOutput("Tool '/bob/math/add:1.0' added successfully and persisted"), added);
            assertEquals(new TextOutput("5"), sum);
            assertEquals(new JsonOutput(List.of("/bob/math/add:1.0")), listed);
            assertEquals(new TextOutput("Tool '/bob/math/add:1.0' removed successfully"), removed);
            assertEquals(ErrorType.NOT_FOUND, assertInstanceOf(ErrorOutput.class, afterRemove).errorType());
        }
    }

    @Test
    void testToolsSurviveRestart() {
        try (TclMcpServer first = new TclMcpServer(config(true))) {
            first.start();
            first.getRegistry().call("sbin___tcl_tool_add", Json.readTree(ADD_ARGS));
        }

        try (TclMcpServer second = new TclMcpServer(config(false))) {
            second.start();

            assertEquals(new TextOutput("5"),
                second.getRegistry().call("user_bob__math___add__v1_0", Json.readTree("{\"a\":2,\"b\":3}")));
            assertTrue(second.getRegistry().listTools().stream()
                .anyMatch(d -> d.name().equals("user_bob__math___add__v1_0")));
        }
    }

    @Test
    void testStartAndCloseLifecycle() throws Exception {
        final TclMcpServer server = new TclMcpServer(config(false));
        assertFalse(server.isRunning());

        server.start();
        server.start();
        assertTrue(server.isRunning());

        server.close();
        assertFalse(server.isRunning());
        try (Stream<Path> files = Files.list(tempDir.resolve("telemetry"))) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("summary_")));
        }
    }

    @Test
    void testStartsWhenStorageUnavailable() throws Exception {
        // A regular file where the storage directory should be
        final Path blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "not a directory");
        final ServerConfig config = new ServerConfig(blocked.resolve("storage"), tempDir.resolve("tools"),
            RuntimeType.EMBEDDED, 16, true, false, tempDir.resolve("telemetry"));

        try (TclMcpServer server = new TclMcpServer(config)) {
            server.start();

            assertTrue(server.isRunning());
            assertEquals(new TextOutput("Tool '/bob/math/add:1.0' added to memory (persistence unavailable)"),
                server.getRegistry().call("sbin___tcl_tool_add", Json.readTree(ADD_ARGS)));
        }
    }
}
