package com.tclmcp.mcp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.tclmcp.mcp.discovery.ToolDiscovery;
import com.tclmcp.mcp.errors.ErrorType;
import com.tclmcp.mcp.executor.TclExecutor;
import com.tclmcp.mcp.interp.EmbeddedTclRuntime;
import com.tclmcp.mcp.interp.RuntimeCapabilities;
import com.tclmcp.mcp.model.ErrorOutput;
import com.tclmcp.mcp.model.JsonOutput;
import com.tclmcp.mcp.model.ParameterDefinition;
import com.tclmcp.mcp.model.TextOutput;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.model.ToolOutput;
import com.tclmcp.mcp.persistence.FilePersistence;
import com.tclmcp.mcp.utils.Json;

class TclToolBoxTest {

    @TempDir
    Path tempDir;

    private TclExecutor executor;
    private TclToolBox toolBox;

    @BeforeEach
    void setUp() {
        final EmbeddedTclRuntime runtime = new EmbeddedTclRuntime();
        executor = new TclExecutor(runtime, new ToolDiscovery(tempDir.resolve("tools")),
            () -> new FilePersistence(tempDir.resolve("storage")), TclExecutor.DEFAULT_QUEUE_CAPACITY);
        executor.start();
        toolBox = new TclToolBox(executor, RuntimeCapabilities.describe(runtime, false));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void testExecute() {
        assertEquals(new TextOutput("hello"), toolBox.tclExecute("puts hello"));
    }

    @Test
    void testAddRejectsInvalidPath() {
        final ToolOutput output = toolBox.tclToolAdd("bob", "my__pkg", "tool", "latest", "d", "set x 1", List.of());

        final ErrorOutput error = assertInstanceOf(ErrorOutput.class, output);
        assertEquals(ErrorType.PATH_FORMAT, error.errorType());
        assertTrue(error.message().startsWith("Invalid tool path: "));
    }

    @Test
    void testAddListRemove() {
        // Given
        final ToolOutput added = toolBox.tclToolAdd("alice", "text", "shout", "latest", "Upper-case",
            "string toupper $s", List.of(ParameterDefinition.required("s", "string", "Text")));

        // When
        final ToolOutput listed = toolBox.tclToolList("alice", "");
        final ToolOutput removed = toolBox.tclToolRemove("/alice/text/shout");
        final ToolOutput removedAgain = toolBox.tclToolRemove("/alice/text/shout");

        // Then
        assertEquals(new TextOutput("Tool '/alice/text/shout' added successfully and persisted"), added);
        assertEquals(new JsonOutput(List.of("/alice/text/shout")), listed);
        assertEquals(new TextOutput("Tool '/alice/text/shout' removed successfully"), removed);
        assertEquals(ErrorType.NOT_FOUND, ((ErrorOutput) removedAgain).errorType());
    }

    @Test
    void testRemoveRejectsMalformedPath() {
        final ErrorOutput error = assertInstanceOf(ErrorOutput.class, toolBox.tclToolRemove("not a path"));

        assertEquals(ErrorType.PATH_FORMAT, error.errorType());
    }

    @Test
    void testListBlankArgumentsMeanNoFilter() {
        final JsonOutput all = assertInstanceOf(JsonOutput.class, toolBox.tclToolList("", ""));

        assertEquals(TclExecutor.SYSTEM_TOOLS.size(), ((List<?>) all.data()).size());
    }

    @Test
    void testExecToolAndCustomToolByEncodedName() {
        toolBox.tclToolAdd("bob", "math", "double", "2.1", "Double it", "expr {$n * 2}",
            List.of(ParameterDefinition.required("n", "integer", "N")));

        assertEquals(new TextOutput("8"), toolBox.execTool("/bob/math/double:2.1", Json.readTree("{\"n\":4}")));
        assertEquals(new TextOutput("10"),
            toolBox.executeCustomTool("user_bob__math___double__v2_1", Json.readTree("{\"n\":5}")));
        assertEquals(ErrorType.PATH_FORMAT,
            ((ErrorOutput) toolBox.executeCustomTool("user_bob", Json.emptyObject())).errorType());
    }

    @Test
    void testToolDefinitions() {
        toolBox.tclToolAdd("bob", "math", "one", "latest", "One", "expr 1", List.of());

        final JsonOutput output = assertInstanceOf(JsonOutput.class, toolBox.getToolDefinitions());

        final List<?> definitions = (List<?>) output.data();
        assertEquals(1, definitions.size());
        assertEquals("/bob/math/one", ((ToolDefinition) definitions.get(0)).path().toString());
    }

    @Test
    void testInitializePersistence() {
        assertEquals(new TextOutput("Persistence initialized. Loaded 0 tools from storage."),
            toolBox.initializePersistence());
    }

    @ParameterizedTest
    @ValueSource(strings = {"overview", "basic_syntax", "commands", "examples", "links"})
    void testReferenceTopicsLoad(String topic) {
        final TextOutput output = assertInstanceOf(TextOutput.class, toolBox.tclReference(topic));

        assertTrue(output.text().startsWith("#"));
    }

    @Test
    void testReferenceCapabilities() {
        final JsonOutput output = assertInstanceOf(JsonOutput.class, toolBox.tclReference("capabilities"));

        assertSame(toolBox.capabilities(), output.data());
        assertTrue(output.toStructuredJson().contains("\"is_safe\":true"));
    }

    @Test
    void testReferenceUnknownTopic() {
        final ErrorOutput error = assertInstanceOf(ErrorOutput.class, toolBox.tclReference("nope"));

        assertEquals(ErrorType.NOT_FOUND, error.errorType());
        assertTrue(error.message().contains("Available topics: overview, basic_syntax"));
    }
}
