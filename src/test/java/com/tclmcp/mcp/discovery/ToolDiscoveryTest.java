package com.tclmcp.mcp.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tclmcp.mcp.errors.DiscoveryException;
import com.tclmcp.mcp.model.DiscoveredTool;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.namespace.ToolPath;

class ToolDiscoveryTest {

    @TempDir
    Path toolsDir;

    private Path write(String relative, String content) throws IOException {
        final Path file = toolsDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testDiscoversSystemAndUserTools() throws Exception {
        // Given
        write("bin/hello_world.tcl", "# @description Say hello\n# @param name:string Who\nputs hi\n");
        write("docs/guide.tcl", "puts guide\n");
        write("users/alice/utils/reverse.tcl", "# @version 1.0\nstring reverse $s\n");
        write("bin/README.md", "not a tool");

        // When
        final List<DiscoveredTool> tools = new ToolDiscovery(toolsDir).discoverTools();

        // Then
        assertEquals(List.of(
            ToolPath.user("alice", "utils", "reverse", "1.0"),
            ToolPath.bin("hello_world"),
            ToolPath.docs("guide")),
            tools.stream().map(DiscoveredTool::path).toList());
        final DiscoveredTool hello = tools.get(1);
        assertEquals("Say hello", hello.description());
        assertEquals(1, hello.parameters().size());
    }

    @Test
    void testMissingDescriptionNamesTheFile() throws Exception {
        final Path file = write("bin/plain.tcl", "puts plain\n");

        final DiscoveredTool tool = new ToolDiscovery(toolsDir).discoverTools().get(0);

        assertEquals("Tool from " + file, tool.description());
        assertEquals(file, tool.filePath());
    }

    @Test
    void testInvalidFileNamesAreSkipped() throws Exception {
        write("bin/bad__name.tcl", "puts x\n");
        write("bin/good.tcl", "puts x\n");

        final List<DiscoveredTool> tools = new ToolDiscovery(toolsDir).discoverTools();

        assertEquals(List.of(ToolPath.bin("good")), tools.stream().map(DiscoveredTool::path).toList());
    }

    @Test
    void testMissingDirectoryFindsNothing() throws DiscoveryException {
        assertTrue(new ToolDiscovery(toolsDir.resolve("absent")).discoverTools().isEmpty());
    }

    @Test
    void testDefinitionViewPointsAtSource() throws Exception {
        final Path file = write("bin/hello.tcl", "puts hello\n");

        final ToolDefinition definition = new ToolDiscovery(toolsDir).discoverTools().get(0).toDefinition();

        assertEquals("# Tool loaded from: " + file, definition.script());
    }
}
