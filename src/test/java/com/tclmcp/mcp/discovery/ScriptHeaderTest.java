package com.tclmcp.mcp.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.tclmcp.mcp.model.ParameterDefinition;

class ScriptHeaderTest {

    @Test
    void testParsesDescriptionVersionAndParams() {
        final String script = """
            #!/usr/bin/env tclsh
            # @description List directory contents
            # @version 2.0
            # @param path:string:required Directory path to list
            # @param pattern:string Glob filter
            puts hi
            """;

        final ScriptHeader header = ScriptHeader.parse(script);

        assertEquals("List directory contents", header.description());
        assertEquals("2.0", header.version());
        assertEquals(List.of(
            new ParameterDefinition("path", "Directory path to list", true, "string"),
            new ParameterDefinition("pattern", "Glob filter", false, "string")), header.parameters());
    }

    @Test
    void testStopsAtFirstNonCommentLine() {
        final String script = """
            # @description Before
            set x 1
            # @description After
            # @param late:string Never seen
            """;

        final ScriptHeader header = ScriptHeader.parse(script);

        assertEquals("Before", header.description());
        assertTrue(header.parameters().isEmpty());
    }

    @Test
    void testIgnoresMalformedParamLines() {
        final ScriptHeader header = ScriptHeader.parse("""
            # @param nodescription:string
            # @param notype Only a name
            # @param ok:number:required Fine
            """);

        assertEquals(List.of(ParameterDefinition.required("ok", "number", "Fine")), header.parameters());
    }

    @Test
    void testNoHeader() {
        final ScriptHeader header = ScriptHeader.parse("expr {1 + 1}");

        assertNull(header.description());
        assertNull(header.version());
        assertTrue(header.parameters().isEmpty());
    }

    @Test
    void testDoubleHashComments() {
        final ScriptHeader header = ScriptHeader.parse("## @description Fancy\n");

        assertEquals("Fancy", header.description());
    }
}
