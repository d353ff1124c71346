package com.tclmcp.mcp.interp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tclmcp.mcp.errors.InterpreterException;

class TclListsTest {

    private EmbeddedTclRuntime tcl;

    @BeforeEach
    void setUp() {
        tcl = new EmbeddedTclRuntime();
    }

    @Test
    void testParseBareBracedAndQuoted() {
        assertEquals(List.of("a", "b c", "d e", ""), TclLists.parse("a {b c} \"d e\" {}"));
    }

    @Test
    void testParseNestedBraces() {
        assertEquals(List.of("x {y z}", "w"), TclLists.parse("{x {y z}} w"));
    }

    @Test
    void testParseUnmatchedBrace() {
        assertThrows(TclError.class, () -> TclLists.parse("{a b"));
    }

    @Test
    void testFormatQuotesWhereNeeded() {
        assertEquals("a {b c} {}", TclLists.format(List.of("a", "b c", "")));
        assertEquals("{#x}", TclLists.format(List.of("#x")));
    }

    @Test
    void testFormatThenParseKeepsElements() {
        final List<String> elements = List.of("plain", "with space", "{brace", "$dollar", "tail\\", "");

        assertEquals(elements, TclLists.parse(TclLists.format(elements)));
    }

    @Test
    void testListCommands() throws InterpreterException {
        assertEquals("3", tcl.eval("llength [list a {b c} d]"));
        assertEquals("b c", tcl.eval("lindex [list a {b c} d] 1"));
        assertEquals("d", tcl.eval("lindex {a b d} end"));
        assertEquals("", tcl.eval("lindex {a b} 5"));
        assertEquals("b c", tcl.eval("lrange {a b c d} 1 2"));
        assertEquals("a b c d", tcl.eval("concat {a b} { c d }"));
    }

    @Test
    void testLappendCreatesVariable() throws InterpreterException {
        assertEquals("x {y z}", tcl.eval("lappend items x; lappend items {y z}"));
    }

    @Test
    void testJoinAndSplit() throws InterpreterException {
        assertEquals("a,b,c", tcl.eval("join {a b c} ,"));
        assertEquals("a b {} c", tcl.eval("split a,b,,c ,"));
        assertEquals("h i", tcl.eval("split hi {}"));
        assertEquals("4", tcl.eval("llength [split \"Hello world from Tcl\"]"));
    }

    @Test
    void testLsortOptions() throws InterpreterException {
        assertEquals("apple banana cherry", tcl.eval("lsort {cherry apple banana}"));
        assertEquals("cherry banana apple", tcl.eval("lsort -decreasing {cherry apple banana}"));
        assertEquals("2 10 33", tcl.eval("lsort -integer {10 2 33}"));
        assertEquals("0.5 1.25 3", tcl.eval("lsort -real {3 0.5 1.25}"));
        assertEquals("a b c", tcl.eval("lsort -unique {c a b a c}"));
    }

    @Test
    void testLsortBadOption() {
        assertThrows(InterpreterException.class, () -> tcl.eval("lsort -bogus {a b}"));
    }
}
