package com.tclmcp.mcp.interp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class RuntimeTypeTest {

    @Test
    void testFromStringIgnoresCaseAndWhitespace() {
        assertEquals(RuntimeType.EMBEDDED, RuntimeType.fromString(" Embedded "));
    }

    @Test
    void testUnknownRuntimeListsValidOptions() {
        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> RuntimeType.fromString("molt"));

        assertEquals("Invalid runtime type 'molt'. Valid options: embedded", e.getMessage());
    }

    @Test
    void testCreate() {
        assertInstanceOf(EmbeddedTclRuntime.class, RuntimeType.EMBEDDED.create());
    }
}
