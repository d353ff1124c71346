package com.tclmcp.mcp.namespace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NamespaceTest {

    @Test
    void testSystemNamespaces() {
        assertTrue(Namespace.BIN.isSystem());
        assertTrue(Namespace.SBIN.isSystem());
        assertTrue(Namespace.DOCS.isSystem());
        assertFalse(Namespace.user("alice").isSystem());
    }

    @Test
    void testKeyword() {
        assertEquals("sbin", Namespace.SBIN.keyword());
        assertEquals("alice", Namespace.user("alice").keyword());
    }

    @Test
    void testMatchesIsExact() {
        assertTrue(Namespace.user("bob").matches("bob"));
        assertFalse(Namespace.user("bobby").matches("bob"));
        assertTrue(Namespace.BIN.matches("bin"));
    }

    @Test
    void testUserNamespaceRequiresId() {
        assertThrows(IllegalArgumentException.class, () -> Namespace.user(""));
        assertThrows(IllegalArgumentException.class, () -> new Namespace(Namespace.Kind.USER, null));
    }

    @Test
    void testSystemNamespaceRejectsUserId() {
        assertThrows(IllegalArgumentException.class, () -> new Namespace(Namespace.Kind.BIN, "alice"));
    }

    @Test
    void testSystemNamespacesSortBeforeUsers() {
        assertTrue(Namespace.DOCS.compareTo(Namespace.user("aaa")) < 0);
        assertTrue(Namespace.user("alice").compareTo(Namespace.user("bob")) < 0);
    }
}
