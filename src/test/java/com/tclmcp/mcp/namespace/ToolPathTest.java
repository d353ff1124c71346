package com.tclmcp.mcp.namespace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.tclmcp.mcp.errors.PathFormatException;

class ToolPathTest {

    @Nested
    class Parse {

        @Test
        void testParseSystemPath() throws PathFormatException {
            final ToolPath path = ToolPath.parse("/bin/tcl_execute");

            assertEquals(Namespace.BIN, path.namespace());
            assertEquals("tcl_execute", path.name());
            assertEquals(ToolPath.LATEST, path.version());
            assertTrue(path.isSystem());
        }

        @Test
        void testParseUserPathWithVersion() throws PathFormatException {
            final ToolPath path = ToolPath.parse("/alice/utils/reverse_string:1.0");

            assertEquals(Namespace.user("alice"), path.namespace());
            assertEquals("utils", path.packageName());
            assertEquals("reverse_string", path.name());
            assertEquals("1.0", path.version());
            assertFalse(path.isLatest());
        }

        @Test
        void testParseUserPathWithoutVersionIsLatest() throws PathFormatException {
            final ToolPath path = ToolPath.parse("/alice/utils/reverse_string");

            assertTrue(path.isLatest());
            assertEquals("/alice/utils/reverse_string", path.toString());
        }

        @Test
        void testParseSystemPathDropsVersion() throws PathFormatException {
            assertEquals(ToolPath.sbin("tcl_tool_add"), ToolPath.parse("/sbin/tcl_tool_add:2.0"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "bin/tcl_execute", "/", "/bin", "/alice/reverse_string",
            "/a/b/c/d", "/alice/utils/", "/alice/ut ils/x", "/alice/utils/x:"})
        void testParseRejectsMalformedPaths(String input) {
            assertThrows(PathFormatException.class, () -> ToolPath.parse(input));
        }

        @Test
        void testParseRejectsNull() {
            assertThrows(PathFormatException.class, () -> ToolPath.parse(null));
        }
    }

    @Nested
    class Encoding {

        @Test
        void testEncodeUserPath() {
            final ToolPath path = ToolPath.user("alice", "utils", "reverse_string", "1.0");

            assertEquals("user_alice__utils___reverse_string__v1_0", path.toEncodedName());
        }

        @Test
        void testEncodeLatestUserPathOmitsVersion() {
            assertEquals("user_bob__math___add", ToolPath.user("bob", "math", "add").toEncodedName());
        }

        @Test
        void testEncodeSystemPaths() {
            assertEquals("bin___tcl_execute", ToolPath.bin("tcl_execute").toEncodedName());
            assertEquals("sbin___tcl_tool_add", ToolPath.sbin("tcl_tool_add").toEncodedName());
            assertEquals("docs___tcl_reference", ToolPath.docs("tcl_reference").toEncodedName());
        }

        @Test
        void testDecodeUserPath() throws PathFormatException {
            assertEquals(ToolPath.user("alice", "utils", "reverse_string", "1.0"),
                ToolPath.fromEncodedName("user_alice__utils___reverse_string__v1_0"));
        }

        @Test
        void testRoundTripAcrossShapes() throws PathFormatException {
            final List<ToolPath> paths = List.of(
                ToolPath.bin("tcl_execute"),
                ToolPath.docs("tcl_reference"),
                ToolPath.user("alice", "utils", "reverse_string", "1.0"),
                ToolPath.user("a-b", "pkg_1", "x", "2.10.3-rc1"),
                ToolPath.user("alice", "utils", "rev", "1.0.0-beta.2"),
                ToolPath.user("bob", "math", "add"));

            for (final ToolPath path : paths) {
                assertEquals(path, ToolPath.fromEncodedName(path.toEncodedName()), path.toString());
                assertEquals(path, ToolPath.parse(path.toString()), path.toString());
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"tcl_execute", "usr___x", "user_alice__utils", "user_alice__utils___x__1_0",
            "user_alice"})
        void testDecodeRejectsUnknownShapes(String encoded) {
            assertThrows(PathFormatException.class, () -> ToolPath.fromEncodedName(encoded));
        }

        @Test
        void testEncodedNameUsesOnlySafeCharacters() {
            final String encoded = ToolPath.user("alice", "utils", "reverse_string", "1.0.2").toEncodedName();

            assertTrue(encoded.matches("[A-Za-z0-9_-]+"), encoded);
        }
    }

    @Nested
    class Construction {

        @Test
        void testSystemPathCannotHavePackage() {
            assertThrows(IllegalArgumentException.class,
                () -> new ToolPath(Namespace.BIN, "pkg", "x", ToolPath.LATEST));
        }

        @Test
        void testIdentifierRejectsDoubleUnderscore() {
            assertThrows(IllegalArgumentException.class, () -> ToolPath.user("alice", "my__pkg", "x"));
        }

        @Test
        void testIdentifierRejectsTrailingUnderscore() {
            assertThrows(IllegalArgumentException.class, () -> ToolPath.user("alice_", "pkg", "x"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1..0", "1.", ".1", "1.-0", "1_0", ""})
        void testVersionRejectsAmbiguousSeparators(String version) {
            assertThrows(IllegalArgumentException.class, () -> ToolPath.user("alice", "utils", "rev", version));
        }

        @Test
        void testParseRejectsDoubleDotVersion() {
            assertThrows(PathFormatException.class, () -> ToolPath.parse("/alice/utils/rev:1..0"));
        }

        @Test
        void testOrderingFollowsCanonicalString() {
            assertTrue(ToolPath.bin("a").compareTo(ToolPath.user("zed", "p", "x")) < 0);
            assertTrue(ToolPath.user("alice", "p", "x").compareTo(ToolPath.bin("a")) < 0);
        }
    }
}
