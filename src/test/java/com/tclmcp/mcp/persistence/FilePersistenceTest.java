package com.tclmcp.mcp.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tclmcp.mcp.errors.PersistenceException;
import com.tclmcp.mcp.model.ParameterDefinition;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.namespace.ToolPath;
import com.tclmcp.mcp.utils.Json;

class FilePersistenceTest {

    @TempDir
    Path tempDir;

    private Path storageDir;
    private FilePersistence store;

    @BeforeEach
    void setUp() throws PersistenceException {
        storageDir = tempDir.resolve("tools.storage");
        store = new FilePersistence(storageDir);
    }

    private static ToolDefinition addTool() {
        return new ToolDefinition(ToolPath.user("bob", "math", "add", "1.0"), "Add two numbers",
            "expr {$a + $b}", List.of(
                ParameterDefinition.required("a", "number", "First operand"),
                ParameterDefinition.required("b", "number", "Second operand")));
    }

    @Test
    void testSaveWritesDocumentAtDerivedLocation() throws PersistenceException {
        // Given
        final ToolDefinition tool = addTool();

        // When
        store.save(tool);

        // Then
        final Path expected = storageDir.resolve("users/bob/math/add_1.0.json");
        assertEquals(expected, store.getToolFilePath(tool.path()));
        assertTrue(Files.exists(expected));
        assertTrue(Files.exists(storageDir.resolve("index.json")));
    }

    @Test
    void testSystemAndLatestFileLayout() {
        assertEquals(storageDir.resolve("system/bin/tcl_execute.json"),
            store.getToolFilePath(ToolPath.bin("tcl_execute")));
        assertEquals(storageDir.resolve("users/alice/utils/reverse.json"),
            store.getToolFilePath(ToolPath.user("alice", "utils", "reverse")));
    }

    @Test
    void testLoadReturnsSavedTool() throws PersistenceException {
        final ToolDefinition tool = addTool();
        store.save(tool);

        final Optional<ToolDefinition> loaded = store.load(tool.path());

        assertTrue(loaded.isPresent());
        assertEquals(tool, loaded.get());
    }

    @Test
    void testLoadMissingToolIsEmpty() throws PersistenceException {
        assertTrue(store.load(ToolPath.user("nobody", "none", "x")).isEmpty());
    }

    @Test
    void testToolsSurviveReopen() throws PersistenceException {
        // Given
        final ToolDefinition tool = addTool();
        store.save(tool);

        // When
        final FilePersistence reopened = new FilePersistence(storageDir);

        // Then
        assertEquals(List.of(tool), reopened.list(null));
        assertEquals(Optional.of(tool), reopened.load(tool.path()));
    }

    @Test
    void testListFiltersByNamespace() throws PersistenceException {
        store.save(addTool());
        store.save(new ToolDefinition(ToolPath.user("alice", "utils", "echo"), "Echo", "set x", List.of()));

        assertEquals(1, store.list("alice").size());
        assertEquals(1, store.list("bob").size());
        assertEquals(2, store.list(null).size());
        assertTrue(store.list("carol").isEmpty());
    }

    @Test
    void testDeleteTwice() throws PersistenceException {
        final ToolDefinition tool = addTool();
        store.save(tool);

        assertTrue(store.delete(tool.path()));
        assertFalse(store.delete(tool.path()));
        assertTrue(store.load(tool.path()).isEmpty());
    }

    @Test
    void testFailedDeleteKeepsIndexEntry() throws Exception {
        // given a tool whose file has been replaced by a non-empty directory
        final ToolDefinition tool = addTool();
        store.save(tool);
        final Path file = store.getToolFilePath(tool.path());
        Files.delete(file);
        Files.createDirectories(file.resolve("blocker"));

        // when the delete fails
        assertThrows(PersistenceException.class, () -> store.delete(tool.path()));

        // then the entry is still indexed and a later delete succeeds
        Files.delete(file.resolve("blocker"));
        assertTrue(store.delete(tool.path()));
        assertFalse(new FilePersistence(storageDir).delete(tool.path()));
    }

    @Test
    void testDeleteRemovesEmptyDirectories() throws PersistenceException {
        final ToolDefinition tool = addTool();
        store.save(tool);

        store.delete(tool.path());

        assertFalse(Files.exists(storageDir.resolve("users/bob")));
        assertFalse(Files.exists(storageDir.resolve("users")));
        assertTrue(Files.exists(storageDir.resolve("index.json")));
    }

    @Test
    void testDeleteKeepsSiblingTools() throws PersistenceException {
        final ToolDefinition add = addTool();
        final ToolDefinition sub = new ToolDefinition(ToolPath.user("bob", "math", "sub", "1.0"), "Subtract",
            "expr {$a - $b}", List.of());
        store.save(add);
        store.save(sub);

        store.delete(add.path());

        assertTrue(Files.exists(storageDir.resolve("users/bob/math/sub_1.0.json")));
        assertEquals(List.of(sub), store.list("bob"));
    }

    @Test
    void testResaveKeepsIdAndBumpsFileVersion() throws Exception {
        // Given
        final ToolDefinition tool = addTool();
        store.save(tool);
        final Path file = store.getToolFilePath(tool.path());
        final PersistedTool first = Json.readFile(file, PersistedTool.class);

        // When
        store.save(new ToolDefinition(tool.path(), tool.description(), "expr {$a + $b + 0}", tool.parameters()));

        // Then
        final PersistedTool second = Json.readFile(file, PersistedTool.class);
        assertEquals(first.metadata().id(), second.metadata().id());
        assertEquals(first.metadata().createdAt(), second.metadata().createdAt());
        assertEquals(first.metadata().fileVersion() + 1, second.metadata().fileVersion());
        assertNotEquals(first.metadata().checksum(), second.metadata().checksum());
    }

    @Test
    void testChecksumMismatchStillLoads() throws Exception {
        // Given a tool file whose script was changed behind the index's back
        final ToolDefinition tool = addTool();
        store.save(tool);
        final Path file = store.getToolFilePath(tool.path());
        final PersistedTool persisted = Json.readFile(file, PersistedTool.class);
        final ToolDefinition edited = new ToolDefinition(tool.path(), tool.description(), "expr {$a * $b}",
            tool.parameters());
        final ToolMetadata metadata = persisted.metadata();
        Json.writeFile(file, new PersistedTool(new ToolMetadata(metadata.id(), metadata.createdAt(),
            metadata.updatedAt(), FilePersistence.checksum(edited.script()), metadata.fileVersion()), edited));

        // When
        final Optional<ToolDefinition> loaded = new FilePersistence(storageDir).load(tool.path());

        // Then
        assertEquals(Optional.of(edited), loaded);
    }

    @Test
    void testCorruptIndexStartsEmpty() throws Exception {
        Files.writeString(storageDir.resolve("index.json"), "{not json");

        final FilePersistence reopened = new FilePersistence(storageDir);

        assertTrue(reopened.list(null).isEmpty());
    }

    @Test
    void testChecksumIsStable() {
        assertEquals(FilePersistence.checksum("expr {1 + 1}"), FilePersistence.checksum("expr {1 + 1}"));
        assertNotEquals(FilePersistence.checksum("a"), FilePersistence.checksum("b"));
    }
}
