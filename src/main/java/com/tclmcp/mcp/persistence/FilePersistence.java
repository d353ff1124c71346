package com.tclmcp.mcp.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.zip.CRC32;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tclmcp.mcp.errors.PersistenceException;
import com.tclmcp.mcp.model.ToolDefinition;
import com.tclmcp.mcp.namespace.Namespace;
import com.tclmcp.mcp.namespace.ToolPath;
import com.tclmcp.mcp.utils.Json;

/**
 * File-backed store of tool definitions.
 *
 * <p>Layout under the storage root:
 * <pre>
 * index.json
 * system/{bin,sbin,docs}/&lt;name&gt;[_&lt;version&gt;].json
 * users/&lt;user&gt;/&lt;package&gt;/&lt;name&gt;[_&lt;version&gt;].json
 * </pre>
 * Each tool file holds a {@link PersistedTool}. The index is a lookup cache over those files.
 *
 * <p>Not thread-safe. The executor is its only caller.
 */
public class FilePersistence {
    private static final Logger log = LoggerFactory.getLogger(FilePersistence.class);

    private static final String INDEX_FILE = "index.json";

    private final Path storageDir;
    private final Path indexPath;
    private final Map<String, ToolIndexEntry> index;
    private Instant lastUpdated;

    /**
     * Open (creating if needed) a store rooted at the given directory.
     *
     * @throws PersistenceException if the directory cannot be created
     */
    public FilePersistence(Path storageDir) throws PersistenceException {
        this.storageDir = storageDir.toAbsolutePath().normalize();
        this.indexPath = this.storageDir.resolve(INDEX_FILE);
        try {
            Files.createDirectories(this.storageDir);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create storage directory " + this.storageDir, e);
        }
        final ToolIndex loaded = loadOrCreateIndex(indexPath);
        this.index = new TreeMap<>(loaded.tools());
        this.lastUpdated = loaded.lastUpdated();
        log.debug("Opened tool store at {} ({} indexed tools)", this.storageDir, index.size());
    }

    public Path getStorageDir() {
        return storageDir;
    }

    /**
     * Write a tool document and update the index.
     *
     * @throws PersistenceException on any I/O or serialization failure
     */
    public void save(ToolDefinition tool) throws PersistenceException {
        final Path filePath = getToolFilePath(tool.path());
        final String checksum = checksum(tool.script());
        final Instant now = Instant.now();

        final ToolMetadata metadata = readExistingMetadata(filePath)
            .map(old -> new ToolMetadata(old.id(), old.createdAt(), now, checksum, old.fileVersion() + 1))
            .orElseGet(() -> new ToolMetadata(UUID.randomUUID().toString(), now, now, checksum, 1));

        try {
            Files.createDirectories(filePath.getParent());
            Json.writeFile(filePath, new PersistedTool(metadata, tool));
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("Failed to write tool " + tool.path() + " to " + filePath, e);
        }

        index.put(tool.path().toString(), new ToolIndexEntry(tool.path(), filePath, checksum, now));
        lastUpdated = now;
        saveIndex();

        log.info("Saved tool {} to {}", tool.path(), filePath);
    }

    /**
     * Load a tool, consulting the index first and then the derived file location.
     * A checksum disagreement between index and file is only logged.
     *
     * @return the tool, or empty when neither location has it
     * @throws PersistenceException if a file exists but cannot be read
     */
    public Optional<ToolDefinition> load(ToolPath path) throws PersistenceException {
        final ToolIndexEntry entry = index.get(path.toString());
        if (entry != null && Files.exists(entry.filePath())) {
            final PersistedTool persisted = readToolFile(entry.filePath());
            if (!persisted.metadata().checksum().equals(entry.checksum())) {
                log.warn("Checksum mismatch for tool {} (index {}, file {}), file may be stale or corrupted",
                    path, entry.checksum(), persisted.metadata().checksum());
            }
            return Optional.of(persisted.tool());
        }

        final Path filePath = getToolFilePath(path);
        if (Files.exists(filePath)) {
            return Optional.of(readToolFile(filePath).tool());
        }
        return Optional.empty();
    }

    /**
     * Load every indexed tool, optionally restricted to one namespace keyword or user id.
     * Entries that fail to load are skipped.
     */
    public List<ToolDefinition> list(String namespaceFilter) {
        final List<ToolDefinition> tools = new ArrayList<>();
        for (final ToolIndexEntry entry : List.copyOf(index.values())) {
            final Namespace namespace = entry.path().namespace();
            if (namespaceFilter != null && !namespace.matches(namespaceFilter)) {
                continue;
            }
            try {
                load(entry.path()).ifPresent(tools::add);
            } catch (PersistenceException e) {
                log.warn("Skipping unreadable tool {}: {}", entry.path(), e.getMessage());
            }
        }
        return tools;
    }

    /**
     * Delete a tool's index entry and file, then prune directories left empty.
     *
     * @return true if an entry was removed, false if the path was not stored
     * @throws PersistenceException if the file or index cannot be updated
     */
    public boolean delete(ToolPath path) throws PersistenceException {
        final ToolIndexEntry entry = index.get(path.toString());
        if (entry == null) {
            return false;
        }

        try {
            if (Files.deleteIfExists(entry.filePath())) {
                log.info("Deleted tool file {}", entry.filePath());
            }
            cleanupEmptyDirs(entry.filePath().getParent());
        } catch (IOException e) {
            throw new PersistenceException("Failed to delete tool file " + entry.filePath(), e);
        }

        index.remove(path.toString());
        lastUpdated = Instant.now();
        saveIndex();
        return true;
    }

    /**
     * Deterministic file location for a path.
     */
    public Path getToolFilePath(ToolPath path) {
        final Namespace namespace = path.namespace();
        Path dir;
        if (namespace.isSystem()) {
            dir = storageDir.resolve("system").resolve(namespace.keyword());
        } else {
            dir = storageDir.resolve("users").resolve(namespace.user());
            if (path.packageName() != null) {
                dir = dir.resolve(path.packageName());
            }
        }
        final String fileName = path.isLatest()
            ? path.name() + ".json"
            : path.name() + "_" + path.version() + ".json";
        return dir.resolve(fileName);
    }

    /**
     * Non-cryptographic content hash used to detect stale index entries.
     */
    static String checksum(String content) {
        final CRC32 crc = new CRC32();
        crc.update(content.getBytes(StandardCharsets.UTF_8));
        return Long.toHexString(crc.getValue());
    }

    private void saveIndex() throws PersistenceException {
        try {
            Json.writeFile(indexPath, new ToolIndex(index, lastUpdated));
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("Failed to write index " + indexPath, e);
        }
    }

    // Walks upward from dir, stopping at the storage root or the first non-empty directory
    private void cleanupEmptyDirs(Path dir) throws IOException {
        Path current = dir;
        while (current != null && current.startsWith(storageDir) && !current.equals(storageDir)) {
            if (!Files.isDirectory(current) || !isEmptyDirectory(current)) {
                return;
            }
            Files.delete(current);
            log.debug("Removed empty directory {}", current);
            current = current.getParent();
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        }
    }

    private Optional<ToolMetadata> readExistingMetadata(Path filePath) {
        if (!Files.exists(filePath)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(readToolFile(filePath).metadata());
        } catch (PersistenceException e) {
            log.warn("Overwriting unreadable tool file {}: {}", filePath, e.getMessage());
            return Optional.empty();
        }
    }

    private static PersistedTool readToolFile(Path filePath) throws PersistenceException {
        try {
            return Json.readFile(filePath, PersistedTool.class);
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("Failed to read tool file " + filePath, e);
        }
    }

    private static ToolIndex loadOrCreateIndex(Path indexPath) {
        if (!Files.exists(indexPath)) {
            return ToolIndex.empty();
        }
        try {
            return Json.readFile(indexPath, ToolIndex.class);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to parse index file {}, starting with an empty index: {}", indexPath, e.getMessage());
            return ToolIndex.empty();
        }
    }
}
