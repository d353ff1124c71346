package com.tclmcp.mcp.discovery;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tclmcp.mcp.errors.DiscoveryException;
import com.tclmcp.mcp.model.DiscoveredTool;
import com.tclmcp.mcp.namespace.Namespace;
import com.tclmcp.mcp.namespace.ToolPath;

/**
 * Finds Tcl tools on disk under a fixed layout:
 * <pre>
 * &lt;root&gt;/bin/*.tcl
 * &lt;root&gt;/sbin/*.tcl
 * &lt;root&gt;/docs/*.tcl
 * &lt;root&gt;/users/&lt;user&gt;/&lt;package&gt;/*.tcl
 * </pre>
 * Each scan replaces this scanner's working set; callers merge the results themselves.
 */
public class ToolDiscovery {
    private static final Logger log = LoggerFactory.getLogger(ToolDiscovery.class);

    private static final String SCRIPT_EXTENSION = ".tcl";

    private final Path toolsDir;
    private final Map<ToolPath, DiscoveredTool> discoveredTools = new TreeMap<>();

    public ToolDiscovery(Path toolsDir) {
        this.toolsDir = toolsDir;
    }

    public Path getToolsDir() {
        return toolsDir;
    }

    /**
     * Scan the tools directory.
     *
     * @return every tool found in this pass
     * @throws DiscoveryException if a directory or script cannot be read
     */
    public List<DiscoveredTool> discoverTools() throws DiscoveryException {
        discoveredTools.clear();
        try {
            scanSystemDirectory(toolsDir.resolve("bin"), Namespace.BIN);
            scanSystemDirectory(toolsDir.resolve("sbin"), Namespace.SBIN);
            scanSystemDirectory(toolsDir.resolve("docs"), Namespace.DOCS);

            final Path usersDir = toolsDir.resolve("users");
            if (Files.isDirectory(usersDir)) {
                scanUserDirectories(usersDir);
            }
        } catch (IOException e) {
            discoveredTools.clear();
            throw new DiscoveryException("Tool discovery failed under " + toolsDir + ": " + e.getMessage(), e);
        }

        log.info("Discovered {} tools under {}", discoveredTools.size(), toolsDir);
        return new ArrayList<>(discoveredTools.values());
    }

    private void scanSystemDirectory(Path dir, Namespace namespace) throws IOException {
        if (!Files.isDirectory(dir)) {
            return;
        }
        for (final Path file : scriptFiles(dir)) {
            final ScriptHeader header = readHeader(file);
            final String toolName = toolName(file);
            try {
                final ToolPath path = new ToolPath(namespace, null, toolName, ToolPath.LATEST);
                register(new DiscoveredTool(path, describe(header, file), file, header.parameters()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping {}: {}", file, e.getMessage());
            }
        }
    }

    private void scanUserDirectories(Path usersDir) throws IOException {
        for (final Path userDir : subdirectories(usersDir)) {
            final String user = userDir.getFileName().toString();
            for (final Path packageDir : subdirectories(userDir)) {
                final String packageName = packageDir.getFileName().toString();
                for (final Path file : scriptFiles(packageDir)) {
                    final ScriptHeader header = readHeader(file);
                    final String version = header.version() != null ? header.version() : ToolPath.LATEST;
                    try {
                        final ToolPath path = ToolPath.user(user, packageName, toolName(file), version);
                        register(new DiscoveredTool(path, describe(header, file), file, header.parameters()));
                    } catch (IllegalArgumentException e) {
                        log.warn("Skipping {}: {}", file, e.getMessage());
                    }
                }
            }
        }
    }

    private void register(DiscoveredTool tool) {
        log.debug("Found tool {} at {}", tool.path(), tool.filePath());
        discoveredTools.put(tool.path(), tool);
    }

    private static ScriptHeader readHeader(Path file) throws IOException {
        return ScriptHeader.parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    private static String describe(ScriptHeader header, Path file) {
        return header.description() != null && !header.description().isEmpty()
            ? header.description()
            : "Tool from " + file;
    }

    private static String toolName(Path file) {
        final String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - SCRIPT_EXTENSION.length());
    }

    private static List<Path> scriptFiles(Path dir) throws IOException {
        final List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, "*" + SCRIPT_EXTENSION)) {
            for (final Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        }
        files.sort(null);
        return files;
    }

    private static List<Path> subdirectories(Path dir) throws IOException {
        final List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
            entries.forEach(dirs::add);
        }
        dirs.sort(null);
        return dirs;
    }
}
