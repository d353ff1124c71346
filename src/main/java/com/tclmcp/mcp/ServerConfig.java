package com.tclmcp.mcp;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tclmcp.mcp.executor.TclExecutor;
import com.tclmcp.mcp.interp.RuntimeType;

/**
 * Server settings. Each key is read from the classpath {@code tcl-mcp.properties},
 * then the system property {@code tcl.mcp.<key>}, then the environment variable
 * {@code TCL_MCP_<KEY>} (dots become underscores), the last one found winning.
 */
public record ServerConfig(
    Path storageDir,
    Path toolsDir,
    RuntimeType runtime,
    int queueCapacity,
    boolean privileged,
    boolean telemetryEnabled,
    Path telemetryDir
) {
    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final String RESOURCE = "tcl-mcp.properties";
    private static final String SYSTEM_PREFIX = "tcl.mcp.";
    private static final String ENV_PREFIX = "TCL_MCP_";

    static final String STORAGE_DIR = "storage.dir";
    static final String TOOLS_DIR = "tools.dir";
    static final String RUNTIME = "runtime";
    static final String QUEUE_CAPACITY = "queue.capacity";
    static final String PRIVILEGED = "privileged";
    static final String TELEMETRY_ENABLED = "telemetry.enabled";
    static final String TELEMETRY_DIR = "telemetry.dir";

    public ServerConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queue.capacity must be positive, got " + queueCapacity);
        }
    }

    /**
     * Settings used when nothing is configured.
     */
    public static ServerConfig defaults() {
        final Path home = Path.of(System.getProperty("user.home"));
        return new ServerConfig(
            home.resolve(".local/share/tcl-mcp-server/tools.storage"),
            Path.of("tools"),
            RuntimeType.EMBEDDED,
            TclExecutor.DEFAULT_QUEUE_CAPACITY,
            false,
            true,
            home.resolve(".tcl_mcp/telemetry"));
    }

    /**
     * Load from the classpath resource, system properties and the environment.
     */
    public static ServerConfig load() {
        return load(classpathProperties(), System.getProperties(), System.getenv());
    }

    static ServerConfig load(Properties file, Properties system, Map<String, String> env) {
        final ServerConfig d = defaults();
        final Source source = new Source(file, system, env);
        return new ServerConfig(
            source.path(STORAGE_DIR, d.storageDir()),
            source.path(TOOLS_DIR, d.toolsDir()),
            source.runtime(d.runtime()),
            source.integer(QUEUE_CAPACITY, d.queueCapacity()),
            source.bool(PRIVILEGED, d.privileged()),
            source.bool(TELEMETRY_ENABLED, d.telemetryEnabled()),
            source.path(TELEMETRY_DIR, d.telemetryDir()));
    }

    private static Properties classpathProperties() {
        final Properties props = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using defaults: {}", RESOURCE, e.getMessage());
        }
        return props;
    }

    private record Source(Properties file, Properties system, Map<String, String> env) {

        String get(String key) {
            final String envValue = env.get(ENV_PREFIX + key.replace('.', '_').toUpperCase(Locale.ROOT));
            if (envValue != null && !envValue.isBlank()) {
                return envValue.strip();
            }
            final String sysValue = system.getProperty(SYSTEM_PREFIX + key);
            if (sysValue != null && !sysValue.isBlank()) {
                return sysValue.strip();
            }
            final String fileValue = file.getProperty(key);
            return fileValue == null || fileValue.isBlank() ? null : fileValue.strip();
        }

        Path path(String key, Path fallback) {
            final String value = get(key);
            if (value == null) {
                return fallback;
            }
            if (value.equals("~") || value.startsWith("~/")) {
                return Path.of(System.getProperty("user.home") + value.substring(1));
            }
            return Path.of(value);
        }

        int integer(String key, int fallback) {
            final String value = get(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + key + ": '" + value + "'", e);
            }
        }

        boolean bool(String key, boolean fallback) {
            final String value = get(key);
            return value == null ? fallback : Boolean.parseBoolean(value);
        }

        RuntimeType runtime(RuntimeType fallback) {
            final String value = get(RUNTIME);
            return value == null ? fallback : RuntimeType.fromString(value);
        }
    }
}
