package com.tclmcp.mcp.namespace;

import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tclmcp.mcp.errors.PathFormatException;

/**
 * Hierarchical address of a tool.
 *
 * <p>Canonical form: {@code /bin/<name>}, {@code /sbin/<name>}, {@code /docs/<name>} and
 * {@code /<user>/<package>/<name>[:<version>]}. Encoded form (for transports that forbid
 * {@code /} and {@code :}): {@code bin___<name>} etc. and
 * {@code user_<user>__<package>___<name>[__v<version>]} with dots in the version
 * replaced by underscores.
 *
 * <p>User paths always carry a package. A package-less user path would render to a
 * two-segment canonical string indistinguishable from a system path, so it cannot be
 * constructed and both parsers reject it.
 */
public record ToolPath(Namespace namespace, String packageName, String name, String version)
        implements Comparable<ToolPath> {

    public static final String LATEST = "latest";

    // No "__" and no trailing '_' keeps the encoded separators unambiguous
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9](?!.*__)[A-Za-z0-9_-]*(?<!_)");
    // Dots encode as '_', so a version may not hold two separators in a row or end with one
    private static final Pattern VERSION = Pattern.compile("[A-Za-z0-9]+([.-][A-Za-z0-9]+)*");

    private static final String SYSTEM_SEPARATOR = "___";
    private static final String USER_PREFIX = "user_";
    private static final String VERSION_MARKER = "v";

    public ToolPath {
        Objects.requireNonNull(namespace, "namespace");
        requireIdentifier("name", name);
        if (namespace.isSystem()) {
            if (packageName != null) {
                throw new IllegalArgumentException("System tool " + name + " cannot have a package");
            }
            if (!LATEST.equals(version)) {
                throw new IllegalArgumentException("System tool " + name + " is always version " + LATEST);
            }
        } else {
            requireIdentifier("user", namespace.user());
            requireIdentifier("package", packageName);
            if (version == null || !VERSION.matcher(version).matches()) {
                throw new IllegalArgumentException("Invalid version: " + version);
            }
        }
    }

    public static ToolPath bin(String name) {
        return new ToolPath(Namespace.BIN, null, name, LATEST);
    }

    public static ToolPath sbin(String name) {
        return new ToolPath(Namespace.SBIN, null, name, LATEST);
    }

    public static ToolPath docs(String name) {
        return new ToolPath(Namespace.DOCS, null, name, LATEST);
    }

    public static ToolPath user(String user, String packageName, String name, String version) {
        return new ToolPath(Namespace.user(user), packageName, name, version);
    }

    public static ToolPath user(String user, String packageName, String name) {
        return user(user, packageName, name, LATEST);
    }

    /**
     * Parse a canonical path string such as {@code /bin/tcl_execute} or
     * {@code /alice/utils/reverse_string:1.0}. A version on a system path is accepted
     * and discarded.
     *
     * @throws PathFormatException if the string is not a valid canonical path
     */
    public static ToolPath parse(String path) throws PathFormatException {
        if (path == null || !path.startsWith("/")) {
            throw new PathFormatException("Tool path must start with '/': " + path);
        }
        final String[] parts = path.substring(1).split("/", -1);
        try {
            if (parts.length == 2) {
                final String name = stripVersion(parts[1]);
                switch (parts[0]) {
                    case "bin":
                        return bin(name);
                    case "sbin":
                        return sbin(name);
                    case "docs":
                        return docs(name);
                    default:
                        throw new PathFormatException(
                            "User tool paths need a package (/<user>/<package>/<name>): " + path);
                }
            }
            if (parts.length == 3) {
                final String nameVersion = parts[2];
                final int colon = nameVersion.indexOf(':');
                if (colon < 0) {
                    return user(parts[0], parts[1], nameVersion, LATEST);
                }
                return user(parts[0], parts[1], nameVersion.substring(0, colon), nameVersion.substring(colon + 1));
            }
        } catch (IllegalArgumentException e) {
            throw new PathFormatException("Invalid tool path " + path + ": " + e.getMessage());
        }
        throw new PathFormatException("Invalid tool path format: " + path);
    }

    /**
     * Decode a name produced by {@link #toEncodedName()}.
     *
     * @throws PathFormatException if the name has no known prefix or a malformed user section
     */
    public static ToolPath fromEncodedName(String encoded) throws PathFormatException {
        if (encoded == null) {
            throw new PathFormatException("Tool name is missing");
        }
        try {
            for (final Namespace.Kind kind : Namespace.Kind.values()) {
                if (kind == Namespace.Kind.USER) continue;
                final String prefix = kind.keyword() + SYSTEM_SEPARATOR;
                if (encoded.startsWith(prefix)) {
                    return new ToolPath(new Namespace(kind, null), null, encoded.substring(prefix.length()), LATEST);
                }
            }
            if (encoded.startsWith(USER_PREFIX)) {
                return decodeUser(encoded, encoded.substring(USER_PREFIX.length()));
            }
        } catch (IllegalArgumentException e) {
            throw new PathFormatException("Invalid tool name " + encoded + ": " + e.getMessage());
        }
        throw new PathFormatException("Unknown tool name format: " + encoded);
    }

    private static ToolPath decodeUser(String encoded, String rest) throws PathFormatException {
        // user__package___name[__vversion]: the third separator leaves a leading '_' on name
        final String[] parts = rest.split("__", -1);
        if (parts.length == 2) {
            throw new PathFormatException("User tool names need a package: " + encoded);
        }
        if (parts.length < 3 || parts.length > 4 || !parts[2].startsWith("_")) {
            throw new PathFormatException("Invalid tool name format: " + encoded);
        }
        final String name = parts[2].substring(1);
        if (parts.length == 3) {
            return user(parts[0], parts[1], name, LATEST);
        }
        if (!parts[3].startsWith(VERSION_MARKER)) {
            throw new PathFormatException("Invalid version section in tool name: " + encoded);
        }
        return user(parts[0], parts[1], name, parts[3].substring(1).replace('_', '.'));
    }

    /**
     * Protocol-safe name using only letters, digits, {@code _} and {@code -}.
     */
    public String toEncodedName() {
        if (namespace.isSystem()) {
            return namespace.keyword() + SYSTEM_SEPARATOR + name;
        }
        final StringBuilder sb = new StringBuilder(USER_PREFIX)
            .append(namespace.user()).append("__")
            .append(packageName).append(SYSTEM_SEPARATOR)
            .append(name);
        if (!isLatest()) {
            sb.append("__").append(VERSION_MARKER).append(version.replace('.', '_'));
        }
        return sb.toString();
    }

    @JsonIgnore
    public boolean isSystem() {
        return namespace.isSystem();
    }

    @JsonIgnore
    public boolean isLatest() {
        return LATEST.equals(version);
    }

    @Override
    public int compareTo(ToolPath other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        if (namespace.isSystem()) {
            return "/" + namespace.keyword() + "/" + name;
        }
        final String base = "/" + namespace.user() + "/" + packageName + "/" + name;
        return isLatest() ? base : base + ":" + version;
    }

    private static String stripVersion(String nameVersion) {
        final int colon = nameVersion.indexOf(':');
        return colon < 0 ? nameVersion : nameVersion.substring(0, colon);
    }

    private static void requireIdentifier(String what, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value);
        }
    }
}
