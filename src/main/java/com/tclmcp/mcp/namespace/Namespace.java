package com.tclmcp.mcp.namespace;

import java.util.Comparator;
import java.util.Objects;

/**
 * Namespace of a tool: one of the fixed system categories or a caller-chosen user id.
 * The kind is a closed set; {@code user} is only present for {@link Kind#USER}.
 */
public record Namespace(Kind kind, String user) implements Comparable<Namespace> {

    /**
     * Namespace categories. System kinds carry their path keyword.
     */
    public enum Kind {
        BIN("bin"),     // system tools, read-only
        SBIN("sbin"),   // system admin tools, privileged only
        DOCS("docs"),   // documentation tools, read-only
        USER(null);

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public static final Namespace BIN = new Namespace(Kind.BIN, null);
    public static final Namespace SBIN = new Namespace(Kind.SBIN, null);
    public static final Namespace DOCS = new Namespace(Kind.DOCS, null);

    private static final Comparator<Namespace> ORDER = Comparator
        .comparing(Namespace::kind)
        .thenComparing(Namespace::user, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Namespace {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.USER) {
            if (user == null || user.isEmpty()) {
                throw new IllegalArgumentException("User namespace requires a user id");
            }
        } else if (user != null) {
            throw new IllegalArgumentException("System namespace " + kind + " cannot carry a user id");
        }
    }

    public static Namespace user(String user) {
        return new Namespace(Kind.USER, user);
    }

    public boolean isSystem() {
        return kind != Kind.USER;
    }

    /**
     * Keyword used in paths and filters: {@code bin}, {@code sbin}, {@code docs} or the user id.
     */
    public String keyword() {
        return kind == Kind.USER ? user : kind.keyword();
    }

    /**
     * Exact match against a namespace filter as supplied by callers.
     */
    public boolean matches(String filter) {
        return keyword().equals(filter);
    }

    @Override
    public int compareTo(Namespace other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind == Kind.USER ? "User(" + user + ")" : kind.name();
    }
}
