package com.tclmcp.mcp.interp;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion between Tcl list strings and Java lists.
 */
final class TclLists {

    private TclLists() {}

    /**
     * Split a Tcl list into its elements. Braced elements are taken verbatim,
     * quoted and bare elements have backslash escapes resolved.
     */
    static List<String> parse(String list) {
        final List<String> elements = new ArrayList<>();
        final int len = list.length();
        int pos = 0;
        while (true) {
            while (pos < len && Character.isWhitespace(list.charAt(pos))) {
                pos++;
            }
            if (pos >= len) {
                return elements;
            }
            final char c = list.charAt(pos);
            final StringBuilder element = new StringBuilder();
            if (c == '{') {
                int depth = 1;
                pos++;
                final int start = pos;
                while (pos < len) {
                    final char ch = list.charAt(pos);
                    if (ch == '\\') {
                        pos += 2;
                        continue;
                    }
                    if (ch == '{') {
                        depth++;
                    } else if (ch == '}' && --depth == 0) {
                        break;
                    }
                    pos++;
                }
                if (pos >= len) {
                    throw new TclError("unmatched open brace in list");
                }
                element.append(list, start, pos);
                pos++;
            } else if (c == '"') {
                pos++;
                while (pos < len && list.charAt(pos) != '"') {
                    pos = appendChar(list, pos, element);
                }
                if (pos >= len) {
                    throw new TclError("unmatched open quote in list");
                }
                pos++;
            } else {
                while (pos < len && !Character.isWhitespace(list.charAt(pos))) {
                    pos = appendChar(list, pos, element);
                }
            }
            if (pos < len && !Character.isWhitespace(list.charAt(pos))) {
                throw new TclError("list element in braces or quotes followed by \""
                    + list.charAt(pos) + "\" instead of space");
            }
            elements.add(element.toString());
        }
    }

    /**
     * Join elements into a list string that {@link #parse} splits back into the same elements.
     */
    static String format(List<String> elements) {
        final StringBuilder sb = new StringBuilder();
        for (final String element : elements) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(quote(element));
        }
        return sb.toString();
    }

    static String quote(String element) {
        if (element.isEmpty()) {
            return "{}";
        }
        if (!needsQuoting(element)) {
            return element;
        }
        if (bracesBalanced(element) && !element.endsWith("\\")) {
            return "{" + element + "}";
        }
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < element.length(); i++) {
            final char c = element.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case ' ', '{', '}', '[', ']', '$', '"', '\\', ';' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean needsQuoting(String element) {
        if (element.charAt(0) == '#') {
            return true;
        }
        for (int i = 0; i < element.length(); i++) {
            final char c = element.charAt(i);
            if (Character.isWhitespace(c) || "{}[]$\"\\;".indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean bracesBalanced(String element) {
        int depth = 0;
        for (int i = 0; i < element.length(); i++) {
            final char c = element.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }

    private static int appendChar(String list, int pos, StringBuilder out) {
        final char c = list.charAt(pos);
        if (c != '\\' || pos + 1 >= list.length()) {
            out.append(c);
            return pos + 1;
        }
        return TclParser.appendEscape(list, pos, out);
    }
}
