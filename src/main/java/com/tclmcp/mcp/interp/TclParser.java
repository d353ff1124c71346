package com.tclmcp.mcp.interp;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script into commands and words, performing variable, command and
 * backslash substitution as it goes. Each command is returned fully substituted
 * so it can be invoked before the next one is parsed.
 */
final class TclParser {
    private final EmbeddedTclRuntime interp;
    private final String text;
    private final int len;
    private int pos;

    TclParser(EmbeddedTclRuntime interp, String text, int pos) {
        this.interp = interp;
        this.text = text;
        this.len = text.length();
        this.pos = pos;
    }

    int position() {
        return pos;
    }

    /**
     * @return the words of the next command, or null at end of script
     */
    List<String> nextCommand() {
        skipSeparatorsAndComments();
        if (pos >= len) {
            return null;
        }
        final List<String> words = new ArrayList<>();
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == ' ' || c == '\t') {
                pos++;
            } else if (isContinuation(pos)) {
                pos += 2;
            } else if (c == '\n' || c == '\r' || c == ';') {
                pos++;
                break;
            } else {
                words.add(parseWord());
            }
        }
        return words;
    }

    private String parseWord() {
        final char c = text.charAt(pos);
        final String word;
        if (c == '{') {
            word = parseBraced();
            requireWordEnd("close-brace");
        } else if (c == '"') {
            word = parseQuoted();
            requireWordEnd("close-quote");
        } else {
            word = parseBare();
        }
        return word;
    }

    /**
     * Braced text, verbatim. Position must be at the opening brace.
     */
    String parseBraced() {
        int depth = 1;
        final int start = ++pos;
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                final String content = text.substring(start, pos);
                pos++;
                return content;
            }
            pos++;
        }
        throw new TclError("missing close-brace");
    }

    /**
     * Quoted text with substitutions. Position must be at the opening quote.
     */
    String parseQuoted() {
        pos++;
        final StringBuilder sb = new StringBuilder();
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            substituteInto(sb);
        }
        throw new TclError("missing \"");
    }

    private String parseBare() {
        final StringBuilder sb = new StringBuilder();
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == ';' || isContinuation(pos)) {
                break;
            }
            substituteInto(sb);
        }
        return sb.toString();
    }

    private void substituteInto(StringBuilder sb) {
        final char c = text.charAt(pos);
        if (c == '$') {
            sb.append(parseVariable());
        } else if (c == '[') {
            sb.append(parseCommand());
        } else if (c == '\\') {
            pos = appendEscape(text, pos, sb);
        } else {
            sb.append(c);
            pos++;
        }
    }

    /**
     * Variable reference: {@code $name}, {@code ${name}} or {@code $name(key)}.
     * A lone {@code $} is literal. Position must be at the dollar sign.
     */
    String parseVariable() {
        pos++;
        if (pos < len && text.charAt(pos) == '{') {
            final int end = text.indexOf('}', pos);
            if (end < 0) {
                throw new TclError("missing close-brace for variable name");
            }
            final String name = text.substring(pos + 1, end);
            pos = end + 1;
            return interp.readVariable(name);
        }
        final int start = pos;
        while (pos < len && isNameChar(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            return "$";
        }
        final String name = text.substring(start, pos);
        if (pos < len && text.charAt(pos) == '(') {
            pos++;
            final StringBuilder key = new StringBuilder();
            while (pos < len && text.charAt(pos) != ')') {
                substituteInto(key);
            }
            if (pos >= len) {
                throw new TclError("missing )");
            }
            pos++;
            return interp.readElement(name, key.toString());
        }
        return interp.readVariable(name);
    }

    /**
     * Bracketed command, evaluated. Position must be at the opening bracket.
     */
    String parseCommand() {
        int depth = 1;
        final int start = ++pos;
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '{') {
                skipBraces();
                continue;
            }
            if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                break;
            }
            pos++;
        }
        if (pos >= len) {
            throw new TclError("missing close-bracket");
        }
        final String script = text.substring(start, pos);
        pos++;
        return interp.evalScript(script);
    }

    /**
     * Resolve the backslash sequence at {@code pos} into {@code out}.
     *
     * @return position after the sequence
     */
    static int appendEscape(String text, int pos, StringBuilder out) {
        if (pos + 1 >= text.length()) {
            out.append('\\');
            return pos + 1;
        }
        final char c = text.charAt(pos + 1);
        switch (c) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'a' -> out.append('\u0007');
            case 'b' -> out.append('\b');
            case 'f' -> out.append('\f');
            case 'v' -> out.append('\u000B');
            case 'u' -> {
                int end = pos + 2;
                while (end < text.length() && end < pos + 6 && isHexDigit(text.charAt(end))) {
                    end++;
                }
                if (end == pos + 2) {
                    out.append('u');
                    return pos + 2;
                }
                out.append((char) Integer.parseInt(text.substring(pos + 2, end), 16));
                return end;
            }
            case '\n' -> {
                // backslash-newline plus leading whitespace collapses to one space
                int end = pos + 2;
                while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
                    end++;
                }
                out.append(' ');
                return end;
            }
            default -> out.append(c);
        }
        return pos + 2;
    }

    private void skipSeparatorsAndComments() {
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == ';') {
                pos++;
            } else if (isContinuation(pos)) {
                pos += 2;
            } else if (c == '#') {
                while (pos < len && text.charAt(pos) != '\n') {
                    pos += text.charAt(pos) == '\\' ? 2 : 1;
                }
            } else {
                return;
            }
        }
    }

    private void skipBraces() {
        int depth = 0;
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            pos++;
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return;
            }
        }
    }

    private void requireWordEnd(String what) {
        if (pos < len) {
            final char c = text.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r' && c != ';' && !isContinuation(pos)) {
                throw new TclError("extra characters after " + what);
            }
        }
    }

    private boolean isContinuation(int at) {
        return text.charAt(at) == '\\' && at + 1 < len && text.charAt(at + 1) == '\n';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == ':';
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
