package com.tclmcp.mcp.interp;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluator for the {@code expr} mini-language. Recursive descent straight over
 * the expression text; operands of {@code &&}, {@code ||} and {@code ?:} that are
 * not selected are scanned without being substituted.
 *
 * <p>Values are {@link Long}, {@link Double} or {@link String}.
 */
final class TclExpr {
    private final EmbeddedTclRuntime interp;
    private final String text;
    private final int len;
    private int pos;

    private TclExpr(EmbeddedTclRuntime interp, String text) {
        this.interp = interp;
        this.text = text;
        this.len = text.length();
    }

    static String evaluate(EmbeddedTclRuntime interp, String expression) {
        return format(evaluateValue(interp, expression));
    }

    static boolean evaluateCondition(EmbeddedTclRuntime interp, String expression) {
        return toBoolean(evaluateValue(interp, expression));
    }

    private static Object evaluateValue(EmbeddedTclRuntime interp, String expression) {
        final TclExpr expr = new TclExpr(interp, expression);
        expr.skipWhitespace();
        if (expr.pos >= expr.len) {
            throw new TclError("empty expression");
        }
        final Object value = expr.ternary(true);
        expr.skipWhitespace();
        if (expr.pos < expr.len) {
            throw new TclError("syntax error in expression \"" + expression + "\"");
        }
        return value;
    }

    private Object ternary(boolean live) {
        final Object condition = logicalOr(live);
        if (!consume("?")) {
            return condition;
        }
        final boolean takeFirst = live && toBoolean(condition);
        final Object first = ternary(live && takeFirst);
        if (!consume(":")) {
            throw new TclError("missing \":\" in ternary expression");
        }
        final Object second = ternary(live && !takeFirst);
        return takeFirst ? first : second;
    }

    private Object logicalOr(boolean live) {
        Object left = logicalAnd(live);
        while (consume("||")) {
            final boolean leftTrue = live && toBoolean(left);
            final Object right = logicalAnd(live && !leftTrue);
            left = live ? bool(leftTrue || toBoolean(right)) : 0L;
        }
        return left;
    }

    private Object logicalAnd(boolean live) {
        Object left = bitOr(live);
        while (consume("&&")) {
            final boolean leftTrue = live && toBoolean(left);
            final Object right = bitOr(live && leftTrue);
            left = live ? bool(leftTrue && toBoolean(right)) : 0L;
        }
        return left;
    }

    private Object bitOr(boolean live) {
        Object left = bitXor(live);
        while (peekSingle('|')) {
            pos++;
            final Object right = bitXor(live);
            left = live ? integer(left, "|") | integer(right, "|") : 0L;
        }
        return left;
    }

    private Object bitXor(boolean live) {
        Object left = bitAnd(live);
        while (consume("^")) {
            final Object right = bitAnd(live);
            left = live ? integer(left, "^") ^ integer(right, "^") : 0L;
        }
        return left;
    }

    private Object bitAnd(boolean live) {
        Object left = equality(live);
        while (peekSingle('&')) {
            pos++;
            final Object right = equality(live);
            left = live ? integer(left, "&") & integer(right, "&") : 0L;
        }
        return left;
    }

    private Object equality(boolean live) {
        Object left = relational(live);
        while (true) {
            if (consume("==")) {
                final Object right = relational(live);
                left = live ? bool(compare(left, right) == 0) : 0L;
            } else if (consume("!=")) {
                final Object right = relational(live);
                left = live ? bool(compare(left, right) != 0) : 0L;
            } else if (consumeWord("eq")) {
                final Object right = relational(live);
                left = live ? bool(format(left).equals(format(right))) : 0L;
            } else if (consumeWord("ne")) {
                final Object right = relational(live);
                left = live ? bool(!format(left).equals(format(right))) : 0L;
            } else {
                return left;
            }
        }
    }

    private Object relational(boolean live) {
        Object left = shift(live);
        while (true) {
            final String op;
            if (consume("<=")) {
                op = "<=";
            } else if (consume(">=")) {
                op = ">=";
            } else if (peekSingle('<')) {
                pos++;
                op = "<";
            } else if (peekSingle('>')) {
                pos++;
                op = ">";
            } else {
                return left;
            }
            final Object right = shift(live);
            if (live) {
                final int c = compare(left, right);
                left = bool(switch (op) {
                    case "<=" -> c <= 0;
                    case ">=" -> c >= 0;
                    case "<" -> c < 0;
                    default -> c > 0;
                });
            }
        }
    }

    private Object shift(boolean live) {
        Object left = additive(live);
        while (true) {
            if (consume("<<")) {
                final Object right = additive(live);
                left = live ? integer(left, "<<") << integer(right, "<<") : 0L;
            } else if (consume(">>")) {
                final Object right = additive(live);
                left = live ? integer(left, ">>") >> integer(right, ">>") : 0L;
            } else {
                return left;
            }
        }
    }

    private Object additive(boolean live) {
        Object left = multiplicative(live);
        while (true) {
            skipWhitespace();
            if (pos >= len || (text.charAt(pos) != '+' && text.charAt(pos) != '-')) {
                return left;
            }
            final char op = text.charAt(pos++);
            final Object right = multiplicative(live);
            if (live) {
                left = arithmetic(left, right, String.valueOf(op));
            }
        }
    }

    private Object multiplicative(boolean live) {
        Object left = unary(live);
        while (true) {
            skipWhitespace();
            if (pos >= len) {
                return left;
            }
            final char c = text.charAt(pos);
            if ((c != '*' && c != '/' && c != '%') || text.startsWith("**", pos)) {
                return left;
            }
            pos++;
            final Object right = unary(live);
            if (live) {
                left = arithmetic(left, right, String.valueOf(c));
            }
        }
    }

    private Object unary(boolean live) {
        skipWhitespace();
        if (pos < len) {
            final char c = text.charAt(pos);
            if (c == '-' || c == '+' || c == '!' || c == '~') {
                pos++;
                final Object operand = unary(live);
                if (!live) {
                    return 0L;
                }
                return switch (c) {
                    case '-' -> negate(number(operand, "-"));
                    case '+' -> number(operand, "+");
                    case '!' -> bool(!toBoolean(operand));
                    default -> ~integer(operand, "~");
                };
            }
        }
        return power(live);
    }

    private Object power(boolean live) {
        final Object base = primary(live);
        if (consume("**")) {
            final Object exponent = unary(live);
            if (!live) {
                return 0L;
            }
            final Number b = number(base, "**");
            final Number e = number(exponent, "**");
            if (b instanceof Long lb && e instanceof Long le && le >= 0) {
                long result = 1;
                for (long i = 0; i < le; i++) {
                    result *= lb;
                }
                return result;
            }
            return Math.pow(b.doubleValue(), e.doubleValue());
        }
        return base;
    }

    private Object primary(boolean live) {
        skipWhitespace();
        if (pos >= len) {
            throw new TclError("missing operand at end of expression \"" + text + "\"");
        }
        final char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            final Object value = ternary(live);
            if (!consume(")")) {
                throw new TclError("unbalanced parentheses in expression \"" + text + "\"");
            }
            return value;
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < len && Character.isDigit(text.charAt(pos + 1)))) {
            return numberLiteral();
        }
        if (c == '$') {
            return live ? coerce(substitute(TclParser::parseVariable)) : skipVariable();
        }
        if (c == '[') {
            return live ? coerce(substitute(TclParser::parseCommand)) : skipBracketed();
        }
        if (c == '"') {
            return live ? substitute(TclParser::parseQuoted) : skipQuoted();
        }
        if (c == '{') {
            return substitute(TclParser::parseBraced);
        }
        if (Character.isLetter(c)) {
            return wordOrFunction(live);
        }
        throw new TclError("syntax error in expression \"" + text + "\"");
    }

    private Object wordOrFunction(boolean live) {
        final int start = pos;
        while (pos < len && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        final String word = text.substring(start, pos);
        skipWhitespace();
        if (pos < len && text.charAt(pos) == '(') {
            pos++;
            final List<Object> args = new ArrayList<>();
            skipWhitespace();
            if (!consume(")")) {
                do {
                    args.add(ternary(live));
                } while (consume(","));
                if (!consume(")")) {
                    throw new TclError("missing close parenthesis in call to \"" + word + "\"");
                }
            }
            return live ? callFunction(word, args) : 0L;
        }
        if (parseBooleanWord(word) != null) {
            return word;
        }
        throw new TclError("invalid bareword \"" + word + "\"");
    }

    private Object callFunction(String name, List<Object> args) {
        return switch (name) {
            case "abs" -> {
                final Number n = number(single(name, args), name);
                yield n instanceof Long l ? (Object) Math.abs(l) : (Object) Math.abs(n.doubleValue());
            }
            case "int" -> number(single(name, args), name).longValue();
            case "double" -> number(single(name, args), name).doubleValue();
            case "round" -> {
                final Number n = number(single(name, args), name);
                yield n instanceof Long ? n : (Object) Math.round(n.doubleValue());
            }
            case "floor" -> Math.floor(number(single(name, args), name).doubleValue());
            case "ceil" -> Math.ceil(number(single(name, args), name).doubleValue());
            case "sqrt" -> Math.sqrt(number(single(name, args), name).doubleValue());
            case "pow" -> {
                if (args.size() != 2) {
                    throw new TclError("wrong # args for math function \"pow\"");
                }
                yield Math.pow(number(args.get(0), name).doubleValue(), number(args.get(1), name).doubleValue());
            }
            case "min", "max" -> {
                if (args.isEmpty()) {
                    throw new TclError("too few arguments for math function \"" + name + "\"");
                }
                Object best = number(args.get(0), name);
                for (final Object arg : args.subList(1, args.size())) {
                    final Object candidate = number(arg, name);
                    final int c = compare(candidate, best);
                    if (name.equals("min") ? c < 0 : c > 0) {
                        best = candidate;
                    }
                }
                yield best;
            }
            default -> throw new TclError("invalid function name \"" + name + "\"");
        };
    }

    private static Object single(String name, List<Object> args) {
        if (args.size() != 1) {
            throw new TclError("wrong # args for math function \"" + name + "\"");
        }
        return args.get(0);
    }

    private Object numberLiteral() {
        final int start = pos;
        if (text.startsWith("0x", pos) || text.startsWith("0X", pos)) {
            pos += 2;
            while (pos < len && Character.digit(text.charAt(pos), 16) >= 0) {
                pos++;
            }
            return Long.parseLong(text.substring(start + 2, pos), 16);
        }
        boolean floating = false;
        while (pos < len && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos < len && text.charAt(pos) == '.') {
            floating = true;
            pos++;
            while (pos < len && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (pos < len && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int p = pos + 1;
            if (p < len && (text.charAt(p) == '+' || text.charAt(p) == '-')) {
                p++;
            }
            if (p < len && Character.isDigit(text.charAt(p))) {
                floating = true;
                pos = p;
                while (pos < len && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            }
        }
        final String literal = text.substring(start, pos);
        try {
            return floating ? (Object) Double.parseDouble(literal) : (Object) Long.parseLong(literal);
        } catch (NumberFormatException e) {
            throw new TclError("invalid number \"" + literal + "\"");
        }
    }

    private interface Substitution {
        String apply(TclParser parser);
    }

    private String substitute(Substitution substitution) {
        final TclParser parser = new TclParser(interp, text, pos);
        final String value = substitution.apply(parser);
        pos = parser.position();
        return value;
    }

    private Object skipVariable() {
        pos++;
        if (pos < len && text.charAt(pos) == '{') {
            final int end = text.indexOf('}', pos);
            pos = end < 0 ? len : end + 1;
            return 0L;
        }
        while (pos < len && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_'
            || text.charAt(pos) == ':')) {
            pos++;
        }
        if (pos < len && text.charAt(pos) == '(') {
            int depth = 0;
            while (pos < len) {
                final char c = text.charAt(pos++);
                if (c == '(') {
                    depth++;
                } else if (c == ')' && --depth == 0) {
                    break;
                }
            }
        }
        return 0L;
    }

    private Object skipBracketed() {
        int depth = 0;
        while (pos < len) {
            final char c = text.charAt(pos++);
            if (c == '\\') {
                pos++;
            } else if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                return 0L;
            }
        }
        throw new TclError("missing close-bracket");
    }

    private Object skipQuoted() {
        pos++;
        while (pos < len) {
            final char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == '[') {
                skipBracketed();
            } else {
                pos++;
                if (c == '"') {
                    return 0L;
                }
            }
        }
        throw new TclError("missing \"");
    }

    private void skipWhitespace() {
        while (pos < len && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean consume(String token) {
        skipWhitespace();
        if (text.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private boolean consumeWord(String word) {
        skipWhitespace();
        final int end = pos + word.length();
        if (text.startsWith(word, pos) && (end >= len || !Character.isLetterOrDigit(text.charAt(end)))) {
            pos = end;
            return true;
        }
        return false;
    }

    // matches a single-character operator that is not the first half of its doubled form
    private boolean peekSingle(char op) {
        skipWhitespace();
        if (pos >= len || text.charAt(pos) != op) {
            return false;
        }
        if (pos + 1 < len) {
            final char next = text.charAt(pos + 1);
            if (next == op || next == '=') {
                return false;
            }
        }
        return true;
    }

    private static Object arithmetic(Object left, Object right, String op) {
        final Number a = number(left, op);
        final Number b = number(right, op);
        if (a instanceof Long la && b instanceof Long lb) {
            return switch (op) {
                case "+" -> la + lb;
                case "-" -> la - lb;
                case "*" -> la * lb;
                case "/" -> {
                    if (lb == 0) {
                        throw new TclError("divide by zero");
                    }
                    yield Math.floorDiv(la, lb);
                }
                default -> {
                    if (lb == 0) {
                        throw new TclError("divide by zero");
                    }
                    yield Math.floorMod(la, lb);
                }
            };
        }
        final double x = a.doubleValue();
        final double y = b.doubleValue();
        return switch (op) {
            case "+" -> x + y;
            case "-" -> x - y;
            case "*" -> x * y;
            case "/" -> {
                if (y == 0.0) {
                    throw new TclError("divide by zero");
                }
                yield x / y;
            }
            default -> throw new TclError("can't use floating-point value as operand of \"%\"");
        };
    }

    private static Object negate(Number n) {
        return n instanceof Long l ? (Object) (-l) : (Object) (-n.doubleValue());
    }

    private static int compare(Object left, Object right) {
        final Number a = asNumber(left);
        final Number b = asNumber(right);
        if (a != null && b != null) {
            if (a instanceof Long la && b instanceof Long lb) {
                return Long.compare(la, lb);
            }
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return format(left).compareTo(format(right));
    }

    private static Number number(Object value, String op) {
        final Number n = asNumber(value);
        if (n == null) {
            throw new TclError("can't use non-numeric string \"" + value + "\" as operand of \"" + op + "\"");
        }
        return n;
    }

    private static long integer(Object value, String op) {
        final Number n = number(value, op);
        if (n instanceof Double) {
            throw new TclError("can't use floating-point value as operand of \"" + op + "\"");
        }
        return n.longValue();
    }

    /**
     * Numeric view of a value, or null when it is not a number.
     */
    static Number asNumber(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        final String s = value.toString().strip();
        if (s.isEmpty()) {
            return null;
        }
        try {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                return Long.parseLong(s.substring(2), 16);
            }
            if (s.startsWith("-0x") || s.startsWith("-0X")) {
                return -Long.parseLong(s.substring(3), 16);
            }
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return parseDouble(s);
        }
    }

    private static Double parseDouble(String s) {
        final char last = s.charAt(s.length() - 1);
        if (!Character.isDigit(last) && last != '.') {
            return null;
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object coerce(String value) {
        final Number n = asNumber(value);
        return n != null ? n : value;
    }

    static boolean toBoolean(Object value) {
        final Number n = asNumber(value);
        if (n != null) {
            return n.doubleValue() != 0.0;
        }
        final Boolean b = parseBooleanWord(value.toString().strip());
        if (b == null) {
            throw new TclError("expected boolean value but got \"" + value + "\"");
        }
        return b;
    }

    private static Boolean parseBooleanWord(String word) {
        return switch (word.toLowerCase()) {
            case "true", "yes", "on" -> Boolean.TRUE;
            case "false", "no", "off" -> Boolean.FALSE;
            default -> null;
        };
    }

    private static Long bool(boolean b) {
        return b ? 1L : 0L;
    }

    static String format(Object value) {
        if (value instanceof Double d) {
            if (!d.isInfinite() && !d.isNaN() && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return (long) d.doubleValue() + ".0";
            }
            if (d.isInfinite()) {
                return d > 0 ? "Inf" : "-Inf";
            }
            return d.toString();
        }
        return value.toString();
    }
}
