package com.tclmcp.mcp.interp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tclmcp.mcp.errors.InterpreterException;

/**
 * Self-contained interpreter for the subset of Tcl that tool scripts use.
 *
 * <p>There are no file, process, socket or clock commands, so every script is
 * confined to string, list and arithmetic work. {@code puts} writes to an
 * in-memory buffer that is returned from {@link #eval} when the script's own
 * result is empty.
 *
 * <p>Global variables and procedures persist across {@link #eval} calls.
 */
public class EmbeddedTclRuntime implements TclRuntime {
    private static final Logger log = LoggerFactory.getLogger(EmbeddedTclRuntime.class);

    static final int MAX_NESTING = 200;

    private static final List<String> FEATURES = List.of(
        "safe_subset",
        "memory_safe",
        "no_file_io",
        "basic_math",
        "string_manipulation",
        "list_operations",
        "control_flow",
        "procedures");

    @FunctionalInterface
    private interface Command {
        String invoke(List<String> argv);
    }

    private record ProcParam(String name, String defaultValue) {}

    private record Procedure(String name, List<ProcParam> params, String body) {}

    private final Map<String, Command> commands = new TreeMap<>();
    private final Map<String, Procedure> procedures = new HashMap<>();
    // head is the current frame, tail the global one; values are String or Map<String, String>
    private final Deque<Map<String, Object>> frames = new ArrayDeque<>();
    private final StringBuilder output = new StringBuilder();
    private int depth;

    public EmbeddedTclRuntime() {
        frames.push(new HashMap<>());
        registerBuiltins();
    }

    @Override
    public String eval(String script) throws InterpreterException {
        output.setLength(0);
        depth = 0;
        while (frames.size() > 1) {
            frames.pop();
        }

        String result;
        try {
            result = evalScript(script);
        } catch (TclError e) {
            throw new InterpreterException("TCL execution error: " + e.getMessage());
        } catch (ControlFlow flow) {
            if (flow.code() != ControlFlow.Code.RETURN) {
                throw new InterpreterException("TCL execution error: invoked \""
                    + flow.code().name().toLowerCase() + "\" outside of a loop");
            }
            result = flow.value();
        }

        if (result.isEmpty() && output.length() > 0) {
            final int end = output.charAt(output.length() - 1) == '\n' ? output.length() - 1 : output.length();
            return output.substring(0, end);
        }
        return result;
    }

    @Override
    public void setVar(String name, String value) {
        frames.getLast().put(name, value);
    }

    @Override
    public String getVar(String name) throws InterpreterException {
        final Object value = frames.getLast().get(name);
        if (value == null) {
            throw new InterpreterException("can't read \"" + name + "\": no such variable");
        }
        if (!(value instanceof String s)) {
            throw new InterpreterException("can't read \"" + name + "\": variable is array");
        }
        return s;
    }

    @Override
    public boolean hasCommand(String name) {
        return commands.containsKey(name);
    }

    @Override
    public String name() {
        return "Embedded Tcl";
    }

    @Override
    public String version() {
        return "1.0";
    }

    @Override
    public List<String> features() {
        return FEATURES;
    }

    @Override
    public boolean isSafe() {
        return true;
    }

    // ---------------------------------------------------------------------
    // Evaluation core, shared with the parser and expression evaluator
    // ---------------------------------------------------------------------

    String evalScript(String script) {
        if (++depth > MAX_NESTING) {
            depth--;
            throw new TclError("too many nested evaluations (infinite loop?)");
        }
        try {
            final TclParser parser = new TclParser(this, script, 0);
            String result = "";
            List<String> words;
            while ((words = parser.nextCommand()) != null) {
                if (!words.isEmpty()) {
                    result = invoke(words);
                }
            }
            return result;
        } finally {
            depth--;
        }
    }

    private String invoke(List<String> words) {
        final Command command = commands.get(words.get(0));
        if (command == null) {
            throw new TclError("invalid command name \"" + words.get(0) + "\"");
        }
        return command.invoke(words);
    }

    String readVariable(String name) {
        final int paren = name.indexOf('(');
        if (paren > 0 && name.endsWith(")")) {
            return readElement(name.substring(0, paren), name.substring(paren + 1, name.length() - 1));
        }
        final Object value = frames.peek().get(name);
        if (value == null) {
            throw new TclError("can't read \"" + name + "\": no such variable");
        }
        if (!(value instanceof String s)) {
            throw new TclError("can't read \"" + name + "\": variable is array");
        }
        return s;
    }

    String readElement(String array, String key) {
        final Object value = frames.peek().get(array);
        if (value == null) {
            throw new TclError("can't read \"" + array + "(" + key + ")\": no such variable");
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new TclError("can't read \"" + array + "(" + key + ")\": variable isn't array");
        }
        final Object element = map.get(key);
        if (element == null) {
            throw new TclError("can't read \"" + array + "(" + key + ")\": no such element in array");
        }
        return element.toString();
    }

    private String writeVariable(String name, String value) {
        final int paren = name.indexOf('(');
        if (paren > 0 && name.endsWith(")")) {
            final String key = name.substring(paren + 1, name.length() - 1);
            arrayFor(name.substring(0, paren), true).put(key, value);
            return value;
        }
        final Object existing = frames.peek().get(name);
        if (existing instanceof Map) {
            throw new TclError("can't set \"" + name + "\": variable is array");
        }
        frames.peek().put(name, value);
        return value;
    }

    private boolean variableExists(String name) {
        final int paren = name.indexOf('(');
        if (paren > 0 && name.endsWith(")")) {
            final Object value = frames.peek().get(name.substring(0, paren));
            return value instanceof Map<?, ?> map && map.containsKey(name.substring(paren + 1, name.length() - 1));
        }
        return frames.peek().containsKey(name);
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> arrayFor(String name, boolean create) {
        final Object value = frames.peek().get(name);
        if (value instanceof Map) {
            return (Map<String, String>) value;
        }
        if (value != null) {
            throw new TclError("can't set \"" + name + "\": variable isn't array");
        }
        if (!create) {
            return null;
        }
        final Map<String, String> array = new LinkedHashMap<>();
        frames.peek().put(name, array);
        return array;
    }

    // ---------------------------------------------------------------------
    // Built-in commands
    // ---------------------------------------------------------------------

    private void registerBuiltins() {
        commands.put("set", this::cmdSet);
        commands.put("unset", this::cmdUnset);
        commands.put("incr", this::cmdIncr);
        commands.put("append", this::cmdAppend);
        commands.put("puts", this::cmdPuts);
        commands.put("expr", argv -> {
            arity(argv, 2, Integer.MAX_VALUE, "expr arg ?arg ...?");
            return TclExpr.evaluate(this, String.join(" ", argv.subList(1, argv.size())));
        });
        commands.put("if", this::cmdIf);
        commands.put("while", this::cmdWhile);
        commands.put("for", this::cmdFor);
        commands.put("foreach", this::cmdForeach);
        commands.put("break", argv -> {
            arity(argv, 1, 1, "break");
            throw ControlFlow.breaking();
        });
        commands.put("continue", argv -> {
            arity(argv, 1, 1, "continue");
            throw ControlFlow.continuing();
        });
        commands.put("proc", this::cmdProc);
        commands.put("return", this::cmdReturn);
        commands.put("error", argv -> {
            arity(argv, 2, 4, "error message ?errorInfo? ?errorCode?");
            throw new TclError(argv.get(1));
        });
        commands.put("catch", this::cmdCatch);
        commands.put("eval", argv -> {
            arity(argv, 2, Integer.MAX_VALUE, "eval arg ?arg ...?");
            return evalScript(concat(argv.subList(1, argv.size())));
        });
        commands.put("info", this::cmdInfo);
        commands.put("array", this::cmdArray);

        commands.put("list", argv -> TclLists.format(argv.subList(1, argv.size())));
        commands.put("llength", argv -> {
            arity(argv, 2, 2, "llength list");
            return String.valueOf(TclLists.parse(argv.get(1)).size());
        });
        commands.put("lindex", this::cmdLindex);
        commands.put("lrange", this::cmdLrange);
        commands.put("lappend", this::cmdLappend);
        commands.put("lsort", this::cmdLsort);
        commands.put("concat", argv -> concat(argv.subList(1, argv.size())));
        commands.put("join", argv -> {
            arity(argv, 2, 3, "join list ?joinString?");
            return String.join(argv.size() > 2 ? argv.get(2) : " ", TclLists.parse(argv.get(1)));
        });
        commands.put("split", this::cmdSplit);
        commands.put("string", this::cmdString);
    }

    private String cmdSet(List<String> argv) {
        arity(argv, 2, 3, "set varName ?newValue?");
        if (argv.size() == 2) {
            return readVariable(argv.get(1));
        }
        return writeVariable(argv.get(1), argv.get(2));
    }

    private String cmdUnset(List<String> argv) {
        int i = 1;
        boolean complain = true;
        if (i < argv.size() && argv.get(i).equals("-nocomplain")) {
            complain = false;
            i++;
        }
        for (; i < argv.size(); i++) {
            final String name = argv.get(i);
            final int paren = name.indexOf('(');
            boolean removed;
            if (paren > 0 && name.endsWith(")")) {
                final Map<String, String> array = frames.peek().get(name.substring(0, paren)) instanceof Map
                    ? arrayFor(name.substring(0, paren), false) : null;
                removed = array != null && array.remove(name.substring(paren + 1, name.length() - 1)) != null;
            } else {
                removed = frames.peek().remove(name) != null;
            }
            if (!removed && complain) {
                throw new TclError("can't unset \"" + name + "\": no such variable");
            }
        }
        return "";
    }

    private String cmdIncr(List<String> argv) {
        arity(argv, 2, 3, "incr varName ?increment?");
        final String name = argv.get(1);
        final long current = variableExists(name) ? parseInteger(readVariable(name)) : 0L;
        final long increment = argv.size() == 3 ? parseInteger(argv.get(2)) : 1L;
        return writeVariable(name, String.valueOf(current + increment));
    }

    private String cmdAppend(List<String> argv) {
        arity(argv, 2, Integer.MAX_VALUE, "append varName ?value ...?");
        final String name = argv.get(1);
        final StringBuilder sb = new StringBuilder(variableExists(name) ? readVariable(name) : "");
        argv.subList(2, argv.size()).forEach(sb::append);
        return writeVariable(name, sb.toString());
    }

    private String cmdPuts(List<String> argv) {
        int i = 1;
        boolean newline = true;
        if (argv.size() > 2 && argv.get(1).equals("-nonewline")) {
            newline = false;
            i++;
        }
        String channel = "stdout";
        if (argv.size() - i == 2) {
            channel = argv.get(i++);
        }
        if (argv.size() - i != 1) {
            throw new TclError("wrong # args: should be \"puts ?-nonewline? ?channelId? string\"");
        }
        final String text = argv.get(i);
        switch (channel) {
            case "stdout" -> {
                output.append(text);
                if (newline) {
                    output.append('\n');
                }
            }
            case "stderr" -> log.debug("Script stderr: {}", text);
            default -> throw new TclError("can not find channel named \"" + channel + "\"");
        }
        return "";
    }

    private String cmdIf(List<String> argv) {
        int i = 1;
        while (true) {
            if (i >= argv.size()) {
                throw new TclError("wrong # args: no expression after \"" + argv.get(i - 1) + "\" argument");
            }
            final boolean condition = TclExpr.evaluateCondition(this, argv.get(i++));
            if (i < argv.size() && argv.get(i).equals("then")) {
                i++;
            }
            if (i >= argv.size()) {
                throw new TclError("wrong # args: no script following \"" + argv.get(i - 1) + "\" argument");
            }
            if (condition) {
                return evalScript(argv.get(i));
            }
            i++;
            if (i >= argv.size()) {
                return "";
            }
            final String keyword = argv.get(i);
            if (keyword.equals("elseif")) {
                i++;
            } else if (keyword.equals("else")) {
                if (i + 1 >= argv.size()) {
                    throw new TclError("wrong # args: no script following \"else\" argument");
                }
                return evalScript(argv.get(i + 1));
            } else if (i == argv.size() - 1) {
                return evalScript(keyword);
            } else {
                throw new TclError("invalid \"if\" syntax near \"" + keyword + "\"");
            }
        }
    }

    private String cmdWhile(List<String> argv) {
        arity(argv, 3, 3, "while test command");
        while (TclExpr.evaluateCondition(this, argv.get(1))) {
            if (!runLoopBody(argv.get(2))) {
                break;
            }
        }
        return "";
    }

    private String cmdFor(List<String> argv) {
        arity(argv, 5, 5, "for start test next command");
        evalScript(argv.get(1));
        while (TclExpr.evaluateCondition(this, argv.get(2))) {
            if (!runLoopBody(argv.get(4))) {
                break;
            }
            evalScript(argv.get(3));
        }
        return "";
    }

    private String cmdForeach(List<String> argv) {
        if (argv.size() < 4 || argv.size() % 2 != 0) {
            throw new TclError("wrong # args: should be \"foreach varList list ?varList list ...? command\"");
        }
        final List<List<String>> varLists = new ArrayList<>();
        final List<List<String>> valueLists = new ArrayList<>();
        int iterations = 0;
        for (int i = 1; i < argv.size() - 1; i += 2) {
            final List<String> vars = TclLists.parse(argv.get(i));
            if (vars.isEmpty()) {
                throw new TclError("foreach varlist is empty");
            }
            final List<String> values = TclLists.parse(argv.get(i + 1));
            varLists.add(vars);
            valueLists.add(values);
            iterations = Math.max(iterations, (values.size() + vars.size() - 1) / vars.size());
        }
        final String body = argv.get(argv.size() - 1);
        for (int iteration = 0; iteration < iterations; iteration++) {
            for (int pair = 0; pair < varLists.size(); pair++) {
                final List<String> vars = varLists.get(pair);
                final List<String> values = valueLists.get(pair);
                for (int v = 0; v < vars.size(); v++) {
                    final int index = iteration * vars.size() + v;
                    writeVariable(vars.get(v), index < values.size() ? values.get(index) : "");
                }
            }
            if (!runLoopBody(body)) {
                break;
            }
        }
        return "";
    }

    /**
     * @return false when the body requested {@code break}
     */
    private boolean runLoopBody(String body) {
        try {
            evalScript(body);
        } catch (ControlFlow flow) {
            switch (flow.code()) {
                case BREAK -> {
                    return false;
                }
                case CONTINUE -> {
                    return true;
                }
                default -> throw flow;
            }
        }
        return true;
    }

    private String cmdProc(List<String> argv) {
        arity(argv, 4, 4, "proc name args body");
        final String name = argv.get(1);
        final List<ProcParam> params = new ArrayList<>();
        for (final String spec : TclLists.parse(argv.get(2))) {
            final List<String> parts = TclLists.parse(spec);
            if (parts.isEmpty() || parts.size() > 2) {
                throw new TclError("too many fields in argument specifier \"" + spec + "\"");
            }
            params.add(new ProcParam(parts.get(0), parts.size() == 2 ? parts.get(1) : null));
        }
        final Procedure procedure = new Procedure(name, List.copyOf(params), argv.get(3));
        procedures.put(name, procedure);
        commands.put(name, args -> callProcedure(procedure, args));
        return "";
    }

    private String callProcedure(Procedure procedure, List<String> argv) {
        final Map<String, Object> frame = new HashMap<>();
        final List<String> actual = argv.subList(1, argv.size());
        final List<ProcParam> params = procedure.params();
        int consumed = 0;
        for (int i = 0; i < params.size(); i++) {
            final ProcParam param = params.get(i);
            if (param.name().equals("args") && i == params.size() - 1) {
                frame.put("args", TclLists.format(actual.subList(Math.min(consumed, actual.size()), actual.size())));
                consumed = actual.size();
            } else if (consumed < actual.size()) {
                frame.put(param.name(), actual.get(consumed++));
            } else if (param.defaultValue() != null) {
                frame.put(param.name(), param.defaultValue());
            } else {
                throw wrongProcArgs(procedure);
            }
        }
        if (consumed < actual.size()) {
            throw wrongProcArgs(procedure);
        }

        frames.push(frame);
        try {
            return evalScript(procedure.body());
        } catch (ControlFlow flow) {
            if (flow.code() == ControlFlow.Code.RETURN) {
                return flow.value();
            }
            throw new TclError("invoked \"" + flow.code().name().toLowerCase() + "\" outside of a loop");
        } finally {
            frames.pop();
        }
    }

    private static TclError wrongProcArgs(Procedure procedure) {
        final StringBuilder usage = new StringBuilder(procedure.name());
        for (final ProcParam param : procedure.params()) {
            usage.append(' ');
            if (param.name().equals("args")) {
                usage.append("?arg ...?");
            } else if (param.defaultValue() != null) {
                usage.append('?').append(param.name()).append('?');
            } else {
                usage.append(param.name());
            }
        }
        return new TclError("wrong # args: should be \"" + usage + "\"");
    }

    private String cmdReturn(List<String> argv) {
        String code = "ok";
        int i = 1;
        while (i + 1 < argv.size() && argv.get(i).startsWith("-")) {
            if (argv.get(i).equals("-code")) {
                code = argv.get(i + 1);
            }
            i += 2;
        }
        final String value = i < argv.size() ? argv.get(i) : "";
        switch (code) {
            case "ok", "0", "return", "2" -> throw ControlFlow.returning(value);
            case "error", "1" -> throw new TclError(value);
            case "break", "3" -> throw ControlFlow.breaking();
            case "continue", "4" -> throw ControlFlow.continuing();
            default -> throw new TclError("bad completion code \"" + code
                + "\": must be ok, error, return, break, continue, or an integer");
        }
    }

    private String cmdCatch(List<String> argv) {
        arity(argv, 2, 3, "catch script ?resultVarName?");
        int code;
        String result;
        try {
            result = evalScript(argv.get(1));
            code = 0;
        } catch (TclError e) {
            result = e.getMessage();
            code = 1;
        } catch (ControlFlow flow) {
            result = flow.value();
            code = switch (flow.code()) {
                case RETURN -> 2;
                case BREAK -> 3;
                case CONTINUE -> 4;
            };
        }
        if (argv.size() == 3) {
            writeVariable(argv.get(2), result);
        }
        return String.valueOf(code);
    }

    private String cmdInfo(List<String> argv) {
        arity(argv, 2, 3, "info subcommand ?arg?");
        final String pattern = argv.size() == 3 ? argv.get(2) : "*";
        return switch (argv.get(1)) {
            case "exists" -> {
                arity(argv, 3, 3, "info exists varName");
                yield variableExists(argv.get(2)) ? "1" : "0";
            }
            case "commands" -> TclLists.format(commands.keySet().stream()
                .filter(name -> globMatch(pattern, name, false)).toList());
            case "procs" -> TclLists.format(procedures.keySet().stream()
                .filter(name -> globMatch(pattern, name, false)).sorted().toList());
            default -> throw new TclError("unknown or ambiguous subcommand \"" + argv.get(1)
                + "\": must be commands, exists, or procs");
        };
    }

    private String cmdArray(List<String> argv) {
        arity(argv, 3, 4, "array subcommand arrayName ?arg?");
        final String name = argv.get(2);
        final Map<String, String> existing = frames.peek().get(name) instanceof Map ? arrayFor(name, false) : null;
        final String pattern = argv.size() == 4 ? argv.get(3) : "*";
        switch (argv.get(1)) {
            case "set" -> {
                arity(argv, 4, 4, "array set arrayName list");
                final List<String> pairs = TclLists.parse(argv.get(3));
                if (pairs.size() % 2 != 0) {
                    throw new TclError("list must have an even number of elements");
                }
                final Map<String, String> array = arrayFor(name, true);
                for (int i = 0; i < pairs.size(); i += 2) {
                    array.put(pairs.get(i), pairs.get(i + 1));
                }
                return "";
            }
            case "get" -> {
                if (existing == null) {
                    return "";
                }
                final List<String> pairs = new ArrayList<>();
                existing.forEach((key, value) -> {
                    if (globMatch(pattern, key, false)) {
                        pairs.add(key);
                        pairs.add(value);
                    }
                });
                return TclLists.format(pairs);
            }
            case "names" -> {
                if (existing == null) {
                    return "";
                }
                return TclLists.format(existing.keySet().stream()
                    .filter(key -> globMatch(pattern, key, false)).toList());
            }
            case "size" -> {
                return String.valueOf(existing == null ? 0 : existing.size());
            }
            case "exists" -> {
                return existing != null ? "1" : "0";
            }
            case "unset" -> {
                if (existing != null) {
                    if (argv.size() == 4) {
                        existing.keySet().removeIf(key -> globMatch(pattern, key, false));
                    } else {
                        frames.peek().remove(name);
                    }
                }
                return "";
            }
            default -> throw new TclError("unknown or ambiguous subcommand \"" + argv.get(1)
                + "\": must be exists, get, names, set, size, or unset");
        }
    }

    private String cmdLindex(List<String> argv) {
        arity(argv, 2, 3, "lindex list ?index?");
        if (argv.size() == 2) {
            return argv.get(1);
        }
        final List<String> list = TclLists.parse(argv.get(1));
        final int index = parseIndex(argv.get(2), list.size());
        return index >= 0 && index < list.size() ? list.get(index) : "";
    }

    private String cmdLrange(List<String> argv) {
        arity(argv, 4, 4, "lrange list first last");
        final List<String> list = TclLists.parse(argv.get(1));
        final int first = Math.max(0, parseIndex(argv.get(2), list.size()));
        final int last = Math.min(list.size() - 1, parseIndex(argv.get(3), list.size()));
        if (first > last) {
            return "";
        }
        return TclLists.format(list.subList(first, last + 1));
    }

    private String cmdLappend(List<String> argv) {
        arity(argv, 2, Integer.MAX_VALUE, "lappend varName ?value ...?");
        final String name = argv.get(1);
        final List<String> list = new ArrayList<>(
            variableExists(name) ? TclLists.parse(readVariable(name)) : List.of());
        list.addAll(argv.subList(2, argv.size()));
        return writeVariable(name, TclLists.format(list));
    }

    private String cmdLsort(List<String> argv) {
        arity(argv, 2, Integer.MAX_VALUE, "lsort ?options? list");
        Comparator<String> order = Comparator.naturalOrder();
        boolean decreasing = false;
        boolean unique = false;
        for (final String option : argv.subList(1, argv.size() - 1)) {
            switch (option) {
                case "-ascii", "-increasing" -> { }
                case "-decreasing" -> decreasing = true;
                case "-unique" -> unique = true;
                case "-nocase", "-dictionary" -> order = String.CASE_INSENSITIVE_ORDER;
                case "-integer" -> order = Comparator.comparingLong(EmbeddedTclRuntime::parseInteger);
                case "-real" -> order = Comparator.comparingDouble(EmbeddedTclRuntime::parseReal);
                default -> throw new TclError("bad option \"" + option + "\": must be -ascii, -decreasing, "
                    + "-dictionary, -increasing, -integer, -nocase, -real, or -unique");
            }
        }
        List<String> list = new ArrayList<>(TclLists.parse(argv.get(argv.size() - 1)));
        list.sort(decreasing ? order.reversed() : order);
        if (unique) {
            list = new ArrayList<>(new LinkedHashSet<>(list));
        }
        return TclLists.format(list);
    }

    private String cmdSplit(List<String> argv) {
        arity(argv, 2, 3, "split string ?splitChars?");
        final String text = argv.get(1);
        final String separators = argv.size() == 3 ? argv.get(2) : " \t\n\r";
        final List<String> parts = new ArrayList<>();
        if (text.isEmpty()) {
            return "";
        }
        if (separators.isEmpty()) {
            text.chars().forEach(c -> parts.add(String.valueOf((char) c)));
            return TclLists.format(parts);
        }
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (separators.indexOf(text.charAt(i)) >= 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return TclLists.format(parts);
    }

    private String cmdString(List<String> argv) {
        arity(argv, 3, Integer.MAX_VALUE, "string subcommand ?arg ...?");
        final String sub = argv.get(1);
        final String s = argv.get(2);
        switch (sub) {
            case "length":
                arity(argv, 3, 3, "string length string");
                return String.valueOf(s.length());
            case "toupper":
                return s.toUpperCase();
            case "tolower":
                return s.toLowerCase();
            case "trim":
                return trimRight(trimLeft(s, trimChars(argv)), trimChars(argv));
            case "trimleft":
                return trimLeft(s, trimChars(argv));
            case "trimright":
                return trimRight(s, trimChars(argv));
            case "reverse":
                return new StringBuilder(s).reverse().toString();
            case "index": {
                arity(argv, 4, 4, "string index string charIndex");
                final int index = parseIndex(argv.get(3), s.length());
                return index >= 0 && index < s.length() ? String.valueOf(s.charAt(index)) : "";
            }
            case "range": {
                arity(argv, 5, 5, "string range string first last");
                final int first = Math.max(0, parseIndex(argv.get(3), s.length()));
                final int last = Math.min(s.length() - 1, parseIndex(argv.get(4), s.length()));
                return first > last ? "" : s.substring(first, last + 1);
            }
            case "equal":
            case "compare": {
                final boolean nocase = argv.size() == 5 && argv.get(2).equals("-nocase");
                if (argv.size() != 4 && !nocase) {
                    throw new TclError("wrong # args: should be \"string " + sub + " ?-nocase? string1 string2\"");
                }
                final String a = argv.get(argv.size() - 2);
                final String b = argv.get(argv.size() - 1);
                final int c = nocase ? a.compareToIgnoreCase(b) : a.compareTo(b);
                return sub.equals("equal") ? (c == 0 ? "1" : "0") : String.valueOf(Integer.signum(c));
            }
            case "repeat": {
                arity(argv, 4, 4, "string repeat string count");
                final long count = parseInteger(argv.get(3));
                return count <= 0 ? "" : s.repeat((int) count);
            }
            case "first": {
                arity(argv, 4, 5, "string first needleString haystackString ?startIndex?");
                final String haystack = argv.get(3);
                final int start = argv.size() == 5 ? Math.max(0, parseIndex(argv.get(4), haystack.length())) : 0;
                return String.valueOf(haystack.indexOf(s, start));
            }
            case "last":
                arity(argv, 4, 4, "string last needleString haystackString");
                return String.valueOf(argv.get(3).lastIndexOf(s));
            case "match": {
                final boolean nocase = argv.size() == 5 && argv.get(2).equals("-nocase");
                if (argv.size() != 4 && !nocase) {
                    throw new TclError("wrong # args: should be \"string match ?-nocase? pattern string\"");
                }
                return globMatch(argv.get(argv.size() - 2), argv.get(argv.size() - 1), nocase) ? "1" : "0";
            }
            default:
                throw new TclError("unknown or ambiguous subcommand \"" + sub + "\": must be compare, equal, "
                    + "first, index, last, length, match, range, repeat, reverse, tolower, toupper, trim, "
                    + "trimleft, or trimright");
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static void arity(List<String> argv, int min, int max, String usage) {
        if (argv.size() < min || argv.size() > max) {
            throw new TclError("wrong # args: should be \"" + usage + "\"");
        }
    }

    private static String concat(List<String> parts) {
        final StringBuilder sb = new StringBuilder();
        for (final String part : parts) {
            final String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(trimmed);
            }
        }
        return sb.toString();
    }

    private static long parseInteger(String value) {
        final Number n = TclExpr.asNumber(value);
        if (!(n instanceof Long l)) {
            throw new TclError("expected integer but got \"" + value + "\"");
        }
        return l;
    }

    private static double parseReal(String value) {
        final Number n = TclExpr.asNumber(value);
        if (n == null) {
            throw new TclError("expected floating-point number but got \"" + value + "\"");
        }
        return n.doubleValue();
    }

    // integer, end, end-N or end+N
    private static int parseIndex(String spec, int size) {
        final String s = spec.strip();
        try {
            if (s.equals("end")) {
                return size - 1;
            }
            if (s.startsWith("end-")) {
                return size - 1 - Integer.parseInt(s.substring(4));
            }
            if (s.startsWith("end+")) {
                return size - 1 + Integer.parseInt(s.substring(4));
            }
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new TclError("bad index \"" + spec + "\": must be integer?[+-]integer? or end?[+-]integer?");
        }
    }

    private static String trimChars(List<String> argv) {
        return argv.size() > 3 ? argv.get(3) : " \t\n\r";
    }

    private static String trimLeft(String s, String chars) {
        int start = 0;
        while (start < s.length() && chars.indexOf(s.charAt(start)) >= 0) {
            start++;
        }
        return s.substring(start);
    }

    private static String trimRight(String s, String chars) {
        int end = s.length();
        while (end > 0 && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end);
    }

    /**
     * Tcl glob matching: {@code *}, {@code ?}, {@code [chars]} with ranges, and backslash quoting.
     */
    static boolean globMatch(String pattern, String s, boolean nocase) {
        if (nocase) {
            return globMatch(pattern.toLowerCase(), s.toLowerCase(), 0, 0);
        }
        return globMatch(pattern, s, 0, 0);
    }

    private static boolean globMatch(String p, String s, int pi, int si) {
        while (pi < p.length()) {
            final char c = p.charAt(pi);
            if (c == '*') {
                while (pi < p.length() && p.charAt(pi) == '*') {
                    pi++;
                }
                if (pi == p.length()) {
                    return true;
                }
                for (int k = si; k <= s.length(); k++) {
                    if (globMatch(p, s, pi, k)) {
                        return true;
                    }
                }
                return false;
            }
            if (si >= s.length()) {
                return false;
            }
            if (c == '?') {
                pi++;
                si++;
            } else if (c == '[') {
                final int close = p.indexOf(']', pi + 1);
                if (close < 0) {
                    return false;
                }
                if (!inCharClass(p.substring(pi + 1, close), s.charAt(si))) {
                    return false;
                }
                pi = close + 1;
                si++;
            } else {
                char literal = c;
                if (c == '\\' && pi + 1 < p.length()) {
                    literal = p.charAt(++pi);
                }
                if (literal != s.charAt(si)) {
                    return false;
                }
                pi++;
                si++;
            }
        }
        return si == s.length();
    }

    private static boolean inCharClass(String chars, char ch) {
        for (int i = 0; i < chars.length(); i++) {
            if (i + 2 < chars.length() && chars.charAt(i + 1) == '-') {
                if (ch >= chars.charAt(i) && ch <= chars.charAt(i + 2)) {
                    return true;
                }
                i += 2;
            } else if (chars.charAt(i) == ch) {
                return true;
            }
        }
        return false;
    }
}
