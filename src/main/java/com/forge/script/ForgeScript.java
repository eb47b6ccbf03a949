package com.forge.script;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.forge.debug.Debug;
import com.forge.script.diagnostics.DiagnosticRenderer;
import com.forge.script.error.ForgeException;
import com.forge.script.host.HostIO;
import com.forge.script.host.NativeFunction;
import com.forge.script.host.StdHostIO;
import com.forge.script.json.ValueJson;
import com.forge.script.parser.Environment;
import com.forge.script.parser.Interpreter;
import com.forge.script.parser.Lexer;
import com.forge.script.parser.Parser;
import com.forge.script.parser.Statement.Stmt;
import com.forge.script.parser.Token;
import com.forge.script.parser.Value;

/**
 * Core Forge engine.
 *
 * - Syntax: var / print / if / else / while / for-in / return / break / continue,
 *   function literals |a, b| { ... }, list [..] and map [k: v] literals
 * - Types: num, str, char, bool, range, function, list, map, host custom types, null
 * - Host functions registered via registerFunction; host values via define / defineJson
 * - Errors: every failure is a ForgeException; {@link #report} renders it against the source
 *
 * An engine holds configuration only. Script state lives in an {@link ExecutionState},
 * created fresh by {@link #run(String)} or supplied by the caller.
 */
public class ForgeScript {
    private static final String TAG = "ForgeScript";

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private final Map<String, NativeFunction> functions = new LinkedHashMap<>();
    private final Map<String, Value> defines = new LinkedHashMap<>();
    private HostIO io = new StdHostIO();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

    public ForgeScript() {
        Prelude.register(this);
    }

    // ===================== CONFIGURATION =====================

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive");
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setIO(HostIO io) { this.io = (io == null) ? new StdHostIO() : io; }

    public HostIO getIO() { return io; }

    public void registerFunction(NativeFunction fn) { functions.put(fn.name(), fn); }

    public void registerFunction(String name, int arity, NativeFunction.Body body) {
        registerFunction(new NativeFunction(name, arity, body));
    }

    /** Binds a host value visible to every script run by this engine. */
    public void define(String name, Value value) { defines.put(name, value); }

    public void defineJson(String name, JsonNode json) { define(name, ValueJson.fromJson(json)); }

    // ===================== EXECUTION =====================

    /** A fresh session scope seeded with the registered functions and defines. */
    public ExecutionState newState() {
        Environment prelude = new Environment();
        for (NativeFunction fn : functions.values()) prelude.define(fn.name(), Value.function(fn));
        for (Map.Entry<String, Value> e : defines.entrySet()) prelude.define(e.getKey(), e.getValue());
        return new ExecutionState(prelude);
    }

    /**
     * Lexes and parses a program.
     *
     * @throws com.forge.script.error.LexError on the first malformed token
     * @throws com.forge.script.error.ParseFailure with every parse error found
     */
    public List<Stmt> parse(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens).parse();
    }

    /** Runs a program in a fresh state. Returns the globals it declared. */
    public Map<String, Value> run(String source) {
        return run(source, newState());
    }

    public Map<String, Value> run(String source, ExecutionState state) {
        List<Stmt> program = parse(source);
        Debug.get().d(TAG, "running " + program.size() + " top-level statement(s)");
        interpreter(state).execute(program);
        return state.globals();
    }

    /**
     * Evaluates one REPL unit against a persistent state.
     *
     * @return the value of a bare expression unit, or null when the unit was statements
     */
    public Value eval(String unit, ExecutionState state) {
        Parser parser = new Parser(new Lexer(unit).tokenize());
        Parser.ReplUnit parsed = parser.parseReplUnit();
        Interpreter interpreter = interpreter(state);
        if (parsed.isExpression()) {
            return interpreter.evaluate(parsed.expression);
        }
        interpreter.execute(parsed.statements);
        return null;
    }

    private Interpreter interpreter(ExecutionState state) {
        return new Interpreter(state.env, io, maxCallDepth);
    }

    /** Formats an error raised by this engine as text diagnostics against its source. */
    public String report(ForgeException error, String source) {
        return DiagnosticRenderer.render(error, source);
    }
}
