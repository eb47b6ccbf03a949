package com.forge.script;

import java.util.Map;

import com.forge.script.parser.Environment;
import com.forge.script.parser.Value;

/**
 * ExecutionState
 *
 * The persistent top-level scope of a session. A REPL passes the same state into every
 * {@link ForgeScript#eval} so declarations survive from one line to the next.
 *
 * Two scopes are kept: the prelude (host functions and defines) and the globals declared
 * by scripts, which is a child of the prelude. Only the latter is reported by
 * {@link #globals()}, so host bindings do not leak into script results.
 */
public class ExecutionState {
    final Environment prelude;
    final Environment env;

    ExecutionState(Environment prelude) {
        this.prelude = prelude;
        this.env = prelude.child();
    }

    /** Script-declared globals in declaration order. */
    public Map<String, Value> globals() {
        return env.snapshot();
    }

    /** Looks a name up through globals and prelude; null when unbound. */
    public Value get(String name) {
        return env.get(name);
    }

    /** Binds a script global, as "var name = value;" would. */
    public void set(String name, Value value) {
        env.define(name, value);
    }

    public Environment environment() {
        return env;
    }
}
