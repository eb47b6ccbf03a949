package com.forge.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope. Scopes chain to their parent; a function value keeps the scope it was
 * created in alive for as long as the function itself is reachable.
 */
public class Environment {
    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment child() {
        return new Environment(this);
    }

    /** Binds a name in this scope. Re-declaring a name here replaces the old binding. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    /** Nearest binding of name, or null when no enclosing scope defines it. */
    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        return null;
    }

    /** Overwrites the nearest binding. Returns false when the name is not defined. */
    public boolean assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return true;
            }
        }
        return false;
    }

    public boolean isDefined(String name) {
        return get(name) != null;
    }

    /** The bindings of this scope only, in declaration order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
