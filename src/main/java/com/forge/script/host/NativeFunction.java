package com.forge.script.host;

import java.util.List;

import com.forge.script.parser.Callable;
import com.forge.script.parser.Interpreter;
import com.forge.script.parser.Span;
import com.forge.script.parser.Value;

/**
 * A host callback exposed to scripts as a FUNCTION value.
 *
 * The body runs synchronously and may re-enter the interpreter through
 * {@link Interpreter#call(Value, List)}. Exceptions that are not Forge errors are reported
 * to the script as a HostError at the call site.
 */
public final class NativeFunction implements Callable {

    @FunctionalInterface
    public interface Body {
        Value apply(Interpreter interpreter, List<Value> args);
    }

    private final String name;
    private final int arity;
    private final Body body;

    public NativeFunction(String name, int arity, Body body) {
        if (arity < 0 && arity != VARIADIC) throw new IllegalArgumentException("arity must be >= 0 or VARIADIC");
        this.name = name;
        this.arity = arity;
        this.body = body;
    }

    public static NativeFunction variadic(String name, Body body) {
        return new NativeFunction(name, VARIADIC, body);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    public Span declaration() {
        return null;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> arguments) {
        Value result = body.apply(interpreter, arguments);
        return result == null ? Value.nil() : result;
    }
}
