package com.forge.script.parser;

import java.util.List;

/**
 * Anything a FUNCTION value can hold: a user function literal or a host callback.
 * The interpreter checks arity and call depth before invoking {@link #call}.
 */
public interface Callable {
    int VARIADIC = -1;

    String name();

    /** Exact parameter count, or {@link #VARIADIC}. */
    int arity();

    /** Where the function was written; null for host functions. */
    Span declaration();

    Value call(Interpreter interpreter, List<Value> arguments);
}
