package com.forge.script.error;

import com.forge.script.parser.Span;

/**
 * Argument count differs from the callee's parameter count. The primary span is the call
 * expression; the declaration span of the function (when it has one) becomes a second frame.
 */
public class ArityError extends RuntimeError {
    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int found;

    public ArityError(int expected, int found, Span callSite, Span declaration) {
        super("expected " + expected + " argument(s), found " + found, callSite);
        this.expected = expected;
        this.found = found;
        if (declaration != null) {
            addFrame(new Frame("function declared", declaration));
        }
    }

    public int expected() {
        return expected;
    }

    public int found() {
        return found;
    }
}
