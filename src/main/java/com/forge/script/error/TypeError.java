package com.forge.script.error;

import com.forge.script.parser.Span;

/** Operand of the wrong type: truthiness, operators, casts, slice assignment, calls. */
public class TypeError extends RuntimeError {
    private static final long serialVersionUID = 1L;

    public TypeError(String message, Span span) {
        super(message, span);
    }
}
