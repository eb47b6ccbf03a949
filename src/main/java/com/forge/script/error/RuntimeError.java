package com.forge.script.error;

import com.forge.script.parser.Span;

/** An error raised while evaluating a parsed program. Aborts the current top-level unit. */
public class RuntimeError extends ForgeException {
    private static final long serialVersionUID = 1L;

    public RuntimeError(String message, Span span) {
        super(message, span);
    }

    public RuntimeError(String message, Span span, Throwable cause) {
        super(message, span, cause);
    }

    @Override
    public Phase phase() {
        return Phase.RUNTIME;
    }
}
