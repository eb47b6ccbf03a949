package com.forge.script.error;

import com.forge.script.parser.Span;

public class IndexError extends RuntimeError {
    private static final long serialVersionUID = 1L;

    public IndexError(String message, Span span) {
        super(message, span);
    }
}
