package com.forge.script.error;

import com.forge.script.parser.Span;

/** A native callback or custom type failed with a non-Forge exception. */
public class HostError extends RuntimeError {
    private static final long serialVersionUID = 1L;

    public HostError(String message, Span span, Throwable cause) {
        super(message, span, cause);
    }
}
