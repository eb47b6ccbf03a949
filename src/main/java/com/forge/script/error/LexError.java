package com.forge.script.error;

import com.forge.script.parser.Span;

/** Invalid input at the character level; the scan stops at the first one. */
public class LexError extends ForgeException {
    private static final long serialVersionUID = 1L;

    public LexError(String message, Span span) {
        super(message, span);
    }

    @Override
    public Phase phase() {
        return Phase.PARSING;
    }
}
