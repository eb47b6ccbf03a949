package com.forge.script.error;

import java.util.List;

import com.forge.script.parser.Span;

/**
 * A grammar violation. The context list is the parser's rule stack at the moment the
 * error was raised, innermost rule first.
 */
public class ParseError extends ForgeException {
    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    public ParseError(String expected, String found, Span span, List<String> context) {
        super("expected " + expected + ", found " + found, span);
        this.expected = expected;
        this.found = found;
        addTrail(context);
    }

    public ParseError(String message, Span span, List<String> context) {
        super(message, span);
        this.expected = null;
        this.found = null;
        addTrail(context);
    }

    /** What the parser wanted at this point, or null for free-form errors. */
    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }

    @Override
    public Phase phase() {
        return Phase.PARSING;
    }
}
