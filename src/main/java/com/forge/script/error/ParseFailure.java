package com.forge.script.error;

import java.util.Collections;
import java.util.List;

/** All parse errors collected from a single parse pass, in source order. */
public class ParseFailure extends ForgeException {
    private static final long serialVersionUID = 1L;

    private final List<ParseError> errors;

    public ParseFailure(List<ParseError> errors) {
        super(errors.size() + " parse error(s)", errors.get(0).span());
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<ParseError> errors() {
        return errors;
    }

    @Override
    public Phase phase() {
        return Phase.PARSING;
    }
}
