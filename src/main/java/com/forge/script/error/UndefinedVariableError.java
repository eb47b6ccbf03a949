package com.forge.script.error;

import com.forge.script.parser.Span;

public class UndefinedVariableError extends RuntimeError {
    private static final long serialVersionUID = 1L;

    private final String name;

    public UndefinedVariableError(String name, Span span) {
        super("undefined variable '" + name + "'", span);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
