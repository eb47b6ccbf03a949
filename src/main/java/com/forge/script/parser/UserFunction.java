package com.forge.script.parser;

import java.util.List;

import com.forge.script.parser.Statement.Block;

/** A function literal closed over the scope it was evaluated in. */
public class UserFunction implements Callable {
    final String name;
    final List<Token> params;
    final Block body;
    final Environment closure;
    final Span declaration;

    UserFunction(String name, List<Token> params, Block body, Environment closure, Span declaration) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
        this.declaration = declaration;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int arity() {
        return params.size();
    }

    @Override
    public Span declaration() {
        return declaration;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        // The call scope is a child of the closure (lexical scoping), not of the caller.
        Environment frame = closure.child();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i).lexeme, args.get(i));
        }

        Signal signal = interpreter.executeBlock(body.statements, frame);
        if (signal.kind == Signal.Kind.RETURN) {
            return signal.value();
        }
        return Value.nil();
    }
}
