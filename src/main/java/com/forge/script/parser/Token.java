package com.forge.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    final Object literal;
    public final Span span;

    Token(TokenType type, String lexeme, Object literal, Span span) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.span = span;
    }

    public int line() {
        return span.line;
    }

    /** Human readable form used in "found ..." messages. */
    public String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case IDENTIFIER:
                return "identifier '" + lexeme + "'";
            case NUMBER:
            case STRING:
            case CHAR:
                return type.display() + " " + lexeme;
            default:
                return "'" + lexeme + "'";
        }
    }

    @Override
    public String toString() {
        return type + " " + lexeme + " @" + span.position();
    }
}
