package com.forge.script.parser;

public enum TokenType {
    // Punctuation
    LEFT_PAREN("'('"), RIGHT_PAREN("')'"), LEFT_BRACE("'{'"), RIGHT_BRACE("'}'"),
    LEFT_BRACKET("'['"), RIGHT_BRACKET("']'"), COMMA("','"), SEMICOLON("';'"), COLON("':'"), PIPE("'|'"),

    // Operators
    PLUS("'+'"), MINUS("'-'"), STAR("'*'"), SLASH("'/'"), PERCENT("'%'"),
    PLUS_EQUAL("'+='"), MINUS_EQUAL("'-='"), STAR_EQUAL("'*='"), SLASH_EQUAL("'/='"), PERCENT_EQUAL("'%='"),
    EQUAL("'='"), EQUAL_EQUAL("'=='"), BANG("'!'"), BANG_EQUAL("'!='"),
    LESS("'<'"), LESS_EQUAL("'<='"), GREATER("'>'"), GREATER_EQUAL("'>='"),
    DOT_DOT("'..'"),

    // Literals
    IDENTIFIER("identifier"), NUMBER("number"), STRING("string"), CHAR("character"),

    // Keywords
    VAR("'var'"), PRINT("'print'"), IF("'if'"), ELSE("'else'"), WHILE("'while'"), FOR("'for'"), IN("'in'"),
    RETURN("'return'"), BREAK("'break'"), CONTINUE("'continue'"),
    TRUE("'true'"), FALSE("'false'"), NULL("'null'"),
    AND("'and'"), OR("'or'"), XOR("'xor'"),
    INPUT("'input'"), CLONE("'clone'"), MIRROR("'mirror'"), AS("'as'"),

    EOF("end of input");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /** How this kind of token is named in "expected ..." messages. */
    public String display() {
        return display;
    }

    public boolean isAssignment() {
        switch (this) {
            case EQUAL:
            case PLUS_EQUAL:
            case MINUS_EQUAL:
            case STAR_EQUAL:
            case SLASH_EQUAL:
            case PERCENT_EQUAL:
                return true;
            default:
                return false;
        }
    }

    /** Keywords that can only begin a statement; used as resynchronisation points. */
    public boolean startsStatement() {
        switch (this) {
            case VAR:
            case PRINT:
            case IF:
            case WHILE:
            case FOR:
            case RETURN:
            case BREAK:
            case CONTINUE:
                return true;
            default:
                return false;
        }
    }
}
