package com.forge.script.parser;

/**
 * Completion of a statement. Anything other than NORMAL unwinds to the nearest loop
 * (BREAK, CONTINUE) or function call (RETURN).
 */
public final class Signal {

    public enum Kind { NORMAL, BREAK, CONTINUE, RETURN }

    public static final Signal NORMAL = new Signal(Kind.NORMAL, null);
    public static final Signal BREAK = new Signal(Kind.BREAK, null);
    public static final Signal CONTINUE = new Signal(Kind.CONTINUE, null);

    public final Kind kind;
    private final Value value;

    private Signal(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static Signal ret(Value value) {
        return new Signal(Kind.RETURN, value == null ? Value.nil() : value);
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    /** The returned value; NULL for anything but RETURN. */
    public Value value() {
        return value == null ? Value.nil() : value;
    }

    @Override
    public String toString() {
        return kind == Kind.RETURN ? "RETURN(" + value + ")" : kind.name();
    }
}
