package com.forge.script.parser;

import java.util.ArrayList;
import java.util.List;

/** Binary operator table over built-in values. Returns null for unsupported operand types. */
final class Operators {

    private Operators() {}

    static Value apply(TokenType op, Value l, Value r) {
        switch (op) {
            case PLUS: return plus(l, r);
            case MINUS:
            case STAR:
            case SLASH:
            case PERCENT:
                return arithmetic(op, l, r);
            case LESS:
            case LESS_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
                return compare(op, l, r);
            case EQUAL_EQUAL:
                return sameType(l, r) ? Value.bool(l.equals(r)) : null;
            case BANG_EQUAL:
                return sameType(l, r) ? Value.bool(!l.equals(r)) : null;
            case DOT_DOT:
                if (l.isIntegral() && r.isIntegral()) {
                    return Value.range((long) l.asNumber(), (long) r.asNumber());
                }
                return null;
            default:
                return null;
        }
    }

    // custom values compare through coercion, so a type mismatch is not yet a verdict
    private static boolean sameType(Value l, Value r) {
        if (l.type == r.type) return true;
        return l.type != Value.Type.CUSTOM && r.type != Value.Type.CUSTOM;
    }

    private static Value plus(Value l, Value r) {
        if (l.type == Value.Type.NUMBER && r.type == Value.Type.NUMBER) {
            return Value.number(l.asNumber() + r.asNumber());
        }
        if (l.type == Value.Type.STRING || r.type == Value.Type.STRING) {
            if (l.type == Value.Type.CUSTOM || r.type == Value.Type.CUSTOM) return null;
            return Value.string(l.display() + r.display());
        }
        if (l.type == Value.Type.CHAR && r.type == Value.Type.CHAR) {
            return Value.string(l.display() + r.display());
        }
        if (l.type == Value.Type.LIST && r.type == Value.Type.LIST) {
            List<Value> out = new ArrayList<>(l.asList());
            out.addAll(r.asList());
            return Value.list(out);
        }
        return null;
    }

    private static Value arithmetic(TokenType op, Value l, Value r) {
        if (l.type != Value.Type.NUMBER || r.type != Value.Type.NUMBER) return null;
        double a = l.asNumber();
        double b = r.asNumber();
        switch (op) {
            case MINUS: return Value.number(a - b);
            case STAR: return Value.number(a * b);
            case SLASH: return Value.number(a / b);
            default: return Value.number(a % b);
        }
    }

    private static Value compare(TokenType op, Value l, Value r) {
        int c;
        if (l.type == Value.Type.NUMBER && r.type == Value.Type.NUMBER) {
            double a = l.asNumber();
            double b = r.asNumber();
            // NaN orders with nothing
            if (Double.isNaN(a) || Double.isNaN(b)) return Value.bool(false);
            c = Double.compare(a == 0.0 ? 0.0 : a, b == 0.0 ? 0.0 : b);
        } else if (l.type == Value.Type.STRING && r.type == Value.Type.STRING) {
            c = compareCodePoints(l.asString(), r.asString());
        } else if (l.type == Value.Type.CHAR && r.type == Value.Type.CHAR) {
            c = Integer.compare(l.asChar(), r.asChar());
        } else {
            return null;
        }
        switch (op) {
            case LESS: return Value.bool(c < 0);
            case LESS_EQUAL: return Value.bool(c <= 0);
            case GREATER: return Value.bool(c > 0);
            default: return Value.bool(c >= 0);
        }
    }

    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Boolean.compare(i < a.length(), j < b.length());
    }
}
