package com.forge.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.forge.script.error.TypeError;

/** The "as" operator. */
final class Casts {

    private Casts() {}

    static Value cast(Value v, String target, Span span) {
        Value out;
        switch (target) {
            case "str": out = Value.string(v.display()); break;
            case "num": out = toNumber(v, span); break;
            case "char": out = toChar(v); break;
            case "bool": out = toBool(v); break;
            case "list": out = toList(v); break;
            default: out = null; break;
        }
        if (out == null && v.type == Value.Type.CUSTOM) {
            Value.Custom c = v.asCustom();
            Value coerced = c.type.coerce(c.payload, typeOf(target));
            if (coerced != null && coerced.type != Value.Type.CUSTOM) return cast(coerced, target, span);
        }
        if (out == null) {
            throw new TypeError("cannot cast value of type '" + v.typeName() + "' to '" + target + "'", span);
        }
        return out;
    }

    private static Value.Type typeOf(String target) {
        switch (target) {
            case "num": return Value.Type.NUMBER;
            case "char": return Value.Type.CHAR;
            case "bool": return Value.Type.BOOL;
            case "list": return Value.Type.LIST;
            default: return Value.Type.STRING;
        }
    }

    private static Value toNumber(Value v, Span span) {
        switch (v.type) {
            case NUMBER: return v;
            case CHAR: return Value.number(v.asChar());
            case BOOL: return Value.number(v.asBool() ? 1 : 0);
            case STRING:
                try {
                    return Value.number(Double.parseDouble(v.asString().trim()));
                } catch (NumberFormatException e) {
                    throw new TypeError("cannot cast \"" + v.asString() + "\" to 'num'", span);
                }
            default:
                return null;
        }
    }

    private static Value toChar(Value v) {
        switch (v.type) {
            case CHAR: return v;
            case NUMBER:
                if (v.isIntegral() && Character.isValidCodePoint((int) v.asNumber())) {
                    return Value.character((int) v.asNumber());
                }
                return null;
            case STRING: {
                String s = v.asString();
                if (s.codePointCount(0, s.length()) == 1) return Value.character(s.codePointAt(0));
                return null;
            }
            default:
                return null;
        }
    }

    private static Value toBool(Value v) {
        switch (v.type) {
            case BOOL: return v;
            case STRING:
                if ("true".equals(v.asString())) return Value.bool(true);
                if ("false".equals(v.asString())) return Value.bool(false);
                return null;
            default:
                return null;
        }
    }

    private static Value toList(Value v) {
        switch (v.type) {
            case LIST: return v;
            case STRING: {
                List<Value> out = new ArrayList<>();
                v.asString().codePoints().forEach(cp -> out.add(Value.character(cp)));
                return Value.list(out);
            }
            case RANGE: {
                Value.RangeBounds r = v.asRange();
                List<Value> out = new ArrayList<>();
                for (long i = r.lo; i < r.hi; i++) out.add(Value.number(i));
                return Value.list(out);
            }
            case MAP: {
                List<Value> out = new ArrayList<>();
                for (Map.Entry<Value, Value> e : v.asMap().entrySet()) {
                    List<Value> pair = new ArrayList<>(2);
                    pair.add(e.getKey());
                    pair.add(e.getValue());
                    out.add(Value.list(pair));
                }
                return Value.list(out);
            }
            default:
                return null;
        }
    }
}
