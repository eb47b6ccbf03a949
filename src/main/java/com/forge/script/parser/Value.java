package com.forge.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.forge.script.host.CustomType;

/**
 * A runtime value: a type tag plus its payload.
 *
 * Payloads by type: NUMBER Double, STRING String, CHAR Integer (code point), BOOL Boolean,
 * RANGE {@link RangeBounds}, FUNCTION {@link Callable}, LIST {@code List<Value>},
 * MAP {@code Map<Value, Value>}, CUSTOM {@link Custom}, NULL nothing.
 * Lists and maps are shared by reference; every other payload is immutable.
 */
public class Value {
    public enum Type {
        NUMBER("num"), STRING("str"), CHAR("char"), BOOL("bool"), RANGE("range"),
        FUNCTION("function"), LIST("list"), MAP("map"), CUSTOM("custom"), NULL("null");

        private final String typeName;

        Type(String typeName) {
            this.typeName = typeName;
        }

        public String typeName() {
            return typeName;
        }
    }

    /** Half-open integral interval lo..hi. */
    public static final class RangeBounds {
        public final long lo;
        public final long hi;

        public RangeBounds(long lo, long hi) {
            this.lo = lo;
            this.hi = hi;
        }

        public long size() {
            if (hi <= lo) return 0;
            long n = hi - lo;
            // saturate when the distance overflows a long
            return n < 0 ? Long.MAX_VALUE : n;
        }
    }

    /** Host payload together with the operation table that gives it meaning. */
    public static final class Custom {
        public final CustomType type;
        public final Object payload;

        public Custom(CustomType type, Object payload) {
            this.type = type;
            this.payload = payload;
        }
    }

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value character(int codePoint) { return new Value(Type.CHAR, codePoint); }
    public static Value range(long lo, long hi) { return new Value(Type.RANGE, new RangeBounds(lo, hi)); }
    public static Value function(Callable f) { return new Value(Type.FUNCTION, f); }
    public static Value list(List<Value> items) { return new Value(Type.LIST, items); }
    public static Value map(Map<Value, Value> entries) { return new Value(Type.MAP, entries); }
    public static Value custom(CustomType type, Object payload) { return new Value(Type.CUSTOM, new Custom(type, payload)); }

    public static Value list() { return list(new ArrayList<>()); }
    public static Value map() { return map(new LinkedHashMap<>()); }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    /** Name used in error messages; custom values report their host type's name. */
    public String typeName() {
        if (type == Type.CUSTOM) return asCustom().type.name();
        return type.typeName();
    }

    // -------------------------
    // Accessors
    // -------------------------

    public double asNumber() {
        expect(Type.NUMBER);
        return (Double) value;
    }

    public boolean asBool() {
        expect(Type.BOOL);
        return (Boolean) value;
    }

    public String asString() {
        expect(Type.STRING);
        return (String) value;
    }

    public int asChar() {
        expect(Type.CHAR);
        return (Integer) value;
    }

    public RangeBounds asRange() {
        expect(Type.RANGE);
        return (RangeBounds) value;
    }

    public Callable asFunction() {
        expect(Type.FUNCTION);
        return (Callable) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        expect(Type.LIST);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<Value, Value> asMap() {
        expect(Type.MAP);
        return (Map<Value, Value>) value;
    }

    public Custom asCustom() {
        expect(Type.CUSTOM);
        return (Custom) value;
    }

    private void expect(Type t) {
        if (type != t) throw new IllegalStateException("Expected " + t.typeName() + ", got " + typeName());
    }

    /** True for a NUMBER with no fractional part that fits a long. */
    public boolean isIntegral() {
        if (type != Type.NUMBER) return false;
        double d = (Double) value;
        return d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.2e18;
    }

    // -------------------------
    // Copying
    // -------------------------

    /**
     * Deep copy. Lists and maps get fresh storage all the way down; shared and cyclic
     * structure is reproduced rather than expanded.
     */
    public Value deepClone() {
        return deepClone(new IdentityHashMap<>());
    }

    private Value deepClone(IdentityHashMap<Object, Value> seen) {
        switch (type) {
            case LIST: {
                Value done = seen.get(value);
                if (done != null) return done;
                List<Value> src = asList();
                List<Value> out = new ArrayList<>(src.size());
                Value copy = Value.list(out);
                seen.put(value, copy);
                for (Value item : src) out.add(item.deepClone(seen));
                return copy;
            }
            case MAP: {
                Value done = seen.get(value);
                if (done != null) return done;
                Map<Value, Value> out = new LinkedHashMap<>();
                Value copy = Value.map(out);
                seen.put(value, copy);
                for (Map.Entry<Value, Value> e : asMap().entrySet()) {
                    out.put(e.getKey().deepClone(seen), e.getValue().deepClone(seen));
                }
                return copy;
            }
            case CUSTOM: {
                Custom c = asCustom();
                return Value.custom(c.type, c.type.copy(c.payload));
            }
            default:
                return this;
        }
    }

    // -------------------------
    // Text forms
    // -------------------------

    /** Text written by print and produced by string concatenation and "as str". */
    public String display() {
        switch (type) {
            case STRING:
                return asString();
            case CHAR:
                return new String(Character.toChars(asChar()));
            default:
                return repr(new IdentityHashMap<>());
        }
    }

    /** Like display, but strings and chars nested in collections are quoted. */
    private String repr(IdentityHashMap<Object, Boolean> open) {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case CHAR:
                return "'" + new String(Character.toChars(asChar())) + "'";
            case RANGE: {
                RangeBounds r = asRange();
                return r.lo + ".." + r.hi;
            }
            case FUNCTION:
                return "<function " + asFunction().name() + ">";
            case LIST: {
                if (open.containsKey(value)) return "[...]";
                open.put(value, Boolean.TRUE);
                StringBuilder sb = new StringBuilder("[");
                Iterator<Value> it = asList().iterator();
                while (it.hasNext()) {
                    sb.append(it.next().repr(open));
                    if (it.hasNext()) sb.append(", ");
                }
                open.remove(value);
                return sb.append(']').toString();
            }
            case MAP: {
                Map<Value, Value> m = asMap();
                if (m.isEmpty()) return "[:]";
                if (open.containsKey(value)) return "[...]";
                open.put(value, Boolean.TRUE);
                StringBuilder sb = new StringBuilder("[");
                Iterator<Map.Entry<Value, Value>> it = m.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<Value, Value> e = it.next();
                    sb.append(e.getKey().repr(open)).append(": ").append(e.getValue().repr(open));
                    if (it.hasNext()) sb.append(", ");
                }
                open.remove(value);
                return sb.append(']').toString();
            }
            case CUSTOM: {
                Custom c = asCustom();
                return c.type.display(c.payload);
            }
            default:
                return "null";
        }
    }

    /** Integral numbers print without a fraction: 3 rather than 3.0. */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    @Override
    public String toString() {
        return repr(new IdentityHashMap<>());
    }

    // -------------------------
    // Structural equality
    // -------------------------

    /** How deep hashCode looks into nested lists and maps. */
    private static final int HASH_DEPTH = 4;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        return sameAs((Value) o, new IdentityHashMap<>());
    }

    /**
     * Structural comparison. A pair of containers already being compared further up
     * counts as equal, so cyclic lists and maps terminate.
     */
    private boolean sameAs(Value other, IdentityHashMap<Object, Set<Object>> comparing) {
        if (type != other.type) return false;
        switch (type) {
            case NUMBER:
                return asNumber() == other.asNumber();
            case RANGE: {
                RangeBounds a = asRange();
                RangeBounds b = other.asRange();
                return a.lo == b.lo && a.hi == b.hi;
            }
            case FUNCTION:
                return value == other.value;
            case LIST: {
                if (value == other.value || !enter(comparing, value, other.value)) return true;
                List<Value> a = asList();
                List<Value> b = other.asList();
                if (a.size() != b.size()) return false;
                for (int i = 0; i < a.size(); i++) {
                    if (!a.get(i).sameAs(b.get(i), comparing)) return false;
                }
                return true;
            }
            case MAP: {
                if (value == other.value || !enter(comparing, value, other.value)) return true;
                Map<Value, Value> a = asMap();
                Map<Value, Value> b = other.asMap();
                if (a.size() != b.size()) return false;
                for (Map.Entry<Value, Value> e : a.entrySet()) {
                    Value v = b.get(e.getKey());
                    if (v == null || !e.getValue().sameAs(v, comparing)) return false;
                }
                return true;
            }
            case CUSTOM: {
                Custom a = asCustom();
                Custom b = other.asCustom();
                return a.type == b.type && a.type.isEqual(a.payload, b.payload);
            }
            case NULL:
                return true;
            default:
                return value.equals(other.value);
        }
    }

    /** Marks the pair as under comparison; false when it already was. */
    private static boolean enter(IdentityHashMap<Object, Set<Object>> comparing, Object a, Object b) {
        Set<Object> partners = comparing.get(a);
        if (partners == null) {
            partners = Collections.newSetFromMap(new IdentityHashMap<>());
            comparing.put(a, partners);
        }
        return partners.add(b);
    }

    @Override
    public int hashCode() {
        return hash(HASH_DEPTH);
    }

    // bounded: containers below the cutoff contribute only their size
    private int hash(int depth) {
        switch (type) {
            case NUMBER: {
                double d = asNumber();
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            case RANGE: {
                RangeBounds r = asRange();
                return 31 * Long.hashCode(r.lo) + Long.hashCode(r.hi);
            }
            case FUNCTION:
                return System.identityHashCode(value);
            case LIST: {
                List<Value> items = asList();
                int h = type.ordinal() * 31 + items.size();
                if (depth == 0) return h;
                for (Value item : items) h = 31 * h + item.hash(depth - 1);
                return h;
            }
            case MAP: {
                Map<Value, Value> entries = asMap();
                int h = type.ordinal() * 31 + entries.size();
                if (depth == 0) return h;
                int sum = 0;
                for (Map.Entry<Value, Value> e : entries.entrySet()) {
                    sum += e.getKey().hash(depth - 1) ^ e.getValue().hash(depth - 1);
                }
                return 31 * h + sum;
            }
            case CUSTOM: {
                Custom c = asCustom();
                return c.type.hash(c.payload);
            }
            case NULL:
                return 0;
            default:
                return type.ordinal() * 31 + value.hashCode();
        }
    }
}
