package com.forge.script;

import java.util.List;

import com.forge.script.parser.Value;

/** Host functions every engine starts with. */
final class Prelude {

    private Prelude() {}

    static void register(ForgeScript engine) {
        engine.registerFunction("len", 1, (interpreter, args) -> {
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: {
                    String s = v.asString();
                    return Value.number(s.codePointCount(0, s.length()));
                }
                case LIST: return Value.number(v.asList().size());
                case MAP: return Value.number(v.asMap().size());
                case RANGE: return Value.number(v.asRange().size());
                default: throw new IllegalArgumentException("len() not supported for type '" + v.typeName() + "'");
            }
        });

        engine.registerFunction("typeof", 1, (interpreter, args) -> Value.string(args.get(0).typeName()));

        engine.registerFunction("push", 2, (interpreter, args) -> {
            List<Value> list = requireList("push", args.get(0));
            list.add(args.get(1));
            return args.get(0);
        });

        engine.registerFunction("pop", 1, (interpreter, args) -> {
            List<Value> list = requireList("pop", args.get(0));
            if (list.isEmpty()) throw new IllegalArgumentException("pop() on an empty list");
            return list.remove(list.size() - 1);
        });

        engine.registerFunction("remove", 2, (interpreter, args) -> {
            Value m = args.get(0);
            if (m.getType() != Value.Type.MAP) {
                throw new IllegalArgumentException("remove() expects a map, got '" + m.typeName() + "'");
            }
            Value removed = m.asMap().remove(args.get(1));
            return removed == null ? Value.nil() : removed;
        });
    }

    private static List<Value> requireList(String fn, Value v) {
        if (v.getType() != Value.Type.LIST) {
            throw new IllegalArgumentException(fn + "() expects a list, got '" + v.typeName() + "'");
        }
        return v.asList();
    }
}
