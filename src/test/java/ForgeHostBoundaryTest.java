import com.forge.script.ForgeScript;
import com.forge.script.error.ArityError;
import com.forge.script.error.HostError;
import com.forge.script.error.TypeError;
import com.forge.script.host.CustomType;
import com.forge.script.host.NativeFunction;
import com.forge.script.parser.Callable;
import com.forge.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ForgeHostBoundaryTest {

    /** A bag of numbers: iterable, and coerces to its size where a number is wanted. */
    private static final CustomType BAG = new CustomType() {
        @Override
        public String name() { return "bag"; }

        @Override
        @SuppressWarnings("unchecked")
        public String display(Object payload) { return "bag(" + ((List<Integer>) payload).size() + ")"; }

        @Override
        @SuppressWarnings("unchecked")
        public Iterator<Value> iterator(Object payload) {
            List<Value> out = new ArrayList<>();
            for (Integer i : (List<Integer>) payload) out.add(Value.number(i));
            return out.iterator();
        }

        @Override
        @SuppressWarnings("unchecked")
        public Value coerce(Object payload, Value.Type target) {
            if (target == Value.Type.NUMBER) return Value.number(((List<Integer>) payload).size());
            return null;
        }
    };

    /** Callable host values: multiply their argument by the payload. */
    private static final CustomType MULTIPLIER = new CustomType() {
        @Override
        public String name() { return "multiplier"; }

        @Override
        public Callable asCallable(Object payload) {
            final int factor = (Integer) payload;
            return new NativeFunction("multiply", 1,
                    (interpreter, args) -> Value.number(args.get(0).asNumber() * factor));
        }
    };

    private static final CustomType TAG = () -> "tag";

    private static ForgeScript engine() {
        ForgeScript es = new ForgeScript();
        es.setIO(new RecordingIO());
        return es;
    }

    @Test
    void native_functions_are_called_with_evaluated_arguments() {
        ForgeScript es = engine();
        es.registerFunction("add", 2, (interpreter, args) -> Value.number(args.get(0).asNumber() + args.get(1).asNumber()));
        assertEquals(5.0, es.run("var r = add(2, 3);").get("r").asNumber(), 0.0);
    }

    @Test
    void variadic_natives_accept_any_count() {
        ForgeScript es = engine();
        es.registerFunction(NativeFunction.variadic("sum", (interpreter, args) -> {
            double total = 0;
            for (Value v : args) total += v.asNumber();
            return Value.number(total);
        }));
        Map<String, Value> env = es.run("var a = sum(); var b = sum(1, 2, 3);");
        assertEquals(0.0, env.get("a").asNumber(), 0.0);
        assertEquals(6.0, env.get("b").asNumber(), 0.0);
    }

    @Test
    void natives_can_call_back_into_script_functions() {
        ForgeScript es = engine();
        es.registerFunction("apply", 2, (interpreter, args) -> interpreter.call(args.get(0), List.of(args.get(1))));
        assertEquals(42.0, es.run("var r = apply(|x| { return x * 2; }, 21);").get("r").asNumber(), 0.0);
    }

    @Test
    void native_arity_mismatch_has_no_declaration_frame() {
        ForgeScript es = engine();
        es.registerFunction("one", 1, (interpreter, args) -> args.get(0));
        ArityError e = assertThrows(ArityError.class, () -> es.run("one();"));
        assertEquals("expected 1 argument(s), found 0", e.getMessage());
        assertTrue(e.frames().isEmpty());
    }

    @Test
    void host_exceptions_become_host_errors() {
        ForgeScript es = engine();
        es.registerFunction("boom", 0, (interpreter, args) -> {
            throw new IllegalStateException("kaboom");
        });
        HostError e = assertThrows(HostError.class, () -> es.run("var x = 1;\nboom();"));
        assertEquals("host function 'boom' failed: kaboom", e.getMessage());
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals(2, e.span().line);

        HostError p = assertThrows(HostError.class, () -> engine().run("pop([]);"));
        assertTrue(p.getMessage().contains("empty list"));
    }

    @Test
    void custom_values_iterate_coerce_and_display() {
        ForgeScript es = engine();
        RecordingIO io = new RecordingIO();
        es.setIO(io);
        es.define("bag", Value.custom(BAG, List.of(1, 2, 3)));

        String src = String.join("\n",
                "var total = 0;",
                "for x in bag { total += x; }",
                "var n = bag + 1;",
                "var t = typeof(bag);",
                "print bag;",
                ""
        );
        Map<String, Value> env = es.run(src);
        assertEquals(6.0, env.get("total").asNumber(), 0.0);
        assertEquals(4.0, env.get("n").asNumber(), 0.0);
        assertEquals("bag", env.get("t").asString());
        assertEquals("bag(3)\n", io.output());
    }

    @Test
    void custom_values_without_a_conversion_are_type_errors() {
        ForgeScript es = engine();
        es.define("bag", Value.custom(BAG, List.of(1)));
        TypeError truth = assertThrows(TypeError.class, () -> es.run("if bag { }"));
        assertEquals("cannot determine truthiness of value of type 'bag'", truth.getMessage());

        es.define("t", Value.custom(TAG, "x"));
        TypeError op = assertThrows(TypeError.class, () -> es.run("var r = t * 2;"));
        assertEquals("unsupported operand types for '*': 'tag' and 'num'", op.getMessage());
        assertThrows(TypeError.class, () -> es.run("for x in t { }"));
        assertThrows(TypeError.class, () -> es.run("t();"));
    }

    @Test
    void callable_custom_values() {
        ForgeScript es = engine();
        es.define("triple", Value.custom(MULTIPLIER, 3));
        assertEquals(15.0, es.run("var r = triple(5);").get("r").asNumber(), 0.0);
    }

    @Test
    void custom_equality_drives_map_keys() {
        ForgeScript es = engine();
        es.define("p1", Value.custom(TAG, "same"));
        es.define("p2", Value.custom(TAG, "same"));
        es.define("p3", Value.custom(TAG, "other"));
        Map<String, Value> env = es.run("var m = [:]; m[p1] = \"first\"; var r = m[p2]; var eq = p1 == p2; var ne = p1 == p3;");
        assertEquals("first", env.get("r").asString());
        assertTrue(env.get("eq").asBool());
        assertFalse(env.get("ne").asBool());
    }
}
