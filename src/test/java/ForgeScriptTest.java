import com.forge.script.ExecutionState;
import com.forge.script.ForgeScript;
import com.forge.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ForgeScriptTest {

    private static Map<String, Value> run(String src) {
        ForgeScript es = new ForgeScript();
        es.setIO(new RecordingIO());
        return es.run(src);
    }

    private static String output(String src, String... input) {
        ForgeScript es = new ForgeScript();
        RecordingIO io = new RecordingIO(input);
        es.setIO(io);
        es.run(src);
        return io.output();
    }

    @Test
    void arithmetic_and_precedence() {
        Map<String, Value> env = run("var a = 1 + 2 * 3; var b = (1 + 2) * 3; var c = 7 % 4; var d = 10 / 4; var e = -2 * -3;");
        assertEquals(7.0, env.get("a").asNumber(), 0.0);
        assertEquals(9.0, env.get("b").asNumber(), 0.0);
        assertEquals(3.0, env.get("c").asNumber(), 0.0);
        assertEquals(2.5, env.get("d").asNumber(), 0.0);
        assertEquals(6.0, env.get("e").asNumber(), 0.0);
    }

    @Test
    void string_concatenation_uses_display_forms() {
        Map<String, Value> env = run("var s = \"n=\" + 5; var t = 'a' + 'b'; var u = \"x\" + 'y'; var v = [1] + [2, 3];");
        assertEquals("n=5", env.get("s").asString());
        assertEquals("ab", env.get("t").asString());
        assertEquals("xy", env.get("u").asString());
        assertEquals(List.of(Value.number(1), Value.number(2), Value.number(3)), env.get("v").asList());
    }

    @Test
    void comparisons_and_structural_equality() {
        String src = String.join("\n",
                "var a = 1 < 2;",
                "var b = \"abc\" < \"abd\";",
                "var c = 'a' >= 'b';",
                "var d = [1, [2]] == [1, [2]];",
                "var e = 1 == \"1\";",
                "var f = null == null;",
                "var g = [1: \"x\"] != [1: \"x\"];",
                ""
        );
        Map<String, Value> env = run(src);
        assertTrue(env.get("a").asBool());
        assertTrue(env.get("b").asBool());
        assertFalse(env.get("c").asBool());
        assertTrue(env.get("d").asBool());
        assertFalse(env.get("e").asBool());
        assertTrue(env.get("f").asBool());
        assertFalse(env.get("g").asBool());
    }

    @Test
    void logical_operators_short_circuit() {
        String src = String.join("\n",
                "var called = false;",
                "var f = || { called = true; return true; };",
                "var r = false and f();",
                "var s = true or f();",
                "var x = true xor true;",
                "var y = false or f();",
                ""
        );
        Map<String, Value> env = run(src);
        assertFalse(env.get("r").asBool());
        assertTrue(env.get("s").asBool());
        assertFalse(env.get("x").asBool());
        assertTrue(env.get("y").asBool());
        assertTrue(env.get("called").asBool());
    }

    @Test
    void blocks_shadow_and_assignment_reaches_outer_scope() {
        Map<String, Value> env = run("var x = 1; var y = 1; { var x = 2; y = x + 1; } var z = 0; var z = \"re\";");
        assertEquals(1.0, env.get("x").asNumber(), 0.0);
        assertEquals(3.0, env.get("y").asNumber(), 0.0);
        assertEquals("re", env.get("z").asString());
    }

    @Test
    void closures_capture_their_scope() {
        String src = String.join("\n",
                "var make = || {",
                "    var n = 0;",
                "    return || { n += 1; return n; };",
                "};",
                "var c = make();",
                "c();",
                "c();",
                "var v = c();",
                ""
        );
        assertEquals(3.0, run(src).get("v").asNumber(), 0.0);
    }

    @Test
    void recursion() {
        String src = String.join("\n",
                "var fib = |n| {",
                "    if n < 2 { return n; }",
                "    return fib(n - 1) + fib(n - 2);",
                "};",
                "var r = fib(10);",
                ""
        );
        assertEquals(55.0, run(src).get("r").asNumber(), 0.0);
    }

    @Test
    void while_with_break_and_continue() {
        String src = String.join("\n",
                "var i = 0;",
                "var sum = 0;",
                "while true {",
                "    i += 1;",
                "    if i > 10 { break; }",
                "    if i % 2 == 0 { continue; }",
                "    sum += i;",
                "}",
                ""
        );
        assertEquals(25.0, run(src).get("sum").asNumber(), 0.0);
    }

    @Test
    void for_over_range_prints_each_number() {
        assertEquals("1\n2\n3\n", output("for i in 1..4 { print i; }"));
        assertEquals("", output("for i in 4..1 { print i; }"));
    }

    @Test
    void for_over_list_sees_live_length() {
        String src = String.join("\n",
                "var xs = [1, 2, 3];",
                "var seen = 0;",
                "for x in xs {",
                "    seen += 1;",
                "    if x == 1 { push(xs, 4); }",
                "}",
                ""
        );
        assertEquals(4.0, run(src).get("seen").asNumber(), 0.0);
    }

    @Test
    void maps_upsert_and_missing_keys_read_null() {
        String src = String.join("\n",
                "var m = [\"a\": 1];",
                "m[\"b\"] = 2;",
                "m[\"a\"] += 10;",
                "var missing = m[\"zzz\"];",
                "var n = len(m);",
                "print m;",
                ""
        );
        ForgeScript es = new ForgeScript();
        RecordingIO io = new RecordingIO();
        es.setIO(io);
        Map<String, Value> env = es.run(src);

        assertTrue(env.get("missing").isNull());
        assertEquals(2.0, env.get("n").asNumber(), 0.0);
        assertEquals("[\"a\": 11, \"b\": 2]\n", io.output());
    }

    @Test
    void list_repeat_makes_independent_copies() {
        Map<String, Value> env = run("var grid = [[0; 2]; 2]; grid[0][0] = 5; var other = grid[1][0]; var mine = grid[0][0];");
        assertEquals(0.0, env.get("other").asNumber(), 0.0);
        assertEquals(5.0, env.get("mine").asNumber(), 0.0);
    }

    @Test
    void casts() {
        String src = String.join("\n",
                "var a = \"42\" as num;",
                "var b = 65 as char;",
                "var c = 'A' as num;",
                "var d = \"true\" as bool;",
                "var e = 3 as str;",
                "var f = \"ab\" as list;",
                "var g = (1..4) as list;",
                "var h = [\"k\": 1] as list;",
                ""
        );
        Map<String, Value> env = run(src);
        assertEquals(42.0, env.get("a").asNumber(), 0.0);
        assertEquals('A', env.get("b").asChar());
        assertEquals(65.0, env.get("c").asNumber(), 0.0);
        assertTrue(env.get("d").asBool());
        assertEquals("3", env.get("e").asString());
        assertEquals(List.of(Value.character('a'), Value.character('b')), env.get("f").asList());
        assertEquals(3, env.get("g").asList().size());
        assertEquals("[[\"k\", 1]]", env.get("h").toString());
    }

    @Test
    void print_uses_display_forms() {
        String src = "print 3; print 2.5; print [1, \"a\", 'c', null]; print [:]; print \"plain\"; print 1..3;";
        assertEquals("3\n2.5\n[1, \"a\", 'c', null]\n[:]\nplain\n1..3\n", output(src));
    }

    @Test
    void top_level_return_ends_the_unit() {
        Map<String, Value> env = run("var a = 1; return; var b = 2;");
        assertTrue(env.containsKey("a"));
        assertFalse(env.containsKey("b"));
    }

    @Test
    void input_reads_lines_without_coercion() {
        String src = String.join("\n",
                "var name = \"\";",
                "input name, \"Name? \";",
                "print \"Hi \" + name;",
                "var n = input \"> \";",
                "print typeof(n);",
                "var gone = input null;",
                "print gone;",
                ""
        );
        assertEquals("Name? Hi Ada\n> str\nnull\n", output(src, "Ada", "7"));
    }

    @Test
    void huge_range_length_saturates() {
        Map<String, Value> env = run("var n = len(-9000000000000000000..9000000000000000000); var e = len(5..2);");
        assertEquals((double) Long.MAX_VALUE, env.get("n").asNumber(), 0.0);
        assertEquals(0.0, env.get("e").asNumber(), 0.0);
    }

    @Test
    void prelude_functions() {
        String src = String.join("\n",
                "var a = len(\"héllo\");",
                "var b = typeof(1);",
                "var c = typeof([:]);",
                "var xs = [1, 2];",
                "var last = pop(xs);",
                "var m = [\"k\": 1, \"j\": 2];",
                "var removed = remove(m, \"k\");",
                "var size = len(m);",
                "var r = len(2..7);",
                ""
        );
        Map<String, Value> env = run(src);
        assertEquals(5.0, env.get("a").asNumber(), 0.0);
        assertEquals("num", env.get("b").asString());
        assertEquals("map", env.get("c").asString());
        assertEquals(2.0, env.get("last").asNumber(), 0.0);
        assertEquals(1, env.get("xs").asList().size());
        assertEquals(1.0, env.get("removed").asNumber(), 0.0);
        assertEquals(1.0, env.get("size").asNumber(), 0.0);
        assertEquals(5.0, env.get("r").asNumber(), 0.0);
    }

    @Test
    void host_functions_do_not_leak_into_results() {
        Map<String, Value> env = run("var only = 1;");
        assertEquals(1, env.size());
        assertTrue(env.containsKey("only"));
    }

    @Test
    void repl_state_persists_between_units() {
        ForgeScript es = new ForgeScript();
        RecordingIO io = new RecordingIO();
        es.setIO(io);
        ExecutionState state = es.newState();

        assertNull(es.eval("var x = 41;", state));
        assertEquals(42.0, es.eval("x + 1", state).asNumber(), 0.0);
        assertNull(es.eval("print x;", state));
        assertEquals("41\n", io.output());
        assertEquals(41.0, state.globals().get("x").asNumber(), 0.0);
    }
}
