import com.forge.script.ForgeScript;
import com.forge.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ForgeCloneMirrorTest {

    private static Map<String, Value> run(String src) {
        ForgeScript es = new ForgeScript();
        es.setIO(new RecordingIO());
        return es.run(src);
    }

    @Test
    void clone_isolates_both_directions_and_mirror_aliases() {
        String src = String.join("\n",
                "var a = [1, [2, 3]];",
                "var b = clone a;",
                "var c = mirror a;",
                "b[1][0] = 99;",
                "c[0] = 7;",
                "a[1][1] = 42;",
                ""
        );
        Map<String, Value> env = run(src);
        assertEquals("[7, [2, 42]]", env.get("a").toString());
        assertEquals("[1, [99, 3]]", env.get("b").toString());
        assertSame(env.get("a").asList(), env.get("c").asList());
    }

    @Test
    void plain_binding_shares_storage() {
        Map<String, Value> env = run("var a = [\"k\": 1]; var d = a; d[\"k\"] = 2; var r = a[\"k\"];");
        assertEquals(2.0, env.get("r").asNumber(), 0.0);
    }

    @Test
    void clone_of_a_cycle_is_a_cycle() {
        Map<String, Value> env = run("var l = [1]; push(l, l); var k = clone l;");
        List<Value> l = env.get("l").asList();
        List<Value> k = env.get("k").asList();

        assertNotSame(l, k);
        assertSame(k, k.get(1).asList());
        assertEquals("[1, [...]]", env.get("k").toString());
    }

    @Test
    void clone_leaves_scalars_and_functions_alone() {
        Map<String, Value> env = run("var f = || { return 1; }; var g = clone f; var same = f == g; var s = clone \"x\";");
        assertTrue(env.get("same").asBool());
        assertEquals("x", env.get("s").asString());
    }

    @Test
    void map_keys_are_snapshotted_on_insert() {
        String src = String.join("\n",
                "var key = [1];",
                "var m = [:];",
                "m[key] = \"v\";",
                "key[0] = 2;",
                "var r = m[[1]];",
                "var gone = m[[2]];",
                ""
        );
        Map<String, Value> env = run(src);
        assertEquals("v", env.get("r").asString());
        assertTrue(env.get("gone").isNull());
    }

    @Test
    void cyclic_lists_compare_and_hash_structurally() {
        String src = String.join("\n",
                "var a = [1];",
                "push(a, a);",
                "var b = clone a;",
                "var same = a == b;",
                "var c = [2];",
                "push(c, c);",
                "var differ = a == c;",
                "var m = [:];",
                "m[a] = \"found\";",
                "var hit = m[b];",
                ""
        );
        Map<String, Value> env = run(src);
        assertTrue(env.get("same").asBool());
        assertFalse(env.get("differ").asBool());
        assertEquals("found", env.get("hit").asString());
        assertEquals(env.get("a").hashCode(), env.get("b").hashCode());
    }
}
