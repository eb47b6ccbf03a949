import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.script.ForgeScript;
import com.forge.script.json.ValueJson;
import com.forge.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueJsonTest {
    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void json_objects_become_maps_with_string_keys() {
        Value v = ValueJson.parse("{\"a\": [1, 2.5, {\"b\": null}], \"c\": true}");
        assertEquals(Value.Type.MAP, v.getType());

        Value a = v.asMap().get(Value.string("a"));
        assertEquals(3, a.asList().size());
        assertEquals(2.5, a.asList().get(1).asNumber(), 0.0);
        assertTrue(a.asList().get(2).asMap().get(Value.string("b")).isNull());
        assertTrue(v.asMap().get(Value.string("c")).asBool());
    }

    @Test
    void script_values_serialize() {
        ForgeScript es = new ForgeScript();
        es.setIO(new RecordingIO());
        Map<String, Value> env = es.run("var v = [\"n\": 3, \"xs\": [1, 'c', \"s\"], \"r\": 1..4, \"z\": null];");
        assertEquals("{\"n\":3,\"xs\":[1,\"c\",\"s\"],\"r\":{\"lo\":1,\"hi\":4},\"z\":null}",
                ValueJson.stringify(env.get("v")));
    }

    @Test
    void functions_have_no_json_form() {
        ForgeScript es = new ForgeScript();
        es.setIO(new RecordingIO());
        Value f = es.run("var f = || { };").get("f");
        assertThrows(IllegalArgumentException.class, () -> ValueJson.toJson(f));
    }

    @Test
    void define_json_binds_a_global() throws Exception {
        ForgeScript es = new ForgeScript();
        es.setIO(new RecordingIO());
        JsonNode cfg = om.readTree("{\"n\": 3, \"names\": [\"a\", \"b\"]}");
        es.defineJson("cfg", cfg);
        Map<String, Value> env = es.run("var r = cfg[\"n\"] * 2; var k = len(cfg[\"names\"]);");
        assertEquals(6.0, env.get("r").asNumber(), 0.0);
        assertEquals(2.0, env.get("k").asNumber(), 0.0);
    }

    @Test
    void invalid_json_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ValueJson.parse("{nope"));
    }
}
