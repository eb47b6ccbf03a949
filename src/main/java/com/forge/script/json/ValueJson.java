package com.forge.script.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.forge.script.parser.Value;

/**
 * Converts between script values and Jackson trees.
 *
 * JSON objects become maps with string keys; maps whose keys are not all strings are
 * written with each key's display text. Chars go out as one-character strings and ranges
 * as {"lo":..,"hi":..}. Functions and custom values have no JSON form.
 */
public final class ValueJson {
    private static final ObjectMapper om = new ObjectMapper();

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case NULL: return om.getNodeFactory().nullNode();
            case BOOL: return om.getNodeFactory().booleanNode(v.asBool());
            case STRING: return om.getNodeFactory().textNode(v.asString());
            case CHAR: return om.getNodeFactory().textNode(v.display());
            case NUMBER: {
                double d = v.asNumber();
                if (v.isIntegral()) return om.getNodeFactory().numberNode((long) d);
                return om.getNodeFactory().numberNode(d);
            }
            case RANGE: {
                ObjectNode o = om.createObjectNode();
                o.put("lo", v.asRange().lo);
                o.put("hi", v.asRange().hi);
                return o;
            }
            case LIST: {
                ArrayNode a = om.createArrayNode();
                for (Value item : v.asList()) a.add(toJson(item));
                return a;
            }
            case MAP: {
                ObjectNode o = om.createObjectNode();
                for (Map.Entry<Value, Value> e : v.asMap().entrySet()) {
                    o.set(e.getKey().display(), toJson(e.getValue()));
                }
                return o;
            }
            default:
                throw new IllegalArgumentException("value of type '" + v.typeName() + "' cannot be converted to JSON");
        }
    }

    public static Value fromJson(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.nil();
        if (n.isBoolean()) return Value.bool(n.booleanValue());
        if (n.isNumber()) return Value.number(n.doubleValue());
        if (n.isTextual()) return Value.string(n.textValue());
        if (n.isArray()) {
            List<Value> items = new ArrayList<>(n.size());
            for (JsonNode item : n) items.add(fromJson(item));
            return Value.list(items);
        }
        if (n.isObject()) {
            Map<Value, Value> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = n.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                entries.put(Value.string(e.getKey()), fromJson(e.getValue()));
            }
            return Value.map(entries);
        }
        throw new IllegalArgumentException("unsupported JSON node: " + n.getNodeType());
    }

    public static Value parse(String json) {
        try {
            return fromJson(om.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String stringify(Value v) {
        try {
            return om.writeValueAsString(toJson(v));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value", e);
        }
    }
}
