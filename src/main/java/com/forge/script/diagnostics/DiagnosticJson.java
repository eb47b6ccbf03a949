package com.forge.script.diagnostics;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.forge.script.error.ForgeException;

/**
 * JSON form of the diagnostic model, for editors and other tools:
 * {@code {"phase":"Runtime","line":3,"column":1,"trail":[...],"message":"...","frames":[...]}}.
 */
public final class DiagnosticJson {
    private static final ObjectMapper om = new ObjectMapper();

    private DiagnosticJson() {}

    public static ObjectNode toJson(Diagnostic d, String source) {
        ObjectNode node = om.createObjectNode();
        node.put("phase", d.phase().title());
        node.put("line", d.line());
        node.put("column", d.column());
        node.put("endLine", d.span().endLine);
        node.put("endColumn", d.span().endColumn);
        ArrayNode trail = node.putArray("trail");
        for (String entry : d.trail()) trail.add(entry);
        node.put("message", d.message());
        ArrayNode frames = node.putArray("frames");
        for (Diagnostic.Frame f : d.frames()) {
            ObjectNode fn = frames.addObject();
            fn.put("label", f.label);
            fn.put("line", f.span.line);
            fn.put("column", f.span.column);
        }
        if (source != null) {
            node.put("text", DiagnosticRenderer.render(Collections.singletonList(d), source));
        }
        return node;
    }

    /** All reports for an error as a JSON array. */
    public static ArrayNode toJson(ForgeException error, String source) {
        ArrayNode out = om.createArrayNode();
        List<Diagnostic> all = Diagnostic.from(error);
        for (Diagnostic d : all) out.add(toJson(d, source));
        return out;
    }

    public static String toJsonString(ForgeException error, String source) {
        try {
            return om.writeValueAsString(toJson(error, source));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagnostic", e);
        }
    }
}
