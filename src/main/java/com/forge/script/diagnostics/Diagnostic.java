package com.forge.script.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.forge.script.error.ForgeException;
import com.forge.script.error.ParseError;
import com.forge.script.error.ParseFailure;
import com.forge.script.parser.Span;

/**
 * One report: the primary location, the context trail leading to it, the message, and any
 * secondary locations. A {@link ParseFailure} expands into one diagnostic per parse error.
 */
public final class Diagnostic {

    /** A secondary location, such as the declaration of a function called with the wrong arity. */
    public static final class Frame {
        public final String label;
        public final Span span;

        Frame(String label, Span span) {
            this.label = label;
            this.span = span;
        }
    }

    private final ForgeException.Phase phase;
    private final Span span;
    private final List<String> trail;
    private final String message;
    private final List<Frame> frames;

    private Diagnostic(ForgeException.Phase phase, Span span, List<String> trail, String message, List<Frame> frames) {
        this.phase = phase;
        this.span = span;
        this.trail = Collections.unmodifiableList(trail);
        this.message = message;
        this.frames = Collections.unmodifiableList(frames);
    }

    public static List<Diagnostic> from(ForgeException error) {
        List<Diagnostic> out = new ArrayList<>();
        if (error instanceof ParseFailure) {
            for (ParseError e : ((ParseFailure) error).errors()) out.add(single(e));
        } else {
            out.add(single(error));
        }
        return out;
    }

    private static Diagnostic single(ForgeException error) {
        List<Frame> frames = new ArrayList<>();
        for (ForgeException.Frame f : error.frames()) frames.add(new Frame(f.label, f.span));
        return new Diagnostic(error.phase(), error.span(), new ArrayList<>(error.trail()), error.getMessage(), frames);
    }

    public ForgeException.Phase phase() { return phase; }
    public Span span() { return span; }
    public int line() { return span.line; }
    public int column() { return span.column; }
    public List<String> trail() { return trail; }
    public String message() { return message; }
    public List<Frame> frames() { return frames; }
}
