package com.forge.script.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.forge.script.parser.Span;

/**
 * Base of every error the Forge pipeline reports to a host.
 *
 * Carries the primary span, a context trail (innermost entry first) and any secondary
 * frames, which is everything the diagnostics renderer needs besides the source text.
 */
public abstract class ForgeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Phase {
        PARSING("Parsing"),
        RUNTIME("Runtime");

        private final String title;

        Phase(String title) {
            this.title = title;
        }

        public String title() {
            return title;
        }
    }

    /** A secondary source location shown below the primary snippet. */
    public static final class Frame {
        public final String label;
        public final Span span;

        public Frame(String label, Span span) {
            this.label = label;
            this.span = span;
        }
    }

    private final Span span;
    private final List<String> trail = new ArrayList<>();
    private final List<Frame> frames = new ArrayList<>();

    protected ForgeException(String message, Span span) {
        super(message);
        this.span = span;
    }

    protected ForgeException(String message, Span span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public abstract Phase phase();

    public Span span() {
        return span;
    }

    /** Context entries such as "parsing print statement", innermost first. */
    public List<String> trail() {
        return Collections.unmodifiableList(trail);
    }

    public List<Frame> frames() {
        return Collections.unmodifiableList(frames);
    }

    /** Appends an outer context entry; entries added later render further down. */
    public void addTrail(String entry) {
        trail.add(entry);
    }

    protected void addTrail(List<String> entries) {
        trail.addAll(entries);
    }

    protected void addFrame(Frame frame) {
        frames.add(frame);
    }
}
