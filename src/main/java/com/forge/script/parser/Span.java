package com.forge.script.parser;

/**
 * A region of source text.
 *
 * Lines and columns are 1-based; offsets are 0-based and end-exclusive. All of them
 * count unicode code points, not UTF-16 chars, so they agree with string indexing.
 */
public final class Span {
    public final int line;
    public final int column;
    public final int endLine;
    public final int endColumn;
    public final int start;
    public final int end;

    public Span(int line, int column, int endLine, int endColumn, int start, int end) {
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.start = start;
        this.end = end;
    }

    /** Zero-width span at a single position. */
    public static Span point(int line, int column, int offset) {
        return new Span(line, column, line, column, offset, offset);
    }

    public Span union(Span other) {
        if (other == null) return this;
        Span first = (other.start < start) ? other : this;
        Span last = (other.end > end) ? other : this;
        return new Span(first.line, first.column, last.endLine, last.endColumn, first.start, last.end);
    }

    public int length() {
        return end - start;
    }

    /** "line:column" of the start position. */
    public String position() {
        return line + ":" + column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span s = (Span) o;
        return start == s.start && end == s.end && line == s.line && column == s.column;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return position() + "-" + endLine + ":" + endColumn;
    }
}
