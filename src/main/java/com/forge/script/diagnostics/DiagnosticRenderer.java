package com.forge.script.diagnostics;

import java.util.List;

import com.forge.script.error.ForgeException;
import com.forge.script.parser.Span;

/**
 * Renders diagnostics as text:
 *
 * <pre>
 * [ERROR] Runtime error at 3:1...
 *    ...while calling 'f' at 5:1...
 *         3| f(1);
 *          | ^^^^
 *         1| var f = || { };
 *          |         ^^^^^^
 *    expected 0 argument(s), found 1
 * </pre>
 */
public final class DiagnosticRenderer {
    private static final int GUTTER = 9;
    private static final String INDENT = "   ";

    private DiagnosticRenderer() {}

    public static String render(ForgeException error, String source) {
        return render(Diagnostic.from(error), source);
    }

    /** Consecutive reports, in the order given. */
    public static String render(List<Diagnostic> diagnostics, String source) {
        String[] lines = splitLines(source);
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            renderOne(sb, d, lines);
        }
        return sb.toString();
    }

    private static void renderOne(StringBuilder sb, Diagnostic d, String[] lines) {
        sb.append("[ERROR] ").append(d.phase().title()).append(" error at ")
                .append(d.span().position()).append("...\n");
        for (String entry : d.trail()) {
            sb.append(INDENT).append("...while ").append(entry).append("...\n");
        }
        snippet(sb, d.span(), lines);
        // secondary frames (a callee's declaration) sit directly under the primary snippet
        for (Diagnostic.Frame f : d.frames()) {
            snippet(sb, f.span, lines);
        }
        sb.append(INDENT).append(d.message()).append('\n');
    }

    /** Source line with its number, then the caret row under the span (clipped to that line). */
    static void snippet(StringBuilder sb, Span span, String[] lines) {
        String text = (span.line >= 1 && span.line <= lines.length) ? lines[span.line - 1] : "";
        int[] cps = text.codePoints().toArray();

        String number = Integer.toString(span.line);
        for (int i = number.length(); i < GUTTER; i++) sb.append(' ');
        sb.append(number).append("| ").append(text).append('\n');

        for (int i = 0; i < GUTTER; i++) sb.append(' ');
        sb.append("| ");
        for (int i = 0; i < span.column - 1; i++) {
            // tabs are copied so the carets line up under any tab width
            sb.append(i < cps.length && cps[i] == '\t' ? '\t' : ' ');
        }
        int width;
        if (span.endLine == span.line) {
            width = span.endColumn - span.column;
        } else {
            width = cps.length - (span.column - 1);
        }
        if (width < 1) width = 1;
        for (int i = 0; i < width; i++) sb.append('^');
        sb.append('\n');
    }

    static String[] splitLines(String source) {
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].endsWith("\r")) lines[i] = lines[i].substring(0, lines[i].length() - 1);
        }
        return lines;
    }
}
