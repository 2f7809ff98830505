package com.alang.ast;

/**
 * Source range covered by a node or token.
 *
 * <p>{@code start} and {@code end} are 0-based character offsets (end exclusive);
 * lines and columns are 1-based.</p>
 */
public record Span(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) {
    /** Span of nodes that were not built from source text. */
    public static final Span NONE = new Span(0, 0, 0, 0, 0, 0);

    /**
     * Smallest span covering both {@code first} and {@code last}.
     */
    public static Span covering(Span first, Span last) {
        return new Span(first.start, last.end, first.startLine, first.startCol, last.endLine, last.endCol);
    }

    /**
     * Zero-width span at the beginning of {@code span}.
     */
    public static Span emptyAt(Span span) {
        return new Span(span.start, span.start, span.startLine, span.startCol, span.startLine, span.startCol);
    }

    /**
     * Zero-width span at the end of {@code span}.
     */
    public static Span emptyAfter(Span span) {
        return new Span(span.end, span.end, span.endLine, span.endCol, span.endLine, span.endCol);
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Renders the span as {@code [line,col]-[line,col]}.
     */
    public String display() {
        return "[" + startLine + "," + startCol + "]-[" + endLine + "," + endCol + "]";
    }
}
