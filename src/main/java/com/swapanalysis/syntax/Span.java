package com.swapanalysis.syntax;

import java.util.Objects;

/**
 * Half-open character range [start, end) in a source file, plus the syntax context it was written in.
 */
public record Span(int start, int end, SyntaxContext context) {

    /** Used for nodes the front end synthesized and that have no source text of their own. */
    public static final Span NONE = new Span(-1, -1, SyntaxContext.ROOT);

    public Span {
        Objects.requireNonNull(context, "context");
        if (start > end) {
            throw new IllegalArgumentException("Span start " + start + " is after end " + end);
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end, SyntaxContext.ROOT);
    }

    public boolean isKnown() {
        return start >= 0;
    }

    /**
     * Smallest span covering both this and {@code other}; keeps this span's context.
     */
    public Span to(Span other) {
        if (!isKnown()) return other;
        if (!other.isKnown()) return this;
        return new Span(Math.min(start, other.start), Math.max(end, other.end), context);
    }

    public boolean eqContext(Span other) {
        return context.equals(other.context);
    }
}
