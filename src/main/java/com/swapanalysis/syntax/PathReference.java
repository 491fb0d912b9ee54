package com.swapanalysis.syntax;

import java.util.List;

/**
 * A reference to named storage: a local variable, a parameter, {@code this}, or a qualified
 * static path such as {@code Config.LIMIT}.
 */
public record PathReference(List<String> segments, Span span) implements Expression {

    public PathReference {
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one segment");
        }
    }

    public static PathReference local(String name, Span span) {
        return new PathReference(List.of(name), span);
    }

    /** True for an unqualified, single-segment path. */
    public boolean isSingleSegment() {
        return segments.size() == 1;
    }

    public String lastSegment() {
        return segments.get(segments.size() - 1);
    }

    public String text() {
        return String.join(".", segments);
    }
}
