package com.swapanalysis.suggestion;

import com.swapanalysis.syntax.Span;

import java.util.Optional;

/**
 * Gives access to the source text behind spans.
 */
public interface SourceText {

    Optional<String> snippet(Span span);

    /** No text at all; every operand falls back to pretty printing. */
    static SourceText none() {
        return span -> Optional.empty();
    }

    static SourceText of(String content) {
        return span -> {
            if (!span.isKnown() || span.end() > content.length()) {
                return Optional.empty();
            }
            return Optional.of(content.substring(span.start(), span.end()));
        };
    }
}
