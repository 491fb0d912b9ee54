package com.swapanalysis.syntax;

import java.util.Optional;

/**
 * Binds exactly one identifier, optionally guarded by a sub-pattern ({@code name @ sub}).
 */
public record BindingPattern(Identifier identifier, Pattern subpattern, Span span) implements Pattern {

    public static BindingPattern of(Identifier identifier) {
        return new BindingPattern(identifier, null, identifier.span());
    }

    public Optional<Pattern> sub() {
        return Optional.ofNullable(subpattern);
    }
}
