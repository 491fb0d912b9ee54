package com.swapanalysis.syntax;

/**
 * Destructuring, wildcard or multi-binding pattern; never takes part in idiom matching.
 */
public record OtherPattern(String kind, Span span) implements Pattern {
}
