package com.swapanalysis.syntax;

/**
 * A literal, compared by its source text.
 */
public record Literal(String text, Span span) implements Expression {
}
