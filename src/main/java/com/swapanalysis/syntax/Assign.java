package com.swapanalysis.syntax;

/**
 * Plain assignment {@code target = value}.
 */
public record Assign(Expression target, Expression value, Span span) implements Expression {
}
