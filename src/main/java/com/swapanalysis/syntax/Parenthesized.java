package com.swapanalysis.syntax;

public record Parenthesized(Expression inner, Span span) implements Expression {
}
