package com.swapanalysis.syntax;

public record ExpressionStatement(Expression expression, Span span) implements Statement {
}
