package com.swapanalysis.syntax;

public record Binary(BinaryOperator operator, Expression left, Expression right, Span span) implements Expression {
}
