package com.swapanalysis.syntax;

public record Unary(UnaryOperator operator, Expression operand, Span span) implements Expression {
}
