package com.swapanalysis.syntax;

public record IndexAccess(Expression base, Expression index, Span span) implements Expression {
}
