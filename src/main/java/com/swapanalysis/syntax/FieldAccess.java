package com.swapanalysis.syntax;

public record FieldAccess(Expression base, String field, Span span) implements Expression {
}
