package com.swapanalysis.syntax;

public record Cast(String type, Expression operand, Span span) implements Expression {
}
