package com.swapanalysis.syntax;

/**
 * Any expression shape the model does not describe (lambdas, conditionals, object creation, ...).
 * Never equivalent to anything, not even itself.
 */
public record OpaqueExpression(String kind, Span span) implements Expression {
}
