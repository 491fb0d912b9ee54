package com.swapanalysis.syntax;

/**
 * {@code lhs op= rhs} as a statement of its own.
 */
public record CompoundAssignment(BinaryOperator operator, Expression lhs, Expression rhs, Span span)
        implements Statement {
}
