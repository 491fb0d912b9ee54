package com.swapanalysis.syntax;

import java.util.List;

/**
 * Free-function call. {@code pure} is only set by a front end that knows the callee has no side effects.
 */
public record Call(Expression callee, List<Expression> arguments, boolean pure, Span span) implements Expression {

    public Call {
        arguments = List.copyOf(arguments);
    }
}
