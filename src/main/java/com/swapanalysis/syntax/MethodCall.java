package com.swapanalysis.syntax;

import java.util.List;

/**
 * Method invocation on a receiver; see {@link Call} for the meaning of {@code pure}.
 */
public record MethodCall(Expression receiver, String method, List<Expression> arguments, boolean pure, Span span)
        implements Expression {

    public MethodCall {
        arguments = List.copyOf(arguments);
    }
}
