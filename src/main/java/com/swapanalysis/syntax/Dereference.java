package com.swapanalysis.syntax;

/**
 * Access through a pointer-like value. {@code implicit} dereferences are inserted by the front end
 * (for instance when a field is read through an object reference) and have no text of their own,
 * so they reuse the span of their target.
 */
public record Dereference(Expression target, boolean implicit, Span span) implements Expression {

    public static Dereference implicitOf(Expression target) {
        return new Dereference(target, true, target.span());
    }
}
