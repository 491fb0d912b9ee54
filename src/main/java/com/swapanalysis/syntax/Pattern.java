package com.swapanalysis.syntax;

/**
 * Left-hand side of a local declaration.
 */
public interface Pattern {

    Span span();
}
