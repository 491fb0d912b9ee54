package com.swapanalysis.syntax;

/**
 * An expression node handed over by the front end. The set of implementations in this package
 * is closed; detectors treat anything they do not recognise as a non-match.
 */
public interface Expression {

    Span span();
}
