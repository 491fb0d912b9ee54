package com.swapanalysis.syntax;

/**
 * Opaque hygiene token attached to every span by the front end.
 * Two spans share a context when the code was written (or generated) in the same place;
 * the engine only ever compares tokens for equality.
 */
public record SyntaxContext(String token) {

    public static final SyntaxContext ROOT = new SyntaxContext("root");
}
