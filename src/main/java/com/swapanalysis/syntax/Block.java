package com.swapanalysis.syntax;

import java.util.List;

/**
 * A statement sequence. {@code origin} names the enclosing declaration, for reporting only.
 */
public record Block(List<Statement> statements, Span span, String origin) {

    public Block {
        statements = List.copyOf(statements);
    }

    public int size() {
        return statements.size();
    }
}
