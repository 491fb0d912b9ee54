package com.swapanalysis.syntax;

import java.util.Optional;

public record LocalDeclaration(Pattern pattern, Expression initializer, Span span) implements Statement {

    public Optional<Expression> init() {
        return Optional.ofNullable(initializer);
    }
}
