package com.swapanalysis.syntax;

/**
 * A statement of a block. Closed set: {@link ExpressionStatement}, {@link LocalDeclaration},
 * {@link CompoundAssignment} and {@link OtherStatement}.
 */
public interface Statement {

    Span span();
}
