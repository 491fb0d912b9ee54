package com.swapanalysis.parser;

import com.swapanalysis.semantics.ContainerKind;
import com.swapanalysis.semantics.TypeOracle;
import com.swapanalysis.syntax.Block;
import com.swapanalysis.syntax.Expression;
import spoon.reflect.code.CtExpression;
import spoon.reflect.reference.CtArrayTypeReference;
import spoon.reflect.reference.CtTypeReference;

import java.util.Map;
import java.util.Optional;

/**
 * Answers type queries from the types Spoon attached to the original expressions.
 * Java has no compile-time evaluated blocks, so no block is a constant context. Only arrays
 * have an element swap the Java dialect can call; every other type is {@link ContainerKind#OTHER}.
 */
public class SpoonTypeOracle implements TypeOracle {

    private final Map<Expression, CtExpression<?>> typedNodes;

    public SpoonTypeOracle(Map<Expression, CtExpression<?>> typedNodes) {
        this.typedNodes = typedNodes;
    }

    @Override
    public boolean isConstantContext(Block block) {
        return false;
    }

    @Override
    public Optional<ContainerKind> staticTypeOf(Expression expression) {
        CtExpression<?> node = typedNodes.get(expression);
        if (node == null) {
            return Optional.empty();
        }
        CtTypeReference<?> type = node.getType();
        if (type == null) {
            return Optional.empty();
        }
        return Optional.of(classify(type));
    }

    static ContainerKind classify(CtTypeReference<?> type) {
        if (type instanceof CtArrayTypeReference<?>) {
            return ContainerKind.ARRAY;
        }
        return ContainerKind.OTHER;
    }
}
