package com.swapanalysis.semantics;

import com.swapanalysis.syntax.Block;
import com.swapanalysis.syntax.Expression;

import java.util.Optional;

/**
 * Type and evaluation-context queries answered by the front end.
 * Either method may throw {@link CollaboratorUnavailableException}.
 */
public interface TypeOracle {

    /** Whether the block is evaluated at compile time, where a swap call could not be used. */
    boolean isConstantContext(Block block);

    /** Static type of the expression, with references peeled; empty when unresolved. */
    Optional<ContainerKind> staticTypeOf(Expression expression);

    /** Oracle for trees without type information: no constant contexts, no known types. */
    static TypeOracle untyped() {
        return new TypeOracle() {
            @Override
            public boolean isConstantContext(Block block) {
                return false;
            }

            @Override
            public Optional<ContainerKind> staticTypeOf(Expression expression) {
                return Optional.empty();
            }
        };
    }
}
