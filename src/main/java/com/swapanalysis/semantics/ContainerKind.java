package com.swapanalysis.semantics;

/**
 * Coarse classification of an expression's static type, as far as element swapping is concerned.
 */
public enum ContainerKind {
    ARRAY,
    SLICE,
    GROWABLE_SEQUENCE,
    DOUBLE_ENDED_SEQUENCE,
    OTHER;

    /** Contiguous, indexable and able to swap two of its elements in place. */
    public boolean supportsElementSwap() {
        return this != OTHER;
    }
}
