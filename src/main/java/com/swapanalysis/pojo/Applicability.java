package com.swapanalysis.pojo;

/**
 * How far a suggested rewrite can be trusted. Downstream tooling only applies
 * {@link #AUTO_APPLICABLE} edits without asking.
 */
public enum Applicability {
    AUTO_APPLICABLE,
    REVIEW_REQUIRED;

    /** The weaker of the two grades. */
    public Applicability and(Applicability other) {
        return this == REVIEW_REQUIRED || other == REVIEW_REQUIRED ? REVIEW_REQUIRED : AUTO_APPLICABLE;
    }
}
