package com.swapanalysis.suggestion;

/**
 * Names of the host-language primitives used in rendered suggestions.
 *
 * @param swapFunction           exchanges the values behind two references, called as {@code f(p a, p b)}
 * @param mutableReferencePrefix turns a place into a reference, {@code p} above; may be empty
 * @param elementSwapMethod      in-place element exchange on a sequence
 * @param staticElementSwap      render the element swap as {@code m(seq, i, j)} instead of {@code seq.m(i, j)}
 * @param replaceFunction        non-in-place alternative mentioned in the advisory note; no note when blank
 * @param autoApplicable         whether rendered rewrites are valid host code; when false every
 *                               finding is graded for review
 */
public record SwapDialect(
        String swapFunction,
        String mutableReferencePrefix,
        String elementSwapMethod,
        boolean staticElementSwap,
        String replaceFunction,
        boolean autoApplicable
) {

    /** Reference-swap primitives with borrow syntax, as in {@code std::mem::swap(&mut a, &mut b)}. */
    public static final SwapDialect DEFAULT =
            new SwapDialect("std::mem::swap", "&mut ", "swap", false, "std::mem::replace", true);

    /**
     * Java has no way to swap two variables through a call, so reference swaps only name the intent.
     * Array elements are swapped with commons-lang's {@code ArrayUtils.swap}, which the analysed
     * project may not depend on.
     */
    public static final SwapDialect JAVA =
            new SwapDialect("swap", "", "org.apache.commons.lang3.ArrayUtils.swap", true, "", false);

    public boolean hasReplaceFunction() {
        return replaceFunction != null && !replaceFunction.isBlank();
    }
}
