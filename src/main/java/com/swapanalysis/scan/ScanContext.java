package com.swapanalysis.scan;

import com.swapanalysis.semantics.AliasingAnalyzer;
import com.swapanalysis.semantics.ExpressionEquivalence;
import com.swapanalysis.semantics.TypeOracle;
import com.swapanalysis.suggestion.SourceText;
import com.swapanalysis.syntax.Block;

/**
 * Everything a pattern or the suggestion builder may consult while one block is scanned.
 *
 * @param constantContext true when the block is compile-time evaluated, or when that could not be determined
 */
public record ScanContext(
        Block block,
        boolean constantContext,
        TypeOracle typeOracle,
        SourceText sourceText,
        ExpressionEquivalence equivalence,
        AliasingAnalyzer aliasing
) {
}
