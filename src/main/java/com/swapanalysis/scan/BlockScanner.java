package com.swapanalysis.scan;

import com.swapanalysis.classifier.IdiomClassifier;
import com.swapanalysis.classifier.IdiomKind;
import com.swapanalysis.pojo.Finding;
import com.swapanalysis.pojo.LintLevels;
import com.swapanalysis.semantics.AliasingAnalyzer;
import com.swapanalysis.semantics.CollaboratorUnavailableException;
import com.swapanalysis.semantics.ExpressionEquivalence;
import com.swapanalysis.semantics.TypeOracle;
import com.swapanalysis.suggestion.SourceText;
import com.swapanalysis.suggestion.SuggestionBuilder;
import com.swapanalysis.syntax.Block;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Slides every registered idiom pattern over one block. Holds no per-block state, so one instance
 * can scan many blocks concurrently.
 */
@Component
public class BlockScanner {

    private static final Logger log = LoggerFactory.getLogger(BlockScanner.class);

    private final IdiomClassifier classifier;
    private final SuggestionBuilder suggestionBuilder;
    private final ExpressionEquivalence equivalence;
    private final AliasingAnalyzer aliasing;
    private final LintLevels lintLevels;

    public BlockScanner(IdiomClassifier classifier,
                        SuggestionBuilder suggestionBuilder,
                        ExpressionEquivalence equivalence,
                        AliasingAnalyzer aliasing,
                        LintLevels lintLevels) {
        this.classifier = classifier;
        this.suggestionBuilder = suggestionBuilder;
        this.equivalence = equivalence;
        this.aliasing = aliasing;
        this.lintLevels = lintLevels;
    }

    public List<Finding> scan(Block block, TypeOracle typeOracle, SourceText sourceText) {
        List<Finding> findings = new ArrayList<>();
        scan(block, typeOracle, sourceText, findings::add);
        return findings;
    }

    public void scan(Block block, TypeOracle typeOracle, SourceText sourceText, FindingSink sink) {
        ScanContext context = new ScanContext(
                block, isConstantContext(block, typeOracle), typeOracle, sourceText, equivalence, aliasing);

        for (Map.Entry<IdiomKind, IdiomClassifier.IdiomPattern> entry : classifier.getRegisteredPatterns().entrySet()) {
            if (!lintLevels.isEnabled(entry.getKey().lint())) {
                continue;
            }
            IdiomClassifier.IdiomPattern pattern = entry.getValue();
            for (Window window : Windows.of(block.statements(), pattern.windowSize())) {
                pattern.match(window, context)
                        .flatMap(match -> suggestionBuilder.build(match, context))
                        .ifPresent(sink::accept);
            }
        }
    }

    private boolean isConstantContext(Block block, TypeOracle typeOracle) {
        try {
            return typeOracle.isConstantContext(block);
        } catch (CollaboratorUnavailableException e) {
            // unknown: the temp-variable idiom is skipped for this block
            log.debug("Constant context of {} unknown: {}", block.origin(), e.getMessage());
            return true;
        }
    }
}
