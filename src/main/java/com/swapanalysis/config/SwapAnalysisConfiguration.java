package com.swapanalysis.config;

import com.swapanalysis.pojo.LintLevels;
import com.swapanalysis.scan.BlockScanner;
import com.swapanalysis.scan.ProgramScanner;
import com.swapanalysis.semantics.AliasingAnalyzer;
import com.swapanalysis.semantics.ExpressionEquivalence;
import com.swapanalysis.suggestion.SuggestionBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the analysis core, which itself does not depend on Spring, from {@link SwapAnalysisProperties}.
 */
@Configuration
@EnableConfigurationProperties(SwapAnalysisProperties.class)
public class SwapAnalysisConfiguration {

    @Bean
    public ExpressionEquivalence expressionEquivalence() {
        return new ExpressionEquivalence();
    }

    @Bean
    public AliasingAnalyzer aliasingAnalyzer(ExpressionEquivalence equivalence) {
        return new AliasingAnalyzer(equivalence);
    }

    @Bean
    public SuggestionBuilder suggestionBuilder(SwapAnalysisProperties properties) {
        return new SuggestionBuilder(properties.getDialect().toSwapDialect());
    }

    @Bean
    public LintLevels lintLevels(SwapAnalysisProperties properties) {
        return properties.toLintLevels();
    }

    @Bean
    public ProgramScanner programScanner(BlockScanner blockScanner, SwapAnalysisProperties properties) {
        return new ProgramScanner(blockScanner, properties.getThreads());
    }
}
