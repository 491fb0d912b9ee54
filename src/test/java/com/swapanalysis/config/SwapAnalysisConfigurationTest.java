package com.swapanalysis.config;

import com.swapanalysis.pojo.LintKind;
import com.swapanalysis.pojo.LintLevel;
import com.swapanalysis.pojo.LintLevels;
import com.swapanalysis.scan.ProgramScanner;
import com.swapanalysis.suggestion.SuggestionBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "swap-analysis.dialect.swap-function=Swaps.swap",
        "swap-analysis.dialect.auto-applicable=true",
        "swap-analysis.lints.manual-swap=deny"
})
public class SwapAnalysisConfigurationTest {

    @Autowired
    private SuggestionBuilder suggestionBuilder;

    @Autowired
    private LintLevels lintLevels;

    @Autowired
    private ProgramScanner programScanner;

    @Test
    public void testPropertiesReachTheAnalysis() {
        assertNotNull(programScanner);
        assertEquals("Swaps.swap", suggestionBuilder.getDialect().swapFunction());
        assertEquals("", suggestionBuilder.getDialect().mutableReferencePrefix());
        assertEquals("org.apache.commons.lang3.ArrayUtils.swap", suggestionBuilder.getDialect().elementSwapMethod());
        assertTrue(suggestionBuilder.getDialect().autoApplicable());
        assertEquals(LintLevel.DENY, lintLevels.levelOf(LintKind.MANUAL_SWAP));
        assertEquals(LintLevel.DENY, lintLevels.levelOf(LintKind.ALMOST_SWAPPED));
    }
}
