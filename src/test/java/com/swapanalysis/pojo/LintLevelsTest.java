package com.swapanalysis.pojo;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LintLevelsTest {

    @Test
    public void testCategoryDefaults() {
        LintLevels levels = LintLevels.defaults();
        assertEquals(LintLevel.WARN, levels.levelOf(LintKind.MANUAL_SWAP));
        assertEquals(LintLevel.DENY, levels.levelOf(LintKind.ALMOST_SWAPPED));
        assertTrue(levels.isEnabled(LintKind.MANUAL_SWAP));
    }

    @Test
    public void testOverrides() {
        LintLevels levels = LintLevels.of(Map.of(LintKind.ALMOST_SWAPPED, LintLevel.ALLOW));
        assertFalse(levels.isEnabled(LintKind.ALMOST_SWAPPED));
        assertEquals(LintLevel.WARN, levels.levelOf(LintKind.MANUAL_SWAP));
        assertEquals(2, levels.asMap().size());
    }

    @Test
    public void testLintNames() {
        assertEquals(LintKind.MANUAL_SWAP, LintKind.fromLintName("manual_swap"));
        assertEquals(LintKind.ALMOST_SWAPPED, LintKind.fromLintName(" Almost-Swapped "));
        assertThrows(IllegalArgumentException.class, () -> LintKind.fromLintName("needless_swap"));
    }
}
