package com.swapanalysis.pojo;

public enum LintCategory {
    COMPLEXITY(LintLevel.WARN),
    CORRECTNESS(LintLevel.DENY);

    private final LintLevel defaultLevel;

    LintCategory(LintLevel defaultLevel) {
        this.defaultLevel = defaultLevel;
    }

    public LintLevel defaultLevel() {
        return defaultLevel;
    }
}
