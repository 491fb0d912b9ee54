package com.swapanalysis.pojo;

/**
 * The lints this analysis reports. Names are stable and used in configuration and reports.
 */
public enum LintKind {
    MANUAL_SWAP("manual_swap", LintCategory.COMPLEXITY),
    ALMOST_SWAPPED("almost_swapped", LintCategory.CORRECTNESS);

    private final String lintName;
    private final LintCategory category;

    LintKind(String lintName, LintCategory category) {
        this.lintName = lintName;
        this.category = category;
    }

    public String lintName() {
        return lintName;
    }

    public LintCategory category() {
        return category;
    }

    public static LintKind fromLintName(String name) {
        String normalized = name.trim().toLowerCase().replace('-', '_');
        for (LintKind kind : values()) {
            if (kind.lintName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown lint: " + name);
    }
}
