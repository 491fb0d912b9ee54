package com.swapanalysis.classifier;

import com.swapanalysis.pojo.LintKind;

public enum IdiomKind {
    TEMP_VARIABLE_SWAP(LintKind.MANUAL_SWAP),
    ALMOST_SWAPPED(LintKind.ALMOST_SWAPPED),
    XOR_SWAP(LintKind.MANUAL_SWAP);

    private final LintKind lint;

    IdiomKind(LintKind lint) {
        this.lint = lint;
    }

    public LintKind lint() {
        return lint;
    }
}
