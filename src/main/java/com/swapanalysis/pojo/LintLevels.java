package com.swapanalysis.pojo;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Effective level per lint; lints without an explicit level use their category's default.
 */
public final class LintLevels {

    private final Map<LintKind, LintLevel> levels;

    private LintLevels(Map<LintKind, LintLevel> levels) {
        this.levels = levels;
    }

    public static LintLevels defaults() {
        return of(Map.of());
    }

    public static LintLevels of(Map<LintKind, LintLevel> overrides) {
        Map<LintKind, LintLevel> levels = new EnumMap<>(LintKind.class);
        for (LintKind kind : LintKind.values()) {
            levels.put(kind, overrides.getOrDefault(kind, kind.category().defaultLevel()));
        }
        return new LintLevels(Collections.unmodifiableMap(levels));
    }

    public LintLevel levelOf(LintKind kind) {
        return levels.get(kind);
    }

    public boolean isEnabled(LintKind kind) {
        return levelOf(kind) != LintLevel.ALLOW;
    }

    public Map<LintKind, LintLevel> asMap() {
        return levels;
    }
}
