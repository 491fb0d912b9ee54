package com.swapanalysis.config;

import com.swapanalysis.pojo.LintKind;
import com.swapanalysis.pojo.LintLevel;
import com.swapanalysis.pojo.LintLevels;
import com.swapanalysis.suggestion.SwapDialect;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Getter
@Setter
@ConfigurationProperties(prefix = "swap-analysis")
public class SwapAnalysisProperties {

    /** Worker threads for block scanning; 1 scans on the calling thread. */
    private int threads = 1;

    /** Where to write the JSON report; no report when empty. */
    private String reportPath = "";

    private Dialect dialect = new Dialect();

    /** Lint name to level; {@code manual_swap} may be written {@code manual-swap}. */
    private Map<String, LintLevel> lints = new LinkedHashMap<>();

    public void setDialect(Dialect dialect) {
        this.dialect = (dialect == null) ? new Dialect() : dialect;
    }

    public void setLints(Map<String, LintLevel> lints) {
        this.lints = new LinkedHashMap<>(Objects.requireNonNullElse(lints, Map.of()));
    }

    public LintLevels toLintLevels() {
        Map<LintKind, LintLevel> overrides = new EnumMap<>(LintKind.class);
        lints.forEach((name, level) -> overrides.put(LintKind.fromLintName(name), level));
        return LintLevels.of(overrides);
    }

    @Getter
    @Setter
    public static final class Dialect {
        private String swapFunction = SwapDialect.JAVA.swapFunction();
        private String mutableReferencePrefix = SwapDialect.JAVA.mutableReferencePrefix();
        private String elementSwapMethod = SwapDialect.JAVA.elementSwapMethod();
        private boolean staticElementSwap = SwapDialect.JAVA.staticElementSwap();
        private String replaceFunction = SwapDialect.JAVA.replaceFunction();
        /** Only set for a dialect whose rewrites compile as they are. */
        private boolean autoApplicable = SwapDialect.JAVA.autoApplicable();

        public SwapDialect toSwapDialect() {
            return new SwapDialect(swapFunction, mutableReferencePrefix, elementSwapMethod, staticElementSwap,
                    replaceFunction, autoApplicable);
        }
    }
}
