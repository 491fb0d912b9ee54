package com.swapanalysis.util;

import com.swapanalysis.pojo.Applicability;
import com.swapanalysis.pojo.Edit;
import com.swapanalysis.pojo.Finding;
import com.swapanalysis.pojo.LineMap;
import com.swapanalysis.pojo.LintLevel;

/**
 * Compiler-style text rendering of a finding.
 */
public final class FindingFormatter {

    private FindingFormatter() {
    }

    public static String format(String file, LineMap lineMap, Finding finding, LintLevel level) {
        String severity = level == LintLevel.DENY ? "error" : "warning";
        StringBuilder sb = new StringBuilder();
        sb.append(file).append(':').append(lineMap.lineOf(finding.span().start())).append(": ")
                .append(severity).append('[').append(finding.kind().lintName()).append("]: ")
                .append(finding.message()).append(System.lineSeparator());
        for (Edit edit : finding.edits()) {
            sb.append("    help: ").append(finding.help()).append(": `").append(edit.replacement()).append('`');
            if (finding.applicability() != Applicability.AUTO_APPLICABLE) {
                sb.append(" (review required)");
            }
            sb.append(System.lineSeparator());
        }
        finding.noteText().ifPresent(note ->
                sb.append("    note: ").append(note).append(System.lineSeparator()));
        return sb.toString();
    }
}
