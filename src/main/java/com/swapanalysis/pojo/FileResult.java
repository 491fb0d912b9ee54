package com.swapanalysis.pojo;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@Builder
public class FileResult {
    private final String name;
    private final LineMap lineMap;
    private final List<Finding> findings;
    private final Map<String, Integer> metrics;

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        result.append("Name of file: ").append(name).append("\n");
        if (findings != null) {
            result.append("Findings:\n");
            for (Finding finding : findings) {
                result.append("  ").append(finding.kind().lintName()).append(": ")
                        .append(finding.message()).append("\n");
            }
        }
        return result.toString();
    }
}
