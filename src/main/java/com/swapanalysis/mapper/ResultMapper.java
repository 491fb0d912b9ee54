package com.swapanalysis.mapper;

import com.swapanalysis.dto.EditDto;
import com.swapanalysis.dto.FileResultDto;
import com.swapanalysis.dto.FindingDto;
import com.swapanalysis.dto.ReportDto;
import com.swapanalysis.pojo.Edit;
import com.swapanalysis.pojo.FileResult;
import com.swapanalysis.pojo.Finding;
import com.swapanalysis.pojo.LineMap;
import com.swapanalysis.pojo.LintLevels;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ResultMapper {

    public static EditDto toDto(Edit edit) {
        return EditDto.builder()
                .start(edit.span().start())
                .end(edit.span().end())
                .replacement(edit.replacement())
                .build();
    }

    public static FindingDto toDto(Finding finding, LineMap lineMap, LintLevels levels) {
        return FindingDto.builder()
                .lint(finding.kind().lintName())
                .level(levels.levelOf(finding.kind()).name().toLowerCase())
                .message(finding.message())
                .line(lineMap.lineOf(finding.span().start()))
                .start(finding.span().start())
                .end(finding.span().end())
                .help(finding.help())
                .edits(finding.edits().stream()
                        .map(ResultMapper::toDto)
                        .collect(Collectors.toList()))
                .note(finding.note())
                .applicability(finding.applicability().name())
                .build();
    }

    public static FileResultDto toDto(FileResult fileResult, LintLevels levels) {
        LineMap lineMap = fileResult.getLineMap() != null ? fileResult.getLineMap() : LineMap.empty();
        return FileResultDto.builder()
                .name(fileResult.getName())
                .metrics(fileResult.getMetrics())
                .findings(fileResult.getFindings().stream()
                        .map(f -> toDto(f, lineMap, levels))
                        .collect(Collectors.toList()))
                .build();
    }

    public static ReportDto toDto(List<FileResult> fileResults, LintLevels levels) {
        Map<String, String> lintLevels = new LinkedHashMap<>();
        levels.asMap().forEach((kind, level) -> lintLevels.put(kind.lintName(), level.name().toLowerCase()));

        Map<String, Integer> totals = new LinkedHashMap<>();
        for (FileResult fileResult : fileResults) {
            fileResult.getMetrics().forEach((lint, count) -> totals.merge(lint, count, Integer::sum));
        }
        return ReportDto.builder()
                .lintLevels(lintLevels)
                .totals(totals)
                .fileResults(fileResults.stream()
                        .filter(r -> !r.getFindings().isEmpty())
                        .map(r -> toDto(r, levels))
                        .collect(Collectors.toList()))
                .build();
    }
}
