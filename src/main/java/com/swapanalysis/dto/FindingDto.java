package com.swapanalysis.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FindingDto {
    private String lint;
    private String level;
    private String message;
    private int line;
    private int start;
    private int end;
    private String help;
    private List<EditDto> edits;
    private String note;
    private String applicability;
}
