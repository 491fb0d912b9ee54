package com.swapanalysis.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swapanalysis.dto.ReportDto;
import com.swapanalysis.parser.SourceAnalysisException;

import java.io.File;
import java.io.IOException;

public class JsonUtils {
    private static final ObjectMapper mapper = new ObjectMapper();

    public static void writeReport(ReportDto report, String path) {
        File file = new File(path);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(file, report);
        } catch (IOException e) {
            throw new SourceAnalysisException("Failed to write report to " + path, e);
        }
    }
}
