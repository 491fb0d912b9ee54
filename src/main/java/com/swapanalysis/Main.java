package com.swapanalysis;

import com.swapanalysis.config.SwapAnalysisProperties;
import com.swapanalysis.mapper.ResultMapper;
import com.swapanalysis.parser.SourceAnalysisException;
import com.swapanalysis.parser.SpoonSourceParser;
import com.swapanalysis.pojo.FileResult;
import com.swapanalysis.pojo.Finding;
import com.swapanalysis.pojo.LintLevel;
import com.swapanalysis.pojo.LintLevels;
import com.swapanalysis.pojo.SourceUnit;
import com.swapanalysis.scan.ProgramScanner;
import com.swapanalysis.util.FindingFormatter;
import com.swapanalysis.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@SpringBootApplication
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_DENIED = 1;
    static final int EXIT_INPUT_ERROR = 2;

    private final SpoonSourceParser sourceParser;
    private final ProgramScanner programScanner;
    private final LintLevels lintLevels;
    private final SwapAnalysisProperties properties;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public Main(SpoonSourceParser sourceParser,
                ProgramScanner programScanner,
                LintLevels lintLevels,
                SwapAnalysisProperties properties) {
        this(sourceParser, programScanner, lintLevels, properties, System.out);
    }

    Main(SpoonSourceParser sourceParser,
         ProgramScanner programScanner,
         LintLevels lintLevels,
         SwapAnalysisProperties properties,
         PrintStream out) {
        this.sourceParser = sourceParser;
        this.programScanner = programScanner;
        this.lintLevels = lintLevels;
        this.properties = properties;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(Main.class, args)));
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            out.println("Usage: swap-analysis <file-or-directory>...");
            return;
        }

        List<SourceUnit> units = new ArrayList<>();
        boolean inputErrors = false;
        for (String arg : args) {
            try {
                units.addAll(sourceParser.parse(List.of(Path.of(arg))));
            } catch (SourceAnalysisException e) {
                log.error("Skipping {}: {}", arg, e.getMessage());
                inputErrors = true;
            }
        }

        List<FileResult> results = programScanner.scanAll(units);
        boolean denied = false;
        for (FileResult result : results) {
            for (Finding finding : result.getFindings()) {
                LintLevel level = lintLevels.levelOf(finding.kind());
                denied |= level == LintLevel.DENY;
                out.print(FindingFormatter.format(result.getName(), result.getLineMap(), finding, level));
            }
        }

        if (!properties.getReportPath().isBlank()) {
            JsonUtils.writeReport(ResultMapper.toDto(results, lintLevels), properties.getReportPath());
            log.info("Report written to {}", properties.getReportPath());
        }

        exitCode = denied ? EXIT_DENIED : inputErrors ? EXIT_INPUT_ERROR : EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
