package com.swapanalysis.parser;

import com.swapanalysis.pojo.LineMap;
import com.swapanalysis.pojo.SourceUnit;
import com.swapanalysis.suggestion.SourceText;
import com.swapanalysis.syntax.Block;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.code.CtStatementList;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.visitor.filter.TypeFilter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a Spoon model for Java files or directories and turns every statement list in it
 * (method bodies, nested blocks, switch cases) into a {@link Block}, one {@link SourceUnit} per file.
 */
@Component
public class SpoonSourceParser {

    private static final Logger log = LoggerFactory.getLogger(SpoonSourceParser.class);

    public List<SourceUnit> parse(List<Path> inputs) {
        CtModel model = buildModel(inputs);
        SpoonTreeTranslator translator = new SpoonTreeTranslator();
        SpoonTypeOracle oracle = new SpoonTypeOracle(translator.getTypedNodes());

        Map<File, List<Block>> blocksByFile = new LinkedHashMap<>();
        for (CtStatementList list : model.getElements(new TypeFilter<>(CtStatementList.class))) {
            SourcePosition position = list.getPosition();
            if (list.isImplicit() || (list.isParentInitialized() && list.getParent().isImplicit())
                    || position == null || !position.isValidPosition() || position.getFile() == null) {
                continue;
            }
            blocksByFile.computeIfAbsent(position.getFile(), f -> new ArrayList<>())
                    .add(translator.translateBlock(list));
        }

        List<SourceUnit> units = new ArrayList<>();
        for (Map.Entry<File, List<Block>> entry : blocksByFile.entrySet()) {
            String content = read(entry.getKey().toPath());
            units.add(new SourceUnit(entry.getKey().getPath(), entry.getValue(), oracle,
                    SourceText.of(content), LineMap.of(content)));
        }
        log.debug("Parsed {} files with {} blocks", units.size(),
                units.stream().mapToInt(u -> u.blocks().size()).sum());
        return units;
    }

    private CtModel buildModel(List<Path> inputs) {
        Launcher launcher = new Launcher();
        launcher.getEnvironment().setNoClasspath(true);
        launcher.getEnvironment().setCommentEnabled(false);
        launcher.getEnvironment().setComplianceLevel(17);
        launcher.getEnvironment().setShouldCompile(false);
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                throw new SourceAnalysisException("No such file or directory: " + input, null);
            }
            launcher.addInputResource(input.toString());
        }
        try {
            launcher.buildModel();
        } catch (RuntimeException e) {
            throw new SourceAnalysisException("Failed to build model for " + inputs, e);
        }
        return launcher.getModel();
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceAnalysisException("Failed to read " + file, e);
        }
    }
}
