package com.swapanalysis.pojo;

import com.swapanalysis.semantics.TypeOracle;
import com.swapanalysis.suggestion.SourceText;
import com.swapanalysis.syntax.Block;

import java.util.List;

/**
 * One parsed source file: its blocks and the collaborators that answer questions about them.
 */
public record SourceUnit(String name, List<Block> blocks, TypeOracle typeOracle, SourceText sourceText,
                         LineMap lineMap) {

    public SourceUnit {
        blocks = List.copyOf(blocks);
    }
}
