package com.swapanalysis.scan;

import com.swapanalysis.syntax.Statement;

import java.util.List;

/**
 * A read-only view of {@code statements.size()} consecutive statements starting at {@code offset}.
 */
public record Window(List<Statement> statements, int offset) {

    public Statement get(int index) {
        return statements.get(index);
    }

    public int size() {
        return statements.size();
    }
}
