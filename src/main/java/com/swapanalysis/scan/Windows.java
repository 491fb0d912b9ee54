package com.swapanalysis.scan;

import com.swapanalysis.syntax.Statement;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * All windows of a fixed width over a statement list, in order. Nothing is copied and every call to
 * {@link #iterator()} starts over, so the same instance can be scanned any number of times.
 */
public final class Windows implements Iterable<Window> {

    private final List<Statement> statements;
    private final int width;

    private Windows(List<Statement> statements, int width) {
        this.statements = Collections.unmodifiableList(statements);
        this.width = width;
    }

    public static Windows of(List<Statement> statements, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Window width must be positive, was " + width);
        }
        return new Windows(statements, width);
    }

    @Override
    public Iterator<Window> iterator() {
        return new Iterator<>() {
            private int offset = 0;

            @Override
            public boolean hasNext() {
                return offset + width <= statements.size();
            }

            @Override
            public Window next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Window window = new Window(statements.subList(offset, offset + width), offset);
                offset++;
                return window;
            }
        };
    }
}
