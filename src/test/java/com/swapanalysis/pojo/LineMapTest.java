package com.swapanalysis.pojo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LineMapTest {

    @Test
    public void testLineOf() {
        LineMap lineMap = LineMap.of("int a;\nint b;\n\nint c;");
        assertEquals(1, lineMap.lineOf(0));
        assertEquals(1, lineMap.lineOf(6));
        assertEquals(2, lineMap.lineOf(7));
        assertEquals(3, lineMap.lineOf(14));
        assertEquals(4, lineMap.lineOf(15));
        assertEquals(4, lineMap.lineOf(100));
    }

    @Test
    public void testUnknownOffsets() {
        assertEquals(0, LineMap.of("x").lineOf(-1));
        assertEquals(1, LineMap.empty().lineOf(42));
    }
}
