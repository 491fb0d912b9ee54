package com.swapanalysis.pojo;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets of a file to 1-based line numbers.
 */
public final class LineMap {

    private final int[] lineStarts;

    private LineMap(int[] lineStarts) {
        this.lineStarts = lineStarts;
    }

    public static LineMap of(String content) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return new LineMap(starts.stream().mapToInt(Integer::intValue).toArray());
    }

    public static LineMap empty() {
        return new LineMap(new int[]{0});
    }

    /** 1-based line of {@code offset}; 0 for unknown offsets. */
    public int lineOf(int offset) {
        if (offset < 0) {
            return 0;
        }
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }
}
