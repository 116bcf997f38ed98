package com.yongkangl.phylomatrix.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

public final class Utils {
    private Utils() {
    }

    /**
     * Renders a collection of 1-based indexes as NEXUS-style ranges, e.g.
     * {@code [1, 2, 3, 5, 8, 9]} becomes {@code "1-3, 5, 8-9"}.
     */
    public static String indexesToRanges(Collection<Integer> indexes) {
        TreeSet<Integer> sorted = new TreeSet<>(indexes);
        List<String> ranges = new ArrayList<>();
        Integer start = null;
        Integer end = null;
        for (int idx : sorted) {
            if (start == null) {
                start = idx;
                end = idx;
            } else if (idx == end + 1) {
                end = idx;
            } else {
                ranges.add(range(start, end));
                start = idx;
                end = idx;
            }
        }
        if (start != null) {
            ranges.add(range(start, end));
        }
        return String.join(", ", ranges);
    }

    /**
     * Positional character name for column {@code index} (0-based) out of
     * {@code count}, zero-padded so that names sort in column order.
     */
    public static String positionalName(int index, int count) {
        int digits = String.valueOf(Math.max(count - 1, 0)).length();
        return "CHAR_" + String.format("%0" + digits + "d", index);
    }

    private static String range(int start, int end) {
        return start == end ? String.valueOf(start) : start + "-" + end;
    }
}
