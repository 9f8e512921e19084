package com.linetrap.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Collapses sorted line numbers into inclusive runs of consecutive lines. */
public final class LineRanges {
    private LineRanges() {}

    /** {@code lines} must be sorted ascending; duplicates are folded into their run. */
    public static List<Range> collapse(int[] lines) {
        if (lines.length == 0) {
            return Collections.emptyList();
        }
        List<Range> ranges = new ArrayList<>();
        int start = lines[0];
        int end = lines[0];
        for (int i = 1; i < lines.length; i++) {
            int line = lines[i];
            if (line < end) {
                throw new IllegalArgumentException("lines are not sorted: " + line + " after " + end);
            }
            if (line > end + 1) {
                ranges.add(new Range(start, end));
                start = line;
            }
            end = line;
        }
        ranges.add(new Range(start, end));
        return ranges;
    }

    /** {@code 1-3,7,9-10}. */
    public static String format(List<Range> ranges) {
        StringBuilder out = new StringBuilder();
        for (Range range : ranges) {
            if (out.length() > 0) {
                out.append(',');
            }
            out.append(range);
        }
        return out.toString();
    }

    public static final class Range {
        private final int start;
        private final int end;

        public Range(int start, int end) {
            if (end < start) {
                throw new IllegalArgumentException("end " + end + " before start " + start);
            }
            this.start = start;
            this.end = end;
        }

        public int start() {
            return start;
        }

        public int end() {
            return end;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Range range)) {
                return false;
            }
            return start == range.start && end == range.end;
        }

        @Override
        public int hashCode() {
            return 31 * start + end;
        }

        @Override
        public String toString() {
            return start == end ? Integer.toString(start) : start + "-" + end;
        }
    }
}
