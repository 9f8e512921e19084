package com.linetrap.engine.table;

import java.util.Objects;

/**
 * One protected region. Offsets are byte offsets; {@code end} is the offset of the last slot
 * inside the region.
 */
public final class ExceptionTableEntry {
    private final int start;
    private final int end;
    private final int handler;
    private final int depthLasti;

    public ExceptionTableEntry(int start, int end, int handler, int depthLasti) {
        this.start = start;
        this.end = end;
        this.handler = handler;
        this.depthLasti = depthLasti;
    }

    public static ExceptionTableEntry of(int start, int end, int handler, int depth, boolean lasti) {
        return new ExceptionTableEntry(start, end, handler, (depth << 1) | (lasti ? 1 : 0));
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public int handler() {
        return handler;
    }

    public int depthLasti() {
        return depthLasti;
    }

    public int depth() {
        return depthLasti >>> 1;
    }

    public boolean lasti() {
        return (depthLasti & 1) != 0;
    }

    public boolean covers(int offset) {
        return start <= offset && offset <= end;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ExceptionTableEntry entry)) {
            return false;
        }
        return start == entry.start
                && end == entry.end
                && handler == entry.handler
                && depthLasti == entry.depthLasti;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, handler, depthLasti);
    }

    @Override
    public String toString() {
        return "ExceptionTableEntry[" + start + ".." + end + " -> " + handler + ", depth "
                + depth() + (lasti() ? ", lasti" : "") + "]";
    }
}
