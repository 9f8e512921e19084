package com.linetrap.engine;

import java.util.BitSet;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Set of source line numbers backed by a bit set. Used for the executable lines reported by the
 * instrumenter and for the covered lines collected at run time.
 *
 * <p>Instances are not thread-safe; callers that share one across threads must synchronize.</p>
 */
public final class CoverageLines {
    private final BitSet lines;

    public CoverageLines() {
        this.lines = new BitSet();
    }

    private CoverageLines(BitSet lines) {
        this.lines = lines;
    }

    public static CoverageLines of(int... lineNumbers) {
        CoverageLines result = new CoverageLines();
        if (lineNumbers != null) {
            for (int line : lineNumbers) {
                result.add(line);
            }
        }
        return result;
    }

    /** Adds {@code line}; returns whether it was not present before. */
    public boolean add(int line) {
        if (line < 0) {
            throw new IllegalArgumentException("Negative line number: " + line);
        }
        if (lines.get(line)) {
            return false;
        }
        lines.set(line);
        return true;
    }

    public void addAll(CoverageLines other) {
        Objects.requireNonNull(other, "other");
        lines.or(other.lines);
    }

    public boolean contains(int line) {
        return line >= 0 && lines.get(line);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int size() {
        return lines.cardinality();
    }

    public boolean isSubsetOf(CoverageLines other) {
        Objects.requireNonNull(other, "other");
        BitSet remainder = (BitSet) lines.clone();
        remainder.andNot(other.lines);
        return remainder.isEmpty();
    }

    public boolean covers(CoverageLines other) {
        Objects.requireNonNull(other, "other");
        return other.isSubsetOf(this);
    }

    public CoverageLines union(CoverageLines other) {
        Objects.requireNonNull(other, "other");
        BitSet merged = (BitSet) lines.clone();
        merged.or(other.lines);
        return new CoverageLines(merged);
    }

    public CoverageLines intersect(CoverageLines other) {
        Objects.requireNonNull(other, "other");
        BitSet common = (BitSet) lines.clone();
        common.and(other.lines);
        return new CoverageLines(common);
    }

    public CoverageLines minus(CoverageLines other) {
        Objects.requireNonNull(other, "other");
        BitSet diff = (BitSet) lines.clone();
        diff.andNot(other.lines);
        return new CoverageLines(diff);
    }

    public CoverageLines copy() {
        return new CoverageLines((BitSet) lines.clone());
    }

    /** Line numbers in ascending order. */
    public int[] toArray() {
        return lines.stream().toArray();
    }

    public void forEachLine(IntConsumer consumer) {
        Objects.requireNonNull(consumer, "consumer");
        for (int line = lines.nextSetBit(0); line >= 0; line = lines.nextSetBit(line + 1)) {
            consumer.accept(line);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CoverageLines coverageLines)) {
            return false;
        }
        return lines.equals(coverageLines.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return lines.toString();
    }
}
