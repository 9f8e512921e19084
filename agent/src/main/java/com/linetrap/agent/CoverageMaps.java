package com.linetrap.agent;

import com.linetrap.engine.CoverageLines;
import com.linetrap.proto.CoverageProto.LineSet;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Helpers over per-file line maps and their protobuf form. */
public final class CoverageMaps {
    private CoverageMaps() {}

    static CoverageLines linesFor(Map<String, CoverageLines> map, String path) {
        return map.computeIfAbsent(path, key -> new CoverageLines());
    }

    static boolean hasNewCoverage(Map<String, CoverageLines> partial, Map<String, CoverageLines> global) {
        if (partial == null) {
            return false;
        }
        for (Map.Entry<String, CoverageLines> entry : partial.entrySet()) {
            CoverageLines known = global.get(entry.getKey());
            if (entry.getValue().isEmpty()) {
                continue;
            }
            if (known == null || !known.covers(entry.getValue())) {
                return true;
            }
        }
        return false;
    }

    static void mergeInto(Map<String, CoverageLines> global, Map<String, CoverageLines> partial) {
        if (partial == null) {
            return;
        }
        for (Map.Entry<String, CoverageLines> entry : partial.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            linesFor(global, entry.getKey()).addAll(entry.getValue());
        }
    }

    static SortedMap<String, CoverageLines> deepCopy(Map<String, CoverageLines> map) {
        SortedMap<String, CoverageLines> copy = new TreeMap<>();
        for (Map.Entry<String, CoverageLines> entry : map.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    static LineSet toLineSet(CoverageLines lines) {
        LineSet.Builder builder = LineSet.newBuilder();
        lines.forEachLine(builder::addLines);
        return builder.build();
    }

    static Map<String, LineSet> toLineSets(Map<String, CoverageLines> map) {
        Map<String, LineSet> result = new TreeMap<>();
        for (Map.Entry<String, CoverageLines> entry : map.entrySet()) {
            result.put(entry.getKey(), toLineSet(entry.getValue()));
        }
        return result;
    }

    /** Converts a proto map back into line sets, sorted by path. */
    public static SortedMap<String, CoverageLines> fromLineSets(Map<String, LineSet> sets) {
        SortedMap<String, CoverageLines> result = new TreeMap<>();
        for (Map.Entry<String, LineSet> entry : sets.entrySet()) {
            CoverageLines lines = new CoverageLines();
            for (int line : entry.getValue().getLinesList()) {
                lines.add(line);
            }
            result.put(entry.getKey(), lines);
        }
        return result;
    }
}
