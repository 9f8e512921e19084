package com.linetrap.report;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.linetrap.agent.CoverageMaps;
import com.linetrap.engine.CoverageLines;
import com.linetrap.proto.CoverageProto;
import com.linetrap.proto.CoverageProto.CoverageSnapshot;
import com.linetrap.proto.CoverageProto.FileCoverage;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-file line coverage built from executable and covered lines, rendered as a text table or as
 * a JSON document listing executed and missing lines.
 */
public final class CoverageReport {
    static final String TITLE = " LINE COVERAGE REPORT ";
    static final String EMPTY_MESSAGE = "No line coverage recorded.";

    private final SortedMap<String, CoverageLines> executable;
    private final SortedMap<String, CoverageLines> covered;

    /** Covered lines outside a file's executable lines are not counted. */
    public CoverageReport(Map<String, CoverageLines> executable, Map<String, CoverageLines> covered) {
        this.executable = new TreeMap<>();
        this.covered = new TreeMap<>();
        for (Map.Entry<String, CoverageLines> entry : executable.entrySet()) {
            CoverageLines lines = entry.getValue().copy();
            CoverageLines hit = covered.get(entry.getKey());
            this.executable.put(entry.getKey(), lines);
            this.covered.put(entry.getKey(), hit == null ? new CoverageLines() : hit.intersect(lines));
        }
    }

    public static CoverageReport fromSnapshot(CoverageSnapshot snapshot) {
        return new CoverageReport(
                CoverageMaps.fromLineSets(snapshot.getExecutableMap()),
                CoverageMaps.fromLineSets(snapshot.getCoveredMap()));
    }

    /** Prints the table; {@code workspace} may be {@code null}. */
    public void printTable(PrintStream out, Path workspace, int width) {
        if (executable.isEmpty()) {
            out.println(EMPTY_MESSAGE);
            return;
        }
        Map<String, String> displayPaths = new TreeMap<>();
        int pathWidth = 0;
        for (String path : executable.keySet()) {
            String display = displayPath(path, workspace);
            displayPaths.put(path, display);
            pathWidth = Math.max(pathWidth, display.length());
        }
        pathWidth += 4;
        String rule = "-".repeat(width);

        out.println(center(TITLE, width, '='));
        out.println(String.format("%-" + pathWidth + "s%8s%8s %8s  MISSED LINES", "PATH", "LINES", "MISSED", "COVERED"));
        out.println(rule);

        int totalLines = 0;
        int totalCovered = 0;
        for (Map.Entry<String, CoverageLines> entry : executable.entrySet()) {
            CoverageLines lines = entry.getValue();
            CoverageLines hit = covered.get(entry.getKey());
            int lineCount = lines.size();
            int coveredCount = hit.size();
            totalLines += lineCount;
            totalCovered += coveredCount;
            if (coveredCount == 0) {
                continue;
            }
            String missed = LineRanges.format(LineRanges.collapse(lines.minus(hit).toArray()));
            out.println(String.format("%-" + pathWidth + "s%8d%8d%8d%%%s",
                    displayPaths.get(entry.getKey()),
                    lineCount,
                    lineCount - coveredCount,
                    percent(coveredCount, lineCount),
                    missed.isEmpty() ? "" : "  [" + missed + "]"));
        }
        out.println(rule);
        out.println(String.format("%-" + pathWidth + "s%8d%8d%8d%%",
                "TOTAL", totalLines, totalLines - totalCovered, percent(totalCovered, totalLines)));
        out.println();
    }

    /** Paths are made relative to {@code workspace} when given and inside it. */
    public CoverageProto.CoverageReport toProto(Path workspace) {
        CoverageProto.CoverageReport.Builder report = CoverageProto.CoverageReport.newBuilder();
        for (Map.Entry<String, CoverageLines> entry : executable.entrySet()) {
            CoverageLines hit = covered.get(entry.getKey());
            FileCoverage.Builder file = FileCoverage.newBuilder();
            Arrays.stream(hit.toArray()).forEach(file::addExecutedLines);
            Arrays.stream(entry.getValue().minus(hit).toArray()).forEach(file::addMissingLines);
            report.putFiles(displayPath(entry.getKey(), workspace), file.build());
        }
        return report.build();
    }

    /** {@code {"files": {"path": {"executed_lines": [...], "missing_lines": [...]}}}}. */
    public String toJson(Path workspace) throws InvalidProtocolBufferException {
        return JsonFormat.printer()
                .preservingProtoFieldNames()
                .includingDefaultValueFields()
                .sortingMapKeys()
                .omittingInsignificantWhitespace()
                .print(toProto(workspace));
    }

    static String displayPath(String path, Path workspace) {
        if (workspace == null) {
            return path;
        }
        Path file = Path.of(path);
        if (file.isAbsolute() == workspace.isAbsolute() && file.startsWith(workspace)) {
            return workspace.relativize(file).toString();
        }
        return path;
    }

    static String center(String text, int width, char fill) {
        int padding = width - text.length();
        if (padding <= 0) {
            return text;
        }
        int left = padding / 2;
        return String.valueOf(fill).repeat(left) + text + String.valueOf(fill).repeat(padding - left);
    }

    private static int percent(int part, int whole) {
        return whole == 0 ? 0 : (int) ((long) part * 100 / whole);
    }
}
