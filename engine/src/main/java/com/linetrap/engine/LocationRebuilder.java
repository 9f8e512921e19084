package com.linetrap.engine;

import com.linetrap.engine.table.LocationEntry;
import com.linetrap.engine.table.LocationTable;
import java.util.List;

/**
 * Re-encodes the location table over the rewritten instruction list. Every slot that came from the
 * original code keeps the location of the entry that covered it; injected trap slots get "no
 * location"; injected prefixes share the location of the slot they precede.
 */
final class LocationRebuilder {
    private static final int NONE = -1;

    private LocationRebuilder() {}

    static byte[] rebuild(CodeUnit unit, List<Instruction> instructions) {
        List<LocationEntry> entries = LocationTable.decode(unit.locationTable());
        if (entries.isEmpty()) {
            return unit.locationTable();
        }
        LocationTable.Writer writer = LocationTable.writer();
        boolean[] emitted = new boolean[entries.size()];
        int runEntry = NONE;
        int runLength = 0;
        for (Instruction instruction : instructions) {
            int entry = entryIndex(entries, instruction.sourceOffset());
            if (runLength > 0 && entry != runEntry) {
                flush(writer, entries, emitted, runEntry, runLength);
                runLength = 0;
            }
            runEntry = entry;
            runLength++;
        }
        if (runLength > 0) {
            flush(writer, entries, emitted, runEntry, runLength);
        }
        return writer.toByteArray();
    }

    private static void flush(
            LocationTable.Writer writer,
            List<LocationEntry> entries,
            boolean[] emitted,
            int entry,
            int slots) {
        if (entry == NONE) {
            writer.appendNone(slots);
            return;
        }
        writer.append(entries.get(entry), slots, !emitted[entry]);
        emitted[entry] = true;
    }

    private static int entryIndex(List<LocationEntry> entries, int sourceOffset) {
        if (sourceOffset == Instruction.NO_OFFSET) {
            return NONE;
        }
        int low = 0;
        int high = entries.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            LocationEntry candidate = entries.get(mid);
            if (sourceOffset < candidate.start()) {
                high = mid - 1;
            } else if (sourceOffset >= candidate.endOffset()) {
                low = mid + 1;
            } else {
                return mid;
            }
        }
        return NONE;
    }
}
