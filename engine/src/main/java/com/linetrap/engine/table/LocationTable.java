package com.linetrap.engine.table;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Codec for the compact offset-to-line table.
 *
 * <p>Each entry starts with a byte {@code 1FFFFSSS}: {@code SSS + 1} is the number of slots it
 * covers and {@code FFFF} its form. Line numbers are stored as deltas from the previous entry that
 * had a line, starting at the unit's first line number.</p>
 */
public final class LocationTable {
    public static final int MAX_SPAN = 8;

    private LocationTable() {}

    public static List<LocationEntry> decode(byte[] table) {
        List<LocationEntry> entries = new ArrayList<>();
        ByteReader reader = new ByteReader(table);
        int offset = 0;
        while (reader.hasNext()) {
            int header = reader.next();
            if ((header & Varints.ENTRY_MARKER) == 0) {
                throw new IllegalArgumentException(
                        "Location entry marker missing at byte " + (reader.position() - 1));
            }
            int span = (header & 7) + 1;
            int form = (header >> 3) & 0xF;
            int lineDelta = 0;
            ByteArrayOutputStream payload = new ByteArrayOutputStream();
            if (form == LocationEntry.FORM_LONG) {
                lineDelta = Varints.readSigned(reader);
                for (int i = 0; i < 3; i++) {
                    Varints.copy(reader, payload);
                }
            } else if (form == LocationEntry.FORM_NO_COLUMNS) {
                lineDelta = Varints.readSigned(reader);
            } else if (form >= LocationEntry.FORM_ONE_LINE) {
                if (form != LocationEntry.FORM_NO_LOCATION) {
                    lineDelta = form - LocationEntry.FORM_ONE_LINE;
                    payload.write(reader.next());
                    payload.write(reader.next());
                }
            } else {
                payload.write(reader.next());
            }
            entries.add(new LocationEntry(offset, span, form, lineDelta, payload.toByteArray()));
            offset += span * 2;
        }
        return entries;
    }

    /** Offsets where a new source line begins, in code order. */
    public static Map<Integer, Integer> lineStarts(byte[] table, int firstLineNumber) {
        Map<Integer, Integer> starts = new LinkedHashMap<>();
        int line = firstLineNumber;
        Integer lastLine = null;
        for (LocationEntry entry : decode(table)) {
            if (!entry.hasLine()) {
                continue;
            }
            line += entry.lineDelta();
            if (lastLine == null || lastLine != line) {
                starts.put(entry.start(), line);
                lastLine = line;
            }
        }
        return starts;
    }

    /** Line in effect at {@code offset}, or -1 when the slot has no location. */
    public static int lineAt(byte[] table, int firstLineNumber, int offset) {
        int line = firstLineNumber;
        for (LocationEntry entry : decode(table)) {
            if (entry.hasLine()) {
                line += entry.lineDelta();
            }
            if (entry.start() <= offset && offset < entry.endOffset()) {
                return entry.hasLine() ? line : -1;
            }
        }
        return -1;
    }

    public static Writer writer() {
        return new Writer();
    }

    /** Appends runs of slots to a new table, splitting runs longer than {@link #MAX_SPAN}. */
    public static final class Writer {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        private Writer() {}

        public Writer append(LocationEntry entry, int slots, boolean withDelta) {
            entry.writeTo(out, slots, withDelta);
            return this;
        }

        public Writer appendNone(int slots) {
            return append(LocationEntry.none(1), slots, false);
        }

        public byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
