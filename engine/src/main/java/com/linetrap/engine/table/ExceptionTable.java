package com.linetrap.engine.table;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Codec for the exception table. Each entry is four varints counted in slots: start (with the
 * entry marker), length, handler and the packed depth/lasti word.
 */
public final class ExceptionTable {
    private static final int SLOT = 2;

    private ExceptionTable() {}

    public static List<ExceptionTableEntry> parse(byte[] table) {
        List<ExceptionTableEntry> entries = new ArrayList<>();
        ByteReader reader = new ByteReader(table);
        while (reader.hasNext()) {
            int start = Varints.readUnsigned(reader) * SLOT;
            int length = Varints.readUnsigned(reader) * SLOT;
            int handler = Varints.readUnsigned(reader) * SLOT;
            int depthLasti = Varints.readUnsigned(reader);
            if (length <= 0) {
                throw new IllegalArgumentException("Empty protected region at " + start);
            }
            entries.add(new ExceptionTableEntry(start, start + length - SLOT, handler, depthLasti));
        }
        return entries;
    }

    public static byte[] encode(List<ExceptionTableEntry> entries) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (ExceptionTableEntry entry : entries) {
            int size = entry.end() - entry.start() + SLOT;
            Varints.writeUnsigned(out, entry.start() / SLOT, true);
            Varints.writeUnsigned(out, size / SLOT, false);
            Varints.writeUnsigned(out, entry.handler() / SLOT, false);
            Varints.writeUnsigned(out, entry.depthLasti(), false);
        }
        return out.toByteArray();
    }
}
