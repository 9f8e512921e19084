package com.linetrap.engine.table;

import java.io.ByteArrayOutputStream;

/**
 * Variable-length integers used by the exception and location tables: big-endian groups of six
 * bits, bit 6 set on every byte that is followed by another one. Bit 7 is left to the caller as an
 * entry marker.
 */
final class Varints {
    static final int CONTINUATION = 0x40;
    static final int ENTRY_MARKER = 0x80;
    private static final int CHUNK_MASK = 0x3F;

    private Varints() {}

    static int readUnsigned(ByteReader reader) {
        int b = reader.next();
        int value = b & CHUNK_MASK;
        while ((b & CONTINUATION) != 0) {
            value <<= 6;
            b = reader.next();
            value |= b & CHUNK_MASK;
        }
        return value;
    }

    static int readSigned(ByteReader reader) {
        int raw = readUnsigned(reader);
        return (raw & 1) != 0 ? -(raw >>> 1) : raw >>> 1;
    }

    static void writeUnsigned(ByteArrayOutputStream out, int value, boolean entryStart) {
        if (value < 0) {
            throw new IllegalArgumentException("Invalid value for varint: " + value);
        }
        int groups = 1;
        for (int rest = value >>> 6; rest != 0; rest >>>= 6) {
            groups++;
        }
        for (int i = groups - 1; i >= 0; i--) {
            int b = (value >>> (6 * i)) & CHUNK_MASK;
            if (i > 0) {
                b |= CONTINUATION;
            }
            if (entryStart && i == groups - 1) {
                b |= ENTRY_MARKER;
            }
            out.write(b);
        }
    }

    static void writeSigned(ByteArrayOutputStream out, int value) {
        writeUnsigned(out, value < 0 ? ((-value) << 1) | 1 : value << 1, false);
    }

    /** Copies one varint verbatim, whatever its width. */
    static void copy(ByteReader reader, ByteArrayOutputStream out) {
        int b = reader.next();
        out.write(b);
        while ((b & CONTINUATION) != 0) {
            b = reader.next();
            out.write(b);
        }
    }
}
