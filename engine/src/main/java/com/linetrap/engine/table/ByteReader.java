package com.linetrap.engine.table;

/** Forward-only cursor over a byte table. */
final class ByteReader {
    private final byte[] data;
    private int position;

    ByteReader(byte[] data) {
        this.data = data;
    }

    boolean hasNext() {
        return position < data.length;
    }

    int position() {
        return position;
    }

    int next() {
        if (position >= data.length) {
            throw new IllegalArgumentException("Table truncated at byte " + position);
        }
        return Byte.toUnsignedInt(data[position++]);
    }
}
