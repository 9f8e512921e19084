package com.linetrap.engine.table;

import java.io.ByteArrayOutputStream;

/**
 * One decoded location-table entry. The column payload is kept opaque and re-emitted verbatim so
 * that rewriting never alters column information.
 */
public final class LocationEntry {
    public static final int FORM_SHORT_MAX = 9;
    public static final int FORM_ONE_LINE = 10;
    public static final int FORM_ONE_LINE_MAX = 12;
    public static final int FORM_NO_COLUMNS = 13;
    public static final int FORM_LONG = 14;
    public static final int FORM_NO_LOCATION = 15;

    private final int start;
    private final int span;
    private final int form;
    private final int lineDelta;
    private final byte[] payload;

    LocationEntry(int start, int span, int form, int lineDelta, byte[] payload) {
        this.start = start;
        this.span = span;
        this.form = form;
        this.lineDelta = lineDelta;
        this.payload = payload;
    }

    /** An entry that moves the current line by {@code lineDelta} and carries no columns. */
    public static LocationEntry line(int span, int lineDelta) {
        return new LocationEntry(-1, span, FORM_NO_COLUMNS, lineDelta, new byte[0]);
    }

    public static LocationEntry none(int span) {
        return new LocationEntry(-1, span, FORM_NO_LOCATION, 0, new byte[0]);
    }

    /** Byte offset of the first slot covered, or -1 for entries built for encoding. */
    public int start() {
        return start;
    }

    /** Number of slots covered. */
    public int span() {
        return span;
    }

    public int form() {
        return form;
    }

    public boolean hasLine() {
        return form != FORM_NO_LOCATION;
    }

    public int lineDelta() {
        return lineDelta;
    }

    public int endOffset() {
        return start + span * 2;
    }

    /**
     * Writes this entry's location over {@code slots} slots, splitting into as many pieces as the
     * span limit requires. Only the first piece carries the line delta, and only when
     * {@code withDelta} is set.
     */
    void writeTo(ByteArrayOutputStream out, int slots, boolean withDelta) {
        boolean delta = withDelta;
        int remaining = slots;
        while (remaining > 0) {
            int piece = Math.min(remaining, LocationTable.MAX_SPAN);
            writePiece(out, piece, delta);
            delta = false;
            remaining -= piece;
        }
    }

    private void writePiece(ByteArrayOutputStream out, int slots, boolean withDelta) {
        int pieceForm = form;
        if (!withDelta && form > FORM_ONE_LINE && form <= FORM_ONE_LINE_MAX) {
            pieceForm = FORM_ONE_LINE;
        }
        out.write(Varints.ENTRY_MARKER | (pieceForm << 3) | (slots - 1));
        if (form == FORM_LONG || form == FORM_NO_COLUMNS) {
            Varints.writeSigned(out, withDelta ? lineDelta : 0);
        }
        out.write(payload, 0, payload.length);
    }

    @Override
    public String toString() {
        return "LocationEntry[" + start + " +" + span + " form " + form
                + (hasLine() ? " delta " + lineDelta : "") + "]";
    }
}
