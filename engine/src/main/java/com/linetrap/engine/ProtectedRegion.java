package com.linetrap.engine;

import com.linetrap.engine.table.ExceptionTableEntry;

/** Exception table entry bound to instructions, so it follows them as the layout grows. */
final class ProtectedRegion {
    Instruction start;
    final Instruction end;
    Instruction handler;
    private final int depthLasti;

    ProtectedRegion(Instruction start, Instruction end, Instruction handler, int depthLasti) {
        this.start = start;
        this.end = end;
        this.handler = handler;
        this.depthLasti = depthLasti;
    }

    /** Moves the anchors held by {@code from} onto {@code to}; the inclusive end never moves. */
    void reanchor(Instruction from, Instruction to) {
        if (start == from) {
            start = to;
        }
        if (handler == from) {
            handler = to;
        }
    }

    ExceptionTableEntry toEntry() {
        return new ExceptionTableEntry(start.offset, end.offset, handler.offset, depthLasti);
    }
}
