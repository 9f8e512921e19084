package com.linetrap.engine;

import java.util.Objects;

/** Result of instrumenting one unit tree. */
public final class InstrumentedUnit {
    private final CodeUnit unit;
    private final CoverageLines executableLines;

    InstrumentedUnit(CodeUnit unit, CoverageLines executableLines) {
        this.unit = Objects.requireNonNull(unit, "unit");
        this.executableLines = Objects.requireNonNull(executableLines, "executableLines");
    }

    public CodeUnit unit() {
        return unit;
    }

    /** Lines reachable in the unit and every nested unit. */
    public CoverageLines executableLines() {
        return executableLines.copy();
    }
}
