package com.linetrap.engine;

/** Raised when a unit cannot be instrumented because its encoding is malformed or unsupported. */
public class InstrumentationException extends Exception {
    private final String unitName;

    public InstrumentationException(String unitName, String message) {
        super("Cannot instrument " + unitName + ": " + message);
        this.unitName = unitName;
    }

    public InstrumentationException(String unitName, String message, Throwable cause) {
        super("Cannot instrument " + unitName + ": " + message, cause);
        this.unitName = unitName;
    }

    public String unitName() {
        return unitName;
    }
}
