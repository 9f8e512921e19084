package com.linetrap.agent;

/**
 * Static entry point called by instrumented JVM classes. Calls made before a collector is
 * installed are dropped.
 */
public final class LineTrapRuntime {
    static final String INTERNAL_NAME = "com/linetrap/agent/LineTrapRuntime";
    static final String ON_LINE = "onLine";
    static final String ON_LINE_DESCRIPTOR = "(Ljava/lang/String;I)V";

    private static volatile CoverageCollector collector;

    private LineTrapRuntime() {}

    public static void install(CoverageCollector newCollector) {
        collector = newCollector;
    }

    public static void uninstall() {
        collector = null;
    }

    public static CoverageCollector installed() {
        return collector;
    }

    public static void onLine(String path, int line) {
        CoverageCollector current = collector;
        if (current != null) {
            current.record(path, line);
        }
    }
}
