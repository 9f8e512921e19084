package com.linetrap.agent;

/**
 * Scope of one logical execution. Closing the outermost scope on a thread merges the lines it
 * observed into the collector; closing twice has no further effect.
 */
public final class CoverageContext implements AutoCloseable {
    private final CoverageCollector collector;
    private final CoverageCollector.ContextState state;
    private boolean closed;

    CoverageContext(CoverageCollector collector, CoverageCollector.ContextState state) {
        this.collector = collector;
        this.state = state;
    }

    public String id() {
        return state.id;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        collector.exit(state);
    }
}
