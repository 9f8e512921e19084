package com.linetrap.agent;

import java.util.Objects;

/**
 * Worker thread whose observed lines follow the context of the thread that created it.
 *
 * <p>If the creating thread has an active context, the task runs in a context of its own and its
 * lines are handed over when the creator calls {@link #join()}: into the joiner's active context,
 * or into the collector if the joiner has none by then. A worker that is never joined loses its
 * lines. Without an active context at creation the task records straight into the collector.</p>
 */
public final class CoverageCollectingThread {
    private final CoverageCollector collector;
    private final boolean propagate;
    private final Thread thread;
    private volatile CoverageCollector.ContextState workerContext;
    private boolean absorbed;

    public CoverageCollectingThread(CoverageCollector collector, Runnable task) {
        this(collector, task, null);
    }

    public CoverageCollectingThread(CoverageCollector collector, Runnable task, String name) {
        this.collector = Objects.requireNonNull(collector, "collector");
        Objects.requireNonNull(task, "task");
        this.propagate = collector.isContextActive();
        Runnable body = () -> runTask(task);
        this.thread = name == null ? new Thread(body) : new Thread(body, name);
    }

    public void start() {
        thread.start();
    }

    public void join() throws InterruptedException {
        thread.join();
        absorb();
    }

    /** Returns {@code false} if the worker is still running after {@code millis}. */
    public boolean join(long millis) throws InterruptedException {
        thread.join(millis);
        if (thread.isAlive()) {
            return false;
        }
        absorb();
        return true;
    }

    public Thread thread() {
        return thread;
    }

    private void runTask(Runnable task) {
        if (!propagate) {
            task.run();
            return;
        }
        CoverageCollector.ContextState context = collector.openDetachedContext(thread.getName());
        workerContext = context;
        try {
            task.run();
        } finally {
            collector.closeDetachedContext(context);
        }
    }

    private synchronized void absorb() {
        CoverageCollector.ContextState context = workerContext;
        if (context == null || absorbed) {
            return;
        }
        absorbed = true;
        collector.absorb(context);
    }
}
