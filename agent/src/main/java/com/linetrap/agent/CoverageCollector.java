package com.linetrap.agent;

import com.linetrap.engine.CodeUnit;
import com.linetrap.engine.CoverageLines;
import com.linetrap.engine.ImportDependency;
import com.linetrap.engine.InstrumentationException;
import com.linetrap.engine.InstrumentedUnit;
import com.linetrap.engine.LineDescriptor;
import com.linetrap.engine.LineHook;
import com.linetrap.engine.LineTrapInstrumenter;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregates the lines reported by instrumented code into per-file covered-line sets.
 *
 * <p>While a thread has an active {@link CoverageContext}, the hook records into that context's
 * own seen-set without any locking. The set is merged into the collector when the outermost scope
 * of the context closes, or, for a {@link CoverageCollectingThread}, when its spawner joins it.
 * Lines reported by a thread with no active context go into concurrent sets that readers fold
 * into the covered map under the collector lock; the recording thread never takes that lock, and a
 * line already seen costs a lookup only.</p>
 */
public final class CoverageCollector {
    final Object lock = new Object();
    private final Map<String, CoverageLines> covered = new HashMap<>();
    private final Map<String, CoverageLines> executable = new HashMap<>();
    private final ConcurrentMap<String, Set<Integer>> unscoped = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> dependencies = new ConcurrentHashMap<>();

    private final ThreadLocal<ContextState> currentContext = new ThreadLocal<>();
    private final AtomicLong contextIds = new AtomicLong();
    private final AtomicLong hookFailures = new AtomicLong();
    private final AtomicBoolean hookFailureReported = new AtomicBoolean();
    private final LineHook hook = this::record;
    private volatile MergeListener mergeListener;

    /** Hook to store in instrumented units; bound to this collector. */
    public LineHook hook() {
        return hook;
    }

    /**
     * Records one executed line. Never throws apart from {@link VirtualMachineError}: other
     * failures are counted and the first one is reported on {@code System.err}.
     */
    public void record(LineDescriptor descriptor) {
        try {
            ContextState state = currentContext.get();
            if (state != null) {
                state.record(descriptor.path(), descriptor.line(), descriptor.dependency());
                return;
            }
            recordUnscoped(descriptor.path(), descriptor.line());
            recordUnscopedDependency(descriptor.path(), descriptor.dependency());
        } catch (Throwable t) {
            onHookFailure(t);
        }
    }

    /** Entry point for JVM bytecode, which reports plain path and line pairs. */
    public void record(String path, int line) {
        try {
            ContextState state = currentContext.get();
            if (state != null) {
                state.record(path, line, null);
                return;
            }
            recordUnscoped(path, line);
        } catch (Throwable t) {
            onHookFailure(t);
        }
    }

    public CoverageContext enterContext() {
        return enterContext(null);
    }

    /**
     * Opens a context on the calling thread. Nested calls share the outermost context and its id;
     * the context merges when the outermost scope closes.
     */
    public CoverageContext enterContext(String id) {
        ContextState state = currentContext.get();
        if (state == null) {
            state = new ContextState(id != null ? id : nextContextId());
            currentContext.set(state);
        }
        state.depth++;
        return new CoverageContext(this, state);
    }

    public boolean isContextActive() {
        return currentContext.get() != null;
    }

    /** Id of the calling thread's active context, or {@code null}. */
    public String currentContextId() {
        ContextState state = currentContext.get();
        return state == null ? null : state.id;
    }

    /** Absorbs lines observed elsewhere. Merges arriving after a snapshot are accepted. */
    public void merge(Map<String, CoverageLines> partial) {
        Objects.requireNonNull(partial, "partial");
        mergeContext(null, partial, Map.of());
    }

    /** Deep copy of the covered lines, sorted by path. */
    public SortedMap<String, CoverageLines> snapshot() {
        synchronized (lock) {
            foldUnscoped();
            return CoverageMaps.deepCopy(covered);
        }
    }

    /** Executable lines registered by {@link #instrument} and the JVM transformer. */
    public SortedMap<String, CoverageLines> executableLines() {
        synchronized (lock) {
            return CoverageMaps.deepCopy(executable);
        }
    }

    /** Qualified names imported by the executed import lines of each file. */
    public SortedMap<String, SortedSet<String>> dependencies() {
        SortedMap<String, SortedSet<String>> copy = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                copy.put(entry.getKey(), new TreeSet<>(entry.getValue()));
            }
        }
        return copy;
    }

    /**
     * Instruments {@code unit} with this collector's hook and registers its executable lines under
     * {@code path}.
     */
    public InstrumentedUnit instrument(CodeUnit unit, String path, String packageName)
            throws InstrumentationException {
        InstrumentedUnit result = LineTrapInstrumenter.instrument(unit, hook, path, packageName);
        registerExecutableLines(path, result.executableLines());
        return result;
    }

    public void registerExecutableLines(String path, CoverageLines lines) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(lines, "lines");
        synchronized (lock) {
            CoverageMaps.linesFor(executable, path).addAll(lines);
        }
    }

    /**
     * Clears covered lines, dependencies and the failure counter. Executable lines stay, since the
     * instrumented code they describe stays loaded. Contexts still open keep their observations
     * and merge them when they close.
     */
    public void reset() {
        synchronized (lock) {
            covered.clear();
            unscoped.clear();
            dependencies.clear();
        }
        hookFailures.set(0);
        hookFailureReported.set(false);
    }

    public long hookFailureCount() {
        return hookFailures.get();
    }

    /** Listener notified after every context merge; {@code null} removes it. */
    public void setMergeListener(MergeListener listener) {
        this.mergeListener = listener;
    }

    void exit(ContextState state) {
        if (state.depth == 0) {
            return;
        }
        state.depth--;
        if (state.depth > 0) {
            return;
        }
        if (currentContext.get() == state) {
            currentContext.remove();
        }
        mergeContext(state.id, state.seen, state.dependencies);
    }

    /** Installs a context on a worker thread; its lines are merged by {@link #absorb}. */
    ContextState openDetachedContext(String id) {
        ContextState state = new ContextState(id != null ? id : nextContextId());
        state.depth = 1;
        currentContext.set(state);
        return state;
    }

    void closeDetachedContext(ContextState state) {
        state.depth = 0;
        if (currentContext.get() == state) {
            currentContext.remove();
        }
    }

    /**
     * Folds a finished worker's lines into the calling thread's active context, or into the
     * collector when the caller has none.
     */
    void absorb(ContextState worker) {
        ContextState joiner = currentContext.get();
        if (joiner != null) {
            for (Map.Entry<String, CoverageLines> entry : worker.seen.entrySet()) {
                CoverageMaps.linesFor(joiner.seen, entry.getKey()).addAll(entry.getValue());
            }
            for (Map.Entry<String, Set<String>> entry : worker.dependencies.entrySet()) {
                joiner.dependencies.computeIfAbsent(entry.getKey(), key -> new TreeSet<>())
                        .addAll(entry.getValue());
            }
            return;
        }
        mergeContext(worker.id, worker.seen, worker.dependencies);
    }

    private void mergeContext(
            String contextId,
            Map<String, CoverageLines> partial,
            Map<String, Set<String>> partialDependencies) {
        boolean hasNewCoverage;
        synchronized (lock) {
            foldUnscoped();
            hasNewCoverage = CoverageMaps.hasNewCoverage(partial, covered);
            CoverageMaps.mergeInto(covered, partial);
            for (Map.Entry<String, Set<String>> entry : partialDependencies.entrySet()) {
                dependencies.computeIfAbsent(entry.getKey(), key -> ConcurrentHashMap.newKeySet())
                        .addAll(entry.getValue());
            }
        }
        MergeListener listener = mergeListener;
        if (listener == null || contextId == null) {
            return;
        }
        try {
            listener.contextMerged(contextId, CoverageMaps.deepCopy(partial), hasNewCoverage);
        } catch (RuntimeException e) {
            System.err.println("Merge listener failed for context " + contextId + ": " + e);
        }
    }

    private void recordUnscoped(String path, int line) {
        if (line < 0) {
            throw new IllegalArgumentException("Negative line number: " + line);
        }
        Set<Integer> lines = unscoped.get(path);
        if (lines == null) {
            Set<Integer> created = ConcurrentHashMap.newKeySet();
            lines = unscoped.putIfAbsent(path, created);
            if (lines == null) {
                lines = created;
            }
        }
        // contains() never blocks; add() may lock a hash bin, so it only runs for a first hit
        if (!lines.contains(line)) {
            lines.add(line);
        }
    }

    private void recordUnscopedDependency(String path, ImportDependency dependency) {
        if (dependency == null) {
            return;
        }
        Set<String> names = dependencies.get(path);
        if (names == null) {
            Set<String> created = ConcurrentHashMap.newKeySet();
            names = dependencies.putIfAbsent(path, created);
            if (names == null) {
                names = created;
            }
        }
        for (String name : dependency.qualifiedNames()) {
            if (!names.contains(name)) {
                names.add(name);
            }
        }
    }

    /** Copies lines recorded outside any context into {@link #covered}. Caller holds the lock. */
    private void foldUnscoped() {
        for (Map.Entry<String, Set<Integer>> entry : unscoped.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            CoverageLines lines = CoverageMaps.linesFor(covered, entry.getKey());
            for (Integer line : entry.getValue()) {
                lines.add(line);
            }
        }
    }

    /** Counts a hook failure; a {@link VirtualMachineError} is rethrown instead. */
    void onHookFailure(Throwable t) {
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        }
        hookFailures.incrementAndGet();
        if (hookFailureReported.compareAndSet(false, true)) {
            System.err.println("Line hook failed; further failures are only counted: " + t);
        }
    }

    private String nextContextId() {
        return "context-" + contextIds.incrementAndGet();
    }

    private static void addDependency(
            Map<String, Set<String>> target, String path, ImportDependency dependency) {
        if (dependency == null) {
            return;
        }
        target.computeIfAbsent(path, key -> new TreeSet<>()).addAll(dependency.qualifiedNames());
    }

    /** Lines seen by one context; owned by the thread running it until merged. */
    static final class ContextState {
        final String id;
        final Map<String, CoverageLines> seen = new HashMap<>();
        final Map<String, Set<String>> dependencies = new HashMap<>();
        int depth;

        ContextState(String id) {
            this.id = id;
        }

        void record(String path, int line, ImportDependency dependency) {
            CoverageMaps.linesFor(seen, path).add(line);
            addDependency(dependencies, path, dependency);
        }
    }

    /** Callback for context merges, used by the coverage service to stream events. */
    @FunctionalInterface
    public interface MergeListener {
        void contextMerged(String contextId, Map<String, CoverageLines> lines, boolean hasNewCoverage);
    }
}
