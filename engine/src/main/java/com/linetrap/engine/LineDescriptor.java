package com.linetrap.engine;

import java.util.Objects;

/** Per-callsite argument of the line hook. */
public final class LineDescriptor {
    private final int line;
    private final String path;
    private final ImportDependency dependency;

    public LineDescriptor(int line, String path, ImportDependency dependency) {
        this.line = line;
        this.path = Objects.requireNonNull(path, "path");
        this.dependency = dependency;
    }

    public int line() {
        return line;
    }

    public String path() {
        return path;
    }

    /** Import tag for import-statement lines and module entry lines, otherwise {@code null}. */
    public ImportDependency dependency() {
        return dependency;
    }

    LineDescriptor withDependency(ImportDependency newDependency) {
        return new LineDescriptor(line, path, newDependency);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LineDescriptor descriptor)) {
            return false;
        }
        return line == descriptor.line
                && path.equals(descriptor.path)
                && Objects.equals(dependency, descriptor.dependency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, path, dependency);
    }

    @Override
    public String toString() {
        return path + ":" + line + (dependency != null ? " " + dependency : "");
    }
}
