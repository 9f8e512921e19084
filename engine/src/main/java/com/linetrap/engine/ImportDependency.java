package com.linetrap.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Package and module names imported by the line a descriptor belongs to. */
public final class ImportDependency {
    private final String packageName;
    private final List<String> moduleNames;

    public ImportDependency(String packageName, List<String> moduleNames) {
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.moduleNames = List.copyOf(moduleNames);
    }

    public String packageName() {
        return packageName;
    }

    public List<String> moduleNames() {
        return moduleNames;
    }

    ImportDependency withModule(String moduleName) {
        List<String> names = new ArrayList<>(moduleNames);
        names.add(moduleName);
        return new ImportDependency(packageName, names);
    }

    /** Fully qualified names: the package joined with each module name, the package alone for "". */
    public List<String> qualifiedNames() {
        List<String> names = new ArrayList<>(moduleNames.size());
        for (String module : moduleNames) {
            if (module.isEmpty()) {
                names.add(packageName);
            } else if (packageName.isEmpty()) {
                names.add(module);
            } else {
                names.add(packageName + "." + module);
            }
        }
        return names;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImportDependency dependency)) {
            return false;
        }
        return packageName.equals(dependency.packageName) && moduleNames.equals(dependency.moduleNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, moduleNames);
    }

    @Override
    public String toString() {
        return packageName + moduleNames;
    }
}
