package com.linetrap.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable compiled unit: a flat word-code stream plus its constant pool, name pool, location
 * table and exception table. Nested units (inner functions) appear among the constants.
 */
public final class CodeUnit {
    /** Name carried by units that represent a whole module body. */
    public static final String MODULE_NAME = "<module>";

    private final String name;
    private final int firstLineNumber;
    private final int argumentCount;
    private final int localCount;
    private final int maxStackDepth;
    private final byte[] code;
    private final List<Object> constants;
    private final List<String> names;
    private final byte[] exceptionTable;
    private final byte[] locationTable;

    private CodeUnit(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.firstLineNumber = builder.firstLineNumber;
        this.argumentCount = builder.argumentCount;
        this.localCount = builder.localCount;
        this.maxStackDepth = builder.maxStackDepth;
        this.code = builder.code.clone();
        this.constants = Collections.unmodifiableList(new ArrayList<>(builder.constants));
        this.names = List.copyOf(builder.names);
        this.exceptionTable = builder.exceptionTable.clone();
        this.locationTable = builder.locationTable.clone();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        return new Builder(name)
                .firstLineNumber(firstLineNumber)
                .argumentCount(argumentCount)
                .localCount(localCount)
                .maxStackDepth(maxStackDepth)
                .code(code)
                .constants(constants)
                .names(names)
                .exceptionTable(exceptionTable)
                .locationTable(locationTable);
    }

    public String name() {
        return name;
    }

    public boolean isModule() {
        return MODULE_NAME.equals(name);
    }

    public int firstLineNumber() {
        return firstLineNumber;
    }

    public int argumentCount() {
        return argumentCount;
    }

    public int localCount() {
        return localCount;
    }

    public int maxStackDepth() {
        return maxStackDepth;
    }

    public byte[] code() {
        return code.clone();
    }

    public int codeLength() {
        return code.length;
    }

    /** Returns the unsigned byte at {@code offset} without copying the code. */
    public int codeAt(int offset) {
        return Byte.toUnsignedInt(code[offset]);
    }

    /** Constants may hold {@code null} entries, hence a plain unmodifiable list. */
    public List<Object> constants() {
        return constants;
    }

    public List<String> names() {
        return names;
    }

    public byte[] exceptionTable() {
        return exceptionTable.clone();
    }

    public byte[] locationTable() {
        return locationTable.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CodeUnit unit)) {
            return false;
        }
        return firstLineNumber == unit.firstLineNumber
                && argumentCount == unit.argumentCount
                && localCount == unit.localCount
                && maxStackDepth == unit.maxStackDepth
                && name.equals(unit.name)
                && Arrays.equals(code, unit.code)
                && constants.equals(unit.constants)
                && names.equals(unit.names)
                && Arrays.equals(exceptionTable, unit.exceptionTable)
                && Arrays.equals(locationTable, unit.locationTable);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, firstLineNumber, argumentCount, localCount, maxStackDepth);
        result = 31 * result + Arrays.hashCode(code);
        result = 31 * result + names.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "CodeUnit[" + name + ", line " + firstLineNumber + ", " + code.length + " bytes]";
    }

    public static final class Builder {
        private String name;
        private int firstLineNumber = 1;
        private int argumentCount;
        private int localCount;
        private int maxStackDepth;
        private byte[] code = new byte[0];
        private List<Object> constants = new ArrayList<>();
        private List<String> names = new ArrayList<>();
        private byte[] exceptionTable = new byte[0];
        private byte[] locationTable = new byte[0];

        private Builder(String name) {
            this.name = name;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder firstLineNumber(int firstLineNumber) {
            this.firstLineNumber = firstLineNumber;
            return this;
        }

        public Builder argumentCount(int argumentCount) {
            this.argumentCount = argumentCount;
            return this;
        }

        public Builder localCount(int localCount) {
            this.localCount = localCount;
            return this;
        }

        public Builder maxStackDepth(int maxStackDepth) {
            this.maxStackDepth = maxStackDepth;
            return this;
        }

        public Builder code(byte[] code) {
            this.code = Objects.requireNonNull(code, "code").clone();
            return this;
        }

        public Builder constants(List<?> constants) {
            this.constants = new ArrayList<>(Objects.requireNonNull(constants, "constants"));
            return this;
        }

        public Builder names(List<String> names) {
            this.names = new ArrayList<>(Objects.requireNonNull(names, "names"));
            return this;
        }

        public Builder exceptionTable(byte[] exceptionTable) {
            this.exceptionTable = Objects.requireNonNull(exceptionTable, "exceptionTable").clone();
            return this;
        }

        public Builder locationTable(byte[] locationTable) {
            this.locationTable = Objects.requireNonNull(locationTable, "locationTable").clone();
            return this;
        }

        public CodeUnit build() {
            return new CodeUnit(this);
        }
    }
}
