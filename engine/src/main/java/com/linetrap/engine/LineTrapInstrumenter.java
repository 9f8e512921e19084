package com.linetrap.engine;

import com.linetrap.engine.table.ExceptionTable;
import com.linetrap.engine.table.ExceptionTableEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rewrites a {@link CodeUnit} so that the first slot of every source line is preceded by a trap
 * call into a {@link LineHook}:
 *
 * <pre>
 *   LOAD_CONST  hook
 *   LOAD_CONST  descriptor
 *   CALL        1
 *   POP_TOP
 * </pre>
 *
 * <p>Jumps and exception handlers that landed on the first slot of a line are moved onto the trap
 * call, so the line is recorded however control reaches it. Branch arguments, the exception table
 * and the location table are re-derived for the grown layout, and nested units found among the
 * constants are rewritten the same way.</p>
 *
 * <p>Instances hold no mutable state and may be shared between threads.</p>
 */
public final class LineTrapInstrumenter {
    /** Transient operand stack usage of one trap call. */
    static final int TRAP_STACK_USAGE = 2;

    private static final int W = Opcodes.INSTRUCTION_WIDTH;
    private static final byte[] EMPTY_MODULE_CODE = {
        (byte) Opcodes.RESUME, 0, (byte) Opcodes.LOAD_CONST, 0, (byte) Opcodes.RETURN_VALUE, 0
    };

    private final LineHook hook;
    private final String path;
    private final String packageName;

    public LineTrapInstrumenter(LineHook hook, String path, String packageName) {
        this.hook = Objects.requireNonNull(hook, "hook");
        this.path = Objects.requireNonNull(path, "path");
        this.packageName = packageName == null ? "" : packageName;
    }

    public static InstrumentedUnit instrument(
            CodeUnit unit, LineHook hook, String path, String packageName)
            throws InstrumentationException {
        return new LineTrapInstrumenter(hook, path, packageName).instrument(unit);
    }

    public InstrumentedUnit instrument(CodeUnit unit) throws InstrumentationException {
        Objects.requireNonNull(unit, "unit");
        InstructionDecoder.DecodedCode decoded = InstructionDecoder.decode(unit);

        List<Object> constants = new ArrayList<>(unit.constants());
        int hookIndex = constants.size();
        constants.add(hook);

        Injection injection = inject(unit, decoded, constants, hookIndex);

        List<Branch> branches = new ArrayList<>(decoded.jumps.size());
        for (Jump jump : decoded.jumps.values()) {
            Instruction jumpInstruction = decoded.instructions.get(jump.start / W);
            branches.add(new Branch(jumpInstruction, jump.direction, injection.anchor(jump.target)));
        }
        List<ProtectedRegion> regions = new ArrayList<>(decoded.exceptionEntries.size());
        for (ExceptionTableEntry entry : decoded.exceptionEntries) {
            regions.add(new ProtectedRegion(
                    injection.anchor(entry.start()),
                    decoded.instructions.get(entry.end() / W),
                    injection.anchor(entry.handler()),
                    entry.depthLasti()));
        }

        List<Instruction> instructions = injection.instructions;
        new BranchResolver(instructions, branches, regions).resolve();

        byte[] code = new byte[instructions.size() * W];
        for (Instruction instruction : instructions) {
            code[instruction.offset] = (byte) instruction.opcode;
            code[instruction.offset + 1] = (byte) instruction.arg;
        }
        List<ExceptionTableEntry> entries = new ArrayList<>(regions.size());
        for (ProtectedRegion region : regions) {
            entries.add(region.toEntry());
        }

        CoverageLines lines = injection.lines;
        for (int i = 0; i < unit.constants().size(); i++) {
            Object constant = unit.constants().get(i);
            if (constant instanceof CodeUnit nested) {
                InstrumentedUnit result = instrument(nested);
                constants.set(i, result.unit());
                lines.addAll(result.executableLines());
            }
        }

        CodeUnit rewritten = unit.toBuilder()
                .code(code)
                .constants(constants)
                .maxStackDepth(unit.maxStackDepth() + (injection.traps > 0 ? TRAP_STACK_USAGE : 0))
                .exceptionTable(ExceptionTable.encode(entries))
                .locationTable(LocationRebuilder.rebuild(unit, instructions))
                .build();
        return new InstrumentedUnit(rewritten, lines);
    }

    private Injection inject(
            CodeUnit unit,
            InstructionDecoder.DecodedCode decoded,
            List<Object> constants,
            int hookIndex) {
        Map<Integer, Integer> lineStarts = decoded.lineStarts;
        if (isEmptyModule(unit, lineStarts)) {
            lineStarts = Map.of(W, 0);
        }
        int resumeOffset = Instruction.NO_OFFSET;
        for (Instruction instruction : decoded.instructions) {
            if (instruction.opcode == Opcodes.RESUME) {
                resumeOffset = instruction.offset;
                break;
            }
        }

        Injection injection = new Injection(decoded);
        int descriptorIndex = -1;
        int currentArg = 0;
        int previousArg = 0;
        int previousPreviousArg = 0;
        String currentImportName = null;

        for (Instruction original : decoded.instructions) {
            int offset = original.offset;
            Integer line = lineStarts.get(offset);
            if (line != null && offset > resumeOffset) {
                if (!Opcodes.NON_INJECTABLE.contains(decoded.chainOpcode(offset))) {
                    ImportDependency dependency = null;
                    if (unit.isModule() && constants.size() == hookIndex + 1) {
                        dependency = new ImportDependency(packageName, List.of(""));
                    }
                    descriptorIndex = constants.size();
                    constants.add(new LineDescriptor(line, path, dependency));
                    List<Instruction> trap = trapCall(hookIndex, descriptorIndex);
                    injection.lineEntries.put(offset, trap.get(0));
                    injection.instructions.addAll(trap);
                    injection.traps++;
                }
                injection.lines.add(line);
            }
            injection.instructions.add(original);
            if (original.isPrefix()) {
                continue;
            }

            previousPreviousArg = previousArg;
            previousArg = currentArg;
            currentArg = decoded.fullArg(offset);
            if (descriptorIndex < 0) {
                continue;
            }
            LineDescriptor descriptor = (LineDescriptor) constants.get(descriptorIndex);
            if (original.opcode == Opcodes.IMPORT_NAME) {
                currentImportName = nameAt(unit, currentArg);
                if (currentImportName != null) {
                    String importPackage = importPackage(constantAt(unit, previousPreviousArg));
                    constants.set(descriptorIndex, descriptor.withDependency(
                            new ImportDependency(importPackage, List.of(currentImportName))));
                }
            } else if (original.opcode == Opcodes.IMPORT_FROM) {
                String fromName = nameAt(unit, currentArg);
                if (descriptor.dependency() != null && currentImportName != null && fromName != null) {
                    constants.set(descriptorIndex, descriptor.withDependency(
                            descriptor.dependency().withModule(currentImportName + "." + fromName)));
                }
            }
        }
        return injection;
    }

    static List<Instruction> trapCall(int hookIndex, int descriptorIndex) {
        List<Instruction> trap = new ArrayList<>(Instruction.withArg(Opcodes.LOAD_CONST, hookIndex));
        trap.addAll(Instruction.withArg(Opcodes.LOAD_CONST, descriptorIndex));
        trap.add(Instruction.injected(Opcodes.CALL, 1));
        trap.add(Instruction.injected(Opcodes.POP_TOP, 0));
        return trap;
    }

    /** Relative imports of level {@code n > 1} climb {@code n - 1} packages up. */
    private String importPackage(Object level) {
        int depth = level instanceof Integer ? (Integer) level : 0;
        if (depth <= 1) {
            return packageName;
        }
        String[] parts = packageName.split("\\.");
        int keep = parts.length - (depth - 1);
        if (keep <= 0) {
            return "";
        }
        return String.join(".", Arrays.asList(parts).subList(0, keep));
    }

    private static boolean isEmptyModule(CodeUnit unit, Map<Integer, Integer> lineStarts) {
        return unit.isModule()
                && lineStarts.equals(Map.of(0, 0))
                && Arrays.equals(unit.code(), EMPTY_MODULE_CODE);
    }

    private static String nameAt(CodeUnit unit, int index) {
        return index >= 0 && index < unit.names().size() ? unit.names().get(index) : null;
    }

    private static Object constantAt(CodeUnit unit, int index) {
        return index >= 0 && index < unit.constants().size() ? unit.constants().get(index) : null;
    }

    private static final class Injection {
        private final InstructionDecoder.DecodedCode decoded;
        final List<Instruction> instructions = new ArrayList<>();
        final Map<Integer, Instruction> lineEntries = new HashMap<>();
        final CoverageLines lines = new CoverageLines();
        int traps;

        Injection(InstructionDecoder.DecodedCode decoded) {
            this.decoded = decoded;
        }

        /**
         * Maps an original jump target, region start or handler to the instruction that now
         * represents it: the trap call injected before it, if any.
         */
        Instruction anchor(int originalOffset) {
            Instruction entry = lineEntries.get(originalOffset);
            return entry != null ? entry : decoded.instructions.get(originalOffset / W);
        }
    }
}
