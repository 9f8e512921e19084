package com.linetrap.engine;

import com.linetrap.engine.table.ExceptionTable;
import com.linetrap.engine.table.ExceptionTableEntry;
import com.linetrap.engine.table.LocationTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Single walk over the original stream that folds prefixes and resolves every relative jump. */
final class InstructionDecoder {
    private static final int W = Opcodes.INSTRUCTION_WIDTH;

    private InstructionDecoder() {}

    static DecodedCode decode(CodeUnit unit) throws InstrumentationException {
        int length = unit.codeLength();
        if (length % W != 0) {
            throw new InstrumentationException(unit.name(), "odd code length " + length);
        }
        int slots = length / W;
        List<Instruction> instructions = new ArrayList<>(slots);
        int[] fullArgs = new int[slots];
        int[] chainOpcodes = new int[slots];
        boolean[] chainHeads = new boolean[slots];
        Map<Integer, Jump> jumps = new LinkedHashMap<>();

        long extended = 0;
        int chainStart = 0;
        for (int offset = 0; offset < length; offset += W) {
            int opcode = unit.codeAt(offset);
            int arg = unit.codeAt(offset + 1);
            int slot = offset / W;
            instructions.add(Instruction.original(offset, opcode, arg));
            fullArgs[slot] = -1;
            if (slot == 0 || instructions.get(slot - 1).opcode != Opcodes.EXTENDED_ARG) {
                chainStart = slot;
                chainHeads[slot] = true;
            }
            if (opcode == Opcodes.EXTENDED_ARG) {
                extended = (extended << 8) | arg;
                continue;
            }
            long value = (extended << 8) | arg;
            extended = 0;
            if (value > Integer.MAX_VALUE) {
                throw new InstrumentationException(unit.name(), "argument overflow at offset " + offset);
            }
            fullArgs[slot] = (int) value;
            for (int i = chainStart; i <= slot; i++) {
                chainOpcodes[i] = opcode;
            }
            if (Opcodes.isJump(opcode)) {
                jumps.put(offset, new Jump(offset, (int) value, JumpDirection.of(opcode)));
            }
        }
        if (slots > 0 && instructions.get(slots - 1).opcode == Opcodes.EXTENDED_ARG) {
            throw new InstrumentationException(unit.name(), "dangling EXTENDED_ARG at end of code");
        }

        for (Jump jump : jumps.values()) {
            requireBoundary(unit, chainHeads, jump.target, "jump at " + jump.start);
        }

        List<ExceptionTableEntry> exceptionEntries;
        Map<Integer, Integer> lineStarts;
        try {
            exceptionEntries = ExceptionTable.parse(unit.exceptionTable());
            lineStarts = LocationTable.lineStarts(unit.locationTable(), unit.firstLineNumber());
        } catch (IllegalArgumentException e) {
            throw new InstrumentationException(unit.name(), e.getMessage(), e);
        }
        for (ExceptionTableEntry entry : exceptionEntries) {
            requireBoundary(unit, chainHeads, entry.start(), "exception region start");
            requireBoundary(unit, chainHeads, entry.handler(), "exception handler");
            if (entry.end() < entry.start() || entry.end() >= length) {
                throw new InstrumentationException(
                        unit.name(), "exception region end " + entry.end() + " out of range");
            }
        }
        return new DecodedCode(
                instructions, fullArgs, chainOpcodes, jumps, exceptionEntries, lineStarts);
    }

    private static void requireBoundary(CodeUnit unit, boolean[] chainHeads, int offset, String what)
            throws InstrumentationException {
        if (offset < 0 || offset >= unit.codeLength() || offset % W != 0) {
            throw new InstrumentationException(unit.name(), what + " points outside the code: " + offset);
        }
        if (!chainHeads[offset / W]) {
            throw new InstrumentationException(
                    unit.name(), what + " points into the middle of an instruction: " + offset);
        }
    }

    /** Decoded view of the original stream; every list and array is indexed by slot. */
    static final class DecodedCode {
        final List<Instruction> instructions;
        private final int[] fullArgs;
        private final int[] chainOpcodes;
        final Map<Integer, Jump> jumps;
        final List<ExceptionTableEntry> exceptionEntries;
        final Map<Integer, Integer> lineStarts;

        DecodedCode(
                List<Instruction> instructions,
                int[] fullArgs,
                int[] chainOpcodes,
                Map<Integer, Jump> jumps,
                List<ExceptionTableEntry> exceptionEntries,
                Map<Integer, Integer> lineStarts) {
            this.instructions = Collections.unmodifiableList(instructions);
            this.fullArgs = fullArgs;
            this.chainOpcodes = chainOpcodes;
            this.jumps = Collections.unmodifiableMap(jumps);
            this.exceptionEntries = List.copyOf(exceptionEntries);
            this.lineStarts = lineStarts;
        }

        /** Argument with prefixes folded in, or -1 for a prefix slot. */
        int fullArg(int offset) {
            return fullArgs[offset / W];
        }

        /** Opcode of the instruction a slot belongs to, looking through prefixes. */
        int chainOpcode(int offset) {
            return chainOpcodes[offset / W];
        }
    }
}
