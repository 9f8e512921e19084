package com.linetrap.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * One slot of the instruction list being rewritten. Offsets are reassigned whenever the layout
 * changes; {@link #sourceOffset()} keeps the original position for location-table repair.
 */
final class Instruction {
    static final int NO_OFFSET = -1;

    int offset;
    final int opcode;
    int arg;
    private final int sourceOffset;
    final List<Branch> targets = new ArrayList<>();

    Instruction(int offset, int opcode, int arg, int sourceOffset) {
        this.offset = offset;
        this.opcode = opcode;
        this.arg = arg & 0xFF;
        this.sourceOffset = sourceOffset;
    }

    static Instruction original(int offset, int opcode, int arg) {
        return new Instruction(offset, opcode, arg, offset);
    }

    static Instruction injected(int opcode, int arg) {
        return new Instruction(NO_OFFSET, opcode, arg, NO_OFFSET);
    }

    /** Emits {@code opcode} with {@code arg}, preceded by as many prefixes as the value needs. */
    static List<Instruction> withArg(int opcode, int arg) {
        List<Instruction> chain = new ArrayList<>();
        chain.add(injected(opcode, arg & 0xFF));
        int rest = arg >>> 8;
        while (rest != 0) {
            chain.add(0, injected(Opcodes.EXTENDED_ARG, rest & 0xFF));
            rest >>>= 8;
        }
        return chain;
    }

    int sourceOffset() {
        return sourceOffset;
    }

    boolean isPrefix() {
        return opcode == Opcodes.EXTENDED_ARG;
    }

    @Override
    public String toString() {
        return offset + ": " + Opcodes.name(opcode) + " " + arg;
    }
}
