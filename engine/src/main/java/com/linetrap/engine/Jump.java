package com.linetrap.engine;

/** A relative jump decoded from the original stream, with its prefixes already folded in. */
final class Jump {
    final int start;
    final int arg;
    final JumpDirection direction;
    final int target;

    Jump(int start, int arg, JumpDirection direction) {
        this.start = start;
        this.arg = arg;
        this.direction = direction;
        this.target = start + Opcodes.INSTRUCTION_WIDTH + direction.sign() * arg * Opcodes.INSTRUCTION_WIDTH;
    }

    @Override
    public String toString() {
        return "Jump[" + start + " -> " + target + "]";
    }
}
