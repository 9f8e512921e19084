package com.linetrap.engine;

/** Live link between a jump instruction and the instruction it lands on. */
final class Branch {
    final Instruction jump;
    final JumpDirection direction;
    Instruction target;

    Branch(Instruction jump, JumpDirection direction, Instruction target) {
        this.jump = jump;
        this.direction = direction;
        this.target = target;
        target.targets.add(this);
    }

    /** Distance in slots, measured from the slot following the jump. */
    int arg() {
        int next = jump.offset + Opcodes.INSTRUCTION_WIDTH;
        int distance = direction == JumpDirection.FORWARD ? target.offset - next : next - target.offset;
        if (distance < 0) {
            throw new IllegalStateException("Branch " + jump + " -> " + target + " changed direction");
        }
        return distance / Opcodes.INSTRUCTION_WIDTH;
    }

    int span() {
        return Math.abs(target.offset - jump.offset);
    }

    void retarget(Instruction newTarget) {
        target = newTarget;
        newTarget.targets.add(this);
    }
}
