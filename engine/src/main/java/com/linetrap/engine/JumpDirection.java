package com.linetrap.engine;

enum JumpDirection {
    FORWARD(1),
    BACKWARD(-1);

    private final int sign;

    JumpDirection(int sign) {
        this.sign = sign;
    }

    int sign() {
        return sign;
    }

    static JumpDirection of(int opcode) {
        if (Opcodes.BACKWARD_JUMPS.contains(opcode)) {
            return BACKWARD;
        }
        if (Opcodes.FORWARD_JUMPS.contains(opcode)) {
            return FORWARD;
        }
        throw new IllegalArgumentException("Not a relative jump: " + Opcodes.name(opcode));
    }
}
