package com.linetrap.engine;

import java.util.Set;

/**
 * Opcodes of the word-code format the engine rewrites.
 *
 * <p>Every slot is {@link #INSTRUCTION_WIDTH} bytes: the opcode followed by a one-byte argument.
 * Arguments wider than one byte are carried by a chain of {@link #EXTENDED_ARG} prefixes, most
 * significant chunk first.</p>
 */
public final class Opcodes {
    public static final int INSTRUCTION_WIDTH = 2;

    public static final int POP_TOP = 1;
    public static final int DUP_TOP = 4;
    public static final int NOP = 9;
    public static final int END_ASYNC_FOR = 54;
    public static final int RETURN_VALUE = 83;
    public static final int LOAD_CONST = 100;
    public static final int COMPARE_OP = 107;
    public static final int IMPORT_NAME = 108;
    public static final int IMPORT_FROM = 109;
    public static final int JUMP_FORWARD = 110;
    public static final int POP_JUMP_FORWARD_IF_FALSE = 114;
    public static final int POP_JUMP_FORWARD_IF_TRUE = 115;
    public static final int RERAISE = 119;
    public static final int BINARY_OP = 122;
    public static final int LOAD_FAST = 124;
    public static final int STORE_FAST = 125;
    public static final int RAISE_VARARGS = 130;
    public static final int MAKE_FUNCTION = 132;
    public static final int JUMP_BACKWARD = 140;
    public static final int EXTENDED_ARG = 144;
    public static final int RESUME = 151;
    public static final int CALL = 171;
    public static final int POP_JUMP_BACKWARD_IF_FALSE = 175;
    public static final int POP_JUMP_BACKWARD_IF_TRUE = 176;

    static final Set<Integer> FORWARD_JUMPS =
            Set.of(JUMP_FORWARD, POP_JUMP_FORWARD_IF_FALSE, POP_JUMP_FORWARD_IF_TRUE);

    static final Set<Integer> BACKWARD_JUMPS =
            Set.of(JUMP_BACKWARD, POP_JUMP_BACKWARD_IF_FALSE, POP_JUMP_BACKWARD_IF_TRUE);

    /** Instructions that must not be preceded by an injected trap call. */
    static final Set<Integer> NON_INJECTABLE = Set.of(END_ASYNC_FOR);

    private Opcodes() {}

    public static boolean isJump(int opcode) {
        return FORWARD_JUMPS.contains(opcode) || BACKWARD_JUMPS.contains(opcode);
    }

    public static String name(int opcode) {
        switch (opcode) {
            case POP_TOP:
                return "POP_TOP";
            case DUP_TOP:
                return "DUP_TOP";
            case NOP:
                return "NOP";
            case END_ASYNC_FOR:
                return "END_ASYNC_FOR";
            case RETURN_VALUE:
                return "RETURN_VALUE";
            case LOAD_CONST:
                return "LOAD_CONST";
            case COMPARE_OP:
                return "COMPARE_OP";
            case IMPORT_NAME:
                return "IMPORT_NAME";
            case IMPORT_FROM:
                return "IMPORT_FROM";
            case JUMP_FORWARD:
                return "JUMP_FORWARD";
            case POP_JUMP_FORWARD_IF_FALSE:
                return "POP_JUMP_FORWARD_IF_FALSE";
            case POP_JUMP_FORWARD_IF_TRUE:
                return "POP_JUMP_FORWARD_IF_TRUE";
            case RERAISE:
                return "RERAISE";
            case BINARY_OP:
                return "BINARY_OP";
            case LOAD_FAST:
                return "LOAD_FAST";
            case STORE_FAST:
                return "STORE_FAST";
            case RAISE_VARARGS:
                return "RAISE_VARARGS";
            case MAKE_FUNCTION:
                return "MAKE_FUNCTION";
            case JUMP_BACKWARD:
                return "JUMP_BACKWARD";
            case EXTENDED_ARG:
                return "EXTENDED_ARG";
            case RESUME:
                return "RESUME";
            case CALL:
                return "CALL";
            case POP_JUMP_BACKWARD_IF_FALSE:
                return "POP_JUMP_BACKWARD_IF_FALSE";
            case POP_JUMP_BACKWARD_IF_TRUE:
                return "POP_JUMP_BACKWARD_IF_TRUE";
            default:
                return "<" + opcode + ">";
        }
    }
}
