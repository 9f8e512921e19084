package com.linetrap.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.linetrap.engine.table.ExceptionTableEntry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BranchResolverTest {

    @Test
    void shortBranchesNeedASinglePass() throws Exception {
        List<Instruction> code = nops(20);
        Branch forward = branch(code, 2, Opcodes.JUMP_FORWARD, 15);
        Branch backward = branch(code, 18, Opcodes.JUMP_BACKWARD, 4);
        BranchResolver resolver = new BranchResolver(code, List.of(forward, backward), List.of());

        assertEquals(1, resolver.resolve());
        assertEquals(0, resolver.insertedPrefixes());
        assertEquals(12, forward.jump.arg);
        assertEquals(15, backward.jump.arg);
        assertLandsOnTargets(code, List.of(forward, backward));
    }

    @Test
    void crossingBranchesWidenEachOtherUntilStable() throws Exception {
        List<Instruction> code = nops(420);
        // The first fits in one byte until the second gains a prefix inside its span.
        Branch tight = branch(code, 50, Opcodes.JUMP_FORWARD, 306);
        Branch wide = branch(code, 100, Opcodes.POP_JUMP_FORWARD_IF_TRUE, 400);
        List<Branch> branches = List.of(tight, wide);
        BranchResolver resolver = new BranchResolver(code, branches, List.of());

        int passes = resolver.resolve();

        assertEquals(2, passes);
        assertEquals(2, resolver.insertedPrefixes());
        assertEquals(422, code.size());
        assertLandsOnTargets(code, branches);
    }

    @Test
    void chainOfSaturatedBranchesSettlesInOneWideningPass() throws Exception {
        for (int length : new int[] {6, 20, 60}) {
            List<Instruction> code = new ArrayList<>();
            List<Branch> chain = saturatedChain(code, length);
            BranchResolver resolver = new BranchResolver(code, chain, List.of());

            int passes = resolver.resolve();

            assertEquals(2, passes, "chain of " + length);
            assertEquals(length + 1, resolver.insertedPrefixes(), "chain of " + length);
            for (int i = 0; i < length; i++) {
                assertEquals(256, chain.get(i).arg(), chain.get(i).jump.toString());
            }
            assertEquals(300, chain.get(length).arg());
            assertLandsOnTargets(code, chain);
        }
    }

    @Test
    void backwardBranchOverAWidenedForwardBranchIsWidenedToo() throws Exception {
        List<Instruction> code = nops(420);
        Branch forward = branch(code, 100, Opcodes.JUMP_FORWARD, 400);
        Branch backward = branch(code, 350, Opcodes.JUMP_BACKWARD, 96);
        List<Branch> branches = List.of(forward, backward);
        BranchResolver resolver = new BranchResolver(code, branches, List.of());

        int passes = resolver.resolve();

        assertEquals(2, passes);
        assertEquals(2, resolver.insertedPrefixes());
        assertEquals(257, backward.arg());
        assertLandsOnTargets(code, branches);
    }

    @Test
    void nestedBranchesReuseExistingPrefixes() throws Exception {
        List<Instruction> code = nops(600);
        code.set(9, Instruction.original(18, Opcodes.EXTENDED_ARG, 2));
        Branch outer = branch(code, 10, Opcodes.JUMP_FORWARD, 580);
        Branch inner = branch(code, 100, Opcodes.JUMP_FORWARD, 400);
        List<Branch> branches = List.of(outer, inner);
        BranchResolver resolver = new BranchResolver(code, branches, List.of());

        resolver.resolve();

        assertEquals(1, resolver.insertedPrefixes());
        assertEquals(Opcodes.EXTENDED_ARG, code.get(9).opcode);
        assertEquals(Opcodes.JUMP_FORWARD, code.get(10).opcode);
        assertLandsOnTargets(code, branches);
    }

    @Test
    void insertedPrefixTakesOverTheAnchorsOfTheSlotItPrecedes() throws Exception {
        List<Instruction> code = nops(500);
        Branch wide = branch(code, 100, Opcodes.JUMP_FORWARD, 400);
        Branch incoming = branch(code, 450, Opcodes.JUMP_BACKWARD, 100);
        Instruction jump = wide.jump;
        Instruction handler = code.get(480);
        ProtectedRegion region = new ProtectedRegion(jump, jump, handler, 2);
        BranchResolver resolver = new BranchResolver(code, List.of(wide, incoming), List.of(region));

        resolver.resolve();

        Instruction prefix = code.get(jump.offset / Opcodes.INSTRUCTION_WIDTH - 1);
        assertTrue(prefix.isPrefix());
        assertSame(prefix, incoming.target);
        assertSame(prefix, region.start);
        assertSame(jump, region.end);
        assertEquals(prefix.sourceOffset(), jump.sourceOffset());
        ExceptionTableEntry entry = region.toEntry();
        assertEquals(prefix.offset, entry.start());
        assertEquals(jump.offset, entry.end());
        assertEquals(handler.offset, entry.handler());
        assertLandsOnTargets(code, List.of(wide, incoming));
    }

    @Test
    void staleHighPrefixesAreZeroed() throws Exception {
        List<Instruction> code = nops(14);
        code.set(0, Instruction.original(0, Opcodes.EXTENDED_ARG, 5));
        code.set(1, Instruction.original(2, Opcodes.EXTENDED_ARG, 7));
        Branch branch = branch(code, 2, Opcodes.JUMP_FORWARD, 13);
        BranchResolver resolver = new BranchResolver(code, List.of(branch), List.of());

        assertEquals(1, resolver.resolve());

        assertEquals(0, code.get(0).arg);
        assertEquals(0, code.get(1).arg);
        assertEquals(10, code.get(2).arg);
        assertLandsOnTargets(code, List.of(branch));
    }

    @Test
    void existingPrefixCarriesTheHighByte() throws Exception {
        List<Instruction> code = nops(303);
        code.set(0, Instruction.original(0, Opcodes.EXTENDED_ARG, 0));
        Branch branch = branch(code, 1, Opcodes.JUMP_FORWARD, 302);
        BranchResolver resolver = new BranchResolver(code, List.of(branch), List.of());

        assertEquals(1, resolver.resolve());

        assertEquals(0, resolver.insertedPrefixes());
        assertEquals(1, code.get(0).arg);
        assertEquals(300 & 0xFF, code.get(1).arg);
        assertLandsOnTargets(code, List.of(branch));
    }

    /**
     * {@code length} forward jumps with argument 255, each holding exactly the next jump inside its
     * span, followed by one jump that is already too far for a single byte.
     */
    private static List<Branch> saturatedChain(List<Instruction> code, int length) {
        int spacing = 200;
        int last = 10 + spacing * length;
        code.addAll(nops(last + 1 + 300 + 10));
        List<Branch> chain = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            int at = 10 + spacing * i;
            chain.add(branch(code, at, Opcodes.JUMP_FORWARD, at + 1 + 255));
        }
        chain.add(branch(code, last, Opcodes.JUMP_FORWARD, last + 1 + 300));
        return chain;
    }

    private static List<Instruction> nops(int slots) {
        List<Instruction> code = new ArrayList<>(slots);
        for (int i = 0; i < slots; i++) {
            code.add(Instruction.original(i * Opcodes.INSTRUCTION_WIDTH, Opcodes.NOP, 0));
        }
        return code;
    }

    private static Branch branch(List<Instruction> code, int at, int opcode, int target) {
        Instruction jump = Instruction.original(at * Opcodes.INSTRUCTION_WIDTH, opcode, 0);
        code.set(at, jump);
        return new Branch(jump, JumpDirection.of(opcode), code.get(target));
    }

    private static void assertLandsOnTargets(List<Instruction> code, List<Branch> branches)
            throws InstrumentationException {
        byte[] bytes = new byte[code.size() * Opcodes.INSTRUCTION_WIDTH];
        for (int i = 0; i < code.size(); i++) {
            Instruction instruction = code.get(i);
            assertEquals(i * Opcodes.INSTRUCTION_WIDTH, instruction.offset);
            bytes[instruction.offset] = (byte) instruction.opcode;
            bytes[instruction.offset + 1] = (byte) instruction.arg;
        }
        InstructionDecoder.DecodedCode decoded =
                InstructionDecoder.decode(CodeUnit.builder("resolved").code(bytes).build());
        for (Branch branch : branches) {
            assertEquals(branch.target.offset, decoded.jumps.get(branch.jump.offset).target, branch.jump.toString());
        }
    }
}
