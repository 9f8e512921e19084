package com.linetrap.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Rewrites branch arguments against the final layout. A distance that no longer fits the existing
 * prefix chain gets new {@code EXTENDED_ARG} slots, which shifts later code and may push other
 * branches over their own width; passes repeat until one inserts nothing.
 */
final class BranchResolver {
    private static final int W = Opcodes.INSTRUCTION_WIDTH;

    private final List<Instruction> instructions;
    private final List<Branch> branches;
    private final List<ProtectedRegion> regions;
    private int insertedPrefixes;

    BranchResolver(List<Instruction> instructions, List<Branch> branches, List<ProtectedRegion> regions) {
        this.instructions = instructions;
        this.branches = branches;
        this.regions = regions;
    }

    /**
     * Runs the fixed point and returns the number of passes, the final quiet pass included. A pass
     * that widens anything re-encodes, within the same pass, every branch whose span holds the new
     * prefix, so a cascade of widenings settles in one pass however long the chain is.
     */
    int resolve() {
        renumber(0);
        int maxPasses = 3 * branches.size() + 2;
        int passes = 0;
        boolean changed = true;
        while (changed) {
            if (++passes > maxPasses) {
                throw new IllegalStateException(
                        "Branch fixup did not converge after " + maxPasses + " passes");
            }
            changed = runPass();
        }
        return passes;
    }

    int insertedPrefixes() {
        return insertedPrefixes;
    }

    private boolean runPass() {
        List<Branch> ordered = new ArrayList<>(branches);
        ordered.sort(Comparator.comparingInt(Branch::span));
        Deque<Branch> queue = new ArrayDeque<>(ordered);
        Set<Branch> queued = Collections.newSetFromMap(new IdentityHashMap<>());
        queued.addAll(ordered);
        // No argument needs more than three prefixes.
        int maxInsertions = 3 * branches.size();
        int insertedThisPass = 0;
        while (!queue.isEmpty()) {
            Branch branch = queue.removeFirst();
            queued.remove(branch);
            int before = insertedPrefixes;
            int prefixOffset = encode(branch);
            if (prefixOffset < 0) {
                continue;
            }
            insertedThisPass += insertedPrefixes - before;
            if (insertedThisPass > maxInsertions) {
                throw new IllegalStateException(
                        "Branch fixup inserted " + insertedThisPass + " prefixes for "
                                + branches.size() + " branches");
            }
            for (Branch other : branches) {
                if (covers(other, prefixOffset) && queued.add(other)) {
                    queue.addLast(other);
                }
            }
        }
        return insertedThisPass > 0;
    }

    /** Encodes one branch; returns the offset of the first inserted prefix, or -1. */
    private int encode(Branch branch) {
        Instruction jump = branch.jump;
        int value = branch.arg();
        jump.arg = value & 0xFF;
        int rest = value >>> 8;
        int head = jump.offset / W;
        int inserted = 0;
        while (rest != 0) {
            if (head > 0 && instructions.get(head - 1).isPrefix()) {
                head--;
                instructions.get(head).arg = rest & 0xFF;
            } else {
                Instruction oldHead = instructions.get(head);
                Instruction prefix = new Instruction(
                        head * W, Opcodes.EXTENDED_ARG, rest & 0xFF, oldHead.sourceOffset());
                instructions.add(head, prefix);
                reanchor(oldHead, prefix);
                inserted++;
            }
            rest >>>= 8;
        }
        // Stale high chunks left over from the original encoding.
        for (int i = head - 1; i >= 0 && instructions.get(i).isPrefix(); i--) {
            instructions.get(i).arg = 0;
        }
        if (inserted == 0) {
            return -1;
        }
        insertedPrefixes += inserted;
        renumber(head);
        return head * W;
    }

    /** Inclusive at both ends: a prefix landing on a target moves that target too. */
    private static boolean covers(Branch branch, int offset) {
        int low = Math.min(branch.jump.offset, branch.target.offset);
        int high = Math.max(branch.jump.offset, branch.target.offset);
        return low <= offset && offset <= high;
    }

    private void reanchor(Instruction from, Instruction to) {
        for (Branch incoming : new ArrayList<>(from.targets)) {
            incoming.retarget(to);
        }
        from.targets.clear();
        for (ProtectedRegion region : regions) {
            region.reanchor(from, to);
        }
    }

    private void renumber(int fromIndex) {
        for (int i = fromIndex; i < instructions.size(); i++) {
            instructions.get(i).offset = i * W;
        }
    }
}
