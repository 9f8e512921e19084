package com.linetrap.engine;

import static com.linetrap.engine.Opcodes.BINARY_OP;
import static com.linetrap.engine.Opcodes.COMPARE_OP;
import static com.linetrap.engine.Opcodes.END_ASYNC_FOR;
import static com.linetrap.engine.Opcodes.EXTENDED_ARG;
import static com.linetrap.engine.Opcodes.IMPORT_FROM;
import static com.linetrap.engine.Opcodes.IMPORT_NAME;
import static com.linetrap.engine.Opcodes.JUMP_BACKWARD;
import static com.linetrap.engine.Opcodes.JUMP_FORWARD;
import static com.linetrap.engine.Opcodes.LOAD_CONST;
import static com.linetrap.engine.Opcodes.LOAD_FAST;
import static com.linetrap.engine.Opcodes.MAKE_FUNCTION;
import static com.linetrap.engine.Opcodes.NOP;
import static com.linetrap.engine.Opcodes.POP_JUMP_FORWARD_IF_FALSE;
import static com.linetrap.engine.Opcodes.POP_TOP;
import static com.linetrap.engine.Opcodes.RESUME;
import static com.linetrap.engine.Opcodes.RETURN_VALUE;
import static com.linetrap.engine.Opcodes.STORE_FAST;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.linetrap.engine.table.ExceptionTable;
import com.linetrap.engine.table.ExceptionTableEntry;
import com.linetrap.engine.table.LocationEntry;
import com.linetrap.engine.table.LocationTable;
import com.linetrap.engine.testing.UnitAssembler;
import com.linetrap.engine.testing.UnitInterpreter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineTrapInstrumenterTest {
    private final List<LineDescriptor> recorded = new ArrayList<>();
    private final LineHook hook = recorded::add;

    @Test
    void everyLineOfStraightCodeIsRecordedOnce() throws Exception {
        CodeUnit unit = straightLine();

        InstrumentedUnit result = LineTrapInstrumenter.instrument(unit, hook, "pkg/calc.py", "pkg");

        assertArrayEquals(new int[] {1, 2, 3}, result.executableLines().toArray());
        assertEquals(12, new UnitInterpreter().call(result.unit(), 5));
        assertEquals(List.of(1, 2, 3), recordedLines());
        assertEquals("pkg/calc.py", recorded.get(0).path());
        assertNull(recorded.get(0).dependency());
        assertEquals(unit.maxStackDepth() + LineTrapInstrumenter.TRAP_STACK_USAGE,
                result.unit().maxStackDepth());
        assertEquals(unit.codeLength() + 3 * 8, result.unit().codeLength());
    }

    @Test
    void hookIsAppendedOnceAndEachCallsiteGetsItsOwnDescriptor() throws Exception {
        CodeUnit unit = straightLine();

        CodeUnit rewritten = LineTrapInstrumenter.instrument(unit, hook, "calc.py", "").unit();

        List<Object> constants = rewritten.constants();
        assertEquals(unit.constants(), constants.subList(0, unit.constants().size()));
        assertEquals(hook, constants.get(unit.constants().size()));
        assertEquals(List.of(1, 2, 3), descriptorLines(rewritten));
        assertEquals(unit.constants().size() + 4, constants.size());
    }

    @Test
    void loopJumpsGainPrefixesAndTheLoopStillRuns() throws Exception {
        CodeUnit unit = countingLoop();
        int hookIndex = unit.constants().size();

        CodeUnit rewritten = LineTrapInstrumenter.instrument(unit, hook, "loop.py", "").unit();

        assertEquals(3, new UnitInterpreter().call(unit, 3));
        assertEquals(3, new UnitInterpreter().call(rewritten, 3));
        assertEquals(4, Collections.frequency(recordedLines(), 3));
        assertEquals(3, Collections.frequency(recordedLines(), 4));
        assertEquals(3, Collections.frequency(recordedLines(), 65));
        assertEquals(1, Collections.frequency(recordedLines(), 66));

        StrippedCode before = StrippedCode.of(unit, hookIndex);
        StrippedCode after = StrippedCode.of(rewritten, hookIndex);
        assertSameProgram(before, after);
        int widened = 0;
        for (int i = 0; i < after.opcodes.size(); i++) {
            if (Opcodes.isJump(after.opcodes.get(i))) {
                assertNotEquals(EXTENDED_ARG, unit.codeAt(before.offsets.get(i) - 2));
                if (rewritten.codeAt(after.offsets.get(i) - 2) == EXTENDED_ARG) {
                    widened++;
                }
            }
        }
        assertEquals(2, widened);
    }

    @Test
    void jumpsToALineStartLandOnItsTrap() throws Exception {
        CodeUnit unit = countingLoop();
        int hookIndex = unit.constants().size();

        CodeUnit rewritten = LineTrapInstrumenter.instrument(unit, hook, "loop.py", "").unit();

        StrippedCode after = StrippedCode.of(rewritten, hookIndex);
        for (int i = 0; i < after.opcodes.size(); i++) {
            if (Opcodes.isJump(after.opcodes.get(i))) {
                int target = StrippedCode.rawTarget(rewritten, after.offsets.get(i));
                assertEquals(LOAD_CONST, rewritten.codeAt(target));
                assertEquals(hookIndex, rewritten.codeAt(target + 1));
            }
        }
    }

    @Test
    void branchesBehaveTheSameAfterInstrumentation() throws Exception {
        CodeUnit unit = sumOfMultiplesOfThree(80);
        int hookIndex = unit.constants().size();

        CodeUnit rewritten = LineTrapInstrumenter.instrument(unit, hook, "sum.py", "").unit();

        assertSameProgram(StrippedCode.of(unit, hookIndex), StrippedCode.of(rewritten, hookIndex));
        for (int n : new int[] {0, 1, 4, 10, 31}) {
            int expected = 0;
            for (int i = 0; i < n; i++) {
                if (i % 3 == 0) {
                    expected += i;
                }
            }
            assertEquals(expected, new UnitInterpreter().call(unit, n));
            assertEquals(expected, new UnitInterpreter().call(rewritten, n));
        }
    }

    @Test
    void protectedRegionIncludesTheTrapOfItsFirstLine() throws Exception {
        CodeUnit unit = guardedDivision();
        int hookIndex = unit.constants().size();
        ExceptionTableEntry original = ExceptionTable.parse(unit.exceptionTable()).get(0);

        CodeUnit rewritten = LineTrapInstrumenter.instrument(unit, hook, "div.py", "").unit();

        List<ExceptionTableEntry> entries = ExceptionTable.parse(rewritten.exceptionTable());
        assertEquals(1, entries.size());
        ExceptionTableEntry entry = entries.get(0);
        assertEquals(LOAD_CONST, rewritten.codeAt(entry.start()));
        assertEquals(hookIndex, rewritten.codeAt(entry.start() + 1));
        assertEquals(LOAD_CONST, rewritten.codeAt(entry.handler()));
        assertEquals(hookIndex, rewritten.codeAt(entry.handler() + 1));
        assertEquals(unit.codeAt(original.end()), rewritten.codeAt(entry.end()));
        assertEquals(RETURN_VALUE, rewritten.codeAt(entry.end()));
        assertEquals(original.depthLasti(), entry.depthLasti());
    }

    @Test
    void exceptionHandlerLineIsRecordedWhenTheRegionRaises() throws Exception {
        CodeUnit rewritten = LineTrapInstrumenter.instrument(guardedDivision(), hook, "div.py", "").unit();

        assertEquals(5, new UnitInterpreter().call(rewritten, 2));
        assertEquals(List.of(2, 3), recordedLines());

        recorded.clear();
        assertEquals(-1, new UnitInterpreter().call(rewritten, 0));
        assertEquals(List.of(2, 4), recordedLines());
    }

    @Test
    void codeBeforeResumeIsLeftAlone() throws Exception {
        UnitAssembler asm = new UnitAssembler("gen").maxStack(1);
        asm.line(1).loadConst(null).op(POP_TOP).op(RESUME);
        asm.line(2).loadConst(7).op(RETURN_VALUE);
        CodeUnit unit = asm.build();

        InstrumentedUnit result = LineTrapInstrumenter.instrument(unit, hook, "gen.py", "");

        assertArrayEquals(new int[] {2}, result.executableLines().toArray());
        assertArrayEquals(Arrays.copyOf(unit.code(), 6), Arrays.copyOf(result.unit().code(), 6));
        assertEquals(7, new UnitInterpreter().call(result.unit()));
        assertEquals(List.of(2), recordedLines());
    }

    @Test
    void nonInjectableLineIsExecutableButNotTrapped() throws Exception {
        UnitAssembler asm = new UnitAssembler("consume").maxStack(1);
        asm.line(1).op(RESUME);
        asm.line(2).op(END_ASYNC_FOR);
        asm.line(3).loadConst(null).op(RETURN_VALUE);
        CodeUnit unit = asm.build();

        InstrumentedUnit result = LineTrapInstrumenter.instrument(unit, hook, "consume.py", "");

        assertArrayEquals(new int[] {2, 3}, result.executableLines().toArray());
        assertEquals(List.of(3), descriptorLines(result.unit()));
        assertEquals(END_ASYNC_FOR, result.unit().codeAt(2));
    }

    @Test
    void moduleImportLinesCarryTheirDependencies() throws Exception {
        UnitAssembler asm = new UnitAssembler(CodeUnit.MODULE_NAME).locals(2).maxStack(2);
        asm.line(0).op(RESUME);
        asm.line(1).loadConst(0).loadConst(null).op(IMPORT_NAME, asm.name("os")).op(STORE_FAST, 0);
        asm.line(2).loadConst(2).loadConst("helper")
                .op(IMPORT_NAME, asm.name("util"))
                .op(IMPORT_FROM, asm.name("helper"))
                .op(STORE_FAST, 1)
                .op(POP_TOP);
        asm.line(3).loadConst(null).op(RETURN_VALUE);
        CodeUnit unit = asm.build();

        CodeUnit rewritten = LineTrapInstrumenter.instrument(unit, hook, "app/sub/mod.py", "app.sub").unit();
        new UnitInterpreter().call(rewritten);

        assertEquals(List.of(1, 2, 3), recordedLines());
        assertEquals(new ImportDependency("app.sub", List.of("os")), recorded.get(0).dependency());
        ImportDependency relative = recorded.get(1).dependency();
        assertEquals(new ImportDependency("app", List.of("util", "util.helper")), relative);
        assertEquals(List.of("app.util", "app.util.helper"), relative.qualifiedNames());
        assertNull(recorded.get(2).dependency());
    }

    @Test
    void emptyModuleStillRecordsItsOnlyLine() throws Exception {
        UnitAssembler asm = new UnitAssembler(CodeUnit.MODULE_NAME).firstLine(0).maxStack(1);
        asm.line(0).op(RESUME).loadConst(null).op(RETURN_VALUE);
        CodeUnit unit = asm.build();

        InstrumentedUnit result = LineTrapInstrumenter.instrument(unit, hook, "pkg/__init__.py", "pkg");
        assertNull(new UnitInterpreter().call(result.unit()));

        assertArrayEquals(new int[] {0}, result.executableLines().toArray());
        assertEquals(List.of(0), recordedLines());
        ImportDependency dependency = recorded.get(0).dependency();
        assertEquals(new ImportDependency("pkg", List.of("")), dependency);
        assertEquals(List.of("pkg"), dependency.qualifiedNames());
    }

    @Test
    void nestedUnitsAreRewrittenAndTheirLinesReported() throws Exception {
        UnitAssembler inner = new UnitAssembler("answer").firstLine(3).maxStack(1);
        inner.line(3).op(RESUME);
        inner.line(4).loadConst(42).op(RETURN_VALUE);
        CodeUnit function = inner.build();

        UnitAssembler outer = new UnitAssembler(CodeUnit.MODULE_NAME).locals(1).maxStack(1);
        outer.line(0).op(RESUME);
        outer.line(1).loadConst(function).op(MAKE_FUNCTION).op(STORE_FAST, 0);
        outer.line(6).op(LOAD_FAST, 0).op(Opcodes.CALL, 0).op(RETURN_VALUE);
        CodeUnit module = outer.build();

        InstrumentedUnit result = LineTrapInstrumenter.instrument(module, hook, "answer.py", "");

        assertArrayEquals(new int[] {1, 4, 6}, result.executableLines().toArray());
        Object rewrittenFunction = result.unit().constants().get(0);
        assertTrue(rewrittenFunction instanceof CodeUnit);
        assertNotEquals(function, rewrittenFunction);
        assertEquals(42, new UnitInterpreter().call(result.unit()));
        assertEquals(List.of(1, 6, 4), recordedLines());
    }

    @Test
    void unitWithoutLaterLinesKeepsItsCodeAndStack() throws Exception {
        UnitAssembler asm = new UnitAssembler("constant").maxStack(1);
        asm.line(1).op(RESUME).loadConst(1).op(RETURN_VALUE);
        CodeUnit unit = asm.build();

        InstrumentedUnit result = LineTrapInstrumenter.instrument(unit, hook, "c.py", "");

        assertTrue(result.executableLines().isEmpty());
        assertArrayEquals(unit.code(), result.unit().code());
        assertEquals(unit.maxStackDepth(), result.unit().maxStackDepth());
        assertArrayEquals(unit.locationTable(), result.unit().locationTable());
    }

    @Test
    void everyOriginalInstructionKeepsItsLine() throws Exception {
        UnitAssembler asm = new UnitAssembler("padded").maxStack(1);
        asm.line(1).op(RESUME);
        asm.line(2).nops(20);
        asm.line(5).nops(3);
        asm.noLine().op(NOP);
        asm.line(4).loadConst(null).op(RETURN_VALUE);
        CodeUnit unit = asm.build();
        int hookIndex = unit.constants().size();

        CodeUnit rewritten = LineTrapInstrumenter.instrument(unit, hook, "padded.py", "").unit();

        StrippedCode before = StrippedCode.of(unit, hookIndex);
        StrippedCode after = StrippedCode.of(rewritten, hookIndex);
        byte[] originalTable = unit.locationTable();
        byte[] table = rewritten.locationTable();
        for (int i = 0; i < before.offsets.size(); i++) {
            assertEquals(
                    LocationTable.lineAt(originalTable, unit.firstLineNumber(), before.offsets.get(i)),
                    LocationTable.lineAt(table, rewritten.firstLineNumber(), after.offsets.get(i)));
        }
        for (LocationEntry entry : LocationTable.decode(table)) {
            assertTrue(entry.span() <= LocationTable.MAX_SPAN);
        }
        assertEquals(
                new ArrayList<>(LocationTable.lineStarts(originalTable, 1).values()),
                new ArrayList<>(LocationTable.lineStarts(table, 1).values()));
        assertEquals(rewritten.codeLength(), LocationTable.decode(table).stream()
                .mapToInt(entry -> entry.span() * 2).sum());
    }

    @Test
    void trapSlotsHaveNoLocation() throws Exception {
        CodeUnit rewritten = LineTrapInstrumenter.instrument(straightLine(), hook, "calc.py", "").unit();

        byte[] table = rewritten.locationTable();
        for (int offset = 0; offset < rewritten.codeLength(); offset += 2) {
            boolean trap = rewritten.codeAt(offset) == LOAD_CONST
                    && rewritten.codeAt(offset + 1) == 2
                    && rewritten.codeAt(offset + 4) == Opcodes.CALL;
            if (trap) {
                for (int slot = 0; slot < 4; slot++) {
                    assertEquals(-1, LocationTable.lineAt(table, 1, offset + slot * 2));
                }
            }
        }
    }

    @Test
    void malformedUnitsAreRejected() {
        assertRejected(CodeUnit.builder("odd").code(new byte[] {(byte) RESUME, 0, (byte) NOP}).build());
        assertRejected(CodeUnit.builder("dangling")
                .code(new byte[] {(byte) RESUME, 0, (byte) EXTENDED_ARG, 1})
                .build());
        assertRejected(CodeUnit.builder("outside")
                .code(new byte[] {(byte) RESUME, 0, (byte) JUMP_FORWARD, 10})
                .build());
        assertRejected(CodeUnit.builder("midchain")
                .code(new byte[] {(byte) JUMP_FORWARD, 1, (byte) EXTENDED_ARG, 0, (byte) NOP, 0})
                .build());
        assertRejected(CodeUnit.builder("table")
                .code(new byte[] {(byte) RESUME, 0})
                .locationTable(new byte[] {0x01})
                .build());
        assertRejected(CodeUnit.builder("handler")
                .code(new byte[] {(byte) RESUME, 0, (byte) NOP, 0})
                .exceptionTable(ExceptionTable.encode(List.of(ExceptionTableEntry.of(0, 2, 40, 0, false))))
                .build());
    }

    private void assertRejected(CodeUnit unit) {
        InstrumentationException e = assertThrows(InstrumentationException.class,
                () -> LineTrapInstrumenter.instrument(unit, hook, "bad.py", ""));
        assertEquals(unit.name(), e.unitName());
    }

    private static void assertSameProgram(StrippedCode expected, StrippedCode actual) {
        assertEquals(expected.opcodes, actual.opcodes);
        assertEquals(expected.args, actual.args);
        assertEquals(expected.jumpTargets, actual.jumpTargets);
    }

    private List<Integer> recordedLines() {
        List<Integer> lines = new ArrayList<>();
        for (LineDescriptor descriptor : recorded) {
            lines.add(descriptor.line());
        }
        return lines;
    }

    private static List<Integer> descriptorLines(CodeUnit unit) {
        List<Integer> lines = new ArrayList<>();
        for (Object constant : unit.constants()) {
            if (constant instanceof LineDescriptor descriptor) {
                lines.add(descriptor.line());
            }
        }
        return lines;
    }

    /** {@code (a + 1) * 2} over three lines. */
    private static CodeUnit straightLine() {
        UnitAssembler asm = new UnitAssembler("scale").arguments(1).locals(2).maxStack(2);
        asm.noLine().op(RESUME);
        asm.line(1).op(LOAD_FAST, 0).loadConst(1).op(BINARY_OP, UnitInterpreter.ADD).op(STORE_FAST, 1);
        asm.line(2).op(LOAD_FAST, 1).loadConst(2).op(BINARY_OP, UnitInterpreter.MULTIPLY).op(STORE_FAST, 1);
        asm.line(3).op(LOAD_FAST, 1).op(RETURN_VALUE);
        return asm.build();
    }

    /** Counts up to its argument through sixty lines of padding, so both jumps outgrow one byte. */
    private static CodeUnit countingLoop() {
        UnitAssembler asm = new UnitAssembler("count").arguments(1).locals(2).maxStack(2);
        UnitAssembler.Label loop = asm.label();
        UnitAssembler.Label done = asm.label();
        asm.line(1).op(RESUME);
        asm.line(2).loadConst(0).op(STORE_FAST, 1);
        asm.mark(loop);
        asm.line(3).op(LOAD_FAST, 1).op(LOAD_FAST, 0).op(COMPARE_OP, UnitInterpreter.LT)
                .jump(POP_JUMP_FORWARD_IF_FALSE, done);
        asm.line(4).op(LOAD_FAST, 1).loadConst(1).op(BINARY_OP, UnitInterpreter.ADD).op(STORE_FAST, 1);
        for (int line = 5; line < 65; line++) {
            asm.line(line).op(NOP);
        }
        asm.line(65).jump(JUMP_BACKWARD, loop);
        asm.mark(done);
        asm.line(66).op(LOAD_FAST, 1).op(RETURN_VALUE);
        return asm.build();
    }

    private static CodeUnit sumOfMultiplesOfThree(int padding) {
        UnitAssembler asm = new UnitAssembler("sum").arguments(1).locals(3).maxStack(2);
        UnitAssembler.Label loop = asm.label();
        UnitAssembler.Label skip = asm.label();
        UnitAssembler.Label done = asm.label();
        asm.line(1).op(RESUME);
        asm.line(2).loadConst(0).op(STORE_FAST, 1);
        asm.line(3).loadConst(0).op(STORE_FAST, 2);
        asm.mark(loop);
        asm.line(4).op(LOAD_FAST, 2).op(LOAD_FAST, 0).op(COMPARE_OP, UnitInterpreter.LT)
                .jump(POP_JUMP_FORWARD_IF_FALSE, done);
        asm.line(5).op(LOAD_FAST, 2).loadConst(3).op(BINARY_OP, UnitInterpreter.MODULO)
                .loadConst(0).op(COMPARE_OP, UnitInterpreter.EQ)
                .jump(POP_JUMP_FORWARD_IF_FALSE, skip);
        asm.line(6).op(LOAD_FAST, 1).op(LOAD_FAST, 2).op(BINARY_OP, UnitInterpreter.ADD).op(STORE_FAST, 1);
        for (int i = 0; i < padding; i++) {
            asm.line(7 + i).op(NOP);
        }
        asm.mark(skip);
        int next = 7 + padding;
        asm.line(next).op(LOAD_FAST, 2).loadConst(1).op(BINARY_OP, UnitInterpreter.ADD).op(STORE_FAST, 2)
                .jump(JUMP_BACKWARD, loop);
        asm.mark(done);
        asm.line(next + 1).op(LOAD_FAST, 1).op(RETURN_VALUE);
        return asm.build();
    }

    /** {@code try: q = 10 // a; return q} with a handler returning -1. */
    private static CodeUnit guardedDivision() {
        UnitAssembler asm = new UnitAssembler("divide").arguments(1).locals(2).maxStack(2);
        UnitAssembler.Label start = asm.label();
        UnitAssembler.Label end = asm.label();
        UnitAssembler.Label handler = asm.label();
        asm.line(1).op(RESUME);
        asm.mark(start);
        asm.line(2).loadConst(10).op(LOAD_FAST, 0).op(BINARY_OP, UnitInterpreter.FLOOR_DIVIDE)
                .op(STORE_FAST, 1);
        asm.line(3).op(LOAD_FAST, 1).op(RETURN_VALUE);
        asm.mark(end);
        asm.mark(handler);
        asm.line(4).op(POP_TOP).loadConst(-1).op(RETURN_VALUE);
        asm.protect(start, end, handler, 0, false);
        return asm.build();
    }
}
