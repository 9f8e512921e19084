package com.linetrap.agent;

import com.linetrap.engine.CoverageLines;
import java.lang.instrument.ClassFileTransformer;
import java.lang.instrument.IllegalClassFormatException;
import java.security.ProtectionDomain;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.commons.AdviceAdapter;

/**
 * Adds a {@link LineTrapRuntime#onLine} call at the start of every line-number entry of every
 * concrete method, and registers the class's line numbers as executable with the collector.
 */
class LineCoverageTransformer implements ClassFileTransformer {
    private static final String[] EXCLUDED_PREFIXES = {
        "com/linetrap/",
        "org/objectweb/asm/",
        "io/grpc/",
        "com/google/",
        "java/",
        "javax/",
        "jdk/",
        "sun/",
        "com/sun/",
    };

    private final CoverageCollector collector;
    private final List<String> includePrefixes;

    LineCoverageTransformer(CoverageCollector collector) {
        this(collector, List.of());
    }

    LineCoverageTransformer(CoverageCollector collector, List<String> includePrefixes) {
        this.collector = collector;
        this.includePrefixes = includePrefixes == null ? List.of() : new ArrayList<>(includePrefixes);
    }

    @Override
    public byte[] transform(
            Module module,
            ClassLoader loader,
            String className,
            Class<?> classBeingRedefined,
            ProtectionDomain protectionDomain,
            byte[] classfileBuffer)
            throws IllegalClassFormatException {
        if (!shouldInstrument(className) || classfileBuffer == null) {
            return null;
        }

        try {
            ClassReader reader = new ClassReader(classfileBuffer);
            ClassWriter writer = new ClassWriter(reader, ClassWriter.COMPUTE_MAXS);
            LineTrapClassVisitor visitor = new LineTrapClassVisitor(writer);
            reader.accept(visitor, ClassReader.EXPAND_FRAMES);
            if (visitor.lines.isEmpty()) {
                return null;
            }
            byte[] rewritten = writer.toByteArray();
            collector.registerExecutableLines(visitor.path, visitor.lines);
            return rewritten;
        } catch (Exception e) {
            throw new IllegalClassFormatException(
                    "Failed to add line coverage instrumentation to " + className + ": " + e.getMessage());
        }
    }

    boolean shouldInstrument(String className) {
        if (className == null) {
            return false;
        }
        for (String excluded : EXCLUDED_PREFIXES) {
            if (className.startsWith(excluded)) {
                return false;
            }
        }
        if (includePrefixes.isEmpty()) {
            return true;
        }
        for (String prefix : includePrefixes) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** {@code <package dir>/<source file>}, falling back to the top-level class name. */
    static String sourcePath(String internalName, String sourceFile) {
        int slash = internalName.lastIndexOf('/');
        String directory = slash < 0 ? "" : internalName.substring(0, slash + 1);
        String file = sourceFile;
        if (file == null) {
            String simpleName = internalName.substring(slash + 1);
            int dollar = simpleName.indexOf('$');
            file = (dollar > 0 ? simpleName.substring(0, dollar) : simpleName) + ".java";
        }
        return directory + file;
    }

    private static final class LineTrapClassVisitor extends ClassVisitor {
        private final CoverageLines lines = new CoverageLines();
        private String className;
        private String path;

        LineTrapClassVisitor(ClassVisitor next) {
            super(Opcodes.ASM9, next);
        }

        @Override
        public void visit(
                int version,
                int access,
                String name,
                String signature,
                String superName,
                String[] interfaces) {
            className = name;
            path = sourcePath(name, null);
            super.visit(version, access, name, signature, superName, interfaces);
        }

        @Override
        public void visitSource(String source, String debug) {
            path = sourcePath(className, source);
            super.visitSource(source, debug);
        }

        @Override
        public MethodVisitor visitMethod(
                int access, String name, String descriptor, String signature, String[] exceptions) {
            MethodVisitor baseVisitor = super.visitMethod(access, name, descriptor, signature, exceptions);
            if (baseVisitor == null || (access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
                return baseVisitor;
            }
            return new LineTrapAdviceAdapter(baseVisitor, access, name, descriptor, this);
        }
    }

    /**
     * Line numbers arrive right after their label and before the frame at the same offset, so the
     * trap is held back until the first instruction or frame that follows.
     */
    private static final class LineTrapAdviceAdapter extends AdviceAdapter {
        private final LineTrapClassVisitor owner;
        private int pendingLine = -1;

        LineTrapAdviceAdapter(
                MethodVisitor methodVisitor,
                int access,
                String name,
                String descriptor,
                LineTrapClassVisitor owner) {
            super(Opcodes.ASM9, methodVisitor, access, name, descriptor);
            this.owner = owner;
        }

        @Override
        public void visitLineNumber(int line, Label start) {
            super.visitLineNumber(line, start);
            owner.lines.add(line);
            pendingLine = line;
        }

        private void injectPendingIfAny() {
            if (pendingLine < 0) {
                return;
            }
            int line = pendingLine;
            pendingLine = -1;
            super.visitLdcInsn(owner.path);
            super.visitLdcInsn(line);
            super.visitMethodInsn(
                    Opcodes.INVOKESTATIC,
                    LineTrapRuntime.INTERNAL_NAME,
                    LineTrapRuntime.ON_LINE,
                    LineTrapRuntime.ON_LINE_DESCRIPTOR,
                    false);
        }

        @Override
        public void visitLabel(Label label) {
            // A label between the line entry and its first instruction would be a jump target
            // that skips the trap.
            injectPendingIfAny();
            super.visitLabel(label);
        }

        @Override
        public void visitFrame(int type, int numLocal, Object[] local, int numStack, Object[] stack) {
            super.visitFrame(type, numLocal, local, numStack, stack);
            injectPendingIfAny();
        }

        @Override
        public void visitInsn(int opcode) {
            injectPendingIfAny();
            super.visitInsn(opcode);
        }

        @Override
        public void visitVarInsn(int opcode, int var) {
            injectPendingIfAny();
            super.visitVarInsn(opcode, var);
        }

        @Override
        public void visitTypeInsn(int opcode, String type) {
            injectPendingIfAny();
            super.visitTypeInsn(opcode, type);
        }

        @Override
        public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
            injectPendingIfAny();
            super.visitFieldInsn(opcode, owner, name, descriptor);
        }

        @Override
        public void visitMethodInsn(
                int opcode, String owner, String name, String descriptor, boolean isInterface) {
            injectPendingIfAny();
            super.visitMethodInsn(opcode, owner, name, descriptor, isInterface);
        }

        @Override
        public void visitInvokeDynamicInsn(
                String name, String descriptor, Handle bootstrapMethodHandle,
                Object... bootstrapMethodArguments) {
            injectPendingIfAny();
            super.visitInvokeDynamicInsn(name, descriptor, bootstrapMethodHandle, bootstrapMethodArguments);
        }

        @Override
        public void visitIntInsn(int opcode, int operand) {
            injectPendingIfAny();
            super.visitIntInsn(opcode, operand);
        }

        @Override
        public void visitIincInsn(int var, int increment) {
            injectPendingIfAny();
            super.visitIincInsn(var, increment);
        }

        @Override
        public void visitMultiANewArrayInsn(String descriptor, int numDimensions) {
            injectPendingIfAny();
            super.visitMultiANewArrayInsn(descriptor, numDimensions);
        }

        @Override
        public void visitLdcInsn(Object value) {
            injectPendingIfAny();
            super.visitLdcInsn(value);
        }

        @Override
        public void visitJumpInsn(int opcode, Label label) {
            injectPendingIfAny();
            super.visitJumpInsn(opcode, label);
        }

        @Override
        public void visitTableSwitchInsn(int min, int max, Label defaultLabel, Label... labels) {
            injectPendingIfAny();
            super.visitTableSwitchInsn(min, max, defaultLabel, labels);
        }

        @Override
        public void visitLookupSwitchInsn(Label defaultLabel, int[] keys, Label[] labels) {
            injectPendingIfAny();
            super.visitLookupSwitchInsn(defaultLabel, keys, labels);
        }
    }
}
