package com.linetrap.agent;

import java.io.IOException;
import java.io.PrintWriter;
import java.lang.instrument.ClassFileTransformer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.ProtectionDomain;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.util.TraceClassVisitor;

/**
 * Writes every class it sees as a {@code .class} file plus an ASM text listing. Registered after
 * {@link LineCoverageTransformer}, so the dumps show the instrumented code. Never changes the
 * class.
 */
final class InstrumentedClassDumper implements ClassFileTransformer {
    private final Path outputDir;
    private final List<String> includePrefixes;

    InstrumentedClassDumper(Path outputDir, List<String> includePrefixes) {
        this.outputDir = outputDir;
        this.includePrefixes = includePrefixes == null ? List.of() : new ArrayList<>(includePrefixes);
    }

    @Override
    public byte[] transform(
            Module module,
            ClassLoader loader,
            String className,
            Class<?> classBeingRedefined,
            ProtectionDomain protectionDomain,
            byte[] classfileBuffer) {
        if (!shouldDump(className) || classfileBuffer == null) {
            return null;
        }
        try {
            dump(className, classfileBuffer);
        } catch (IOException | RuntimeException e) {
            System.err.println("Failed to dump instrumented class " + className + ": " + e);
        }
        return null;
    }

    void dump(String className, byte[] classfileBuffer) throws IOException {
        Path asmOut = outputDir.resolve(className + ".asm");
        Files.createDirectories(asmOut.getParent());
        try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(asmOut))) {
            new ClassReader(classfileBuffer).accept(new TraceClassVisitor(pw), 0);
        }
        Files.write(outputDir.resolve(className + ".class"), classfileBuffer);
    }

    private boolean shouldDump(String className) {
        if (className == null) {
            return false;
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
}
