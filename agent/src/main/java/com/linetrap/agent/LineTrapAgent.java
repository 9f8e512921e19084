package com.linetrap.agent;

import java.lang.instrument.Instrumentation;
import org.objectweb.asm.Opcodes;

public class LineTrapAgent {
    private static CoverageCollector collector;
    private static CoverageServer coverageServer;

    public static void premain(String agentArgs, Instrumentation inst) {
        AgentConfig config = AgentConfig.parse(agentArgs);
        logStartup(config);
        CoverageCollector installed = installCollector();
        if (config.serverEnabled()) {
            startCoverageServer(installed, config);
        }
        installTransformers(inst, installed, config);
    }

    public static void premain(String agentArgs) {
        AgentConfig config = AgentConfig.parse(agentArgs);
        logStartup(config);
        CoverageCollector installed = installCollector();
        if (config.serverEnabled()) {
            startCoverageServer(installed, config);
        }
    }

    private static void logStartup(AgentConfig config) {
        System.out.println("linetrap agent initialized. " + config + ", ASM API=" + Opcodes.ASM9);
    }

    private static synchronized CoverageCollector installCollector() {
        if (collector == null) {
            collector = new CoverageCollector();
            LineTrapRuntime.install(collector);
            Runtime.getRuntime().addShutdownHook(new Thread(LineTrapAgent::logSummary));
        }
        return collector;
    }

    private static void installTransformers(
            Instrumentation inst, CoverageCollector installed, AgentConfig config) {
        try {
            inst.addTransformer(new LineCoverageTransformer(installed, config.includePrefixes()), false);
            if (config.dumpDirectory() != null) {
                inst.addTransformer(
                        new InstrumentedClassDumper(config.dumpDirectory(), config.includePrefixes()), false);
                System.out.println("Dumping instrumented classes to " + config.dumpDirectory());
            }
        } catch (Exception e) {
            System.err.println("Failed to install line coverage transformer: " + e);
        }
    }

    private static synchronized void startCoverageServer(CoverageCollector installed, AgentConfig config) {
        if (coverageServer != null) {
            return;
        }
        try {
            CoverageServer server = new CoverageServer(installed, config.socketPath());
            server.start();
            coverageServer = server;
            System.out.println("Coverage service listening on " + config.socketPath());
            Runtime.getRuntime()
                    .addShutdownHook(new Thread(() -> {
                        if (coverageServer != null) {
                            coverageServer.stop();
                        }
                    }));
        } catch (Exception e) {
            System.err.println("Failed to start coverage server: " + e);
        }
    }

    private static void logSummary() {
        CoverageCollector current = collector;
        if (current == null) {
            return;
        }
        int files = current.snapshot().size();
        System.out.println("linetrap agent exiting. files with coverage=" + files
                + ", hook failures=" + current.hookFailureCount());
    }
}
