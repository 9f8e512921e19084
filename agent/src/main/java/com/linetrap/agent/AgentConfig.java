package com.linetrap.agent;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options passed after {@code -javaagent:linetrap-agent.jar=}, as comma separated
 * {@code key=value} pairs. Include prefixes are separated by {@code ;}:
 *
 * <pre>
 *   include=com.example;org.acme,socket=/tmp/cov.sock,server=true,dump=/tmp/dump
 * </pre>
 */
final class AgentConfig {
    static final Path DEFAULT_SOCKET = Path.of("/tmp/linetrap-coverage.sock");

    private final List<String> includePrefixes;
    private final Path socketPath;
    private final boolean serverEnabled;
    private final Path dumpDirectory;

    private AgentConfig(List<String> includePrefixes, Path socketPath, boolean serverEnabled, Path dumpDirectory) {
        this.includePrefixes = Collections.unmodifiableList(includePrefixes);
        this.socketPath = socketPath;
        this.serverEnabled = serverEnabled;
        this.dumpDirectory = dumpDirectory;
    }

    static AgentConfig parse(String agentArgs) {
        List<String> includes = new ArrayList<>();
        Path socket = DEFAULT_SOCKET;
        boolean server = true;
        Path dump = null;
        if (agentArgs != null) {
            for (String option : agentArgs.split(",")) {
                String trimmed = option.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) {
                    System.err.println("Ignoring malformed agent option: " + trimmed);
                    continue;
                }
                String key = trimmed.substring(0, eq).trim();
                String value = trimmed.substring(eq + 1).trim();
                switch (key) {
                    case "include":
                        for (String prefix : value.split(";")) {
                            if (!prefix.isBlank()) {
                                includes.add(prefix.trim().replace('.', '/'));
                            }
                        }
                        break;
                    case "socket":
                        if (value.isEmpty()) {
                            System.err.println("Empty socket path, using " + DEFAULT_SOCKET);
                        } else {
                            socket = Path.of(value);
                        }
                        break;
                    case "server":
                        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
                            server = Boolean.parseBoolean(value);
                        } else {
                            System.err.println("Invalid server value: " + value);
                        }
                        break;
                    case "dump":
                        dump = value.isEmpty() ? null : Path.of(value);
                        break;
                    default:
                        System.err.println("Unknown agent option: " + key);
                }
            }
        }
        return new AgentConfig(includes, socket, server, dump);
    }

    /** Internal-name prefixes of the classes to instrument; empty means every eligible class. */
    List<String> includePrefixes() {
        return includePrefixes;
    }

    Path socketPath() {
        return socketPath;
    }

    boolean serverEnabled() {
        return serverEnabled;
    }

    /** Directory receiving dumps of instrumented classes, or {@code null}. */
    Path dumpDirectory() {
        return dumpDirectory;
    }

    @Override
    public String toString() {
        return "include=" + includePrefixes + ", socket=" + socketPath + ", server=" + serverEnabled
                + ", dump=" + dumpDirectory;
    }
}
