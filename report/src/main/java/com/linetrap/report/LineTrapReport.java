package com.linetrap.report;

import com.google.protobuf.InvalidProtocolBufferException;
import com.linetrap.proto.CoverageProto.CoverageSnapshot;
import com.linetrap.proto.CoverageProto.SnapshotRequest;
import com.linetrap.proto.CoverageServiceGrpc;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import io.grpc.netty.shaded.io.netty.channel.epoll.Epoll;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollDomainSocketChannel;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollEventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.unix.DomainSocketAddress;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Pulls a snapshot from a running agent's coverage service and prints it.
 *
 * <pre>
 *   --socket=/tmp/linetrap-coverage.sock --format=text|json --workspace=/src/app --width=100
 * </pre>
 */
public final class LineTrapReport {
    private static final String DEFAULT_SOCKET = "/tmp/linetrap-coverage.sock";
    private static final int DEFAULT_WIDTH = 80;
    private static final long RPC_TIMEOUT_SECONDS = 10;

    private LineTrapReport() {
        // Utility class
    }

    public static void main(String[] args) throws InterruptedException {
        Options options = Options.parse(args);
        if (!Epoll.isAvailable()) {
            System.err.println("Epoll is not available; unable to connect to coverage socket.");
            System.exit(1);
            return;
        }

        EpollEventLoopGroup group = new EpollEventLoopGroup();
        ManagedChannel channel =
                NettyChannelBuilder.forAddress(new DomainSocketAddress(options.socket))
                        .channelType(EpollDomainSocketChannel.class)
                        .eventLoopGroup(group)
                        .usePlaintext()
                        .build();
        int status = 0;
        try {
            CoverageSnapshot snapshot =
                    CoverageServiceGrpc.newBlockingStub(channel)
                            .withDeadlineAfter(RPC_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                            .getSnapshot(SnapshotRequest.getDefaultInstance());
            render(snapshot, options, System.out);
        } catch (StatusRuntimeException e) {
            System.err.println("Failed to fetch coverage from " + options.socket + ": " + e.getStatus());
            status = 1;
        } catch (InvalidProtocolBufferException e) {
            System.err.println("Failed to render coverage report: " + e.getMessage());
            status = 1;
        } finally {
            channel.shutdownNow();
            channel.awaitTermination(5, TimeUnit.SECONDS);
            group.shutdownGracefully().syncUninterruptibly();
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    static void render(CoverageSnapshot snapshot, Options options, PrintStream out)
            throws InvalidProtocolBufferException {
        CoverageReport report = CoverageReport.fromSnapshot(snapshot);
        if (options.json) {
            out.println(report.toJson(options.workspace));
        } else {
            report.printTable(out, options.workspace, options.width);
        }
    }

    static final class Options {
        String socket = DEFAULT_SOCKET;
        boolean json;
        Path workspace;
        int width = DEFAULT_WIDTH;

        static Options parse(String[] args) {
            Options options = new Options();
            if (args == null) {
                return options;
            }
            for (String arg : args) {
                if (arg == null) {
                    continue;
                }
                if (arg.startsWith("--socket=")) {
                    options.socket = arg.substring("--socket=".length());
                } else if (arg.startsWith("--format=")) {
                    String value = arg.substring("--format=".length());
                    if ("json".equals(value)) {
                        options.json = true;
                    } else if ("text".equals(value)) {
                        options.json = false;
                    } else {
                        System.err.println("Invalid format value: " + value);
                    }
                } else if (arg.startsWith("--workspace=")) {
                    options.workspace = Path.of(arg.substring("--workspace=".length()));
                } else if (arg.startsWith("--width=")) {
                    String value = arg.substring("--width=".length());
                    try {
                        options.width = Integer.parseInt(value);
                    } catch (NumberFormatException ignored) {
                        System.err.println("Invalid width value: " + value);
                    }
                } else {
                    System.err.println("Ignoring unknown argument: " + arg);
                }
            }
            return options;
        }
    }
}
