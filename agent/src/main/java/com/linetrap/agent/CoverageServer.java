package com.linetrap.agent;

import com.linetrap.engine.CoverageLines;
import com.linetrap.proto.CoverageProto.CoverageSnapshot;
import com.linetrap.proto.CoverageProto.DependencySet;
import com.linetrap.proto.CoverageProto.MergeEvent;
import com.linetrap.proto.CoverageProto.ResetRequest;
import com.linetrap.proto.CoverageProto.ResetResponse;
import com.linetrap.proto.CoverageProto.SnapshotRequest;
import com.linetrap.proto.CoverageProto.SubscribeRequest;
import com.linetrap.proto.CoverageServiceGrpc;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.netty.shaded.io.netty.channel.EventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.Epoll;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollEventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.grpc.netty.shaded.io.netty.channel.unix.DomainSocketAddress;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Serves the collector's snapshot, reset and merge-event stream over gRPC. */
final class CoverageServer {
    private final CoverageCollector collector;
    private final Path socketPath;
    private final ServerBuilder<?> serverBuilder;
    private final Set<StreamObserver<MergeEvent>> observers =
            Collections.newSetFromMap(new ConcurrentHashMap<>());
    private final AtomicBoolean clientConnected = new AtomicBoolean(false);
    private final CountDownLatch firstClientLatch = new CountDownLatch(1);

    private Server server;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    /** Server on a Unix domain socket; needs Netty's epoll transport. */
    CoverageServer(CoverageCollector collector, Path socketPath) {
        this.collector = collector;
        this.socketPath = socketPath;
        this.serverBuilder = null;
    }

    /** Server on a caller-supplied transport. */
    CoverageServer(CoverageCollector collector, ServerBuilder<?> serverBuilder) {
        this.collector = collector;
        this.socketPath = null;
        this.serverBuilder = serverBuilder;
    }

    void start() throws IOException {
        if (serverBuilder != null) {
            server = serverBuilder.addService(new CoverageServiceImpl()).build().start();
        } else {
            if (!Epoll.isAvailable()) {
                throw new IOException("Epoll is required for unix domain sockets", Epoll.unavailabilityCause());
            }
            Files.deleteIfExists(socketPath);

            bossGroup = new EpollEventLoopGroup(1);
            workerGroup = new EpollEventLoopGroup();

            server =
                    NettyServerBuilder.forAddress(new DomainSocketAddress(socketPath.toString()))
                            .bossEventLoopGroup(bossGroup)
                            .workerEventLoopGroup(workerGroup)
                            .channelType(EpollServerDomainSocketChannel.class)
                            .addService(new CoverageServiceImpl())
                            .build()
                            .start();
        }
        collector.setMergeListener(this::handleContextMerged);
    }

    void stop() {
        collector.setMergeListener(null);
        for (StreamObserver<MergeEvent> observer : observers) {
            try {
                observer.onCompleted();
            } catch (RuntimeException e) {
                System.err.println("Failed to complete coverage stream: " + e);
            }
        }
        observers.clear();
        if (server != null) {
            server.shutdown();
            try {
                server.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (socketPath != null) {
            try {
                Files.deleteIfExists(socketPath);
            } catch (IOException e) {
                System.err.println("Failed to delete coverage socket " + socketPath + ": " + e);
            }
        }
        firstClientLatch.countDown();
    }

    /** Port of a TCP server, or -1 for a domain socket. */
    int getPort() {
        return server == null ? -1 : server.getPort();
    }

    Path getSocketPath() {
        return socketPath;
    }

    boolean hasClientConnected() {
        return clientConnected.get();
    }

    void awaitFirstClient() throws InterruptedException {
        if (clientConnected.get()) {
            return;
        }
        firstClientLatch.await();
    }

    boolean awaitFirstClient(long timeout, TimeUnit unit) throws InterruptedException {
        if (clientConnected.get()) {
            return true;
        }
        return firstClientLatch.await(timeout, unit);
    }

    CoverageSnapshot buildSnapshot() {
        CoverageSnapshot.Builder builder = CoverageSnapshot.newBuilder()
                .putAllCovered(CoverageMaps.toLineSets(collector.snapshot()))
                .putAllExecutable(CoverageMaps.toLineSets(collector.executableLines()));
        for (Map.Entry<String, SortedSet<String>> entry : collector.dependencies().entrySet()) {
            builder.putDependencies(
                    entry.getKey(), DependencySet.newBuilder().addAllNames(entry.getValue()).build());
        }
        return builder.build();
    }

    private void handleContextMerged(String contextId, Map<String, CoverageLines> lines, boolean hasNewCoverage) {
        if (observers.isEmpty()) {
            return;
        }
        MergeEvent event =
                MergeEvent.newBuilder()
                        .setContextId(contextId)
                        .setHasNewCoverage(hasNewCoverage)
                        .putAllCovered(CoverageMaps.toLineSets(lines))
                        .build();
        for (StreamObserver<MergeEvent> observer : observers) {
            try {
                synchronized (observer) {
                    observer.onNext(event);
                }
            } catch (RuntimeException e) {
                observers.remove(observer);
                System.err.println("Dropping coverage subscriber: " + e);
            }
        }
    }

    private final class CoverageServiceImpl extends CoverageServiceGrpc.CoverageServiceImplBase {
        @Override
        public void getSnapshot(SnapshotRequest request, StreamObserver<CoverageSnapshot> responseObserver) {
            markClientConnected();
            responseObserver.onNext(buildSnapshot());
            responseObserver.onCompleted();
        }

        @Override
        public void reset(ResetRequest request, StreamObserver<ResetResponse> responseObserver) {
            long failures = collector.hookFailureCount();
            collector.reset();
            responseObserver.onNext(ResetResponse.newBuilder().setHookFailures(failures).build());
            responseObserver.onCompleted();
        }

        @Override
        public void subscribe(SubscribeRequest request, StreamObserver<MergeEvent> responseObserver) {
            observers.add(responseObserver);
            markClientConnected();
            if (responseObserver instanceof ServerCallStreamObserver<MergeEvent> serverObserver) {
                serverObserver.setOnCancelHandler(() -> observers.remove(responseObserver));
                serverObserver.setOnCloseHandler(() -> observers.remove(responseObserver));
            }
        }
    }

    private void markClientConnected() {
        if (clientConnected.compareAndSet(false, true)) {
            firstClientLatch.countDown();
        }
    }
}
