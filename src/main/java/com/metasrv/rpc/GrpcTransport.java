package com.metasrv.rpc;

import com.metasrv.core.NodeId;
import com.metasrv.rpc.proto.*;
import io.grpc.*;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * gRPC-based transport for real network communication.
 *
 * <p>Each node runs a gRPC server for {@code RaftService} and keeps one
 * channel per peer address. Peer addresses come from the resolver installed
 * by the meta node; a peer whose address changes gets a new channel on first
 * use.
 */
public class GrpcTransport implements RpcTransport {

    private static final Logger logger = LoggerFactory.getLogger(GrpcTransport.class);

    private final NodeId selfId;
    private final String host;
    private final int port;
    private final long rpcTimeoutMs;
    private final long forwardTimeoutMs;
    private final long installSnapshotTimeoutMs;

    private volatile Function<NodeId, String> addressResolver = id -> null;

    private Server server;
    private RpcHandler handler;

    // address -> channel
    private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();

    private final ExecutorService executor;

    /**
     * @param selfId this node's ID
     * @param host host to bind the server to
     * @param port port to bind the server to
     * @param rpcTimeoutMs deadline for vote and append calls
     * @param forwardTimeoutMs deadline for forwarded requests, which wait for
     *                         the leader to apply them
     * @param installSnapshotTimeoutMs deadline for snapshot transfer
     */
    public GrpcTransport(NodeId selfId, String host, int port,
                         long rpcTimeoutMs, long forwardTimeoutMs, long installSnapshotTimeoutMs) {
        this.selfId = selfId;
        this.host = host;
        this.port = port;
        this.rpcTimeoutMs = rpcTimeoutMs;
        this.forwardTimeoutMs = forwardTimeoutMs;
        this.installSnapshotTimeoutMs = installSnapshotTimeoutMs;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "grpc-rpc-" + selfId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void setAddressResolver(Function<NodeId, String> resolver) {
        this.addressResolver = resolver;
    }

    @Override
    public void start(RpcHandler handler) {
        this.handler = handler;

        try {
            server = ServerBuilder.forPort(port)
                    .addService(new RaftServiceImpl())
                    .build()
                    .start();

            logger.info("gRPC raft server started on {}:{}", host, port);

        } catch (IOException e) {
            throw new IllegalStateException("Failed to start gRPC server on port " + port, e);
        }
    }

    @Override
    public void shutdown() {
        for (ManagedChannel channel : channels.values()) {
            try {
                channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                channel.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channels.clear();

        if (server != null) {
            server.shutdown();
            try {
                server.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                server.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        executor.shutdown();
        logger.info("gRPC transport shutdown for {}", selfId);
    }

    @Override
    public CompletableFuture<VoteResponse> sendVoteRequest(NodeId target, VoteRequest request) {
        return call(target, "RequestVote", rpcTimeoutMs, stub -> stub.requestVote(request));
    }

    @Override
    public CompletableFuture<AppendEntriesResponse> sendAppendEntries(NodeId target, AppendEntriesRequest request) {
        return call(target, "AppendEntries", rpcTimeoutMs, stub -> stub.appendEntries(request));
    }

    @Override
    public CompletableFuture<InstallSnapshotResponse> sendInstallSnapshot(NodeId target, InstallSnapshotRequest request) {
        logger.debug("{} -> {} InstallSnapshot(index={}, size={})",
                selfId, target, request.getLastIncludedIndex(), request.getData().size());
        return call(target, "InstallSnapshot", installSnapshotTimeoutMs, stub -> stub.installSnapshot(request));
    }

    @Override
    public CompletableFuture<ForwardResponse> sendForward(NodeId target, ForwardRequest request) {
        return call(target, "Forward", forwardTimeoutMs, stub -> stub.forward(request));
    }

    @Override
    public CompletableFuture<ForwardResponse> sendForward(String address, ForwardRequest request) {
        return callAddress(address, "Forward", forwardTimeoutMs, stub -> stub.forward(request));
    }

    private <T> CompletableFuture<T> call(NodeId target, String rpcName, long timeoutMs,
                                          Function<RaftServiceGrpc.RaftServiceFutureStub, Future<T>> rpc) {
        String address = addressResolver.apply(target);
        if (address == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException(rpcName + " to " + target + ": address unknown"));
        }
        return callAddress(address, rpcName + " to " + target, timeoutMs, rpc);
    }

    private <T> CompletableFuture<T> callAddress(String address, String what, long timeoutMs,
                                                 Function<RaftServiceGrpc.RaftServiceFutureStub, Future<T>> rpc) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    RaftServiceGrpc.RaftServiceFutureStub stub = RaftServiceGrpc.newFutureStub(getChannel(address))
                            .withDeadlineAfter(timeoutMs, TimeUnit.MILLISECONDS);
                    return rpc.apply(stub).get(timeoutMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    throw new CompletionException(what + " at " + address + " timed out", e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CompletionException(what + " at " + address + " interrupted", e);
                } catch (ExecutionException e) {
                    throw new CompletionException(what + " at " + address + " failed", e.getCause());
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Transport of " + selfId + " is shut down", e));
        }
    }

    private ManagedChannel getChannel(String address) {
        return channels.computeIfAbsent(address, addr -> {
            int colon = addr.lastIndexOf(':');
            String peerHost = addr.substring(0, colon);
            int peerPort = Integer.parseInt(addr.substring(colon + 1));

            logger.debug("Creating channel to {}:{}", peerHost, peerPort);

            return ManagedChannelBuilder.forAddress(peerHost, peerPort)
                    .usePlaintext()
                    .build();
        });
    }

    public int getPort() {
        return port;
    }

    /**
     * gRPC service implementation that delegates to RpcHandler.
     */
    private class RaftServiceImpl extends RaftServiceGrpc.RaftServiceImplBase {

        @Override
        public void requestVote(VoteRequest request, StreamObserver<VoteResponse> responseObserver) {
            serve("VoteRequest", () -> handler.handleVoteRequest(request), responseObserver);
        }

        @Override
        public void appendEntries(AppendEntriesRequest request, StreamObserver<AppendEntriesResponse> responseObserver) {
            serve("AppendEntries", () -> handler.handleAppendEntries(request), responseObserver);
        }

        @Override
        public void installSnapshot(InstallSnapshotRequest request, StreamObserver<InstallSnapshotResponse> responseObserver) {
            serve("InstallSnapshot", () -> handler.handleInstallSnapshot(request), responseObserver);
        }

        @Override
        public void forward(ForwardRequest request, StreamObserver<ForwardResponse> responseObserver) {
            serve("Forward", () -> handler.handleForward(request), responseObserver);
        }

        private <T> void serve(String rpcName, Callable<T> body, StreamObserver<T> responseObserver) {
            MDC.put("nodeId", selfId.toString());
            try {
                T response = body.call();
                responseObserver.onNext(response);
                responseObserver.onCompleted();
            } catch (Exception e) {
                logger.error("Error handling {}", rpcName, e);
                responseObserver.onError(Status.INTERNAL
                        .withDescription(e.getMessage())
                        .asRuntimeException());
            }
        }
    }
}
