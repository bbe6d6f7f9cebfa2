package com.metasrv.rpc;

import com.metasrv.core.NodeId;
import com.metasrv.rpc.proto.AppendEntriesRequest;
import com.metasrv.rpc.proto.AppendEntriesResponse;
import com.metasrv.rpc.proto.ForwardRequest;
import com.metasrv.rpc.proto.ForwardResponse;
import com.metasrv.rpc.proto.InstallSnapshotRequest;
import com.metasrv.rpc.proto.InstallSnapshotResponse;
import com.metasrv.rpc.proto.VoteRequest;
import com.metasrv.rpc.proto.VoteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory transport for local testing.
 * All nodes share a static registry to find each other, by id and by address.
 */
public class LocalTransport implements RpcTransport {

    private static final Logger logger = LoggerFactory.getLogger(LocalTransport.class);

    // Shared registries of all nodes in the local cluster
    private static final Map<NodeId, RpcHandler> REGISTRY = new ConcurrentHashMap<>();
    private static final Map<String, RpcHandler> ADDRESSES = new ConcurrentHashMap<>();

    private final NodeId selfId;
    private final String address;
    private final ExecutorService executor;
    private final long networkDelayMs;

    public LocalTransport(NodeId selfId, String address) {
        this(selfId, address, 0);
    }

    public LocalTransport(NodeId selfId, String address, long networkDelayMs) {
        this.selfId = selfId;
        this.address = address;
        this.networkDelayMs = networkDelayMs;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "local-rpc-" + selfId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start(RpcHandler handler) {
        REGISTRY.put(selfId, handler);
        ADDRESSES.put(address, handler);
        logger.info("LocalTransport started for node {} at {}", selfId, address);
    }

    @Override
    public void shutdown() {
        REGISTRY.remove(selfId);
        ADDRESSES.remove(address);
        executor.shutdown();
        logger.info("LocalTransport shutdown for node {}", selfId);
    }

    @Override
    public void setAddressResolver(Function<NodeId, String> resolver) {
        // nodes are found by id in the shared registry
    }

    @Override
    public CompletableFuture<VoteResponse> sendVoteRequest(NodeId target, VoteRequest request) {
        return call(target, handler -> {
            logger.debug("{} -> {} VoteRequest(term={})", selfId, target, request.getTerm());
            VoteResponse response = handler.handleVoteRequest(request);
            logger.debug("{} <- {} VoteResponse(granted={})", selfId, target, response.getVoteGranted());
            return response;
        });
    }

    @Override
    public CompletableFuture<AppendEntriesResponse> sendAppendEntries(NodeId target, AppendEntriesRequest request) {
        return call(target, handler -> {
            if (request.getEntriesCount() == 0) {
                logger.trace("{} -> {} Heartbeat(term={})", selfId, target, request.getTerm());
            } else {
                logger.debug("{} -> {} AppendEntries(term={}, entries={})",
                        selfId, target, request.getTerm(), request.getEntriesCount());
            }
            return handler.handleAppendEntries(request);
        });
    }

    @Override
    public CompletableFuture<InstallSnapshotResponse> sendInstallSnapshot(NodeId target, InstallSnapshotRequest request) {
        return call(target, handler -> {
            logger.debug("{} -> {} InstallSnapshot(index={}, size={})",
                    selfId, target, request.getLastIncludedIndex(), request.getData().size());
            return handler.handleInstallSnapshot(request);
        });
    }

    @Override
    public CompletableFuture<ForwardResponse> sendForward(NodeId target, ForwardRequest request) {
        return call(target, handler -> {
            logger.debug("{} -> {} Forward({})", selfId, target, request.getBodyCase());
            return handler.handleForward(request);
        });
    }

    @Override
    public CompletableFuture<ForwardResponse> sendForward(String targetAddress, ForwardRequest request) {
        return supply(() -> {
            RpcHandler handler = ADDRESSES.get(targetAddress);
            if (handler == null) {
                throw new IllegalStateException("No node at address: " + targetAddress);
            }
            logger.debug("{} -> {} Forward({})", selfId, targetAddress, request.getBodyCase());
            return handler.handleForward(request);
        });
    }

    private <T> CompletableFuture<T> call(NodeId target, Function<RpcHandler, T> rpc) {
        return supply(() -> {
            RpcHandler handler = REGISTRY.get(target);
            if (handler == null) {
                throw new IllegalStateException("Node not found: " + target);
            }
            return rpc.apply(handler);
        });
    }

    private <T> CompletableFuture<T> supply(Supplier<T> rpc) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                simulateNetworkDelay();
                return rpc.get();
            }, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transport of " + selfId + " is shut down", e));
        }
    }

    private void simulateNetworkDelay() {
        if (networkDelayMs > 0) {
            try {
                Thread.sleep(networkDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Clear the registry. Useful for test cleanup.
     */
    public static void clearRegistry() {
        REGISTRY.clear();
        ADDRESSES.clear();
    }

    /**
     * Check if a node is registered.
     */
    public static boolean isRegistered(NodeId nodeId) {
        return REGISTRY.containsKey(nodeId);
    }
}
