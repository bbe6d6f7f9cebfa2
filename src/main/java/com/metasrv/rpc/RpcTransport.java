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

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Node-to-node communication.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link LocalTransport} - in-memory transport for tests (single process)</li>
 *   <li>{@link GrpcTransport} - gRPC transport over the network</li>
 * </ul>
 *
 * <h2>Addressing</h2>
 * <p>Targets are node ids. The transport learns where a node lives from the
 * address resolver installed with {@link #setAddressResolver(Function)}; the
 * meta node resolves ids through its node registry. A node that is not a
 * member yet can only be reached by address, which is what
 * {@link #sendForward(String, ForwardRequest)} is for.
 *
 * <p>All send methods are asynchronous. A future that completes exceptionally
 * means the outcome on the remote side is unknown.
 *
 * @see RpcHandler
 */
public interface RpcTransport {

    CompletableFuture<VoteResponse> sendVoteRequest(NodeId target, VoteRequest request);

    CompletableFuture<AppendEntriesResponse> sendAppendEntries(NodeId target, AppendEntriesRequest request);

    CompletableFuture<InstallSnapshotResponse> sendInstallSnapshot(NodeId target, InstallSnapshotRequest request);

    CompletableFuture<ForwardResponse> sendForward(NodeId target, ForwardRequest request);

    /**
     * Sends a forward request to a node known only by its transport address
     * ({@code host:port}).
     */
    CompletableFuture<ForwardResponse> sendForward(String address, ForwardRequest request);

    /**
     * Installs the function mapping node ids to transport addresses. It may
     * return {@code null} for an unknown node.
     */
    void setAddressResolver(Function<NodeId, String> resolver);

    /**
     * Starts accepting incoming RPCs and hands them to {@code handler}.
     */
    void start(RpcHandler handler);

    /**
     * Stops accepting RPCs, closes connections and releases threads.
     */
    void shutdown();
}
