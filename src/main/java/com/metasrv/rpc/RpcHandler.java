package com.metasrv.rpc;

import com.metasrv.rpc.proto.AppendEntriesRequest;
import com.metasrv.rpc.proto.AppendEntriesResponse;
import com.metasrv.rpc.proto.ForwardRequest;
import com.metasrv.rpc.proto.ForwardResponse;
import com.metasrv.rpc.proto.InstallSnapshotRequest;
import com.metasrv.rpc.proto.InstallSnapshotResponse;
import com.metasrv.rpc.proto.VoteRequest;
import com.metasrv.rpc.proto.VoteResponse;

/**
 * Receives the node-to-node RPCs delivered by an {@link RpcTransport}.
 *
 * <p>Implemented by {@link com.metasrv.meta.MetaNode}, which hands the three
 * consensus RPCs to its {@link com.metasrv.core.RaftNode} and serves
 * {@code Forward} itself. Methods are called concurrently from transport
 * threads.
 *
 * @see RpcTransport
 */
public interface RpcHandler {

    /**
     * Handles a vote request from a candidate.
     */
    VoteResponse handleVoteRequest(VoteRequest request);

    /**
     * Handles replication or a heartbeat from the leader.
     */
    AppendEntriesResponse handleAppendEntries(AppendEntriesRequest request);

    /**
     * Handles a complete snapshot sent by the leader to a node whose next
     * needed log entry has been purged.
     */
    InstallSnapshotResponse handleInstallSnapshot(InstallSnapshotRequest request);

    /**
     * Handles a join, leave or write request routed from another node toward
     * the leader. Failures are reported inside the response, never thrown.
     */
    ForwardResponse handleForward(ForwardRequest request);
}
