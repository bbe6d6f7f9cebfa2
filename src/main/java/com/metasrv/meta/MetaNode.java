package com.metasrv.meta;

import com.google.protobuf.ByteString;
import com.metasrv.config.RaftConfig;
import com.metasrv.core.ForwardToLeaderException;
import com.metasrv.core.Membership;
import com.metasrv.core.MetricsWatcher;
import com.metasrv.core.NodeId;
import com.metasrv.core.RaftNode;
import com.metasrv.persistence.StorageException;
import com.metasrv.rpc.GrpcTransport;
import com.metasrv.rpc.RpcHandler;
import com.metasrv.rpc.RpcTransport;
import com.metasrv.rpc.proto.AppendEntriesRequest;
import com.metasrv.rpc.proto.AppendEntriesResponse;
import com.metasrv.rpc.proto.ForwardResponse;
import com.metasrv.rpc.proto.ForwardToLeader;
import com.metasrv.rpc.proto.InstallSnapshotRequest;
import com.metasrv.rpc.proto.InstallSnapshotResponse;
import com.metasrv.rpc.proto.VoteRequest;
import com.metasrv.rpc.proto.VoteResponse;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Command;
import com.metasrv.statemachine.MetaStateMachine;
import com.metasrv.statemachine.Node;
import com.metasrv.statemachine.SeqV;
import com.metasrv.store.MetaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A member of the metadata cluster: store, consensus node and transport wired
 * together.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #boot} - fresh storage, becomes the single voter of a new
 *       cluster and registers itself</li>
 *   <li>{@link #open} - existing storage, resumes the role it had</li>
 *   <li>{@link #openCreateBoot} - either of the above, or a created node with
 *       no membership that waits to be joined</li>
 * </ul>
 *
 * <h2>Forwarding</h2>
 * <p>Writes, joins and leaves may be sent to any node. A node that is not the
 * leader forwards the request to the leader it knows while the hop budget
 * lasts, otherwise it answers with {@link ForwardToLeaderException}.
 *
 * <p>Reads are served from the local state machine and may be stale on a
 * node that is not the leader.
 */
public class MetaNode implements RpcHandler, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MetaNode.class);

    private static final Duration BOOT_TIMEOUT = Duration.ofSeconds(10);

    private final RaftConfig config;
    private final NodeId id;
    private final MetaStore store;
    private final RpcTransport transport;
    private final RaftNode raftNode;

    private volatile boolean stopped = false;

    private MetaNode(RaftConfig config, MetaStore store, RpcTransport transport) {
        this.config = config;
        this.id = config.getNodeId();
        this.store = store;
        this.transport = transport;
        this.raftNode = new RaftNode(config, store, transport);
    }

    // ==================== Lifecycle ====================

    /**
     * Boots a single-node cluster on fresh storage, served over gRPC.
     */
    public static MetaNode boot(RaftConfig config) {
        return boot(config, grpcTransport(config));
    }

    /**
     * Boots a single-node cluster on fresh storage: the node becomes the only
     * voter, waits for its leadership and registers itself.
     *
     * @throws MetaNodeException if storage already exists
     */
    public static MetaNode boot(RaftConfig config, RpcTransport transport) {
        return openCreateBoot(config, false, true, true, transport);
    }

    /**
     * Opens a node on existing storage, served over gRPC.
     */
    public static MetaNode open(RaftConfig config) {
        return open(config, grpcTransport(config));
    }

    /**
     * Opens a node on existing storage. It resumes with the log, membership and
     * state it had when it stopped.
     *
     * @throws MetaNodeException if there is no storage
     */
    public static MetaNode open(RaftConfig config, RpcTransport transport) {
        return openCreateBoot(config, true, false, false, transport);
    }

    public static MetaNode openCreateBoot(RaftConfig config, boolean open, boolean create, boolean boot) {
        return openCreateBoot(config, open, create, boot, grpcTransport(config));
    }

    /**
     * Opens existing storage if {@code open} is allowed, or creates fresh
     * storage if {@code create} is allowed. With {@code boot}, a node on fresh
     * storage initializes a single-node cluster; otherwise it starts without
     * membership and waits to be joined. {@code boot} has no effect on opened
     * storage.
     *
     * @throws MetaNodeException if neither applies to the state of the storage
     * @throws StorageException if the storage is locked or corrupt
     */
    public static MetaNode openCreateBoot(RaftConfig config, boolean open, boolean create, boolean boot,
                                          RpcTransport transport) {
        MDC.put("nodeId", config.getNodeId().toString());

        boolean exists = MetaStore.exists(config.getDataDir());
        MetaStore store;
        if (exists) {
            if (!open) {
                throw new MetaNodeException("Storage exists at " + config.getDataDir() + " but open is not allowed");
            }
            store = MetaStore.open(config.getDataDir());
        } else {
            if (!create) {
                throw new MetaNodeException("No storage at " + config.getDataDir() + " and create is not allowed");
            }
            store = MetaStore.create(config.getDataDir());
        }

        MetaNode node = new MetaNode(config, store, transport);
        try {
            node.start();
            if (boot) {
                if (exists) {
                    logger.info("Storage at {} is already initialized, skipping boot", config.getDataDir());
                } else {
                    node.bootCluster();
                }
            }
        } catch (RuntimeException e) {
            node.stop();
            throw e;
        }

        logger.info("MetaNode {} started ({}): {}", config.getNodeId(), exists ? "opened" : "created", config);
        return node;
    }

    /**
     * Creates the gRPC transport for a node.
     */
    public static RpcTransport grpcTransport(RaftConfig config) {
        return new GrpcTransport(config.getNodeId(), config.getHost(), config.getPort(),
                config.getRpcTimeoutMs(), config.getForwardTimeoutMs(), config.getInstallSnapshotTimeoutMs());
    }

    private void start() {
        transport.setAddressResolver(this::resolveAddress);
        transport.start(this);
        raftNode.initialize();
    }

    private void bootCluster() {
        logger.info("Booting single-node cluster on {}", id);
        raftNode.initializeCluster(Membership.ofVoters(Set.of(id)));

        try {
            raftNode.metrics().awaitLeader(id, BOOT_TIMEOUT);
        } catch (TimeoutException e) {
            throw new MetaNodeException("Node " + id + " did not become leader after boot", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetaNodeException("Interrupted while booting " + id, e);
        }

        new MetaLeader(this).write(Command.addNode(config.toNode()));
        logger.info("Booted cluster, node {} registered at {}", id, config.getEndpoint());
    }

    /**
     * Asks an existing cluster to add this node, trying the configured join
     * addresses in order. Does nothing if no address is configured or this
     * node is already a member.
     *
     * @throws MetaNodeException if no address accepted the join
     */
    public void joinCluster() {
        joinCluster(config.getJoinAddresses());
    }

    public void joinCluster(List<String> addresses) {
        MDC.put("nodeId", id.toString());
        if (addresses.isEmpty()) {
            return;
        }
        if (raftNode.getMembership().contains(id)) {
            logger.info("Node {} is already a member, not joining", id);
            return;
        }

        ForwardRequest request = ForwardRequest.join(JoinRequest.of(config.toNode()), config.getForwardBudget());
        RuntimeException lastError = null;
        for (String address : addresses) {
            if (address.equals(config.getRaftAddress())) {
                continue;
            }
            try {
                logger.info("Joining cluster via {}", address);
                AppliedState result = decode(await(transport.sendForward(address, request.toProto()),
                        "join via " + address));
                logger.info("Joined cluster via {}: {}", address, result);
                return;
            } catch (ForwardToLeaderException | RetryableException | MetaNodeException e) {
                logger.warn("Join via {} failed: {}", address, e.getMessage());
                lastError = e;
            }
        }
        throw new MetaNodeException("Cannot join cluster via " + addresses, lastError);
    }

    /**
     * Stops the consensus node, the transport and the store.
     */
    public void stop() {
        MDC.put("nodeId", id.toString());
        if (stopped) {
            return;
        }
        stopped = true;
        logger.info("Stopping MetaNode {}", id);

        transport.shutdown();
        raftNode.stop();
        store.close();

        logger.info("MetaNode {} stopped", id);
    }

    @Override
    public void close() {
        stop();
    }

    // ==================== Forwarding ====================

    /**
     * Executes the request at the leader: locally if this node leads,
     * otherwise by forwarding it while the hop budget allows.
     *
     * @throws ForwardToLeaderException if this node is not the leader and may
     *                                  not forward, or knows no leader
     * @throws RetryableException if forwarding failed or timed out
     */
    public AppliedState handleForwardableRequest(ForwardRequest request) {
        MDC.put("nodeId", id.toString());

        if (raftNode.isLeader()) {
            return new MetaLeader(this).handle(request.body());
        }

        NodeId leaderId = raftNode.getLeaderId();
        if (request.forwardToLeader() == 0 || leaderId == null) {
            throw new ForwardToLeaderException(leaderId);
        }

        logger.debug("Forwarding {} to leader {}, budget {}", request.body(), leaderId,
                request.forwardToLeader() - 1);
        ForwardResponse response = await(transport.sendForward(leaderId, request.forwarded().toProto()),
                "forward to " + leaderId);
        return decode(response);
    }

    /**
     * Writes a command through the leader, forwarding with the configured
     * budget.
     */
    public AppliedState write(Command command) {
        return handleForwardableRequest(ForwardRequest.write(command, config.getForwardBudget()));
    }

    /**
     * Registers {@code node} and adds it to the cluster as a learner, through
     * the leader. Joining a member again only updates its descriptor.
     */
    public AppliedState join(Node node) {
        return handleForwardableRequest(ForwardRequest.join(JoinRequest.of(node), config.getForwardBudget()));
    }

    /**
     * Unregisters a node and removes it from the membership, through the
     * leader. The removed process is not stopped.
     */
    public AppliedState leave(NodeId nodeId) {
        return handleForwardableRequest(ForwardRequest.leave(nodeId, config.getForwardBudget()));
    }

    /**
     * Makes {@code voters} the voter set of the cluster. Leader only.
     *
     * @throws ForwardToLeaderException if this node is not the leader
     */
    public void changeVoters(Set<NodeId> voters) {
        if (!raftNode.isLeader()) {
            throw new ForwardToLeaderException(raftNode.getLeaderId());
        }
        new MetaLeader(this).changeVoters(voters);
    }

    private ForwardResponse await(CompletableFuture<ForwardResponse> future, String what) {
        try {
            return future.get(config.getForwardTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RetryableException("Timed out: " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryableException("Interrupted: " + what, e);
        } catch (ExecutionException e) {
            throw new RetryableException("Failed to " + what + ": " + e.getCause().getMessage(), e.getCause());
        }
    }

    private static AppliedState decode(ForwardResponse response) {
        return switch (response.getResultCase()) {
            case APPLIED_STATE -> AppliedState.fromBytes(response.getAppliedState().toByteArray());
            case FORWARD_TO_LEADER -> {
                ForwardToLeader hint = response.getForwardToLeader();
                throw new ForwardToLeaderException(hint.hasLeaderId() ? NodeId.of(hint.getLeaderId()) : null);
            }
            case RETRYABLE -> throw new RetryableException(response.getRetryable());
            case ERROR -> throw new MetaNodeException(response.getError());
            case RESULT_NOT_SET -> throw new MetaNodeException("Empty forward response");
        };
    }

    /**
     * Builds the wire form of a leader hint, with the leader's API address if
     * it is registered.
     */
    public ForwardToLeader forwardToLeader(NodeId leaderId) {
        ForwardToLeader.Builder builder = ForwardToLeader.newBuilder();
        if (leaderId != null) {
            builder.setLeaderId(leaderId.id());
            Node leader = getNode(leaderId);
            if (leader != null && leader.grpcApiAddress() != null) {
                builder.setLeaderApiAddress(leader.grpcApiAddress());
            }
        }
        return builder.build();
    }

    // ==================== RpcHandler ====================

    @Override
    public VoteResponse handleVoteRequest(VoteRequest request) {
        return raftNode.handleVoteRequest(request);
    }

    @Override
    public AppendEntriesResponse handleAppendEntries(AppendEntriesRequest request) {
        return raftNode.handleAppendEntries(request);
    }

    @Override
    public InstallSnapshotResponse handleInstallSnapshot(InstallSnapshotRequest request) {
        return raftNode.handleInstallSnapshot(request);
    }

    @Override
    public ForwardResponse handleForward(com.metasrv.rpc.proto.ForwardRequest request) {
        MDC.put("nodeId", id.toString());
        try {
            AppliedState result = handleForwardableRequest(ForwardRequest.fromProto(request));
            return ForwardResponse.newBuilder()
                    .setAppliedState(ByteString.copyFrom(result.toBytes()))
                    .build();
        } catch (ForwardToLeaderException e) {
            return ForwardResponse.newBuilder()
                    .setForwardToLeader(forwardToLeader(e.getLeaderId()))
                    .build();
        } catch (RetryableException e) {
            return ForwardResponse.newBuilder()
                    .setRetryable(e.getMessage())
                    .build();
        } catch (RuntimeException e) {
            logger.warn("Forwarded request failed", e);
            return ForwardResponse.newBuilder()
                    .setError(String.valueOf(e.getMessage()))
                    .build();
        }
    }

    private String resolveAddress(NodeId nodeId) {
        Node node = store.getStateMachine().getNode(nodeId);
        if (node != null) {
            return node.endpoint().toString();
        }
        return nodeId.equals(id) ? config.getRaftAddress() : null;
    }

    // ==================== Reads ====================

    /**
     * Returns the registered descriptor of a node, or {@code null}.
     */
    public Node getNode(NodeId nodeId) {
        return store.getStateMachine().getNode(nodeId);
    }

    public List<Node> listNodes() {
        return store.getStateMachine().listNodes();
    }

    /**
     * Returns the local value of a key, or {@code null} if absent or expired.
     */
    public SeqV getKv(String key) {
        return store.getStateMachine().getKv(key);
    }

    public Map<String, SeqV> mgetKv(List<String> keys) {
        return store.getStateMachine().mgetKv(keys);
    }

    public Map<String, SeqV> prefixList(String prefix) {
        return store.getStateMachine().prefixList(prefix);
    }

    // ==================== Getters ====================

    public NodeId getId() {
        return id;
    }

    public RaftConfig getConfig() {
        return config;
    }

    public RaftNode getRaftNode() {
        return raftNode;
    }

    public MetaStateMachine getStateMachine() {
        return store.getStateMachine();
    }

    /**
     * The leader this node knows, or {@code null}.
     */
    public NodeId getLeader() {
        return raftNode.getLeaderId();
    }

    public boolean isLeader() {
        return raftNode.isLeader();
    }

    public MetricsWatcher metrics() {
        return raftNode.metrics();
    }
}
