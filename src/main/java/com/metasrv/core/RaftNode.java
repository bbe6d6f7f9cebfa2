package com.metasrv.core;

import com.metasrv.config.RaftConfig;
import com.metasrv.election.ElectionManager;
import com.metasrv.log.LogEntry;
import com.metasrv.log.LogManager;
import com.metasrv.persistence.HardState;
import com.metasrv.persistence.StorageException;
import com.metasrv.replication.ReplicationManager;
import com.metasrv.rpc.RpcTransport;
import com.metasrv.rpc.proto.AppendEntriesRequest;
import com.metasrv.rpc.proto.AppendEntriesResponse;
import com.metasrv.rpc.proto.EntryType;
import com.metasrv.rpc.proto.InstallSnapshotRequest;
import com.metasrv.rpc.proto.InstallSnapshotResponse;
import com.metasrv.rpc.proto.VoteRequest;
import com.metasrv.rpc.proto.VoteResponse;
import com.metasrv.snapshot.SnapshotMeta;
import com.metasrv.snapshot.SnapshotPolicy;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Command;
import com.metasrv.store.MetaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main Raft node implementation.
 *
 * Assembles election, replication, the log and the store, and coordinates
 * their interactions:
 * - role and term transitions happen under the monitor of {@link RaftState}
 * - log appends happen under the append lock, taken after that monitor
 * - committed entries are applied in order on a single apply thread, which
 *   also serializes the state machine for snapshots
 * - snapshot files are written and the log purged on a separate snapshot thread
 *
 * The effective membership is the latest MEMBERSHIP entry of the log. Voters
 * run as FOLLOWER / CANDIDATE / LEADER, every other node as LEARNER.
 * Every change is published to the {@link MetricsWatcher} returned by
 * {@link #metrics()}.
 */
public class RaftNode {

    private static final Logger logger = LoggerFactory.getLogger(RaftNode.class);

    private final NodeId id;
    private final RaftConfig config;
    private final MetaStore store;
    private final LogManager logManager;
    private final RaftState state;
    private final ElectionManager electionManager;
    private final ReplicationManager replicationManager;
    private final SnapshotPolicy snapshotPolicy;
    private final MetricsWatcher metrics;

    // Proposals of this leader waiting to be applied, by log index
    private final Map<Long, PendingProposal> pendingProposals = new ConcurrentHashMap<>();

    // Lock for log append operations
    private final ReentrantLock appendLock = new ReentrantLock();

    private final Object metricsLock = new Object();

    // Executor for applying committed entries
    private final ExecutorService applyExecutor;

    // Executor for writing snapshots and purging the log
    private final ExecutorService snapshotExecutor;
    private final AtomicBoolean snapshotInProgress = new AtomicBoolean(false);

    private volatile boolean stopped = false;

    // Set once local storage failed; the node then refuses all work
    private volatile StorageException fatalError;

    private record PendingProposal(long term, CompletableFuture<AppliedState> future) {
    }

    public RaftNode(RaftConfig config, MetaStore store, RpcTransport transport) {
        this.id = config.getNodeId();
        this.config = config;
        this.store = store;
        this.logManager = store.getLog();
        this.state = new RaftState();
        this.snapshotPolicy = config.getSnapshotPolicy();

        this.electionManager = new ElectionManager(
                id,
                state,
                transport,
                logManager::getLatestMembership,
                logManager::getLastIndex,
                logManager::getLastTerm,
                config.getElectionTimeoutMinMs(),
                config.getElectionTimeoutMaxMs()
        );

        this.replicationManager = new ReplicationManager(
                id,
                state,
                logManager,
                transport,
                logManager::getLatestMembership,
                store::loadSnapshot,
                config.getHeartbeatIntervalMs()
        );

        this.applyExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "apply-" + id);
            t.setDaemon(true);
            return t;
        });
        this.snapshotExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "snapshot-" + id);
            t.setDaemon(true);
            return t;
        });

        this.metrics = new MetricsWatcher(buildMetrics());

        // Wire up callbacks
        electionManager.setOnBecomeLeader(this::onBecomeLeader);
        electionManager.setOnBecomeFollower(this::onBecomeFollower);
        electionManager.setOnStateChanged(this::publishMetrics);
        replicationManager.setOnHigherTermDiscovered(this::onHigherTermDiscovered);
        replicationManager.setOnCommitAdvanced(this::applyCommittedEntries);
    }

    /**
     * Restores the hard state from the store and starts the election timer.
     * The store has already replayed everything it knows to be committed.
     */
    public void initialize() {
        MDC.put("nodeId", id.toString());

        HardState hardState = store.getHardState();
        synchronized (state) {
            state.restore(hardState.currentTerm(), hardState.votedFor());
            state.setPersistCallback((term, votedFor) -> store.saveHardState(new HardState(term, votedFor)));

            long applied = store.getLastApplied();
            state.setCommitIndex(applied);
            state.setLastApplied(applied);

            refreshRole();
        }

        electionManager.start();
        publishMetrics();

        logger.info("RaftNode {} initialized as {}: term={}, lastLogIndex={}, lastApplied={}, membership={}",
                id, state.getRole(), state.getCurrentTerm(), logManager.getLastIndex(),
                state.getLastApplied(), logManager.getLatestMembership());
    }

    /**
     * Writes the initial membership of a brand-new cluster as the first log
     * entry. A voter in it campaigns on the next election timeout.
     *
     * @throws IllegalStateException if the log or term is not pristine
     */
    public void initializeCluster(Membership membership) {
        MDC.put("nodeId", id.toString());
        synchronized (state) {
            if (logManager.getLastIndex() != 0 || state.getCurrentTerm() != 0) {
                throw new IllegalStateException("Node " + id + " is already initialized: lastIndex="
                        + logManager.getLastIndex() + ", term=" + state.getCurrentTerm());
            }
            appendLock.lock();
            try {
                logManager.append(0, EntryType.MEMBERSHIP, membership.toBytes());
            } finally {
                appendLock.unlock();
            }
            refreshRole();
        }
        logger.info("Initialized cluster with {}", membership);
        publishMetrics();
    }

    /**
     * Stop the Raft node. The store and transport are owned by the caller.
     */
    public void stop() {
        MDC.put("nodeId", id.toString());
        if (stopped) {
            return;
        }
        stopped = true;
        logger.info("Stopping RaftNode {}", id);

        replicationManager.shutdown();
        electionManager.stop();

        awaitShutdown(applyExecutor, "apply");
        awaitShutdown(snapshotExecutor, "snapshot");

        failPending(new IllegalStateException("Node " + id + " stopped"));
        metrics.close();

        logger.info("RaftNode {} stopped", id);
    }

    private void awaitShutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("{} executor did not terminate in time", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ==================== Proposals ====================

    /**
     * Submit a command to the Raft cluster.
     * Only the leader can accept commands.
     *
     * @param command the command to execute
     * @return future that completes with the applied result once the command
     *         is committed and applied; fails with
     *         {@link ForwardToLeaderException} if this node is not, or stops
     *         being, the leader
     */
    public CompletableFuture<AppliedState> propose(Command command) {
        return proposeEntry(EntryType.NORMAL, command.toBytes());
    }

    /**
     * Proposes a new membership. Single-step: at most one membership change
     * may be uncommitted at a time, a second one fails with
     * {@link MembershipChangeInProgressException}. Proposing the effective
     * membership again completes immediately.
     */
    public CompletableFuture<AppliedState> changeMembership(Membership membership) {
        if (membership.voters().isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Membership needs at least one voter: " + membership));
        }
        if (membership.equals(logManager.getLatestMembership())) {
            return CompletableFuture.completedFuture(AppliedState.NOTHING);
        }
        return proposeEntry(EntryType.MEMBERSHIP, membership.toBytes());
    }

    private CompletableFuture<AppliedState> proposeEntry(EntryType type, byte[] payload) {
        MDC.put("nodeId", id.toString());

        synchronized (state) {
            if (fatalError != null) {
                return CompletableFuture.failedFuture(fatalError);
            }
            if (!state.isLeader() || stopped) {
                return CompletableFuture.failedFuture(new ForwardToLeaderException(state.getLeaderId()));
            }

            LogEntry entry;
            PendingProposal pending;
            appendLock.lock();
            try {
                if (type == EntryType.MEMBERSHIP) {
                    LogEntry inProgress = uncommittedMembership();
                    if (inProgress != null) {
                        return CompletableFuture.failedFuture(
                                new MembershipChangeInProgressException(inProgress.index(), inProgress.membership()));
                    }
                }
                long term = state.getCurrentTerm();
                entry = logManager.append(term, type, payload);
                pending = new PendingProposal(term, new CompletableFuture<>());
                pendingProposals.put(entry.index(), pending);
            } catch (StorageException e) {
                return CompletableFuture.failedFuture(e);
            } finally {
                appendLock.unlock();
            }

            logger.debug("Proposed {}", entry);
            if (entry.isMembership()) {
                logger.info("Proposed membership change at index {}: {}", entry.index(), entry.membership());
            }

            replicationManager.triggerReplication();
            publishMetrics();
            return pending.future();
        }
    }

    private LogEntry uncommittedMembership() {
        LogEntry pending = null;
        for (LogEntry entry : logManager.getEntries(state.getCommitIndex() + 1, logManager.getLastIndex())) {
            if (entry.isMembership()) {
                pending = entry;
            }
        }
        return pending;
    }

    private void failPending(Throwable cause) {
        for (Long index : new ArrayList<>(pendingProposals.keySet())) {
            PendingProposal pending = pendingProposals.remove(index);
            if (pending != null) {
                pending.future().completeExceptionally(cause);
            }
        }
    }

    // ==================== Callbacks ====================

    private void onBecomeLeader() {
        MDC.put("nodeId", id.toString());
        synchronized (state) {
            long term = state.getCurrentTerm();
            logger.info("Became LEADER for term {}", term);
            electionManager.cancelElectionTimer();

            // A blank entry of the new term lets earlier entries commit
            appendLock.lock();
            try {
                logManager.append(term, EntryType.BLANK, new byte[0]);
            } finally {
                appendLock.unlock();
            }

            replicationManager.start();
        }
        publishMetrics();
    }

    private void onBecomeFollower() {
        MDC.put("nodeId", id.toString());
        synchronized (state) {
            stepDown();
        }
        publishMetrics();
    }

    // Caller holds the state monitor
    private void stepDown() {
        logger.debug("Stepping down in term {}", state.getCurrentTerm());
        replicationManager.stop();
        if (state.isLeader() || state.isCandidate()) {
            state.setRole(Role.FOLLOWER);
        }
        refreshRole();
        electionManager.resetElectionTimer();

        // Fail pending requests - we're no longer leader
        failPending(new ForwardToLeaderException(state.getLeaderId()));
    }

    private void onHigherTermDiscovered(long newTerm) {
        MDC.put("nodeId", id.toString());
        synchronized (state) {
            if (state.updateTerm(newTerm)) {
                stepDown();
            }
        }
        publishMetrics();
    }

    /**
     * Keeps the role consistent with the effective membership. Leaders are
     * demoted when their removal is applied, see {@link #onMembershipApplied()}.
     * Caller holds the state monitor.
     */
    private void refreshRole() {
        Role role = state.getRole();
        if (role == Role.LEADER) {
            return;
        }
        boolean voter = logManager.getLatestMembership().isVoter(id);
        if (role == Role.LEARNER && voter) {
            logger.info("Became voter, now FOLLOWER");
            state.setRole(Role.FOLLOWER);
            electionManager.resetElectionTimer();
        } else if (role != Role.LEARNER && !voter) {
            logger.info("Not a voter, now LEARNER");
            state.setRole(Role.LEARNER);
        }
    }

    private void onMembershipApplied() {
        synchronized (state) {
            if (state.isLeader() && !logManager.getLatestMembership().isVoter(id)) {
                logger.info("Removed from voters, stepping down in term {}", state.getCurrentTerm());
                state.setRole(Role.LEARNER);
                state.setLeaderId(null);
                replicationManager.stop();
                failPending(new ForwardToLeaderException(null));
                electionManager.resetElectionTimer();
            }
        }
    }

    // ==================== Apply ====================

    /**
     * Apply committed entries to state machine.
     */
    private void applyCommittedEntries() {
        try {
            applyExecutor.execute(this::applyCommitted);
        } catch (RejectedExecutionException e) {
            logger.debug("Apply executor is shut down");
        }
    }

    private void applyCommitted() {
        MDC.put("nodeId", id.toString());

        long commitIndex = state.getCommitIndex();
        long lastApplied = store.getLastApplied();
        if (lastApplied >= commitIndex) {
            return;
        }

        try {
            for (LogEntry entry : store.entriesToApply(lastApplied, commitIndex)) {
                AppliedState result = store.apply(entry);
                state.setLastApplied(entry.index());
                logger.debug("Applied entry {}: {}", entry.index(), result);

                PendingProposal pending = pendingProposals.remove(entry.index());
                if (pending != null) {
                    if (pending.term() == entry.term()) {
                        pending.future().complete(result);
                    } else {
                        // Our entry was overwritten by another leader's
                        pending.future().completeExceptionally(new ForwardToLeaderException(state.getLeaderId()));
                    }
                }

                if (entry.isMembership()) {
                    onMembershipApplied();
                }
            }

            store.saveCommitted(state.getLastApplied());
            maybeSnapshot();
        } catch (StorageException e) {
            logger.error("Failed to apply committed entries up to {}", commitIndex, e);
            halt(e);
            return;
        }

        publishMetrics();
    }

    /**
     * Halts the node after a local storage failure. Runs on the apply thread.
     * Pending proposals fail with the error, timers and replication stop, the
     * metrics stream is closed, and proposals and RPCs are refused from now
     * on. The store stays open until the owner stops the node.
     */
    private void halt(StorageException cause) {
        synchronized (state) {
            if (fatalError != null) {
                return;
            }
            fatalError = cause;
        }
        logger.error("Halting node {} after storage failure", id);

        replicationManager.shutdown();
        electionManager.stop();
        applyExecutor.shutdown();
        snapshotExecutor.shutdown();

        failPending(cause);
        metrics.close();
    }

    private void checkNotHalted() {
        StorageException fatal = fatalError;
        if (fatal != null) {
            throw new StorageException("Node " + id + " halted after storage failure: " + fatal.getMessage(), fatal);
        }
    }

    // ==================== Snapshot Operations ====================

    /**
     * Check if we should take a snapshot. Runs on the apply thread.
     */
    private void maybeSnapshot() {
        SnapshotMeta last = store.getSnapshotMeta();
        long lastSnapshotIndex = last != null ? last.lastIncludedIndex() : 0;
        if (snapshotPolicy.shouldSnapshot(store.getLastApplied(), lastSnapshotIndex)) {
            takeSnapshot();
        }
    }

    /**
     * Serializes the state machine at the last applied index and hands it to
     * the snapshot thread. Runs on the apply thread.
     *
     * @return future of the written snapshot's metadata; the latest existing
     *         snapshot if there is nothing new or a snapshot is being written
     */
    private CompletableFuture<SnapshotMeta> takeSnapshot() {
        SnapshotMeta last = store.getSnapshotMeta();
        long index = store.getLastApplied();
        if (index == 0 || (last != null && index <= last.lastIncludedIndex())) {
            return CompletableFuture.completedFuture(last);
        }
        if (!snapshotInProgress.compareAndSet(false, true)) {
            logger.debug("Snapshot already in progress, skipping index {}", index);
            return CompletableFuture.completedFuture(last);
        }

        SnapshotMeta meta = new SnapshotMeta(index, logManager.getTerm(index), logManager.getMembershipAt(index));
        byte[] data;
        try {
            data = store.getStateMachine().takeSnapshot();
        } catch (RuntimeException e) {
            snapshotInProgress.set(false);
            return CompletableFuture.failedFuture(e);
        }
        long purgeUpTo = snapshotPolicy.purgeUpTo(index);

        logger.info("Taking snapshot at index {}, term {}, purging up to {}",
                index, meta.lastIncludedTerm(), purgeUpTo);

        try {
            return CompletableFuture.supplyAsync(() -> {
                MDC.put("nodeId", id.toString());
                store.saveSnapshot(meta, data, purgeUpTo);
                logger.info("Snapshot complete: {} bytes, {} log entries remaining",
                        data.length, logManager.size());
                publishMetrics();
                return meta;
            }, snapshotExecutor).whenComplete((m, e) -> {
                snapshotInProgress.set(false);
                if (e != null) {
                    logger.error("Failed to write snapshot at index {}", index, e);
                }
            });
        } catch (RejectedExecutionException e) {
            snapshotInProgress.set(false);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Manually trigger a snapshot of everything applied so far (for operators
     * and tests).
     *
     * @return future of the metadata of the snapshot covering the applied state
     */
    public CompletableFuture<SnapshotMeta> triggerSnapshot() {
        try {
            return CompletableFuture.supplyAsync(() -> {
                MDC.put("nodeId", id.toString());
                return takeSnapshot();
            }, applyExecutor).thenCompose(f -> f);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Node " + id + " stopped", e));
        }
    }

    // ==================== RPC Handling ====================

    public VoteResponse handleVoteRequest(VoteRequest request) {
        MDC.put("nodeId", id.toString());
        checkNotHalted();
        VoteResponse response;
        synchronized (state) {
            response = electionManager.handleVoteRequest(request);
            refreshRole();
        }
        publishMetrics();
        return response;
    }

    public AppendEntriesResponse handleAppendEntries(AppendEntriesRequest request) {
        MDC.put("nodeId", id.toString());
        checkNotHalted();

        AppendEntriesResponse response;
        boolean commitAdvanced = false;

        synchronized (state) {
            long currentTerm = state.getCurrentTerm();
            long requestTerm = request.getTerm();

            // Reject if request term < current term
            if (requestTerm < currentTerm) {
                return AppendEntriesResponse.newBuilder()
                        .setTerm(currentTerm)
                        .setSuccess(false)
                        .build();
            }

            // If request term > current term, update term (will be persisted)
            if (requestTerm > currentTerm) {
                state.updateTerm(requestTerm);
                currentTerm = requestTerm;
                stepDown();
            } else if (state.isLeader()) {
                logger.error("Two leaders in term {}: {} and {}", currentTerm, id, request.getLeaderId());
                return AppendEntriesResponse.newBuilder()
                        .setTerm(currentTerm)
                        .setSuccess(false)
                        .build();
            } else if (state.isCandidate()) {
                // Another candidate won this term
                state.setRole(Role.FOLLOWER);
            }

            // Valid message from leader
            NodeId leaderId = NodeId.of(request.getLeaderId());
            if (!leaderId.equals(state.getLeaderId())) {
                logger.info("Following leader {} in term {}", leaderId, currentTerm);
            }
            state.setLeaderId(leaderId);
            electionManager.recordLeaderContact();

            long prevLogIndex = request.getPrevLogIndex();
            long prevLogTerm = request.getPrevLogTerm();

            // Entries up to the purge point are committed and need no check
            if (prevLogIndex > 0 && prevLogIndex >= logManager.getPurgedIndex()) {
                // We don't have this entry
                if (prevLogIndex > logManager.getLastIndex()) {
                    logger.debug("Missing entry at index {}", prevLogIndex);
                    response = AppendEntriesResponse.newBuilder()
                            .setTerm(currentTerm)
                            .setSuccess(false)
                            .setConflictIndex(logManager.getLastIndex() + 1)
                            .build();
                    refreshRole();
                    return publishAndReturn(response);
                }

                long myTermAtPrev = logManager.getTerm(prevLogIndex);
                if (myTermAtPrev != prevLogTerm) {
                    logger.debug("Term mismatch at index {}: {} != {}", prevLogIndex, myTermAtPrev, prevLogTerm);
                    // Find first index of conflicting term
                    long conflictIndex = prevLogIndex;
                    while (conflictIndex > logManager.getPurgedIndex() + 1
                            && logManager.getTerm(conflictIndex - 1) == myTermAtPrev) {
                        conflictIndex--;
                    }
                    response = AppendEntriesResponse.newBuilder()
                            .setTerm(currentTerm)
                            .setSuccess(false)
                            .setConflictTerm(myTermAtPrev)
                            .setConflictIndex(conflictIndex)
                            .build();
                    refreshRole();
                    return publishAndReturn(response);
                }
            }

            // Append entries (will be persisted)
            if (request.getEntriesCount() > 0) {
                List<LogEntry> entries = request.getEntriesList().stream()
                        .map(LogEntry::fromProto)
                        .toList();

                boolean success;
                appendLock.lock();
                try {
                    success = logManager.appendEntries(prevLogIndex, prevLogTerm, entries);
                } finally {
                    appendLock.unlock();
                }
                if (!success) {
                    response = AppendEntriesResponse.newBuilder()
                            .setTerm(currentTerm)
                            .setSuccess(false)
                            .build();
                    return publishAndReturn(response);
                }

                logger.debug("Appended {} entries, last index now {}", entries.size(), logManager.getLastIndex());
            }

            refreshRole();

            long lastNewIndex = prevLogIndex + request.getEntriesCount();

            // Update commit index
            if (request.getLeaderCommit() > state.getCommitIndex()) {
                long newCommit = Math.min(request.getLeaderCommit(), lastNewIndex);
                commitAdvanced = state.advanceCommitIndex(newCommit);
            }

            response = AppendEntriesResponse.newBuilder()
                    .setTerm(currentTerm)
                    .setSuccess(true)
                    .setMatchIndex(lastNewIndex)
                    .build();
        }

        if (commitAdvanced) {
            applyCommittedEntries();
        }
        return publishAndReturn(response);
    }

    private <T> T publishAndReturn(T response) {
        publishMetrics();
        return response;
    }

    public InstallSnapshotResponse handleInstallSnapshot(InstallSnapshotRequest request) {
        MDC.put("nodeId", id.toString());
        checkNotHalted();

        long currentTerm;
        synchronized (state) {
            currentTerm = state.getCurrentTerm();
            long requestTerm = request.getTerm();

            // Reject if request term < current term
            if (requestTerm < currentTerm) {
                return InstallSnapshotResponse.newBuilder()
                        .setTerm(currentTerm)
                        .setInstalled(false)
                        .build();
            }

            if (requestTerm > currentTerm) {
                state.updateTerm(requestTerm);
                currentTerm = requestTerm;
                stepDown();
            } else if (state.isCandidate()) {
                state.setRole(Role.FOLLOWER);
            }

            // Valid message from leader
            state.setLeaderId(NodeId.of(request.getLeaderId()));
            electionManager.recordLeaderContact();
        }

        SnapshotMeta meta = new SnapshotMeta(
                request.getLastIncludedIndex(),
                request.getLastIncludedTerm(),
                new Membership(toNodeIds(request.getVotersList()), toNodeIds(request.getLearnersList())));
        byte[] data = request.getData().toByteArray();

        boolean installed;
        try {
            installed = CompletableFuture.supplyAsync(() -> installSnapshot(meta, data), applyExecutor)
                    .get(config.getInstallSnapshotTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            installed = false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            logger.error("Failed to install snapshot {}", meta, e);
            installed = false;
        }

        publishMetrics();
        return InstallSnapshotResponse.newBuilder()
                .setTerm(currentTerm)
                .setInstalled(installed)
                .build();
    }

    /**
     * Replaces log and state machine with a snapshot from the leader. Runs on
     * the apply thread so no entry is applied concurrently.
     */
    private boolean installSnapshot(SnapshotMeta meta, byte[] data) {
        MDC.put("nodeId", id.toString());

        if (meta.lastIncludedIndex() <= store.getLastApplied()) {
            logger.debug("Snapshot {} already covered, lastApplied={}", meta, store.getLastApplied());
            return true;
        }

        logger.info("Installing snapshot: lastIndex={}, lastTerm={}, size={}",
                meta.lastIncludedIndex(), meta.lastIncludedTerm(), data.length);

        synchronized (state) {
            appendLock.lock();
            try {
                store.installSnapshot(meta, data);
            } finally {
                appendLock.unlock();
            }
            state.advanceCommitIndex(meta.lastIncludedIndex());
            state.setLastApplied(meta.lastIncludedIndex());
            refreshRole();
        }

        logger.info("Snapshot installed successfully");
        return true;
    }

    private static Set<NodeId> toNodeIds(List<Long> ids) {
        Set<NodeId> result = new TreeSet<>();
        for (Long id : ids) {
            result.add(NodeId.of(id));
        }
        return result;
    }

    // ==================== Metrics ====================

    private RaftMetrics buildMetrics() {
        return new RaftMetrics(
                id,
                state.getRole(),
                state.getCurrentTerm(),
                state.getLeaderId(),
                logManager.getLastIndex(),
                state.getLastApplied(),
                logManager.getLatestMembership(),
                store.getSnapshotMeta()
        );
    }

    private void publishMetrics() {
        synchronized (metricsLock) {
            metrics.publish(buildMetrics());
        }
    }

    /**
     * The stream of metrics of this node. Closed when the node stops.
     */
    public MetricsWatcher metrics() {
        return metrics;
    }

    // ==================== Getters ====================

    public NodeId getId() {
        return id;
    }

    /**
     * The storage failure that halted this node, or {@code null} while healthy.
     */
    public StorageException getFatalError() {
        return fatalError;
    }

    public RaftState getState() {
        return state;
    }

    public MetaStore getStore() {
        return store;
    }

    public Membership getMembership() {
        return logManager.getLatestMembership();
    }

    public boolean isLeader() {
        return state.isLeader();
    }

    public NodeId getLeaderId() {
        return state.getLeaderId();
    }

    public long getCurrentTerm() {
        return state.getCurrentTerm();
    }

    public long getCommitIndex() {
        return state.getCommitIndex();
    }

    public long getLastApplied() {
        return state.getLastApplied();
    }
}
