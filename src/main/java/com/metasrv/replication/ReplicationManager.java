package com.metasrv.replication;

import com.google.protobuf.ByteString;
import com.metasrv.core.Membership;
import com.metasrv.core.NodeId;
import com.metasrv.core.RaftState;
import com.metasrv.log.LogEntry;
import com.metasrv.log.LogManager;
import com.metasrv.rpc.RpcTransport;
import com.metasrv.rpc.proto.AppendEntriesRequest;
import com.metasrv.rpc.proto.AppendEntriesResponse;
import com.metasrv.rpc.proto.InstallSnapshotRequest;
import com.metasrv.rpc.proto.InstallSnapshotResponse;
import com.metasrv.snapshot.Snapshot;
import com.metasrv.snapshot.SnapshotMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Manages log replication from leader to followers and learners.
 *
 * Leader maintains for each replication target:
 * - nextIndex: next log entry to send (initialized lazily to leader's last log index + 1)
 * - matchIndex: highest log entry known to be replicated (initialized to 0)
 *
 * Targets are all members of the effective membership except the leader
 * itself; only voters count toward the commit quorum. A target whose next
 * entry was purged after a snapshot receives the latest snapshot instead, and
 * incremental replication resumes after it.
 *
 * At most one request per target is in flight.
 */
public class ReplicationManager {

    private static final Logger logger = LoggerFactory.getLogger(ReplicationManager.class);

    private static final int MAX_ENTRIES_PER_REQUEST = 256;

    private final NodeId selfId;
    private final RaftState state;
    private final LogManager logManager;
    private final RpcTransport transport;
    private final Supplier<Membership> membershipSupplier;
    private final Supplier<Snapshot> snapshotSupplier;
    private final long heartbeatIntervalMs;

    // Per-target replication state
    private final Map<NodeId, Long> nextIndex = new ConcurrentHashMap<>();
    private final Map<NodeId, Long> matchIndex = new ConcurrentHashMap<>();
    private final Set<NodeId> inFlight = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> replicationTask;

    private Consumer<Long> onHigherTermDiscovered;
    private Runnable onCommitAdvanced;

    public ReplicationManager(
            NodeId selfId,
            RaftState state,
            LogManager logManager,
            RpcTransport transport,
            Supplier<Membership> membershipSupplier,
            Supplier<Snapshot> snapshotSupplier,
            long heartbeatIntervalMs) {
        this.selfId = selfId;
        this.state = state;
        this.logManager = logManager;
        this.transport = transport;
        this.membershipSupplier = membershipSupplier;
        this.snapshotSupplier = snapshotSupplier;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "replication-" + selfId);
            t.setDaemon(true);
            return t;
        });
    }

    public void setOnHigherTermDiscovered(Consumer<Long> callback) {
        this.onHigherTermDiscovered = callback;
    }

    public void setOnCommitAdvanced(Runnable callback) {
        this.onCommitAdvanced = callback;
    }

    /**
     * Start replication. Called when becoming leader.
     */
    public synchronized void start() {
        MDC.put("nodeId", selfId.toString());
        logger.info("ReplicationManager started for term {}", state.getCurrentTerm());

        nextIndex.clear();
        matchIndex.clear();

        if (replicationTask != null) {
            replicationTask.cancel(false);
        }
        try {
            // Immediately send heartbeats, then periodically
            replicationTask = scheduler.scheduleAtFixedRate(
                    this::replicateToAll,
                    0,
                    heartbeatIntervalMs,
                    TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            logger.debug("Replication scheduler is shut down");
        }
    }

    /**
     * Stop replication. Called when no longer leader.
     */
    public synchronized void stop() {
        if (replicationTask != null) {
            replicationTask.cancel(false);
            replicationTask = null;
            logger.info("ReplicationManager stopped");
        }
        nextIndex.clear();
        matchIndex.clear();
    }

    /**
     * Shutdown completely.
     */
    public void shutdown() {
        stop();
        scheduler.shutdown();
    }

    /**
     * Trigger immediate replication (e.g., after new log entry).
     */
    public void triggerReplication() {
        try {
            scheduler.execute(this::replicateToAll);
        } catch (RejectedExecutionException e) {
            logger.debug("Replication scheduler is shut down");
        }
    }

    private void replicateToAll() {
        MDC.put("nodeId", selfId.toString());

        if (!state.isLeader()) {
            return;
        }

        try {
            Membership membership = membershipSupplier.get();
            Set<NodeId> targets = membership.allMembers();

            // Forget removed members
            nextIndex.keySet().retainAll(targets);
            matchIndex.keySet().retainAll(targets);

            for (NodeId peer : targets) {
                if (!peer.equals(selfId)) {
                    replicateTo(peer);
                }
            }

            // A single voter commits alone; a shrunk voter set may commit now
            tryAdvanceCommitIndex();
        } catch (RuntimeException e) {
            // Keep the periodic task alive
            logger.error("Replication round failed", e);
        }
    }

    private void replicateTo(NodeId peer) {
        if (!inFlight.add(peer)) {
            return;
        }

        long term = state.getCurrentTerm();
        long peerNextIndex = nextIndex.computeIfAbsent(peer, p -> logManager.getLastIndex() + 1);

        if (peerNextIndex <= logManager.getPurgedIndex()) {
            sendSnapshot(peer, term);
            return;
        }

        long prevLogIndex = peerNextIndex - 1;
        long prevLogTerm = logManager.getTerm(prevLogIndex);

        List<LogEntry> entries = logManager.getEntries(peerNextIndex,
                peerNextIndex + MAX_ENTRIES_PER_REQUEST - 1);

        AppendEntriesRequest.Builder requestBuilder = AppendEntriesRequest.newBuilder()
                .setTerm(term)
                .setLeaderId(selfId.id())
                .setPrevLogIndex(prevLogIndex)
                .setPrevLogTerm(prevLogTerm)
                .setLeaderCommit(state.getCommitIndex());

        for (LogEntry entry : entries) {
            requestBuilder.addEntries(entry.toProto());
        }

        AppendEntriesRequest request = requestBuilder.build();

        if (!entries.isEmpty()) {
            logger.debug("Replicating {} entries to {} (nextIndex={})", entries.size(), peer, peerNextIndex);
        }

        transport.sendAppendEntries(peer, request)
                .whenComplete((response, error) -> {
                    inFlight.remove(peer);
                    if (error != null) {
                        logger.trace("Replication to {} failed: {}", peer, error.getMessage());
                        return;
                    }
                    handleResponse(peer, term, request, response);
                });
    }

    private void handleResponse(NodeId peer, long sentTerm, AppendEntriesRequest request,
                                AppendEntriesResponse response) {
        MDC.put("nodeId", selfId.toString());

        if (response.getTerm() > state.getCurrentTerm()) {
            logger.info("Discovered higher term {} from {}", response.getTerm(), peer);
            if (onHigherTermDiscovered != null) {
                onHigherTermDiscovered.accept(response.getTerm());
            }
            return;
        }

        if (!state.isLeader() || state.getCurrentTerm() != sentTerm) {
            return;
        }

        if (response.getSuccess()) {
            long newMatchIndex = request.getPrevLogIndex() + request.getEntriesCount();
            long currentMatch = matchIndex.getOrDefault(peer, 0L);
            if (newMatchIndex > currentMatch || !matchIndex.containsKey(peer)) {
                matchIndex.put(peer, Math.max(newMatchIndex, currentMatch));
                nextIndex.put(peer, Math.max(newMatchIndex, currentMatch) + 1);

                if (request.getEntriesCount() > 0) {
                    logger.debug("Replication to {} succeeded, matchIndex={}", peer, newMatchIndex);
                }

                tryAdvanceCommitIndex();
            }
        } else {
            // Use conflict info if available for faster rollback
            long current = nextIndex.getOrDefault(peer, 1L);
            long newNextIndex;
            if (response.getConflictIndex() > 0) {
                newNextIndex = Math.min(response.getConflictIndex(), current - 1);
            } else {
                newNextIndex = current - 1;
            }
            newNextIndex = Math.max(newNextIndex, matchIndex.getOrDefault(peer, 0L) + 1);
            nextIndex.put(peer, Math.max(1, newNextIndex));
            logger.debug("Replication to {} rejected, nextIndex moved to {}", peer, nextIndex.get(peer));
        }

        // Keep going while the target is behind
        if (nextIndex.getOrDefault(peer, Long.MAX_VALUE) <= logManager.getLastIndex()) {
            triggerReplicationTo(peer);
        }
    }

    private void triggerReplicationTo(NodeId peer) {
        try {
            scheduler.execute(() -> {
                MDC.put("nodeId", selfId.toString());
                if (state.isLeader()) {
                    replicateTo(peer);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Replication scheduler is shut down");
        }
    }

    // ==================== Snapshot transfer ====================

    private void sendSnapshot(NodeId peer, long term) {
        Snapshot snapshot;
        try {
            snapshot = snapshotSupplier.get();
        } catch (RuntimeException e) {
            inFlight.remove(peer);
            logger.error("Cannot read snapshot for {}", peer, e);
            return;
        }
        if (snapshot == null) {
            inFlight.remove(peer);
            logger.warn("Log of {} is purged to {} but no snapshot is available",
                    peer, logManager.getPurgedIndex());
            return;
        }

        SnapshotMeta meta = snapshot.meta();
        InstallSnapshotRequest.Builder request = InstallSnapshotRequest.newBuilder()
                .setTerm(term)
                .setLeaderId(selfId.id())
                .setLastIncludedIndex(meta.lastIncludedIndex())
                .setLastIncludedTerm(meta.lastIncludedTerm())
                .setData(ByteString.copyFrom(snapshot.data()));
        for (NodeId voter : meta.membership().voters()) {
            request.addVoters(voter.id());
        }
        for (NodeId learner : meta.membership().learners()) {
            request.addLearners(learner.id());
        }

        logger.info("Sending snapshot to {}: index={}, term={}, {} bytes",
                peer, meta.lastIncludedIndex(), meta.lastIncludedTerm(), snapshot.data().length);

        transport.sendInstallSnapshot(peer, request.build())
                .whenComplete((response, error) -> {
                    inFlight.remove(peer);
                    MDC.put("nodeId", selfId.toString());
                    if (error != null) {
                        logger.warn("InstallSnapshot to {} failed: {}", peer, error.getMessage());
                        return;
                    }
                    handleSnapshotResponse(peer, term, meta, response);
                });
    }

    private void handleSnapshotResponse(NodeId peer, long sentTerm, SnapshotMeta meta,
                                        InstallSnapshotResponse response) {
        if (response.getTerm() > state.getCurrentTerm()) {
            logger.info("Discovered higher term {} from {}", response.getTerm(), peer);
            if (onHigherTermDiscovered != null) {
                onHigherTermDiscovered.accept(response.getTerm());
            }
            return;
        }

        if (!state.isLeader() || state.getCurrentTerm() != sentTerm || !response.getInstalled()) {
            return;
        }

        long installed = meta.lastIncludedIndex();
        if (installed > matchIndex.getOrDefault(peer, 0L)) {
            matchIndex.put(peer, installed);
        }
        nextIndex.put(peer, matchIndex.get(peer) + 1);
        logger.info("Snapshot {} installed on {}", installed, peer);

        tryAdvanceCommitIndex();
        triggerReplicationTo(peer);
    }

    // ==================== Commit ====================

    /**
     * Try to advance commit index based on matchIndex values.
     * Commit index can advance to N if:
     * - N > commitIndex
     * - A majority of the voters have matchIndex >= N (the leader counts if it votes)
     * - log[N].term == currentTerm
     */
    private void tryAdvanceCommitIndex() {
        if (!state.isLeader()) {
            return;
        }

        Membership membership = membershipSupplier.get();
        long currentCommit = state.getCommitIndex();
        long lastIndex = logManager.getLastIndex();
        long currentTerm = state.getCurrentTerm();

        for (long n = lastIndex; n > currentCommit; n--) {
            long termAtN = logManager.getTerm(n);
            if (termAtN < currentTerm) {
                // Earlier entries are older still; they commit with this term's entries
                break;
            }
            if (termAtN != currentTerm) {
                continue;
            }

            int replicaCount = 0;
            for (NodeId voter : membership.voters()) {
                if (voter.equals(selfId) || matchIndex.getOrDefault(voter, 0L) >= n) {
                    replicaCount++;
                }
            }

            if (replicaCount >= membership.quorum()) {
                if (state.advanceCommitIndex(n)) {
                    logger.debug("Advanced commit index from {} to {}", currentCommit, n);
                    if (onCommitAdvanced != null) {
                        onCommitAdvanced.run();
                    }
                }
                break;
            }
        }
    }

    /**
     * Get match index for a peer (for testing/debugging).
     */
    public long getMatchIndex(NodeId peer) {
        return matchIndex.getOrDefault(peer, 0L);
    }

    /**
     * Get next index for a peer (for testing/debugging).
     */
    public long getNextIndex(NodeId peer) {
        return nextIndex.getOrDefault(peer, 0L);
    }
}
