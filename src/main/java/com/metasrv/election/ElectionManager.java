package com.metasrv.election;

import com.metasrv.core.Membership;
import com.metasrv.core.NodeId;
import com.metasrv.core.RaftState;
import com.metasrv.core.Role;
import com.metasrv.rpc.RpcTransport;
import com.metasrv.rpc.proto.VoteRequest;
import com.metasrv.rpc.proto.VoteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Random;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Manages leader election process.
 *
 * Responsibilities:
 * - Election timeout detection
 * - Starting elections as candidate (voters only)
 * - Vote counting against the voters of the effective membership
 * - Role transitions
 *
 * All role transitions happen while holding the monitor of {@link RaftState},
 * the same monitor the node takes for its own transitions.
 *
 * A node that heard from a live leader within the minimum election timeout
 * ignores vote requests of a higher term. A node removed from the membership
 * keeps timing out and campaigning with ever higher terms; this keeps it from
 * deposing the leader of the cluster it left.
 */
public class ElectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ElectionManager.class);

    private final NodeId selfId;
    private final RaftState state;
    private final RpcTransport transport;
    private final Supplier<Membership> membershipSupplier;
    private final LongSupplier lastLogIndexSupplier;
    private final LongSupplier lastLogTermSupplier;
    private final int electionTimeoutMinMs;
    private final int electionTimeoutMaxMs;

    private final ScheduledExecutorService scheduler;
    private final Random random = new Random();

    private final Object timerLock = new Object();
    private ScheduledFuture<?> electionTimer;
    private volatile long lastLeaderContactNanos = 0;
    private volatile boolean stopped = false;

    // Callbacks
    private Runnable onBecomeLeader;
    private Runnable onBecomeFollower;
    private Runnable onStateChanged;

    public ElectionManager(
            NodeId selfId,
            RaftState state,
            RpcTransport transport,
            Supplier<Membership> membershipSupplier,
            LongSupplier lastLogIndexSupplier,
            LongSupplier lastLogTermSupplier,
            int electionTimeoutMinMs,
            int electionTimeoutMaxMs) {
        this.selfId = selfId;
        this.state = state;
        this.transport = transport;
        this.membershipSupplier = membershipSupplier;
        this.lastLogIndexSupplier = lastLogIndexSupplier;
        this.lastLogTermSupplier = lastLogTermSupplier;
        this.electionTimeoutMinMs = electionTimeoutMinMs;
        this.electionTimeoutMaxMs = electionTimeoutMaxMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "election-" + selfId);
            t.setDaemon(true);
            return t;
        });
    }

    public void setOnBecomeLeader(Runnable callback) {
        this.onBecomeLeader = callback;
    }

    public void setOnBecomeFollower(Runnable callback) {
        this.onBecomeFollower = callback;
    }

    /**
     * Invoked after every change of term, role or vote made by this manager.
     */
    public void setOnStateChanged(Runnable callback) {
        this.onStateChanged = callback;
    }

    /**
     * Start the election manager.
     */
    public void start() {
        MDC.put("nodeId", selfId.toString());
        logger.info("ElectionManager started, timeout {}..{}ms", electionTimeoutMinMs, electionTimeoutMaxMs);
        resetElectionTimer();
    }

    /**
     * Stop the election manager.
     */
    public void stop() {
        stopped = true;
        cancelElectionTimer();
        scheduler.shutdown();
        logger.info("ElectionManager stopped");
    }

    /**
     * Reset election timer. Called when:
     * - Receiving valid heartbeat from leader
     * - Granting vote to a candidate
     * - Starting a new election
     * - Stepping down from leadership
     */
    public void resetElectionTimer() {
        synchronized (timerLock) {
            if (stopped) {
                return;
            }
            cancelElectionTimer();

            int timeout = electionTimeoutMinMs + random.nextInt(electionTimeoutMaxMs - electionTimeoutMinMs);

            try {
                electionTimer = scheduler.schedule(this::onElectionTimeout, timeout, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                logger.debug("Election scheduler is shut down");
                return;
            }

            logger.trace("Election timer reset to {}ms", timeout);
        }
    }

    /**
     * Cancel the election timer. Called when becoming leader.
     */
    public void cancelElectionTimer() {
        synchronized (timerLock) {
            if (electionTimer != null && !electionTimer.isDone()) {
                electionTimer.cancel(false);
            }
        }
    }

    /**
     * Records that a valid message from the current leader arrived.
     */
    public void recordLeaderContact() {
        lastLeaderContactNanos = System.nanoTime();
        resetElectionTimer();
    }

    private boolean heardFromLeaderRecently() {
        long last = lastLeaderContactNanos;
        return last != 0
                && System.nanoTime() - last < TimeUnit.MILLISECONDS.toNanos(electionTimeoutMinMs);
    }

    /**
     * Handle election timeout - start an election if this node may vote.
     */
    private void onElectionTimeout() {
        MDC.put("nodeId", selfId.toString());

        synchronized (state) {
            if (state.isLeader() || stopped) {
                // Leaders don't need election timeout
                return;
            }

            Membership membership = membershipSupplier.get();
            if (!membership.isVoter(selfId)) {
                // Learners and uninitialized nodes wait to be replicated to
                resetElectionTimer();
                return;
            }

            logger.info("Election timeout, starting election");
            startElection(membership);
        }
    }

    /**
     * Start an election as candidate.
     */
    private void startElection(Membership membership) {
        long newTerm = state.startElection(selfId);
        notifyStateChanged();

        logger.info("Starting election for term {}", newTerm);

        // Reset timer for this election
        resetElectionTimer();

        VoteRequest request = VoteRequest.newBuilder()
                .setTerm(newTerm)
                .setCandidateId(selfId.id())
                .setLastLogIndex(lastLogIndexSupplier.getAsLong())
                .setLastLogTerm(lastLogTermSupplier.getAsLong())
                .build();

        // Count votes (start with 1 for self)
        int majority = membership.quorum();
        AtomicInteger votes = new AtomicInteger(1);
        List<NodeId> peers = membership.voters().stream()
                .filter(id -> !id.equals(selfId))
                .toList();

        logger.debug("Need {} votes to win (voters: {})", majority, membership.voters());

        // Single voter cluster
        if (votes.get() >= majority) {
            winElection(newTerm);
            return;
        }

        for (NodeId peer : peers) {
            requestVote(peer, request, newTerm, votes, majority);
        }
    }

    private void requestVote(NodeId peer, VoteRequest request, long electionTerm,
                             AtomicInteger votes, int majority) {
        transport.sendVoteRequest(peer, request)
                .thenAccept(response -> {
                    MDC.put("nodeId", selfId.toString());
                    handleVoteResponse(response, electionTerm, votes, majority);
                })
                .exceptionally(e -> {
                    logger.debug("Failed to get vote from {}: {}", peer, e.getMessage());
                    return null;
                });
    }

    private void handleVoteResponse(
            VoteResponse response,
            long electionTerm,
            AtomicInteger votes,
            int majority) {
        synchronized (state) {
            onVoteResponse(response, electionTerm, votes, majority);
        }
    }

    private void onVoteResponse(
            VoteResponse response,
            long electionTerm,
            AtomicInteger votes,
            int majority) {

        if (response.getTerm() > state.getCurrentTerm()) {
            logger.info("Discovered higher term {}, stepping down", response.getTerm());
            state.updateTerm(response.getTerm());
            notifyStateChanged();
            if (onBecomeFollower != null) {
                onBecomeFollower.run();
            }
            return;
        }

        // Ignore if election is stale or we're no longer candidate
        if (electionTerm != state.getCurrentTerm() || !state.isCandidate()) {
            return;
        }

        if (response.getVoteGranted()) {
            int currentVotes = votes.incrementAndGet();
            logger.debug("Received vote, total: {}/{}", currentVotes, majority);

            if (currentVotes >= majority) {
                winElection(electionTerm);
            }
        }
    }

    private void winElection(long electionTerm) {
        if (electionTerm != state.getCurrentTerm() || !state.isCandidate()) {
            return;
        }
        logger.info("Won election for term {}", electionTerm);
        state.setRole(Role.LEADER);
        state.setLeaderId(selfId);
        cancelElectionTimer();
        notifyStateChanged();

        if (onBecomeLeader != null) {
            onBecomeLeader.run();
        }
    }

    /**
     * Handle incoming vote request.
     *
     * Grant vote if:
     * 1. Candidate's term >= currentTerm
     * 2. No live leader was heard from within the minimum election timeout
     * 3. Haven't voted in this term, or already voted for this candidate
     * 4. Candidate's log is at least as up-to-date as ours
     */
    public VoteResponse handleVoteRequest(VoteRequest request) {
        MDC.put("nodeId", selfId.toString());
        synchronized (state) {
            return onVoteRequest(request);
        }
    }

    private VoteResponse onVoteRequest(VoteRequest request) {

        long currentTerm = state.getCurrentTerm();
        long requestTerm = request.getTerm();
        NodeId candidateId = NodeId.of(request.getCandidateId());

        if (requestTerm > currentTerm && (state.isLeader() || heardFromLeaderRecently())) {
            logger.debug("Ignoring vote request from {} for term {}: leader {} is alive",
                    candidateId, requestTerm, state.getLeaderId());
            return VoteResponse.newBuilder()
                    .setTerm(currentTerm)
                    .setVoteGranted(false)
                    .build();
        }

        if (requestTerm > currentTerm) {
            boolean wasLeader = state.isLeader();
            state.updateTerm(requestTerm);
            currentTerm = requestTerm;
            notifyStateChanged();
            if (wasLeader && onBecomeFollower != null) {
                onBecomeFollower.run();
            }
        }

        if (requestTerm < currentTerm) {
            logger.debug("Rejecting vote for {} - stale term {} < {}", candidateId, requestTerm, currentTerm);
            return VoteResponse.newBuilder()
                    .setTerm(currentTerm)
                    .setVoteGranted(false)
                    .build();
        }

        // Check log is up-to-date before spending the vote
        boolean logUpToDate = isLogUpToDate(request.getLastLogTerm(), request.getLastLogIndex());
        boolean voteGranted = logUpToDate && state.tryVoteFor(candidateId);

        if (voteGranted) {
            logger.info("Granting vote to {} for term {}", candidateId, requestTerm);
            notifyStateChanged();
            resetElectionTimer();
        } else {
            logger.debug("Rejecting vote for {} - votedFor={}, logUpToDate={}",
                    candidateId, state.getVotedFor(), logUpToDate);
        }

        return VoteResponse.newBuilder()
                .setTerm(currentTerm)
                .setVoteGranted(voteGranted)
                .build();
    }

    /**
     * Check if candidate's log is at least as up-to-date as ours.
     * Raft determines which log is more up-to-date by comparing:
     * 1. Last entry's term (higher is more up-to-date)
     * 2. If terms are equal, longer log is more up-to-date
     */
    private boolean isLogUpToDate(long candidateLastTerm, long candidateLastIndex) {
        long myLastTerm = lastLogTermSupplier.getAsLong();
        long myLastIndex = lastLogIndexSupplier.getAsLong();

        if (candidateLastTerm != myLastTerm) {
            return candidateLastTerm > myLastTerm;
        }
        return candidateLastIndex >= myLastIndex;
    }

    private void notifyStateChanged() {
        if (onStateChanged != null) {
            onStateChanged.run();
        }
    }
}
