package com.metasrv.core;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * Consensus state of a node.
 *
 * <h2>Hard state (persisted before answering any RPC)</h2>
 * <ul>
 *   <li>{@code currentTerm} - latest term seen, monotonically increasing</li>
 *   <li>{@code votedFor} - candidate voted for in the current term, or null</li>
 * </ul>
 *
 * <h2>Volatile state</h2>
 * <ul>
 *   <li>{@code role} - starts as {@link Role#LEARNER} until the node finds
 *       itself among the voters</li>
 *   <li>{@code leaderId} - current known leader, used for forwarding</li>
 *   <li>{@code commitIndex} / {@code lastApplied}</li>
 * </ul>
 *
 * <p>Every change of the hard state is reported to the persist callback, which
 * writes it to stable storage.
 *
 * @see RaftNode
 */
public class RaftState {

    private final AtomicLong currentTerm = new AtomicLong(0);
    private final AtomicReference<NodeId> votedFor = new AtomicReference<>(null);

    private volatile Role role = Role.LEARNER;
    private volatile NodeId leaderId = null;
    private final AtomicLong commitIndex = new AtomicLong(0);
    private final AtomicLong lastApplied = new AtomicLong(0);

    private BiConsumer<Long, NodeId> persistCallback;

    public void setPersistCallback(BiConsumer<Long, NodeId> callback) {
        this.persistCallback = callback;
    }

    /**
     * Restores the hard state read from disk on startup. Does not persist.
     */
    public void restore(long term, NodeId votedFor) {
        this.currentTerm.set(term);
        this.votedFor.set(votedFor);
    }

    private void persist() {
        if (persistCallback != null) {
            persistCallback.accept(currentTerm.get(), votedFor.get());
        }
    }

    // ==================== Term ====================

    public long getCurrentTerm() {
        return currentTerm.get();
    }

    /**
     * Adopts {@code newTerm} if it is greater than the current term: clears the
     * vote, drops leadership and persists.
     *
     * @return {@code true} if the term was updated
     */
    public synchronized boolean updateTerm(long newTerm) {
        if (newTerm > currentTerm.get()) {
            currentTerm.set(newTerm);
            votedFor.set(null);
            if (role == Role.LEADER || role == Role.CANDIDATE) {
                role = Role.FOLLOWER;
            }
            leaderId = null;
            persist();
            return true;
        }
        return false;
    }

    /**
     * Starts a new election term voting for {@code self}; persisted once.
     *
     * @return the new term
     */
    public synchronized long startElection(NodeId self) {
        long newTerm = currentTerm.incrementAndGet();
        votedFor.set(self);
        role = Role.CANDIDATE;
        leaderId = null;
        persist();
        return newTerm;
    }

    // ==================== Vote ====================

    public NodeId getVotedFor() {
        return votedFor.get();
    }

    /**
     * Grants the vote of the current term to {@code candidateId} if no other
     * candidate got it yet.
     */
    public synchronized boolean tryVoteFor(NodeId candidateId) {
        NodeId current = votedFor.get();
        if (current == null) {
            votedFor.set(candidateId);
            persist();
            return true;
        }
        return current.equals(candidateId);
    }

    // ==================== Role ====================

    public Role getRole() {
        return role;
    }

    public boolean isLeader() {
        return role == Role.LEADER;
    }

    public boolean isCandidate() {
        return role == Role.CANDIDATE;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    // ==================== Leader ====================

    public NodeId getLeaderId() {
        return leaderId;
    }

    public void setLeaderId(NodeId leaderId) {
        this.leaderId = leaderId;
    }

    // ==================== Indexes ====================

    public long getCommitIndex() {
        return commitIndex.get();
    }

    public void setCommitIndex(long index) {
        commitIndex.set(index);
    }

    /**
     * Advances the commit index; never moves it backwards.
     *
     * @return {@code true} if the commit index moved
     */
    public boolean advanceCommitIndex(long newIndex) {
        long current;
        do {
            current = commitIndex.get();
            if (newIndex <= current) {
                return false;
            }
        } while (!commitIndex.compareAndSet(current, newIndex));
        return true;
    }

    public long getLastApplied() {
        return lastApplied.get();
    }

    public void setLastApplied(long index) {
        lastApplied.set(index);
    }

    @Override
    public String toString() {
        return String.format("RaftState{term=%d, role=%s, votedFor=%s, leader=%s, commit=%d, applied=%d}",
                currentTerm.get(), role, votedFor.get(), leaderId, commitIndex.get(), lastApplied.get());
    }
}
