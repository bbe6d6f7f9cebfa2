package com.metasrv.core;

/**
 * Enumeration of the roles a node can assume.
 *
 * <p>Besides the three classic Raft roles, a node that is part of the cluster
 * membership only as a non-voter runs as a {@link #LEARNER}: it receives log
 * replication but never campaigns and is not counted toward the quorum.
 *
 * <pre>
 *     LEARNER ──(promoted to voter)──► FOLLOWER ──(election timeout)──► CANDIDATE
 *                                          ▲                                │
 *                                          │                        (wins election)
 *                                          │                                ▼
 *                                          └───(discovers higher term)─── LEADER
 * </pre>
 *
 * @see RaftState
 * @see RaftNode
 */
public enum Role {

    /**
     * Passive voter. Responds to RPCs from leaders and candidates and converts to
     * candidate if no heartbeat arrives in time.
     */
    FOLLOWER,

    /**
     * Voter actively seeking votes to become leader.
     */
    CANDIDATE,

    /**
     * The single node per term that accepts proposals and replicates the log.
     */
    LEADER,

    /**
     * Non-voting member, or a node that is not yet part of any membership.
     */
    LEARNER
}
