package com.metasrv.core;

import com.metasrv.snapshot.SnapshotMeta;

/**
 * Read-only projection of a node's consensus state, published on every change
 * through {@link MetricsWatcher}.
 *
 * @param id the node publishing the metrics
 * @param role current role
 * @param currentTerm latest term seen
 * @param currentLeader known leader, or {@code null} if unknown
 * @param lastLogIndex index of the last entry in the local log
 * @param lastApplied index of the last entry applied to the state machine
 * @param membership effective membership configuration
 * @param snapshot the latest local snapshot, or {@code null} if none
 */
public record RaftMetrics(
        NodeId id,
        Role role,
        long currentTerm,
        NodeId currentLeader,
        long lastLogIndex,
        long lastApplied,
        Membership membership,
        SnapshotMeta snapshot
) {

    public boolean isLeader() {
        return role == Role.LEADER;
    }
}
