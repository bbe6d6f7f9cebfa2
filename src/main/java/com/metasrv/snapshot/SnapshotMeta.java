package com.metasrv.snapshot;

import com.metasrv.core.Membership;

/**
 * Describes a snapshot: the last log position it covers and the membership
 * that was in effect at that position.
 *
 * @param lastIncludedIndex index of the last log entry included in the snapshot
 * @param lastIncludedTerm term of the last log entry included in the snapshot
 * @param membership membership effective at {@code lastIncludedIndex}
 */
public record SnapshotMeta(long lastIncludedIndex, long lastIncludedTerm, Membership membership) {

    /**
     * Index of the first log entry not covered by this snapshot.
     */
    public long nextIndex() {
        return lastIncludedIndex + 1;
    }
}
