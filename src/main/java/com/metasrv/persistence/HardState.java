package com.metasrv.persistence;

import com.metasrv.core.NodeId;

/**
 * The consensus state that must survive a restart.
 *
 * @param currentTerm latest term seen
 * @param votedFor candidate voted for in {@code currentTerm}, or {@code null}
 */
public record HardState(long currentTerm, NodeId votedFor) {

    public static final HardState INITIAL = new HardState(0, null);
}
