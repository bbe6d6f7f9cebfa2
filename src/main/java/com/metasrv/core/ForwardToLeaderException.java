package com.metasrv.core;

/**
 * Thrown when a request needs the leader but this node is not the leader and
 * may not forward the request any further.
 *
 * <p>This is not a business error: it tells the caller to retry the same
 * request against {@link #getLeaderId()}. A {@code null} leader id means no
 * leader is currently known and the caller should retry later.
 */
public class ForwardToLeaderException extends RuntimeException {

    private final NodeId leaderId;

    public ForwardToLeaderException(NodeId leaderId) {
        super(leaderId != null
                ? "Forward to leader: " + leaderId
                : "Forward to leader: leader unknown");
        this.leaderId = leaderId;
    }

    /**
     * Returns the known leader id, or {@code null} if unknown.
     */
    public NodeId getLeaderId() {
        return leaderId;
    }
}
