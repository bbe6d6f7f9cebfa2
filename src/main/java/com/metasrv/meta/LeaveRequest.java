package com.metasrv.meta;

import com.metasrv.core.NodeId;

import java.util.Objects;

/**
 * Asks the leader to unregister a node and remove it from the membership.
 */
public record LeaveRequest(NodeId nodeId) implements ForwardRequest.Body {

    public LeaveRequest {
        Objects.requireNonNull(nodeId, "nodeId");
    }
}
