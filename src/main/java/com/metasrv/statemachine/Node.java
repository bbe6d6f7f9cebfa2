package com.metasrv.statemachine;

import com.metasrv.core.NodeId;

import java.util.Objects;

/**
 * Descriptor of a cluster node, kept in the node registry of the state
 * machine.
 *
 * @param id node id
 * @param name human-readable name
 * @param endpoint address of the consensus transport
 * @param grpcApiAddress address of the client API, or {@code null} if the node
 *                       serves none
 */
public record Node(NodeId id, String name, Endpoint endpoint, String grpcApiAddress) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(endpoint, "endpoint");
    }

    public static Node of(NodeId id, Endpoint endpoint) {
        return new Node(id, "", endpoint, null);
    }
}
