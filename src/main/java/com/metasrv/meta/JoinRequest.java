package com.metasrv.meta;

import com.metasrv.core.NodeId;
import com.metasrv.statemachine.Endpoint;
import com.metasrv.statemachine.Node;

import java.util.Objects;

/**
 * Asks the leader to register a node and add it to the cluster as a learner.
 *
 * @param nodeId id of the joining node
 * @param name human-readable name
 * @param endpoint consensus transport address of the joining node
 * @param grpcApiAddress client API address, or {@code null}
 */
public record JoinRequest(NodeId nodeId, String name, Endpoint endpoint, String grpcApiAddress)
        implements ForwardRequest.Body {

    public JoinRequest {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(endpoint, "endpoint");
        name = name != null ? name : "";
    }

    public static JoinRequest of(Node node) {
        return new JoinRequest(node.id(), node.name(), node.endpoint(), node.grpcApiAddress());
    }

    public Node toNode() {
        return new Node(nodeId, name, endpoint, grpcApiAddress);
    }

    com.metasrv.rpc.proto.JoinRequest toProto() {
        com.metasrv.rpc.proto.JoinRequest.Builder builder = com.metasrv.rpc.proto.JoinRequest.newBuilder()
                .setNodeId(nodeId.id())
                .setName(name)
                .setEndpoint(endpoint.toString());
        if (grpcApiAddress != null) {
            builder.setGrpcApiAddress(grpcApiAddress);
        }
        return builder.build();
    }

    static JoinRequest fromProto(com.metasrv.rpc.proto.JoinRequest proto) {
        return new JoinRequest(
                NodeId.of(proto.getNodeId()),
                proto.getName(),
                Endpoint.parse(proto.getEndpoint()),
                proto.getGrpcApiAddress().isEmpty() ? null : proto.getGrpcApiAddress());
    }
}
