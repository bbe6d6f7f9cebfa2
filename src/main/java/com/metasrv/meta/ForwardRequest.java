package com.metasrv.meta;

import com.google.protobuf.ByteString;
import com.metasrv.core.NodeId;
import com.metasrv.statemachine.Command;

/**
 * A request that only the leader can execute, carrying the number of hops it
 * may still be forwarded toward the leader.
 *
 * <p>A node that is not the leader forwards the request with a budget one
 * lower; with a budget of 0 it answers with the leader it knows instead.
 * The budget bounds forwarding loops while leadership is changing.
 *
 * @param forwardToLeader remaining hop budget
 * @param body what to execute at the leader
 */
public record ForwardRequest(int forwardToLeader, Body body) {

    /**
     * Payload of a forward request.
     */
    public sealed interface Body permits JoinRequest, LeaveRequest, WriteRequest {
    }

    public ForwardRequest {
        if (forwardToLeader < 0) {
            throw new IllegalArgumentException("Forward budget cannot be negative: " + forwardToLeader);
        }
        if (body == null) {
            throw new IllegalArgumentException("Forward request needs a body");
        }
    }

    public static ForwardRequest join(JoinRequest join, int budget) {
        return new ForwardRequest(budget, join);
    }

    public static ForwardRequest leave(NodeId nodeId, int budget) {
        return new ForwardRequest(budget, new LeaveRequest(nodeId));
    }

    public static ForwardRequest write(Command command, int budget) {
        return new ForwardRequest(budget, new WriteRequest(command));
    }

    /**
     * The same request with one hop spent.
     */
    public ForwardRequest forwarded() {
        return new ForwardRequest(forwardToLeader - 1, body);
    }

    public com.metasrv.rpc.proto.ForwardRequest toProto() {
        com.metasrv.rpc.proto.ForwardRequest.Builder builder = com.metasrv.rpc.proto.ForwardRequest.newBuilder()
                .setForwardToLeader(forwardToLeader);
        if (body instanceof JoinRequest join) {
            builder.setJoin(join.toProto());
        } else if (body instanceof LeaveRequest leave) {
            builder.setLeave(com.metasrv.rpc.proto.LeaveRequest.newBuilder().setNodeId(leave.nodeId().id()));
        } else if (body instanceof WriteRequest write) {
            builder.setWrite(ByteString.copyFrom(write.command().toBytes()));
        }
        return builder.build();
    }

    /**
     * @throws IllegalArgumentException if the request has no body or the body
     *                                  cannot be decoded
     */
    public static ForwardRequest fromProto(com.metasrv.rpc.proto.ForwardRequest proto) {
        Body body = switch (proto.getBodyCase()) {
            case JOIN -> JoinRequest.fromProto(proto.getJoin());
            case LEAVE -> new LeaveRequest(NodeId.of(proto.getLeave().getNodeId()));
            case WRITE -> new WriteRequest(Command.fromBytes(proto.getWrite().toByteArray()));
            case BODY_NOT_SET -> throw new IllegalArgumentException("Forward request without body");
        };
        return new ForwardRequest(proto.getForwardToLeader(), body);
    }
}
