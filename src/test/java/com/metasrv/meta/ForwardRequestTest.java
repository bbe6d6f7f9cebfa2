package com.metasrv.meta;

import com.metasrv.core.NodeId;
import com.metasrv.statemachine.Command;
import com.metasrv.statemachine.Endpoint;
import com.metasrv.statemachine.Node;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for forwardable requests and their wire form.
 */
class ForwardRequestTest {

    @Test
    @DisplayName("Forwarding spends one hop")
    void testForwarded() {
        ForwardRequest request = ForwardRequest.write(Command.upsert("k", "v"), 2);

        assertThat(request.forwarded().forwardToLeader()).isEqualTo(1);
        assertThat(request.forwarded().forwarded().forwardToLeader()).isZero();
        assertThatThrownBy(() -> request.forwarded().forwarded().forwarded())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Join, leave and write bodies survive the wire form")
    void testProto() {
        Node node = new Node(NodeId.of(4), "four", new Endpoint("10.0.0.4", 28004), "10.0.0.4:9191");
        ForwardRequest join = ForwardRequest.join(JoinRequest.of(node), 1);
        ForwardRequest leave = ForwardRequest.leave(NodeId.of(4), 0);
        ForwardRequest write = ForwardRequest.write(Command.incrSeq("ids"), 1);

        assertThat(ForwardRequest.fromProto(join.toProto())).isEqualTo(join);
        assertThat(ForwardRequest.fromProto(leave.toProto())).isEqualTo(leave);
        assertThat(ForwardRequest.fromProto(write.toProto())).isEqualTo(write);
        assertThat(((JoinRequest) ForwardRequest.fromProto(join.toProto()).body()).toNode()).isEqualTo(node);
    }

    @Test
    @DisplayName("A join without API address keeps it absent")
    void testJoinWithoutApiAddress() {
        Node node = Node.of(NodeId.of(2), new Endpoint("h", 2));
        JoinRequest decoded = (JoinRequest) ForwardRequest.fromProto(
                ForwardRequest.join(JoinRequest.of(node), 1).toProto()).body();

        assertThat(decoded.grpcApiAddress()).isNull();
    }

    @Test
    @DisplayName("A request without body is rejected")
    void testEmptyBody() {
        com.metasrv.rpc.proto.ForwardRequest empty = com.metasrv.rpc.proto.ForwardRequest.newBuilder()
                .setForwardToLeader(1)
                .build();

        assertThatThrownBy(() -> ForwardRequest.fromProto(empty)).isInstanceOf(IllegalArgumentException.class);
    }
}
