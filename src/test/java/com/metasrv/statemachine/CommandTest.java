package com.metasrv.statemachine;

import com.metasrv.core.NodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the log encoding of commands and applied states.
 */
class CommandTest {

    @Test
    @DisplayName("Conditional upsert with txid and expiry survives encoding")
    void testUpsertEncoding() {
        Command cmd = new Command(new Txid("client-1", 42),
                Cmd.UpsertKV.update("k", "v")
                        .withSeq(MatchSeq.greaterOrEqual(3))
                        .withMeta(KVMeta.expireAt(1_700_000_000L)));

        Command decoded = Command.fromBytes(cmd.toBytes());

        assertThat(decoded).isEqualTo(cmd);
    }

    @Test
    @DisplayName("Delete and node commands survive encoding")
    void testOtherCommands() {
        Node node = new Node(NodeId.of(7), "seven", new Endpoint("10.0.0.7", 28004), null);

        assertThat(Command.fromBytes(Command.delete("k").toBytes())).isEqualTo(Command.delete("k"));
        assertThat(Command.fromBytes(Command.addNode(node).toBytes())).isEqualTo(Command.addNode(node));
        assertThat(Command.fromBytes(Command.removeNode(NodeId.of(7)).toBytes()))
                .isEqualTo(Command.removeNode(NodeId.of(7)));
    }

    @Test
    @DisplayName("Garbage bytes are rejected")
    void testGarbage() {
        assertThatThrownBy(() -> Command.fromBytes(new byte[]{1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Command.fromBytes(new byte[]{0, 0, 0, 0, 99}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Applied states survive encoding")
    void testAppliedStateEncoding() {
        SeqV v = new SeqV(3, KVMeta.expireAt(10), "x".getBytes());
        AppliedState kv = new AppliedState.KV(null, v);
        AppliedState change = new AppliedState.NodeChange(Node.of(NodeId.of(1), new Endpoint("h", 1)), null);

        assertThat(AppliedState.fromBytes(kv.toBytes())).isEqualTo(kv);
        assertThat(AppliedState.fromBytes(change.toBytes())).isEqualTo(change);
        assertThat(AppliedState.fromBytes(new AppliedState.Seq(5).toBytes())).isEqualTo(new AppliedState.Seq(5));
        assertThat(AppliedState.fromBytes(AppliedState.NOTHING.toBytes())).isEqualTo(AppliedState.NOTHING);
    }

    @Test
    @DisplayName("Endpoint parsing uses the last colon")
    void testEndpointParse() {
        assertThat(Endpoint.parse("127.0.0.1:28004")).isEqualTo(new Endpoint("127.0.0.1", 28004));
        assertThat(Endpoint.parse("::1:9000")).isEqualTo(new Endpoint("::1", 9000));
        assertThatThrownBy(() -> Endpoint.parse("nohost")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Endpoint.parse("h:x")).isInstanceOf(IllegalArgumentException.class);
    }
}
