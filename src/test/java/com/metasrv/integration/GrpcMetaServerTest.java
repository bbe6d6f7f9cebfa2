package com.metasrv.integration;

import com.metasrv.client.MetaClient;
import com.metasrv.config.RaftConfig;
import com.metasrv.core.NodeId;
import com.metasrv.core.Role;
import com.metasrv.meta.MetaNodeException;
import com.metasrv.rpc.proto.MetricsResponse;
import com.metasrv.server.MetaServer;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Cmd;
import com.metasrv.statemachine.Command;
import com.metasrv.statemachine.MatchSeq;
import com.metasrv.statemachine.Node;
import com.metasrv.statemachine.SeqV;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests of meta servers over gRPC, driven through {@link MetaClient}.
 */
class GrpcMetaServerTest {

    private static final Logger logger = LoggerFactory.getLogger(GrpcMetaServerTest.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private final List<MetaServer> servers = new ArrayList<>();
    private MetaClient client;

    @AfterEach
    void teardown() {
        if (client != null) {
            client.close();
            client = null;
        }
        for (MetaServer server : servers) {
            server.stop();
        }
        servers.clear();
    }

    private MetaServer startServer(long id, boolean boot, String joinAddress, int forwardBudget) throws IOException {
        RaftConfig.Builder builder = RaftConfig.builder()
                .nodeId(id)
                .host("127.0.0.1")
                .port(freePort())
                .grpcApiAddress("127.0.0.1:" + freePort())
                .dataDir(tempDir.resolve("node-" + id))
                .heartbeatIntervalMs(30)
                .forwardBudget(forwardBudget)
                .boot(boot);
        if (joinAddress != null) {
            builder.addJoinAddress(joinAddress);
        }

        MetaServer server = new MetaServer(builder.build());
        server.start();
        servers.add(server);
        logger.info("Started server {} with API on {}", id, server.getConfig().getGrpcApiAddress());
        return server;
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    @Test
    @DisplayName("Client writes and reads through a booted server")
    void testSingleServer() {
        MetaServer server = startServer0();
        client = MetaClient.connect(server.getConfig().getGrpcApiAddress());

        AppliedState.KV created = client.upsert("app/config", "v1");
        assertThat(created.prev()).isNull();
        assertThat(created.result().dataAsString()).isEqualTo("v1");

        AppliedState.KV updated = client.upsert("app/config", "v2");
        assertThat(updated.prev().dataAsString()).isEqualTo("v1");
        assertThat(updated.result().seq()).isGreaterThan(created.result().seq());

        client.upsert("app/name", "meta");
        client.upsert("other", "x");

        assertThat(client.getKv("app/config").dataAsString()).isEqualTo("v2");
        assertThat(client.getKv("missing")).isNull();
        assertThat(client.prefixList("app/")).containsOnlyKeys("app/config", "app/name");

        Map<String, SeqV> values = client.mgetKv(List.of("other", "missing"));
        assertThat(values).containsKeys("other", "missing");
        assertThat(values.get("other").dataAsString()).isEqualTo("x");
        assertThat(values.get("missing")).isNull();

        AppliedState.KV deleted = client.delete("other");
        assertThat(deleted.result()).isNull();
        assertThat(client.getKv("other")).isNull();
    }

    @Test
    @DisplayName("Conditional writes and counters go through the client")
    void testConditionalWrite() {
        MetaServer server = startServer0();
        client = MetaClient.connect(server.getConfig().getGrpcApiAddress());

        AppliedState.KV first = (AppliedState.KV) client.write(Command.of(
                Cmd.UpsertKV.update("lock", "owner-1").withSeq(MatchSeq.exact(0))));
        AppliedState.KV second = (AppliedState.KV) client.write(Command.of(
                Cmd.UpsertKV.update("lock", "owner-2").withSeq(MatchSeq.exact(0))));

        assertThat(first.changed()).isTrue();
        assertThat(second.changed()).isFalse();
        assertThat(client.getKv("lock").dataAsString()).isEqualTo("owner-1");

        assertThat(client.incrSeq("ids")).isEqualTo(1);
        assertThat(client.incrSeq("ids")).isEqualTo(2);
    }

    @Test
    @DisplayName("Client follows the leader hint of a server that may not forward")
    void testLeaderHint() throws Exception {
        MetaServer leader = startServer0();
        MetaServer follower = startServer(1, false, leader.getConfig().getRaftAddress(), 0);
        follower.getMetaNode().metrics().awaitRole(Role.LEARNER, TIMEOUT);
        follower.getMetaNode().metrics().awaitLeader(NodeId.of(0), TIMEOUT);
        await().atMost(TIMEOUT).until(() -> follower.getMetaNode().getNode(NodeId.of(0)) != null);

        client = MetaClient.connect(follower.getConfig().getGrpcApiAddress());
        client.upsert("foo", "bar");

        assertThat(client.getLeaderAddress()).isEqualTo(leader.getConfig().getGrpcApiAddress());
        assertThat(leader.getMetaNode().getKv("foo").dataAsString()).isEqualTo("bar");
    }

    @Test
    @DisplayName("Joined server registers itself and shows up in node listings")
    void testJoinOverGrpc() throws Exception {
        MetaServer leader = startServer0();
        MetaServer joined = startServer(1, false, leader.getConfig().getRaftAddress(), 1);

        leader.getMetaNode().metrics().awaitMembers(Set.of(NodeId.of(0), NodeId.of(1)), TIMEOUT, "join");
        await().atMost(TIMEOUT).until(() -> joined.getMetaNode().getNode(NodeId.of(0)) != null
                && joined.getMetaNode().getNode(NodeId.of(1)) != null);

        client = MetaClient.connect(List.of(
                joined.getConfig().getGrpcApiAddress(),
                leader.getConfig().getGrpcApiAddress()));

        // default budget: the joined server forwards the write itself
        client.upsert("via", "follower");
        assertThat(client.getLeaderAddress()).isEqualTo(joined.getConfig().getGrpcApiAddress());

        Node node = leader.getMetaNode().getNode(NodeId.of(1));
        assertThat(node.grpcApiAddress()).isEqualTo(joined.getConfig().getGrpcApiAddress());
        assertThat(client.listNodes()).extracting(Node::id).contains(NodeId.of(0), NodeId.of(1));
        assertThat(client.getNode(NodeId.of(0)).endpoint().toString())
                .isEqualTo(leader.getConfig().getRaftAddress());

        MetricsResponse metrics = client.metrics();
        assertThat(metrics.getId()).isEqualTo(1);
        assertThat(metrics.getCurrentLeader()).isEqualTo(0);
    }

    @Test
    @DisplayName("Re-sending a write with the same transaction id applies it once")
    void testResentWriteAppliedOnce() {
        MetaServer server = startServer0();
        client = MetaClient.connect(server.getConfig().getGrpcApiAddress());

        Command command = client.attachTxid(Command.incrSeq("ids"));
        assertThat(command.txid()).isNotNull();
        assertThat(client.attachTxid(command)).isSameAs(command);

        AppliedState first = client.write(command);
        AppliedState resent = client.write(command);

        assertThat(first).isEqualTo(new AppliedState.Seq(1));
        assertThat(resent).isEqualTo(first);

        // plain helper calls get fresh transaction ids
        assertThat(client.incrSeq("ids")).isEqualTo(2);
        assertThat(client.incrSeq("ids")).isEqualTo(3);
        assertThat(client.attachTxid(Command.incrSeq("ids")).txid().serial())
                .isGreaterThan(command.txid().serial());
    }

    @Test
    @DisplayName("Server that cannot join stops its node and releases the data dir")
    void testFailedJoinStopsNode() throws Exception {
        RaftConfig config = RaftConfig.builder()
                .nodeId(5)
                .host("127.0.0.1")
                .port(freePort())
                .dataDir(tempDir.resolve("node-5"))
                .heartbeatIntervalMs(30)
                .addJoinAddress("127.0.0.1:1")
                .build();
        MetaServer failed = new MetaServer(config);

        assertThatThrownBy(failed::start)
                .isInstanceOf(MetaNodeException.class)
                .hasMessageContaining("Cannot join cluster");
        assertThat(failed.getMetaNode()).isNull();

        MetaServer reopened = new MetaServer(RaftConfig.builder()
                .nodeId(5)
                .host("127.0.0.1")
                .port(config.getPort())
                .dataDir(config.getDataDir())
                .heartbeatIntervalMs(30)
                .build());
        reopened.start();
        servers.add(reopened);

        assertThat(reopened.getMetaNode().getRaftNode().getMembership().contains(NodeId.of(5))).isFalse();
    }

    @Test
    @DisplayName("Client gives up when no server is reachable")
    void testUnreachableServers() {
        client = MetaClient.connect("127.0.0.1:1");

        assertThatThrownBy(() -> client.upsert("a", "b"))
                .isInstanceOf(MetaClient.MetaClientException.class)
                .hasMessageContaining("retries");
    }

    private MetaServer startServer0() {
        try {
            return startServer(0, true, null, 1);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
