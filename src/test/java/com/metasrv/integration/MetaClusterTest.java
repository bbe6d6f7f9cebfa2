package com.metasrv.integration;

import com.metasrv.config.RaftConfig;
import com.metasrv.core.ForwardToLeaderException;
import com.metasrv.core.Membership;
import com.metasrv.core.NodeId;
import com.metasrv.core.Role;
import com.metasrv.meta.ForwardRequest;
import com.metasrv.meta.MetaNode;
import com.metasrv.meta.MetaNodeException;
import com.metasrv.persistence.StorageException;
import com.metasrv.rpc.LocalTransport;
import com.metasrv.rpc.proto.EntryType;
import com.metasrv.rpc.proto.VoteRequest;
import com.metasrv.snapshot.SnapshotMeta;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Cmd;
import com.metasrv.statemachine.Command;
import com.metasrv.statemachine.Endpoint;
import com.metasrv.statemachine.Node;
import com.metasrv.statemachine.Txid;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.metasrv.integration.LocalMetaCluster.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Integration tests for meta nodes over the in-memory transport.
 */
class MetaClusterTest {

    private static final Logger logger = LoggerFactory.getLogger(MetaClusterTest.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private LocalMetaCluster cluster;

    @BeforeEach
    void setUp() {
        cluster = new LocalMetaCluster(tempDir);
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    @DisplayName("Booted node leads a single-node cluster and registers itself")
    void testBoot() {
        MetaNode node = cluster.boot(0);

        assertThat(node.isLeader()).isTrue();
        assertThat(node.getRaftNode().getMembership()).isEqualTo(Membership.ofVoters(Set.of(id(0))));

        Node self = node.getNode(id(0));
        assertThat(self).isNotNull();
        assertThat(self.endpoint()).isEqualTo(new Endpoint("127.0.0.1", 28000));
        assertThat(node.listNodes()).containsExactly(self);
    }

    @Test
    @DisplayName("Boot refuses existing storage and open refuses missing storage")
    void testOpenCreateBootFlags() {
        cluster.boot(0);
        cluster.stop(0);

        assertThatThrownBy(() -> cluster.boot(0))
                .isInstanceOf(MetaNodeException.class)
                .hasMessageContaining("open is not allowed");
        assertThatThrownBy(() -> cluster.open(1))
                .isInstanceOf(MetaNodeException.class)
                .hasMessageContaining("create is not allowed");
    }

    @Test
    @DisplayName("Writes survive a restart")
    void testRestart() throws Exception {
        MetaNode node = cluster.boot(0);
        node.write(Command.upsert("foo", "bar"));
        assertThat(node.write(Command.incrSeq("ids"))).isEqualTo(new AppliedState.Seq(1));

        cluster.stop(0);
        MetaNode reopened = cluster.open(0);

        reopened.metrics().awaitLeader(id(0), TIMEOUT);
        assertThat(reopened.getKv("foo").dataAsString()).isEqualTo("bar");
        assertThat(reopened.getNode(id(0))).isNotNull();

        AppliedState next = reopened.write(Command.incrSeq("ids"));
        assertThat(next).isEqualTo(new AppliedState.Seq(2));
    }

    @Test
    @DisplayName("Boot flag is ignored on existing storage")
    void testOpenCreateBootOnExistingStorage() throws Exception {
        cluster.boot(0).write(Command.upsert("foo", "bar"));
        cluster.stop(0);

        RaftConfig config = cluster.config(0);
        MetaNode node = MetaNode.openCreateBoot(config, true, true, true,
                new LocalTransport(config.getNodeId(), config.getRaftAddress()));
        try {
            node.metrics().awaitLeader(id(0), TIMEOUT);
            assertThat(node.getKv("foo").dataAsString()).isEqualTo("bar");
            assertThat(node.listNodes()).hasSize(1);
        } finally {
            node.stop();
        }
    }

    @Test
    @DisplayName("Joined node becomes a learner and replicates data")
    void testJoin() throws Exception {
        MetaNode leader = cluster.boot(0);
        leader.write(Command.upsert("foo", "bar"));

        MetaNode learner = cluster.join(1, 0);

        leader.metrics().awaitMembers(Set.of(id(0), id(1)), TIMEOUT, "node 1 joined");
        assertThat(leader.getRaftNode().getMembership().isLearner(id(1))).isTrue();
        assertThat(leader.getNode(id(1)).endpoint()).isEqualTo(Endpoint.parse(LocalMetaCluster.raftAddress(1)));

        learner.metrics().awaitRole(Role.LEARNER, TIMEOUT);
        learner.metrics().awaitLeader(id(0), TIMEOUT);

        leader.write(Command.upsert("k2", "v2"));
        await().atMost(TIMEOUT).until(() -> learner.getKv("k2") != null);

        assertThat(learner.getKv("foo").dataAsString()).isEqualTo("bar");
        assertThat(learner.listNodes()).extracting(Node::id).containsExactly(id(0), id(1));
    }

    @Test
    @DisplayName("Concurrent joins wait for each other's membership change")
    void testConcurrentJoins() throws Exception {
        MetaNode leader = cluster.boot(0);
        List<MetaNode> joining = List.of(cluster.create(1), cluster.create(2), cluster.create(3));

        List<CompletableFuture<AppliedState>> joins = joining.stream()
                .map(n -> CompletableFuture.supplyAsync(() -> leader.join(n.getConfig().toNode())))
                .collect(Collectors.toList());
        CompletableFuture.allOf(joins.toArray(new CompletableFuture[0])).get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

        leader.metrics().awaitMembers(Set.of(id(0), id(1), id(2), id(3)), TIMEOUT, "all joined");
        assertThat(leader.listNodes()).extracting(Node::id).containsExactlyInAnyOrder(id(0), id(1), id(2), id(3));
        assertThat(leader.isLeader()).isTrue();
    }

    @Test
    @DisplayName("Joining twice keeps one membership entry and updates the descriptor")
    void testJoinIdempotent() throws Exception {
        MetaNode leader = cluster.boot(0);
        cluster.join(1, 0);
        leader.metrics().awaitMembers(Set.of(id(0), id(1)), TIMEOUT, "node 1 joined");
        Membership before = leader.getRaftNode().getMembership();

        Node renamed = new Node(id(1), "renamed", Endpoint.parse(LocalMetaCluster.raftAddress(1)), null);
        AppliedState result = leader.join(renamed);

        assertThat(result).isInstanceOf(AppliedState.NodeChange.class);
        assertThat(((AppliedState.NodeChange) result).result()).isEqualTo(renamed);
        assertThat(leader.getRaftNode().getMembership()).isEqualTo(before);
        assertThat(leader.getNode(id(1)).name()).isEqualTo("renamed");
    }

    @Test
    @DisplayName("Join through a non-leader is forwarded to the leader")
    void testJoinViaFollower() throws Exception {
        MetaNode leader = cluster.boot(0);
        MetaNode learner = cluster.join(1, 0);
        learner.metrics().awaitLeader(id(0), TIMEOUT);

        cluster.join(2, 1);

        leader.metrics().awaitMembers(Set.of(id(0), id(1), id(2)), TIMEOUT, "node 2 joined");
        assertThat(leader.getNode(id(2))).isNotNull();
    }

    @Test
    @DisplayName("Non-leader forwards within its budget and refuses without one")
    void testForwardBudget() throws Exception {
        MetaNode leader = cluster.boot(0);
        MetaNode learner = cluster.join(cluster.config(1, b -> b.forwardBudget(0)), 0);
        learner.metrics().awaitLeader(id(0), TIMEOUT);

        assertThatThrownBy(() -> learner.write(Command.upsert("a", "1")))
                .isInstanceOfSatisfying(ForwardToLeaderException.class,
                        e -> assertThat(e.getLeaderId()).isEqualTo(id(0)));
        assertThat(leader.getKv("a")).isNull();

        AppliedState result = learner.handleForwardableRequest(
                ForwardRequest.write(Command.upsert("a", "1"), 1));

        assertThat(result).isInstanceOf(AppliedState.KV.class);
        assertThat(((AppliedState.KV) result).result().dataAsString()).isEqualTo("1");
        assertThat(leader.getKv("a").dataAsString()).isEqualTo("1");
    }

    @Test
    @DisplayName("Node without a known leader answers with an empty leader hint")
    void testNoLeader() {
        MetaNode lonely = cluster.create(5);

        assertThat(lonely.getRaftNode().getState().getRole()).isEqualTo(Role.LEARNER);
        assertThatThrownBy(() -> lonely.write(Command.upsert("a", "1")))
                .isInstanceOfSatisfying(ForwardToLeaderException.class,
                        e -> assertThat(e.getLeaderId()).isNull());
    }

    @Test
    @DisplayName("Join fails when no address accepts it")
    void testJoinUnreachable() {
        MetaNode node = cluster.create(1);

        assertThatThrownBy(() -> node.joinCluster(List.of(LocalMetaCluster.raftAddress(9))))
                .isInstanceOf(MetaNodeException.class)
                .hasMessageContaining("Cannot join cluster");
    }

    @Test
    @DisplayName("Leave removes the node from registry and membership, also after restart")
    void testLeave() throws Exception {
        MetaNode leader = cluster.boot(0);
        cluster.join(1, 0);
        leader.metrics().awaitMembers(Set.of(id(0), id(1)), TIMEOUT, "node 1 joined");

        AppliedState result = leader.leave(id(1));

        assertThat(result).isInstanceOf(AppliedState.NodeChange.class);
        assertThat(((AppliedState.NodeChange) result).result()).isNull();
        leader.metrics().awaitMembers(Set.of(id(0)), TIMEOUT, "node 1 left");
        assertThat(leader.getNode(id(1))).isNull();

        cluster.stop(1);
        cluster.stop(0);
        MetaNode reopened = cluster.open(0);
        reopened.metrics().awaitLeader(id(0), TIMEOUT);

        assertThat(reopened.getRaftNode().getMembership().contains(id(1))).isFalse();
        assertThat(reopened.listNodes()).extracting(Node::id).containsExactly(id(0));
    }

    @Test
    @DisplayName("Learners promoted to voters keep the cluster available")
    void testChangeVoters() throws Exception {
        MetaNode leader = cluster.boot(0);
        MetaNode n1 = cluster.join(1, 0);
        MetaNode n2 = cluster.join(2, 0);
        leader.metrics().awaitMembers(Set.of(id(0), id(1), id(2)), TIMEOUT, "all joined");

        leader.changeVoters(Set.of(id(0), id(1), id(2)));

        Membership expected = Membership.ofVoters(Set.of(id(0), id(1), id(2)));
        n1.metrics().await(m -> m.membership().equals(expected), TIMEOUT, "node 1 sees voters");
        n2.metrics().await(m -> m.membership().equals(expected), TIMEOUT, "node 2 sees voters");
        n1.metrics().awaitRole(Role.FOLLOWER, TIMEOUT);

        // a follower with the default budget forwards writes
        AppliedState result = n1.write(Command.upsert("x", "y"));
        assertThat(((AppliedState.KV) result).result().dataAsString()).isEqualTo("y");
        await().atMost(TIMEOUT).until(() -> n2.getKv("x") != null);

        assertThatThrownBy(() -> n1.changeVoters(Set.of(id(1))))
                .isInstanceOf(ForwardToLeaderException.class);
    }

    @Test
    @DisplayName("New leader is elected after the old one stops")
    void testFailover() throws Exception {
        MetaNode leader = cluster.boot(0);
        cluster.join(1, 0);
        cluster.join(2, 0);
        leader.metrics().awaitMembers(Set.of(id(0), id(1), id(2)), TIMEOUT, "all joined");
        leader.changeVoters(Set.of(id(0), id(1), id(2)));
        leader.write(Command.upsert("before", "1"));
        cluster.awaitApplied(leader.getRaftNode().getLastApplied());

        cluster.stop(0);

        MetaNode newLeader = cluster.awaitLeader();
        logger.info("New leader: {}", newLeader.getId());
        assertThat(newLeader.getId()).isNotEqualTo(id(0));
        assertThat(newLeader.getKv("before").dataAsString()).isEqualTo("1");

        newLeader.write(Command.upsert("after", "2"));
        for (MetaNode node : cluster.getNodes()) {
            await().atMost(TIMEOUT).until(() -> node.getKv("after") != null);
        }
    }

    @Test
    @DisplayName("Retried command with the same txid is applied once")
    void testTxidDeduplication() {
        MetaNode node = cluster.boot(0);
        Command incr = new Command(new Txid("client-1", 7), new Cmd.IncrSeq("ids"));

        AppliedState first = node.write(incr);
        AppliedState retried = node.write(incr);

        assertThat(first).isEqualTo(new AppliedState.Seq(1));
        assertThat(retried).isEqualTo(first);
        assertThat(node.write(Command.incrSeq("ids"))).isEqualTo(new AppliedState.Seq(2));
    }

    @Test
    @DisplayName("Snapshot is taken by policy and installed on a new learner")
    void testSnapshotInstall() throws Exception {
        MetaNode leader = cluster.boot(cluster.config(0, b -> b
                .snapshotLogsSinceLast(10)
                .maxAppliedLogToKeep(0)));

        for (int i = 0; i < 20; i++) {
            leader.write(Command.upsert("key-" + i, "value-" + i));
        }
        leader.metrics().awaitSnapshot(10, TIMEOUT, "policy snapshot");

        long applied = leader.getRaftNode().getLastApplied();
        SnapshotMeta meta = await().atMost(TIMEOUT).until(
                () -> leader.getRaftNode().triggerSnapshot().get(10, TimeUnit.SECONDS),
                m -> m != null && m.lastIncludedIndex() == applied);
        assertThat(meta.membership()).isEqualTo(Membership.ofVoters(Set.of(id(0))));

        MetaNode learner = cluster.join(1, 0);

        learner.metrics().awaitSnapshot(meta.lastIncludedIndex(), TIMEOUT, "snapshot installed");
        await().atMost(TIMEOUT).until(() -> learner.getKv("key-19") != null);
        assertThat(learner.prefixList("key-")).hasSize(20);
        assertThat(learner.getNode(id(0))).isNotNull();
    }

    @Test
    @DisplayName("Leaving the last voter is rejected before anything is written")
    void testLeaveLastVoterRejected() {
        MetaNode node = cluster.boot(0);
        long applied = node.getRaftNode().getLastApplied();

        assertThatThrownBy(() -> node.leave(id(0)))
                .isInstanceOf(MetaNodeException.class)
                .hasMessageContaining("no voter would remain");

        assertThat(node.getNode(id(0))).isNotNull();
        assertThat(node.getRaftNode().getMembership()).isEqualTo(Membership.ofVoters(Set.of(id(0))));
        assertThat(node.getRaftNode().getLastApplied()).isEqualTo(applied);
        assertThat(node.isLeader()).isTrue();
    }

    @Test
    @DisplayName("Demoting every voter is rejected")
    void testChangeVotersToNoneRejected() {
        MetaNode node = cluster.boot(0);

        assertThatThrownBy(() -> node.changeVoters(Set.of()))
                .isInstanceOf(MetaNodeException.class);
        assertThat(node.getRaftNode().getMembership()).isEqualTo(Membership.ofVoters(Set.of(id(0))));
    }

    @Test
    @DisplayName("Undecodable committed entry halts the node")
    void testStorageFailureHalts() throws Exception {
        MetaNode node = cluster.boot(0);
        node.write(Command.upsert("before", "1"));

        long term = node.getRaftNode().getCurrentTerm();
        node.getRaftNode().getStore().getLog().append(term, EntryType.NORMAL, new byte[]{1, 2, 3});

        await().atMost(TIMEOUT).until(() -> node.getRaftNode().getFatalError() != null);

        assertThat(node.getRaftNode().getFatalError()).isInstanceOf(StorageException.class);
        assertThat(node.metrics().isClosed()).isTrue();
        assertThat(node.getKv("before").dataAsString()).isEqualTo("1");
        assertThatThrownBy(() -> node.write(Command.upsert("after", "2")))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> node.getRaftNode().handleVoteRequest(VoteRequest.newBuilder()
                .setTerm(term + 1)
                .setCandidateId(7)
                .build()))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("halted");
    }

    @Test
    @DisplayName("Stopping a node closes its metrics stream")
    void testStopClosesMetrics() {
        MetaNode node = cluster.boot(0);
        node.stop();

        assertThat(node.metrics().isClosed()).isTrue();
        assertThatThrownBy(() -> node.metrics().awaitRole(Role.CANDIDATE, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Node ids in metrics match the config")
    void testMetricsIdentity() {
        MetaNode node = cluster.boot(3);

        assertThat(node.metrics().current().id()).isEqualTo(NodeId.of(3));
        assertThat(node.metrics().current().currentLeader()).isEqualTo(NodeId.of(3));
        assertThat(node.metrics().current().isLeader()).isTrue();
    }
}
