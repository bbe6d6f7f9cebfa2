package com.metasrv.config;

import com.metasrv.core.NodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RaftConfigTest {

    @Test
    @DisplayName("Command line options are parsed")
    void testFromArgs() {
        RaftConfig config = RaftConfig.fromArgs(new String[]{
                "--id=3",
                "--port=28007",
                "--grpc-api-address=127.0.0.1:9193",
                "--data-dir=data/3",
                "--join=127.0.0.1:28004, 127.0.0.1:28005",
                "--snapshot-logs-since-last=100",
                "--max-applied-log-to-keep=0",
                "--forward-budget=2",
                "--boot=true"
        });

        assertThat(config.getNodeId()).isEqualTo(NodeId.of(3));
        assertThat(config.getName()).isEqualTo("node-3");
        assertThat(config.getRaftAddress()).isEqualTo("127.0.0.1:28007");
        assertThat(config.getGrpcApiAddress()).isEqualTo("127.0.0.1:9193");
        assertThat(config.getDataDir()).isEqualTo(Paths.get("data/3"));
        assertThat(config.getJoinAddresses()).containsExactly("127.0.0.1:28004", "127.0.0.1:28005");
        assertThat(config.getSnapshotPolicy().logsSinceLast()).isEqualTo(100);
        assertThat(config.getSnapshotPolicy().maxAppliedLogToKeep()).isZero();
        assertThat(config.getForwardBudget()).isEqualTo(2);
        assertThat(config.isBoot()).isTrue();
        assertThat(config.toNode().endpoint().port()).isEqualTo(28007);
    }

    @Test
    @DisplayName("Defaults apply to omitted options")
    void testDefaults() {
        RaftConfig config = RaftConfig.fromArgs(new String[]{"--id=0", "--data-dir=d"});

        assertThat(config.getPort()).isEqualTo(28004);
        assertThat(config.getGrpcApiAddress()).isNull();
        assertThat(config.getJoinAddresses()).isEmpty();
        assertThat(config.getForwardBudget()).isEqualTo(1);
        assertThat(config.isBoot()).isFalse();
        assertThat(config.getForwardTimeoutMs()).isGreaterThan(config.getProposeTimeoutMs());
    }

    @Test
    @DisplayName("Malformed and unknown options are rejected")
    void testBadArgs() {
        assertThatThrownBy(() -> RaftConfig.fromArgs(new String[]{"id=0"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RaftConfig.fromArgs(new String[]{"--id"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RaftConfig.fromArgs(new String[]{"--id=0", "--data-dir=d", "--peers=x"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("peers");
    }

    @Test
    @DisplayName("Inconsistent settings fail to build")
    void testValidation() {
        assertThatThrownBy(() -> RaftConfig.builder().dataDir(Paths.get("d")).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RaftConfig.builder().nodeId(0).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RaftConfig.builder().nodeId(0).dataDir(Paths.get("d"))
                .electionTimeoutMinMs(300).electionTimeoutMaxMs(200).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RaftConfig.builder().nodeId(0).dataDir(Paths.get("d"))
                .heartbeatIntervalMs(200).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RaftConfig.builder().nodeId(0).dataDir(Paths.get("d"))
                .snapshotLogsSinceLast(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
