package com.metasrv.config;

import com.metasrv.core.NodeId;
import com.metasrv.snapshot.SnapshotPolicy;
import com.metasrv.statemachine.Endpoint;
import com.metasrv.statemachine.Node;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a meta node.
 */
public class RaftConfig {

    private final NodeId nodeId;
    private final String name;
    private final String host;
    private final int port;
    private final String grpcApiAddress;
    private final Path dataDir;
    private final List<String> joinAddresses;

    private final int electionTimeoutMinMs;
    private final int electionTimeoutMaxMs;
    private final int heartbeatIntervalMs;
    private final long rpcTimeoutMs;
    private final long installSnapshotTimeoutMs;
    private final long proposeTimeoutMs;

    private final long snapshotLogsSinceLast;
    private final long maxAppliedLogToKeep;

    private final int forwardBudget;
    private final boolean boot;

    private RaftConfig(Builder builder) {
        this.nodeId = builder.nodeId;
        this.name = builder.name != null ? builder.name : "node-" + builder.nodeId;
        this.host = builder.host;
        this.port = builder.port;
        this.grpcApiAddress = builder.grpcApiAddress;
        this.dataDir = builder.dataDir;
        this.joinAddresses = List.copyOf(builder.joinAddresses);
        this.electionTimeoutMinMs = builder.electionTimeoutMinMs;
        this.electionTimeoutMaxMs = builder.electionTimeoutMaxMs;
        this.heartbeatIntervalMs = builder.heartbeatIntervalMs;
        this.rpcTimeoutMs = builder.rpcTimeoutMs;
        this.installSnapshotTimeoutMs = builder.installSnapshotTimeoutMs;
        this.proposeTimeoutMs = builder.proposeTimeoutMs;
        this.snapshotLogsSinceLast = builder.snapshotLogsSinceLast;
        this.maxAppliedLogToKeep = builder.maxAppliedLogToKeep;
        this.forwardBudget = builder.forwardBudget;
        this.boot = builder.boot;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public String getName() {
        return name;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * Address of the consensus transport, {@code host:port}.
     */
    public String getRaftAddress() {
        return host + ":" + port;
    }

    public Endpoint getEndpoint() {
        return new Endpoint(host, port);
    }

    /**
     * Address of the client API, or {@code null} if the node serves none.
     */
    public String getGrpcApiAddress() {
        return grpcApiAddress;
    }

    public Path getDataDir() {
        return dataDir;
    }

    /**
     * Addresses of existing cluster members a fresh node sends its join
     * request to, tried in order.
     */
    public List<String> getJoinAddresses() {
        return joinAddresses;
    }

    public int getElectionTimeoutMinMs() {
        return electionTimeoutMinMs;
    }

    public int getElectionTimeoutMaxMs() {
        return electionTimeoutMaxMs;
    }

    public int getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public long getRpcTimeoutMs() {
        return rpcTimeoutMs;
    }

    public long getInstallSnapshotTimeoutMs() {
        return installSnapshotTimeoutMs;
    }

    /**
     * How long a proposal may take from append to apply before the caller
     * gives up waiting.
     */
    public long getProposeTimeoutMs() {
        return proposeTimeoutMs;
    }

    /**
     * Deadline of a request forwarded to the leader: the leader's propose
     * timeout plus one round trip.
     */
    public long getForwardTimeoutMs() {
        return proposeTimeoutMs + rpcTimeoutMs;
    }

    public SnapshotPolicy getSnapshotPolicy() {
        return new SnapshotPolicy(snapshotLogsSinceLast, maxAppliedLogToKeep);
    }

    /**
     * Hop budget given to requests this node forwards on behalf of its own
     * callers.
     */
    public int getForwardBudget() {
        return forwardBudget;
    }

    /**
     * Whether a node started on fresh storage boots a single-node cluster
     * instead of waiting to be joined.
     */
    public boolean isBoot() {
        return boot;
    }

    /**
     * Descriptor of this node as registered in the cluster.
     */
    public Node toNode() {
        return new Node(nodeId, name, getEndpoint(), grpcApiAddress);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse command line arguments into a RaftConfig.
     *
     * Expected format:
     *   --id=1 --host=127.0.0.1 --port=28004 --grpc-api-address=127.0.0.1:9191
     *   --data-dir=data/1 --join=127.0.0.1:28003,127.0.0.1:28005
     *   --snapshot-logs-since-last=1024 --max-applied-log-to-keep=1000 --boot=true
     */
    public static RaftConfig fromArgs(String[] args) {
        Builder builder = builder();

        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (!arg.startsWith("--") || eq < 0) {
                throw new IllegalArgumentException("Expected --key=value, got: " + arg);
            }
            String key = arg.substring(2, eq);
            String value = arg.substring(eq + 1);

            switch (key) {
                case "id" -> builder.nodeId(NodeId.parse(value));
                case "name" -> builder.name(value);
                case "host" -> builder.host(value);
                case "port" -> builder.port(Integer.parseInt(value));
                case "grpc-api-address" -> builder.grpcApiAddress(value);
                case "data-dir" -> builder.dataDir(Paths.get(value));
                case "join" -> {
                    for (String address : value.split(",")) {
                        if (!address.isBlank()) {
                            builder.addJoinAddress(address.trim());
                        }
                    }
                }
                case "election-timeout-min" -> builder.electionTimeoutMinMs(Integer.parseInt(value));
                case "election-timeout-max" -> builder.electionTimeoutMaxMs(Integer.parseInt(value));
                case "heartbeat-interval" -> builder.heartbeatIntervalMs(Integer.parseInt(value));
                case "rpc-timeout" -> builder.rpcTimeoutMs(Long.parseLong(value));
                case "install-snapshot-timeout" -> builder.installSnapshotTimeoutMs(Long.parseLong(value));
                case "propose-timeout" -> builder.proposeTimeoutMs(Long.parseLong(value));
                case "snapshot-logs-since-last" -> builder.snapshotLogsSinceLast(Long.parseLong(value));
                case "max-applied-log-to-keep" -> builder.maxAppliedLogToKeep(Long.parseLong(value));
                case "forward-budget" -> builder.forwardBudget(Integer.parseInt(value));
                case "boot" -> builder.boot(Boolean.parseBoolean(value));
                default -> throw new IllegalArgumentException("Unknown option: --" + key);
            }
        }

        return builder.build();
    }

    @Override
    public String toString() {
        return "RaftConfig{" +
                "nodeId=" + nodeId +
                ", name='" + name + '\'' +
                ", raftAddress=" + getRaftAddress() +
                ", grpcApiAddress=" + grpcApiAddress +
                ", dataDir=" + dataDir +
                ", join=" + joinAddresses +
                ", election=" + electionTimeoutMinMs + ".." + electionTimeoutMaxMs + "ms" +
                ", heartbeat=" + heartbeatIntervalMs + "ms" +
                ", snapshotLogsSinceLast=" + snapshotLogsSinceLast +
                ", maxAppliedLogToKeep=" + maxAppliedLogToKeep +
                ", boot=" + boot +
                '}';
    }

    public static class Builder {
        private NodeId nodeId;
        private String name;
        private String host = "127.0.0.1";
        private int port = 28004;
        private String grpcApiAddress;
        private Path dataDir;
        private final List<String> joinAddresses = new ArrayList<>();

        private int electionTimeoutMinMs = 150;
        private int electionTimeoutMaxMs = 300;
        private int heartbeatIntervalMs = 50;
        private long rpcTimeoutMs = 1000;
        private long installSnapshotTimeoutMs = 10_000;
        private long proposeTimeoutMs = 5000;

        private long snapshotLogsSinceLast = SnapshotPolicy.DEFAULT_LOGS_SINCE_LAST;
        private long maxAppliedLogToKeep = SnapshotPolicy.DEFAULT_MAX_APPLIED_LOG_TO_KEEP;

        private int forwardBudget = 1;
        private boolean boot = false;

        public Builder nodeId(NodeId nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder nodeId(long nodeId) {
            return nodeId(NodeId.of(nodeId));
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder grpcApiAddress(String grpcApiAddress) {
            this.grpcApiAddress = grpcApiAddress;
            return this;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder addJoinAddress(String address) {
            this.joinAddresses.add(address);
            return this;
        }

        public Builder electionTimeoutMinMs(int ms) {
            this.electionTimeoutMinMs = ms;
            return this;
        }

        public Builder electionTimeoutMaxMs(int ms) {
            this.electionTimeoutMaxMs = ms;
            return this;
        }

        public Builder heartbeatIntervalMs(int ms) {
            this.heartbeatIntervalMs = ms;
            return this;
        }

        public Builder rpcTimeoutMs(long ms) {
            this.rpcTimeoutMs = ms;
            return this;
        }

        public Builder installSnapshotTimeoutMs(long ms) {
            this.installSnapshotTimeoutMs = ms;
            return this;
        }

        public Builder proposeTimeoutMs(long ms) {
            this.proposeTimeoutMs = ms;
            return this;
        }

        public Builder snapshotLogsSinceLast(long n) {
            this.snapshotLogsSinceLast = n;
            return this;
        }

        public Builder maxAppliedLogToKeep(long n) {
            this.maxAppliedLogToKeep = n;
            return this;
        }

        public Builder forwardBudget(int budget) {
            this.forwardBudget = budget;
            return this;
        }

        public Builder boot(boolean boot) {
            this.boot = boot;
            return this;
        }

        public RaftConfig build() {
            if (nodeId == null) {
                throw new IllegalStateException("nodeId is required");
            }
            if (dataDir == null) {
                throw new IllegalStateException("dataDir is required");
            }
            if (electionTimeoutMinMs <= 0 || electionTimeoutMaxMs <= electionTimeoutMinMs) {
                throw new IllegalStateException("Invalid election timeout range: "
                        + electionTimeoutMinMs + ".." + electionTimeoutMaxMs);
            }
            if (heartbeatIntervalMs <= 0 || heartbeatIntervalMs >= electionTimeoutMinMs) {
                throw new IllegalStateException("Heartbeat interval must be positive and below the election timeout");
            }
            if (forwardBudget < 0) {
                throw new IllegalStateException("forwardBudget cannot be negative");
            }
            // validates the snapshot settings
            new SnapshotPolicy(snapshotLogsSinceLast, maxAppliedLogToKeep);
            return new RaftConfig(this);
        }
    }
}
