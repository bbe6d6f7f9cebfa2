package com.metasrv.server;

import com.metasrv.config.RaftConfig;
import com.metasrv.meta.MetaNode;
import com.metasrv.statemachine.Endpoint;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Meta server main class.
 *
 * Starts one meta node with gRPC transport and, if an API address is
 * configured, the client API on it.
 *
 * Usage:
 *   java -jar meta-node.jar --id=0 --port=28004 --grpc-api-address=127.0.0.1:9191 \
 *       --data-dir=data/node-0 --boot=true
 *   java -jar meta-node.jar --id=1 --port=28005 --grpc-api-address=127.0.0.1:9192 \
 *       --data-dir=data/node-1 --join=127.0.0.1:28004
 */
public class MetaServer {

    private static final Logger logger = LoggerFactory.getLogger(MetaServer.class);

    private final RaftConfig config;
    private MetaNode metaNode;
    private Server apiServer;

    public MetaServer(RaftConfig config) {
        this.config = config;
    }

    /**
     * Start the meta server.
     */
    public void start() throws IOException {
        logger.info("Starting meta server with config: {}", config);

        metaNode = MetaNode.openCreateBoot(config, true, true, config.isBoot());
        try {
            if (!config.getJoinAddresses().isEmpty()) {
                metaNode.joinCluster();
            }

            if (config.getGrpcApiAddress() != null) {
                int apiPort = Endpoint.parse(config.getGrpcApiAddress()).port();
                apiServer = ServerBuilder.forPort(apiPort)
                        .addService(new MetaServiceImpl(metaNode))
                        .build()
                        .start();
                logger.info("Client API listening on {}", config.getGrpcApiAddress());
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Meta server {} failed to start, stopping node", config.getNodeId(), e);
            metaNode.stop();
            metaNode = null;
            throw e;
        }

        logger.info("Meta server started: {} raft on {}", config.getNodeId(), config.getRaftAddress());
    }

    /**
     * Stop the meta server.
     */
    public synchronized void stop() {
        logger.info("Stopping meta server: {}", config.getNodeId());

        if (apiServer != null) {
            apiServer.shutdown();
            try {
                apiServer.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                apiServer.shutdownNow();
                Thread.currentThread().interrupt();
            }
            apiServer = null;
        }

        if (metaNode != null) {
            metaNode.stop();
            metaNode = null;
        }
        notifyAll();

        logger.info("Meta server stopped: {}", config.getNodeId());
    }

    public MetaNode getMetaNode() {
        return metaNode;
    }

    public RaftConfig getConfig() {
        return config;
    }

    /**
     * Block until shutdown signal.
     */
    public void awaitTermination() throws InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }));

        synchronized (this) {
            while (metaNode != null) {
                wait(1000);
            }
        }
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }

        try {
            RaftConfig config = RaftConfig.fromArgs(args);
            MetaServer server = new MetaServer(config);

            server.start();
            server.awaitTermination();

        } catch (Exception e) {
            logger.error("Failed to start meta server", e);
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar meta-node.jar [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --id=<node-id>                 Numeric node id (required)");
        System.out.println("  --data-dir=<dir>               Data directory (required)");
        System.out.println("  --name=<name>                  Node name (default: node-<id>)");
        System.out.println("  --host=<host>                  Host of the raft transport (default: 127.0.0.1)");
        System.out.println("  --port=<port>                  Port of the raft transport (default: 28004)");
        System.out.println("  --grpc-api-address=<host:port> Address of the client API (default: none)");
        System.out.println("  --boot=<true|false>            Boot a single-node cluster on fresh storage");
        System.out.println("  --join=<addrs>                 Comma-separated raft addresses to join through");
        System.out.println("  --election-timeout-min=<ms>    (default: 150)");
        System.out.println("  --election-timeout-max=<ms>    (default: 300)");
        System.out.println("  --heartbeat-interval=<ms>      (default: 50)");
        System.out.println("  --rpc-timeout=<ms>             (default: 1000)");
        System.out.println("  --install-snapshot-timeout=<ms> (default: 10000)");
        System.out.println("  --propose-timeout=<ms>         (default: 5000)");
        System.out.println("  --snapshot-logs-since-last=<n> (default: 1024)");
        System.out.println("  --max-applied-log-to-keep=<n>  (default: 1000)");
        System.out.println("  --forward-budget=<n>           Hops a request may be forwarded (default: 1)");
        System.out.println();
        System.out.println("Example:");
        System.out.println("  java -jar meta-node.jar --id=0 --port=28004 --data-dir=data/0 --boot=true \\");
        System.out.println("      --grpc-api-address=127.0.0.1:9191");
        System.out.println("  java -jar meta-node.jar --id=1 --port=28005 --data-dir=data/1 \\");
        System.out.println("      --join=127.0.0.1:28004 --grpc-api-address=127.0.0.1:9192");
    }
}
