package com.metasrv.client;

import com.google.protobuf.ByteString;
import com.metasrv.core.NodeId;
import com.metasrv.rpc.ApiCodec;
import com.metasrv.rpc.proto.*;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Command;
import com.metasrv.statemachine.Node;
import com.metasrv.statemachine.SeqV;
import com.metasrv.statemachine.Txid;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Client SDK for a meta cluster.
 *
 * Features:
 * - Follows leader hints returned with writes
 * - Retries on retryable outcomes and unreachable servers
 * - Tags every write with a transaction id, so a retried write is applied once
 * - One channel per server
 *
 * Usage:
 * <pre>
 *   try (MetaClient client = MetaClient.connect("127.0.0.1:9191,127.0.0.1:9192")) {
 *       client.upsert("foo", "bar");
 *       SeqV value = client.getKv("foo");
 *       long next = client.incrSeq("ids");
 *   }
 * </pre>
 *
 * <p>Reads are answered by whichever server the client currently talks to
 * and may be stale unless that server is the leader.
 */
public class MetaClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(MetaClient.class);

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MAX_RETRIES = 5;
    private static final long RETRY_BACKOFF_MS = 100;

    private final List<String> serverAddresses;
    private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, MetaServiceGrpc.MetaServiceBlockingStub> stubs = new ConcurrentHashMap<>();

    private volatile String leaderAddress;
    private final AtomicInteger currentServerIndex = new AtomicInteger(0);

    private final String clientId = UUID.randomUUID().toString();
    private final AtomicLong txSerial = new AtomicLong();

    private MetaClient(List<String> serverAddresses) {
        if (serverAddresses.isEmpty()) {
            throw new IllegalArgumentException("At least one server address is required");
        }
        this.serverAddresses = new ArrayList<>();
        for (String address : serverAddresses) {
            this.serverAddresses.add(address.trim());
        }
        this.leaderAddress = this.serverAddresses.get(0);
    }

    /**
     * Connect to a meta cluster.
     *
     * @param addresses comma-separated list of API addresses (host:port)
     */
    public static MetaClient connect(String addresses) {
        return new MetaClient(Arrays.asList(addresses.split(",")));
    }

    public static MetaClient connect(List<String> addresses) {
        return new MetaClient(addresses);
    }

    // ==================== Writes ====================

    /**
     * Writes a command through the leader. A command without transaction id
     * gets one first, and every retry re-sends the same bytes, so a write whose
     * first attempt was applied after all is not applied again.
     *
     * @return the applied state the leader returned
     * @throws MetaClientException if the write fails after retries
     */
    public AppliedState write(Command command) {
        WriteRequest request = WriteRequest.newBuilder()
                .setCommand(ByteString.copyFrom(attachTxid(command).toBytes()))
                .build();

        Exception lastException = null;

        for (int attempt = 0; attempt < MAX_RETRIES; attempt++) {
            String address = leaderAddress;

            try {
                WriteResponse response = getStub(address)
                        .withDeadlineAfter(DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                        .write(request);

                switch (response.getResultCase()) {
                    case APPLIED_STATE -> {
                        return AppliedState.fromBytes(response.getAppliedState().toByteArray());
                    }
                    case FORWARD_TO_LEADER -> {
                        String hint = response.getForwardToLeader().getLeaderApiAddress();
                        if (hint.isEmpty()) {
                            // leader unknown or not registered yet
                            leaderAddress = getNextServer();
                            backoff();
                        } else {
                            leaderAddress = hint;
                        }
                        logger.debug("{} is not the leader, switched to {}", address, leaderAddress);
                    }
                    case RETRYABLE -> {
                        logger.debug("Retryable outcome from {}: {}", address, response.getRetryable());
                        lastException = new MetaClientException(response.getRetryable());
                        backoff();
                    }
                    case ERROR -> throw new MetaClientException(response.getError());
                    case RESULT_NOT_SET -> throw new MetaClientException("Empty response from " + address);
                }

            } catch (StatusRuntimeException e) {
                if (e.getStatus().getCode() == Status.Code.INVALID_ARGUMENT) {
                    throw new MetaClientException(e.getStatus().getDescription(), e);
                }
                lastException = e;
                logger.debug("Write to {} failed: {}", address, e.getMessage());
                leaderAddress = getNextServer();
            }
        }

        throw new MetaClientException("Failed after " + MAX_RETRIES + " retries", lastException);
    }

    /**
     * Sets {@code key} to {@code value} unconditionally.
     */
    public AppliedState.KV upsert(String key, String value) {
        return (AppliedState.KV) write(Command.upsert(key, value));
    }

    public AppliedState.KV delete(String key) {
        return (AppliedState.KV) write(Command.delete(key));
    }

    /**
     * Increments a named counter.
     *
     * @return the new value
     */
    public long incrSeq(String key) {
        return ((AppliedState.Seq) write(Command.incrSeq(key))).seq();
    }

    // ==================== Reads ====================

    /**
     * @return the value, or null if absent or expired
     */
    public SeqV getKv(String key) {
        GetKVResponse response = read(stub -> stub.getKV(GetKVRequest.newBuilder().setKey(key).build()));
        return response.hasValue() ? ApiCodec.fromProto(response.getValue()) : null;
    }

    /**
     * Values of several keys in request order; absent keys map to null.
     */
    public Map<String, SeqV> mgetKv(List<String> keys) {
        MGetKVResponse response = read(stub -> stub.mGetKV(MGetKVRequest.newBuilder().addAllKeys(keys).build()));
        return ApiCodec.fromItems(response.getItemsList());
    }

    public Map<String, SeqV> prefixList(String prefix) {
        PrefixListResponse response = read(stub ->
                stub.prefixList(PrefixListRequest.newBuilder().setPrefix(prefix).build()));
        return ApiCodec.fromItems(response.getItemsList());
    }

    /**
     * @return the registered node, or null
     */
    public Node getNode(NodeId id) {
        GetNodeResponse response = read(stub ->
                stub.getNode(GetNodeRequest.newBuilder().setNodeId(id.id()).build()));
        return response.hasNode() ? ApiCodec.fromProto(response.getNode()) : null;
    }

    public List<Node> listNodes() {
        ListNodesResponse response = read(stub -> stub.listNodes(ListNodesRequest.getDefaultInstance()));
        return response.getNodesList().stream().map(ApiCodec::fromProto).toList();
    }

    /**
     * Consensus metrics of the server the client currently talks to.
     */
    public MetricsResponse metrics() {
        return read(stub -> stub.getMetrics(GetMetricsRequest.getDefaultInstance()));
    }

    private <T> T read(Function<MetaServiceGrpc.MetaServiceBlockingStub, T> call) {
        StatusRuntimeException lastException = null;

        for (int attempt = 0; attempt < MAX_RETRIES; attempt++) {
            String address = leaderAddress;
            try {
                return call.apply(getStub(address).withDeadlineAfter(DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS));
            } catch (StatusRuntimeException e) {
                lastException = e;
                logger.debug("Read from {} failed: {}", address, e.getMessage());
                leaderAddress = getNextServer();
            }
        }

        throw new MetaClientException("Failed after " + MAX_RETRIES + " retries", lastException);
    }

    /**
     * Returns {@code command} with a transaction id of this client, unless it
     * already carries one.
     *
     * <p>The server remembers only the latest serial per transaction client, so
     * each calling thread writes as its own client and its serials increase.
     */
    public Command attachTxid(Command command) {
        if (command.txid() != null) {
            return command;
        }
        String client = clientId + "-" + Thread.currentThread().getId();
        return new Command(new Txid(client, txSerial.incrementAndGet()), command.cmd());
    }

    private void backoff() {
        try {
            Thread.sleep(RETRY_BACKOFF_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetaClientException("Interrupted while retrying", e);
        }
    }

    /**
     * Get the next server address (round-robin, thread-safe).
     */
    private String getNextServer() {
        int index = currentServerIndex.updateAndGet(i -> (i + 1) % serverAddresses.size());
        return serverAddresses.get(index);
    }

    private MetaServiceGrpc.MetaServiceBlockingStub getStub(String address) {
        return stubs.computeIfAbsent(address, addr -> MetaServiceGrpc.newBlockingStub(getChannel(addr)));
    }

    private ManagedChannel getChannel(String address) {
        return channels.computeIfAbsent(address, addr -> {
            int colon = addr.lastIndexOf(':');
            String host = addr.substring(0, colon);
            int port = Integer.parseInt(addr.substring(colon + 1));

            return ManagedChannelBuilder.forAddress(host, port)
                    .usePlaintext()
                    .build();
        });
    }

    /**
     * The address writes are currently sent to.
     */
    public String getLeaderAddress() {
        return leaderAddress;
    }

    @Override
    public void close() {
        for (ManagedChannel channel : channels.values()) {
            try {
                channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                channel.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channels.clear();
        stubs.clear();
    }

    /**
     * Exception thrown by the meta client.
     */
    public static class MetaClientException extends RuntimeException {
        public MetaClientException(String message) {
            super(message);
        }

        public MetaClientException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
