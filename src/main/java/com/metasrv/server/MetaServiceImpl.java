package com.metasrv.server;

import com.google.protobuf.ByteString;
import com.metasrv.core.ForwardToLeaderException;
import com.metasrv.core.NodeId;
import com.metasrv.core.RaftMetrics;
import com.metasrv.meta.MetaNode;
import com.metasrv.meta.RetryableException;
import com.metasrv.rpc.ApiCodec;
import com.metasrv.rpc.proto.*;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Command;
import com.metasrv.statemachine.Node;
import com.metasrv.statemachine.SeqV;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * gRPC service implementation of the client API.
 *
 * <p>Handles the {@code MetaService} defined in the protobuf schema by
 * delegating to a {@link MetaNode}.
 *
 * <h2>Request Handling</h2>
 * <ul>
 *   <li><b>Write</b> - goes through consensus; a node that is not the leader
 *       forwards it within the configured hop budget</li>
 *   <li><b>Reads</b> - served from the local state machine (may be stale)</li>
 * </ul>
 *
 * <h2>Leader Redirection</h2>
 * <p>When a write cannot reach the leader, the response carries a
 * {@code forward_to_leader} hint with the leader id and, if registered, its
 * API address, so clients can redirect.
 *
 * @see com.metasrv.client.MetaClient
 */
public class MetaServiceImpl extends MetaServiceGrpc.MetaServiceImplBase {

    private static final Logger logger = LoggerFactory.getLogger(MetaServiceImpl.class);

    private final MetaNode metaNode;

    public MetaServiceImpl(MetaNode metaNode) {
        this.metaNode = metaNode;
    }

    @Override
    public void write(WriteRequest request, StreamObserver<WriteResponse> responseObserver) {
        MDC.put("nodeId", metaNode.getId().toString());

        Command command;
        try {
            command = Command.fromBytes(request.getCommand().toByteArray());
        } catch (IllegalArgumentException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .asRuntimeException());
            return;
        }

        logger.debug("Received write: {}", command);
        WriteResponse.Builder response = WriteResponse.newBuilder();
        try {
            AppliedState result = metaNode.write(command);
            response.setAppliedState(ByteString.copyFrom(result.toBytes()));
        } catch (ForwardToLeaderException e) {
            response.setForwardToLeader(metaNode.forwardToLeader(e.getLeaderId()));
        } catch (RetryableException e) {
            response.setRetryable(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error handling write {}", command, e);
            response.setError("Internal error: " + e.getMessage());
        }
        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }

    @Override
    public void getKV(GetKVRequest request, StreamObserver<GetKVResponse> responseObserver) {
        serve("GetKV", () -> {
            GetKVResponse.Builder builder = GetKVResponse.newBuilder();
            SeqV value = metaNode.getKv(request.getKey());
            if (value != null) {
                builder.setValue(ApiCodec.toProto(value));
            }
            return builder.build();
        }, responseObserver);
    }

    @Override
    public void mGetKV(MGetKVRequest request, StreamObserver<MGetKVResponse> responseObserver) {
        serve("MGetKV", () -> {
            MGetKVResponse.Builder builder = MGetKVResponse.newBuilder();
            // absent keys are kept as items without value
            for (Map.Entry<String, SeqV> e : metaNode.mgetKv(request.getKeysList()).entrySet()) {
                KVItem.Builder item = KVItem.newBuilder().setKey(e.getKey());
                if (e.getValue() != null) {
                    item.setValue(ApiCodec.toProto(e.getValue()));
                }
                builder.addItems(item);
            }
            return builder.build();
        }, responseObserver);
    }

    @Override
    public void prefixList(PrefixListRequest request, StreamObserver<PrefixListResponse> responseObserver) {
        serve("PrefixList", () -> PrefixListResponse.newBuilder()
                .addAllItems(ApiCodec.toItems(metaNode.prefixList(request.getPrefix())))
                .build(), responseObserver);
    }

    @Override
    public void getNode(GetNodeRequest request, StreamObserver<GetNodeResponse> responseObserver) {
        serve("GetNode", () -> {
            GetNodeResponse.Builder builder = GetNodeResponse.newBuilder();
            Node node = metaNode.getNode(NodeId.of(request.getNodeId()));
            if (node != null) {
                builder.setNode(ApiCodec.toProto(node));
            }
            return builder.build();
        }, responseObserver);
    }

    @Override
    public void listNodes(ListNodesRequest request, StreamObserver<ListNodesResponse> responseObserver) {
        serve("ListNodes", () -> {
            ListNodesResponse.Builder builder = ListNodesResponse.newBuilder();
            for (Node node : metaNode.listNodes()) {
                builder.addNodes(ApiCodec.toProto(node));
            }
            return builder.build();
        }, responseObserver);
    }

    @Override
    public void getMetrics(GetMetricsRequest request, StreamObserver<MetricsResponse> responseObserver) {
        serve("GetMetrics", () -> toProto(metaNode.metrics().current()), responseObserver);
    }

    private static MetricsResponse toProto(RaftMetrics metrics) {
        MetricsResponse.Builder builder = MetricsResponse.newBuilder()
                .setId(metrics.id().id())
                .setRole(metrics.role().name())
                .setCurrentTerm(metrics.currentTerm())
                .setLastLogIndex(metrics.lastLogIndex())
                .setLastApplied(metrics.lastApplied());
        if (metrics.currentLeader() != null) {
            builder.setCurrentLeader(metrics.currentLeader().id());
        }
        metrics.membership().voters().forEach(id -> builder.addVoters(id.id()));
        metrics.membership().learners().forEach(id -> builder.addLearners(id.id()));
        if (metrics.snapshot() != null) {
            builder.setSnapshotIndex(metrics.snapshot().lastIncludedIndex())
                    .setSnapshotTerm(metrics.snapshot().lastIncludedTerm());
        }
        return builder.build();
    }

    private <T> void serve(String rpcName, Callable<T> body, StreamObserver<T> responseObserver) {
        MDC.put("nodeId", metaNode.getId().toString());
        try {
            T response = body.call();
            responseObserver.onNext(response);
            responseObserver.onCompleted();
        } catch (Exception e) {
            logger.error("Error handling {}", rpcName, e);
            responseObserver.onError(Status.INTERNAL
                    .withDescription(e.getMessage())
                    .asRuntimeException());
        }
    }
}
