package com.metasrv.rpc;

import com.google.protobuf.ByteString;
import com.metasrv.core.NodeId;
import com.metasrv.rpc.proto.KVItem;
import com.metasrv.rpc.proto.KVValue;
import com.metasrv.rpc.proto.NodeInfo;
import com.metasrv.statemachine.Endpoint;
import com.metasrv.statemachine.KVMeta;
import com.metasrv.statemachine.Node;
import com.metasrv.statemachine.SeqV;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between state machine values and the messages of the client
 * API, shared by the server side and {@link com.metasrv.client.MetaClient}.
 */
public final class ApiCodec {

    private ApiCodec() {
    }

    public static KVValue toProto(SeqV value) {
        KVValue.Builder builder = KVValue.newBuilder()
                .setSeq(value.seq())
                .setData(ByteString.copyFrom(value.data()));
        if (value.meta() != null && value.meta().expireAt() != null) {
            builder.setExpireAt(value.meta().expireAt());
        }
        return builder.build();
    }

    public static SeqV fromProto(KVValue value) {
        KVMeta meta = value.hasExpireAt() ? KVMeta.expireAt(value.getExpireAt()) : null;
        return new SeqV(value.getSeq(), meta, value.getData().toByteArray());
    }

    public static NodeInfo toProto(Node node) {
        NodeInfo.Builder builder = NodeInfo.newBuilder()
                .setId(node.id().id())
                .setName(node.name())
                .setEndpoint(node.endpoint().toString());
        if (node.grpcApiAddress() != null) {
            builder.setGrpcApiAddress(node.grpcApiAddress());
        }
        return builder.build();
    }

    public static Node fromProto(NodeInfo info) {
        String apiAddress = info.getGrpcApiAddress().isEmpty() ? null : info.getGrpcApiAddress();
        return new Node(NodeId.of(info.getId()), info.getName(), Endpoint.parse(info.getEndpoint()), apiAddress);
    }

    /**
     * Converts key-value pairs to items, skipping {@code null} values.
     */
    public static List<KVItem> toItems(Map<String, SeqV> values) {
        return values.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> KVItem.newBuilder()
                        .setKey(e.getKey())
                        .setValue(toProto(e.getValue()))
                        .build())
                .toList();
    }

    /**
     * Converts items back to an ordered map. Items without a value map to
     * {@code null}.
     */
    public static Map<String, SeqV> fromItems(List<KVItem> items) {
        Map<String, SeqV> result = new LinkedHashMap<>();
        for (KVItem item : items) {
            result.put(item.getKey(), item.hasValue() ? fromProto(item.getValue()) : null);
        }
        return result;
    }
}
