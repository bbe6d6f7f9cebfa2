package com.metasrv.rpc;

import com.metasrv.core.NodeId;
import com.metasrv.rpc.proto.KVItem;
import com.metasrv.rpc.proto.KVValue;
import com.metasrv.statemachine.Endpoint;
import com.metasrv.statemachine.KVMeta;
import com.metasrv.statemachine.Node;
import com.metasrv.statemachine.SeqV;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiCodecTest {

    @Test
    @DisplayName("Expiry is carried only when present")
    void testKvValue() {
        SeqV plain = SeqV.of(4, "v".getBytes());
        SeqV expiring = new SeqV(5, KVMeta.expireAt(1234), "w".getBytes());

        KVValue plainProto = ApiCodec.toProto(plain);
        assertThat(plainProto.hasExpireAt()).isFalse();
        assertThat(ApiCodec.fromProto(plainProto)).isEqualTo(plain);

        KVValue expiringProto = ApiCodec.toProto(expiring);
        assertThat(expiringProto.getExpireAt()).isEqualTo(1234);
        assertThat(ApiCodec.fromProto(expiringProto)).isEqualTo(expiring);
    }

    @Test
    @DisplayName("Node info keeps a missing API address absent")
    void testNodeInfo() {
        Node withApi = new Node(NodeId.of(1), "one", new Endpoint("h", 1), "h:9191");
        Node withoutApi = Node.of(NodeId.of(2), new Endpoint("h", 2));

        assertThat(ApiCodec.fromProto(ApiCodec.toProto(withApi))).isEqualTo(withApi);
        assertThat(ApiCodec.fromProto(ApiCodec.toProto(withoutApi)).grpcApiAddress()).isNull();
    }

    @Test
    @DisplayName("Items drop null values and keep order")
    void testItems() {
        Map<String, SeqV> values = new LinkedHashMap<>();
        values.put("b", SeqV.of(2, "2".getBytes()));
        values.put("missing", null);
        values.put("a", SeqV.of(1, "1".getBytes()));

        List<KVItem> items = ApiCodec.toItems(values);
        assertThat(items).extracting(KVItem::getKey).containsExactly("b", "a");

        List<KVItem> withAbsent = List.of(KVItem.newBuilder().setKey("x").build());
        assertThat(ApiCodec.fromItems(withAbsent)).containsEntry("x", null);
    }
}
