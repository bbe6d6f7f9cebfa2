package com.metasrv.statemachine;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for the {@code DataOutputStream} encodings of state machine values.
 * Nullable fields are prefixed with a presence flag.
 */
final class BinaryCodec {

    private BinaryCodec() {
    }

    static void writeString(DataOutputStream dos, String s) throws IOException {
        writeBytes(dos, s.getBytes(StandardCharsets.UTF_8));
    }

    static String readString(DataInputStream dis) throws IOException {
        return new String(readBytes(dis), StandardCharsets.UTF_8);
    }

    static void writeNullableString(DataOutputStream dos, String s) throws IOException {
        dos.writeBoolean(s != null);
        if (s != null) {
            writeString(dos, s);
        }
    }

    static String readNullableString(DataInputStream dis) throws IOException {
        return dis.readBoolean() ? readString(dis) : null;
    }

    static void writeBytes(DataOutputStream dos, byte[] bytes) throws IOException {
        dos.writeInt(bytes.length);
        dos.write(bytes);
    }

    static byte[] readBytes(DataInputStream dis) throws IOException {
        int len = dis.readInt();
        if (len < 0) {
            throw new IOException("Negative length: " + len);
        }
        byte[] bytes = new byte[len];
        dis.readFully(bytes);
        return bytes;
    }

    static void writeSeqV(DataOutputStream dos, SeqV v) throws IOException {
        dos.writeBoolean(v != null);
        if (v == null) {
            return;
        }
        dos.writeLong(v.seq());
        writeMeta(dos, v.meta());
        writeBytes(dos, v.data());
    }

    static SeqV readSeqV(DataInputStream dis) throws IOException {
        if (!dis.readBoolean()) {
            return null;
        }
        long seq = dis.readLong();
        KVMeta meta = readMeta(dis);
        return new SeqV(seq, meta, readBytes(dis));
    }

    static void writeMeta(DataOutputStream dos, KVMeta meta) throws IOException {
        boolean hasExpire = meta != null && meta.expireAt() != null;
        dos.writeBoolean(meta != null);
        if (meta != null) {
            dos.writeBoolean(hasExpire);
            if (hasExpire) {
                dos.writeLong(meta.expireAt());
            }
        }
    }

    static KVMeta readMeta(DataInputStream dis) throws IOException {
        if (!dis.readBoolean()) {
            return null;
        }
        return new KVMeta(dis.readBoolean() ? dis.readLong() : null);
    }

    static void writeNode(DataOutputStream dos, Node node) throws IOException {
        dos.writeBoolean(node != null);
        if (node == null) {
            return;
        }
        dos.writeLong(node.id().id());
        writeString(dos, node.name());
        writeString(dos, node.endpoint().toString());
        writeNullableString(dos, node.grpcApiAddress());
    }

    static Node readNode(DataInputStream dis) throws IOException {
        if (!dis.readBoolean()) {
            return null;
        }
        long id = dis.readLong();
        String name = readString(dis);
        Endpoint endpoint = Endpoint.parse(readString(dis));
        return new Node(com.metasrv.core.NodeId.of(id), name, endpoint, readNullableString(dis));
    }
}
