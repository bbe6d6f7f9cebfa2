package com.metasrv.statemachine;

import com.metasrv.core.NodeId;

import java.io.*;

/**
 * A client write as it is stored in the replicated log: the operation plus an
 * optional transaction id used to detect retries.
 *
 * <h2>Serialization</h2>
 * <p>Commands are stored in the payload of {@code NORMAL} log entries using
 * {@link #toBytes()} and read back with {@link #fromBytes(byte[])}:
 * <pre>
 * [bool: has txid] [client string, 8 bytes serial]?
 * [4 bytes: kind ordinal] [kind specific fields]
 * </pre>
 *
 * <pre>{@code
 * Command cmd = Command.of(Cmd.UpsertKV.update("foo", "1"));
 * byte[] bytes = cmd.toBytes();
 * Command restored = Command.fromBytes(bytes);
 * }</pre>
 *
 * @param txid transaction id, may be {@code null}
 * @param cmd the operation
 * @see MetaStateMachine
 */
public record Command(Txid txid, Cmd cmd) {

    public static Command of(Cmd cmd) {
        return new Command(null, cmd);
    }

    public static Command upsert(String key, String value) {
        return of(Cmd.UpsertKV.update(key, value));
    }

    public static Command delete(String key) {
        return of(Cmd.UpsertKV.delete(key));
    }

    public static Command incrSeq(String key) {
        return of(new Cmd.IncrSeq(key));
    }

    public static Command addNode(Node node) {
        return of(new Cmd.AddNode(node.id(), node));
    }

    public static Command removeNode(NodeId id) {
        return of(new Cmd.RemoveNode(id));
    }

    public byte[] toBytes() {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(bos)) {

            dos.writeBoolean(txid != null);
            if (txid != null) {
                BinaryCodec.writeString(dos, txid.client());
                dos.writeLong(txid.serial());
            }

            dos.writeInt(cmd.kind().ordinal());
            switch (cmd.kind()) {
                case UPSERT_KV -> {
                    Cmd.UpsertKV upsert = (Cmd.UpsertKV) cmd;
                    BinaryCodec.writeString(dos, upsert.key());
                    dos.writeInt(upsert.seq().kind().ordinal());
                    dos.writeLong(upsert.seq().seq());
                    dos.writeBoolean(upsert.value().isDelete());
                    if (!upsert.value().isDelete()) {
                        BinaryCodec.writeBytes(dos, upsert.value().value());
                    }
                    BinaryCodec.writeMeta(dos, upsert.valueMeta());
                }
                case INCR_SEQ -> BinaryCodec.writeString(dos, ((Cmd.IncrSeq) cmd).key());
                case ADD_NODE -> {
                    Cmd.AddNode add = (Cmd.AddNode) cmd;
                    dos.writeLong(add.id().id());
                    BinaryCodec.writeNode(dos, add.node());
                }
                case REMOVE_NODE -> dos.writeLong(((Cmd.RemoveNode) cmd).id().id());
            }

            dos.flush();
            return bos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize command", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a valid command
     */
    public static Command fromBytes(byte[] bytes) {
        try (ByteArrayInputStream bis = new ByteArrayInputStream(bytes);
             DataInputStream dis = new DataInputStream(bis)) {

            Txid txid = null;
            if (dis.readBoolean()) {
                String client = BinaryCodec.readString(dis);
                txid = new Txid(client, dis.readLong());
            }

            int ordinal = dis.readInt();
            Cmd.Kind[] kinds = Cmd.Kind.values();
            if (ordinal < 0 || ordinal >= kinds.length) {
                throw new IllegalArgumentException("Unknown command kind: " + ordinal);
            }

            Cmd cmd = switch (kinds[ordinal]) {
                case UPSERT_KV -> {
                    String key = BinaryCodec.readString(dis);
                    MatchSeq.Kind matchKind = MatchSeq.Kind.values()[dis.readInt()];
                    MatchSeq matchSeq = new MatchSeq(matchKind, dis.readLong());
                    Operation op = dis.readBoolean()
                            ? Operation.delete()
                            : Operation.update(BinaryCodec.readBytes(dis));
                    yield new Cmd.UpsertKV(key, matchSeq, op, BinaryCodec.readMeta(dis));
                }
                case INCR_SEQ -> new Cmd.IncrSeq(BinaryCodec.readString(dis));
                case ADD_NODE -> {
                    NodeId id = NodeId.of(dis.readLong());
                    yield new Cmd.AddNode(id, BinaryCodec.readNode(dis));
                }
                case REMOVE_NODE -> new Cmd.RemoveNode(NodeId.of(dis.readLong()));
            };

            return new Command(txid, cmd);
        } catch (IOException | ArrayIndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Failed to deserialize command", e);
        }
    }
}
