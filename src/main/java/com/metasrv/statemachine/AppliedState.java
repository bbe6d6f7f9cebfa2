package com.metasrv.statemachine;

import java.io.*;

/**
 * Result of applying one log entry, returned to the proposer.
 *
 * <p>A conditional update whose precondition does not hold is not an error:
 * it yields a {@link KV} whose {@code prev} and {@code result} are the same
 * value.
 */
public sealed interface AppliedState
        permits AppliedState.KV, AppliedState.Seq, AppliedState.NodeChange, AppliedState.Nothing {

    /**
     * Value of a key before and after an upsert. Either side is {@code null}
     * when the key was absent.
     */
    record KV(SeqV prev, SeqV result) implements AppliedState {

        /**
         * Whether the upsert changed the stored value.
         */
        public boolean changed() {
            return !java.util.Objects.equals(prev, result);
        }
    }

    /**
     * New value of a counter.
     */
    record Seq(long seq) implements AppliedState {
    }

    /**
     * Node descriptor before and after an add or remove.
     */
    record NodeChange(Node prev, Node result) implements AppliedState {
    }

    /**
     * Result of entries that carry no command: blank and membership entries.
     */
    record Nothing() implements AppliedState {
    }

    AppliedState NOTHING = new Nothing();

    default byte[] toBytes() {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(bos)) {
            writeTo(this, dos);
            dos.flush();
            return bos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize applied state", e);
        }
    }

    static AppliedState fromBytes(byte[] bytes) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(bytes))) {
            return readFrom(dis);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to deserialize applied state", e);
        }
    }

    static void writeTo(AppliedState state, DataOutputStream dos) throws IOException {
        if (state instanceof KV kv) {
            dos.writeByte(1);
            BinaryCodec.writeSeqV(dos, kv.prev());
            BinaryCodec.writeSeqV(dos, kv.result());
        } else if (state instanceof Seq seq) {
            dos.writeByte(2);
            dos.writeLong(seq.seq());
        } else if (state instanceof NodeChange change) {
            dos.writeByte(3);
            BinaryCodec.writeNode(dos, change.prev());
            BinaryCodec.writeNode(dos, change.result());
        } else {
            dos.writeByte(0);
        }
    }

    static AppliedState readFrom(DataInputStream dis) throws IOException {
        byte tag = dis.readByte();
        return switch (tag) {
            case 0 -> NOTHING;
            case 1 -> {
                SeqV prev = BinaryCodec.readSeqV(dis);
                yield new KV(prev, BinaryCodec.readSeqV(dis));
            }
            case 2 -> new Seq(dis.readLong());
            case 3 -> {
                Node prev = BinaryCodec.readNode(dis);
                yield new NodeChange(prev, BinaryCodec.readNode(dis));
            }
            default -> throw new IOException("Unknown applied state tag: " + tag);
        };
    }
}
