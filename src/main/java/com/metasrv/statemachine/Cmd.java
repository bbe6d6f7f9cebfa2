package com.metasrv.statemachine;

import com.metasrv.core.NodeId;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The operations the metadata state machine understands.
 *
 * <p>The set is closed: {@link MetaStateMachine#apply(long, Command)} switches
 * over {@link #kind()} and must handle every case.
 */
public sealed interface Cmd permits Cmd.UpsertKV, Cmd.IncrSeq, Cmd.AddNode, Cmd.RemoveNode {

    enum Kind {
        UPSERT_KV,
        INCR_SEQ,
        ADD_NODE,
        REMOVE_NODE
    }

    Kind kind();

    /**
     * Conditionally updates or deletes a key.
     *
     * @param key the key
     * @param seq precondition on the current sequence of the key
     * @param value update or delete
     * @param valueMeta metadata for the new value, may be {@code null}
     */
    record UpsertKV(String key, MatchSeq seq, Operation value, KVMeta valueMeta) implements Cmd {

        public UpsertKV {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(seq, "seq");
            Objects.requireNonNull(value, "value");
        }

        public static UpsertKV update(String key, byte[] value) {
            return new UpsertKV(key, MatchSeq.ANY, Operation.update(value), null);
        }

        public static UpsertKV update(String key, String value) {
            return update(key, value.getBytes(StandardCharsets.UTF_8));
        }

        public static UpsertKV delete(String key) {
            return new UpsertKV(key, MatchSeq.ANY, Operation.delete(), null);
        }

        public UpsertKV withSeq(MatchSeq matchSeq) {
            return new UpsertKV(key, matchSeq, value, valueMeta);
        }

        public UpsertKV withMeta(KVMeta meta) {
            return new UpsertKV(key, seq, value, meta);
        }

        @Override
        public Kind kind() {
            return Kind.UPSERT_KV;
        }
    }

    /**
     * Increments a named counter and returns the new value.
     */
    record IncrSeq(String key) implements Cmd {

        public IncrSeq {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public Kind kind() {
            return Kind.INCR_SEQ;
        }
    }

    /**
     * Inserts or replaces a node descriptor.
     */
    record AddNode(NodeId id, Node node) implements Cmd {

        public AddNode {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(node, "node");
        }

        @Override
        public Kind kind() {
            return Kind.ADD_NODE;
        }
    }

    /**
     * Removes a node descriptor.
     */
    record RemoveNode(NodeId id) implements Cmd {

        public RemoveNode {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public Kind kind() {
            return Kind.REMOVE_NODE;
        }
    }
}
