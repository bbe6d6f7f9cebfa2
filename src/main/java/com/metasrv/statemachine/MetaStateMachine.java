package com.metasrv.statemachine;

import com.metasrv.core.NodeId;
import com.metasrv.persistence.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * The metadata state machine: a flat versioned key-value namespace, named
 * counters and the registry of cluster nodes.
 *
 * <h2>Versioning</h2>
 * <p>Every update of a key gets a fresh sequence number minted from the
 * counter {@value #GENERIC_KV_SEQ}, so sequence numbers are unique across all
 * keys and strictly increasing in apply order. An absent key has sequence 0.
 *
 * <h2>Expiry</h2>
 * <p>Values may carry an expiry time. Apply ignores it; only the read methods
 * hide expired values, using the clock given at construction.
 *
 * <h2>Snapshot Format</h2>
 * <pre>
 * [int n][key, SeqV]*n        kvs
 * [int n][name, long]*n       counters
 * [int n][Node]*n             node registry
 * [int n][client, serial, AppliedState]*n   last applied txid per client
 * [long lastAppliedIndex]
 * </pre>
 *
 * <p>All access goes through a read-write lock; the apply thread is the only
 * writer, readers see immutable values.
 */
public class MetaStateMachine implements StateMachine {

    private static final Logger logger = LoggerFactory.getLogger(MetaStateMachine.class);

    /** Counter used to mint the sequence numbers of key-value updates. */
    public static final String GENERIC_KV_SEQ = "generic-kv";

    private final TreeMap<String, SeqV> kvs = new TreeMap<>();
    private final TreeMap<String, Long> sequences = new TreeMap<>();
    private final TreeMap<NodeId, Node> nodes = new TreeMap<>();
    private final Map<String, ClientLast> clientLast = new HashMap<>();
    private long lastAppliedIndex = 0;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final LongSupplier clockSeconds;

    private record ClientLast(long serial, AppliedState result) {
    }

    public MetaStateMachine() {
        this(() -> System.currentTimeMillis() / 1000);
    }

    /**
     * @param clockSeconds current time in epoch seconds, used by reads to hide
     *                     expired values
     */
    public MetaStateMachine(LongSupplier clockSeconds) {
        this.clockSeconds = clockSeconds;
    }

    // ==================== Apply ====================

    @Override
    public AppliedState apply(long index, Command command) {
        lock.writeLock().lock();
        try {
            Txid txid = command.txid();
            if (txid != null) {
                ClientLast last = clientLast.get(txid.client());
                if (last != null && last.serial() == txid.serial()) {
                    logger.debug("Duplicate txid {} at index {}, returning previous result", txid, index);
                    lastAppliedIndex = index;
                    return last.result();
                }
            }

            Cmd cmd = command.cmd();
            AppliedState result = switch (cmd.kind()) {
                case UPSERT_KV -> applyUpsert((Cmd.UpsertKV) cmd);
                case INCR_SEQ -> new AppliedState.Seq(incrSeq(((Cmd.IncrSeq) cmd).key()));
                case ADD_NODE -> applyAddNode((Cmd.AddNode) cmd);
                case REMOVE_NODE -> applyRemoveNode((Cmd.RemoveNode) cmd);
            };

            if (txid != null) {
                clientLast.put(txid.client(), new ClientLast(txid.serial(), result));
            }
            lastAppliedIndex = index;

            logger.trace("Applied index {}: {} -> {}", index, cmd, result);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks {@code index} applied for entries that carry no command.
     */
    public void applyNothing(long index) {
        lock.writeLock().lock();
        try {
            lastAppliedIndex = index;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private AppliedState applyUpsert(Cmd.UpsertKV upsert) {
        SeqV prev = kvs.get(upsert.key());
        long currentSeq = prev != null ? prev.seq() : 0;

        if (!upsert.seq().matches(currentSeq)) {
            logger.debug("Upsert {} not applied: seq {} does not match {}", upsert.key(), currentSeq, upsert.seq());
            return new AppliedState.KV(prev, prev);
        }

        if (upsert.value().isDelete()) {
            if (prev == null) {
                return new AppliedState.KV(null, null);
            }
            kvs.remove(upsert.key());
            return new AppliedState.KV(prev, null);
        }

        long seq = incrSeq(GENERIC_KV_SEQ);
        SeqV result = new SeqV(seq, upsert.valueMeta(), upsert.value().value());
        kvs.put(upsert.key(), result);
        return new AppliedState.KV(prev, result);
    }

    private long incrSeq(String key) {
        return sequences.merge(key, 1L, Long::sum);
    }

    private AppliedState applyAddNode(Cmd.AddNode add) {
        Node node = add.node().id().equals(add.id())
                ? add.node()
                : new Node(add.id(), add.node().name(), add.node().endpoint(), add.node().grpcApiAddress());
        Node prev = nodes.put(add.id(), node);
        logger.info("Node {} registered at {}{}", add.id(), node.endpoint(), prev != null ? " (replaced)" : "");
        return new AppliedState.NodeChange(prev, node);
    }

    private AppliedState applyRemoveNode(Cmd.RemoveNode remove) {
        Node prev = nodes.remove(remove.id());
        if (prev != null) {
            logger.info("Node {} removed", remove.id());
        }
        return new AppliedState.NodeChange(prev, null);
    }

    // ==================== Reads ====================

    /**
     * Returns the value of {@code key}, or {@code null} if absent or expired.
     */
    public SeqV getKv(String key) {
        lock.readLock().lock();
        try {
            return visible(kvs.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the values of several keys in request order; absent or expired
     * keys map to {@code null}.
     */
    public Map<String, SeqV> mgetKv(List<String> keys) {
        lock.readLock().lock();
        try {
            Map<String, SeqV> result = new LinkedHashMap<>();
            for (String key : keys) {
                result.put(key, visible(kvs.get(key)));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns all live entries whose key starts with {@code prefix}, in key
     * order.
     */
    public Map<String, SeqV> prefixList(String prefix) {
        lock.readLock().lock();
        try {
            Map<String, SeqV> result = new LinkedHashMap<>();
            for (Map.Entry<String, SeqV> e : kvs.tailMap(prefix, true).entrySet()) {
                if (!e.getKey().startsWith(prefix)) {
                    break;
                }
                SeqV v = visible(e.getValue());
                if (v != null) {
                    result.put(e.getKey(), v);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private SeqV visible(SeqV v) {
        if (v == null || v.isExpired(clockSeconds.getAsLong())) {
            return null;
        }
        return v;
    }

    /**
     * Returns the current value of a counter, 0 if it was never incremented.
     */
    public long getSeq(String key) {
        lock.readLock().lock();
        try {
            return sequences.getOrDefault(key, 0L);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Node getNode(NodeId id) {
        lock.readLock().lock();
        try {
            return nodes.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns all registered nodes ordered by id.
     */
    public List<Node> listNodes() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(nodes.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getLastAppliedIndex() {
        lock.readLock().lock();
        try {
            return lastAppliedIndex;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Snapshot ====================

    @Override
    public byte[] takeSnapshot() {
        lock.readLock().lock();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {

            dos.writeInt(kvs.size());
            for (Map.Entry<String, SeqV> e : kvs.entrySet()) {
                BinaryCodec.writeString(dos, e.getKey());
                BinaryCodec.writeSeqV(dos, e.getValue());
            }

            dos.writeInt(sequences.size());
            for (Map.Entry<String, Long> e : sequences.entrySet()) {
                BinaryCodec.writeString(dos, e.getKey());
                dos.writeLong(e.getValue());
            }

            dos.writeInt(nodes.size());
            for (Node node : nodes.values()) {
                BinaryCodec.writeNode(dos, node);
            }

            TreeMap<String, ClientLast> sortedClients = new TreeMap<>(clientLast);
            dos.writeInt(sortedClients.size());
            for (Map.Entry<String, ClientLast> e : sortedClients.entrySet()) {
                BinaryCodec.writeString(dos, e.getKey());
                dos.writeLong(e.getValue().serial());
                AppliedState.writeTo(e.getValue().result(), dos);
            }

            dos.writeLong(lastAppliedIndex);

            dos.flush();
            byte[] snapshot = baos.toByteArray();
            logger.debug("Created snapshot at index {}: {} kvs, {} nodes, {} bytes",
                    lastAppliedIndex, kvs.size(), nodes.size(), snapshot.length);
            return snapshot;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create snapshot", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws StorageException if the snapshot cannot be decoded
     */
    @Override
    public void restoreSnapshot(byte[] data) {
        lock.writeLock().lock();
        try {
            kvs.clear();
            sequences.clear();
            nodes.clear();
            clientLast.clear();
            lastAppliedIndex = 0;

            if (data == null || data.length == 0) {
                logger.debug("Restored empty snapshot");
                return;
            }

            try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data))) {
                int n = dis.readInt();
                for (int i = 0; i < n; i++) {
                    String key = BinaryCodec.readString(dis);
                    kvs.put(key, BinaryCodec.readSeqV(dis));
                }

                n = dis.readInt();
                for (int i = 0; i < n; i++) {
                    String key = BinaryCodec.readString(dis);
                    sequences.put(key, dis.readLong());
                }

                n = dis.readInt();
                for (int i = 0; i < n; i++) {
                    Node node = BinaryCodec.readNode(dis);
                    nodes.put(node.id(), node);
                }

                n = dis.readInt();
                for (int i = 0; i < n; i++) {
                    String client = BinaryCodec.readString(dis);
                    long serial = dis.readLong();
                    clientLast.put(client, new ClientLast(serial, AppliedState.readFrom(dis)));
                }

                lastAppliedIndex = dis.readLong();
            } catch (IOException e) {
                throw new StorageException("Failed to restore snapshot", e);
            }

            logger.debug("Restored snapshot at index {}: {} kvs, {} nodes", lastAppliedIndex, kvs.size(), nodes.size());
        } finally {
            lock.writeLock().unlock();
        }
    }
}
