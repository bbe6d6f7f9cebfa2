package com.metasrv.core;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A cluster membership configuration: the voting members and the non-voting
 * learners.
 *
 * <p>The two sets are disjoint. Membership changes are committed to the log as
 * {@code MEMBERSHIP} entries; the most recent entry in the log is the effective
 * configuration.
 *
 * @param voters nodes counted toward the commit quorum
 * @param learners nodes receiving replication without voting
 */
public record Membership(Set<NodeId> voters, Set<NodeId> learners) {

    private static final Membership EMPTY = new Membership(Set.of(), Set.of());

    public Membership {
        TreeSet<NodeId> v = new TreeSet<>(voters);
        TreeSet<NodeId> l = new TreeSet<>(learners);
        l.removeAll(v);
        voters = Collections.unmodifiableSet(v);
        learners = Collections.unmodifiableSet(l);
    }

    public static Membership empty() {
        return EMPTY;
    }

    public static Membership ofVoters(Set<NodeId> voters) {
        return new Membership(voters, Set.of());
    }

    public boolean isEmpty() {
        return voters.isEmpty() && learners.isEmpty();
    }

    public boolean isVoter(NodeId id) {
        return voters.contains(id);
    }

    public boolean isLearner(NodeId id) {
        return learners.contains(id);
    }

    public boolean contains(NodeId id) {
        return isVoter(id) || isLearner(id);
    }

    /**
     * Returns all members, voters first.
     */
    public Set<NodeId> allMembers() {
        TreeSet<NodeId> all = new TreeSet<>(voters);
        all.addAll(learners);
        return Collections.unmodifiableSet(all);
    }

    /**
     * Number of voter acknowledgements needed to commit.
     */
    public int quorum() {
        return voters.size() / 2 + 1;
    }

    public Membership withLearner(NodeId id) {
        if (contains(id)) {
            return this;
        }
        TreeSet<NodeId> l = new TreeSet<>(learners);
        l.add(id);
        return new Membership(voters, l);
    }

    public Membership without(NodeId id) {
        TreeSet<NodeId> v = new TreeSet<>(voters);
        TreeSet<NodeId> l = new TreeSet<>(learners);
        v.remove(id);
        l.remove(id);
        return new Membership(v, l);
    }

    /**
     * Builds the configuration with the given voter set; every other current
     * member is kept as a learner.
     */
    public Membership withVoters(Set<NodeId> newVoters) {
        TreeSet<NodeId> l = new TreeSet<>(allMembers());
        l.removeAll(newVoters);
        return new Membership(newVoters, l);
    }

    public byte[] toBytes() {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(bos)) {
            writeTo(dos);
            dos.flush();
            return bos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize membership", e);
        }
    }

    public static Membership fromBytes(byte[] bytes) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(bytes))) {
            return readFrom(dis);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to deserialize membership", e);
        }
    }

    public void writeTo(DataOutputStream dos) throws IOException {
        dos.writeInt(voters.size());
        for (NodeId id : voters) {
            dos.writeLong(id.id());
        }
        dos.writeInt(learners.size());
        for (NodeId id : learners) {
            dos.writeLong(id.id());
        }
    }

    public static Membership readFrom(DataInputStream dis) throws IOException {
        Set<NodeId> v = new TreeSet<>();
        int nv = dis.readInt();
        for (int i = 0; i < nv; i++) {
            v.add(NodeId.of(dis.readLong()));
        }
        Set<NodeId> l = new TreeSet<>();
        int nl = dis.readInt();
        for (int i = 0; i < nl; i++) {
            l.add(NodeId.of(dis.readLong()));
        }
        return new Membership(v, l);
    }

    @Override
    public String toString() {
        return "Membership{voters=" + voters + ", learners=" + learners + "}";
    }
}
