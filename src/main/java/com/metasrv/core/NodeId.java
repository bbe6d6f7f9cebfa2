package com.metasrv.core;

/**
 * Immutable unique identifier for a node in the metadata cluster.
 *
 * <p>Node ids are unsigned 64-bit numbers. The id is used for:
 * <ul>
 *   <li>Identifying the source and target of RPC messages</li>
 *   <li>Tracking vote grants and the voted-for candidate in hard state</li>
 *   <li>Keys of the node registry kept in the state machine</li>
 *   <li>Membership sets (voters and learners)</li>
 * </ul>
 *
 * <p>Node {@code 0} is, by convention, the node that boots a brand-new cluster.
 *
 * @see RaftNode
 */
public record NodeId(long id) implements Comparable<NodeId> {

    /**
     * Constructs a new {@code NodeId} with validation.
     *
     * @param id the numeric id
     * @throws IllegalArgumentException if {@code id} is negative
     */
    public NodeId {
        if (id < 0) {
            throw new IllegalArgumentException("Node ID cannot be negative: " + id);
        }
    }

    /**
     * Factory method to create a new {@code NodeId}.
     *
     * @param id the numeric id
     * @return a new {@code NodeId} instance
     */
    public static NodeId of(long id) {
        return new NodeId(id);
    }

    /**
     * Parses a node id from its decimal text form.
     */
    public static NodeId parse(String text) {
        return new NodeId(Long.parseLong(text.trim()));
    }

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(id, other.id);
    }

    @Override
    public String toString() {
        return Long.toString(id);
    }
}
