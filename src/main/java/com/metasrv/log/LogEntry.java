package com.metasrv.log;

import com.metasrv.core.Membership;
import com.metasrv.rpc.proto.EntryType;

import java.util.Arrays;

/**
 * A single record of the replicated log.
 *
 * <ul>
 *   <li>{@code index} - position in the log (1-indexed)</li>
 *   <li>{@code term} - term in which the leader created the entry</li>
 *   <li>{@code type} - {@link EntryType#NORMAL} for an encoded
 *       {@link com.metasrv.statemachine.Command}, {@link EntryType#BLANK} for the
 *       no-op a leader appends at the start of its term,
 *       {@link EntryType#MEMBERSHIP} for an encoded {@link Membership}</li>
 *   <li>{@code payload} - the encoded body, empty for blank entries</li>
 * </ul>
 *
 * @see LogManager
 */
public record LogEntry(
        long index,
        long term,
        EntryType type,
        byte[] payload
) {

    public static LogEntry of(long index, long term, EntryType type, byte[] payload) {
        return new LogEntry(index, term, type, payload != null ? payload.clone() : new byte[0]);
    }

    public static LogEntry blank(long index, long term) {
        return new LogEntry(index, term, EntryType.BLANK, new byte[0]);
    }

    public static LogEntry membership(long index, long term, Membership membership) {
        return new LogEntry(index, term, EntryType.MEMBERSHIP, membership.toBytes());
    }

    public boolean isMembership() {
        return type == EntryType.MEMBERSHIP;
    }

    /**
     * Decodes the payload of a membership entry.
     *
     * @throws IllegalStateException if this is not a membership entry
     */
    public Membership membership() {
        if (!isMembership()) {
            throw new IllegalStateException("Not a membership entry: " + this);
        }
        return Membership.fromBytes(payload);
    }

    /**
     * Returns a copy of this entry placed at another position. Used when the
     * leader assigns the final index under its append lock.
     */
    public LogEntry withPosition(long newIndex, long newTerm) {
        return new LogEntry(newIndex, newTerm, type, payload);
    }

    public com.metasrv.rpc.proto.LogEntry toProto() {
        return com.metasrv.rpc.proto.LogEntry.newBuilder()
                .setIndex(index)
                .setTerm(term)
                .setType(type)
                .setPayload(com.google.protobuf.ByteString.copyFrom(payload))
                .build();
    }

    public static LogEntry fromProto(com.metasrv.rpc.proto.LogEntry proto) {
        return new LogEntry(
                proto.getIndex(),
                proto.getTerm(),
                proto.getType(),
                proto.getPayload().toByteArray()
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogEntry logEntry = (LogEntry) o;
        return index == logEntry.index
                && term == logEntry.term
                && type == logEntry.type
                && Arrays.equals(payload, logEntry.payload);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(index);
        result = 31 * result + Long.hashCode(term);
        result = 31 * result + type.hashCode();
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return String.format("LogEntry{index=%d, term=%d, type=%s, len=%d}", index, term, type, payload.length);
    }
}
