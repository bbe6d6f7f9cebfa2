package com.metasrv.statemachine;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A stored value with its version. Immutable: the bytes are copied in and
 * every {@link #data()} call returns a fresh copy.
 *
 * @param seq version of the value, unique across all keys and increasing
 * @param meta optional metadata, may be {@code null}
 * @param data the value bytes
 */
public record SeqV(long seq, KVMeta meta, byte[] data) {

    public SeqV {
        data = Objects.requireNonNull(data, "data").clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public static SeqV of(long seq, byte[] data) {
        return new SeqV(seq, null, data);
    }

    public boolean isExpired(long nowSeconds) {
        return meta != null && meta.isExpired(nowSeconds);
    }

    public String dataAsString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SeqV other = (SeqV) o;
        return seq == other.seq && Objects.equals(meta, other.meta) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(seq);
        result = 31 * result + Objects.hashCode(meta);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "SeqV{seq=" + seq + ", meta=" + meta + ", len=" + data.length + "}";
    }
}
