package com.metasrv.statemachine;

import java.util.Arrays;

/**
 * What an upsert does to the value: replace it or delete it.
 *
 * @param kind update or delete
 * @param value new value bytes, {@code null} for a delete
 */
public record Operation(Kind kind, byte[] value) {

    public enum Kind {
        UPDATE,
        DELETE
    }

    private static final Operation DELETE = new Operation(Kind.DELETE, null);

    public Operation {
        if (kind == Kind.UPDATE && value == null) {
            throw new IllegalArgumentException("Update requires a value");
        }
    }

    public static Operation update(byte[] value) {
        return new Operation(Kind.UPDATE, value);
    }

    public static Operation delete() {
        return DELETE;
    }

    public boolean isDelete() {
        return kind == Kind.DELETE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Operation other = (Operation) o;
        return kind == other.kind && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return kind == Kind.DELETE ? "Delete" : "Update(len=" + value.length + ")";
    }
}
