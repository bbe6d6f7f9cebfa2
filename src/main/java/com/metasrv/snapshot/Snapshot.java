package com.metasrv.snapshot;

/**
 * A snapshot as read from disk: its metadata and the serialized state machine.
 */
public record Snapshot(SnapshotMeta meta, byte[] data) {
}
