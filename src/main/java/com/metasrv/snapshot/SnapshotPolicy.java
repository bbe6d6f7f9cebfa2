package com.metasrv.snapshot;

/**
 * When to take a snapshot and how much of the applied log to keep after it.
 *
 * @param logsSinceLast number of entries applied since the last snapshot that
 *                      triggers a new one
 * @param maxAppliedLogToKeep number of applied entries retained behind the
 *                            snapshot for followers that are slightly behind;
 *                            0 purges everything the snapshot covers
 */
public record SnapshotPolicy(long logsSinceLast, long maxAppliedLogToKeep) {

    public static final long DEFAULT_LOGS_SINCE_LAST = 1024;
    public static final long DEFAULT_MAX_APPLIED_LOG_TO_KEEP = 1000;

    public SnapshotPolicy {
        if (logsSinceLast <= 0) {
            throw new IllegalArgumentException("logsSinceLast must be positive: " + logsSinceLast);
        }
        if (maxAppliedLogToKeep < 0) {
            throw new IllegalArgumentException("maxAppliedLogToKeep cannot be negative: " + maxAppliedLogToKeep);
        }
    }

    public static SnapshotPolicy defaults() {
        return new SnapshotPolicy(DEFAULT_LOGS_SINCE_LAST, DEFAULT_MAX_APPLIED_LOG_TO_KEEP);
    }

    /**
     * Whether a snapshot is due.
     *
     * @param lastApplied index of the last applied entry
     * @param lastSnapshotIndex index covered by the latest snapshot, 0 if none
     */
    public boolean shouldSnapshot(long lastApplied, long lastSnapshotIndex) {
        return lastApplied - lastSnapshotIndex >= logsSinceLast;
    }

    /**
     * Highest log index that may be purged after a snapshot at
     * {@code snapshotIndex}; 0 means nothing.
     */
    public long purgeUpTo(long snapshotIndex) {
        return Math.max(0, snapshotIndex - maxAppliedLogToKeep);
    }
}
