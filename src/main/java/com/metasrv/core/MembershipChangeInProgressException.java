package com.metasrv.core;

/**
 * A membership change was proposed while an earlier one is not committed yet.
 * Retry once the entry at {@link #getIndex()} is applied.
 */
public class MembershipChangeInProgressException extends IllegalStateException {

    private final long index;

    public MembershipChangeInProgressException(long index, Membership pending) {
        super("Another membership change is in progress at index " + index + ": " + pending);
        this.index = index;
    }

    /**
     * Log index of the uncommitted membership entry.
     */
    public long getIndex() {
        return index;
    }
}
