package com.metasrv.statemachine;

/**
 * Metadata attached to a stored value.
 *
 * @param expireAt absolute expiry time in epoch seconds, or {@code null} for
 *                 a value that never expires
 */
public record KVMeta(Long expireAt) {

    public static KVMeta expireAt(long epochSeconds) {
        return new KVMeta(epochSeconds);
    }

    /**
     * A value is expired once {@code expireAt} is earlier than {@code nowSeconds}.
     */
    public boolean isExpired(long nowSeconds) {
        return expireAt != null && expireAt < nowSeconds;
    }
}
