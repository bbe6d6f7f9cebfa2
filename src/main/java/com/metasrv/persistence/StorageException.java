package com.metasrv.persistence;

/**
 * Fatal local-storage error: corrupted log, unreadable hard state, snapshot and
 * log that do not fit together, or a data directory held by another process.
 *
 * <p>A node that hits this error during startup must refuse to start; there is
 * no automatic recovery across corrupted storage.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
