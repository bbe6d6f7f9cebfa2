package com.metasrv.meta;

/**
 * Misuse of the meta node lifecycle, such as opening a node without storage
 * or booting one whose storage exists, or a request the leader rejected.
 */
public class MetaNodeException extends RuntimeException {

    public MetaNodeException(String message) {
        super(message);
    }

    public MetaNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
