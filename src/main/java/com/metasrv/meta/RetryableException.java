package com.metasrv.meta;

/**
 * A request could not be completed because of a transport failure or timeout.
 *
 * <p>The outcome is unknown: the request may or may not have been applied.
 * Callers back off and retry, using a transaction id to make the retry
 * idempotent.
 */
public class RetryableException extends RuntimeException {

    public RetryableException(String message) {
        super(message);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
