package com.metasrv.statemachine;

/**
 * Client-assigned transaction id. A command carrying the same client and
 * serial as the last one applied for that client is not applied again; the
 * earlier result is returned instead.
 *
 * @param client client identity
 * @param serial serial number chosen by the client
 */
public record Txid(String client, long serial) {
}
