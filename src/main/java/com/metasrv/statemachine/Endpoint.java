package com.metasrv.statemachine;

import java.util.Objects;

/**
 * Network address of a node's consensus transport.
 *
 * @param host host name or IP address
 * @param port TCP port
 */
public record Endpoint(String host, int port) {

    public Endpoint {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
    }

    /**
     * Parses {@code host:port}. The last colon separates the port.
     */
    public static Endpoint parse(String address) {
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Expected host:port, got: " + address);
        }
        try {
            return new Endpoint(address.substring(0, colon), Integer.parseInt(address.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address: " + address, e);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
