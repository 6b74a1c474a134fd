package com.netsim.dvr.model;

import java.net.InetSocketAddress;

/**
 * Transport address of a node's listener.
 */
public record Endpoint(String host, int port) {

    public Endpoint {
        if (host == null || host.isBlank())
            throw new IllegalArgumentException("host is required");
        if (port < 0 || port > 65535)
            throw new IllegalArgumentException("Port out of range: " + port);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
