package com.netsim.dvr.model;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;

/**
 * Assigns each node a unique transport endpoint at graph construction time.
 */
@FunctionalInterface
public interface EndpointAllocator {

    /**
     * @param nodeId the node being registered.
     * @param index  zero-based registration order of the node.
     */
    Endpoint allocate(String nodeId, int index);

    /**
     * Deterministic ports: {@code basePort + index * stride}.
     */
    static EndpointAllocator sequential(String host, int basePort, int stride) {
        if (stride <= 0)
            throw new IllegalArgumentException("stride must be positive: " + stride);
        return (nodeId, index) -> new Endpoint(host, basePort + index * stride);
    }

    /**
     * Reserves a currently free OS port for every node. The port is released
     * again before the listener binds it, so another process could in theory
     * take it in between; intended for tests and throwaway runs.
     */
    static EndpointAllocator ephemeral(String host) {
        return (nodeId, index) -> {
            try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getByName(host))) {
                return new Endpoint(host, probe.getLocalPort());
            } catch (IOException e) {
                throw new UncheckedIOException("No free port for node " + nodeId, e);
            }
        };
    }
}
