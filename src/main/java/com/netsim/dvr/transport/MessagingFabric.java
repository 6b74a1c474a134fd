package com.netsim.dvr.transport;

import com.netsim.dvr.api.AdvertisementTransport;
import com.netsim.dvr.api.RoutingTableEntry;
import com.netsim.dvr.config.SimulationConfig;
import com.netsim.dvr.model.NetworkGraph;
import com.netsim.dvr.model.Node;
import com.netsim.dvr.util.ErrorRateLimiter;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Socket-based messaging between nodes.
 *
 * Key Responsibilities:
 * 1. Listener lifecycle: one {@link NodeListener} thread per node, started
 * together by {@link #start()}, which returns only once every listener is
 * bound (the readiness barrier). If any listener fails to bind, the ones
 * already running are stopped and start-up fails.
 * 2. Sending: {@link #send} opens a connection to the neighbor, writes the
 * payload, half-closes and waits for the acknowledgement. The listener stores
 * the advertisement before acknowledging, so a successful send means the
 * neighbor's inbox already holds it.
 * 3. Shutdown: raises every node's cancellation flag, then joins every
 * listener thread before returning.
 *
 * Delivery is best effort. Refused connections, timeouts and I/O errors are
 * logged (throttled) and the advertisement is dropped; there are no retries.
 */
public final class MessagingFabric implements AdvertisementTransport, AutoCloseable {
    private static final Logger log = LogManager.getLogger(MessagingFabric.class);

    private final NetworkGraph graph;
    private final SimulationConfig config;
    private final AdvertisementCodec codec = new AdvertisementCodec();
    private final ErrorRateLimiter sendErrors = new ErrorRateLimiter(log, 1000);

    private final Map<String, NodeListener> listeners = new LinkedHashMap<>();
    private final Map<String, Thread> threads = new LinkedHashMap<>();
    private volatile boolean running;

    public MessagingFabric(NetworkGraph graph, SimulationConfig config) {
        this.graph = graph;
        this.config = config;
    }

    /**
     * Starts every node listener and blocks until all of them accept
     * connections.
     *
     * @throws IllegalStateException if a listener cannot bind or readiness
     *                               times out.
     */
    public synchronized void start() {
        if (running)
            throw new IllegalStateException("Messaging fabric already started");

        for (Node node : graph.nodes()) {
            node.clearShutdown();
            NodeListener listener = new NodeListener(node, codec,
                    config.getPollIntervalMillis(), config.getReadTimeoutMillis());
            Thread thread = new Thread(listener, "dv-listener-" + node.id());
            thread.setDaemon(true);
            listeners.put(node.id(), listener);
            threads.put(node.id(), thread);
            thread.start();
        }
        running = true;

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getReadyTimeoutMillis());
        for (NodeListener listener : listeners.values()) {
            boolean ready;
            try {
                ready = listener.awaitReady(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                shutdown();
                throw new IllegalStateException("Interrupted while waiting for node listeners", e);
            }
            if (!ready) {
                Node node = listener.node();
                shutdown();
                throw new IllegalStateException("Listener of node " + node.id() + " is not ready on "
                        + node.endpoint(), listener.bindFailure());
            }
        }
        log.info("All {} node listeners are ready", listeners.size());
    }

    @Override
    public boolean send(String fromId, String toId, List<RoutingTableEntry> advertisement) {
        Node target = graph.node(toId);
        if (target == null) {
            log.warn("Advertisement from {} addressed to unknown node {}", fromId, toId);
            return false;
        }

        byte[] payload = codec.encode(advertisement);
        try (Socket socket = new Socket()) {
            socket.connect(target.endpoint().toSocketAddress(), config.getConnectTimeoutMillis());
            socket.setSoTimeout(config.getReadTimeoutMillis());

            OutputStream out = socket.getOutputStream();
            out.write(payload);
            out.flush();
            socket.shutdownOutput();

            byte[] reply = socket.getInputStream().readAllBytes();
            if (reply.length == 0) {
                log.debug("No acknowledgement from {} for advertisement of {}", toId, fromId);
                return false;
            }
            if (log.isTraceEnabled())
                log.trace("{} -> {}: {}", fromId, toId, new String(reply, StandardCharsets.UTF_8));
            return true;
        } catch (IOException e) {
            sendErrors.log("Advertisement " + fromId + " -> " + toId + " (" + target.endpoint()
                    + ") dropped: " + e.getMessage(), null);
            return false;
        }
    }

    /**
     * Signals every listener to stop and joins all of them.
     */
    public synchronized void shutdown() {
        if (threads.isEmpty())
            return;

        for (Node node : graph.nodes())
            node.signalShutdown();

        long joinMillis = config.getPollIntervalMillis() * 3 + config.getReadTimeoutMillis();
        for (Map.Entry<String, Thread> e : threads.entrySet()) {
            try {
                e.getValue().join(joinMillis);
                if (e.getValue().isAlive())
                    log.warn("Listener of node {} did not stop within {} ms", e.getKey(), joinMillis);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping listener of node {}", e.getKey());
                break;
            }
        }
        threads.clear();
        listeners.clear();
        running = false;
        log.info("Messaging fabric shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isRunning() {
        return running;
    }

    /** Listener of a node, or null when the fabric is not running. */
    public synchronized NodeListener listener(String nodeId) {
        return listeners.get(nodeId);
    }
}
