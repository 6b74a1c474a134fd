package com.netsim.dvr.transport;

import com.netsim.dvr.api.RoutingTableEntry;
import com.netsim.dvr.model.Node;
import com.netsim.dvr.util.ErrorRateLimiter;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Inbound side of one node: accepts connections on the node's endpoint and
 * stores every decoded advertisement in the node's inbox.
 *
 * Per connection:
 * 1. Read the payload until the peer half-closes.
 * 2. Decode it into routing rows.
 * 3. Append the rows to the inbox as one batch.
 * 4. Reply with {@link AdvertisementCodec#ACK} and close.
 *
 * The accept call times out every poll interval so the loop can check the
 * node's cancellation flag; shutdown therefore completes within one poll
 * interval. Malformed payloads and I/O errors are logged (throttled) and the
 * connection is dropped without a reply.
 */
public final class NodeListener implements Runnable {
    private static final Logger log = LogManager.getLogger(NodeListener.class);

    private final Node node;
    private final AdvertisementCodec codec;
    private final int pollIntervalMillis;
    private final int readTimeoutMillis;
    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1000);

    private final CountDownLatch ready = new CountDownLatch(1);
    private volatile IOException bindFailure;
    private volatile long accepted;
    private final AtomicLong dropped = new AtomicLong();

    public NodeListener(Node node, AdvertisementCodec codec, long pollIntervalMillis, int readTimeoutMillis) {
        this.node = node;
        this.codec = codec;
        this.pollIntervalMillis = (int) Math.min(Integer.MAX_VALUE, pollIntervalMillis);
        this.readTimeoutMillis = readTimeoutMillis;
    }

    @Override
    public void run() {
        try (ServerSocket server = new ServerSocket()) {
            server.setReuseAddress(true);
            server.bind(node.endpoint().toSocketAddress());
            server.setSoTimeout(pollIntervalMillis);
            log.debug("Node {} listening on {}", node.id(), node.endpoint());
            ready.countDown();

            while (!node.isShutdownRequested()) {
                Socket connection;
                try {
                    connection = server.accept();
                } catch (SocketTimeoutException e) {
                    // poll tick: re-check the cancellation flag
                    continue;
                } catch (IOException e) {
                    errors.log("Node " + node.id() + " failed to accept a connection: " + e.getMessage(), null);
                    continue;
                }

                accepted++;
                try (connection) {
                    handle(connection);
                } catch (SocketTimeoutException e) {
                    dropped.incrementAndGet();
                    errors.log("Node " + node.id() + " timed out reading an advertisement from "
                            + connection.getRemoteSocketAddress(), null);
                } catch (IOException e) {
                    dropped.incrementAndGet();
                    errors.log("Node " + node.id() + " dropped an inbound advertisement: " + e.getMessage(), null);
                }
            }
        } catch (IOException e) {
            bindFailure = e;
            log.error("Node {} could not listen on {}", node.id(), node.endpoint(), e);
        } finally {
            ready.countDown();
            log.debug("Server {} has shut down", node.id());
        }
    }

    private void handle(Socket connection) throws IOException {
        connection.setSoTimeout(readTimeoutMillis);
        byte[] payload = connection.getInputStream().readAllBytes();
        List<RoutingTableEntry> rows = codec.decode(payload);
        node.deliver(rows);

        OutputStream out = connection.getOutputStream();
        out.write(AdvertisementCodec.ACK.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    /**
     * Waits until the server socket is bound (or binding failed).
     *
     * @return true if the listener is bound and accepting.
     */
    public boolean awaitReady(long timeout, TimeUnit unit) throws InterruptedException {
        return ready.await(timeout, unit) && bindFailure == null;
    }

    public IOException bindFailure() {
        return bindFailure;
    }

    public long acceptedConnections() {
        return accepted;
    }

    /** Connections closed without storing an advertisement (timeouts, bad payloads). */
    public long droppedConnections() {
        return dropped.get();
    }

    public Node node() {
        return node;
    }
}
