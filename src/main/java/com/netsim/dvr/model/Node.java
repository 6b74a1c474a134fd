package com.netsim.dvr.model;

import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.api.RoutingTableEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A router in the simulated network.
 *
 * A node knows only its own links. Its mutable state is the routing table and
 * the inbox of advertisements received from neighbors; both are written from
 * two sides at once:
 *
 * - The node's listener thread appends each received advertisement to the
 * inbox via {@link #deliver(List)}.
 * - The controller thread reads the table and inbox at the start of an update
 * ({@link #beginUpdate(MailboxPolicy)}) and later installs the recomputed
 * table ({@link #replaceTable(RoutingTable)}).
 *
 * Both go through the same per-node monitor, so an appended batch is seen
 * either entirely or not at all, and an update always works on a consistent
 * snapshot.
 *
 * Lifecycle: created once by {@link NetworkGraph.Builder} with an empty table;
 * the table is populated by engine initialization; the cancellation flag is
 * raised once on shutdown and polled by the listener.
 */
public final class Node {
    private final String id;
    private final Endpoint endpoint;
    private final List<Edge> edges;

    private final Object lock = new Object();
    private RoutingTable table;
    private final List<List<RoutingTableEntry>> inbox = new ArrayList<>();
    private long deliveredBatches;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean();

    Node(String id, Endpoint endpoint, List<Edge> edges) {
        this.id = id;
        this.endpoint = endpoint;
        this.edges = Collections.unmodifiableList(edges);
        this.table = RoutingTable.empty(id);
    }

    public String id() {
        return id;
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    /** Outgoing halves of this node's links, in the order they were added. */
    public List<Edge> edges() {
        return edges;
    }

    /** Returns the edge to {@code neighborId}, or null if there is no direct link. */
    public Edge edgeTo(String neighborId) {
        for (Edge e : edges) {
            if (e.destination().equals(neighborId))
                return e;
        }
        return null;
    }

    public RoutingTable table() {
        synchronized (lock) {
            return table;
        }
    }

    public void replaceTable(RoutingTable newTable) {
        if (!id.equals(newTable.owner()))
            throw new IllegalArgumentException("Table owned by " + newTable.owner() + " installed on " + id);
        synchronized (lock) {
            this.table = newTable;
        }
    }

    /**
     * Appends one received advertisement to the inbox as a single unit.
     */
    public void deliver(List<RoutingTableEntry> advertisement) {
        List<RoutingTableEntry> batch = List.copyOf(advertisement);
        synchronized (lock) {
            inbox.add(batch);
            deliveredBatches++;
        }
    }

    /**
     * Captures the current table together with the pending advertisements.
     * Under {@link MailboxPolicy#DRAIN} the inbox is cleared in the same
     * critical section.
     */
    public UpdateSnapshot beginUpdate(MailboxPolicy policy) {
        synchronized (lock) {
            List<List<RoutingTableEntry>> batches = List.copyOf(inbox);
            if (policy == MailboxPolicy.DRAIN)
                inbox.clear();
            return new UpdateSnapshot(table, batches);
        }
    }

    public int pendingBatches() {
        synchronized (lock) {
            return inbox.size();
        }
    }

    /** Total advertisements ever delivered to this node. */
    public long deliveredBatches() {
        synchronized (lock) {
            return deliveredBatches;
        }
    }

    public void clearInbox() {
        synchronized (lock) {
            inbox.clear();
        }
    }

    public void signalShutdown() {
        shutdownRequested.set(true);
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /** Re-arms the cancellation flag so a new listener can be started. */
    public void clearShutdown() {
        shutdownRequested.set(false);
    }

    @Override
    public String toString() {
        return "Node[" + id + "@" + endpoint + "]";
    }

    /**
     * Table and inbox as seen at the start of one update.
     */
    public record UpdateSnapshot(RoutingTable table, List<List<RoutingTableEntry>> batches) {
    }
}
