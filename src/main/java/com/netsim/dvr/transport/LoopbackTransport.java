package com.netsim.dvr.transport;

import com.netsim.dvr.api.AdvertisementTransport;
import com.netsim.dvr.api.RoutingTableEntry;
import com.netsim.dvr.model.NetworkGraph;
import com.netsim.dvr.model.Node;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * In-process transport: hands each advertisement straight to the target
 * node's inbox without sockets or threads.
 *
 * Delivery semantics match {@link MessagingFabric} after a successful send,
 * so the controller behaves identically on both. A drop filter simulates lost
 * messages.
 */
public final class LoopbackTransport implements AdvertisementTransport {
    private static final Logger log = LogManager.getLogger(LoopbackTransport.class);

    private final NetworkGraph graph;
    private volatile BiPredicate<String, String> dropFilter = (from, to) -> false;
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public LoopbackTransport(NetworkGraph graph) {
        this.graph = graph;
    }

    /**
     * Drops every advertisement for which {@code filter.test(from, to)} is true.
     */
    public LoopbackTransport dropIf(BiPredicate<String, String> filter) {
        this.dropFilter = filter;
        return this;
    }

    @Override
    public boolean send(String fromId, String toId, List<RoutingTableEntry> advertisement) {
        Node target = graph.node(toId);
        if (target == null) {
            log.warn("Advertisement from {} addressed to unknown node {}", fromId, toId);
            return false;
        }
        if (dropFilter.test(fromId, toId)) {
            dropped.incrementAndGet();
            return false;
        }
        target.deliver(advertisement);
        sent.incrementAndGet();
        return true;
    }

    public long sentCount() {
        return sent.get();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
