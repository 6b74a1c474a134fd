package com.netsim.dvr.model;

import com.netsim.dvr.io.TopologyDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * The simulated network: a fixed set of nodes joined by bidirectional links.
 *
 * Structure:
 * - Nodes are kept in registration order (the order the builder first saw
 * them). That order is the "graph order" used everywhere a deterministic
 * iteration is needed: table layout, broadcast order, update order.
 * - Every link is stored as two {@link Edge} objects, one on each endpoint,
 * with the same weight.
 *
 * Mutability:
 * The node set and the link endpoints never change after {@link Builder#build}.
 * Link weights may change, but only through
 * {@link #setLinkWeight(String, String, double)}, which updates both halves.
 * Per-node routing state lives on {@link Node} and is synchronized there.
 */
@Log4j2
public final class NetworkGraph {
    private final Map<String, Node> nodesById;
    private final int linkCount;

    private NetworkGraph(Map<String, Node> nodesById, int linkCount) {
        this.nodesById = Collections.unmodifiableMap(nodesById);
        this.linkCount = linkCount;
    }

    public int nodeCount() {
        return nodesById.size();
    }

    /** Number of bidirectional links (each counted once). */
    public int linkCount() {
        return linkCount;
    }

    /** Nodes in graph order. */
    public Collection<Node> nodes() {
        return nodesById.values();
    }

    public List<String> nodeIds() {
        return List.copyOf(nodesById.keySet());
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    /**
     * @return the node, or null if not found.
     */
    public Node node(String id) {
        return nodesById.get(id);
    }

    /**
     * @throws IllegalArgumentException if the node is unknown.
     */
    public Node requireNode(String id) {
        Node n = nodesById.get(id);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return n;
    }

    /**
     * Returns the weight of the direct link a-b, or +Infinity when there is none.
     * Self-distance is 0.
     */
    public double linkWeight(String a, String b) {
        if (a.equals(b))
            return 0.0;
        Node n = nodesById.get(a);
        if (n == null)
            return Double.POSITIVE_INFINITY;
        Edge e = n.edgeTo(b);
        return e == null ? Double.POSITIVE_INFINITY : e.weight();
    }

    /**
     * Overwrites the weight of both halves of the link a-b.
     *
     * @return false (and changes nothing) if either node or either half of
     *         the link is missing.
     */
    public boolean setLinkWeight(String a, String b, double weight) {
        Node na = nodesById.get(a);
        Node nb = nodesById.get(b);
        if (na == null || nb == null)
            return false;
        Edge ab = na.edgeTo(b);
        Edge ba = nb.edgeTo(a);
        if (ab == null || ba == null)
            return false;
        ab.weight(weight);
        ba.weight(weight);
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a graph from parsed links, registering nodes in the order they
     * first appear.
     */
    public static NetworkGraph fromDefinition(TopologyDefinition definition, EndpointAllocator allocator) {
        Builder builder = builder();
        for (TopologyDefinition.LinkDef link : definition.getLinks())
            builder.addLink(link.getSource(), link.getDestination(), link.getWeight());
        return builder.build(allocator);
    }

    /**
     * Collects links and assigns endpoints.
     */
    public static final class Builder {
        // node id -> (neighbor id -> weight); insertion ordered on both levels
        private final Map<String, Map<String, Double>> adjacency = new LinkedHashMap<>();

        /** Registers a node with no links (yet). */
        public Builder addNode(String id) {
            if (id == null || id.isBlank())
                throw new IllegalArgumentException("Node id is required");
            adjacency.computeIfAbsent(id, k -> new LinkedHashMap<>());
            return this;
        }

        /**
         * Adds the bidirectional link a-b. Nodes are registered on first sight,
         * source before destination. A repeated link replaces the earlier weight.
         */
        public Builder addLink(String a, String b, double weight) {
            if (a.equals(b))
                throw new IllegalArgumentException("Self-link not allowed: " + a);
            if (Double.isNaN(weight) || weight < 0)
                throw new IllegalArgumentException("Link " + a + "-" + b + " has invalid weight " + weight);
            addNode(a);
            addNode(b);
            Double previous = adjacency.get(a).put(b, weight);
            adjacency.get(b).put(a, weight);
            if (previous != null)
                log.warn("Link {}-{} redefined: {} -> {}", a, b, previous, weight);
            return this;
        }

        public NetworkGraph build(EndpointAllocator allocator) {
            Map<String, Node> nodes = new LinkedHashMap<>(adjacency.size() * 2);
            Set<Endpoint> used = new HashSet<>();
            int index = 0;
            int halfEdges = 0;

            for (var entry : adjacency.entrySet()) {
                String id = entry.getKey();
                Endpoint endpoint = allocator.allocate(id, index++);
                if (!used.add(endpoint))
                    throw new IllegalStateException("Endpoint " + endpoint + " assigned twice (node " + id + ")");

                List<Edge> edges = new ArrayList<>(entry.getValue().size());
                for (var link : entry.getValue().entrySet())
                    edges.add(new Edge(id, link.getKey(), link.getValue()));
                halfEdges += edges.size();

                nodes.put(id, new Node(id, endpoint, edges));
            }
            log.debug("Built graph with {} nodes and {} links", nodes.size(), halfEdges / 2);
            return new NetworkGraph(nodes, halfEdges / 2);
        }
    }
}
