package com.netsim.dvr.engine;

import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.model.NetworkGraph;
import com.netsim.dvr.model.Node;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Changes the cost of one link at runtime.
 *
 * An edit overwrites, in one step:
 * - the weight of both halves of the link a-b,
 * - a's table entry for b,
 * - b's table entry for a.
 *
 * Every precondition is checked before anything is written, so a failed
 * edit leaves the graph and all tables untouched. The edit does not
 * propagate; callers re-run the {@link ConvergenceController} afterwards.
 */
public final class LinkMutator {
    private static final Logger log = LogManager.getLogger(LinkMutator.class);

    private final NetworkGraph graph;

    public LinkMutator(NetworkGraph graph) {
        this.graph = graph;
    }

    /**
     * @param nodeA   one end of the link.
     * @param nodeB   the other end.
     * @param newCost non-negative cost, or +Infinity to take the link down.
     * @throws LinkNotFoundException    if a node is unknown or the nodes are not
     *                                  directly linked in both directions.
     * @throws IllegalArgumentException if newCost is negative or NaN.
     */
    public void mutate(String nodeA, String nodeB, double newCost) throws LinkNotFoundException {
        if (Double.isNaN(newCost) || newCost < 0)
            throw new IllegalArgumentException("Invalid link cost: " + newCost);

        Node a = graph.node(nodeA);
        Node b = graph.node(nodeB);
        if (a == null || b == null)
            throw new LinkNotFoundException(nodeA, nodeB, "one or both nodes do not exist");
        if (a == b || a.edgeTo(nodeB) == null || b.edgeTo(nodeA) == null)
            throw new LinkNotFoundException(nodeA, nodeB, "nodes are not directly linked");

        RoutingTable tableA = a.table();
        RoutingTable tableB = b.table();
        if (!tableA.knows(nodeB) || !tableB.knows(nodeA))
            throw new LinkNotFoundException(nodeA, nodeB, "routing tables have no entry for the link");

        log.debug("Before adjustment: {} / {}", tableA, tableB);

        graph.setLinkWeight(nodeA, nodeB, newCost);
        a.replaceTable(tableA.withCost(nodeB, newCost));
        b.replaceTable(tableB.withCost(nodeA, newCost));

        log.info("Link cost between {} and {} adjusted to {}", nodeA, nodeB, newCost);
        log.debug("After adjustment: {} / {}", a.table(), b.table());
    }
}
