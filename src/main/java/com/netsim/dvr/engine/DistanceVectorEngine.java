package com.netsim.dvr.engine;

import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.api.RoutingTableEntry;
import com.netsim.dvr.model.Edge;
import com.netsim.dvr.model.NetworkGraph;
import com.netsim.dvr.model.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The Bellman-Ford distance-vector rules: table initialization, advertisement
 * targeting and relaxation.
 *
 * The engine itself is stateless; all state lives on the nodes. The
 * {@link ConvergenceController} decides when each rule runs.
 *
 * Relaxation rule:
 * For a node N and every advertised row (A, D, c):
 *
 * 1. Rows advertised by N itself are ignored.
 * 2. If N's own table has no finite cost to A, A is not a known neighbor and
 * the row is ignored.
 * 3. N's distance to itself is never touched.
 * 4. candidate = cost(N, A) + c. If D is unknown to N, or candidate is
 * strictly below N's current cost to D, N adopts candidate.
 *
 * Strict less-than is the only loop guard. There is no split horizon or
 * poison reverse, so after a link cost increase stale routes through the old
 * path are never withdrawn; the controller's round cap is the only bound.
 */
public final class DistanceVectorEngine {
    private static final Logger log = LogManager.getLogger(DistanceVectorEngine.class);

    /**
     * Initial cost from {@code source} to {@code destination}: 0 to itself,
     * the direct link weight to a neighbor, +Infinity otherwise.
     */
    public double initialCost(NetworkGraph graph, String source, String destination) {
        return graph.linkWeight(source, destination);
    }

    /**
     * Builds the initial table of one node, one entry per graph node in graph
     * order.
     */
    public RoutingTable initialTable(NetworkGraph graph, String nodeId) {
        Map<String, Double> costs = new LinkedHashMap<>(graph.nodeCount() * 2);
        for (Node dest : graph.nodes())
            costs.put(dest.id(), initialCost(graph, nodeId, dest.id()));
        return RoutingTable.of(nodeId, costs);
    }

    /**
     * Installs the initial table on every node and drops any stale inbox
     * content.
     */
    public void initialize(NetworkGraph graph) {
        for (Node node : graph.nodes()) {
            node.clearInbox();
            node.replaceTable(initialTable(graph, node.id()));
        }
        log.debug("Initialized {} routing tables", graph.nodeCount());
    }

    /**
     * Neighbors that receive this node's advertisement: every direct link with
     * a finite, non-zero weight. Order follows the node's edge list.
     */
    public List<String> advertisementTargets(Node node) {
        List<String> targets = new ArrayList<>(node.edges().size());
        for (Edge e : node.edges()) {
            if (e.isActive() && !e.destination().equals(node.id()))
                targets.add(e.destination());
        }
        return targets;
    }

    /**
     * The payload a node broadcasts: its whole current table.
     */
    public List<RoutingTableEntry> advertisement(Node node) {
        return node.table().entries();
    }

    /**
     * Applies the relaxation rule to {@code current} using every row of every
     * batch.
     *
     * @param current the node's table at the start of the update.
     * @param batches advertisements received since the last update.
     * @return the rebuilt table and whether any cost changed.
     */
    public UpdateResult relax(RoutingTable current, List<List<RoutingTableEntry>> batches) {
        final String self = current.owner();
        Map<String, Double> costs = new LinkedHashMap<>(current.asMap());
        boolean changed = false;

        for (List<RoutingTableEntry> batch : batches) {
            for (RoutingTableEntry row : batch) {
                String advertiser = row.source();
                if (advertiser.equals(self))
                    continue;

                Double toAdvertiser = costs.get(advertiser);
                if (toAdvertiser == null || toAdvertiser == Double.POSITIVE_INFINITY)
                    continue;

                String dest = row.destination();
                if (dest.equals(self))
                    continue;

                double candidate = toAdvertiser + row.cost();
                Double known = costs.get(dest);
                if (known == null || candidate < known) {
                    if (log.isTraceEnabled())
                        log.trace("Node {}: cost to {} {} -> {} via {}", self, dest, known, candidate, advertiser);
                    costs.put(dest, candidate);
                    changed = true;
                }
            }
        }

        return new UpdateResult(changed ? RoutingTable.of(self, costs) : current, changed);
    }

    /**
     * Result of one relaxation.
     */
    public record UpdateResult(RoutingTable table, boolean changed) {
    }
}
