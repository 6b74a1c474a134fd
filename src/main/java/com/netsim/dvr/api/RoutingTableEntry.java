package com.netsim.dvr.api;

/**
 * One row of a distance vector: the cost {@code source} currently believes it
 * pays to reach {@code destination}.
 *
 * This triple is also the unit of the wire format: an advertisement is the
 * advertiser's whole table encoded as a list of these rows.
 *
 * @param source      id of the node that owns the row (the advertiser on the
 *                    wire).
 * @param destination id of the destination node.
 * @param cost        non-negative cost, or {@link Double#POSITIVE_INFINITY}
 *                    when the destination is unreachable.
 */
public record RoutingTableEntry(String source, String destination, double cost) {

    public RoutingTableEntry {
        if (source == null || destination == null)
            throw new IllegalArgumentException("source and destination are required");
        if (Double.isNaN(cost) || cost < 0)
            throw new IllegalArgumentException("Invalid cost " + cost + " for " + source + "->" + destination);
    }

    public boolean isReachable() {
        return cost != Double.POSITIVE_INFINITY;
    }
}
