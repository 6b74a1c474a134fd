package com.netsim.dvr.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable distance vector owned by a single node.
 *
 * Maps every known destination to the lowest cost the owner currently
 * believes in. Iteration order is insertion order, which the engine keeps
 * equal to graph order so that rendered and transmitted tables are stable
 * from round to round.
 *
 * Instances are replaced, never mutated: the engine and the link mutator
 * build a new table and swap it into the node under the node's lock, so a
 * reference obtained from {@code Node.table()} is always a consistent
 * snapshot.
 */
public final class RoutingTable {
    private final String owner;
    private final Map<String, Double> costs;

    private RoutingTable(String owner, Map<String, Double> costs) {
        this.owner = owner;
        this.costs = Collections.unmodifiableMap(costs);
    }

    public static RoutingTable empty(String owner) {
        return new RoutingTable(owner, new LinkedHashMap<>());
    }

    /** Copies {@code costs} preserving its iteration order. */
    public static RoutingTable of(String owner, Map<String, Double> costs) {
        for (Map.Entry<String, Double> e : costs.entrySet()) {
            // Reuses the entry's validation
            new RoutingTableEntry(owner, e.getKey(), e.getValue());
        }
        return new RoutingTable(owner, new LinkedHashMap<>(costs));
    }

    /**
     * Rebuilds a table from wire rows. Every row must belong to {@code owner}.
     */
    public static RoutingTable fromEntries(String owner, List<RoutingTableEntry> entries) {
        Map<String, Double> costs = new LinkedHashMap<>(entries.size() * 2);
        for (RoutingTableEntry e : entries) {
            if (!owner.equals(e.source()))
                throw new IllegalArgumentException("Row " + e + " does not belong to " + owner);
            costs.put(e.destination(), e.cost());
        }
        return new RoutingTable(owner, costs);
    }

    public String owner() {
        return owner;
    }

    public boolean knows(String destination) {
        return costs.containsKey(destination);
    }

    /**
     * Returns the cost to {@code destination}, or +Infinity when the
     * destination is not in the table.
     */
    public double cost(String destination) {
        Double c = costs.get(destination);
        return c == null ? Double.POSITIVE_INFINITY : c;
    }

    public Set<String> destinations() {
        return costs.keySet();
    }

    public int size() {
        return costs.size();
    }

    public Map<String, Double> asMap() {
        return costs;
    }

    /** Returns a copy with one destination overwritten (or appended). */
    public RoutingTable withCost(String destination, double cost) {
        new RoutingTableEntry(owner, destination, cost);
        Map<String, Double> copy = new LinkedHashMap<>(costs);
        copy.put(destination, cost);
        return new RoutingTable(owner, copy);
    }

    /** The table as ordered {@code (owner, destination, cost)} triples. */
    public List<RoutingTableEntry> entries() {
        List<RoutingTableEntry> rows = new ArrayList<>(costs.size());
        for (Map.Entry<String, Double> e : costs.entrySet())
            rows.add(new RoutingTableEntry(owner, e.getKey(), e.getValue()));
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RoutingTable other))
            return false;
        return owner.equals(other.owner) && costs.equals(other.costs);
    }

    @Override
    public int hashCode() {
        return 31 * owner.hashCode() + costs.hashCode();
    }

    @Override
    public String toString() {
        return owner + costs;
    }
}
