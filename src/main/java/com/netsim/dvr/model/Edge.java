package com.netsim.dvr.model;

/**
 * A directed half of a bidirectional link.
 *
 * Edges are always created in mirrored pairs by {@link NetworkGraph.Builder},
 * and their weights are only ever changed in pairs by
 * {@link NetworkGraph#setLinkWeight(String, String, double)}, so
 * {@code weight(a->b) == weight(b->a)} holds at all times.
 */
public final class Edge {
    private final String source;
    private final String destination;
    private volatile double weight;

    Edge(String source, String destination, double weight) {
        this.source = source;
        this.destination = destination;
        this.weight = weight;
    }

    public String source() {
        return source;
    }

    public String destination() {
        return destination;
    }

    public double weight() {
        return weight;
    }

    void weight(double weight) {
        this.weight = weight;
    }

    /**
     * True when this edge carries advertisements: finite and non-zero weight.
     */
    public boolean isActive() {
        double w = weight;
        return w != 0 && w != Double.POSITIVE_INFINITY;
    }

    @Override
    public String toString() {
        return source + "->" + destination + "(" + weight + ")";
    }
}
