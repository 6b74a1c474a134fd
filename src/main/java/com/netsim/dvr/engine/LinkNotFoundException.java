package com.netsim.dvr.engine;

/**
 * Thrown when a link edit names an unknown node or a pair of nodes without a
 * direct link. No state has been changed when this is thrown.
 */
public class LinkNotFoundException extends Exception {
    private final String nodeA;
    private final String nodeB;

    public LinkNotFoundException(String nodeA, String nodeB, String reason) {
        super("Link " + nodeA + "-" + nodeB + " not found: " + reason);
        this.nodeA = nodeA;
        this.nodeB = nodeB;
    }

    public String nodeA() {
        return nodeA;
    }

    public String nodeB() {
        return nodeB;
    }
}
