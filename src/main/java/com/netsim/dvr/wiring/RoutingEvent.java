package com.netsim.dvr.wiring;

import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingTable;

/**
 * Mutable ring buffer slot carrying one {@link com.netsim.dvr.api.RoutingListener}
 * callback.
 *
 * Instances are pre-allocated by the Disruptor and reused; the producer sets
 * exactly one callback per slot and the consumer clears it after dispatch.
 * Tables are immutable, so the references can cross threads as they are.
 */
public final class RoutingEvent {

    public enum Type {
        INITIAL_TABLE, ROUND_START, TABLE_CHANGED, ROUND_END, RUN_COMPLETE
    }

    private Type type;
    private int round;
    private int changedNodes;
    private String nodeId;
    private RoutingTable table;
    private ConvergenceResult result;

    public void setInitialTable(String nodeId, RoutingTable table) {
        clear();
        this.type = Type.INITIAL_TABLE;
        this.nodeId = nodeId;
        this.table = table;
    }

    public void setRoundStart(int round) {
        clear();
        this.type = Type.ROUND_START;
        this.round = round;
    }

    public void setTableChanged(int round, String nodeId, RoutingTable table) {
        clear();
        this.type = Type.TABLE_CHANGED;
        this.round = round;
        this.nodeId = nodeId;
        this.table = table;
    }

    public void setRoundEnd(int round, int changedNodes) {
        clear();
        this.type = Type.ROUND_END;
        this.round = round;
        this.changedNodes = changedNodes;
    }

    public void setRunComplete(ConvergenceResult result) {
        clear();
        this.type = Type.RUN_COMPLETE;
        this.result = result;
    }

    public Type type() {
        return type;
    }

    public int round() {
        return round;
    }

    public int changedNodes() {
        return changedNodes;
    }

    public String nodeId() {
        return nodeId;
    }

    public RoutingTable table() {
        return table;
    }

    public ConvergenceResult result() {
        return result;
    }

    public void clear() {
        type = null;
        round = 0;
        changedNodes = 0;
        nodeId = null;
        table = null;
        result = null;
    }
}
