package com.netsim.dvr.util;

import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingListener;
import com.netsim.dvr.api.RoutingTable;

import java.util.Arrays;

/**
 * Fans every callback out to several {@link RoutingListener} instances, in
 * registration order.
 */
public class CompositeRoutingListener implements RoutingListener {
    private RoutingListener[] listeners = new RoutingListener[0];

    public void add(RoutingListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener is null");
        RoutingListener[] old = listeners;
        RoutingListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onInitialTable(String nodeId, RoutingTable table) {
        for (RoutingListener l : listeners)
            l.onInitialTable(nodeId, table);
    }

    @Override
    public void onRoundStart(int round) {
        for (RoutingListener l : listeners)
            l.onRoundStart(round);
    }

    @Override
    public void onTableChanged(int round, String nodeId, RoutingTable table) {
        for (RoutingListener l : listeners)
            l.onTableChanged(round, nodeId, table);
    }

    @Override
    public void onRoundEnd(int round, int changedNodes) {
        for (RoutingListener l : listeners)
            l.onRoundEnd(round, changedNodes);
    }

    @Override
    public void onRunComplete(ConvergenceResult result) {
        for (RoutingListener l : listeners)
            l.onRunComplete(result);
    }
}
