package com.netsim.dvr.web;

import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingListener;
import com.netsim.dvr.api.RoutingTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the latest table of every node for {@code GET /api/tables} and pushes
 * change events to WebSocket clients.
 *
 * Callbacks may arrive on the controller thread or an async consumer thread
 * while HTTP requests read the snapshot, hence the synchronized table map.
 */
public class DashboardListener implements RoutingListener {
    private final RoutingDashboardServer server;
    private final TableSnapshotSerializer serializer;
    private final Map<String, RoutingTable> latest = new LinkedHashMap<>();

    public DashboardListener(RoutingDashboardServer server, TableSnapshotSerializer serializer) {
        this.server = server;
        this.serializer = serializer;
        server.setSnapshotSupplier(this::snapshotJson);
    }

    public String snapshotJson() {
        synchronized (latest) {
            return serializer.snapshot(latest);
        }
    }

    public RoutingTable latest(String nodeId) {
        synchronized (latest) {
            return latest.get(nodeId);
        }
    }

    @Override
    public void onInitialTable(String nodeId, RoutingTable table) {
        synchronized (latest) {
            latest.put(nodeId, table);
        }
    }

    @Override
    public void onRoundStart(int round) {
        // only completed rounds are pushed
    }

    @Override
    public void onTableChanged(int round, String nodeId, RoutingTable table) {
        synchronized (latest) {
            latest.put(nodeId, table);
        }
        server.broadcast(serializer.tableChanged(round, nodeId, table));
    }

    @Override
    public void onRoundEnd(int round, int changedNodes) {
        server.broadcast(serializer.roundEnd(round, changedNodes));
    }

    @Override
    public void onRunComplete(ConvergenceResult result) {
        server.broadcast(serializer.runComplete(result));
    }
}
