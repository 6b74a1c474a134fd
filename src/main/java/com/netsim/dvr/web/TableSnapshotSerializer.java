package com.netsim.dvr.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingTable;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * JSON messages of the dashboard.
 *
 * Tables are rendered as {@code {"destination": cost}} objects; an unreachable
 * destination has cost {@code null} since JSON has no infinity.
 */
public final class TableSnapshotSerializer {
    private final ObjectMapper mapper = new ObjectMapper();

    /** {@code {"type":"snapshot","tables":{"1":{"1":0.0,...},...}}} */
    public String snapshot(Map<String, RoutingTable> tables) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "snapshot");
        ObjectNode all = root.putObject("tables");
        for (Map.Entry<String, RoutingTable> e : tables.entrySet())
            writeTable(all.putObject(e.getKey()), e.getValue());
        return write(root);
    }

    /** {@code {"type":"tableChanged","round":2,"node":"1","table":{...}}} */
    public String tableChanged(int round, String nodeId, RoutingTable table) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "tableChanged");
        root.put("round", round);
        root.put("node", nodeId);
        writeTable(root.putObject("table"), table);
        return write(root);
    }

    /** {@code {"type":"roundEnd","round":2,"changedNodes":0}} */
    public String roundEnd(int round, int changedNodes) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "roundEnd");
        root.put("round", round);
        root.put("changedNodes", changedNodes);
        return write(root);
    }

    /** {@code {"type":"runComplete","status":"CONVERGED","rounds":2,...}} */
    public String runComplete(ConvergenceResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "runComplete");
        root.put("status", result.status().name());
        root.put("rounds", result.rounds());
        root.put("maxRounds", result.maxRounds());
        root.put("elapsedSeconds", result.elapsedSeconds());
        return write(root);
    }

    private static void writeTable(ObjectNode target, RoutingTable table) {
        for (Map.Entry<String, Double> e : table.asMap().entrySet()) {
            double cost = e.getValue();
            if (Double.isInfinite(cost))
                target.putNull(e.getKey());
            else
                target.put(e.getKey(), cost);
        }
    }

    private String write(ObjectNode root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize dashboard message", e);
        }
    }
}
