package com.netsim.dvr.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.ConvergenceStatus;
import com.netsim.dvr.api.RoutingTable;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class TableSnapshotSerializerTest {

    private final TableSnapshotSerializer serializer = new TableSnapshotSerializer();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testSnapshotWritesInfinityAsNull() throws Exception {
        Map<String, Double> costs = new LinkedHashMap<>();
        costs.put("1", 0.0);
        costs.put("2", Double.POSITIVE_INFINITY);
        Map<String, RoutingTable> tables = new LinkedHashMap<>();
        tables.put("1", RoutingTable.of("1", costs));

        JsonNode root = mapper.readTree(serializer.snapshot(tables));
        assertEquals("snapshot", root.get("type").asText());
        assertEquals(0.0, root.at("/tables/1/1").asDouble(), 0.0);
        assertTrue(root.at("/tables/1/2").isNull());
    }

    @Test
    public void testEventMessages() throws Exception {
        JsonNode changed = mapper.readTree(serializer.tableChanged(2, "3", RoutingTable.of("3", Map.of("1", 4.0))));
        assertEquals("tableChanged", changed.get("type").asText());
        assertEquals(2, changed.get("round").asInt());
        assertEquals("3", changed.get("node").asText());
        assertEquals(4.0, changed.at("/table/1").asDouble(), 0.0);

        JsonNode end = mapper.readTree(serializer.roundEnd(2, 0));
        assertEquals(0, end.get("changedNodes").asInt());

        JsonNode done = mapper.readTree(serializer.runComplete(
                new ConvergenceResult(ConvergenceStatus.DID_NOT_CONVERGE, 5, 5, 0)));
        assertEquals("DID_NOT_CONVERGE", done.get("status").asText());
        assertEquals(5, done.get("rounds").asInt());
    }
}
