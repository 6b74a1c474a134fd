package com.netsim.dvr.engine;

import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.api.RoutingTableEntry;
import com.netsim.dvr.model.NetworkGraph;
import com.netsim.dvr.testutil.Topologies;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class DistanceVectorEngineTest {
    private static final double INF = Double.POSITIVE_INFINITY;

    private NetworkGraph graph;
    private DistanceVectorEngine engine;

    @Before
    public void setUp() {
        graph = Topologies.triangle();
        engine = new DistanceVectorEngine();
    }

    @Test
    public void testInitialTableUsesDirectLinks() {
        RoutingTable t1 = engine.initialTable(graph, "1");
        assertEquals(List.of("1", "2", "3"), List.copyOf(t1.destinations()));
        assertEquals(0.0, t1.cost("1"), 0.0);
        assertEquals(3.0, t1.cost("2"), 0.0);
        assertEquals(10.0, t1.cost("3"), 0.0);
    }

    @Test
    public void testInitialTableUnreachableIsInfinite() {
        NetworkGraph chain = Topologies.chain(3);
        RoutingTable t1 = engine.initialTable(chain, "1");
        assertEquals(INF, t1.cost("3"), 0.0);
        assertTrue(t1.knows("3"));
    }

    @Test
    public void testInitializeInstallsTablesAndClearsInbox() {
        graph.requireNode("1").deliver(List.of(new RoutingTableEntry("2", "3", 1)));
        engine.initialize(graph);
        assertEquals(0, graph.requireNode("1").pendingBatches());
        assertEquals(10.0, graph.requireNode("1").table().cost("3"), 0.0);
        assertEquals(10.0, graph.requireNode("3").table().cost("1"), 0.0);
    }

    @Test
    public void testRelaxAdoptsCheaperRoute() {
        engine.initialize(graph);
        RoutingTable node1 = graph.requireNode("1").table();
        RoutingTable node2 = graph.requireNode("2").table();
        RoutingTable node3 = graph.requireNode("3").table();

        DistanceVectorEngine.UpdateResult r = engine.relax(node1, List.of(node2.entries(), node3.entries()));
        assertTrue(r.changed());
        assertEquals(4.0, r.table().cost("3"), 0.0);
        assertEquals(3.0, r.table().cost("2"), 0.0);
        assertEquals(0.0, r.table().cost("1"), 0.0);
    }

    @Test
    public void testRelaxNodeThreeLearnsNodeOneViaTwo() {
        engine.initialize(graph);
        RoutingTable node3 = graph.requireNode("3").table();
        RoutingTable node1 = graph.requireNode("1").table();
        RoutingTable node2 = graph.requireNode("2").table();

        DistanceVectorEngine.UpdateResult r = engine.relax(node3, List.of(node1.entries(), node2.entries()));
        assertTrue(r.changed());
        assertEquals(4.0, r.table().cost("1"), 0.0);
    }

    @Test
    public void testRelaxWithoutImprovementReturnsSameTable() {
        RoutingTable current = RoutingTable.of("1", Map.of("1", 0.0, "2", 3.0));
        DistanceVectorEngine.UpdateResult r = engine.relax(current,
                List.of(List.of(new RoutingTableEntry("2", "1", 3.0), new RoutingTableEntry("2", "2", 0.0))));
        assertFalse(r.changed());
        assertSame(current, r.table());
    }

    @Test
    public void testRelaxIgnoresUnknownAdvertiser() {
        RoutingTable current = RoutingTable.of("1", Map.of("1", 0.0, "2", 3.0, "9", INF));
        DistanceVectorEngine.UpdateResult r = engine.relax(current,
                List.of(List.of(new RoutingTableEntry("9", "2", 0.5)),
                        List.of(new RoutingTableEntry("7", "2", 0.5))));
        assertFalse(r.changed());
        assertEquals(3.0, r.table().cost("2"), 0.0);
    }

    @Test
    public void testRelaxNeverTouchesSelfDistance() {
        RoutingTable current = RoutingTable.of("1", Map.of("1", 0.0, "2", 3.0));
        DistanceVectorEngine.UpdateResult r = engine.relax(current,
                List.of(List.of(new RoutingTableEntry("2", "1", 0.0)),
                        List.of(new RoutingTableEntry("1", "2", 0.0))));
        assertFalse(r.changed());
        assertEquals(0.0, r.table().cost("1"), 0.0);
        assertEquals(3.0, r.table().cost("2"), 0.0);
    }

    @Test
    public void testRelaxLearnsUnknownDestination() {
        RoutingTable current = RoutingTable.of("1", Map.of("1", 0.0, "2", 3.0));
        DistanceVectorEngine.UpdateResult r = engine.relax(current,
                List.of(List.of(new RoutingTableEntry("2", "5", 2.0))));
        assertTrue(r.changed());
        assertEquals(5.0, r.table().cost("5"), 0.0);
    }

    @Test
    public void testAdvertisementTargetsSkipInactiveLinks() {
        NetworkGraph g = NetworkGraph.builder()
                .addLink("a", "b", 1)
                .addLink("a", "c", INF)
                .addLink("a", "d", 0)
                .build(Topologies.UNBOUND);
        assertEquals(List.of("b"), engine.advertisementTargets(g.requireNode("a")));
    }
}
