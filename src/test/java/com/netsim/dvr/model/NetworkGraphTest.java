package com.netsim.dvr.model;

import com.netsim.dvr.io.TopologyDefinition;
import com.netsim.dvr.testutil.Topologies;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NetworkGraphTest {

    @Test
    public void testNodesKeepRegistrationOrder() {
        NetworkGraph g = NetworkGraph.builder()
                .addLink("b", "a", 1)
                .addLink("c", "a", 2)
                .build(Topologies.UNBOUND);
        assertEquals(List.of("b", "a", "c"), g.nodeIds());
        assertEquals(3, g.nodeCount());
        assertEquals(2, g.linkCount());
    }

    @Test
    public void testLinksAreBidirectional() {
        NetworkGraph g = Topologies.triangle();
        assertEquals(3.0, g.linkWeight("1", "2"), 0.0);
        assertEquals(3.0, g.linkWeight("2", "1"), 0.0);
        assertEquals(0.0, g.linkWeight("2", "2"), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, g.linkWeight("1", "9"), 0.0);
        assertEquals("2", g.requireNode("1").edgeTo("2").destination());
        assertNull(g.requireNode("1").edgeTo("9"));
    }

    @Test
    public void testRedefinedLinkKeepsLastWeight() {
        NetworkGraph g = NetworkGraph.builder()
                .addLink("1", "2", 3)
                .addLink("2", "1", 7)
                .build(Topologies.UNBOUND);
        assertEquals(1, g.linkCount());
        assertEquals(7.0, g.linkWeight("1", "2"), 0.0);
        assertEquals(7.0, g.linkWeight("2", "1"), 0.0);
    }

    @Test
    public void testSetLinkWeightUpdatesBothHalves() {
        NetworkGraph g = Topologies.triangle();
        assertTrue(g.setLinkWeight("1", "3", 2));
        assertEquals(2.0, g.linkWeight("3", "1"), 0.0);
        assertFalse(g.setLinkWeight("1", "9", 2));
    }

    @Test
    public void testSequentialEndpoints() {
        NetworkGraph g = Topologies.triangle(EndpointAllocator.sequential("localhost", 10, 5));
        assertEquals(new Endpoint("localhost", 10), g.requireNode("1").endpoint());
        assertEquals(new Endpoint("localhost", 15), g.requireNode("2").endpoint());
        assertEquals(new Endpoint("localhost", 20), g.requireNode("3").endpoint());
    }

    @Test(expected = IllegalStateException.class)
    public void testDuplicateEndpointIsRejected() {
        Topologies.triangle((id, index) -> new Endpoint("localhost", 30000));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfLinkIsRejected() {
        NetworkGraph.builder().addLink("1", "1", 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeWeightIsRejected() {
        NetworkGraph.builder().addLink("1", "2", -1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRequireUnknownNode() {
        Topologies.triangle().requireNode("9");
    }

    @Test
    public void testFromDefinition() {
        TopologyDefinition def = new TopologyDefinition()
                .addLink("x", "y", 2)
                .addLink("y", "z", 4);
        NetworkGraph g = NetworkGraph.fromDefinition(def, Topologies.UNBOUND);
        assertEquals(List.of("x", "y", "z"), g.nodeIds());
        assertEquals(4.0, g.linkWeight("z", "y"), 0.0);
    }

    @Test
    public void testInboxDrainAndAccumulate() {
        Node n = Topologies.triangle().requireNode("1");
        n.deliver(List.of());
        n.deliver(List.of());

        assertEquals(2, n.beginUpdate(MailboxPolicy.ACCUMULATE).batches().size());
        assertEquals(2, n.pendingBatches());
        assertEquals(2, n.beginUpdate(MailboxPolicy.DRAIN).batches().size());
        assertEquals(0, n.pendingBatches());
        assertEquals(2, n.deliveredBatches());
    }
}
