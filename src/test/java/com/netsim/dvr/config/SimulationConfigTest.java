package com.netsim.dvr.config;

import com.netsim.dvr.model.Endpoint;
import com.netsim.dvr.model.MailboxPolicy;
import org.junit.Test;

import static org.junit.Assert.*;

public class SimulationConfigTest {

    @Test
    public void testDefaultsFromClasspath() {
        SimulationConfig c = SimulationConfig.defaults();
        assertEquals("localhost", c.getHost());
        assertEquals(15000, c.getBasePort());
        assertEquals(MailboxPolicy.DRAIN, c.getMailboxPolicy());
        assertEquals(150, c.maxRounds(3));
    }

    @Test
    public void testPartialJsonKeepsDefaults() throws Exception {
        SimulationConfig c = SimulationConfig.fromJson(
                "{\"basePort\":10,\"portStride\":10,\"mailboxPolicy\":\"ACCUMULATE\",\"unknown\":true}");
        assertEquals(10, c.getBasePort());
        assertEquals(MailboxPolicy.ACCUMULATE, c.getMailboxPolicy());
        assertEquals(1000, c.getPollIntervalMillis());
        assertEquals(new Endpoint("localhost", 30), c.endpointAllocator().allocate("3", 2));
    }

    @Test
    public void testRoundLimitOverridesPerNodeCap() {
        SimulationConfig c = new SimulationConfig();
        c.setRoundsPerNode(2);
        assertEquals(8, c.maxRounds(4));
        c.setRoundLimit(3);
        assertEquals(3, c.maxRounds(4));
        c.setRoundLimit(0);
        assertEquals(1, c.maxRounds(0));
    }

    @Test
    public void testEphemeralAllocatorWhenBasePortIsZero() {
        SimulationConfig c = new SimulationConfig();
        c.setBasePort(0);
        Endpoint e = c.endpointAllocator().allocate("1", 0);
        assertTrue(e.port() > 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidValuesAreRejected() throws Exception {
        SimulationConfig.fromJson("{\"portStride\":0}");
    }
}
