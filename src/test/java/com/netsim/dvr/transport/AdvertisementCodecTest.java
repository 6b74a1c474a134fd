package com.netsim.dvr.transport;

import com.netsim.dvr.api.RoutingTableEntry;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class AdvertisementCodecTest {

    private final AdvertisementCodec codec = new AdvertisementCodec();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testEncodesTriplesWithBareInfinity() {
        String json = new String(codec.encode(List.of(
                new RoutingTableEntry("1", "2", 3.0),
                new RoutingTableEntry("1", "3", Double.POSITIVE_INFINITY))), StandardCharsets.UTF_8);
        assertEquals("[[\"1\",\"2\",3.0],[\"1\",\"3\",Infinity]]", json);
    }

    @Test
    public void testDecodesBareAndQuotedInfinity() throws Exception {
        List<RoutingTableEntry> rows = codec.decode(utf8("[[1,2,Infinity],[\"1\",\"3\",\"Infinity\"],[\"1\",\"1\",0]]"));
        assertEquals(3, rows.size());
        assertEquals(new RoutingTableEntry("1", "2", Double.POSITIVE_INFINITY), rows.get(0));
        assertEquals(Double.POSITIVE_INFINITY, rows.get(1).cost(), 0.0);
        assertEquals(0.0, rows.get(2).cost(), 0.0);
    }

    @Test
    public void testDecodesEmptyAdvertisement() throws Exception {
        assertTrue(codec.decode(utf8("[]")).isEmpty());
    }

    @Test(expected = MalformedAdvertisementException.class)
    public void testRejectsInvalidJson() throws Exception {
        codec.decode(utf8("[[\"1\",\"2\""));
    }

    @Test(expected = MalformedAdvertisementException.class)
    public void testRejectsNonArrayRoot() throws Exception {
        codec.decode(utf8("{\"1\":2}"));
    }

    @Test(expected = MalformedAdvertisementException.class)
    public void testRejectsShortRow() throws Exception {
        codec.decode(utf8("[[\"1\",\"2\"]]"));
    }

    @Test(expected = MalformedAdvertisementException.class)
    public void testRejectsNegativeCost() throws Exception {
        codec.decode(utf8("[[\"1\",\"2\",-4]]"));
    }

    @Test(expected = MalformedAdvertisementException.class)
    public void testRejectsEmptyPayload() throws Exception {
        codec.decode(new byte[0]);
    }
}
