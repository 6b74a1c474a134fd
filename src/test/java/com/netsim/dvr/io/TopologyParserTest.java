package com.netsim.dvr.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class TopologyParserTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testParsesLinksUntilSentinel() {
        TopologyDefinition def = TopologyParser.parse("1 2 3\n2 3 1\n1 3 10\nEnd of Input\n4 5 1\n");
        assertEquals(3, def.getLinks().size());
        TopologyDefinition.LinkDef last = def.getLinks().get(2);
        assertEquals("1", last.getSource());
        assertEquals("3", last.getDestination());
        assertEquals(10.0, last.getWeight(), 0.0);
    }

    @Test
    public void testSkipsLinesWithoutThreeFields() {
        TopologyDefinition def = TopologyParser.parse("\n1 2\n  1\t2   2.5  \n1 2 3 4\r\n");
        assertEquals(1, def.getLinks().size());
        assertEquals(2.5, def.getLinks().get(0).getWeight(), 0.0);
    }

    @Test
    public void testMissingSentinelReadsToEnd() {
        assertEquals(2, TopologyParser.parse("a b 1\nb c 2").getLinks().size());
    }

    @Test
    public void testBadWeightNamesLine() {
        try {
            TopologyParser.parse("1 2 3\n2 3 abc\n");
            fail("expected TopologyFormatException");
        } catch (TopologyFormatException e) {
            assertEquals(2, e.lineNumber());
            assertTrue(e.getMessage().contains("abc"));
        }
    }

    @Test(expected = TopologyFormatException.class)
    public void testNegativeWeightIsRejected() {
        TopologyParser.parse("1 2 -3\n");
    }

    @Test(expected = TopologyFormatException.class)
    public void testSelfLinkIsRejected() {
        TopologyParser.parse("1 1 3\n");
    }

    @Test
    public void testParseFile() throws Exception {
        Path file = folder.newFile("topology.txt").toPath();
        Files.writeString(file, "1 2 3\n2 3 1\nEnd of Input\n");
        assertEquals(2, TopologyParser.parseFile(file).getLinks().size());
    }
}
