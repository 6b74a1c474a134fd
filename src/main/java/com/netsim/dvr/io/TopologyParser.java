package com.netsim.dvr.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads the plain-text topology format.
 *
 * <pre>
 * 1 2 3
 * 2 3 1
 * 1 3 10
 * End of Input
 * </pre>
 *
 * <p>
 * One link per line as {@code SRC DEST WEIGHT}, whitespace separated, weight a
 * non-negative decimal. Parsing stops at the {@value #END_OF_INPUT} line; a
 * missing sentinel simply reads to the end. Lines that do not have exactly
 * three fields (blank lines included) are skipped.
 */
public final class TopologyParser {
    private static final Logger log = LogManager.getLogger(TopologyParser.class);

    public static final String END_OF_INPUT = "End of Input";

    private TopologyParser() {
        // Utility class
    }

    /** Parses a topology file. */
    public static TopologyDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses topology text.
     *
     * @throws TopologyFormatException if a weight is not a non-negative number
     *                                 or a link connects a node to itself.
     */
    public static TopologyDefinition parse(String text) {
        TopologyDefinition def = new TopologyDefinition();
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.equals(END_OF_INPUT))
                break;

            String[] fields = line.isEmpty() ? new String[0] : line.split("\\s+");
            if (fields.length != 3) {
                if (!line.isEmpty())
                    log.debug("Skipping line {}: expected 3 fields, got {}", lineNumber, fields.length);
                continue;
            }
            if (fields[0].equals(fields[1]))
                throw new TopologyFormatException(lineNumber, "self-link on node " + fields[0]);
            def.addLink(fields[0], fields[1], weight(fields[2], lineNumber));
        }
        log.debug("Parsed {} links", def.getLinks().size());
        return def;
    }

    private static double weight(String field, int lineNumber) {
        double weight;
        try {
            weight = Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw new TopologyFormatException(lineNumber, "weight is not a number: " + field, e);
        }
        if (Double.isNaN(weight) || weight < 0)
            throw new TopologyFormatException(lineNumber, "weight must be non-negative: " + field);
        return weight;
    }
}
