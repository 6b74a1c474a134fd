package com.netsim.dvr.io;

/**
 * A topology file line cannot be turned into a link.
 */
public class TopologyFormatException extends IllegalArgumentException {
    private final int lineNumber;

    public TopologyFormatException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public TopologyFormatException(int lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
