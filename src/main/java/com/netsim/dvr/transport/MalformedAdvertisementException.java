package com.netsim.dvr.transport;

import java.io.IOException;

/**
 * A received payload is not a valid list of routing rows.
 */
public class MalformedAdvertisementException extends IOException {

    public MalformedAdvertisementException(String message) {
        super(message);
    }

    public MalformedAdvertisementException(String message, Throwable cause) {
        super(message, cause);
    }
}
