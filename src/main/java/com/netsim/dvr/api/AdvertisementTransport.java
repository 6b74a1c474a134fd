package com.netsim.dvr.api;

import java.util.List;

/**
 * Point-to-point delivery of a distance vector from one node to a neighbor.
 *
 * Contract:
 * - Best effort. A failed delivery is logged and dropped by the
 * implementation; it is never reported to the caller as an exception.
 * - Synchronous. When {@link #send} returns true the advertisement is already
 * in the receiver's inbox.
 * - No ordering guarantee between sends from different nodes.
 */
public interface AdvertisementTransport {

    /**
     * @param fromId        advertiser.
     * @param toId          receiving neighbor.
     * @param advertisement advertiser's whole table as wire rows.
     * @return true if the receiver acknowledged the advertisement.
     */
    boolean send(String fromId, String toId, List<RoutingTableEntry> advertisement);
}
