package com.netsim.dvr.model;

/**
 * What a node's inbox does with advertisements once an update has read them.
 */
public enum MailboxPolicy {
    /** The update atomically takes every pending batch and leaves the inbox empty. */
    DRAIN,
    /**
     * Batches are never removed; every update reprocesses everything received
     * so far, including advertisements already applied.
     */
    ACCUMULATE
}
