package com.netsim.dvr.api;

/**
 * How a controller run ended.
 */
public enum ConvergenceStatus {
    /** A full round changed no table. */
    CONVERGED,
    /** The round cap was reached while tables were still changing. */
    DID_NOT_CONVERGE,
    /** The continuation predicate declined another round (stepped mode only). */
    HALTED
}
