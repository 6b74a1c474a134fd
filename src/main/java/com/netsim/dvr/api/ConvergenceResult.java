package com.netsim.dvr.api;

import java.util.concurrent.TimeUnit;

/**
 * Outcome of one controller run.
 *
 * @param status       why the run stopped.
 * @param rounds       rounds executed, including the final stable round.
 * @param maxRounds    cap that applied to this run.
 * @param elapsedNanos wall-clock duration of the run.
 */
public record ConvergenceResult(ConvergenceStatus status, int rounds, int maxRounds, long elapsedNanos) {

    public boolean converged() {
        return status == ConvergenceStatus.CONVERGED;
    }

    public double elapsedSeconds() {
        return elapsedNanos / (double) TimeUnit.SECONDS.toNanos(1);
    }
}
