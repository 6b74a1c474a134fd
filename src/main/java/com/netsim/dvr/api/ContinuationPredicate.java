package com.netsim.dvr.api;

/**
 * Decides, in stepped mode, whether the controller should run another round.
 *
 * Returning false stops the current run gracefully with
 * {@link ConvergenceStatus#HALTED}. It never terminates the process; that
 * decision stays with whoever called the controller.
 */
@FunctionalInterface
public interface ContinuationPredicate {

    /**
     * @param completedRound number of rounds finished so far in this run.
     * @return true to run the next round.
     */
    boolean shouldContinue(int completedRound);

    static ContinuationPredicate always() {
        return round -> true;
    }

    static ContinuationPredicate never() {
        return round -> false;
    }
}
