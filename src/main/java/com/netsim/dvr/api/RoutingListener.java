package com.netsim.dvr.api;

/**
 * Display/observability interface for the routing simulation.
 *
 * Implementations are registered with the ConvergenceController (usually
 * through the RoutingSimulation facade) and receive:
 *
 * - Initial snapshot: one {@link #onInitialTable} per node after table
 * initialization, in graph order.
 * - Round lifecycle: {@link #onRoundStart} / {@link #onRoundEnd} around every
 * round.
 * - Change events: {@link #onTableChanged} for every node whose table changed
 * in the round, after all nodes of that round were updated. A manual link
 * cost edit is reported the same way with round 0.
 * - Run completion: {@link #onRunComplete} with the outcome.
 *
 * These callbacks are notifications only. Nothing a listener returns or
 * throws influences the algorithm; exceptions are logged and swallowed by the
 * controller. Callbacks run on the controller thread, so slow displays should
 * be wrapped in an AsyncRoutingListener.
 */
public interface RoutingListener {

    /**
     * Called once per node after initialization, before any round runs.
     *
     * @param nodeId The node.
     * @param table  Its freshly initialized table.
     */
    void onInitialTable(String nodeId, RoutingTable table);

    /**
     * Called immediately before a round begins broadcasting.
     *
     * @param round 1-based round number within the current run.
     */
    void onRoundStart(int round);

    /**
     * Called for each node whose table changed during the round.
     *
     * @param round  Current round.
     * @param nodeId The node that changed.
     * @param table  Its new table.
     */
    void onTableChanged(int round, String nodeId, RoutingTable table);

    /**
     * Called when the round is complete.
     *
     * @param round        Current round.
     * @param changedNodes Number of nodes whose table changed (0 means stable).
     */
    void onRoundEnd(int round, int changedNodes);

    /**
     * Called once when a run of the controller ends, whatever the outcome.
     */
    void onRunComplete(ConvergenceResult result);
}
