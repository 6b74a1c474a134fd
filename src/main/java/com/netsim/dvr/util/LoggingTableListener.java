package com.netsim.dvr.util;

import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingListener;
import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.api.RoutingTableEntry;

import lombok.extern.log4j.Log4j2;

/**
 * Writes routing tables to the log as a three-column table.
 *
 * <pre>
 * Routing table of node 1
 * Source     | Destination | Cost
 * 1          | 1           | 0.0
 * 1          | 2           | 3.0
 * </pre>
 */
@Log4j2
public class LoggingTableListener implements RoutingListener {

    @Override
    public void onInitialTable(String nodeId, RoutingTable table) {
        log.info("Initial {}", render(table));
    }

    @Override
    public void onRoundStart(int round) {
        log.debug("Round {} started", round);
    }

    @Override
    public void onTableChanged(int round, String nodeId, RoutingTable table) {
        log.info("Round {}: {}", round, render(table));
    }

    @Override
    public void onRoundEnd(int round, int changedNodes) {
        if (changedNodes == 0)
            log.info("Round {}: no table changed, network is stable", round);
        else
            log.info("Round {}: {} table(s) changed", round, changedNodes);
    }

    @Override
    public void onRunComplete(ConvergenceResult result) {
        switch (result.status()) {
            case CONVERGED -> log.info("Convergence reached after {} rounds in {} s",
                    result.rounds(), String.format("%.3f", result.elapsedSeconds()));
            case DID_NOT_CONVERGE -> log.warn("Network did not converge within {} rounds", result.maxRounds());
            case HALTED -> log.info("Run stopped by user after {} rounds", result.rounds());
        }
    }

    /** Renders one table, header included. */
    public static String render(RoutingTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append("routing table of node ").append(table.owner()).append(System.lineSeparator());
        sb.append(String.format("%-10s | %-11s | %s", "Source", "Destination", "Cost"));
        for (RoutingTableEntry row : table.entries()) {
            sb.append(System.lineSeparator());
            sb.append(String.format("%-10s | %-11s | %s", row.source(), row.destination(), row.cost()));
        }
        return sb.toString();
    }
}
