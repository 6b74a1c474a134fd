package com.netsim.dvr;

import com.netsim.dvr.api.ContinuationPredicate;
import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.config.SimulationConfig;
import com.netsim.dvr.engine.LinkNotFoundException;
import com.netsim.dvr.io.TopologyFormatException;
import com.netsim.dvr.util.LoggingTableListener;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Interactive console for the routing simulation.
 *
 * Usage: {@code DistanceVectorApp [topologyFile [configFile]]}. Without a
 * topology file the user is asked for one. Menu:
 * 1. show every node's table,
 * 2. run in single step mode,
 * 3. run without intervention,
 * 4. adjust a link cost, then pick a mode and run,
 * 5. exit.
 * A run (options 2 to 4) ends the session.
 */
public final class DistanceVectorApp {
    private static final Logger log = LogManager.getLogger(DistanceVectorApp.class);

    private final BufferedReader in;
    private final PrintStream out;

    public DistanceVectorApp(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int code = new DistanceVectorApp(stdin, System.out).run(args);
        System.exit(code);
    }

    /**
     * Runs one interactive session.
     *
     * @return process exit code.
     */
    public int run(String[] args) {
        try {
            SimulationConfig config = args.length > 1
                    ? SimulationConfig.load(Path.of(args[1]))
                    : SimulationConfig.defaults();

            String filename = args.length > 0 ? args[0] : prompt("Enter filename: ");
            if (filename == null)
                return 1;
            Path topology = Path.of(filename.strip());
            if (!Files.isRegularFile(topology)) {
                out.println("File not found.");
                return 1;
            }

            try (RoutingSimulation simulation = RoutingSimulation.fromTopologyFile(topology, config)) {
                simulation.addListener(new LoggingTableListener());
                simulation.start();
                out.println("All servers are ready.");
                menu(simulation);
            }
            return 0;
        } catch (TopologyFormatException e) {
            out.println("Invalid topology: " + e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.error("Console input or topology could not be read", e);
            out.println("Could not read input: " + e.getMessage());
            return 1;
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.error("Simulation failed", e);
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void menu(RoutingSimulation simulation) throws IOException {
        while (true) {
            printMenu();
            String choice = prompt("Enter your choice: ");
            if (choice == null)
                return;
            switch (choice.strip()) {
                case "1" -> printTables(simulation);
                case "2" -> {
                    report(simulation.runStepped(steppedPredicate()));
                    return;
                }
                case "3" -> {
                    report(simulation.runUnattended());
                    return;
                }
                case "4" -> {
                    if (adjustAndRun(simulation))
                        return;
                }
                case "5" -> {
                    return;
                }
                default -> out.println("Invalid choice.");
            }
        }
    }

    private void printMenu() {
        String border = "*".repeat(44);
        out.println(border);
        out.println("  Welcome to the Distance Vector Algorithm");
        out.println(border);
        out.println("  1. Display Initial Distance Vector Table for Each Node");
        out.println("  2. Run Algorithm In Single Step Mode");
        out.println("  3. Run Algorithm Without Intervention");
        out.println("  4. Adjust Link Cost");
        out.println("  5. Exit");
        out.println(border);
    }

    private void printTables(RoutingSimulation simulation) {
        for (RoutingTable table : simulation.tables().values()) {
            out.println(LoggingTableListener.render(table));
            out.println();
        }
    }

    /**
     * @return true when a run took place (the session ends), false to go back
     *         to the menu.
     */
    private boolean adjustAndRun(RoutingSimulation simulation) throws IOException {
        String line = prompt("Enter SourceID DestinationID Cost: \nExample Format: 1 2 3\nEnter Yours: ");
        if (line == null)
            return true;
        String[] fields = line.strip().split("\\s+");
        if (fields.length != 3) {
            out.println("Expected three values.");
            return false;
        }
        double cost;
        try {
            cost = Double.parseDouble(fields[2]);
        } catch (NumberFormatException e) {
            out.println("Cost is not a number: " + fields[2]);
            return false;
        }

        try {
            out.println("Before Adjustment:");
            printPair(simulation, fields[0], fields[1]);
            simulation.changeLinkCost(fields[0], fields[1], cost);
        } catch (LinkNotFoundException e) {
            out.println("Link not found: " + e.getMessage());
            return false;
        } catch (IllegalArgumentException e) {
            out.println("Invalid cost: " + e.getMessage());
            return false;
        }
        out.println("Link cost between " + fields[0] + " and " + fields[1] + " adjusted to " + cost + ".");
        out.println("After Adjustment:");
        printPair(simulation, fields[0], fields[1]);

        out.println();
        out.println("How would you like to run the DV algorithm?");
        out.println("1. Single Step Mode");
        out.println("2. Without Intervention");
        String mode = prompt("Enter your choice: ");
        if (mode == null)
            return true;
        switch (mode.strip()) {
            case "1" -> report(simulation.runStepped(steppedPredicate()));
            case "2" -> report(simulation.runUnattended());
            default -> {
                out.println("Invalid choice. Returning to main menu.");
                return false;
            }
        }
        return true;
    }

    private void printPair(RoutingSimulation simulation, String a, String b) {
        for (String id : new String[] { a, b }) {
            if (simulation.graph().contains(id))
                out.println(simulation.table(id));
        }
    }

    private ContinuationPredicate steppedPredicate() {
        return round -> {
            try {
                String answer = prompt("Continue to next cycle? (Y/N): ");
                boolean go = answer != null && answer.strip().equalsIgnoreCase("Y");
                if (!go)
                    out.println("User halted the algorithm.");
                return go;
            } catch (IOException e) {
                log.warn("Could not read the answer after round {}, stopping", round, e);
                return false;
            }
        };
    }

    private void report(ConvergenceResult result) {
        switch (result.status()) {
            case CONVERGED -> {
                out.println("Algorithm has reached a stable state in " + result.rounds() + " cycles.");
                out.printf("Total time taken: %.3f seconds.%n", result.elapsedSeconds());
            }
            case DID_NOT_CONVERGE -> out.println("Reached maximum cycles without becoming stable.");
            case HALTED -> out.println("Stopped after " + result.rounds() + " cycles.");
        }
    }

    private String prompt(String text) throws IOException {
        out.print(text);
        out.flush();
        return in.readLine();
    }
}
