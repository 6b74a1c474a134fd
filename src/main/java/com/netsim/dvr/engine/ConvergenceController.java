package com.netsim.dvr.engine;

import com.netsim.dvr.api.AdvertisementTransport;
import com.netsim.dvr.api.ContinuationPredicate;
import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.ConvergenceStatus;
import com.netsim.dvr.api.RoutingListener;
import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.api.RoutingTableEntry;
import com.netsim.dvr.config.SimulationConfig;
import com.netsim.dvr.model.MailboxPolicy;
import com.netsim.dvr.model.NetworkGraph;
import com.netsim.dvr.model.Node;
import com.netsim.dvr.util.ErrorRateLimiter;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives distance-vector rounds over the whole graph until the tables stop
 * changing.
 *
 * State machine:
 * INIT -> ROUND -> STABLE -> DONE
 *              \-> UNSTABLE -> ROUND (or DONE when capped / halted)
 *
 * Round:
 * 1. Broadcast: every node, in graph order, sends its whole table to each
 * active neighbor through the {@link AdvertisementTransport}.
 * 2. Update: every node, in the same order, takes a snapshot of its table and
 * inbox and applies {@link DistanceVectorEngine#relax}. Changed tables are
 * installed and reported to the listener.
 * 3. Stability: if no node changed the round is STABLE and the run ends with
 * {@link ConvergenceStatus#CONVERGED}.
 *
 * Safety bound:
 * A run executes at most {@code maxRounds} rounds (node count x 50 by
 * default). Reaching it while still unstable ends the run with
 * {@link ConvergenceStatus#DID_NOT_CONVERGE}; the tables are kept as the best
 * effort state.
 *
 * Modes:
 * - Unattended ({@link #runUnattended()}): rounds follow each other
 * automatically.
 * - Stepped ({@link #runStepped(ContinuationPredicate)}): after every unstable
 * round below the cap the predicate is asked; false ends the run with
 * {@link ConvergenceStatus#HALTED}.
 *
 * Threading:
 * Single-threaded and non-reentrant. Node listeners keep appending to inboxes
 * concurrently; the per-node lock on {@link Node} makes that safe. Link cost
 * edits must not run concurrently with a run.
 */
public final class ConvergenceController {
    private static final Logger log = LogManager.getLogger(ConvergenceController.class);

    private final NetworkGraph graph;
    private final DistanceVectorEngine engine;
    private final AdvertisementTransport transport;
    private final MailboxPolicy mailboxPolicy;
    private final int maxRounds;

    private final ErrorRateLimiter listenerErrors = new ErrorRateLimiter(log, 1000);
    private RoutingListener listener;

    private long totalRounds;
    private ConvergenceResult lastResult;

    public ConvergenceController(NetworkGraph graph, DistanceVectorEngine engine,
            AdvertisementTransport transport, SimulationConfig config) {
        this.graph = graph;
        this.engine = engine;
        this.transport = transport;
        this.mailboxPolicy = config.getMailboxPolicy();
        this.maxRounds = config.maxRounds(graph.nodeCount());
    }

    public void setListener(RoutingListener listener) {
        this.listener = listener;
    }

    /**
     * Initializes every node's table and publishes the initial snapshot.
     */
    public void initialize() {
        engine.initialize(graph);
        final RoutingListener l = this.listener;
        if (l == null)
            return;
        for (Node node : graph.nodes()) {
            RoutingTable table = node.table();
            notifyListener(() -> l.onInitialTable(node.id(), table));
        }
    }

    public ConvergenceResult runUnattended() {
        ConvergenceResult result = run(null);
        log.info("Unattended run finished: {} after {} rounds in {} s",
                result.status(), result.rounds(), String.format("%.3f", result.elapsedSeconds()));
        return result;
    }

    public ConvergenceResult runStepped(ContinuationPredicate predicate) {
        if (predicate == null)
            throw new IllegalArgumentException("Stepped mode needs a continuation predicate");
        ConvergenceResult result = run(predicate);
        log.info("Stepped run finished: {} after {} rounds", result.status(), result.rounds());
        return result;
    }

    private ConvergenceResult run(ContinuationPredicate predicate) {
        final long start = System.nanoTime();
        int rounds = 0;
        ConvergenceStatus status;

        while (true) {
            rounds++;
            int changed = runRound(rounds);

            if (changed == 0) {
                status = ConvergenceStatus.CONVERGED;
                break;
            }
            if (rounds >= maxRounds) {
                log.warn("Reached {} rounds without becoming stable", maxRounds);
                status = ConvergenceStatus.DID_NOT_CONVERGE;
                break;
            }
            if (predicate != null && !predicate.shouldContinue(rounds)) {
                log.info("Run halted by caller after round {}", rounds);
                status = ConvergenceStatus.HALTED;
                break;
            }
        }

        ConvergenceResult result = new ConvergenceResult(status, rounds, maxRounds, System.nanoTime() - start);
        this.lastResult = result;
        final RoutingListener l = this.listener;
        if (l != null)
            notifyListener(() -> l.onRunComplete(result));
        return result;
    }

    /**
     * Executes one broadcast + update round outside of a run.
     *
     * @return number of nodes whose table changed.
     */
    public int runRound() {
        return runRound(1);
    }

    private int runRound(int round) {
        totalRounds++;
        final RoutingListener l = this.listener;
        if (l != null)
            notifyListener(() -> l.onRoundStart(round));

        broadcast();

        List<Node> changedNodes = new ArrayList<>();
        for (Node node : graph.nodes()) {
            Node.UpdateSnapshot snapshot = node.beginUpdate(mailboxPolicy);
            DistanceVectorEngine.UpdateResult update = engine.relax(snapshot.table(), snapshot.batches());
            if (update.changed()) {
                node.replaceTable(update.table());
                changedNodes.add(node);
                log.debug("Round {}: node {} updated table {}", round, node.id(), update.table());
            }
        }

        if (l != null) {
            for (Node node : changedNodes) {
                RoutingTable table = node.table();
                notifyListener(() -> l.onTableChanged(round, node.id(), table));
            }
            notifyListener(() -> l.onRoundEnd(round, changedNodes.size()));
        }
        return changedNodes.size();
    }

    private void broadcast() {
        for (Node node : graph.nodes()) {
            List<RoutingTableEntry> advertisement = engine.advertisement(node);
            for (String neighbor : engine.advertisementTargets(node)) {
                if (!transport.send(node.id(), neighbor, advertisement))
                    log.debug("Advertisement {} -> {} was not delivered", node.id(), neighbor);
            }
        }
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            listenerErrors.log("Routing listener failed", e);
        }
    }

    public int maxRounds() {
        return maxRounds;
    }

    /** Rounds executed over the controller's lifetime, across runs. */
    public long totalRounds() {
        return totalRounds;
    }

    /** Outcome of the most recent run, or null before the first one. */
    public ConvergenceResult lastResult() {
        return lastResult;
    }

    public NetworkGraph graph() {
        return graph;
    }
}
