package com.netsim.dvr;

import com.netsim.dvr.api.AdvertisementTransport;
import com.netsim.dvr.api.ContinuationPredicate;
import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingListener;
import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.config.SimulationConfig;
import com.netsim.dvr.engine.ConvergenceController;
import com.netsim.dvr.engine.DistanceVectorEngine;
import com.netsim.dvr.engine.LinkMutator;
import com.netsim.dvr.engine.LinkNotFoundException;
import com.netsim.dvr.io.TopologyParser;
import com.netsim.dvr.model.NetworkGraph;
import com.netsim.dvr.model.Node;
import com.netsim.dvr.transport.MessagingFabric;
import com.netsim.dvr.util.CompositeRoutingListener;
import com.netsim.dvr.web.DashboardListener;
import com.netsim.dvr.web.RoutingDashboardServer;
import com.netsim.dvr.web.TableSnapshotSerializer;
import com.netsim.dvr.wiring.AsyncRoutingListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper that wires a complete routing simulation.
 * <p>
 * This class handles:
 * <ul>
 * <li>Building the {@link NetworkGraph} from a topology file</li>
 * <li>Starting the per-node listeners of the {@link MessagingFabric}</li>
 * <li>Setting up the {@link ConvergenceController} and {@link LinkMutator}</li>
 * <li>Fanning listener callbacks out through a {@link CompositeRoutingListener}</li>
 * <li>Optionally hosting the web dashboard</li>
 * </ul>
 * Methods are synchronized: a link cost edit never overlaps a run.
 */
public class RoutingSimulation implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(RoutingSimulation.class);

    private final NetworkGraph graph;
    private final SimulationConfig config;
    private final MessagingFabric fabric;
    private final ConvergenceController controller;
    private final LinkMutator mutator;
    private final CompositeRoutingListener listeners = new CompositeRoutingListener();
    private final List<AutoCloseable> closeables = new ArrayList<>();

    private RoutingDashboardServer dashboard;
    private boolean started;
    private boolean closed;

    /**
     * Simulation over real sockets.
     */
    public RoutingSimulation(NetworkGraph graph, SimulationConfig config) {
        this(graph, config, new MessagingFabric(graph, config));
    }

    /**
     * Simulation over any transport. A {@link MessagingFabric} is started and
     * shut down with the simulation; other transports are used as they are.
     */
    public RoutingSimulation(NetworkGraph graph, SimulationConfig config, AdvertisementTransport transport) {
        this.graph = graph;
        this.config = config;
        this.fabric = transport instanceof MessagingFabric f ? f : null;
        this.controller = new ConvergenceController(graph, new DistanceVectorEngine(), transport, config);
        this.mutator = new LinkMutator(graph);
        controller.setListener(listeners);
    }

    /**
     * Loads a topology file and builds a socket-based simulation with
     * endpoints from {@code config}.
     */
    public static RoutingSimulation fromTopologyFile(Path topology, SimulationConfig config) throws IOException {
        NetworkGraph graph = NetworkGraph.fromDefinition(TopologyParser.parseFile(topology),
                config.endpointAllocator());
        log.info("Loaded {} nodes and {} links from {}", graph.nodeCount(), graph.linkCount(), topology);
        return new RoutingSimulation(graph, config);
    }

    /**
     * Registers a listener. Listeners that are {@link AutoCloseable} are closed
     * with the simulation.
     */
    public synchronized RoutingSimulation addListener(RoutingListener listener) {
        if (started)
            throw new IllegalStateException("Listeners must be added before start()");
        listeners.add(listener);
        if (listener instanceof AutoCloseable c)
            closeables.add(c);
        return this;
    }

    /**
     * Starts messaging, initializes every table and publishes the initial
     * snapshot.
     */
    public synchronized void start() {
        if (closed)
            throw new IllegalStateException("Simulation is closed");
        if (started)
            throw new IllegalStateException("Simulation already started");

        if (config.getDashboardPort() > 0)
            startDashboard(config.getDashboardPort());
        if (fabric != null)
            fabric.start();
        controller.initialize();
        started = true;
        log.info("Simulation of {} nodes started, round cap {}", graph.nodeCount(), controller.maxRounds());
    }

    private void startDashboard(int port) {
        dashboard = new RoutingDashboardServer();
        AsyncRoutingListener async = new AsyncRoutingListener(
                new DashboardListener(dashboard, new TableSnapshotSerializer()));
        listeners.add(async);
        closeables.add(async);
        dashboard.start(port);
    }

    public synchronized ConvergenceResult runUnattended() {
        requireStarted();
        return controller.runUnattended();
    }

    public synchronized ConvergenceResult runStepped(ContinuationPredicate predicate) {
        requireStarted();
        return controller.runStepped(predicate);
    }

    /**
     * Overwrites the cost of the link a-b in the graph and both tables. The
     * change is reported to listeners as round 0 and propagates on the next
     * run.
     */
    public synchronized void changeLinkCost(String nodeA, String nodeB, double cost) throws LinkNotFoundException {
        requireStarted();
        mutator.mutate(nodeA, nodeB, cost);
        try {
            listeners.onTableChanged(0, nodeA, graph.requireNode(nodeA).table());
            listeners.onTableChanged(0, nodeB, graph.requireNode(nodeB).table());
        } catch (RuntimeException e) {
            log.warn("Routing listener failed on link cost edit {}-{}", nodeA, nodeB, e);
        }
    }

    /** Current table of every node, in graph order. */
    public synchronized Map<String, RoutingTable> tables() {
        Map<String, RoutingTable> tables = new LinkedHashMap<>(graph.nodeCount() * 2);
        for (Node node : graph.nodes())
            tables.put(node.id(), node.table());
        return tables;
    }

    public RoutingTable table(String nodeId) {
        return graph.requireNode(nodeId).table();
    }

    public NetworkGraph graph() {
        return graph;
    }

    public ConvergenceController controller() {
        return controller;
    }

    public SimulationConfig config() {
        return config;
    }

    /** Dashboard port, or -1 when no dashboard runs. */
    public int dashboardPort() {
        return dashboard == null ? -1 : dashboard.port();
    }

    public synchronized boolean isStarted() {
        return started && !closed;
    }

    private void requireStarted() {
        if (!started || closed)
            throw new IllegalStateException("Simulation is not running");
    }

    /**
     * Stops every node listener and waits for them, then closes listeners and
     * the dashboard.
     */
    @Override
    public synchronized void close() {
        if (closed)
            return;
        closed = true;
        if (fabric != null)
            fabric.shutdown();
        for (AutoCloseable c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                log.warn("Failed to close listener {}", c, e);
            }
        }
        if (dashboard != null)
            dashboard.stop();
        log.info("Simulation closed");
    }
}
