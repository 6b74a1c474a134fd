package com.netsim.dvr.web;

import io.javalin.Javalin;
import io.javalin.websocket.WsContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * A lightweight web server exposing the current routing tables.
 *
 * - {@code GET /api/tables}: JSON snapshot of every node's table.
 * - {@code /ws/tables}: WebSocket; a client receives the snapshot on connect,
 * then every change event pushed through {@link #broadcast(String)}.
 */
public class RoutingDashboardServer {
    private static final Logger log = LogManager.getLogger(RoutingDashboardServer.class);

    private final Set<WsContext> sessions = ConcurrentHashMap.newKeySet();
    private Javalin app;

    private Supplier<String> snapshotSupplier = null;

    public void setSnapshotSupplier(Supplier<String> supplier) {
        this.snapshotSupplier = supplier;
    }

    /**
     * Starts the server.
     *
     * @param port The port to listen on; 0 picks a free one (see {@link #port()}).
     */
    public void start(int port) {
        log.info("Starting routing dashboard on port {}", port);

        app = Javalin.create(config -> {
        }).start(port);

        app.get("/api/tables", ctx -> {
            if (snapshotSupplier != null) {
                ctx.contentType("application/json");
                ctx.result(snapshotSupplier.get());
            } else {
                ctx.status(503).result("{\"error\":\"Snapshot supplier not configured\"}");
            }
        });

        app.ws("/ws/tables", ws -> {
            ws.onConnect(ctx -> {
                log.info("WebSocket client connected: {}", ctx.getSessionId());
                sessions.add(ctx);
                if (snapshotSupplier != null && ctx.session.isOpen())
                    ctx.send(snapshotSupplier.get());
            });
            ws.onClose(ctx -> {
                log.info("WebSocket client disconnected: {}", ctx.getSessionId());
                sessions.remove(ctx);
            });
            ws.onError(ctx -> {
                log.error("WebSocket client error: {}", ctx.getSessionId(), ctx.error());
                sessions.remove(ctx);
            });
        });
    }

    /**
     * Sends a JSON payload to every connected WebSocket client.
     */
    public void broadcast(String jsonPayload) {
        if (sessions.isEmpty())
            return;

        for (WsContext ctx : sessions) {
            if (ctx.session.isOpen())
                ctx.send(jsonPayload);
        }
    }

    /** Actual port once started, -1 before. */
    public int port() {
        return app == null ? -1 : app.port();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            sessions.clear();
        }
    }
}
