package com.netsim.dvr.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netsim.dvr.api.RoutingTable;
import org.junit.After;
import org.junit.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class RoutingDashboardServerTest {

    private final RoutingDashboardServer server = new RoutingDashboardServer();

    @After
    public void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path)).GET().build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testTablesEndpointServesLatestTables() throws Exception {
        DashboardListener listener = new DashboardListener(server, new TableSnapshotSerializer());
        server.start(0);
        assertTrue(server.port() > 0);

        listener.onInitialTable("1", RoutingTable.of("1", Map.of("3", 10.0)));
        listener.onTableChanged(1, "1", RoutingTable.of("1", Map.of("3", 4.0)));

        HttpResponse<String> response = get("/api/tables");
        assertEquals(200, response.statusCode());
        JsonNode root = new ObjectMapper().readTree(response.body());
        assertEquals(4.0, root.at("/tables/1/3").asDouble(), 0.0);
        assertEquals(4.0, listener.latest("1").cost("3"), 0.0);
    }

    @Test
    public void testWebSocketClientReceivesSnapshotThenEvents() throws Exception {
        DashboardListener listener = new DashboardListener(server, new TableSnapshotSerializer());
        listener.onInitialTable("1", RoutingTable.of("1", Map.of("3", 10.0)));
        server.start(0);

        BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        WebSocket ws = HttpClient.newHttpClient().newWebSocketBuilder()
                .buildAsync(URI.create("ws://localhost:" + server.port() + "/ws/tables"), new WebSocket.Listener() {
                    @Override
                    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                        messages.add(data.toString());
                        webSocket.request(1);
                        return null;
                    }
                })
                .get(5, TimeUnit.SECONDS);
        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode snapshot = mapper.readTree(messages.poll(5, TimeUnit.SECONDS));
            assertEquals("snapshot", snapshot.get("type").asText());
            assertEquals(10.0, snapshot.at("/tables/1/3").asDouble(), 0.0);
            assertEquals(1, server.sessionCount());

            listener.onTableChanged(1, "1", RoutingTable.of("1", Map.of("3", 4.0)));
            JsonNode changed = mapper.readTree(messages.poll(5, TimeUnit.SECONDS));
            assertEquals("tableChanged", changed.get("type").asText());
            assertEquals(4.0, changed.at("/table/3").asDouble(), 0.0);
        } finally {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testTablesEndpointWithoutSupplier() throws Exception {
        server.start(0);
        assertEquals(503, get("/api/tables").statusCode());
        assertEquals(0, server.sessionCount());
    }
}
