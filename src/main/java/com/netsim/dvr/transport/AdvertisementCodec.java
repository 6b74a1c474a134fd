package com.netsim.dvr.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.netsim.dvr.api.RoutingTableEntry;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire format of an advertisement.
 *
 * One message per connection, UTF-8 JSON, no framing or version field:
 *
 * <pre>
 * [["1","1",0.0],["1","2",3.0],["1","3",Infinity]]
 * </pre>
 *
 * Unreachable costs are written as the bare {@code Infinity} token. When
 * reading, a quoted {@code "Infinity"} is accepted too, and node ids may be
 * JSON numbers.
 */
public final class AdvertisementCodec {
    /** Fixed reply sent by a listener after it stored an advertisement. */
    public static final String ACK = "Data received";

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .build();

    public byte[] encode(List<RoutingTableEntry> rows) {
        ArrayNode root = mapper.createArrayNode();
        for (RoutingTableEntry row : rows)
            root.addArray().add(row.source()).add(row.destination()).add(row.cost());
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode advertisement", e);
        }
    }

    public List<RoutingTableEntry> decode(byte[] payload) throws MalformedAdvertisementException {
        JsonNode root;
        try {
            root = mapper.readTree(new String(payload, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new MalformedAdvertisementException("Payload is not valid JSON", e);
        }
        if (root == null || !root.isArray())
            throw new MalformedAdvertisementException("Payload is not a JSON array");

        List<RoutingTableEntry> rows = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode row = root.get(i);
            if (!row.isArray() || row.size() != 3)
                throw new MalformedAdvertisementException("Row " + i + " is not a [source, destination, cost] triple");
            String source = id(row.get(0), i);
            String destination = id(row.get(1), i);
            double cost = cost(row.get(2), i);
            try {
                rows.add(new RoutingTableEntry(source, destination, cost));
            } catch (IllegalArgumentException e) {
                throw new MalformedAdvertisementException("Row " + i + ": " + e.getMessage(), e);
            }
        }
        return rows;
    }

    private static String id(JsonNode node, int row) throws MalformedAdvertisementException {
        if (node.isTextual() || node.isIntegralNumber())
            return node.asText();
        throw new MalformedAdvertisementException("Row " + row + " has an invalid node id: " + node);
    }

    private static double cost(JsonNode node, int row) throws MalformedAdvertisementException {
        if (node.isNumber())
            return node.doubleValue();
        if (node.isTextual() && "Infinity".equals(node.asText()))
            return Double.POSITIVE_INFINITY;
        throw new MalformedAdvertisementException("Row " + row + " has an invalid cost: " + node);
    }
}
