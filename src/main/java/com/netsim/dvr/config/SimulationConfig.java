package com.netsim.dvr.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netsim.dvr.model.EndpointAllocator;
import com.netsim.dvr.model.MailboxPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Data;

/**
 * Runtime settings of a simulation.
 *
 * Defaults match {@code simulation.json} on the classpath. Any subset of keys
 * may be given in a JSON file; unknown keys are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SimulationConfig {
    public static final String DEFAULT_RESOURCE = "simulation.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Host every node listens on. */
    private String host = "localhost";
    /** First node's port; 0 picks free ephemeral ports instead. */
    private int basePort = 15000;
    private int portStride = 5;

    /** Accept timeout of a node listener; bounds how long shutdown takes. */
    private long pollIntervalMillis = 1000;
    private int connectTimeoutMillis = 1000;
    private int readTimeoutMillis = 2000;
    /** How long start-up waits for all listeners to be bound. */
    private long readyTimeoutMillis = 5000;

    /** Round cap is nodeCount * roundsPerNode unless roundLimit is positive. */
    private int roundsPerNode = 50;
    private int roundLimit = 0;

    private MailboxPolicy mailboxPolicy = MailboxPolicy.DRAIN;

    /** Port of the web dashboard; 0 disables it. */
    private int dashboardPort = 0;

    public static SimulationConfig defaults() {
        try (InputStream in = SimulationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null)
                return new SimulationConfig();
            return MAPPER.readValue(in, SimulationConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static SimulationConfig load(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    public static SimulationConfig fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, SimulationConfig.class).validate();
    }

    /**
     * Effective round cap for a graph of {@code nodeCount} nodes.
     */
    public int maxRounds(int nodeCount) {
        if (roundLimit > 0)
            return roundLimit;
        return Math.max(1, nodeCount * roundsPerNode);
    }

    public EndpointAllocator endpointAllocator() {
        return basePort == 0
                ? EndpointAllocator.ephemeral(host)
                : EndpointAllocator.sequential(host, basePort, portStride);
    }

    /**
     * @throws IllegalArgumentException on out-of-range values.
     */
    public SimulationConfig validate() {
        require(host != null && !host.isBlank(), "host is required");
        require(basePort >= 0 && basePort <= 65535, "basePort out of range: " + basePort);
        require(portStride > 0, "portStride must be positive");
        require(pollIntervalMillis > 0, "pollIntervalMillis must be positive");
        require(connectTimeoutMillis > 0, "connectTimeoutMillis must be positive");
        require(readTimeoutMillis > 0, "readTimeoutMillis must be positive");
        require(readyTimeoutMillis > 0, "readyTimeoutMillis must be positive");
        require(roundsPerNode > 0, "roundsPerNode must be positive");
        require(roundLimit >= 0, "roundLimit must not be negative");
        require(mailboxPolicy != null, "mailboxPolicy is required");
        require(dashboardPort >= 0 && dashboardPort <= 65535, "dashboardPort out of range: " + dashboardPort);
        return this;
    }

    private static void require(boolean ok, String message) {
        if (!ok)
            throw new IllegalArgumentException(message);
    }
}
