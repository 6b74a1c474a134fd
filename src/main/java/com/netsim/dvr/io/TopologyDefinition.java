package com.netsim.dvr.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a network topology: an ordered list of links.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TopologyDefinition {
    private List<LinkDef> links = new ArrayList<>();

    public TopologyDefinition addLink(String source, String destination, double weight) {
        links.add(new LinkDef(source, destination, weight));
        return this;
    }

    /** One bidirectional link as read from the input. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LinkDef {
        private String source, destination;
        private double weight;
    }
}
