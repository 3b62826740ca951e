package com.biomech.cfpg.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of an influence graph definition.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information and contents of the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name, description;
        /** Optional isolated nodes; nodes named by edges need not be listed. */
        private List<String> nodes;
        private List<EdgeDef> edges;
    }

    /** A single directed edge. Sign 1 is inhibiting; weight defaults to 1. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeDef {
        private String source, target;
        private int sign;
        private Double weight;
    }
}
