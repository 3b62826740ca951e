package com.biomech.cfpg.io;

import com.biomech.cfpg.graph.DirectedGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads JSON graph definitions and compiles them into a {@link DirectedGraph}.
 *
 * Format:
 * <pre>
 * {"graph": {"name": "egfr",
 *            "edges": [{"source": "EGF", "target": "EGFR", "sign": 0, "weight": 2.0}]}}
 * </pre>
 */
@Log4j2
public final class GraphLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphLoader() {
        // Utility class
    }

    /** Parses a JSON file into a GraphDefinition. */
    public static GraphDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        }
    }

    public static GraphDefinition parse(InputStream in) throws IOException {
        return MAPPER.readValue(in, GraphDefinition.class);
    }

    public static GraphDefinition parse(String json) throws IOException {
        return MAPPER.readValue(json, GraphDefinition.class);
    }

    /** Parses and compiles in one step. */
    public static DirectedGraph load(Path path) throws IOException {
        return compile(parseFile(path));
    }

    /**
     * Compiles a definition into the engine's graph.
     *
     * @throws IllegalArgumentException if the graph key is missing or an edge
     *                                  lacks an endpoint or has a bad sign or
     *                                  weight
     */
    public static DirectedGraph compile(GraphDefinition def) {
        GraphDefinition.GraphInfo info = def.getGraph();
        if (info == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        DirectedGraph.Builder b = DirectedGraph.builder();
        if (info.getNodes() != null)
            for (String n : info.getNodes())
                b.addNode(n);
        int edges = 0;
        if (info.getEdges() != null) {
            for (GraphDefinition.EdgeDef e : info.getEdges()) {
                if (e.getSource() == null || e.getTarget() == null)
                    throw new IllegalArgumentException("Edge without source or target in graph " + info.getName());
                double w = e.getWeight() == null ? DirectedGraph.DEFAULT_WEIGHT : e.getWeight();
                b.addEdge(e.getSource(), e.getTarget(), e.getSign(), w);
                edges++;
            }
        }
        DirectedGraph g = b.build();
        log.info("Loaded graph '{}': {} nodes, {} edges ({} declared)", info.getName(), g.nodeCount(),
                g.edgeCount(), edges);
        return g;
    }
}
