package com.biomech.cfpg.io;

import com.biomech.cfpg.graph.DirectedGraph;
import lombok.extern.log4j.Log4j2;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a signed graph in simple interaction format: one
 * {@code source polarity target} triple per line, whitespace separated, with
 * polarity 0 (activating) or 1 (inhibiting). Blank lines and lines starting
 * with {@code #} are skipped, and so are self-loops.
 */
@Log4j2
public final class SifLoader {
    private SifLoader() {
        // Utility class
    }

    public static DirectedGraph load(Path path) throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(r);
        }
    }

    /**
     * @throws IllegalArgumentException on a line that is not a valid triple
     */
    public static DirectedGraph load(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        DirectedGraph.Builder b = DirectedGraph.builder();
        int lineNo = 0, selfLoops = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#"))
                continue;
            String[] parts = trimmed.split("\\s+");
            if (parts.length != 3)
                throw new IllegalArgumentException("Line " + lineNo + ": expected 'source polarity target': " + line);
            int sign;
            try {
                sign = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Line " + lineNo + ": polarity is not a number: " + parts[1], e);
            }
            if (sign != 0 && sign != 1)
                throw new IllegalArgumentException("Line " + lineNo + ": polarity must be 0 or 1: " + sign);
            if (parts[0].equals(parts[2])) {
                selfLoops++;
                continue;
            }
            b.addEdge(parts[0], parts[2], sign);
        }
        DirectedGraph g = b.build();
        log.info("Loaded SIF graph: {} nodes, {} edges, {} self-loops dropped", g.nodeCount(), g.edgeCount(),
                selfLoops);
        return g;
    }
}
