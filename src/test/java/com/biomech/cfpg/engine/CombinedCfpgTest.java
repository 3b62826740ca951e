package com.biomech.cfpg.engine;

import com.biomech.cfpg.graph.DirectedGraph;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class CombinedCfpgTest {

    private static List<Cfpg> upTo(DirectedGraph g, String s, String t, int maxDepth) {
        List<Cfpg> out = new ArrayList<>();
        for (int len = 1; len <= maxDepth; len++)
            out.add(Cfpg.fromGraph(g, s, t, len));
        return out;
    }

    @Test
    public void testCombineLengths() {
        DirectedGraph g = GraphFixtures.graph("S>A", "S>T", "A>T", "A>S");
        CombinedCfpg combined = new CombinedCfpg(upTo(g, "S", "T", 4));

        assertFalse(combined.isEmpty());
        assertEquals(2, combined.components().size());
        assertEquals(2, combined.countPaths());
        assertEquals(Set.of(List.of("S", "T"), List.of("S", "A", "T")),
                new HashSet<>(combined.enumeratePaths()));

        int direct = 0;
        for (List<String> p : combined.samplePaths(2000, new Random(8))) {
            assertTrue(p.equals(List.of("S", "T")) || p.equals(List.of("S", "A", "T")));
            if (p.size() == 2)
                direct++;
        }
        assertEquals(0.5, direct / 2000.0, 0.05);
    }

    @Test
    public void testSingleSharedSource() {
        DirectedGraph g = GraphFixtures.graph("S>A", "S>T", "A>T", "A>S");
        CombinedCfpg combined = new CombinedCfpg(upTo(g, "S", "T", 2));
        assertEquals(1, combined.graph().nodes(n -> n.name().equals("S")).size());
        assertEquals(2, combined.graph().nodes(n -> n.name().equals("T")).size());
    }

    @Test
    public void testSignedComponentsCountNameSequencesOnce() {
        DirectedGraph g = DirectedGraph.builder()
                .addEdge("S", "T", 0).addEdge("S", "T", 1)
                .addEdge("S", "A", 0).addEdge("S", "A", 1)
                .addEdge("A", "T", 0).addEdge("A", "T", 1)
                .build();
        List<Cfpg> cfpgs = new ArrayList<>();
        for (int len = 1; len <= 2; len++)
            cfpgs.add(Cfpg.fromPreCfpg(PreCfpg.fromPathsGraph(PathsGraph.fromGraph(g, "S", "T", len, null, true, 0))));
        CombinedCfpg combined = new CombinedCfpg(cfpgs);

        assertEquals(2, combined.countPaths());
        assertEquals(2, combined.enumeratePaths().size());
        assertEquals(Set.of(List.of("S", "T"), List.of("S", "A", "T")), new HashSet<>(combined.enumeratePaths()));
    }

    @Test
    public void testAllEmpty() {
        DirectedGraph g = GraphFixtures.graph("A>B", "C>D");
        CombinedCfpg combined = new CombinedCfpg(upTo(g, "A", "D", 3));
        assertTrue(combined.isEmpty());
        assertEquals(0, combined.countPaths());
        assertTrue(combined.enumeratePaths().isEmpty());
        assertTrue(combined.samplePaths(4, new Random(1)).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateLengths() {
        DirectedGraph g = GraphFixtures.diamond();
        new CombinedCfpg(List.of(Cfpg.fromGraph(g, "A", "D", 2), Cfpg.fromGraph(g, "A", "D", 2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedEndpoints() {
        DirectedGraph g = GraphFixtures.diamond();
        new CombinedCfpg(List.of(Cfpg.fromGraph(g, "A", "D", 2), Cfpg.fromGraph(g, "A", "B", 1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroLength() {
        new CombinedCfpg(List.of(Cfpg.fromGraph(GraphFixtures.diamond(), "A", "A", 0)));
    }
}
