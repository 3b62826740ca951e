package com.biomech.cfpg.engine;

import com.biomech.cfpg.graph.DirectedGraph;
import com.biomech.cfpg.graph.LeveledNode;
import com.biomech.cfpg.graph.SplitNode;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class CfpgTest {

    @Test
    public void testNodeSplitting() {
        Cfpg cfpg = Cfpg.fromGraph(GraphFixtures.twoWayCycle(), "A", "E", 4);

        assertEquals(8, cfpg.graph().nodeCount());
        assertEquals(8, cfpg.graph().edgeCount());
        assertEquals(2, cfpg.graph().nodes(n -> n.node().equals(LeveledNode.of(2, "D"))).size());
        assertEquals(2, cfpg.countPaths());
        assertEquals(Set.of(List.of("A", "B", "D", "C", "E"), List.of("A", "C", "D", "B", "E")),
                new HashSet<>(cfpg.enumeratePaths()));
    }

    @Test
    public void testEndpoints() {
        Cfpg cfpg = Cfpg.fromGraph(GraphFixtures.twoWayCycle(), "A", "E", 4);
        assertEquals(LeveledNode.of(0, "A"), cfpg.source().node());
        assertEquals(LeveledNode.of(4, "E"), cfpg.target().node());
        assertEquals(4, cfpg.length());
        assertTrue(cfpg.graph().predecessors(cfpg.source()).isEmpty());
        assertTrue(cfpg.graph().successors(cfpg.target()).isEmpty());
    }

    @Test
    public void testWeightedSampling() {
        DirectedGraph g = DirectedGraph.builder()
                .addEdge("A", "B", 0, 3.0)
                .addEdge("A", "C")
                .addEdge("C", "D")
                .addEdge("B", "D")
                .addEdge("D", "B")
                .addEdge("D", "C")
                .addEdge("B", "E")
                .addEdge("C", "E")
                .build();
        Cfpg cfpg = Cfpg.fromGraph(g, "A", "E", 4);
        List<List<String>> samples = cfpg.samplePaths(1000, new Random(1));
        assertEquals(1000, samples.size());
        long viaB = samples.stream().filter(p -> p.equals(List.of("A", "B", "D", "C", "E"))).count();
        assertEquals(0.75, viaB / 1000.0, 0.04);
    }

    @Test
    public void testSharedTarget() {
        Cfpg cfpg = Cfpg.fromGraph(GraphFixtures.diamond(), "A", "D", 2);
        assertEquals(2, cfpg.countPaths());
        assertEquals(List.of(List.of("A", "B", "D"), List.of("A", "C", "D")), cfpg.enumeratePaths());
    }

    @Test
    public void testCycleThroughSource() {
        Cfpg cfpg = Cfpg.fromGraph(GraphFixtures.cycleThroughSource(), "A", "D", 3);
        assertEquals(List.of(List.of("A", "B", "C", "D")), cfpg.enumeratePaths());
        for (List<String> p : cfpg.samplePaths(50, new Random(2)))
            assertEquals(List.of("A", "B", "C", "D"), p);
    }

    @Test
    public void testDeterministicConstruction() {
        Cfpg first = Cfpg.fromGraph(GraphFixtures.twoWayCycle(), "A", "E", 4);
        Cfpg second = Cfpg.fromGraph(GraphFixtures.twoWayCycle(), "A", "E", 4);
        assertEquals(first.graph(), second.graph());
        assertEquals(first.samplePaths(30, new Random(9)), second.samplePaths(30, new Random(9)));
    }

    @Test
    public void testUniformPathDistribution() {
        DirectedGraph g = GraphFixtures.graph("A>B", "A>C", "B>X", "B>Y", "C>Z", "X>T", "Y>T", "Z>T");
        Cfpg cfpg = Cfpg.fromGraph(g, "A", "T", 3);
        List<String> viaZ = List.of("A", "C", "Z", "T");

        long defaultViaZ = cfpg.samplePaths(4000, new Random(3)).stream().filter(viaZ::equals).count();
        assertEquals(0.5, defaultViaZ / 4000.0, 0.04);

        Cfpg uniform = cfpg.withUniformPathDistribution();
        assertEquals(cfpg.countPaths(), uniform.countPaths());
        Map<List<String>, Integer> hits = new HashMap<>();
        for (List<String> p : uniform.samplePaths(9000, new Random(4)))
            hits.merge(p, 1, Integer::sum);
        assertEquals(3, hits.size());
        for (int n : hits.values())
            assertEquals(3000, n, 250);
    }

    @Test
    public void testSignedParallelEdgesYieldOnePath() {
        // A-B-C is reachable at polarity 0 through ++ and through --
        DirectedGraph g = DirectedGraph.builder()
                .addEdge("A", "B", 0).addEdge("A", "B", 1)
                .addEdge("B", "C", 0).addEdge("B", "C", 1)
                .addEdge("A", "D", 0).addEdge("D", "C", 0)
                .build();
        PathsGraph pg = PathsGraph.fromGraph(g, "A", "C", 2, null, true, 0);
        PreCfpg pre = PreCfpg.fromPathsGraph(pg);
        Cfpg cfpg = Cfpg.fromPreCfpg(pre);
        Set<List<String>> expected = Set.of(List.of("A", "B", "C"), List.of("A", "D", "C"));

        assertTrue(cfpg.signed());
        assertEquals(2, cfpg.enumeratePaths().size());
        assertEquals(expected, new HashSet<>(cfpg.enumeratePaths()));
        assertEquals(2, cfpg.countPaths());
        assertEquals(2, pre.enumeratePaths().size());
        assertEquals(2, pre.countPaths());
        for (List<String> p : cfpg.samplePaths(50, new Random(3)))
            assertTrue(expected.contains(p));

        Cfpg uniform = cfpg.withUniformPathDistribution();
        assertTrue(uniform.signed());
        assertEquals(2, uniform.countPaths());
    }

    @Test
    public void testZeroLength() {
        Cfpg cfpg = Cfpg.fromGraph(GraphFixtures.diamond(), "A", "A", 0);
        assertFalse(cfpg.isEmpty());
        assertEquals(1, cfpg.countPaths());
        assertEquals(List.of(List.of("A")), cfpg.enumeratePaths());
        assertEquals(List.of(List.of("A"), List.of("A")), cfpg.samplePaths(2, new Random(1)));
    }

    @Test
    public void testUnreachable() {
        Cfpg cfpg = Cfpg.fromGraph(GraphFixtures.diamond(), "D", "A", 2);
        assertTrue(cfpg.isEmpty());
        assertEquals(0, cfpg.countPaths());
        assertTrue(cfpg.enumeratePaths().isEmpty());
        assertTrue(cfpg.samplePaths(3, new Random(1)).isEmpty());
        assertSame(cfpg, cfpg.withUniformPathDistribution());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeSampleCount() {
        Cfpg.fromGraph(GraphFixtures.diamond(), "A", "D", 2).samplePaths(-1, new Random(1));
    }

    @Test
    public void testCopiesAreKeyedByReachableAnchors() {
        Cfpg cfpg = Cfpg.fromGraph(GraphFixtures.twoWayCycle(), "A", "E", 4);
        LeveledNode b1 = LeveledNode.of(1, "B"), c1 = LeveledNode.of(1, "C");
        for (SplitNode d : cfpg.graph().nodes(n -> n.name().equals("D"))) {
            String next = cfpg.graph().successors(d).first().name();
            if (next.equals("C")) {
                assertTrue(d.tags().contains(b1));
                assertFalse(d.tags().contains(c1));
            } else {
                assertTrue(d.tags().contains(c1));
                assertFalse(d.tags().contains(b1));
            }
        }
    }
}
