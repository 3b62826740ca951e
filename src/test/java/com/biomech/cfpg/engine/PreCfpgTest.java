package com.biomech.cfpg.engine;

import com.biomech.cfpg.api.BuildListener;
import com.biomech.cfpg.graph.DirectedGraph;
import com.biomech.cfpg.graph.LeveledNode;
import com.biomech.cfpg.graph.TagSet;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.*;

public class PreCfpgTest {

    private static final LeveledNode A0 = LeveledNode.of(0, "A");
    private static final LeveledNode B1 = LeveledNode.of(1, "B");
    private static final LeveledNode C2 = LeveledNode.of(2, "C");
    private static final LeveledNode D3 = LeveledNode.of(3, "D");

    /** S -> A -> B -> C -> T plus a loop S -> X -> Y -> X -> T; needs a second round to confirm. */
    private static DirectedGraph loopedLadder() {
        return GraphFixtures.graph("S>A", "A>B", "B>C", "C>T", "S>X", "X>Y", "Y>X", "X>T");
    }

    private static PreCfpg build(DirectedGraph g, String s, String t, int length) {
        return PreCfpg.fromPathsGraph(PathsGraph.fromGraph(g, s, t, length));
    }

    private static Set<LeveledNode> members(TagSet t) {
        return new HashSet<>(t.members());
    }

    @Test
    public void testFullyConnectedTriangle() {
        DirectedGraph g = GraphFixtures.graph("0>1", "1>0", "1>2", "2>1", "0>2", "2>0");
        PreCfpg pre = build(g, "0", "2", 2);

        LeveledNode n0 = LeveledNode.of(0, "0"), n1 = LeveledNode.of(1, "1"), n2 = LeveledNode.of(2, "2");
        assertEquals(Set.of(n0, n1, n2), pre.graph().nodes());
        assertTrue(pre.graph().containsEdge(n0, n1));
        assertTrue(pre.graph().containsEdge(n1, n2));
        assertEquals(2, pre.graph().edgeCount());

        assertEquals(Set.of(n0), members(pre.tags(n0)));
        assertEquals(Set.of(n0, n1), members(pre.tags(n1)));
        assertEquals(Set.of(n0, n1, n2), members(pre.tags(n2)));
        assertEquals(1, pre.rounds());
    }

    @Test
    public void testOnlyWalkRevisitsSource() {
        DirectedGraph g = GraphFixtures.graph("A>B", "B>A", "B>D", "A>D");
        PreCfpg pre = build(g, "A", "D", 3);
        assertTrue(pre.isEmpty());
        assertEquals(0, pre.countPaths());
        assertTrue(pre.samplePaths(5, new Random(1)).isEmpty());
    }

    @Test
    public void testCycleThroughSourceRemoved() {
        PreCfpg pre = build(GraphFixtures.cycleThroughSource(), "A", "D", 3);

        assertEquals(Set.of(A0, B1, C2, D3), pre.graph().nodes());
        assertEquals(3, pre.graph().edgeCount());
        assertEquals(Set.of(A0), members(pre.tags(A0)));
        assertEquals(Set.of(A0, B1), members(pre.tags(B1)));
        assertEquals(Set.of(A0, B1, C2), members(pre.tags(C2)));
        assertEquals(Set.of(A0, B1, C2, D3), members(pre.tags(D3)));
        assertEquals(List.of(List.of("A", "B", "C", "D")), pre.enumeratePaths());
    }

    @Test
    public void testInteriorLoopNeedsTwoRounds() {
        List<Integer> starts = new ArrayList<>();
        int[] levels = new int[1];
        boolean[] lastConverged = new boolean[1];
        BuildListener listener = new BuildListener() {
            @Override
            public void onRoundStart(int round, int nodes, int edges) {
                starts.add(round);
            }

            @Override
            public void onLevelProcessed(int round, int level, int nodes, int edges) {
                levels[0]++;
            }

            @Override
            public void onRoundEnd(int round, int edges, boolean converged) {
                lastConverged[0] = converged;
            }
        };
        PreCfpg pre = PreCfpg.fromPathsGraph(PathsGraph.fromGraph(loopedLadder(), "S", "T", 4), 10, listener);

        assertEquals(2, pre.rounds());
        assertEquals(List.of(1, 2), starts);
        assertEquals(8, levels[0]);
        assertTrue(lastConverged[0]);
        assertEquals(List.of(List.of("S", "A", "B", "C", "T")), pre.enumeratePaths());
    }

    @Test
    public void testRoundCap() {
        PathsGraph pg = PathsGraph.fromGraph(loopedLadder(), "S", "T", 4);
        try {
            PreCfpg.fromPathsGraph(pg, 1, BuildListener.NONE);
            fail("Expected ConvergenceException");
        } catch (ConvergenceException e) {
            assertEquals(1, e.rounds());
        }
    }

    @Test
    public void testSamplingMatchesSimplePaths() {
        DirectedGraph g = GraphFixtures.graph("0>1", "0>3", "0>4", "0>5", "1>4", "2>4", "2>5", "3>0", "3>2",
                "3>4", "3>5", "4>2", "4>3", "4>5");
        PreCfpg pre = build(g, "0", "5", 5);
        Set<List<String>> expected = GraphFixtures.simplePaths(g, "0", "5", 5);
        assertFalse(expected.isEmpty());

        List<List<String>> enumerated = pre.enumeratePaths();
        assertEquals(expected, new HashSet<>(enumerated));
        assertEquals(expected.size(), enumerated.size());
        assertEquals(expected.size(), pre.countPaths());

        Set<List<String>> sampled = new HashSet<>(pre.samplePaths(1000, new Random(5)));
        assertEquals(expected, sampled);
    }

    @Test
    public void testZeroLength() {
        PreCfpg pre = build(GraphFixtures.diamond(), "A", "A", 0);
        assertFalse(pre.isEmpty());
        assertEquals(List.of(List.of("A")), pre.enumeratePaths());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTagsOfUnknownNode() {
        build(GraphFixtures.diamond(), "A", "D", 2).tags(LeveledNode.of(1, "Z"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroRoundCapRejected() {
        PreCfpg.fromPathsGraph(PathsGraph.fromGraph(GraphFixtures.diamond(), "A", "D", 2), 0, BuildListener.NONE);
    }
}
