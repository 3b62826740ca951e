package com.biomech.cfpg.util;

import com.biomech.cfpg.api.BuildListener;
import com.biomech.cfpg.engine.PathsGraph;
import com.biomech.cfpg.engine.PreCfpg;
import com.biomech.cfpg.graph.DirectedGraph;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class BuildListenersTest {

    /** Two-round build: S -> A -> B -> C -> T with a loop through X. */
    private static PathsGraph loopedLadder() {
        DirectedGraph g = DirectedGraph.builder()
                .addEdge("S", "A").addEdge("A", "B").addEdge("B", "C").addEdge("C", "T")
                .addEdge("S", "X").addEdge("X", "Y").addEdge("Y", "X").addEdge("X", "T")
                .build();
        return PathsGraph.fromGraph(g, "S", "T", 4);
    }

    private static final class Recorder implements BuildListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onRoundStart(int round, int nodes, int edges) {
            events.add("start " + round);
        }

        @Override
        public void onRoundEnd(int round, int edges, boolean converged) {
            events.add("end " + round + (converged ? " converged" : ""));
        }
    }

    @Test
    public void testLoggingListenerCounters() {
        LoggingBuildListener logging = new LoggingBuildListener();
        PreCfpg.fromPathsGraph(loopedLadder(), 10, logging);
        PreCfpg.fromPathsGraph(loopedLadder(), 10, logging);

        assertEquals(2, logging.totalBuilds());
        assertEquals(4, logging.totalRounds());
        assertEquals(2, logging.lastRounds());
        assertEquals(2, logging.maxRounds());
        assertEquals(2.0, logging.avgRoundsPerBuild(), 0.0);
        assertTrue(logging.lastRoundNanos() >= 0);
    }

    @Test
    public void testCompositeFansOut() {
        CompositeBuildListener composite = new CompositeBuildListener();
        Recorder first = new Recorder();
        Recorder second = new Recorder();
        composite.addForComposite(first);
        composite.addForComposite(second);
        assertEquals(2, composite.size());

        PreCfpg.fromPathsGraph(loopedLadder(), 10, composite);

        List<String> expected = List.of("start 1", "end 1", "start 2", "end 2 converged");
        assertEquals(expected, first.events);
        assertEquals(expected, second.events);
    }

    @Test
    public void testNoListenersIsHarmless() {
        CompositeBuildListener composite = new CompositeBuildListener();
        assertEquals(0, composite.size());
        assertEquals(2, PreCfpg.fromPathsGraph(loopedLadder(), 10, composite).rounds());
    }
}
