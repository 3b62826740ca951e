package com.biomech.cfpg.io;

import com.biomech.cfpg.graph.DirectedGraph;
import org.junit.Test;

import java.io.StringReader;

import static org.junit.Assert.*;

public class SifLoaderTest {

    @Test
    public void testLoadFixture() throws Exception {
        DirectedGraph g = SifLoader.load(GraphLoaderTest.resource("toy.sif"));

        assertEquals(4, g.nodeCount());
        assertEquals(5, g.edgeCount());
        assertFalse(g.hasEdge("C", "C"));
        assertTrue(g.hasEdge("B", "D"));
        assertEquals(1, signOf(g, "B", "C"));
        assertEquals(0, signOf(g, "B", "D"));
        assertEquals(1, signOf(g, "A", "C"));
    }

    private static int signOf(DirectedGraph g, String from, String to) {
        int u = g.index(from);
        for (int e = g.outStart(u); e < g.outEnd(u); e++)
            if (g.name(g.targetAt(e)).equals(to))
                return g.outSignAt(e);
        throw new AssertionError("no edge " + from + " -> " + to);
    }

    @Test
    public void testTabsAndExtraSpaces() throws Exception {
        DirectedGraph g = SifLoader.load(new StringReader("  X\t1   Y \n"));
        assertEquals(1, g.edgeCount());
        assertEquals(1, g.outSignAt(g.outStart(g.index("X"))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooFewColumns() throws Exception {
        SifLoader.load(new StringReader("A B\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonNumericPolarity() throws Exception {
        SifLoader.load(new StringReader("A x B\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPolarityOutOfRange() throws Exception {
        SifLoader.load(new StringReader("A 2 B\n"));
    }
}
