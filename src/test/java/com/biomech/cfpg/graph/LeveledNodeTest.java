package com.biomech.cfpg.graph;

import org.junit.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.Assert.*;

public class LeveledNodeTest {

    @Test
    public void testOrderByDepthThenNameThenPolarity() {
        TreeSet<LeveledNode> nodes = new TreeSet<>(List.of(
                new LeveledNode(1, "B", 1),
                LeveledNode.of(2, "A"),
                LeveledNode.of(1, "B"),
                LeveledNode.of(1, "A")));
        assertEquals(List.of(LeveledNode.of(1, "A"), LeveledNode.of(1, "B"), new LeveledNode(1, "B", 1),
                LeveledNode.of(2, "A")), List.copyOf(nodes));
    }

    @Test
    public void testSameName() {
        assertTrue(LeveledNode.of(0, "A").sameName(new LeveledNode(3, "A", 1)));
        assertFalse(LeveledNode.of(0, "A").sameName(LeveledNode.of(0, "B")));
    }

    @Test
    public void testToString() {
        assertEquals("(2, X)", LeveledNode.of(2, "X").toString());
        assertEquals("(2, X, -)", new LeveledNode(2, "X", 1).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadPolarity() {
        new LeveledNode(0, "A", 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDepth() {
        LeveledNode.of(-1, "A");
    }
}
