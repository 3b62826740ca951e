package com.biomech.cfpg.io;

import org.junit.Test;

import static org.junit.Assert.*;

public class PathQueryOptionsTest {

    @Test
    public void testDefaults() {
        PathQueryOptions o = PathQueryOptions.defaults();
        assertFalse(o.isSigned());
        assertEquals(0, o.getTargetPolarity());
        assertEquals(6, o.getMaxDepth());
        assertEquals(1000, o.getNumSamples());
        assertEquals(50, o.getMaxRounds());
        assertTrue(o.isCycleFree());
        assertNull(o.getSeed());
    }

    @Test
    public void testLoadFixture() throws Exception {
        PathQueryOptions o = PathQueryOptions.load(GraphLoaderTest.resource("options.json"));
        assertTrue(o.isSigned());
        assertEquals(1, o.getTargetPolarity());
        assertEquals(4, o.getMaxDepth());
        assertEquals(25, o.getNumSamples());
        assertEquals(Long.valueOf(7), o.getSeed());
        // unspecified keys keep their defaults
        assertEquals(50, o.getMaxRounds());
        assertTrue(o.isCycleFree());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadPolarity() throws Exception {
        PathQueryOptions.parse("{\"targetPolarity\": 2}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadRoundCap() throws Exception {
        PathQueryOptions.parse("{\"maxRounds\": 0}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDepth() {
        PathQueryOptions o = PathQueryOptions.defaults();
        o.setMaxDepth(-1);
        o.validate();
    }
}
