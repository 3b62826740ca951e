package com.biomech.cfpg.api;

import java.util.List;
import java.util.Random;

/**
 * A finite set of source-to-target paths that can be sampled, enumerated and
 * counted.
 *
 * Every stage of the pipeline that can yield paths implements this interface:
 * the paths graph (walks, names may repeat), the pre-CFPG (memory-based
 * sampling), the CFPG, the combined CFPG and the path tree. Paths are lists of
 * vertex names from source to target.
 *
 * An empty set is a normal value: sampling it returns an empty list and counting
 * it returns zero.
 */
public interface PathSet {

    /** True if there is no path at all. */
    boolean isEmpty();

    /**
     * Draws paths with replacement.
     *
     * @param numSamples number of paths to draw
     * @param random     the randomness source; pass a seeded instance for
     *                   reproducible results
     * @return exactly {@code numSamples} paths, or an empty list if the set is
     *         empty
     */
    List<List<String>> samplePaths(int numSamples, Random random);

    /** Returns every distinct path. Exponential in the worst case. */
    List<List<String>> enumeratePaths();

    /** Number of paths, computed without materializing them where possible. */
    long countPaths();
}
