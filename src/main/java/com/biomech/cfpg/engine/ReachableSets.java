package com.biomech.cfpg.engine;

import com.biomech.cfpg.graph.DirectedGraph;
import com.biomech.cfpg.graph.LeveledNode;
import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * Forward and backward reach sets of a (source, target) pair.
 *
 * {@code forward(i)} holds every node reachable from the source by a walk of
 * exactly {@code i} edges; {@code backward(i)} holds every node from which the
 * target is reachable by exactly {@code i} edges. In signed mode the polarity
 * of a leveled node is the parity of inhibiting edges along the walk.
 *
 * When the target is never reached from the source (or vice versa) within the
 * depth bound, both maps are empty. The instance is immutable and may be
 * cached across queries on the same graph.
 */
@Log4j2
public final class ReachableSets {
    private final List<Set<LeveledNode>> forward;
    private final List<Set<LeveledNode>> backward;
    private final boolean signed;
    private final int bound;

    private ReachableSets(List<Set<LeveledNode>> forward, List<Set<LeveledNode>> backward, boolean signed,
            int bound) {
        this.forward = forward;
        this.backward = backward;
        this.signed = signed;
        this.bound = bound;
    }

    private static ReachableSets empty(boolean signed, int bound) {
        return new ReachableSets(Collections.emptyList(), Collections.emptyList(), signed, bound);
    }

    /**
     * Runs both breadth-first sweeps.
     *
     * @param maxDepth deepest level to compute, inclusive
     * @throws IllegalArgumentException if source or target is not in the graph,
     *                                  or maxDepth is negative
     */
    public static ReachableSets compute(DirectedGraph graph, String source, String target, int maxDepth,
            boolean signed) {
        if (maxDepth < 0)
            throw new IllegalArgumentException("Negative max depth: " + maxDepth);
        int s = graph.index(source);
        int t = graph.index(target);

        List<Set<LeveledNode>> fwd = sweep(graph, s, maxDepth, signed, true);
        List<Set<LeveledNode>> bwd = sweep(graph, t, maxDepth, signed, false);

        if (!visits(fwd, target) || !visits(bwd, source)) {
            log.debug("{} -> {} not connected within depth {}", source, target, maxDepth);
            return empty(signed, maxDepth);
        }
        log.debug("Reach sets {} -> {}: forward depth {}, backward depth {}", source, target, fwd.size() - 1,
                bwd.size() - 1);
        return new ReachableSets(fwd, bwd, signed, maxDepth);
    }

    private static List<Set<LeveledNode>> sweep(DirectedGraph g, int start, int maxDepth, boolean signed,
            boolean forward) {
        List<Set<LeveledNode>> levels = new ArrayList<>();
        // Frontier entries are (vertex index, polarity) pairs packed as 2v + p
        Set<Integer> frontier = new TreeSet<>();
        frontier.add(start << 1);
        levels.add(toLevel(g, 0, frontier));
        for (int depth = 1; depth <= maxDepth; depth++) {
            Set<Integer> next = new TreeSet<>();
            for (int packed : frontier) {
                int v = packed >> 1, pol = packed & 1;
                int begin = forward ? g.outStart(v) : g.inStart(v);
                int end = forward ? g.outEnd(v) : g.inEnd(v);
                for (int e = begin; e < end; e++) {
                    int u = forward ? g.targetAt(e) : g.sourceAt(e);
                    int sign = forward ? g.outSignAt(e) : g.inSignAt(e);
                    int p = signed ? (pol + sign) & 1 : 0;
                    next.add((u << 1) | p);
                }
            }
            if (next.isEmpty())
                break;
            levels.add(toLevel(g, depth, next));
            frontier = next;
        }
        return Collections.unmodifiableList(levels);
    }

    private static Set<LeveledNode> toLevel(DirectedGraph g, int depth, Set<Integer> packed) {
        Set<LeveledNode> level = new TreeSet<>();
        for (int p : packed)
            level.add(new LeveledNode(depth, g.name(p >> 1), p & 1));
        return Collections.unmodifiableSet(level);
    }

    private static boolean visits(List<Set<LeveledNode>> levels, String name) {
        for (Set<LeveledNode> level : levels)
            for (LeveledNode n : level)
                if (n.name().equals(name))
                    return true;
        return false;
    }

    public boolean isEmpty() {
        return forward.isEmpty();
    }

    public boolean signed() {
        return signed;
    }

    /** The depth bound the sweeps were run with. */
    public int bound() {
        return bound;
    }

    /**
     * Deepest level recorded in both directions, or -1 when empty. A sweep
     * stops early when a level comes out empty, so this can be below
     * {@link #bound()}; a length beyond it has no walks to find.
     */
    public int maxDepth() {
        if (isEmpty())
            return -1;
        return Math.min(forward.size(), backward.size()) - 1;
    }

    /** Nodes at distance {@code depth} from the source; empty beyond the recorded depth. */
    public Set<LeveledNode> forward(int depth) {
        return depth < forward.size() ? forward.get(depth) : Collections.emptySet();
    }

    /** Nodes at distance {@code depth} to the target; empty beyond the recorded depth. */
    public Set<LeveledNode> backward(int depth) {
        return depth < backward.size() ? backward.get(depth) : Collections.emptySet();
    }
}
