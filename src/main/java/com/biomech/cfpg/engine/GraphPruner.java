package com.biomech.cfpg.engine;

import com.biomech.cfpg.graph.NodeGraph;

import java.util.*;

/**
 * Iterative dead-end removal shared by every stage.
 *
 * Pruning proceeds as follows:
 * 1. Remove the requested nodes.
 * 2. Every node left without incoming edges (except the source) or without
 * outgoing edges (except the target) is removed in turn.
 * 3. Repeat until nothing changes.
 *
 * The source is exempt only from the incoming-edge rule and the target only
 * from the outgoing-edge rule: a source that loses all its out-edges, or a
 * target that loses all its in-edges, is removed too. Callers detect a
 * disconnected result by checking that both endpoints are still present.
 * The input graph is never modified.
 */
public final class GraphPruner {
    private GraphPruner() {
        // Utility class
    }

    /**
     * Removes {@code toPrune} and cascades. Returns {@code graph} itself when
     * there is nothing to remove.
     */
    public static <N extends Comparable<N>> NodeGraph<N> prune(NodeGraph<N> graph, Collection<N> toPrune,
            N source, N target) {
        if (toPrune.isEmpty())
            return graph;
        NodeGraph.Builder<N> b = graph.toBuilder();
        for (N v : toPrune)
            b.removeNode(v);
        Deque<N> work = new ArrayDeque<>();
        for (N v : b.nodes())
            if (isDead(b, v, source, target))
                work.add(v);
        cascade(b, work, source, target);
        return b.build();
    }

    /** Removes every node that cannot lie on a source-to-target path, cascading. */
    public static <N extends Comparable<N>> NodeGraph<N> pruneDeadEnds(NodeGraph<N> graph, N source, N target) {
        List<N> dead = deadEnds(graph, source, target);
        return prune(graph, dead, source, target);
    }

    /** Nodes that currently have no successors (except target) or no predecessors (except source). */
    public static <N extends Comparable<N>> List<N> deadEnds(NodeGraph<N> graph, N source, N target) {
        return graph.nodes(v -> (!v.equals(target) && graph.outDegree(v) == 0)
                || (!v.equals(source) && graph.inDegree(v) == 0));
    }

    private static <N extends Comparable<N>> boolean isDead(NodeGraph.Builder<N> b, N v, N source, N target) {
        return (!v.equals(target) && b.outDegree(v) == 0) || (!v.equals(source) && b.inDegree(v) == 0);
    }

    private static <N extends Comparable<N>> void cascade(NodeGraph.Builder<N> b, Deque<N> work, N source,
            N target) {
        while (!work.isEmpty()) {
            N v = work.poll();
            if (!b.containsNode(v))
                continue;
            // Neighbours are the only nodes whose degree can drop
            List<N> touched = new ArrayList<>(b.predecessors(v));
            touched.addAll(b.successors(v));
            b.removeNode(v);
            for (N u : touched) {
                if (!b.containsNode(u))
                    continue;
                if (isDead(b, u, source, target))
                    work.add(u);
            }
        }
    }
}
