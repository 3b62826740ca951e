package com.biomech.cfpg.engine;

import com.biomech.cfpg.graph.NodeGraph;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Walk, enumeration and counting primitives over a DAG-shaped
 * {@link NodeGraph} whose every node lies on a source-to-target path.
 *
 * Successors are always visited in the graph's canonical order, so a seeded
 * {@link Random} reproduces the same walk.
 */
public final class PathWalker {
    private PathWalker() {
        // Utility class
    }

    /**
     * One weighted random walk from {@code source} until a node accepted by
     * {@code isTarget} is reached. Each step draws a successor with probability
     * proportional to its edge weight.
     *
     * @throws IllegalStateException if the walk reaches a node with no successors
     *                               that is not a target
     */
    public static <N extends Comparable<N>> List<N> randomWalk(NodeGraph<N> graph, N source,
            Predicate<N> isTarget, Random random) {
        List<N> walk = new ArrayList<>();
        N current = source;
        walk.add(current);
        while (!isTarget.test(current)) {
            current = weightedChoice(graph, current, graph.successors(current), random);
            if (current == null)
                throw new IllegalStateException("Walk stuck at a dead end: " + walk);
            walk.add(current);
        }
        return walk;
    }

    /**
     * Draws one of {@code candidates} (all successors of {@code from}) with
     * probability proportional to edge weight; null if there are none.
     */
    static <N extends Comparable<N>> N weightedChoice(NodeGraph<N> graph, N from, Collection<N> candidates,
            Random random) {
        if (candidates.isEmpty())
            return null;
        double total = 0;
        for (N c : candidates)
            total += graph.weight(from, c);
        double r = random.nextDouble() * total;
        double acc = 0;
        N last = null;
        for (N c : candidates) {
            acc += graph.weight(from, c);
            last = c;
            if (r < acc)
                return c;
        }
        // Rounding at the top of the cumulative range
        return last;
    }

    /** Every source-to-target node sequence, in canonical depth-first order. */
    public static <N extends Comparable<N>> List<List<N>> enumerate(NodeGraph<N> graph, N source,
            Predicate<N> isTarget) {
        List<List<N>> out = new ArrayList<>();
        if (!graph.containsNode(source))
            return out;
        Deque<N> stack = new ArrayDeque<>();
        stack.addLast(source);
        dfs(graph, source, isTarget, stack, out);
        return out;
    }

    private static <N extends Comparable<N>> void dfs(NodeGraph<N> graph, N node,
            Predicate<N> isTarget, Deque<N> stack, List<List<N>> out) {
        if (isTarget.test(node)) {
            out.add(new ArrayList<>(stack));
            return;
        }
        for (N next : graph.successors(node)) {
            stack.addLast(next);
            dfs(graph, next, isTarget, stack, out);
            stack.removeLast();
        }
    }

    /**
     * Number of source-to-target paths, by memoized dynamic programming over
     * the DAG.
     *
     * @throws ArithmeticException if the count overflows a long
     */
    public static <N extends Comparable<N>> long count(NodeGraph<N> graph, N source,
            Predicate<N> isTarget) {
        if (!graph.containsNode(source))
            return 0;
        return pathsToTarget(graph, isTarget).getOrDefault(source, 0L);
    }

    /**
     * For every node, the number of paths from it to a target. Computed in
     * reverse topological order without recursion.
     */
    public static <N extends Comparable<N>> Map<N, Long> pathsToTarget(NodeGraph<N> graph,
            Predicate<N> isTarget) {
        Map<N, Long> counts = new HashMap<>();
        for (N n : reverseTopological(graph)) {
            long c = isTarget.test(n) ? 1 : 0;
            for (N s : graph.successors(n))
                c = Math.addExact(c, counts.get(s));
            counts.put(n, c);
        }
        return counts;
    }

    private static <N extends Comparable<N>> List<N> reverseTopological(NodeGraph<N> graph) {
        Map<N, Integer> remaining = new HashMap<>();
        Deque<N> ready = new ArrayDeque<>();
        for (N n : graph.nodes()) {
            int d = graph.outDegree(n);
            remaining.put(n, d);
            if (d == 0)
                ready.add(n);
        }
        List<N> order = new ArrayList<>(graph.nodeCount());
        while (!ready.isEmpty()) {
            N n = ready.poll();
            order.add(n);
            for (N p : graph.predecessors(n))
                if (remaining.merge(p, -1, Integer::sum) == 0)
                    ready.add(p);
        }
        if (order.size() != graph.nodeCount())
            throw new IllegalStateException("Graph has a cycle; paths cannot be counted");
        return order;
    }

    /** Projects node paths to name paths. */
    public static <N> List<List<String>> names(List<List<N>> paths, Function<N, String> name) {
        List<List<String>> out = new ArrayList<>(paths.size());
        for (List<N> p : paths)
            out.add(nameSequence(p, name));
        return out;
    }

    /**
     * Drops repeated name sequences, keeping first occurrences in order. In
     * signed graphs two parallel edges of opposite sign can give one name
     * sequence several sign histories.
     */
    public static List<List<String>> distinct(List<List<String>> paths) {
        return new ArrayList<>(new LinkedHashSet<>(paths));
    }

    public static <N> List<String> nameSequence(List<N> path, Function<N, String> name) {
        List<String> names = new ArrayList<>(path.size());
        for (N n : path)
            names.add(name.apply(n));
        return names;
    }
}
