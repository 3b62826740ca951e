package com.biomech.cfpg.engine;

import com.biomech.cfpg.api.PathSet;
import com.biomech.cfpg.graph.DirectedGraph;
import com.biomech.cfpg.graph.NodeGraph;

import java.util.*;

/**
 * Common-prefix trie over an explicit list of paths.
 *
 * Each tree node is a prefix; the root is the empty prefix and every complete
 * path ends in a terminal node. Sampling walks from the root choosing a child
 * in proportion to the weight of the edge from the prefix's last name to the
 * child's last name in the weight graph (1 when there is no weight graph, no
 * such edge, or the step leaves the root). A path that is a proper prefix of
 * another still ends in its own terminal node.
 */
public final class PathsTree implements PathSet {

    /** A path prefix; {@code complete} marks the terminal node of a full path. */
    public record Prefix(List<String> names, boolean complete) implements Comparable<Prefix> {
        public Prefix {
            names = List.copyOf(names);
        }

        @Override
        public int compareTo(Prefix o) {
            int n = Math.min(names.size(), o.names.size());
            for (int i = 0; i < n; i++) {
                int c = names.get(i).compareTo(o.names.get(i));
                if (c != 0)
                    return c;
            }
            int c = Integer.compare(names.size(), o.names.size());
            return c != 0 ? c : Boolean.compare(complete, o.complete);
        }
    }

    private static final Prefix ROOT = new Prefix(List.of(), false);

    private final NodeGraph<Prefix> graph;

    public PathsTree(Collection<List<String>> paths) {
        this(paths, null);
    }

    /**
     * @param paths   the paths to index; empty paths are ignored and duplicates
     *                collapse
     * @param weights graph supplying edge weights, or null for uniform
     *                branching
     */
    public PathsTree(Collection<List<String>> paths, DirectedGraph weights) {
        NodeGraph.Builder<Prefix> b = NodeGraph.builder();
        for (List<String> path : paths) {
            if (path.isEmpty())
                continue;
            Prefix head = ROOT;
            for (int i = 1; i <= path.size(); i++) {
                Prefix tail = new Prefix(path.subList(0, i), false);
                double w = (weights != null && i > 1) ? weights.weight(path.get(i - 2), path.get(i - 1))
                        : DirectedGraph.DEFAULT_WEIGHT;
                b.addEdge(head, tail, w);
                head = tail;
            }
            b.addEdge(head, new Prefix(path, true), DirectedGraph.DEFAULT_WEIGHT);
        }
        this.graph = b.build();
    }

    public NodeGraph<Prefix> graph() {
        return graph;
    }

    @Override
    public boolean isEmpty() {
        return graph.isEmpty();
    }

    @Override
    public List<List<String>> samplePaths(int numSamples, Random random) {
        if (numSamples < 0)
            throw new IllegalArgumentException("Negative sample count: " + numSamples);
        List<List<String>> out = new ArrayList<>(numSamples);
        if (isEmpty())
            return out;
        for (int i = 0; i < numSamples; i++) {
            List<Prefix> walk = PathWalker.randomWalk(graph, ROOT, Prefix::complete, random);
            out.add(walk.get(walk.size() - 1).names());
        }
        return out;
    }

    /** The distinct paths in lexicographic order. */
    @Override
    public List<List<String>> enumeratePaths() {
        List<List<String>> out = new ArrayList<>();
        for (Prefix p : graph.nodes(Prefix::complete))
            out.add(p.names());
        return out;
    }

    @Override
    public long countPaths() {
        return graph.nodes(Prefix::complete).size();
    }
}
