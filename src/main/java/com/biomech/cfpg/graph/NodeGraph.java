package com.biomech.cfpg.graph;

import java.util.*;
import java.util.function.Predicate;

/**
 * Immutable weighted digraph over comparable node keys.
 *
 * Every intermediate stage of the pipeline (paths graph, pre-CFPG, CFPG,
 * combined CFPG, path tree) is one of these. Adjacency is kept in sorted maps
 * so that iteration order, and therefore sampling with a seeded random source,
 * is canonical.
 *
 * A node may be present without edges; stages that have no edges left treat
 * themselves as empty.
 */
public final class NodeGraph<N extends Comparable<N>> {
    private final NavigableMap<N, NavigableMap<N, Double>> successors;
    private final NavigableMap<N, NavigableMap<N, Double>> predecessors;
    private final int edgeCount;

    private NodeGraph(NavigableMap<N, NavigableMap<N, Double>> successors,
            NavigableMap<N, NavigableMap<N, Double>> predecessors, int edgeCount) {
        this.successors = successors;
        this.predecessors = predecessors;
        this.edgeCount = edgeCount;
    }

    public static <N extends Comparable<N>> NodeGraph<N> empty() {
        return new NodeGraph<>(Collections.<N, NavigableMap<N, Double>>emptyNavigableMap(),
                Collections.<N, NavigableMap<N, Double>>emptyNavigableMap(), 0);
    }

    public static <N extends Comparable<N>> Builder<N> builder() {
        return new Builder<>();
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return successors.isEmpty();
    }

    public boolean containsNode(N node) {
        return successors.containsKey(node);
    }

    public boolean containsEdge(N from, N to) {
        NavigableMap<N, Double> out = successors.get(from);
        return out != null && out.containsKey(to);
    }

    /** All nodes in canonical order. */
    public NavigableSet<N> nodes() {
        return Collections.unmodifiableNavigableSet(successors.navigableKeySet());
    }

    public List<N> nodes(Predicate<? super N> filter) {
        List<N> out = new ArrayList<>();
        for (N n : successors.keySet())
            if (filter.test(n))
                out.add(n);
        return out;
    }

    public NavigableSet<N> successors(N node) {
        NavigableMap<N, Double> out = successors.get(node);
        return out == null ? Collections.emptyNavigableSet()
                : Collections.unmodifiableNavigableSet(out.navigableKeySet());
    }

    public NavigableSet<N> predecessors(N node) {
        NavigableMap<N, Double> in = predecessors.get(node);
        return in == null ? Collections.emptyNavigableSet()
                : Collections.unmodifiableNavigableSet(in.navigableKeySet());
    }

    public int outDegree(N node) {
        NavigableMap<N, Double> out = successors.get(node);
        return out == null ? 0 : out.size();
    }

    public int inDegree(N node) {
        NavigableMap<N, Double> in = predecessors.get(node);
        return in == null ? 0 : in.size();
    }

    /** Weight of the edge {@code from -> to}; throws if the edge does not exist. */
    public double weight(N from, N to) {
        NavigableMap<N, Double> out = successors.get(from);
        Double w = out == null ? null : out.get(to);
        if (w == null)
            throw new IllegalArgumentException("No edge " + from + " -> " + to);
        return w;
    }

    /** The subgraph induced on the given node set (isolated nodes are kept). */
    public NodeGraph<N> induce(Collection<N> keep) {
        Set<N> members = keep instanceof Set<N> s ? s : new HashSet<>(keep);
        Builder<N> b = builder();
        for (N u : keep) {
            if (!successors.containsKey(u))
                continue;
            b.addNode(u);
            for (Map.Entry<N, Double> e : successors.get(u).entrySet())
                if (members.contains(e.getKey()))
                    b.addEdge(u, e.getKey(), e.getValue());
        }
        return b.build();
    }

    /** True if both graphs have exactly the same edge set (weights ignored). */
    public boolean sameEdges(NodeGraph<N> other) {
        if (edgeCount != other.edgeCount)
            return false;
        for (Map.Entry<N, NavigableMap<N, Double>> e : successors.entrySet()) {
            if (e.getValue().isEmpty())
                continue;
            NavigableMap<N, Double> theirs = other.successors.get(e.getKey());
            if (theirs == null || !theirs.keySet().equals(e.getValue().keySet()))
                return false;
        }
        return true;
    }

    /** Copies nodes and edges into a new builder for incremental editing. */
    public Builder<N> toBuilder() {
        Builder<N> b = builder();
        for (Map.Entry<N, NavigableMap<N, Double>> e : successors.entrySet()) {
            b.addNode(e.getKey());
            for (Map.Entry<N, Double> s : e.getValue().entrySet())
                b.addEdge(e.getKey(), s.getKey(), s.getValue());
        }
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NodeGraph<?> other))
            return false;
        return successors.equals(other.successors);
    }

    @Override
    public int hashCode() {
        return successors.hashCode();
    }

    @Override
    public String toString() {
        return "NodeGraph[" + nodeCount() + " nodes, " + edgeCount + " edges]";
    }

    /**
     * Mutable accumulator for a NodeGraph. The first weight recorded for an
     * edge wins.
     */
    public static final class Builder<N extends Comparable<N>> {
        private final NavigableMap<N, NavigableMap<N, Double>> succ = new TreeMap<>();
        private final NavigableMap<N, NavigableMap<N, Double>> pred = new TreeMap<>();
        private int edges;

        public Builder<N> addNode(N node) {
            succ.computeIfAbsent(node, k -> new TreeMap<>());
            pred.computeIfAbsent(node, k -> new TreeMap<>());
            return this;
        }

        public Builder<N> addEdge(N from, N to) {
            return addEdge(from, to, DirectedGraph.DEFAULT_WEIGHT);
        }

        public Builder<N> addEdge(N from, N to, double weight) {
            addNode(from);
            addNode(to);
            if (succ.get(from).putIfAbsent(to, weight) == null) {
                pred.get(to).put(from, weight);
                edges++;
            }
            return this;
        }

        /** Copies every node and edge of the other graph into this builder. */
        public Builder<N> addAll(NodeGraph<N> other) {
            for (Map.Entry<N, NavigableMap<N, Double>> e : other.successors.entrySet()) {
                addNode(e.getKey());
                for (Map.Entry<N, Double> s : e.getValue().entrySet())
                    addEdge(e.getKey(), s.getKey(), s.getValue());
            }
            return this;
        }

        public Builder<N> removeNode(N node) {
            NavigableMap<N, Double> out = succ.remove(node);
            NavigableMap<N, Double> in = pred.remove(node);
            if (out != null) {
                for (N v : out.keySet()) {
                    NavigableMap<N, Double> in2 = pred.get(v);
                    if (in2 != null)
                        in2.remove(node);
                }
                edges -= out.size();
            }
            if (in != null) {
                for (N u : in.keySet()) {
                    NavigableMap<N, Double> out2 = succ.get(u);
                    if (out2 != null && out2.remove(node) != null)
                        edges--;
                }
            }
            return this;
        }

        public boolean containsNode(N node) {
            return succ.containsKey(node);
        }

        public int outDegree(N node) {
            NavigableMap<N, Double> out = succ.get(node);
            return out == null ? 0 : out.size();
        }

        public int inDegree(N node) {
            NavigableMap<N, Double> in = pred.get(node);
            return in == null ? 0 : in.size();
        }

        public Set<N> successors(N node) {
            NavigableMap<N, Double> out = succ.get(node);
            return out == null ? Set.of() : out.keySet();
        }

        public Set<N> predecessors(N node) {
            NavigableMap<N, Double> in = pred.get(node);
            return in == null ? Set.of() : in.keySet();
        }

        public Set<N> nodes() {
            return succ.keySet();
        }

        public int edgeCount() {
            return edges;
        }

        public NodeGraph<N> build() {
            NavigableMap<N, NavigableMap<N, Double>> s = new TreeMap<>();
            NavigableMap<N, NavigableMap<N, Double>> p = new TreeMap<>();
            for (Map.Entry<N, NavigableMap<N, Double>> e : succ.entrySet())
                s.put(e.getKey(), Collections.unmodifiableNavigableMap(new TreeMap<>(e.getValue())));
            for (Map.Entry<N, NavigableMap<N, Double>> e : pred.entrySet())
                p.put(e.getKey(), Collections.unmodifiableNavigableMap(new TreeMap<>(e.getValue())));
            return new NodeGraph<>(Collections.unmodifiableNavigableMap(s),
                    Collections.unmodifiableNavigableMap(p), edges);
        }
    }
}
