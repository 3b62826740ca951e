package com.biomech.cfpg.graph;

import java.util.*;

/**
 * DirectedGraph -- CSR-encoded, read-only influence graph.
 *
 * This is the caller-owned input to every path query. After {@link Builder#build()}
 * the structure never changes, so a single instance can be shared by any number
 * of concurrent queries.
 *
 * Data layout (Compressed Sparse Row, once per direction):
 * - outOffset[i] .. outOffset[i+1] delimits the slice of the flat arrays
 * holding the out-edges of vertex i. outTarget holds the head vertex index,
 * outSign the edge sign (0 activating, 1 inhibiting) and outWeight the
 * positive edge weight.
 * - inOffset / inSource / inSign / inWeight mirror this for in-edges, so that
 * backward reach sets are computed with the same contiguous scans.
 *
 * Parallel edges between the same pair are kept when their signs differ; they
 * are distinct candidate edges for signed queries.
 */
public final class DirectedGraph {
    public static final double DEFAULT_WEIGHT = 1.0;

    private final String[] names;
    private final Map<String, Integer> nameToIndex;

    private final int[] outOffset;
    private final int[] outTarget;
    private final byte[] outSign;
    private final double[] outWeight;

    private final int[] inOffset;
    private final int[] inSource;
    private final byte[] inSign;
    private final double[] inWeight;

    private DirectedGraph(String[] names, Map<String, Integer> nameToIndex,
            int[] outOffset, int[] outTarget, byte[] outSign, double[] outWeight,
            int[] inOffset, int[] inSource, byte[] inSign, double[] inWeight) {
        this.names = names;
        this.nameToIndex = nameToIndex;
        this.outOffset = outOffset;
        this.outTarget = outTarget;
        this.outSign = outSign;
        this.outWeight = outWeight;
        this.inOffset = inOffset;
        this.inSource = inSource;
        this.inSign = inSign;
        this.inWeight = inWeight;
    }

    public int nodeCount() {
        return names.length;
    }

    public int edgeCount() {
        return outTarget.length;
    }

    public String name(int vi) {
        return names[vi];
    }

    public boolean containsNode(String name) {
        return nameToIndex.containsKey(name);
    }

    /** Resolves a vertex name to its index. O(1) hash lookup. */
    public int index(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public int outDegree(int vi) {
        return outOffset[vi + 1] - outOffset[vi];
    }

    public int inDegree(int vi) {
        return inOffset[vi + 1] - inOffset[vi];
    }

    public int outStart(int vi) {
        return outOffset[vi];
    }

    public int outEnd(int vi) {
        return outOffset[vi + 1];
    }

    public int targetAt(int flatIndex) {
        return outTarget[flatIndex];
    }

    public int outSignAt(int flatIndex) {
        return outSign[flatIndex];
    }

    public double outWeightAt(int flatIndex) {
        return outWeight[flatIndex];
    }

    public int inStart(int vi) {
        return inOffset[vi];
    }

    public int inEnd(int vi) {
        return inOffset[vi + 1];
    }

    public int sourceAt(int flatIndex) {
        return inSource[flatIndex];
    }

    public int inSignAt(int flatIndex) {
        return inSign[flatIndex];
    }

    public double inWeightAt(int flatIndex) {
        return inWeight[flatIndex];
    }

    /**
     * Weight of the first edge {@code from -> to}, or {@link #DEFAULT_WEIGHT}
     * when no such edge exists.
     */
    public double weight(String from, String to) {
        Integer u = nameToIndex.get(from);
        Integer v = nameToIndex.get(to);
        if (u == null || v == null)
            return DEFAULT_WEIGHT;
        for (int e = outOffset[u]; e < outOffset[u + 1]; e++)
            if (outTarget[e] == v)
                return outWeight[e];
        return DEFAULT_WEIGHT;
    }

    /** True if the graph has an edge {@code from -> to} of any sign. */
    public boolean hasEdge(String from, String to) {
        Integer u = nameToIndex.get(from);
        Integer v = nameToIndex.get(to);
        if (u == null || v == null)
            return false;
        for (int e = outOffset[u]; e < outOffset[u + 1]; e++)
            if (outTarget[e] == v)
                return true;
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the DirectedGraph.
     * Vertices are indexed in insertion order; edges may name vertices that were
     * not added explicitly.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<int[]> edges = new ArrayList<>();
        private final List<Double> weights = new ArrayList<>();
        private final Set<Long> seen = new HashSet<>();

        public Builder addNode(String name) {
            if (name == null || name.isEmpty())
                throw new IllegalArgumentException("Node name must not be empty");
            if (!nameToIdx.containsKey(name)) {
                nameToIdx.put(name, names.size());
                names.add(name);
            }
            return this;
        }

        public Builder addEdge(String from, String to) {
            return addEdge(from, to, 0, DEFAULT_WEIGHT);
        }

        public Builder addEdge(String from, String to, int sign) {
            return addEdge(from, to, sign, DEFAULT_WEIGHT);
        }

        /**
         * Adds an edge. A second edge with the same endpoints and sign is
         * ignored; one with a different sign is kept as a distinct edge.
         */
        public Builder addEdge(String from, String to, int sign, double weight) {
            if (sign != 0 && sign != 1)
                throw new IllegalArgumentException("Edge sign must be 0 or 1: " + from + " -> " + to);
            if (!(weight > 0) || Double.isInfinite(weight))
                throw new IllegalArgumentException("Edge weight must be positive: " + from + " -> " + to);
            addNode(from);
            addNode(to);
            int u = nameToIdx.get(from), v = nameToIdx.get(to);
            long key = (((long) u) << 33) | (((long) v) << 1) | sign;
            if (seen.add(key)) {
                edges.add(new int[] { u, v, sign });
                weights.add(weight);
            }
            return this;
        }

        /** Compiles the edge list into forward and backward CSR arrays. */
        public DirectedGraph build() {
            int n = names.size();
            int m = edges.size();

            int[] outOff = new int[n + 1], inOff = new int[n + 1];
            for (int[] e : edges) {
                outOff[e[0] + 1]++;
                inOff[e[1] + 1]++;
            }
            for (int i = 0; i < n; i++) {
                outOff[i + 1] += outOff[i];
                inOff[i + 1] += inOff[i];
            }

            int[] outT = new int[m], inS = new int[m];
            byte[] outSg = new byte[m], inSg = new byte[m];
            double[] outW = new double[m], inW = new double[m];
            int[] outFill = Arrays.copyOf(outOff, n), inFill = Arrays.copyOf(inOff, n);
            for (int k = 0; k < m; k++) {
                int[] e = edges.get(k);
                double w = weights.get(k);
                int o = outFill[e[0]]++;
                outT[o] = e[1];
                outSg[o] = (byte) e[2];
                outW[o] = w;
                int i = inFill[e[1]]++;
                inS[i] = e[0];
                inSg[i] = (byte) e[2];
                inW[i] = w;
            }
            return new DirectedGraph(names.toArray(new String[0]), Map.copyOf(nameToIdx),
                    outOff, outT, outSg, outW, inOff, inS, inSg, inW);
        }
    }
}
