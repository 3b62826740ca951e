package com.biomech.cfpg.engine;

import com.biomech.cfpg.api.PathSet;
import com.biomech.cfpg.graph.NodeGraph;
import com.biomech.cfpg.graph.SplitNode;

import java.util.*;

/**
 * Several fixed-length CFPGs between the same endpoints merged into one graph
 * for variable-length sampling.
 *
 * Split nodes are re-keyed by the path length of the CFPG they came from, so
 * the components stay disjoint except for one shared source node. A walk ends
 * at whichever component's target it reaches first, which is the only target
 * on its component.
 */
public final class CombinedCfpg implements PathSet {
    /** A split node tagged with the length of the CFPG it belongs to. */
    public record CombinedNode(int pathLength, SplitNode node) implements Comparable<CombinedNode> {
        public String name() {
            return node.name();
        }

        @Override
        public int compareTo(CombinedNode o) {
            int c = Integer.compare(pathLength, o.pathLength);
            return c != 0 ? c : node.compareTo(o.node);
        }
    }

    private final NodeGraph<CombinedNode> graph;
    private final CombinedNode source;
    private final Set<CombinedNode> targets;
    private final List<Cfpg> components;
    private final boolean signed;

    /**
     * @param cfpgs CFPGs with a common source and target; empty ones are
     *              skipped
     * @throws IllegalArgumentException if endpoints differ, or a component has
     *                                  length zero or repeats a length
     */
    public CombinedCfpg(Collection<Cfpg> cfpgs) {
        List<Cfpg> kept = new ArrayList<>();
        Set<Integer> lengths = new HashSet<>();
        String sourceName = null, targetName = null;
        for (Cfpg c : cfpgs) {
            if (c.length() == 0)
                throw new IllegalArgumentException("Zero-length CFPGs cannot be combined");
            if (!lengths.add(c.length()))
                throw new IllegalArgumentException("Duplicate path length " + c.length());
            if (sourceName == null) {
                sourceName = c.source().name();
                targetName = c.target().name();
            } else if (!sourceName.equals(c.source().name()) || !targetName.equals(c.target().name())) {
                throw new IllegalArgumentException("CFPGs do not share endpoints: " + c);
            }
            if (!c.isEmpty())
                kept.add(c);
        }
        this.components = Collections.unmodifiableList(kept);
        this.signed = kept.stream().anyMatch(Cfpg::signed);

        if (kept.isEmpty()) {
            this.graph = NodeGraph.empty();
            this.source = null;
            this.targets = Collections.emptySet();
            return;
        }
        CombinedNode src = new CombinedNode(0, kept.get(0).source());
        NodeGraph.Builder<CombinedNode> b = NodeGraph.builder();
        Set<CombinedNode> tgts = new TreeSet<>();
        b.addNode(src);
        for (Cfpg c : kept) {
            int len = c.length();
            NodeGraph<SplitNode> g = c.graph();
            for (SplitNode u : g.nodes()) {
                CombinedNode from = u.equals(c.source()) ? src : new CombinedNode(len, u);
                for (SplitNode v : g.successors(u))
                    b.addEdge(from, new CombinedNode(len, v), g.weight(u, v));
            }
            tgts.add(new CombinedNode(len, c.target()));
        }
        this.graph = b.build();
        this.source = src;
        this.targets = Collections.unmodifiableSet(tgts);
    }

    public NodeGraph<CombinedNode> graph() {
        return graph;
    }

    /** The non-empty CFPGs, in the order given. */
    public List<Cfpg> components() {
        return components;
    }

    @Override
    public boolean isEmpty() {
        return components.isEmpty();
    }

    @Override
    public List<List<String>> samplePaths(int numSamples, Random random) {
        if (numSamples < 0)
            throw new IllegalArgumentException("Negative sample count: " + numSamples);
        List<List<String>> out = new ArrayList<>(numSamples);
        if (isEmpty())
            return out;
        for (int i = 0; i < numSamples; i++)
            out.add(PathWalker.nameSequence(PathWalker.randomWalk(graph, source, targets::contains, random),
                    CombinedNode::name));
        return out;
    }

    @Override
    public List<List<String>> enumeratePaths() {
        if (isEmpty())
            return new ArrayList<>();
        List<List<String>> paths = PathWalker.names(PathWalker.enumerate(graph, source, targets::contains),
                CombinedNode::name);
        return signed ? PathWalker.distinct(paths) : paths;
    }

    @Override
    public long countPaths() {
        if (isEmpty())
            return 0;
        return signed ? enumeratePaths().size() : PathWalker.count(graph, source, targets::contains);
    }

    @Override
    public String toString() {
        return "CombinedCfpg[" + components.size() + " lengths, " + graph + "]";
    }
}
