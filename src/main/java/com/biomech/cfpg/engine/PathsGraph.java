package com.biomech.cfpg.engine;

import com.biomech.cfpg.api.PathSet;
import com.biomech.cfpg.graph.DirectedGraph;
import com.biomech.cfpg.graph.LeveledNode;
import com.biomech.cfpg.graph.NodeGraph;
import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * The graph of every walk of one fixed length between a source and a target.
 *
 * Nodes are {@link LeveledNode}s at depths 0..L. The node set at depth i is
 * the forward reach set at depth i intersected with the backward reach set at
 * depth L - i; edges join consecutive depths wherever the input graph has an
 * edge of matching sign. After pruning, every node lies on at least one full
 * length-L walk.
 *
 * A walk may still revisit a name at two different depths. As a
 * {@link PathSet} this class therefore yields walks, not cycle-free paths.
 * When source and target coincide, a positive length yields the closed walks
 * through the source; none of them is cycle-free.
 */
@Log4j2
public final class PathsGraph implements PathSet {
    private final NodeGraph<LeveledNode> graph;
    private final LeveledNode source;
    private final LeveledNode target;
    private final int length;
    private final boolean signed;
    private final boolean empty;

    private PathsGraph(NodeGraph<LeveledNode> graph, LeveledNode source, LeveledNode target, int length,
            boolean signed, boolean empty) {
        this.graph = graph;
        this.source = source;
        this.target = target;
        this.length = length;
        this.signed = signed;
        this.empty = empty;
    }

    static PathsGraph empty(String source, String target, int length, boolean signed, int targetPolarity) {
        return new PathsGraph(NodeGraph.empty(), LeveledNode.of(0, source),
                new LeveledNode(length, target, targetPolarity), length, signed, true);
    }

    /** Unsigned paths graph; the reach sets are computed on demand. */
    public static PathsGraph fromGraph(DirectedGraph g, String source, String target, int length) {
        return fromGraph(g, source, target, length, null, false, 0);
    }

    /**
     * Builds the paths graph.
     *
     * @param reach          precomputed reach sets for this pair, or null to
     *                       compute them to depth {@code length}
     * @param targetPolarity required cumulative sign of a walk; ignored when
     *                       {@code signed} is false
     * @throws IllegalArgumentException for a negative length, a polarity outside
     *                                  {0, 1}, an unknown node, or reach sets
     *                                  computed in the other signedness mode
     */
    public static PathsGraph fromGraph(DirectedGraph g, String source, String target, int length,
            ReachableSets reach, boolean signed, int targetPolarity) {
        if (length < 0)
            throw new IllegalArgumentException("Negative path length: " + length);
        if (targetPolarity != 0 && targetPolarity != 1)
            throw new IllegalArgumentException("Target polarity must be 0 or 1: " + targetPolarity);
        g.index(source);
        g.index(target);
        int tp = signed ? targetPolarity : 0;

        if (length == 0) {
            if (!source.equals(target) || tp != 0)
                return empty(source, target, 0, signed, tp);
            LeveledNode only = LeveledNode.of(0, source);
            return new PathsGraph(NodeGraph.<LeveledNode>builder().addNode(only).build(), only, only, 0, signed,
                    false);
        }
        if (reach == null)
            reach = ReachableSets.compute(g, source, target, length, signed);
        else if (reach.signed() != signed)
            throw new IllegalArgumentException("Reach sets were computed with signed=" + reach.signed());
        if (length > reach.bound()) {
            log.warn("Insufficient depth: reach sets for {} -> {} were computed to depth {}, path length is {}",
                    source, target, reach.bound(), length);
            return empty(source, target, length, signed, tp);
        }
        if (reach.isEmpty() || length > reach.maxDepth())
            return empty(source, target, length, signed, tp);

        List<Set<LeveledNode>> levels = levels(reach, source, target, length, tp);
        LeveledNode src = levels.get(0).iterator().next();
        LeveledNode tgt = levels.get(length).iterator().next();

        NodeGraph.Builder<LeveledNode> b = NodeGraph.builder();
        b.addNode(src).addNode(tgt);
        for (int i = 0; i < length; i++) {
            Set<LeveledNode> nextLevel = levels.get(i + 1);
            for (LeveledNode u : levels.get(i)) {
                int vi = g.index(u.name());
                for (int e = g.outStart(vi); e < g.outEnd(vi); e++) {
                    int pol = signed ? (u.polarity() + g.outSignAt(e)) & 1 : 0;
                    LeveledNode v = new LeveledNode(i + 1, g.name(g.targetAt(e)), pol);
                    if (nextLevel.contains(v))
                        b.addEdge(u, v, g.outWeightAt(e));
                }
            }
        }
        NodeGraph<LeveledNode> pruned = GraphPruner.pruneDeadEnds(b.build(), src, tgt);
        if (pruned.edgeCount() == 0)
            return empty(source, target, length, signed, tp);
        log.debug("Paths graph {} -> {} length {}: {} nodes, {} edges", source, target, length,
                pruned.nodeCount(), pruned.edgeCount());
        return new PathsGraph(pruned, src, tgt, length, signed, false);
    }

    /** Candidate nodes per depth; the backward sets are re-leveled and polarity-adjusted. */
    private static List<Set<LeveledNode>> levels(ReachableSets reach, String source, String target, int length,
            int tp) {
        List<Set<LeveledNode>> levels = new ArrayList<>(length + 1);
        levels.add(Set.of(LeveledNode.of(0, source)));
        for (int i = 1; i < length; i++) {
            Set<LeveledNode> adjusted = new HashSet<>();
            for (LeveledNode n : reach.backward(length - i))
                adjusted.add(new LeveledNode(i, n.name(), n.polarity() ^ tp));
            Set<LeveledNode> level = new TreeSet<>();
            for (LeveledNode n : reach.forward(i))
                if (adjusted.contains(n))
                    level.add(n);
            levels.add(level);
        }
        levels.add(Set.of(new LeveledNode(length, target, tp)));
        return levels;
    }

    public NodeGraph<LeveledNode> graph() {
        return graph;
    }

    public LeveledNode source() {
        return source;
    }

    public LeveledNode target() {
        return target;
    }

    public int length() {
        return length;
    }

    public boolean signed() {
        return signed;
    }

    @Override
    public boolean isEmpty() {
        return empty;
    }

    @Override
    public List<List<String>> samplePaths(int numSamples, Random random) {
        if (numSamples < 0)
            throw new IllegalArgumentException("Negative sample count: " + numSamples);
        List<List<String>> out = new ArrayList<>(numSamples);
        if (empty)
            return out;
        for (int i = 0; i < numSamples; i++)
            out.add(PathWalker.nameSequence(PathWalker.randomWalk(graph, source, target::equals, random),
                    LeveledNode::name));
        return out;
    }

    @Override
    public List<List<String>> enumeratePaths() {
        if (empty)
            return new ArrayList<>();
        List<List<String>> walks = PathWalker.names(PathWalker.enumerate(graph, source, target::equals),
                LeveledNode::name);
        return signed ? PathWalker.distinct(walks) : walks;
    }

    /** Distinct name sequences; signed graphs are counted by enumeration. */
    @Override
    public long countPaths() {
        if (empty)
            return 0;
        return signed ? enumeratePaths().size() : PathWalker.count(graph, source, target::equals);
    }

    @Override
    public String toString() {
        return "PathsGraph[" + source.name() + " -> " + target.name() + ", length " + length + ", " + graph + "]";
    }
}
