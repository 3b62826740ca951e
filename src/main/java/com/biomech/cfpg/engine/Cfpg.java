package com.biomech.cfpg.engine;

import com.biomech.cfpg.api.PathSet;
import com.biomech.cfpg.graph.DirectedGraph;
import com.biomech.cfpg.graph.LeveledNode;
import com.biomech.cfpg.graph.NodeGraph;
import com.biomech.cfpg.graph.NodeIndex;
import com.biomech.cfpg.graph.SplitNode;
import com.biomech.cfpg.graph.TagSet;
import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * Cycle-free paths graph: a DAG over {@link SplitNode}s in which every
 * source-to-target path is cycle-free, every cycle-free walk of the requested
 * length is present, and no two paths project to the same name sequence.
 * A memoryless random walk over it therefore samples cycle-free paths.
 *
 * Construction runs from the target back to the source. At level i every
 * pre-CFPG node x that precedes an already-split node w is examined once per
 * such w: the anchors that can precede the edge x -> w are tags(w) ∩ tags(x),
 * reduced to the nodes that still lie on a source-to-x path. Successors that
 * share the same reduced set are served by one copy of x whose tags are that
 * set. Edges keep the weight of the underlying edge.
 *
 * In signed graphs, parallel edges of opposite sign can give one name sequence
 * two sign histories, each its own CFPG path. Enumeration then drops the
 * repeats and counting enumerates; sampling draws sign histories, so such a
 * name sequence is proportionally more likely.
 */
@Log4j2
public final class Cfpg implements PathSet {
    private final NodeGraph<SplitNode> graph;
    private final SplitNode source;
    private final SplitNode target;
    private final int length;
    private final boolean signed;
    private final boolean empty;

    private Cfpg(NodeGraph<SplitNode> graph, SplitNode source, SplitNode target, int length, boolean signed,
            boolean empty) {
        this.graph = graph;
        this.source = source;
        this.target = target;
        this.length = length;
        this.signed = signed;
        this.empty = empty;
    }

    /** Unsigned CFPG built straight from the input graph. */
    public static Cfpg fromGraph(DirectedGraph g, String source, String target, int length) {
        return fromPreCfpg(PreCfpg.fromPathsGraph(PathsGraph.fromGraph(g, source, target, length)));
    }

    public static Cfpg fromPreCfpg(PreCfpg pre) {
        LeveledNode src = pre.source();
        LeveledNode tgt = pre.target();
        int length = pre.length();
        boolean signed = pre.signed();
        if (pre.isEmpty())
            return empty(src, tgt, length, signed);
        if (length == 0) {
            SplitNode only = new SplitNode(src, 0, pre.tags(src));
            return new Cfpg(NodeGraph.<SplitNode>builder().addNode(only).build(), only, only, 0, signed, false);
        }

        NodeGraph<LeveledNode> g = pre.graph();
        NodeGraph.Builder<SplitNode> b = NodeGraph.builder();
        SplitNode tgtCopy = new SplitNode(tgt, 0, pre.tags(tgt));
        SplitNode srcCopy = new SplitNode(src, 0, pre.tags(src));
        b.addNode(tgtCopy);

        List<SplitNode> level = List.of(tgtCopy);
        Map<SplitNode, Set<LeveledNode>> rawPred = new HashMap<>();
        rawPred.put(tgtCopy, g.predecessors(tgt));

        for (int i = length - 1; i >= 1; i--) {
            SortedSet<LeveledNode> current = new TreeSet<>();
            for (SplitNode w : level)
                current.addAll(rawPred.get(w));

            List<SplitNode> next = new ArrayList<>();
            for (LeveledNode x : current) {
                SortedMap<TagSet, List<SplitNode>> groups = groupSuccessors(pre, x, level, rawPred);
                int copy = 0;
                for (Map.Entry<TagSet, List<SplitNode>> e : groups.entrySet()) {
                    TagSet tags = e.getKey();
                    SplitNode xc = new SplitNode(x, copy++, tags);
                    for (SplitNode w : e.getValue())
                        b.addEdge(xc, w, g.weight(x, w.node()));
                    Set<LeveledNode> preds = new TreeSet<>();
                    for (LeveledNode u : g.predecessors(x))
                        if (tags.contains(u))
                            preds.add(u);
                    rawPred.put(xc, preds);
                    next.add(xc);
                }
            }
            if (next.isEmpty()) {
                log.debug("CFPG {} -> {} length {}: level {} has no copies", src.name(), tgt.name(), length, i);
                return empty(src, tgt, length, signed);
            }
            log.debug("CFPG level {}: {} pre-CFPG nodes split into {} copies", i, current.size(), next.size());
            level = next;
        }
        for (SplitNode w : level)
            b.addEdge(srcCopy, w, g.weight(src, w.node()));

        NodeGraph<SplitNode> pruned = GraphPruner.pruneDeadEnds(b.build(), srcCopy, tgtCopy);
        if (pruned.edgeCount() == 0)
            return empty(src, tgt, length, signed);
        log.debug("CFPG {} -> {} length {}: {} nodes, {} edges", src.name(), tgt.name(), length,
                pruned.nodeCount(), pruned.edgeCount());
        return new Cfpg(pruned, srcCopy, tgtCopy, length, signed, false);
    }

    /**
     * Groups the already-split successors of {@code x} by the frozen anchor set
     * of the copy of x that serves them. Successors whose anchor set no longer
     * connects the source to x are dropped.
     */
    private static SortedMap<TagSet, List<SplitNode>> groupSuccessors(PreCfpg pre, LeveledNode x,
            List<SplitNode> level, Map<SplitNode, Set<LeveledNode>> rawPred) {
        LeveledNode src = pre.source();
        TagSet xTags = pre.tags(x);
        SortedMap<TagSet, List<SplitNode>> groups = new TreeMap<>();
        for (SplitNode w : level) {
            if (!rawPred.get(w).contains(x))
                continue;
            TagSet candidate = w.tags().intersect(xTags);
            NodeGraph<LeveledNode> sub = pre.graph().induce(candidate.members());
            NodeGraph<LeveledNode> survivors = GraphPruner.pruneDeadEnds(sub, src, x);
            if (!survivors.containsNode(x) || !survivors.containsNode(src))
                continue;
            TagSet frozen = TagSet.of(xTags.index(), survivors.nodes());
            groups.computeIfAbsent(frozen, k -> new ArrayList<>()).add(w);
        }
        return groups;
    }

    private static Cfpg empty(LeveledNode src, LeveledNode tgt, int length, boolean signed) {
        TagSet none = TagSet.empty(new NodeIndex(List.of()));
        return new Cfpg(NodeGraph.empty(), new SplitNode(src, 0, none), new SplitNode(tgt, 0, none), length, signed,
                true);
    }

    /**
     * A copy of this graph in which each edge {@code u -> v} weighs the number
     * of paths from {@code v} to the target, so that a random walk draws every
     * cycle-free path (in signed graphs, every sign history) with equal
     * probability.
     */
    public Cfpg withUniformPathDistribution() {
        if (empty || length == 0)
            return this;
        Map<SplitNode, Long> counts = PathWalker.pathsToTarget(graph, target::equals);
        NodeGraph.Builder<SplitNode> b = NodeGraph.builder();
        for (SplitNode u : graph.nodes()) {
            b.addNode(u);
            for (SplitNode v : graph.successors(u))
                b.addEdge(u, v, counts.get(v).doubleValue());
        }
        return new Cfpg(b.build(), source, target, length, signed, false);
    }

    public NodeGraph<SplitNode> graph() {
        return graph;
    }

    public SplitNode source() {
        return source;
    }

    public SplitNode target() {
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
                    SplitNode::name));
        return out;
    }

    @Override
    public List<List<String>> enumeratePaths() {
        if (empty)
            return new ArrayList<>();
        List<List<String>> paths = PathWalker.names(PathWalker.enumerate(graph, source, target::equals),
                SplitNode::name);
        return signed ? PathWalker.distinct(paths) : paths;
    }

    /** Distinct name sequences: a DP count, or an enumeration in signed graphs. */
    @Override
    public long countPaths() {
        if (empty)
            return 0;
        return signed ? enumeratePaths().size() : PathWalker.count(graph, source, target::equals);
    }

    @Override
    public String toString() {
        return "Cfpg[" + source.name() + " -> " + target.name() + ", length " + length + ", " + graph + "]";
    }
}
