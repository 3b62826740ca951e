package com.biomech.cfpg.engine;

import com.biomech.cfpg.api.BuildListener;
import com.biomech.cfpg.api.PathSet;
import com.biomech.cfpg.graph.LeveledNode;
import com.biomech.cfpg.graph.NodeGraph;
import com.biomech.cfpg.graph.NodeIndex;
import com.biomech.cfpg.graph.TagSet;
import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * Pre-CFPG: a paths graph with the walks that cycle through a processed node
 * removed, and every node tagged with the anchors through which it can be
 * reached without its name recurring.
 *
 * Algorithm:
 * 1. Nodes (other than the endpoints) that carry the source's or the target's
 * name are pruned. Every remaining node is tagged {source}.
 * 2. A round sweeps levels k = 1..L. For each node x at level k of the current
 * graph, the forward and backward subgraphs of x are joined; nodes in the
 * forward part carrying x's name at another depth close a cycle through x and
 * are pruned. If x survives, its pruned subgraph is merged into the level's
 * graph and x is added to the tags of every surviving node at depth k or more.
 * 3. Rounds repeat, each on the previous round's output, until a round leaves
 * the edge set unchanged or empty.
 *
 * A round is a pure function of (graph, tags); no snapshot is mutated after it
 * is built. The graph alone is not cycle-free: sampling it must check that the
 * whole path so far is contained in the tags of the next node.
 */
@Log4j2
public final class PreCfpg implements PathSet {
    public static final int DEFAULT_MAX_ROUNDS = 50;
    static final int MAX_SAMPLE_ATTEMPTS = 1000;

    private final NodeGraph<LeveledNode> graph;
    private final Map<LeveledNode, TagSet> tags;
    private final LeveledNode source;
    private final LeveledNode target;
    private final int length;
    private final int rounds;
    private final boolean signed;
    private final boolean empty;

    private PreCfpg(NodeGraph<LeveledNode> graph, Map<LeveledNode, TagSet> tags, LeveledNode source,
            LeveledNode target, int length, int rounds, boolean signed, boolean empty) {
        this.graph = graph;
        this.tags = tags;
        this.source = source;
        this.target = target;
        this.length = length;
        this.rounds = rounds;
        this.signed = signed;
        this.empty = empty;
    }

    /** One fixed-point iterate: a graph and the tags of its nodes. */
    private record Snapshot(NodeGraph<LeveledNode> graph, Map<LeveledNode, Set<LeveledNode>> tags) {
        boolean isEmpty() {
            return graph.edgeCount() == 0;
        }
    }

    public static PreCfpg fromPathsGraph(PathsGraph pg) {
        return fromPathsGraph(pg, DEFAULT_MAX_ROUNDS, BuildListener.NONE);
    }

    /**
     * Runs the fixed-point loop.
     *
     * @param maxRounds upper bound on the number of rounds
     * @throws ConvergenceException if the loop has not converged after
     *                              {@code maxRounds} rounds
     */
    public static PreCfpg fromPathsGraph(PathsGraph pg, int maxRounds, BuildListener listener) {
        if (maxRounds < 1)
            throw new IllegalArgumentException("maxRounds must be at least 1: " + maxRounds);
        LeveledNode src = pg.source();
        LeveledNode tgt = pg.target();
        int length = pg.length();
        boolean signed = pg.signed();
        if (pg.isEmpty())
            return empty(src, tgt, length, signed);
        if (length == 0)
            return finish(new Snapshot(pg.graph(), Map.of(src, Set.of(src))), src, tgt, 0, 0, signed);
        if (src.sameName(tgt)) {
            log.debug("Closed walks {} -> {} of length {} all repeat the endpoint", src.name(), tgt.name(), length);
            return empty(src, tgt, length, signed);
        }

        Snapshot current = initialize(pg.graph(), src, tgt);
        if (current.isEmpty())
            return empty(src, tgt, length, signed);

        int round = 0;
        while (true) {
            if (round == maxRounds)
                throw new ConvergenceException(maxRounds, current.graph().edgeCount());
            round++;
            listener.onRoundStart(round, current.graph().nodeCount(), current.graph().edgeCount());
            Snapshot next = round(current, src, tgt, length, round, listener);
            boolean converged = next.isEmpty() || next.graph().sameEdges(current.graph());
            listener.onRoundEnd(round, next.graph().edgeCount(), converged);
            current = next;
            if (converged)
                break;
        }
        if (current.isEmpty()) {
            log.debug("Pre-CFPG {} -> {} length {} has no cycle-free paths (round {})", src.name(), tgt.name(),
                    length, round);
            return empty(src, tgt, length, signed);
        }
        log.debug("Pre-CFPG {} -> {} length {} converged after {} round(s): {} nodes, {} edges", src.name(),
                tgt.name(), length, round, current.graph().nodeCount(), current.graph().edgeCount());
        return finish(current, src, tgt, length, round, signed);
    }

    private static PreCfpg empty(LeveledNode src, LeveledNode tgt, int length, boolean signed) {
        return new PreCfpg(NodeGraph.empty(), Collections.emptyMap(), src, tgt, length, 0, signed, true);
    }

    /** Freezes the tag sets over a dense index of the final graph's nodes. */
    private static PreCfpg finish(Snapshot s, LeveledNode src, LeveledNode tgt, int length, int rounds,
            boolean signed) {
        NodeIndex index = new NodeIndex(s.graph().nodes());
        Map<LeveledNode, TagSet> frozen = new TreeMap<>();
        for (LeveledNode v : s.graph().nodes())
            frozen.put(v, TagSet.of(index, s.tags().get(v)));
        return new PreCfpg(s.graph(), Collections.unmodifiableMap(frozen), src, tgt, length, rounds, signed,
                false);
    }

    /** Prunes source- and target-named interior nodes and tags everything with the source. */
    static Snapshot initialize(NodeGraph<LeveledNode> pg, LeveledNode src, LeveledNode tgt) {
        List<LeveledNode> toPrune = pg.nodes(v -> !v.equals(src) && !v.equals(tgt)
                && (v.sameName(src) || v.sameName(tgt)));
        NodeGraph<LeveledNode> g = GraphPruner.prune(pg, toPrune, src, tgt);
        if (!g.containsNode(src) || !g.containsNode(tgt) || g.edgeCount() == 0)
            return new Snapshot(NodeGraph.empty(), Collections.emptyMap());
        Map<LeveledNode, Set<LeveledNode>> tags = new TreeMap<>();
        for (LeveledNode v : g.nodes())
            tags.put(v, Set.of(src));
        return new Snapshot(g, tags);
    }

    private static Snapshot round(Snapshot in, LeveledNode src, LeveledNode tgt, int length, int round,
            BuildListener listener) {
        NodeGraph<LeveledNode> h = in.graph();
        Map<LeveledNode, Set<LeveledNode>> tags = in.tags();
        for (int k = 1; k <= length; k++) {
            final int depth = k;
            final Map<LeveledNode, Set<LeveledNode>> previous = tags;
            NodeGraph.Builder<LeveledNode> hk = NodeGraph.builder();
            Map<LeveledNode, Set<LeveledNode>> tk = new TreeMap<>();
            for (LeveledNode x : h.nodes(v -> v.depth() == depth)) {
                NodeGraph<LeveledNode> fwd = reachable(h, x, true);
                NodeGraph<LeveledNode> gx = fwd.toBuilder().addAll(reachable(h, x, false)).build();
                List<LeveledNode> cycles = fwd.nodes(v -> v.sameName(x) && v.depth() != depth);
                NodeGraph<LeveledNode> pruned = GraphPruner.prune(gx, cycles, src, tgt);
                if (!pruned.containsNode(x) || !pruned.containsNode(src) || !pruned.containsNode(tgt)
                        || pruned.edgeCount() == 0)
                    continue;
                hk.addAll(pruned);
                for (LeveledNode v : pruned.nodes()) {
                    Set<LeveledNode> t = tk.computeIfAbsent(v, key -> new TreeSet<>(previous.get(key)));
                    if (v.depth() >= depth)
                        t.add(x);
                }
            }
            h = hk.build();
            tags = tk;
            listener.onLevelProcessed(round, k, h.nodeCount(), h.edgeCount());
            if (h.edgeCount() == 0)
                return new Snapshot(NodeGraph.empty(), Collections.emptyMap());
        }
        return new Snapshot(h, tags);
    }

    /** The subgraph of every edge on a walk leaving (or entering) {@code x}. */
    private static NodeGraph<LeveledNode> reachable(NodeGraph<LeveledNode> h, LeveledNode x, boolean forward) {
        NodeGraph.Builder<LeveledNode> b = NodeGraph.<LeveledNode>builder().addNode(x);
        Set<LeveledNode> seen = new HashSet<>();
        Deque<LeveledNode> work = new ArrayDeque<>();
        seen.add(x);
        work.add(x);
        while (!work.isEmpty()) {
            LeveledNode v = work.poll();
            for (LeveledNode u : forward ? h.successors(v) : h.predecessors(v)) {
                if (forward)
                    b.addEdge(v, u, h.weight(v, u));
                else
                    b.addEdge(u, v, h.weight(u, v));
                if (seen.add(u))
                    work.add(u);
            }
        }
        return b.build();
    }

    public NodeGraph<LeveledNode> graph() {
        return graph;
    }

    /** Tag set of every node, keyed in canonical node order. */
    public Map<LeveledNode, TagSet> tags() {
        return tags;
    }

    public TagSet tags(LeveledNode node) {
        TagSet t = tags.get(node);
        if (t == null)
            throw new IllegalArgumentException("Not a pre-CFPG node: " + node);
        return t;
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

    /** True if node polarities track edge signs. */
    public boolean signed() {
        return signed;
    }

    /** Rounds the fixed-point loop ran before converging. */
    public int rounds() {
        return rounds;
    }

    @Override
    public boolean isEmpty() {
        return empty;
    }

    /**
     * Memory-based sampling: from {@code v}, successor {@code u} is legal only
     * if the path so far is a subset of tags[u]. A walk that runs out of legal
     * successors is restarted.
     *
     * @throws IllegalStateException if a single sample needs more than
     *                               {@value #MAX_SAMPLE_ATTEMPTS} restarts
     */
    @Override
    public List<List<String>> samplePaths(int numSamples, Random random) {
        if (numSamples < 0)
            throw new IllegalArgumentException("Negative sample count: " + numSamples);
        List<List<String>> out = new ArrayList<>(numSamples);
        if (empty)
            return out;
        for (int i = 0; i < numSamples; i++)
            out.add(PathWalker.nameSequence(sampleOne(random), LeveledNode::name));
        return out;
    }

    private List<LeveledNode> sampleOne(Random random) {
        for (int attempt = 0; attempt < MAX_SAMPLE_ATTEMPTS; attempt++) {
            List<LeveledNode> path = new ArrayList<>();
            path.add(source);
            LeveledNode current = source;
            while (current != null && !current.equals(target)) {
                current = PathWalker.weightedChoice(graph, current, legalSuccessors(path, current), random);
                if (current != null)
                    path.add(current);
            }
            if (current != null)
                return path;
        }
        throw new IllegalStateException("No cycle-free walk found after " + MAX_SAMPLE_ATTEMPTS + " attempts");
    }

    private List<LeveledNode> legalSuccessors(List<LeveledNode> path, LeveledNode v) {
        List<LeveledNode> legal = new ArrayList<>();
        for (LeveledNode u : graph.successors(v))
            if (tags.get(u).containsAll(path))
                legal.add(u);
        return legal;
    }

    @Override
    public List<List<String>> enumeratePaths() {
        List<List<String>> out = new ArrayList<>();
        if (empty)
            return out;
        List<LeveledNode> path = new ArrayList<>();
        path.add(source);
        enumerate(path, out);
        return signed ? PathWalker.distinct(out) : out;
    }

    private void enumerate(List<LeveledNode> path, List<List<String>> out) {
        LeveledNode v = path.get(path.size() - 1);
        if (v.equals(target)) {
            out.add(PathWalker.nameSequence(path, LeveledNode::name));
            return;
        }
        for (LeveledNode u : legalSuccessors(path, v)) {
            path.add(u);
            enumerate(path, out);
            path.remove(path.size() - 1);
        }
    }

    /** Counts by enumeration; legality depends on the whole prefix. */
    @Override
    public long countPaths() {
        return enumeratePaths().size();
    }

    @Override
    public String toString() {
        return "PreCfpg[" + source.name() + " -> " + target.name() + ", length " + length + ", " + graph + "]";
    }
}
