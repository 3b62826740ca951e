package com.biomech.cfpg.util;

import com.biomech.cfpg.engine.Cfpg;
import com.biomech.cfpg.engine.PathsGraph;
import com.biomech.cfpg.engine.PreCfpg;
import com.biomech.cfpg.graph.LeveledNode;
import com.biomech.cfpg.graph.NodeGraph;
import com.biomech.cfpg.graph.SplitNode;
import com.biomech.cfpg.graph.TagSet;

import java.util.*;

/**
 * Diagnostic utility for inspecting the intermediate graphs of a query.
 *
 * <p>
 * Generates human-readable text dumps of paths graphs, pre-CFPGs and CFPGs.
 * Intended for debugging sessions and DEBUG logging. Do <b>not</b> use on
 * large graphs in a loop (allocates strings, iterates everything).
 */
public final class GraphExplain {
    private GraphExplain() {
        // Utility class
    }

    /** One line per node, listing its successors, in canonical order. */
    public static <N extends Comparable<N>> String dumpGraph(NodeGraph<N> graph) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ").append(graph.edgeCount())
                .append(" edges):\n");
        for (N node : graph.nodes()) {
            sb.append("  ").append(node);
            Set<N> succ = graph.successors(node);
            if (!succ.isEmpty()) {
                sb.append(" -> ");
                Iterator<N> it = succ.iterator();
                while (it.hasNext()) {
                    N s = it.next();
                    sb.append(s);
                    double w = graph.weight(node, s);
                    if (w != 1.0)
                        sb.append(" [").append(w).append(']');
                    if (it.hasNext())
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public static String explain(PathsGraph pg) {
        if (pg.isEmpty())
            return "Paths graph " + pg.source().name() + " -> " + pg.target().name() + " (length " + pg.length()
                    + "): empty\n";
        return "Paths graph " + pg.source().name() + " -> " + pg.target().name() + " (length " + pg.length()
                + (pg.signed() ? ", signed" : "") + ")\n" + dumpGraph(pg.graph());
    }

    /** The graph followed by the tag set of every node. */
    public static String explain(PreCfpg pre) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Pre-CFPG ").append(pre.source().name()).append(" -> ").append(pre.target().name())
                .append(" (length ").append(pre.length()).append(", ").append(pre.rounds()).append(" rounds)");
        if (pre.isEmpty())
            return sb.append(": empty\n").toString();
        sb.append('\n').append(dumpGraph(pre.graph())).append("Tags:\n");
        for (Map.Entry<LeveledNode, TagSet> e : pre.tags().entrySet())
            sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        return sb.toString();
    }

    /** The graph followed by the number of copies each pre-CFPG node was split into. */
    public static String explain(Cfpg cfpg) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("CFPG ").append(cfpg.source().name()).append(" -> ").append(cfpg.target().name())
                .append(" (length ").append(cfpg.length()).append(')');
        if (cfpg.isEmpty())
            return sb.append(": empty\n").toString();
        sb.append('\n').append(dumpGraph(cfpg.graph())).append("Copies:\n");
        for (Map.Entry<LeveledNode, Integer> e : copyCounts(cfpg).entrySet())
            sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        return sb.toString();
    }

    /** How many split copies of each pre-CFPG node survive in the CFPG. */
    public static SortedMap<LeveledNode, Integer> copyCounts(Cfpg cfpg) {
        SortedMap<LeveledNode, Integer> counts = new TreeMap<>();
        for (SplitNode n : cfpg.graph().nodes())
            counts.merge(n.node(), 1, Integer::sum);
        return counts;
    }
}
