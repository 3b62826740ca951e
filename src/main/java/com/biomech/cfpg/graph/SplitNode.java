package com.biomech.cfpg.graph;

import java.util.Comparator;

/**
 * A copy of a pre-CFPG node in the cycle-free paths graph.
 *
 * Identity is the pair (node, tags): every path entering a split node shares
 * exactly that tag signature, so any outgoing edge may be taken without
 * remembering how the node was reached. {@code copy} numbers the copies of
 * one node in tag order and is derived from the tags.
 */
public record SplitNode(LeveledNode node, int copy, TagSet tags) implements Comparable<SplitNode> {

    private static final Comparator<SplitNode> ORDER = Comparator
            .comparing(SplitNode::node)
            .thenComparing(SplitNode::tags);

    public int depth() {
        return node.depth();
    }

    public String name() {
        return node.name();
    }

    @Override
    public int compareTo(SplitNode o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return "(" + node.depth() + ", " + node.name() + (node.polarity() == 0 ? "" : ", -") + ", #" + copy + ")";
    }
}
