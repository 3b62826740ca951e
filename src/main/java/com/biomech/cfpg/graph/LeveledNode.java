package com.biomech.cfpg.graph;

import java.util.Comparator;

/**
 * A vertex name placed at a fixed depth of a paths graph.
 *
 * Two nodes that differ only in depth are distinct graph nodes, which is how
 * a walk that revisits a name is represented without collapsing it. In signed
 * graphs the polarity carries the cumulative sign (0 = activating, 1 =
 * inhibiting) accumulated from the source; unsigned graphs always use 0.
 */
public record LeveledNode(int depth, String name, int polarity) implements Comparable<LeveledNode> {

    private static final Comparator<LeveledNode> ORDER = Comparator
            .comparingInt(LeveledNode::depth)
            .thenComparing(LeveledNode::name)
            .thenComparingInt(LeveledNode::polarity);

    public LeveledNode {
        if (depth < 0)
            throw new IllegalArgumentException("Negative depth: " + depth);
        if (name == null)
            throw new IllegalArgumentException("Node name must not be null");
        if (polarity != 0 && polarity != 1)
            throw new IllegalArgumentException("Polarity must be 0 or 1: " + polarity);
    }

    public static LeveledNode of(int depth, String name) {
        return new LeveledNode(depth, name, 0);
    }

    /** True if the other node carries the same vertex name, regardless of depth or polarity. */
    public boolean sameName(LeveledNode other) {
        return name.equals(other.name);
    }

    @Override
    public int compareTo(LeveledNode o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return "(" + depth + ", " + name + (polarity == 0 ? "" : ", -") + ")";
    }
}
