package com.biomech.cfpg.graph;

import java.util.*;

/**
 * Dense, canonical numbering of the nodes of one pre-CFPG.
 *
 * Index {@code i} is the i-th node in {@link LeveledNode} order, so bit
 * positions in a {@link TagSet} sort the same way the nodes do.
 */
public final class NodeIndex {
    private final LeveledNode[] nodes;
    private final Map<LeveledNode, Integer> positions;

    public NodeIndex(Collection<LeveledNode> members) {
        this.nodes = new TreeSet<>(members).toArray(new LeveledNode[0]);
        Map<LeveledNode, Integer> pos = new HashMap<>(nodes.length * 2);
        for (int i = 0; i < nodes.length; i++)
            pos.put(nodes[i], i);
        this.positions = pos;
    }

    public int size() {
        return nodes.length;
    }

    public LeveledNode node(int i) {
        return nodes[i];
    }

    /** Position of the node, or -1 if it is not indexed. */
    public int indexOf(LeveledNode node) {
        Integer i = positions.get(node);
        return i == null ? -1 : i;
    }

    public boolean contains(LeveledNode node) {
        return positions.containsKey(node);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof NodeIndex other && Arrays.equals(nodes, other.nodes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(nodes);
    }
}
