package com.biomech.cfpg.graph;

import java.util.*;

/**
 * Immutable set of {@link LeveledNode} anchors, stored as a bit set over a
 * {@link NodeIndex}.
 *
 * Bits are packed 64 per long. Equality, hashing and ordering depend only on
 * the members, so a tag set is a canonical key for split nodes: two copies
 * of a node with the same tag set are the same copy.
 */
public final class TagSet implements Comparable<TagSet>, Iterable<LeveledNode> {
    private final NodeIndex index;
    private final long[] words;
    private final int size;
    private final int hash;

    private TagSet(NodeIndex index, long[] words) {
        this.index = index;
        this.words = words;
        int count = 0;
        for (long w : words)
            count += Long.bitCount(w);
        this.size = count;
        this.hash = 31 * index.hashCode() + Arrays.hashCode(words);
    }

    public static TagSet empty(NodeIndex index) {
        return new TagSet(index, new long[(index.size() + 63) / 64]);
    }

    /** Builds a tag set; members that are not indexed are ignored. */
    public static TagSet of(NodeIndex index, Collection<LeveledNode> members) {
        long[] w = new long[(index.size() + 63) / 64];
        for (LeveledNode n : members) {
            int i = index.indexOf(n);
            if (i >= 0)
                w[i >> 6] |= (1L << i);
        }
        return new TagSet(index, w);
    }

    public NodeIndex index() {
        return index;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(LeveledNode node) {
        int i = index.indexOf(node);
        return i >= 0 && (words[i >> 6] & (1L << i)) != 0;
    }

    public boolean containsAll(Collection<LeveledNode> nodes) {
        for (LeveledNode n : nodes)
            if (!contains(n))
                return false;
        return true;
    }

    /** True if every member of this set is also in {@code other}. */
    public boolean isSubsetOf(TagSet other) {
        requireSameIndex(other);
        for (int i = 0; i < words.length; i++)
            if ((words[i] & ~other.words[i]) != 0)
                return false;
        return true;
    }

    public TagSet intersect(TagSet other) {
        requireSameIndex(other);
        long[] w = new long[words.length];
        for (int i = 0; i < w.length; i++)
            w[i] = words[i] & other.words[i];
        return new TagSet(index, w);
    }

    /** Members in canonical node order. */
    public List<LeveledNode> members() {
        List<LeveledNode> out = new ArrayList<>(size);
        for (LeveledNode n : this)
            out.add(n);
        return out;
    }

    @Override
    public Iterator<LeveledNode> iterator() {
        return new Iterator<>() {
            private int next = nextSetBit(0);

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public LeveledNode next() {
                if (next < 0)
                    throw new NoSuchElementException();
                LeveledNode n = index.node(next);
                next = nextSetBit(next + 1);
                return n;
            }
        };
    }

    private int nextSetBit(int from) {
        int wi = from >> 6;
        if (wi >= words.length)
            return -1;
        long w = words[wi] & (-1L << from);
        while (true) {
            if (w != 0)
                return (wi << 6) + Long.numberOfTrailingZeros(w);
            if (++wi == words.length)
                return -1;
            w = words[wi];
        }
    }

    private void requireSameIndex(TagSet other) {
        if (index != other.index && !index.equals(other.index))
            throw new IllegalArgumentException("Tag sets are indexed over different node sets");
    }

    /**
     * Orders by the lowest node at which the two sets differ; the set that
     * contains that node sorts first.
     */
    @Override
    public int compareTo(TagSet o) {
        int n = Math.max(words.length, o.words.length);
        for (int i = 0; i < n; i++) {
            long a = i < words.length ? words[i] : 0L;
            long b = i < o.words.length ? o.words[i] : 0L;
            long diff = a ^ b;
            if (diff != 0)
                return (a & Long.lowestOneBit(diff)) != 0 ? -1 : 1;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TagSet other))
            return false;
        return hash == other.hash && Arrays.equals(words, other.words) && index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return members().toString();
    }
}
