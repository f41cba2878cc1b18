package com.shapetea.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Persistent insertion-ordered map backed by a hash array mapped trie. An update copies only
 * the trie nodes on the path to the changed key, so maps handed to forked paths share the rest.
 *
 * Iteration follows insertion order: each entry keeps the sequence number it was first put
 * with, and the ordered view is built on first use and cached per instance.
 */
public final class PMap<K, V> {

    private static final int BITS = 5;
    private static final int MASK = (1 << BITS) - 1;

    private final Node<K, V> root;
    private final int size;
    private final long nextSeq;
    private volatile Map<K, V> ordered;

    private PMap(Node<K, V> root, int size, long nextSeq) {
        this.root = root;
        this.size = size;
        this.nextSeq = nextSeq;
    }

    public static <K, V> PMap<K, V> empty() {
        return new PMap<>(null, 0, 0L);
    }

    public static <K, V> PMap<K, V> of(Map<K, V> source) {
        PMap<K, V> out = empty();
        for (Map.Entry<K, V> e : source.entrySet()) {
            out = out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    public PMap<K, V> put(K key, V value) {
        Objects.requireNonNull(key, "key");
        int hash = spread(key);
        Leaf<K, V> existing = lookup(key);
        if (existing != null) {
            if (Objects.equals(existing.value, value)) return this;
            return new PMap<>(root.put(new Leaf<>(key, value, hash, existing.seq), 0), size, nextSeq);
        }
        Leaf<K, V> leaf = new Leaf<>(key, value, hash, nextSeq);
        Node<K, V> next = root == null ? leaf : root.put(leaf, 0);
        return new PMap<>(next, size + 1, nextSeq + 1);
    }

    public PMap<K, V> remove(K key) {
        if (key == null || lookup(key) == null) return this;
        return new PMap<>(root.remove(key, spread(key), 0), size - 1, nextSeq);
    }

    public PMap<K, V> putAll(Map<K, V> entries) {
        PMap<K, V> out = this;
        for (Map.Entry<K, V> e : entries.entrySet()) {
            out = out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    /** Rebuilds every entry through {@code fn}, which may return a new key and value. */
    public <K2, V2> PMap<K2, V2> mapEntries(BiFunction<K, V, Map.Entry<K2, V2>> fn) {
        PMap<K2, V2> out = empty();
        for (Map.Entry<K, V> e : ordered().entrySet()) {
            Map.Entry<K2, V2> n = fn.apply(e.getKey(), e.getValue());
            out = out.put(n.getKey(), n.getValue());
        }
        return out;
    }

    public V get(K key) {
        Leaf<K, V> leaf = lookup(key);
        return leaf == null ? null : leaf.value;
    }

    public boolean containsKey(K key) {
        return lookup(key) != null;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public Set<K> keySet() {
        return ordered().keySet();
    }

    public Set<Map.Entry<K, V>> entrySet() {
        return ordered().entrySet();
    }

    public Map<K, V> asMap() {
        return ordered();
    }

    private Leaf<K, V> lookup(Object key) {
        if (root == null || key == null) return null;
        return root.find(key, spread(key), 0);
    }

    private Map<K, V> ordered() {
        Map<K, V> view = ordered;
        if (view == null) {
            List<Leaf<K, V>> leaves = new ArrayList<>(size);
            if (root != null) root.collect(leaves);
            leaves.sort(Comparator.comparingLong(leaf -> leaf.seq));
            Map<K, V> map = new LinkedHashMap<>();
            for (Leaf<K, V> leaf : leaves) {
                map.put(leaf.key, leaf.value);
            }
            view = Collections.unmodifiableMap(map);
            ordered = view;
        }
        return view;
    }

    private static int spread(Object key) {
        int h = key.hashCode();
        return h ^ (h >>> 16);
    }

    private static int bit(int hash, int shift) {
        return 1 << ((hash >>> shift) & MASK);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PMap)) return false;
        PMap<?, ?> other = (PMap<?, ?>) o;
        if (size != other.size) return false;
        if (root == other.root) return true;
        List<Leaf<K, V>> leaves = new ArrayList<>(size);
        root.collect(leaves);
        for (Leaf<K, V> leaf : leaves) {
            Leaf<?, ?> match = other.lookup(leaf.key);
            if (match == null || !Objects.equals(leaf.value, match.value)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        if (root == null) return h;
        List<Leaf<K, V>> leaves = new ArrayList<>(size);
        root.collect(leaves);
        for (Leaf<K, V> leaf : leaves) {
            h += leaf.key.hashCode() ^ Objects.hashCode(leaf.value);
        }
        return h;
    }

    @Override
    public String toString() {
        return ordered().toString();
    }

    // ===================== trie nodes =====================

    private abstract static class Node<K, V> {
        abstract Leaf<K, V> find(Object key, int hash, int shift);

        /** Inserts or replaces {@code leaf}, matched by key. */
        abstract Node<K, V> put(Leaf<K, V> leaf, int shift);

        /** Null when nothing is left. The key must be present. */
        abstract Node<K, V> remove(Object key, int hash, int shift);

        abstract void collect(List<Leaf<K, V>> out);
    }

    private static final class Leaf<K, V> extends Node<K, V> {
        final K key;
        final V value;
        final int hash;
        final long seq;

        Leaf(K key, V value, int hash, long seq) {
            this.key = key;
            this.value = value;
            this.hash = hash;
            this.seq = seq;
        }

        @Override
        Leaf<K, V> find(Object k, int h, int shift) {
            return h == hash && key.equals(k) ? this : null;
        }

        @Override
        Node<K, V> put(Leaf<K, V> leaf, int shift) {
            if (leaf.hash == hash && key.equals(leaf.key)) return leaf;
            if (leaf.hash == hash) {
                List<Leaf<K, V>> both = new ArrayList<>(2);
                both.add(this);
                both.add(leaf);
                return new Collision<>(hash, both);
            }
            return new Branch<>(bit(hash, shift), List.<Node<K, V>>of(this)).put(leaf, shift);
        }

        @Override
        Node<K, V> remove(Object k, int h, int shift) {
            return null;
        }

        @Override
        void collect(List<Leaf<K, V>> out) {
            out.add(this);
        }
    }

    /** Leaves whose keys share the full hash. */
    private static final class Collision<K, V> extends Node<K, V> {
        final int hash;
        final List<Leaf<K, V>> leaves;

        Collision(int hash, List<Leaf<K, V>> leaves) {
            this.hash = hash;
            this.leaves = leaves;
        }

        @Override
        Leaf<K, V> find(Object k, int h, int shift) {
            if (h != hash) return null;
            for (Leaf<K, V> leaf : leaves) {
                if (leaf.key.equals(k)) return leaf;
            }
            return null;
        }

        @Override
        Node<K, V> put(Leaf<K, V> leaf, int shift) {
            if (leaf.hash != hash) {
                return new Branch<>(bit(hash, shift), List.<Node<K, V>>of(this)).put(leaf, shift);
            }
            List<Leaf<K, V>> next = new ArrayList<>(leaves);
            for (int i = 0; i < next.size(); i++) {
                if (next.get(i).key.equals(leaf.key)) {
                    next.set(i, leaf);
                    return new Collision<>(hash, next);
                }
            }
            next.add(leaf);
            return new Collision<>(hash, next);
        }

        @Override
        Node<K, V> remove(Object k, int h, int shift) {
            List<Leaf<K, V>> next = new ArrayList<>(leaves);
            next.removeIf(leaf -> leaf.key.equals(k));
            if (next.isEmpty()) return null;
            if (next.size() == 1) return next.get(0);
            return new Collision<>(hash, next);
        }

        @Override
        void collect(List<Leaf<K, V>> out) {
            out.addAll(leaves);
        }
    }

    private static final class Branch<K, V> extends Node<K, V> {
        final int bitmap;
        final List<Node<K, V>> children;

        Branch(int bitmap, List<Node<K, V>> children) {
            this.bitmap = bitmap;
            this.children = children;
        }

        private int index(int bit) {
            return Integer.bitCount(bitmap & (bit - 1));
        }

        @Override
        Leaf<K, V> find(Object k, int h, int shift) {
            int bit = bit(h, shift);
            if ((bitmap & bit) == 0) return null;
            return children.get(index(bit)).find(k, h, shift + BITS);
        }

        @Override
        Node<K, V> put(Leaf<K, V> leaf, int shift) {
            int bit = bit(leaf.hash, shift);
            int idx = index(bit);
            List<Node<K, V>> next = new ArrayList<>(children);
            if ((bitmap & bit) == 0) {
                next.add(idx, leaf);
                return new Branch<>(bitmap | bit, next);
            }
            next.set(idx, children.get(idx).put(leaf, shift + BITS));
            return new Branch<>(bitmap, next);
        }

        @Override
        Node<K, V> remove(Object k, int h, int shift) {
            int bit = bit(h, shift);
            int idx = index(bit);
            Node<K, V> child = children.get(idx).remove(k, h, shift + BITS);
            List<Node<K, V>> next = new ArrayList<>(children);
            if (child != null) {
                next.set(idx, child);
                return new Branch<>(bitmap, next);
            }
            next.remove(idx);
            return next.isEmpty() ? null : new Branch<>(bitmap & ~bit, next);
        }

        @Override
        void collect(List<Leaf<K, V>> out) {
            for (Node<K, V> child : children) {
                child.collect(out);
            }
        }
    }
}
