package org.calista.chainhal.brain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Set of distinct chains with uniform random selection.
 * Same sampling rules as {@link org.calista.chainhal.text.WordSet}.
 */
public final class ChainSet implements Iterable<Chain> {

    private final LinkedHashSet<Chain> chains = new LinkedHashSet<>();

    public boolean add(Chain c) {
        return chains.add(Objects.requireNonNull(c, "c"));
    }

    public boolean contains(Chain c) {
        return chains.contains(c);
    }

    public int size() {
        return chains.size();
    }

    public boolean isEmpty() {
        return chains.isEmpty();
    }

    public ChainSet union(ChainSet... others) {
        ChainSet out = new ChainSet();
        out.chains.addAll(chains);
        for (ChainSet o : others) {
            if (o != null) out.chains.addAll(o.chains);
        }
        return out;
    }

    /**
     * @throws IllegalStateException if the set is empty
     */
    public Chain chooseOne(Random rnd) {
        if (chains.isEmpty()) throw new IllegalStateException("chooseOne on empty ChainSet");
        int ofs = rnd.nextInt(chains.size());
        int i = 0;
        for (Chain c : chains) {
            if (i++ == ofs) return c;
        }
        throw new IllegalStateException("chooseOne index out of range: " + ofs);
    }

    public List<Chain> chooseRandom(int n, Random rnd) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        ArrayList<Chain> pool = new ArrayList<>(chains);
        int k = Math.min(n, pool.size());
        for (int i = 0; i < k; i++) {
            int j = i + rnd.nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
        }
        return new ArrayList<>(pool.subList(0, k));
    }

    public Set<Chain> asSet() {
        return Collections.unmodifiableSet(chains);
    }

    @Override
    public Iterator<Chain> iterator() {
        return Collections.unmodifiableSet(chains).iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainSet)) return false;
        return chains.equals(((ChainSet) o).chains);
    }

    @Override
    public int hashCode() {
        return chains.hashCode();
    }

    @Override
    public String toString() {
        return chains.toString();
    }
}
