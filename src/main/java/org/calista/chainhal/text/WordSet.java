package org.calista.chainhal.text;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Set of distinct words with uniform random selection.
 *
 * <p>
 * Membership keeps insertion order so that a seeded {@link Random} reproduces the same picks.
 * Random selection draws an explicit index into a materialized list of the members; it never
 * relies on hash iteration order.
 * </p>
 *
 * <p>Not thread-safe; the owning structure guards it.</p>
 */
public final class WordSet implements Iterable<Word> {

    private final LinkedHashSet<Word> words;

    public WordSet() {
        this.words = new LinkedHashSet<>();
    }

    public WordSet(Collection<Word> init) {
        this.words = new LinkedHashSet<>(Objects.requireNonNull(init, "init"));
    }

    public static WordSet of(Word... ws) {
        WordSet s = new WordSet();
        for (Word w : ws) s.add(w);
        return s;
    }

    public boolean add(Word w) {
        return words.add(Objects.requireNonNull(w, "w"));
    }

    public boolean contains(Word w) {
        return words.contains(w);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    /** New set holding the words of the receiver and all the given sets. */
    public WordSet union(WordSet... others) {
        WordSet out = new WordSet(words);
        for (WordSet o : others) {
            if (o != null) out.words.addAll(o.words);
        }
        return out;
    }

    public WordSet nouns() {
        WordSet out = new WordSet();
        for (Word w : words) if (w.isNoun()) out.words.add(w);
        return out;
    }

    public WordSet properNouns() {
        WordSet out = new WordSet();
        for (Word w : words) if (w.isProperNoun()) out.words.add(w);
        return out;
    }

    /**
     * Picks one member uniformly at random.
     *
     * @throws IllegalStateException if the set is empty
     */
    public Word chooseOne(Random rnd) {
        if (words.isEmpty()) throw new IllegalStateException("chooseOne on empty WordSet");
        int ofs = rnd.nextInt(words.size());
        int i = 0;
        for (Word w : words) {
            if (i++ == ofs) return w;
        }
        throw new IllegalStateException("chooseOne index out of range: " + ofs);
    }

    /** Up to {@code n} distinct members, drawn without replacement. */
    public List<Word> chooseRandom(int n, Random rnd) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        ArrayList<Word> pool = new ArrayList<>(words);
        int k = Math.min(n, pool.size());
        // partial Fisher-Yates: the first k slots end up holding the sample
        for (int i = 0; i < k; i++) {
            int j = i + rnd.nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
        }
        return new ArrayList<>(pool.subList(0, k));
    }

    public Set<Word> asSet() {
        return Collections.unmodifiableSet(words);
    }

    @Override
    public Iterator<Word> iterator() {
        return Collections.unmodifiableSet(words).iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WordSet)) return false;
        return words.equals(((WordSet) o).words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
