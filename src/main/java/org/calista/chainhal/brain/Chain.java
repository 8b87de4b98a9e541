package org.calista.chainhal.brain;

import org.calista.chainhal.text.Word;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Chain — fixed-length ordered tuple of {@link #LENGTH} words, the unit the brain learns.
 *
 * <p>Immutable; the shift operations return the shifted value.</p>
 */
public final class Chain {

    public static final int LENGTH = 4;

    private final Word[] words;
    private final int hash;

    private Chain(Word[] words) {
        this.words = words;
        this.hash = Arrays.hashCode(words);
    }

    public static Chain of(List<Word> words) {
        Objects.requireNonNull(words, "words");
        if (words.size() != LENGTH) {
            throw new IllegalArgumentException("chain needs " + LENGTH + " words, got " + words.size());
        }
        Word[] ws = new Word[LENGTH];
        for (int i = 0; i < LENGTH; i++) ws[i] = Objects.requireNonNull(words.get(i), "word");
        return new Chain(ws);
    }

    public static Chain of(Word... words) {
        return of(Arrays.asList(words));
    }

    public Word get(int i) {
        return words[i];
    }

    public Word first() {
        return words[0];
    }

    public Word last() {
        return words[LENGTH - 1];
    }

    public boolean contains(Word w) {
        for (Word x : words) if (x.equals(w)) return true;
        return false;
    }

    public List<Word> words() {
        return List.of(words);
    }

    /** New word in first position, the rest moved one step right, the last word dropped. */
    public Chain shiftLeft(Word w) {
        Word[] out = new Word[LENGTH];
        out[0] = Objects.requireNonNull(w, "w");
        System.arraycopy(words, 0, out, 1, LENGTH - 1);
        return new Chain(out);
    }

    /** First word dropped, the rest moved one step left, new word in last position. */
    public Chain shiftRight(Word w) {
        Word[] out = new Word[LENGTH];
        System.arraycopy(words, 1, out, 0, LENGTH - 1);
        out[LENGTH - 1] = Objects.requireNonNull(w, "w");
        return new Chain(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chain)) return false;
        Chain c = (Chain) o;
        return hash == c.hash && Arrays.equals(words, c.words);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(words);
    }
}
