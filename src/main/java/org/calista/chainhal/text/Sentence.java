package org.calista.chainhal.text;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered sequence of words.
 *
 * <p>{@link #EMPTY} is the explicit "nothing to say" value returned by generation.</p>
 */
public final class Sentence implements Iterable<Word> {

    public static final Sentence EMPTY = new Sentence(List.of());

    private final List<Word> words;

    private Sentence(List<Word> words) {
        this.words = words;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Sentence of(Collection<Word> words) {
        Objects.requireNonNull(words, "words");
        if (words.isEmpty()) return EMPTY;
        for (Word w : words) Objects.requireNonNull(w, "word");
        return new Sentence(List.copyOf(words));
    }

    public static Sentence of(Word... words) {
        return of(List.of(words));
    }

    @JsonValue
    public List<Word> asList() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public Word get(int i) {
        return words.get(i);
    }

    public boolean contains(Word w) {
        return words.contains(w);
    }

    /** Distinct words of the sentence. */
    public WordSet words() {
        return new WordSet(words);
    }

    /** Distinct common and proper nouns. */
    public WordSet nouns() {
        WordSet out = new WordSet();
        for (Word w : words) if (w.isNoun()) out.add(w);
        return out;
    }

    public WordSet properNouns() {
        WordSet out = new WordSet();
        for (Word w : words) if (w.isProperNoun()) out.add(w);
        return out;
    }

    /**
     * Drops a trailing period, emulating chat style where final periods are elided.
     * A period preceded by another period is kept (ellipsis). Other terminators are kept.
     */
    public Sentence trimPeriod() {
        int n = words.size();
        if (n == 0) return this;
        if (!words.get(n - 1).equals(Word.PERIOD)) return this;
        if (n > 1 && words.get(n - 2).equals(Word.PERIOD)) return this;
        return n == 1 ? EMPTY : new Sentence(words.subList(0, n - 1));
    }

    /** Space-joined text with the usual punctuation spacing rules. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(words.size() * 6);
        for (int i = 0; i < words.size(); i++) {
            Word w = words.get(i);
            if (i > 0 && needsSpace(words.get(i - 1), w)) sb.append(' ');
            sb.append(w.text());
        }
        return sb.toString();
    }

    /** {@code text/TAG} notation, useful for debugging the annotator. */
    public String toTaggedString() {
        StringBuilder sb = new StringBuilder(words.size() * 10);
        for (int i = 0; i < words.size(); i++) {
            if (i > 0) sb.append(' ');
            Word w = words.get(i);
            sb.append(w.text()).append('/').append(w.tag());
        }
        return sb.toString();
    }

    private static boolean needsSpace(Word prev, Word w) {
        switch (w.tag()) {
            case ".":
            case ",":
            case ":":
            case ")":
            case "''":
                return false;
            default:
                break;
        }
        switch (prev.tag()) {
            case "(":
            case "``":
            case "$":
                return false;
            default:
                break;
        }
        return !w.text().contains("'");
    }

    @Override
    public Iterator<Word> iterator() {
        return words.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sentence)) return false;
        return words.equals(((Sentence) o).words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }
}
