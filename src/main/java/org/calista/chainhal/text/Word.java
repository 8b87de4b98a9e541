package org.calista.chainhal.text;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One annotated token: a part-of-speech tag plus the token text.
 *
 * <p>
 * Text is NFC-normalized and lower-cased at construction, so two words read from differently
 * cased or composed sources compare equal. Equality and hashing are by value.
 * </p>
 *
 * <p>JSON form is the pair {@code [text, tag]}.</p>
 */
public final class Word {

    public static final Word PERIOD = of(".", ".");
    public static final Word QUESTION_MARK = of(".", "?");
    public static final Word EXCLAMATION_MARK = of(".", "!");

    /** Placeholder for unresolvable references (e.g. a bad index in a snapshot). */
    public static final Word INVALID = new Word("", "");

    private final String tag;
    private final String text;
    private final WordClass wordClass;

    private Word(String tag, String text) {
        this.tag = tag;
        this.text = text;
        this.wordClass = WordClass.of(tag);
    }

    public static Word of(String tag, String text) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(text, "text");
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        return new Word(tag, normalized);
    }

    /**
     * Rebuilds a word exactly as stored, without re-normalizing. Used by decoders that read
     * words which were normalized when first learned.
     */
    public static Word raw(String tag, String text) {
        return new Word(tag == null ? "" : tag, text == null ? "" : text);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static Word fromPair(List<String> pair) {
        if (pair == null || pair.size() != 2) {
            throw new IllegalArgumentException("word must be a [text, tag] pair, got " + pair);
        }
        return of(nz(pair.get(1)), nz(pair.get(0)));
    }

    @JsonValue
    List<String> toPair() {
        return List.of(text, tag);
    }

    public String tag() { return tag; }

    public String text() { return text; }

    public WordClass wordClass() { return wordClass; }

    public boolean isNoun() {
        return wordClass.isNoun();
    }

    public boolean isProperNoun() {
        return wordClass == WordClass.PROPER_NOUN;
    }

    public boolean isHashtag() {
        return isNoun() && text.startsWith("#");
    }

    public boolean isAtMention() {
        return isNoun() && text.startsWith("@");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Word)) return false;
        Word w = (Word) o;
        return tag.equals(w.tag) && text.equals(w.text);
    }

    @Override
    public int hashCode() {
        return 31 * tag.hashCode() + text.hashCode();
    }

    @Override
    public String toString() {
        return text + "/" + tag;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
