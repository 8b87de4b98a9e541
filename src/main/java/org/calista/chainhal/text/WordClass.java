package org.calista.chainhal.text;

/**
 * Closed classification of part-of-speech tags.
 *
 * <p>Tags follow the Penn Treebank convention the annotator emits. Everything that is not
 * a noun or a sentence terminator falls into {@link #OTHER}.</p>
 */
public enum WordClass {
    COMMON_NOUN,
    PROPER_NOUN,
    TERMINATOR,
    OTHER;

    public static WordClass of(String tag) {
        if (tag == null) return OTHER;
        switch (tag) {
            case "NN":
            case "NNS":
                return COMMON_NOUN;
            case "NNP":
            case "NNPS":
                return PROPER_NOUN;
            case ".":
                return TERMINATOR;
            default:
                return OTHER;
        }
    }

    public boolean isNoun() {
        return this == COMMON_NOUN || this == PROPER_NOUN;
    }
}
