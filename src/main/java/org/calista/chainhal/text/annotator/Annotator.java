package org.calista.chainhal.text.annotator;

import org.calista.chainhal.text.Sentence;

import java.util.List;

/**
 * Turns free text into part-of-speech tagged sentences.
 *
 * <p>
 * Implementations must lower-case and NFC-normalize consistently with {@link
 * org.calista.chainhal.text.Word#of}, otherwise words learned from training text will not match
 * the keywords of later chat input.
 * </p>
 */
public interface Annotator {

    /**
     * @return the sentences of {@code text} in order; empty for blank input
     */
    List<Sentence> annotate(String text);
}
