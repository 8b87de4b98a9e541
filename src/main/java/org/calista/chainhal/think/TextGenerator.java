package org.calista.chainhal.think;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;

/**
 * Builds whole sentences around a keyword.
 *
 * <p>Every method returns {@link Sentence#EMPTY} when no sentence can be built; that is a normal
 * outcome, not an error.</p>
 */
public interface TextGenerator {

    /** A sentence containing {@code w} anywhere. */
    Sentence makeSentenceWithKeyword(Word w);

    /** A sentence whose first word is {@code w}. */
    Sentence makeSentenceStartingKeyword(Word w);

    /** A sentence whose last word is {@code w}. */
    Sentence makeSentenceEndingKeyword(Word w);

    /** A sentence ending in a question mark; used to open or change the subject. */
    default Sentence makeQuestion() {
        return makeSentenceEndingKeyword(Word.QUESTION_MARK);
    }

    /**
     * A sentence opened by the question-mark word, used by the chat layer as a "because..."
     * style answer to a why-question.
     */
    default Sentence makeReason() {
        return makeSentenceStartingKeyword(Word.QUESTION_MARK);
    }
}
