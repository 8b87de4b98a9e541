package org.calista.chainhal.learn;

import org.calista.chainhal.text.Sentence;

import java.util.Collection;

/**
 * Learner: feeds sentences into the brain.
 */
public interface Learner {

    /**
     * Annotates free text and learns every sentence found in it.
     *
     * @return how many sentences were long enough to be learned
     */
    int learnFromText(String text);

    /**
     * Learns already annotated sentences, in order.
     *
     * @return how many sentences were long enough to be learned
     */
    int learnSentences(Collection<Sentence> sentences);
}
