package org.calista.chainhal.think;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;
import org.calista.chainhal.text.WordSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * ReplyComposer — picks a reply for one user turn.
 *
 * <p>
 * Keywords are the proper nouns of the input when there are at least two of them, otherwise
 * all its nouns. One candidate sentence is generated per keyword and the candidate with the
 * highest overlap score wins; on a tie the earlier candidate is kept.
 * </p>
 *
 * <p>Score per word of a candidate (additive):</p>
 * <ul>
 *   <li>+2 proper noun</li>
 *   <li>+3 noun of the input</li>
 *   <li>+4 proper noun of the input (on top of the +3, so 9 with the first rule)</li>
 *   <li>+1 any word of the input</li>
 * </ul>
 */
public final class ReplyComposer {

    private static final Logger log = LogManager.getLogger(ReplyComposer.class);

    static final int PROPER_NOUN_POINTS = 2;
    static final int INPUT_NOUN_POINTS = 3;
    static final int INPUT_PROPER_NOUN_POINTS = 4;
    static final int INPUT_WORD_POINTS = 1;

    private final TextGenerator generator;

    public ReplyComposer(TextGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    public Sentence makeReply(Sentence... input) {
        return makeReply(Arrays.asList(input));
    }

    /**
     * @return the best-scoring generated sentence, or {@link Sentence#EMPTY} if the input has no
     * nouns or none of them produced a sentence
     */
    public Sentence makeReply(Collection<Sentence> input) {
        Objects.requireNonNull(input, "input");

        WordSet allWords = new WordSet();
        WordSet nouns = new WordSet();
        WordSet properNouns = new WordSet();
        for (Sentence s : input) {
            allWords = allWords.union(s.words());
            nouns = nouns.union(s.nouns());
            properNouns = properNouns.union(s.properNouns());
        }

        WordSet keywords = properNouns.size() >= 2 ? properNouns : nouns;
        if (keywords.isEmpty()) {
            log.debug("no keywords in input; nothing to say");
            return Sentence.EMPTY;
        }

        log.debug("building replies with keywords: {}", keywords);

        List<Sentence> candidates = new ArrayList<>(keywords.size());
        for (Word kw : keywords) {
            Sentence s = generator.makeSentenceWithKeyword(kw);
            if (!s.isEmpty()) candidates.add(s);
        }

        if (candidates.isEmpty()) {
            log.debug("no sentences were generated");
            return Sentence.EMPTY;
        }
        if (candidates.size() == 1) {
            log.debug("only one sentence generated, so it wins by default");
            return candidates.get(0);
        }

        Sentence best = Sentence.EMPTY;
        int bestScore = -1;
        for (Sentence s : candidates) {
            int score = score(s, allWords, nouns, properNouns);
            if (score > bestScore) {
                bestScore = score;
                best = s;
                log.debug("sentence \"{}\" scored {}, the new winner", s, score);
            } else {
                log.debug("sentence \"{}\" scored {}, not enough to beat the winner", s, score);
            }
        }
        return best;
    }

    static int score(Sentence candidate, WordSet allWords, WordSet nouns, WordSet properNouns) {
        int score = 0;
        for (Word w : candidate) {
            if (w.isProperNoun()) score += PROPER_NOUN_POINTS;
            if (nouns.contains(w)) score += INPUT_NOUN_POINTS;
            if (properNouns.contains(w)) score += INPUT_PROPER_NOUN_POINTS;
            if (allWords.contains(w)) score += INPUT_WORD_POINTS;
        }
        return score;
    }
}
