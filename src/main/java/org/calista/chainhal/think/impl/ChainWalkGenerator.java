package org.calista.chainhal.think.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.brain.Brain;
import org.calista.chainhal.brain.Chain;
import org.calista.chainhal.brain.ChainSet;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;
import org.calista.chainhal.text.WordSet;
import org.calista.chainhal.think.TextGenerator;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Random;

/**
 * ChainWalkGenerator — bidirectional random walk over the brain's chains.
 *
 * <p>
 * A seed chain holding the keyword is chosen, then words are prepended from the words seen
 * before the current chain until a start chain is reached, and appended from the words seen
 * after it until an end chain is reached. At a boundary chain that could still be extended the
 * walk continues with probability {@code continueChance / 256}.
 * </p>
 *
 * <p>
 * The walk has no length cap: it stops only at boundaries, and each boundary it passes is an
 * independent trial, so long sentences become geometrically unlikely.
 * </p>
 *
 * <p>Thread-safe as long as the {@link Random} is; the brain's read lock is held per sentence.</p>
 */
public final class ChainWalkGenerator implements TextGenerator {

    private static final Logger log = LogManager.getLogger(ChainWalkGenerator.class);

    public static final int DEFAULT_CONTINUE_CHANCE = 128;

    private final Brain brain;
    private final Random rnd;
    private final int continueChance;

    public ChainWalkGenerator(Brain brain) {
        this(brain, new Random(), DEFAULT_CONTINUE_CHANCE);
    }

    public ChainWalkGenerator(Brain brain, Random rnd) {
        this(brain, rnd, DEFAULT_CONTINUE_CHANCE);
    }

    /**
     * @param continueChance times out of 256 a walk continues past a boundary it could stop at
     */
    public ChainWalkGenerator(Brain brain, Random rnd, int continueChance) {
        this.brain = Objects.requireNonNull(brain, "brain");
        this.rnd = Objects.requireNonNull(rnd, "rnd");
        if (continueChance < 0 || continueChance > 255) {
            throw new IllegalArgumentException("continueChance must be in [0..255]");
        }
        this.continueChance = continueChance;
    }

    @Override
    public Sentence makeSentenceWithKeyword(Word w) {
        return makeSentence(w, false, false);
    }

    @Override
    public Sentence makeSentenceStartingKeyword(Word w) {
        return makeSentence(w, true, false);
    }

    @Override
    public Sentence makeSentenceEndingKeyword(Word w) {
        return makeSentence(w, false, true);
    }

    @Override
    public Sentence makeQuestion() {
        log.debug("building a question sentence");
        return makeSentenceEndingKeyword(Word.QUESTION_MARK);
    }

    @Override
    public Sentence makeReason() {
        log.debug("building a reason sentence");
        return makeSentenceStartingKeyword(Word.QUESTION_MARK);
    }

    private Sentence makeSentence(Word w, boolean mustBeStart, boolean mustBeEnd) {
        Objects.requireNonNull(w, "w");
        return brain.read(v -> walk(v, w, mustBeStart, mustBeEnd));
    }

    private Sentence walk(Brain.View v, Word w, boolean mustBeStart, boolean mustBeEnd) {
        log.debug("building a sentence for keyword {}", w);

        ChainSet candidates = v.chainsContaining(w);
        if (candidates.isEmpty()) {
            log.debug("unknown keyword {}", w);
            return Sentence.EMPTY;
        }

        Chain seed = null;
        if (mustBeEnd) {
            for (Chain c : candidates) {
                if (c.last().equals(w) && v.isEnd(c)) {
                    seed = c;
                    break;
                }
            }
            if (seed == null) {
                log.debug("no end chains ending with {}", w);
                return Sentence.EMPTY;
            }
        } else if (mustBeStart) {
            for (Chain c : candidates) {
                if (c.first().equals(w) && v.isStart(c)) {
                    seed = c;
                    break;
                }
            }
            if (seed == null) {
                log.debug("no start chains beginning with {}", w);
                return Sentence.EMPTY;
            }
        } else {
            seed = candidates.chooseOne(rnd);
        }

        log.debug("starting chain is {}", seed);

        // collected in walk order, i.e. reversed
        ArrayList<Word> before = new ArrayList<>();
        Chain current = seed;
        while (true) {
            WordSet prev = v.wordsBefore(current);
            if (v.isStart(current) && (prev.isEmpty() || !continues())) break;
            if (prev.isEmpty()) {
                throw new IllegalStateException("chain " + current + " is not a start chain but has no words before it");
            }
            Word nw = prev.chooseOne(rnd);
            before.add(nw);
            current = current.shiftLeft(nw);
        }
        log.debug("before words are {}", before);

        ArrayList<Word> after = new ArrayList<>();
        current = seed;
        while (true) {
            WordSet next = v.wordsAfter(current);
            if (v.isEnd(current) && (next.isEmpty() || !continues())) break;
            if (next.isEmpty()) {
                throw new IllegalStateException("chain " + current + " is not an end chain but has no words after it");
            }
            Word nw = next.chooseOne(rnd);
            after.add(nw);
            current = current.shiftRight(nw);
        }
        log.debug("after words are {}", after);

        ArrayList<Word> out = new ArrayList<>(before.size() + Chain.LENGTH + after.size());
        for (int i = before.size() - 1; i >= 0; i--) out.add(before.get(i));
        out.addAll(seed.words());
        out.addAll(after);
        return Sentence.of(out);
    }

    /** One Bernoulli trial at a boundary chain. */
    private boolean continues() {
        return rnd.nextInt(256) < continueChance;
    }
}
