package org.calista.chainhal.learn.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.brain.Brain;
import org.calista.chainhal.brain.Chain;
import org.calista.chainhal.learn.Learner;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

public final class BrainLearner implements Learner {
    private static final Logger log = LogManager.getLogger(BrainLearner.class);

    private final Brain brain;
    private final Annotator annotator;
    private final boolean trimPeriods;

    /**
     * @param trimPeriods learn sentences without their trailing period, which keeps the
     *                    casual chat style in generated replies
     */
    public BrainLearner(Brain brain, Annotator annotator, boolean trimPeriods) {
        this.brain = Objects.requireNonNull(brain, "brain");
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.trimPeriods = trimPeriods;
    }

    @Override
    public int learnFromText(String text) {
        if (text == null || text.isBlank()) return 0;
        List<Sentence> ss = annotator.annotate(text);
        return learnSentences(ss);
    }

    @Override
    public int learnSentences(Collection<Sentence> sentences) {
        Objects.requireNonNull(sentences, "sentences");
        int learned = 0;
        for (Sentence s : sentences) {
            Sentence x = trimPeriods ? s.trimPeriod() : s;
            if (x.size() < Chain.LENGTH) {
                if (log.isTraceEnabled()) log.trace("too short to learn: {}", x);
                continue;
            }
            brain.addSentence(x);
            learned++;
        }
        if (log.isDebugEnabled()) {
            log.debug("BrainLearner: learned {} of {} sentences (chains now {})",
                    learned, sentences.size(), brain.chainCount());
        }
        return learned;
    }
}
