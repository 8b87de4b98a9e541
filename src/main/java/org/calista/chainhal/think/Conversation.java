package org.calista.chainhal.think;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.learn.Learner;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;

import java.util.List;
import java.util.Objects;

/**
 * Conversation — the chat turn policy.
 *
 * <ol>
 *   <li>a turn opening with "why" is answered with a reason sentence if one can be made</li>
 *   <li>otherwise a keyword reply ({@link ReplyComposer})</li>
 *   <li>failing that, a question to change the subject</li>
 * </ol>
 * The reply's trailing period is trimmed, then (optionally) the user's sentences are learned.
 */
public final class Conversation {

    private static final Logger log = LogManager.getLogger(Conversation.class);

    public static final Word WHY = Word.of("WRB", "why");

    private final TextGenerator generator;
    private final ReplyComposer composer;
    private final Learner learner;
    private final boolean learnFromUser;

    public Conversation(TextGenerator generator, Learner learner, boolean learnFromUser) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.composer = new ReplyComposer(generator);
        this.learner = Objects.requireNonNull(learner, "learner");
        this.learnFromUser = learnFromUser;
    }

    /** Question used to open a chat; may be empty for a fresh brain. */
    public Sentence opener() {
        return generator.makeQuestion().trimPeriod();
    }

    /**
     * @return the reply, or {@link Sentence#EMPTY} when the brain has nothing to say
     */
    public Sentence respond(List<Sentence> input) {
        Objects.requireNonNull(input, "input");

        Sentence reply = Sentence.EMPTY;
        if (!input.isEmpty() && !input.get(0).isEmpty() && input.get(0).get(0).equals(WHY)) {
            reply = generator.makeReason();
        }
        if (reply.isEmpty()) reply = composer.makeReply(input);
        if (reply.isEmpty()) reply = generator.makeQuestion();

        if (learnFromUser) {
            int learned = learner.learnSentences(input);
            log.debug("learned {} of {} user sentences", learned, input.size());
        }
        return reply.trimPeriod();
    }
}
