package org.calista.chainhal.think;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;
import org.calista.chainhal.text.WordSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.calista.chainhal.text.TaggedText.sentence;
import static org.calista.chainhal.text.TaggedText.word;

class ReplyComposerTest {

    private final Word cat = word("cat/NN");
    private final Word mat = word("mat/NN");
    private final Word alice = word("@alice/NNP");
    private final Word bob = word("@bob/NNP");

    private FakeTextGenerator gen;
    private ReplyComposer composer;

    @BeforeEach
    void setUp() {
        gen = new FakeTextGenerator();
        composer = new ReplyComposer(gen);
    }

    @Test
    void inputWithoutNounsGivesNothing() {
        Sentence reply = composer.makeReply(sentence("how/WRB are/VBP you/PRP ?/."));

        assertThat(reply).isSameAs(Sentence.EMPTY);
        assertThat(gen.asked).isEmpty();
    }

    @Test
    void noGeneratedCandidatesGivesNothing() {
        assertThat(composer.makeReply(sentence("the/DT cat/NN sat/VBD"))).isSameAs(Sentence.EMPTY);
        assertThat(gen.asked).containsExactly(cat);
    }

    @Test
    void singleCandidateWins() {
        Sentence s = sentence("my/PRP$ cat/NN is/VBZ fat/NN");
        gen.with(cat, s);

        assertThat(composer.makeReply(sentence("the/DT cat/NN sat/VBD on/IN the/DT mat/NN"))).isEqualTo(s);
        assertThat(gen.asked).containsExactly(cat, mat);
    }

    @Test
    void twoProperNounsReplaceCommonNounsAsKeywords() {
        composer.makeReply(sentence("@alice/NNP and/CC @bob/NNP like/IN the/DT cat/NN"));

        assertThat(gen.asked).containsExactly(alice, bob);
    }

    @Test
    void oneProperNounIsJustAnotherNoun() {
        composer.makeReply(sentence("@alice/NNP likes/VBZ the/DT cat/NN"));

        assertThat(gen.asked).containsExactly(alice, cat);
    }

    @Test
    void keywordsComeFromEveryInputSentence() {
        composer.makeReply(sentence("hello/UH cat/NN"), sentence("nice/JJ mat/NN"));

        assertThat(gen.asked).containsExactly(cat, mat);
    }

    @Test
    void highestScoreWins() {
        Sentence weak = sentence("a/DT cat/NN ran/VBD off/IN");
        Sentence strong = sentence("the/DT cat/NN on/IN the/DT mat/NN");
        gen.with(cat, weak).with(mat, strong);

        Sentence reply = composer.makeReply(sentence("the/DT cat/NN sat/VBD on/IN the/DT mat/NN"));

        assertThat(reply).isEqualTo(strong);
    }

    @Test
    void tieKeepsEarlierCandidate() {
        Sentence first = sentence("my/PRP$ cat/NN");
        Sentence second = sentence("my/PRP$ mat/NN");
        gen.with(cat, first).with(mat, second);

        assertThat(composer.makeReply(sentence("cat/NN and/CC mat/NN"))).isEqualTo(first);
    }

    @Test
    void scoring() {
        Sentence input = sentence("@alice/NNP saw/VBD the/DT cat/NN");
        WordSet all = input.words();
        WordSet nouns = input.nouns();
        WordSet proper = input.properNouns();

        // input proper noun: 2 + 3 + 4 + 1
        assertThat(ReplyComposer.score(sentence("@alice/NNP"), all, nouns, proper)).isEqualTo(10);
        // input common noun: 3 + 1
        assertThat(ReplyComposer.score(sentence("cat/NN"), all, nouns, proper)).isEqualTo(4);
        // other input word
        assertThat(ReplyComposer.score(sentence("the/DT"), all, nouns, proper)).isEqualTo(1);
        // proper noun not in the input
        assertThat(ReplyComposer.score(sentence("@bob/NNP"), all, nouns, proper)).isEqualTo(2);
        assertThat(ReplyComposer.score(sentence("a/DT dog/NN"), all, nouns, proper)).isZero();
        // repeated words count every time
        assertThat(ReplyComposer.score(sentence("the/DT cat/NN the/DT"), all, nouns, proper)).isEqualTo(6);
    }
}
