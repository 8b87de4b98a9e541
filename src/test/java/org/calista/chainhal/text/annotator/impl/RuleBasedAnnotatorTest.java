package org.calista.chainhal.text.annotator.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;
import org.calista.chainhal.think.Conversation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedAnnotatorTest {

    private RuleBasedAnnotator annotator;

    @BeforeEach
    void setUp() {
        annotator = new RuleBasedAnnotator();
    }

    @Test
    void tagsSimpleSentence() {
        List<Sentence> ss = annotator.annotate("The cat sat on the mat.");

        assertThat(ss).hasSize(1);
        assertThat(ss.get(0).toTaggedString()).isEqualTo("the/DT cat/NN sat/VBD on/IN the/DT mat/NN ./.");
        assertThat(ss.get(0)).hasToString("the cat sat on the mat.");
    }

    @Test
    void splitsSentencesAtTerminators() {
        List<Sentence> ss = annotator.annotate("Hello there! How are you?  Fine");

        assertThat(ss).extracting(Sentence::toTaggedString).containsExactly(
                "hello/UH there/RB !/.",
                "how/WRB are/VBP you/PRP ?/.",
                "fine/NN");
    }

    @Test
    void keepsRunOfTerminatorsTogether() {
        List<Sentence> ss = annotator.annotate("Wait... what?!");

        assertThat(ss).extracting(Sentence::toString).containsExactly("wait...", "what?!");
    }

    @Test
    void splitsContractions() {
        assertThat(annotator.annotate("I don't know").get(0).toTaggedString())
                .isEqualTo("i/PRP do/VBP n't/RB know/VB");
        assertThat(annotator.annotate("it's mine").get(0).toTaggedString())
                .isEqualTo("it/PRP 's/POS mine/NN");
        assertThat(annotator.annotate("I don't know").get(0)).hasToString("i don't know");
    }

    @Test
    void hashtagsAndMentionsAreProperNouns() {
        Sentence s = annotator.annotate("I love #Java and @Bob, really.").get(0);

        assertThat(s.properNouns().asSet()).extracting(Word::text).containsExactly("#java", "@bob");
        assertThat(s.toTaggedString()).contains("@bob/NNP ,/,");
    }

    @Test
    void urlsEmailsAndNumbersStayWhole() {
        Sentence s = annotator.annotate("Mail bob@example.com or see https://example.com/a?b=1, pi is 3.14").get(0);

        assertThat(s.asList()).extracting(Word::text)
                .contains("bob@example.com", "https://example.com/a?b=1", "3.14");
        assertThat(s.toTaggedString()).contains("3.14/CD");
    }

    @Test
    void hyphenatedWordsStayWhole() {
        assertThat(annotator.annotate("a well-known fact").get(0).toTaggedString())
                .isEqualTo("a/DT well-known/NN fact/NN");
    }

    @Test
    void straightQuotesOpenAndClose() {
        Sentence s = annotator.annotate("She said \"hi\" today").get(0);

        assertThat(s.toTaggedString()).isEqualTo("she/PRP said/VBD \"/`` hi/UH \"/'' today/NN");
        assertThat(s).hasToString("she said \"hi\" today");
    }

    @Test
    void whyIsRecognized() {
        Sentence s = annotator.annotate("Why is the sky blue?").get(0);

        assertThat(s.get(0)).isEqualTo(Conversation.WHY);
    }

    @Test
    void suffixRules() {
        assertThat(RuleBasedAnnotator.tagOf("quickly")).isEqualTo("RB");
        assertThat(RuleBasedAnnotator.tagOf("running")).isEqualTo("VBG");
        assertThat(RuleBasedAnnotator.tagOf("jumped")).isEqualTo("VBD");
        assertThat(RuleBasedAnnotator.tagOf("cats")).isEqualTo("NNS");
        assertThat(RuleBasedAnnotator.tagOf("glass")).isEqualTo("NN");
        assertThat(RuleBasedAnnotator.tagOf("42")).isEqualTo("CD");
        assertThat(RuleBasedAnnotator.tagOf(";")).isEqualTo(":");
        assertThat(RuleBasedAnnotator.tagOf("(")).isEqualTo("(");
    }

    @Test
    void blankInputHasNoSentences() {
        assertThat(annotator.annotate("  \n ")).isEmpty();
        assertThat(annotator.annotate(null)).isEmpty();
    }

    @Test
    void longTokensAreCut() {
        RuleBasedAnnotator.Config cfg = new RuleBasedAnnotator.Config();
        cfg.maxTokenLength = 5;

        List<String> tokens = new RuleBasedAnnotator(cfg).tokenize("abcdefghij ok");

        assertThat(tokens).containsExactly("abcde", "ok");
    }

    @Test
    void switchedOffSpecialTokensSplitLikeOrdinaryText() {
        RuleBasedAnnotator.Config cfg = new RuleBasedAnnotator.Config();
        cfg.keepUrls = false;
        cfg.keepEmails = false;
        cfg.keepHashtags = false;
        cfg.keepMentions = false;

        List<String> tokens = new RuleBasedAnnotator(cfg).tokenize("#tag @bob bob@mail.org http://x.io");

        assertThat(tokens).containsExactly(
                "#", "tag", "@", "bob", "bob", "@", "mail", ".", "org", "http", ":", "/", "/", "x", ".", "io");
    }
}
