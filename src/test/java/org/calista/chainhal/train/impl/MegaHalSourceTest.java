package org.calista.chainhal.train.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.impl.RuleBasedAnnotator;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MegaHalSourceTest {

    @Test
    void oneUtterancePerLineSkippingComments() throws Exception {
        String trn = "#\n# MegaHAL training file\n#\n"
                + "Hello there\n"
                + "\n"
                + "  How are you today?  \n"
                + "I am fine. Thanks\n";

        List<Sentence> ss = new MegaHalSource(new RuleBasedAnnotator())
                .parse(new ByteArrayInputStream(trn.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);

        assertThat(ss).extracting(Sentence::toString)
                .containsExactly("hello there", "how are you today?", "i am fine.", "thanks");
    }
}
