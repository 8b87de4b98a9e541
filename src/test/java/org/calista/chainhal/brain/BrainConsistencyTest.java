package org.calista.chainhal.brain;

import org.calista.chainhal.text.Word;
import org.calista.chainhal.think.impl.ChainWalkGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.calista.chainhal.text.TaggedText.word;

class BrainConsistencyTest {

    @Test
    void walkFailsLoudlyOnChainWithoutNeighbours() {
        Word cat = word("cat/NN");
        Brain brain = new Brain();
        // neither a start chain nor anything before it
        brain.restoreChain(Chain.of(word("the/DT"), cat, word("sat/VBD"), word("down/RB")),
                List.of(), List.of(), false, true);

        ChainWalkGenerator gen = new ChainWalkGenerator(brain, new Random(1));

        assertThatThrownBy(() -> gen.makeSentenceWithKeyword(cat))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not a start chain");
    }
}
