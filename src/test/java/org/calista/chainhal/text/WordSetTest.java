package org.calista.chainhal.text;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.calista.chainhal.text.TaggedText.word;

class WordSetTest {

    private final Word a = word("a/DT");
    private final Word cat = word("cat/NN");
    private final Word bob = word("@bob/NNP");

    @Test
    void keepsInsertionOrderWithoutDuplicates() {
        WordSet s = WordSet.of(cat, a, cat, bob);

        assertThat(s.size()).isEqualTo(3);
        assertThat(s).containsExactly(cat, a, bob);
    }

    @Test
    void unionReturnsNewSet() {
        WordSet left = WordSet.of(a);
        WordSet right = WordSet.of(cat);

        WordSet u = left.union(right, null);

        assertThat(u).containsExactly(a, cat);
        assertThat(left).containsExactly(a);
    }

    @Test
    void nounFilters() {
        WordSet s = WordSet.of(a, cat, bob);

        assertThat(s.nouns()).containsExactly(cat, bob);
        assertThat(s.properNouns()).containsExactly(bob);
    }

    @Test
    void chooseOneOnEmptySetFails() {
        assertThatThrownBy(() -> new WordSet().chooseOne(new Random(1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void chooseOneIsReproducibleWithSeed() {
        WordSet s = WordSet.of(a, cat, bob);

        for (long seed = 0; seed < 20; seed++) {
            assertThat(s.chooseOne(new Random(seed))).isEqualTo(s.chooseOne(new Random(seed)));
        }
    }

    @Test
    void chooseOneReachesEveryMember() {
        WordSet s = WordSet.of(a, cat, bob);
        Random rnd = new Random(3);
        HashSet<Word> seen = new HashSet<>();

        for (int i = 0; i < 200; i++) seen.add(s.chooseOne(rnd));

        assertThat(seen).containsExactlyInAnyOrder(a, cat, bob);
    }

    @Test
    void chooseRandomDrawsDistinctMembers() {
        WordSet s = WordSet.of(a, cat, bob);

        List<Word> two = s.chooseRandom(2, new Random(5));
        List<Word> all = s.chooseRandom(10, new Random(5));

        assertThat(two).hasSize(2).doesNotHaveDuplicates();
        assertThat(all).containsExactlyInAnyOrder(a, cat, bob);
        assertThatThrownBy(() -> s.chooseRandom(-1, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
