package org.calista.chainhal.core;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;
import org.calista.chainhal.think.Conversation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HalKernelTest {

    @TempDir
    Path dir;

    private HalKernel kernel(boolean requireBrain) throws IOException {
        return HalKernel.builder()
                .configRoot(dir)
                .random(new Random(7))
                .requireExistingBrain(requireBrain)
                .build(Path.of("config/chainhal.json"));
    }

    private Path corpus(String name, String text) throws IOException {
        Path f = dir.resolve("corpus").resolve(name);
        Files.createDirectories(f.getParent());
        Files.writeString(f, text);
        return f;
    }

    @Test
    void buildCreatesConfigAndEmptyBrain() throws Exception {
        HalKernel k = kernel(false);

        assertThat(dir.resolve("config/chainhal.json")).exists();
        assertThat(k.io().baseDir()).isEqualTo(dir.resolve("data").toAbsolutePath().normalize());
        assertThat(k.brain().isEmpty()).isTrue();
        assertThat(k.snapshotStore().file()).isEqualTo(k.io().resolve("chainhal.brain"));
    }

    @Test
    void requireExistingBrainFailsWithoutSnapshot() {
        assertThatThrownBy(() -> kernel(true)).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void trainSavesSnapshotThatLaterBuildsLoad() throws Exception {
        Path txt = corpus("book.txt", "The cat sat on the mat.\n\nThe dog sat on the mat.");
        Path trn = corpus("chat.trn", "# comment\nDo you like the cat?\n");

        HalKernel k = kernel(false);
        int learned = k.train(List.of(txt, trn));

        assertThat(learned).isEqualTo(3);
        assertThat(k.snapshotStore().exists()).isTrue();

        HalKernel reloaded = kernel(true);
        assertThat(reloaded.brain().chains()).isEqualTo(k.brain().chains());
        assertThat(reloaded.generator().makeQuestion().toString()).isEqualTo("do you like the cat?");
    }

    @Test
    void trainingStopsAtBadFileByDefault() throws Exception {
        Path good = corpus("good.txt", "The cat sat on the mat.");
        Path bad = corpus("bad.bin", "???");

        HalKernel k = kernel(false);

        assertThatThrownBy(() -> k.train(List.of(bad, good)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("bad.bin");
        assertThat(k.brain().isEmpty()).isTrue();
    }

    @Test
    void trainingSkipsBadFilesWhenNotFailFast() throws Exception {
        Files.createDirectories(dir.resolve("config"));
        Files.writeString(dir.resolve("config/chainhal.json"), "{\"training\":{\"failFast\":false}}");
        Path good = corpus("good.txt", "The cat sat on the mat.");
        Path missing = dir.resolve("corpus/missing.txt");

        HalKernel k = kernel(false);

        assertThat(k.train(List.of(missing, good))).isEqualTo(1);
    }

    @Test
    void brainFileOverride() throws Exception {
        Path brainFile = dir.resolve("elsewhere/my.brain");

        HalKernel k = HalKernel.builder()
                .configRoot(dir)
                .brainFile(brainFile)
                .build(Path.of("config/chainhal.json"));
        k.train(List.of(corpus("a.txt", "The cat sat on the mat.")));

        assertThat(brainFile).exists();
        assertThat(dir.resolve("data/chainhal.brain")).doesNotExist();
    }

    @Test
    void conversationLearnsFromUser() throws Exception {
        HalKernel k = kernel(false);
        Conversation c = k.conversation();

        List<Sentence> input = k.annotator().annotate("The bird flew over the house.");
        c.respond(input);

        // learned without the trailing period
        assertThat(k.generator().makeSentenceWithKeyword(input.get(0).get(1)).toString())
                .isEqualTo("the bird flew over the house");
    }

    @Test
    void annotatorSwitchesComeFromConfig() throws Exception {
        Path cfg = dir.resolve("config/chainhal.json");
        Files.createDirectories(cfg.getParent());
        Files.writeString(cfg, "{\"annotator\":{\"keepHashtags\":false,\"keepUrls\":false}}");

        HalKernel k = kernel(false);
        Sentence s = k.annotator().annotate("I love #java at www.example.com").get(0);

        assertThat(s.properNouns().isEmpty()).isTrue();
        assertThat(s.asList()).extracting(Word::text).contains("java", "www").doesNotContain("#java");
        assertThat(k.config().annotator.keepMentions).isTrue();
    }
}
