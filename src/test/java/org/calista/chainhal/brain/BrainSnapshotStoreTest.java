package org.calista.chainhal.brain;

import org.calista.chainhal.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.calista.chainhal.text.TaggedText.sentence;

class BrainSnapshotStoreTest {

    @TempDir
    Path dir;

    private BrainSnapshotStore store;

    @BeforeEach
    void setUp() {
        FileIO io = new FileIO(dir);
        store = new BrainSnapshotStore(io, new BrainSnapshotCodec(), io.resolve("brains/test.brain"));
    }

    @Test
    void missingSnapshotIsReported() {
        assertThat(store.exists()).isFalse();
        assertThatThrownBy(() -> store.load()).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void loadOrCreateStartsEmpty() throws Exception {
        assertThat(store.loadOrCreate().isEmpty()).isTrue();
    }

    @Test
    void saveThenLoad() throws Exception {
        Brain brain = new Brain();
        brain.addSentence(sentence("the/DT cat/NN sat/VBD on/IN the/DT mat/NN"));

        store.save(brain);

        assertThat(store.exists()).isTrue();
        assertThat(dir.resolve("brains/.test.brain.new")).doesNotExist();
        assertThat(store.load().chains()).isEqualTo(brain.chains());
    }

    @Test
    void corruptSnapshotFailsLoadOrCreate() throws Exception {
        Files.createDirectories(store.file().getParent());
        Files.write(store.file(), new byte[]{'x', 'y'});

        assertThatThrownBy(() -> store.loadOrCreate())
                .isInstanceOf(BrainFormatException.class)
                .hasMessage("not a brain file");
    }
}
