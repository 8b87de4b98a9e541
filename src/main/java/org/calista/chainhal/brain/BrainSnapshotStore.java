package org.calista.chainhal.brain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.io.FileIO;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * BrainSnapshotStore — loads and saves a brain snapshot file.
 *
 * <p>
 * Saving goes through {@link FileIO#writeBytes}, i.e. a temp sibling followed by an atomic move,
 * so a crash mid-save leaves the previous snapshot intact.
 * </p>
 */
public final class BrainSnapshotStore {

    private static final Logger log = LogManager.getLogger(BrainSnapshotStore.class);

    private final FileIO io;
    private final BrainSnapshotCodec codec;
    private final Path snapshotFile;

    public BrainSnapshotStore(FileIO io, BrainSnapshotCodec codec, Path snapshotFile) {
        this.io = Objects.requireNonNull(io, "io");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.snapshotFile = Objects.requireNonNull(snapshotFile, "snapshotFile");
    }

    public Path file() {
        return snapshotFile;
    }

    public boolean exists() {
        return io.exists(snapshotFile);
    }

    public void save(Brain brain) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(64 * 1024);
        codec.save(brain, buf);
        io.writeBytes(snapshotFile, buf.toByteArray());
        log.info("Brain saved: {} (chains={})", snapshotFile, brain.chainCount());
    }

    /**
     * @throws NoSuchFileException if there is no snapshot yet
     * @throws BrainFormatException if the file is not a valid snapshot
     */
    public Brain load() throws IOException {
        byte[] src = io.readBytes(snapshotFile);
        Brain brain = codec.decode(src);
        log.info("Brain loaded: {} (chains={}, words={})", snapshotFile, brain.chainCount(), brain.wordCount());
        return brain;
    }

    /** Loads the snapshot, or starts an empty brain when the file does not exist yet. */
    public Brain loadOrCreate() throws IOException {
        try {
            return load();
        } catch (NoSuchFileException e) {
            log.info("No brain snapshot at {}; starting with an empty brain", snapshotFile);
            return new Brain();
        }
    }
}
