package org.calista.chainhal.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * FileIO — single entry point for file access.
 *
 * <ul>
 *   <li>relative paths resolve inside a base directory (no escaping through "..")</li>
 *   <li>text reads transparently decompress {@code .gz}/{@code .gzip} files</li>
 *   <li>writes go to a temp sibling, are fsync'ed and committed by an atomic move</li>
 *   <li>unchanged content is not rewritten</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8);
    }

    public FileIO(Path baseDir, Charset charset) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        log.debug("FileIO init: baseDir={}, charset={}", this.baseDir, charset);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    private void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Resolves a relative path inside the base directory. Absolute paths and paths that
     * escape the base directory are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        String sanitized = relative.replace('\\', '/');
        Path rel = Paths.get(sanitized);
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /** For paths given by the user (training corpora): normalization only. */
    public Path resolveExternal(String anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        return Paths.get(anyPath).toAbsolutePath().normalize();
    }

    private void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            try (InputStream in = openInputStream(file)) {
                return new String(in.readAllBytes(), charset);
            }
        }
        return Files.readString(file, charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        writeBytes(file, content.getBytes(charset));
    }

    // ----------------------------
    // Bytes
    // ----------------------------

    public byte[] readBytes(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readAllBytes(file);
    }

    public void writeBytes(Path file, byte[] bytes) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(bytes, "bytes");
        ensureParentDir(file);

        if (isSameBytes(file, bytes)) {
            log.debug("writeBytes: skip unchanged content for {}", file);
            return;
        }

        Path tmp = tempSibling(file);
        Files.write(tmp, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    /**
     * Opens a file for reading, decompressing gzip files on the fly.
     * The caller closes the stream.
     */
    public InputStream openInputStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            return new GZIPInputStream(Files.newInputStream(file));
        }
        return Files.newInputStream(file);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private Path tempSibling(Path target) {
        // dot-prefixed so a half-written file is not picked up as a snapshot
        return target.resolveSibling("." + target.getFileName() + ".new");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        fsyncFile(tmp);

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("Could not remove temp file {}: {}", tmp, e.toString());
            }
        }
    }

    private void fsyncFile(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsyncFile ignored for {}: {}", file, e.toString());
        }
    }

    private static boolean isGzip(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") || name.endsWith(".gzip");
    }

    private static boolean isSameBytes(Path file, byte[] bytes) {
        if (!Files.exists(file)) return false;
        try {
            if (Files.size(file) != bytes.length) return false;
            return Arrays.equals(Files.readAllBytes(file), bytes);
        } catch (IOException e) {
            return false;
        }
    }
}
