package org.calista.chainhal.train;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.io.FileIO;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;
import org.calista.chainhal.train.impl.FeedSource;
import org.calista.chainhal.train.impl.HtmlSource;
import org.calista.chainhal.train.impl.JsonUtterSource;
import org.calista.chainhal.train.impl.MarkdownSource;
import org.calista.chainhal.train.impl.MegaHalSource;
import org.calista.chainhal.train.impl.PlainTextSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces a training file of any supported format to sentences.
 *
 * <p>
 * Formats: HTML, RSS/Atom feeds with HTML bodies, Markdown, plain text, MegaHAL {@code .trn}
 * and pre-tagged JSON. The format comes from the media type if given, else from the file name.
 * </p>
 */
public final class TrainingInputParser {

    private static final Logger log = LogManager.getLogger(TrainingInputParser.class);

    private final Map<TrainingFormat, SentenceSource> sources = new EnumMap<>(TrainingFormat.class);

    public TrainingInputParser(Annotator annotator, ObjectMapper mapper) {
        Objects.requireNonNull(annotator, "annotator");
        Objects.requireNonNull(mapper, "mapper");

        HtmlSource html = new HtmlSource(annotator);
        sources.put(TrainingFormat.HTML, html);
        sources.put(TrainingFormat.FEED, new FeedSource(annotator, html));
        sources.put(TrainingFormat.MARKDOWN, new MarkdownSource(annotator));
        sources.put(TrainingFormat.PLAIN, new PlainTextSource(annotator));
        sources.put(TrainingFormat.MEGAHAL, new MegaHalSource(annotator));
        sources.put(TrainingFormat.JSON_UTTER, new JsonUtterSource(mapper));
    }

    /**
     * @param filename  optional, used to guess the format
     * @param mediaType optional, takes precedence over the file name
     * @throws IOException if the format cannot be detected or the input cannot be parsed
     */
    public List<Sentence> parse(InputStream in, String filename, String mediaType) throws IOException {
        Objects.requireNonNull(in, "in");
        TrainingFormat.Selection sel = TrainingFormat.select(filename, mediaType);
        SentenceSource src = sources.get(sel.format);
        if (src == null) {
            throw new IOException("failed to detect file format from filename or media type");
        }
        Charset cs = sel.charset().orElse(StandardCharsets.UTF_8);
        log.debug("parsing training input {} as {} ({})", filename, sel.format, cs);
        return src.parse(in, cs);
    }

    /** Parses a file from disk; gzip-compressed files are read transparently. */
    public List<Sentence> parseFile(FileIO io, Path file) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(file, "file");
        try (InputStream in = io.openInputStream(file)) {
            return parse(in, file.getFileName().toString(), null);
        }
    }
}
