package org.calista.chainhal.train.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;
import org.calista.chainhal.train.SentenceSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Plain text: paragraphs are separated by blank lines, so a paragraph without final
 * punctuation does not run into the next one.
 */
public final class PlainTextSource implements SentenceSource {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R\\s*\\R");

    private final Annotator annotator;

    public PlainTextSource(Annotator annotator) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
    }

    @Override
    public List<Sentence> parse(InputStream in, Charset charset) throws IOException {
        String text = new String(in.readAllBytes(), charset);
        return annotateParagraphs(annotator, text);
    }

    static List<Sentence> annotateParagraphs(Annotator annotator, String text) {
        ArrayList<Sentence> out = new ArrayList<>();
        for (String para : PARAGRAPH_BREAK.split(text)) {
            if (para.isBlank()) continue;
            out.addAll(annotator.annotate(para));
        }
        return out;
    }
}
