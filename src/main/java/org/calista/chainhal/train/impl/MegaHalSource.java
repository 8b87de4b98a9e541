package org.calista.chainhal.train.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;
import org.calista.chainhal.train.SentenceSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MegaHAL training files ({@code .trn}): one utterance per line, lines starting with '#'
 * are comments.
 */
public final class MegaHalSource implements SentenceSource {

    private final Annotator annotator;

    public MegaHalSource(Annotator annotator) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
    }

    @Override
    public List<Sentence> parse(InputStream in, Charset charset) throws IOException {
        ArrayList<Sentence> out = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, charset))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                out.addAll(annotator.annotate(line));
            }
        }
        return out;
    }
}
