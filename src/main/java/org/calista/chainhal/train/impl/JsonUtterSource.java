package org.calista.chainhal.train.impl;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.train.SentenceSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * "JSON utter": sentences that were already tagged in a separate step, stored as
 * {@code [[["text","TAG"], ...], ...]}. Streams the root array so big files are not
 * materialized as a tree.
 */
public final class JsonUtterSource implements SentenceSource {

    private final ObjectMapper mapper;

    public JsonUtterSource(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public List<Sentence> parse(InputStream in, Charset charset) throws IOException {
        ArrayList<Sentence> out = new ArrayList<>();
        try (JsonParser p = mapper.getFactory().createParser(new InputStreamReader(in, charset))) {
            JsonToken first = p.nextToken();
            if (first == null) return out;
            if (first != JsonToken.START_ARRAY) throw new IOException("JSON does not have array at root");

            while (p.nextToken() == JsonToken.START_ARRAY) {
                Sentence s = mapper.readValue(p, Sentence.class);
                if (s != null) out.add(s);
            }
            if (p.currentToken() != JsonToken.END_ARRAY) {
                throw new IOException("expected a sentence array at " + p.currentLocation());
            }
        }
        return out;
    }
}
