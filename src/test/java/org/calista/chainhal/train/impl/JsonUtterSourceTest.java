package org.calista.chainhal.train.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.chainhal.text.Sentence;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.calista.chainhal.text.TaggedText.sentence;

class JsonUtterSourceTest {

    private final JsonUtterSource source = new JsonUtterSource(new ObjectMapper());

    @Test
    void readsPreTaggedSentences() throws Exception {
        String json = "[[[\"The\",\"DT\"],[\"cat\",\"NN\"],[\"sat\",\"VBD\"],[\".\",\".\"]],"
                + " [[\"hi\",\"UH\"]]]";

        List<Sentence> ss = parse(json);

        assertThat(ss).containsExactly(sentence("the/DT cat/NN sat/VBD ./."), sentence("hi/UH"));
    }

    @Test
    void emptyInputAndEmptyArray() throws Exception {
        assertThat(parse("")).isEmpty();
        assertThat(parse("[]")).isEmpty();
    }

    @Test
    void rootMustBeArray() {
        assertThatThrownBy(() -> parse("{\"a\": 1}"))
                .isInstanceOf(IOException.class)
                .hasMessage("JSON does not have array at root");
    }

    @Test
    void elementsMustBeSentences() {
        assertThatThrownBy(() -> parse("[1, 2]"))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("expected a sentence array");
        assertThatThrownBy(() -> parse("[[[\"only-text\"]]]"))
                .isInstanceOf(IOException.class);
    }

    private List<Sentence> parse(String json) throws IOException {
        return source.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }
}
