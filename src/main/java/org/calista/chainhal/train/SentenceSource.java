package org.calista.chainhal.train;

import org.calista.chainhal.text.Sentence;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Extracts sentences from one training input format.
 */
public interface SentenceSource {

    /**
     * @param charset charset to decode with when the format has no way to declare its own
     */
    List<Sentence> parse(InputStream in, Charset charset) throws IOException;
}
