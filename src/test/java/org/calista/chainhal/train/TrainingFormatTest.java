package org.calista.chainhal.train;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TrainingFormatTest {

    @Test
    void detectsFromExtension() {
        assertThat(TrainingFormat.select("page.html", null).format).isEqualTo(TrainingFormat.HTML);
        assertThat(TrainingFormat.select("page.HTM", null).format).isEqualTo(TrainingFormat.HTML);
        assertThat(TrainingFormat.select("notes.md", null).format).isEqualTo(TrainingFormat.MARKDOWN);
        assertThat(TrainingFormat.select("news.rss", null).format).isEqualTo(TrainingFormat.FEED);
        assertThat(TrainingFormat.select("news.atom", null).format).isEqualTo(TrainingFormat.FEED);
        assertThat(TrainingFormat.select("news.xml", null).format).isEqualTo(TrainingFormat.FEED);
        assertThat(TrainingFormat.select("book.txt", null).format).isEqualTo(TrainingFormat.PLAIN);
        assertThat(TrainingFormat.select("megahal.trn", null).format).isEqualTo(TrainingFormat.MEGAHAL);
        assertThat(TrainingFormat.select("tagged.json", null).format).isEqualTo(TrainingFormat.JSON_UTTER);
    }

    @Test
    void ignoresDirectoriesAndGzipSuffix() {
        assertThat(TrainingFormat.select("/corpora/v1.2/book.txt.gz", null).format).isEqualTo(TrainingFormat.PLAIN);
        assertThat(TrainingFormat.select("C:\\corpora\\page.html", "").format).isEqualTo(TrainingFormat.HTML);
    }

    @Test
    void unknownWithoutUsableHints() {
        assertThat(TrainingFormat.select("archive.zip", null).format).isEqualTo(TrainingFormat.UNKNOWN);
        assertThat(TrainingFormat.select("README", null).format).isEqualTo(TrainingFormat.UNKNOWN);
        assertThat(TrainingFormat.select(null, null).format).isEqualTo(TrainingFormat.UNKNOWN);
    }

    @Test
    void mediaTypeWinsOverFilename() {
        assertThat(TrainingFormat.select("page.html", "text/markdown").format).isEqualTo(TrainingFormat.MARKDOWN);
        assertThat(TrainingFormat.select("feed", "application/atom+xml").format).isEqualTo(TrainingFormat.FEED);
        assertThat(TrainingFormat.select("x", "application/json").format).isEqualTo(TrainingFormat.JSON_UTTER);
    }

    @Test
    void unknownMediaTypeFallsBackToFilename() {
        assertThat(TrainingFormat.select("page.html", "application/octet-stream").format)
                .isEqualTo(TrainingFormat.HTML);
    }

    @Test
    void readsCharsetParameter() {
        TrainingFormat.Selection sel = TrainingFormat.select(null, "Text/Plain; charset=\"ISO-8859-1\"");

        assertThat(sel.format).isEqualTo(TrainingFormat.PLAIN);
        assertThat(sel.charset()).contains(StandardCharsets.ISO_8859_1);
        assertThat(TrainingFormat.select(null, "text/plain; charset=bogus-cs").charset()).isEmpty();
        assertThat(TrainingFormat.select("a.txt", null).charset()).isEmpty();
    }
}
