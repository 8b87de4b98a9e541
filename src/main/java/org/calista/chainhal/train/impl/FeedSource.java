package org.calista.chainhal.train.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;
import org.calista.chainhal.train.SentenceSource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RSS and Atom feeds. Each item's title is read as text; its content and description/summary
 * are read as HTML fragments.
 */
public final class FeedSource implements SentenceSource {

    private final Annotator annotator;
    private final HtmlSource html;

    public FeedSource(Annotator annotator, HtmlSource html) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.html = Objects.requireNonNull(html, "html");
    }

    @Override
    public List<Sentence> parse(InputStream in, Charset charset) throws IOException {
        Document doc = Jsoup.parse(in, charset == null ? null : charset.name(), "", Parser.xmlParser());

        List<Element> items = new ArrayList<>(doc.getElementsByTag("item"));
        items.addAll(doc.getElementsByTag("entry"));
        if (items.isEmpty() && doc.getElementsByTag("rss").isEmpty() && doc.getElementsByTag("feed").isEmpty()) {
            throw new IOException("error parsing feed: no rss or atom root element");
        }

        ArrayList<Sentence> out = new ArrayList<>();
        for (Element item : items) {
            Element title = first(item, "title");
            if (title != null) out.addAll(annotator.annotate(title.text()));

            Element content = first(item, "content:encoded", "content");
            if (content != null) out.addAll(html.parseFragment(bodyOf(content)));

            Element description = first(item, "description", "summary");
            if (description != null) out.addAll(html.parseFragment(bodyOf(description)));
        }
        return out;
    }

    private static Element first(Element item, String... tags) {
        for (String t : tags) {
            for (Element c : item.children()) {
                if (c.tagName().equalsIgnoreCase(t)) return c;
            }
        }
        return null;
    }

    /** Escaped or CDATA HTML comes back as text; inline XHTML as child elements. */
    private static String bodyOf(Element e) {
        return e.children().isEmpty() ? e.wholeText() : e.html();
    }
}
