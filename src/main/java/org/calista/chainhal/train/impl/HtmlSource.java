package org.calista.chainhal.train.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;
import org.calista.chainhal.train.SentenceSource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * HTML pages: prose is read from {@code p} and {@code li} elements only. Elements that are
 * unlikely to hold prose (scripts, tables, navigation, figures, quotes...) are skipped with
 * their whole subtree.
 */
public final class HtmlSource implements SentenceSource {

    private static final Set<String> LEAF_ELEMENTS = Set.of(
            "script", "style", "frameset", "frame", "applet", "object", "form", "label", "pre", "plaintext",
            "listing", "menu", "table", "td", "tr", "th", "map", "noframes", "iframe", "picture", "img",
            "canvas", "svg", "video", "audio", "blockquote", "nav", "figure");

    private static final Set<String> PROSE_ELEMENTS = Set.of("p", "li");

    private final Annotator annotator;

    public HtmlSource(Annotator annotator) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
    }

    /** The document's own meta charset wins over {@code charset}. */
    @Override
    public List<Sentence> parse(InputStream in, Charset charset) throws IOException {
        Document doc = Jsoup.parse(in, charset == null ? null : charset.name(), "");
        ArrayList<Sentence> out = new ArrayList<>();
        extract(doc, out);
        return out;
    }

    /**
     * Parses a fragment such as a feed item body. Bare text at the top level means we are
     * already inside prose, so the whole fragment is read as one block.
     */
    public List<Sentence> parseFragment(String html) {
        if (html == null || html.isBlank()) return List.of();
        Element body = Jsoup.parseBodyFragment(html).body();

        ArrayList<Sentence> out = new ArrayList<>();
        if (hasTopLevelText(body)) {
            StringBuilder sb = new StringBuilder(html.length());
            appendText(body, sb);
            out.addAll(annotator.annotate(sb.toString()));
            return out;
        }
        for (Node child : body.childNodes()) extract(child, out);
        return out;
    }

    private void extract(Node node, List<Sentence> out) {
        // Document is an Element too, so the root takes this branch
        if (node instanceof Element) {
            Element e = (Element) node;
            if (isLeaf(e)) return;
            if (PROSE_ELEMENTS.contains(e.normalName())) {
                StringBuilder sb = new StringBuilder(128);
                appendText(e, sb);
                out.addAll(annotator.annotate(sb.toString()));
                return;
            }
        } else {
            // text directly inside a non-prose container is not prose
            return;
        }
        for (Node child : node.childNodes()) extract(child, out);
    }

    private static void appendText(Node node, StringBuilder sb) {
        if (node instanceof TextNode) {
            sb.append(((TextNode) node).getWholeText()).append(' ');
            return;
        }
        if (node instanceof Element && isLeaf((Element) node)) return;
        for (Node child : node.childNodes()) appendText(child, sb);
    }

    private static boolean hasTopLevelText(Element body) {
        for (Node n : body.childNodes()) {
            if (n instanceof TextNode && !((TextNode) n).isBlank()) return true;
        }
        return false;
    }

    private static boolean isLeaf(Element e) {
        return LEAF_ELEMENTS.contains(e.normalName());
    }
}
