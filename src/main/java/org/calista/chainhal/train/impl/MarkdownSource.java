package org.calista.chainhal.train.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;
import org.calista.chainhal.train.SentenceSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Markdown: formatting is stripped down to prose, then read like plain text.
 * Code blocks, headings and rules are dropped entirely.
 */
public final class MarkdownSource implements SentenceSource {

    private static final Pattern CODE_FENCE = Pattern.compile("(?s)```.*?```|~~~.*?~~~");
    private static final Pattern HEADING = Pattern.compile("(?m)^[ \\t]{0,3}#{1,6}[ \\t]+.*$");
    private static final Pattern SETEXT_UNDERLINE = Pattern.compile("(?m)^[ \\t]{0,3}(=+|-+)[ \\t]*$");
    private static final Pattern HR_LINE = Pattern.compile("(?m)^[ \\t]{0,3}(-{3,}|_{3,}|\\*{3,})[ \\t]*$");
    private static final Pattern LIST_MARKER = Pattern.compile("(?m)^[ \\t]{0,6}([-*+•]|\\d+[.)])[ \\t]+");
    private static final Pattern QUOTE_MARKER = Pattern.compile("(?m)^[ \\t]{0,3}>[ \\t]?");
    private static final Pattern IMAGE = Pattern.compile("!\\[[^\\]]*]\\([^)]*\\)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern INLINE_CODE = Pattern.compile("`[^`]*`");
    private static final Pattern EMPHASIS = Pattern.compile("(\\*{1,3}|_{1,3})(\\S(?:.*?\\S)?)\\1");

    private final Annotator annotator;

    public MarkdownSource(Annotator annotator) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
    }

    @Override
    public List<Sentence> parse(InputStream in, Charset charset) throws IOException {
        String md = new String(in.readAllBytes(), charset);
        return PlainTextSource.annotateParagraphs(annotator, stripFormatting(md));
    }

    static String stripFormatting(String md) {
        String s = md.replace("\r\n", "\n");
        s = CODE_FENCE.matcher(s).replaceAll("\n");
        s = HR_LINE.matcher(s).replaceAll("");
        s = HEADING.matcher(s).replaceAll("");
        s = SETEXT_UNDERLINE.matcher(s).replaceAll("");
        s = LIST_MARKER.matcher(s).replaceAll("");
        s = QUOTE_MARKER.matcher(s).replaceAll("");
        s = IMAGE.matcher(s).replaceAll("");
        s = LINK.matcher(s).replaceAll("$1");
        s = INLINE_CODE.matcher(s).replaceAll("");
        s = EMPHASIS.matcher(s).replaceAll("$2");
        return s;
    }
}
