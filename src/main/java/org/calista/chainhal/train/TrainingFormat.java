package org.calista.chainhal.train;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Optional;

/**
 * Training input formats, detected from a media type and/or a file name.
 */
public enum TrainingFormat {
    FEED,
    HTML,
    MARKDOWN,
    PLAIN,
    MEGAHAL,
    JSON_UTTER,
    UNKNOWN;

    /** A detected format plus the charset named by the media type, if any. */
    public static final class Selection {
        public final TrainingFormat format;
        public final Charset charset;

        Selection(TrainingFormat format, Charset charset) {
            this.format = format;
            this.charset = charset;
        }

        public Optional<Charset> charset() {
            return Optional.ofNullable(charset);
        }
    }

    /**
     * Media type wins over file name when it names a known format. With neither the
     * result is {@link #UNKNOWN}.
     */
    public static Selection select(String filename, String mediaType) {
        if (mediaType != null && !mediaType.isBlank()) {
            Selection byType = fromMediaType(mediaType);
            if (byType.format != UNKNOWN) return byType;
        }
        if (filename != null && !filename.isBlank()) {
            return new Selection(fromFilename(filename), null);
        }
        return new Selection(UNKNOWN, null);
    }

    static Selection fromMediaType(String mediaType) {
        String[] parts = mediaType.split(";");
        String type = parts[0].trim().toLowerCase(Locale.ROOT);

        Charset cs = null;
        for (int i = 1; i < parts.length; i++) {
            String p = parts[i].trim();
            int eq = p.indexOf('=');
            if (eq < 0) continue;
            if (!p.substring(0, eq).trim().equalsIgnoreCase("charset")) continue;
            String name = p.substring(eq + 1).trim().replace("\"", "");
            try {
                cs = Charset.forName(name);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                cs = null;
            }
        }

        switch (type) {
            case "text/html":
                return new Selection(HTML, cs);
            case "text/markdown":
            case "text/x-markdown":
                return new Selection(MARKDOWN, cs);
            // not all XML is a feed, but feeds are the only XML we read
            case "application/rss":
            case "text/rss":
            case "application/atom+xml":
            case "application/atom":
            case "text/atom":
            case "application/xml":
            case "text/xml":
                return new Selection(FEED, cs);
            case "text/plain":
                return new Selection(PLAIN, cs);
            case "application/json":
                return new Selection(JSON_UTTER, cs);
            default:
                return new Selection(UNKNOWN, cs);
        }
    }

    static TrainingFormat fromFilename(String filename) {
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        if (name.toLowerCase(Locale.ROOT).endsWith(".gz")) name = name.substring(0, name.length() - 3);

        int dot = name.lastIndexOf('.');
        if (dot < 0) return UNKNOWN;

        switch (name.substring(dot).toLowerCase(Locale.ROOT)) {
            case ".html":
            case ".htm":
                return HTML;
            case ".md":
                return MARKDOWN;
            case ".rss":
            case ".atom":
            case ".xml":
                return FEED;
            case ".txt":
                return PLAIN;
            case ".trn":
                return MEGAHAL;
            case ".json":
                return JSON_UTTER;
            default:
                return UNKNOWN;
        }
    }
}
