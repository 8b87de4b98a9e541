package org.calista.chainhal.text.annotator.impl;

import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;
import org.calista.chainhal.text.annotator.Annotator;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based annotator:
 * - NFC normalization + lowercasing with Locale.ROOT
 * - single-pass tokenizer: words (with inner '-' '_' '\'' '’'), numbers, URLs, e-mails,
 *   #hashtags, @mentions, and every punctuation mark as its own token
 * - contractions split the way treebank tokenizers do: "don't" -> "do" "n't"
 * - sentences end after a run of '.', '?' or '!'
 * - closed-class lexicon + suffix rules for tags, NN as the fallback
 *
 * <p>
 * Everything is tagged from lower-cased text, so ordinary names come out as common nouns;
 * hashtags and mentions are the only proper nouns. That trades recall of proper nouns for
 * consistent tagging of casual chat input.
 * </p>
 */
public final class RuleBasedAnnotator implements Annotator {

    public static final int DEFAULT_MAX_TOKEN_LEN = 64;

    private static final Map<String, String> LEXICON = buildLexicon();

    private static final Set<String> CONTRACTION_SUFFIXES = Set.of("'s", "'re", "'ll", "'ve", "'m", "'d");

    private final int maxLen;
    private final boolean keepUrls;
    private final boolean keepEmails;
    private final boolean keepHashtags;
    private final boolean keepMentions;

    public RuleBasedAnnotator() {
        this(new Config());
    }

    public RuleBasedAnnotator(Config cfg) {
        this.maxLen = Math.max(1, cfg.maxTokenLength);
        this.keepUrls = cfg.keepUrls;
        this.keepEmails = cfg.keepEmails;
        this.keepHashtags = cfg.keepHashtags;
        this.keepMentions = cfg.keepMentions;
    }

    public static final class Config {
        public int maxTokenLength = DEFAULT_MAX_TOKEN_LEN;
        public boolean keepUrls = true;
        public boolean keepEmails = true;
        public boolean keepHashtags = true;
        public boolean keepMentions = true;
    }

    @Override
    public List<Sentence> annotate(String text) {
        if (text == null || text.isBlank()) return List.of();

        String s = Normalizer.normalize(text, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        List<String> tokens = tokenize(s);

        ArrayList<Sentence> out = new ArrayList<>();
        ArrayList<String> cur = new ArrayList<>(32);
        for (int i = 0; i < tokens.size(); i++) {
            String t = tokens.get(i);
            cur.add(t);
            boolean boundary = isTerminator(t)
                    && (i + 1 == tokens.size() || !isTerminator(tokens.get(i + 1)));
            if (boundary) {
                out.add(tag(cur));
                cur.clear();
            }
        }
        if (!cur.isEmpty()) out.add(tag(cur));
        return out;
    }

    // ---- tokenizing ----

    List<String> tokenize(String s) {
        ArrayList<String> out = new ArrayList<>(Math.max(8, s.length() / 4));
        StringBuilder tok = new StringBuilder(32);

        final int n = s.length();
        int i = 0;
        while (i < n) {
            char c = s.charAt(i);

            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                i++;
                continue;
            }

            if (keepUrls && looksLikeUrlStart(s, i)) {
                int j = trimTrailingPunct(s, i, consumeUntilWhitespace(s, i));
                addToken(out, s.substring(i, j));
                i = j;
                continue;
            }
            if (keepEmails && looksLikeEmailStart(s, i)) {
                int j = trimTrailingPunct(s, i, consumeUntilWhitespace(s, i));
                addToken(out, s.substring(i, j));
                i = j;
                continue;
            }

            if ((c == '#' && keepHashtags) || (c == '@' && keepMentions)) {
                int j = i + 1;
                if (j < n && isTokenChar(s.charAt(j))) {
                    j = trimTrailingPunct(s, i, consumeTagToken(s, j));
                    addToken(out, s.substring(i, j));
                    i = j;
                    continue;
                }
            }

            if (isTokenChar(c)) {
                tok.setLength(0);
                tok.append(c);
                i++;
                while (i < n) {
                    char x = s.charAt(i);
                    if (isTokenChar(x)) {
                        tok.append(x);
                        i++;
                        continue;
                    }
                    // inner connectors only between token chars: foo-bar, it's, o’neill
                    if (isInnerConnector(x) && i + 1 < n && isTokenChar(s.charAt(i + 1))) {
                        tok.append(x == '’' ? '\'' : x);
                        i++;
                        continue;
                    }
                    // decimal numbers: 3.14, 1,000
                    if ((x == '.' || x == ',') && i + 1 < n && Character.isDigit(s.charAt(i + 1))
                            && Character.isDigit(tok.charAt(tok.length() - 1))) {
                        tok.append(x);
                        i++;
                        continue;
                    }
                    break;
                }
                addWord(out, tok.toString());
                continue;
            }

            if (Character.getType(c) == Character.NON_SPACING_MARK) {
                i++;
                continue;
            }

            // anything else is a one-character punctuation/symbol token
            addToken(out, String.valueOf(c));
            i++;
        }
        return out;
    }

    private void addWord(List<String> out, String w) {
        int apos = w.lastIndexOf('\'');
        if (apos > 0) {
            if (w.endsWith("n't") && w.length() > 3) {
                addToken(out, w.substring(0, w.length() - 3));
                addToken(out, "n't");
                return;
            }
            String suffix = w.substring(apos);
            if (CONTRACTION_SUFFIXES.contains(suffix)) {
                addToken(out, w.substring(0, apos));
                addToken(out, suffix);
                return;
            }
        }
        addToken(out, w);
    }

    private void addToken(List<String> out, String token) {
        if (token.isEmpty()) return;
        out.add(token.length() > maxLen ? token.substring(0, maxLen) : token);
    }

    // ---- tagging ----

    private static Sentence tag(List<String> tokens) {
        ArrayList<Word> ws = new ArrayList<>(tokens.size());
        boolean doubleOpen = false;
        boolean singleOpen = false;

        for (String t : tokens) {
            String tag;
            switch (t) {
                case "\"":
                    tag = doubleOpen ? "''" : "``";
                    doubleOpen = !doubleOpen;
                    break;
                case "'":
                    tag = singleOpen ? "''" : "``";
                    singleOpen = !singleOpen;
                    break;
                case "“":
                    tag = "``";
                    doubleOpen = true;
                    break;
                case "”":
                    tag = "''";
                    doubleOpen = false;
                    break;
                case "‘":
                    tag = "``";
                    singleOpen = true;
                    break;
                case "’":
                    tag = "''";
                    singleOpen = false;
                    break;
                default:
                    tag = tagOf(t);
            }
            ws.add(Word.of(tag, t));
        }
        return Sentence.of(ws);
    }

    static String tagOf(String t) {
        String lex = LEXICON.get(t);
        if (lex != null) return lex;

        char c = t.charAt(0);
        if (t.length() == 1 && !Character.isLetterOrDigit(c)) return punctuationTag(c);
        if ((c == '#' || c == '@') && t.length() > 1) return "NNP";
        if (Character.isDigit(c)) return "CD";
        if (t.startsWith("http://") || t.startsWith("https://") || t.startsWith("www.")) return "NN";

        int n = t.length();
        if (n > 4 && t.endsWith("ly")) return "RB";
        if (n > 5 && t.endsWith("ing")) return "VBG";
        if (n > 4 && t.endsWith("ed")) return "VBD";
        if (n > 3 && t.endsWith("s") && !t.endsWith("ss") && !t.endsWith("us") && !t.endsWith("is")) return "NNS";
        return "NN";
    }

    private static String punctuationTag(char c) {
        switch (c) {
            case '.':
            case '?':
            case '!':
                return ".";
            case ',':
                return ",";
            case ';':
            case ':':
            case '-':
            case '–':
            case '—':
                return ":";
            case '(':
            case '[':
            case '{':
                return "(";
            case ')':
            case ']':
            case '}':
                return ")";
            case '$':
            case '€':
            case '£':
                return "$";
            case '#':
                return "#";
            default:
                return "SYM";
        }
    }

    private static boolean isTerminator(String t) {
        return t.equals(".") || t.equals("?") || t.equals("!");
    }

    private static Map<String, String> buildLexicon() {
        HashMap<String, String> m = new HashMap<>(256);
        put(m, "DT", "the", "a", "an", "this", "that", "these", "those", "every", "each", "some", "any", "no", "all", "another");
        put(m, "IN", "in", "on", "at", "of", "for", "with", "about", "from", "by", "into", "over", "under", "after",
                "before", "because", "if", "while", "than", "as", "like", "through", "during", "without", "since",
                "until", "between", "against", "among", "upon", "off", "out", "around");
        put(m, "TO", "to");
        put(m, "CC", "and", "or", "but", "nor", "yet", "so");
        put(m, "PRP", "i", "you", "he", "she", "it", "we", "they", "me", "him", "us", "them",
                "myself", "yourself", "himself", "herself", "itself", "ourselves", "themselves");
        put(m, "PRP$", "my", "your", "his", "her", "its", "our", "their");
        put(m, "MD", "can", "could", "will", "would", "shall", "should", "may", "might", "must", "'ll", "'d", "ca", "wo");
        put(m, "WRB", "why", "how", "when", "where");
        put(m, "WP", "what", "who", "whom");
        put(m, "WDT", "which", "whatever", "whichever");
        put(m, "VBZ", "is", "has", "does");
        put(m, "VBP", "am", "are", "have", "do", "'re", "'ve", "'m");
        put(m, "VBD", "was", "were", "had", "did", "said", "went", "got", "made", "saw", "sat", "came", "took");
        put(m, "VB", "be", "go", "get", "make", "say", "see", "know", "take", "come", "think", "want", "like");
        put(m, "VBN", "been", "done", "gone", "seen", "known", "taken");
        put(m, "VBG", "being", "having", "doing", "going");
        put(m, "RB", "not", "n't", "very", "too", "also", "just", "really", "never", "always", "often", "here",
                "there", "now", "then", "again", "still", "already", "even", "only", "maybe", "perhaps");
        put(m, "JJ", "good", "bad", "new", "old", "big", "small", "great", "little", "other", "many", "much",
                "more", "most", "few", "same", "different", "happy", "sad", "long", "short");
        put(m, "UH", "hello", "hi", "hey", "yes", "oh", "ok", "okay", "please", "thanks", "bye");
        put(m, "POS", "'s");
        return Map.copyOf(m);
    }

    private static void put(Map<String, String> m, String tag, String... words) {
        for (String w : words) m.putIfAbsent(w, tag);
    }

    // ---- character classes ----

    private static boolean isTokenChar(char c) {
        return Character.isLetterOrDigit(c);
    }

    private static boolean isInnerConnector(char c) {
        return c == '-' || c == '_' || c == '\'' || c == '’';
    }

    private static boolean looksLikeUrlStart(String s, int i) {
        return s.startsWith("https://", i) || s.startsWith("http://", i) || s.startsWith("www.", i);
    }

    private static boolean looksLikeEmailStart(String s, int i) {
        if (!isTokenChar(s.charAt(i))) return false;
        int n = s.length();
        int j = i;
        int atPos = -1;
        while (j < n) {
            char c = s.charAt(j);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) break;
            if (c == '@') {
                atPos = j;
                break;
            }
            if (!isTokenChar(c) && c != '.' && c != '_' && c != '-' && c != '+') return false;
            j++;
        }
        return atPos > i && atPos + 1 < n && isTokenChar(s.charAt(atPos + 1));
    }

    private static int consumeUntilWhitespace(String s, int i) {
        int n = s.length();
        int j = i;
        while (j < n) {
            char c = s.charAt(j);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) break;
            j++;
        }
        return j;
    }

    private static int trimTrailingPunct(String s, int start, int end) {
        while (end > start + 1) {
            char last = s.charAt(end - 1);
            if (last == '.' || last == ',' || last == ';' || last == ':' || last == '!' || last == '?'
                    || last == ')' || last == ']' || last == '"' || last == '\'') {
                end--;
            } else {
                break;
            }
        }
        return end;
    }

    /** Hashtag/mention body: letters/digits and '_' or '.' after the first char. */
    private static int consumeTagToken(String s, int i) {
        int n = s.length();
        int j = i;
        while (j < n) {
            char c = s.charAt(j);
            if (isTokenChar(c) || c == '_' || c == '.') {
                j++;
            } else {
                break;
            }
        }
        return j;
    }
}
