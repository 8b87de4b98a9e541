package org.calista.chainhal.brain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.text.Word;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BrainSnapshotCodec — binary persistence of a {@link Brain}.
 *
 * <p>
 * Layout: the 4 magic bytes {@code QWOK}, then one MessagePack map:
 * </p>
 * <pre>
 * { "chainLen": 4,
 *   "chains": [ { "w": [idx x4], "a": [idx...], "b": [idx...], "s": bool, "e": bool }, ... ],
 *   "words":  [ [text, tag], ... ] }
 * </pre>
 *
 * <p>
 * Words are interned: each distinct word gets the next index the first time it is met while
 * encoding, and every chain refers to words by index. An index outside the word table decodes
 * to {@link Word#INVALID} instead of failing the load.
 * </p>
 */
public final class BrainSnapshotCodec {

    private static final Logger log = LogManager.getLogger(BrainSnapshotCodec.class);

    static final byte[] MAGIC = {'Q', 'W', 'O', 'K'};

    private final ObjectMapper mapper;

    public BrainSnapshotCodec() {
        ObjectMapper om = new ObjectMapper(new MessagePackFactory());
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.mapper = om;
    }

    // =========================
    // Save
    // =========================

    /** Writes a point-in-time snapshot; holds the brain's read lock while collecting it. */
    public void save(Brain brain, OutputStream out) throws IOException {
        Objects.requireNonNull(brain, "brain");
        Objects.requireNonNull(out, "out");

        BrainRecord rec = brain.read(BrainSnapshotCodec::toRecord);
        byte[] payload = mapper.writeValueAsBytes(rec);

        out.write(MAGIC);
        out.write(payload);
        out.flush();

        log.debug("brain snapshot written: chains={}, words={}, bytes={}",
                rec.chains.size(), rec.words.size(), MAGIC.length + payload.length);
    }

    private static BrainRecord toRecord(Brain.View v) {
        BrainRecord rec = new BrainRecord();
        rec.chainLen = Chain.LENGTH;
        rec.chains = new ArrayList<>(v.chains().size());
        rec.words = new ArrayList<>(v.words().size());

        Map<Word, Long> index = new HashMap<>(v.words().size() * 2);

        for (Chain c : v.chains()) {
            ChainRecord cr = new ChainRecord();
            cr.words = new ArrayList<>(Chain.LENGTH);
            for (int i = 0; i < Chain.LENGTH; i++) cr.words.add(intern(c.get(i), index, rec.words));

            cr.after = new ArrayList<>();
            for (Word w : v.wordsAfter(c)) cr.after.add(intern(w, index, rec.words));
            cr.before = new ArrayList<>();
            for (Word w : v.wordsBefore(c)) cr.before.add(intern(w, index, rec.words));

            cr.canStart = v.isStart(c);
            cr.canEnd = v.isEnd(c);
            rec.chains.add(cr);
        }
        return rec;
    }

    private static long intern(Word w, Map<Word, Long> index, List<WordRecord> table) {
        Long idx = index.get(w);
        if (idx != null) return idx;
        long next = table.size();
        index.put(w, next);
        table.add(new WordRecord(w.text(), w.tag()));
        return next;
    }

    // =========================
    // Load
    // =========================

    /**
     * Decodes a snapshot into a new brain.
     *
     * @throws BrainFormatException if the stream is not a brain snapshot or is malformed
     */
    public Brain load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        return decode(in.readAllBytes());
    }

    public Brain decode(byte[] src) throws BrainFormatException {
        Objects.requireNonNull(src, "src");
        if (src.length < MAGIC.length || !Arrays.equals(src, 0, MAGIC.length, MAGIC, 0, MAGIC.length)) {
            throw new BrainFormatException("not a brain file");
        }

        BrainRecord rec;
        try {
            rec = mapper.readValue(src, MAGIC.length, src.length - MAGIC.length, BrainRecord.class);
        } catch (JsonProcessingException e) {
            throw new BrainFormatException("invalid brain file: " + e.getOriginalMessage(), e);
        } catch (IOException | RuntimeException e) {
            // the msgpack reader reports truncated or reserved bytes unchecked
            throw new BrainFormatException("invalid brain file: " + e.getMessage(), e);
        }
        if (rec == null) throw new BrainFormatException("invalid brain file: empty payload");

        if (rec.chainLen != Chain.LENGTH) {
            throw new BrainFormatException("wrong chain length " + rec.chainLen + "; need " + Chain.LENGTH);
        }

        List<WordRecord> table = rec.words == null ? List.of() : rec.words;
        List<ChainRecord> chainRecs = rec.chains == null ? List.of() : rec.chains;

        Brain brain = new Brain();
        for (int i = 0; i < chainRecs.size(); i++) {
            ChainRecord cr = chainRecs.get(i);
            if (cr == null) throw new BrainFormatException("chain " + i + " is null");

            List<Long> ws = cr.words == null ? List.of() : cr.words;
            if (ws.size() != Chain.LENGTH) {
                throw new BrainFormatException("chain " + i + " has wrong length " + ws.size() + "; need " + Chain.LENGTH);
            }

            List<Word> cw = new ArrayList<>(Chain.LENGTH);
            for (Long idx : ws) cw.add(wordAt(table, idx));

            brain.restoreChain(Chain.of(cw), words(table, cr.before), words(table, cr.after), cr.canStart, cr.canEnd);
        }

        log.debug("brain snapshot decoded: chains={}, words={}", chainRecs.size(), table.size());
        return brain;
    }

    private static List<Word> words(List<WordRecord> table, List<Long> idxs) {
        if (idxs == null || idxs.isEmpty()) return List.of();
        ArrayList<Word> out = new ArrayList<>(idxs.size());
        for (Long idx : idxs) out.add(wordAt(table, idx));
        return out;
    }

    private static Word wordAt(List<WordRecord> table, Long idx) {
        if (idx == null || idx < 0 || idx >= table.size()) return Word.INVALID;
        WordRecord wr = table.get(idx.intValue());
        if (wr == null) return Word.INVALID;
        return Word.raw(wr.tag, wr.text);
    }

    // =========================
    // Wire records
    // =========================

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"chainLen", "chains", "words"})
    static final class BrainRecord {
        @JsonProperty("chainLen")
        public long chainLen;

        @JsonProperty("chains")
        public List<ChainRecord> chains;

        @JsonProperty("words")
        public List<WordRecord> words;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"w", "a", "b", "s", "e"})
    static final class ChainRecord {
        @JsonProperty("w")
        public List<Long> words;

        @JsonProperty("a")
        public List<Long> after;

        @JsonProperty("b")
        public List<Long> before;

        @JsonProperty("s")
        public boolean canStart;

        @JsonProperty("e")
        public boolean canEnd;
    }

    /** Encoded as the two-element array {@code [text, tag]}. */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"text", "tag"})
    static final class WordRecord {
        @JsonProperty("text")
        public String text;

        @JsonProperty("tag")
        public String tag;

        public WordRecord() {}

        WordRecord(String text, String tag) {
            this.text = text;
            this.tag = tag;
        }
    }
}
