package org.calista.chainhal.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.chainhal.brain.Brain;
import org.calista.chainhal.brain.BrainSnapshotCodec;
import org.calista.chainhal.brain.BrainSnapshotStore;
import org.calista.chainhal.io.FileIO;
import org.calista.chainhal.learn.Learner;
import org.calista.chainhal.learn.impl.BrainLearner;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.annotator.Annotator;
import org.calista.chainhal.text.annotator.impl.RuleBasedAnnotator;
import org.calista.chainhal.think.Conversation;
import org.calista.chainhal.think.TextGenerator;
import org.calista.chainhal.think.impl.ChainWalkGenerator;
import org.calista.chainhal.train.TrainingInputParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * HalKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> load/create config, open IO, load (or create) the brain
 *   2) use               -> chat / train through the accessors
 *   3) saveBrain()       -> persist the snapshot
 *
 * The brain is owned by the kernel and handed to every collaborator; there is no global instance.
 */
public final class HalKernel {

    private static final Logger log = LoggerFactory.getLogger(HalKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final HalConfig cfg;

    private final Brain brain;
    private final BrainSnapshotStore snapshots;
    private final Annotator annotator;
    private final TextGenerator generator;
    private final TrainingInputParser trainingParser;

    private HalKernel(FileIO io,
                      ObjectMapper mapper,
                      HalConfig cfg,
                      Brain brain,
                      BrainSnapshotStore snapshots,
                      Annotator annotator,
                      Random rnd) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.brain = Objects.requireNonNull(brain, "brain");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.generator = new ChainWalkGenerator(brain, rnd, cfg.brain.continueChance);
        this.trainingParser = new TrainingInputParser(annotator, mapper);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Directory the config file is resolved against. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private Annotator annotator;
        private Random random;

        /** Overrides brain.snapshotFile; resolved against the working directory. */
        private Path brainFile;

        private boolean requireExistingBrain = false;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder annotator(Annotator annotator) {
            this.annotator = Objects.requireNonNull(annotator, "annotator");
            return this;
        }

        public Builder random(Random random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public Builder brainFile(Path brainFile) {
            this.brainFile = brainFile;
            return this;
        }

        /** When set, a missing snapshot fails the build instead of starting an empty brain. */
        public Builder requireExistingBrain(boolean v) {
            this.requireExistingBrain = v;
            return this;
        }

        public HalKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, charset);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            HalConfig cfg = HalConfig.loadOrCreate(external, cfgPath, om);

            FileIO io = new FileIO(configRoot.resolve(cfg.baseDir), charset);

            Path snapshotPath = (brainFile != null)
                    ? io.resolveExternal(brainFile.toString())
                    : io.resolve(cfg.brain.snapshotFile);
            BrainSnapshotStore snapshots = new BrainSnapshotStore(io, new BrainSnapshotCodec(), snapshotPath);

            Brain brain = requireExistingBrain ? snapshots.load() : snapshots.loadOrCreate();

            Random rnd = (random != null) ? random
                    : (cfg.brain.seed != 0L ? new Random(cfg.brain.seed) : new Random());
            Annotator ann = (annotator != null) ? annotator : ruleBasedAnnotator(cfg.annotator);

            HalKernel k = new HalKernel(io, om, cfg, brain, snapshots, ann, rnd);
            log.info("HalKernel created: config={}, baseDir={}, brain={}, chains={}",
                    cfgPath, io.baseDir(), snapshotPath, brain.chainCount());
            return k;
        }

        private static RuleBasedAnnotator ruleBasedAnnotator(HalConfig.AnnotatorSection a) {
            RuleBasedAnnotator.Config rc = new RuleBasedAnnotator.Config();
            rc.maxTokenLength = a.maxTokenLength;
            rc.keepUrls = a.keepUrls;
            rc.keepEmails = a.keepEmails;
            rc.keepHashtags = a.keepHashtags;
            rc.keepMentions = a.keepMentions;
            return new RuleBasedAnnotator(rc);
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Operations
    // ---------------------------------------------------------------------

    /**
     * Learns every corpus file in order, saving the brain after each file that was read.
     * With {@code training.failFast} the first unreadable file aborts the run.
     *
     * @return number of sentences learned
     */
    public int train(List<Path> corpusFiles) throws IOException {
        Objects.requireNonNull(corpusFiles, "corpusFiles");
        Learner learner = new BrainLearner(brain, annotator, false);

        int total = 0;
        for (Path f : corpusFiles) {
            Path file = io.resolveExternal(f.toString());
            List<Sentence> sentences;
            try {
                log.info("Reading training content from {}...", file);
                sentences = trainingParser.parseFile(io, file);
            } catch (IOException e) {
                if (cfg.training.failFast) throw new IOException("Failed to read " + file + ": " + e.getMessage(), e);
                log.warn("Skipping {}: {}", file, e.toString());
                continue;
            }

            log.info("Sentences found: {}", sentences.size());
            if (log.isDebugEnabled()) {
                sentences.stream().limit(5).forEach(s -> log.debug("- {}", s));
            }
            total += learner.learnSentences(sentences);

            // overwrite the snapshot after each successful import
            saveBrain();
        }
        log.info("Training done: files={}, sentencesLearned={}, chains={}", corpusFiles.size(), total, brain.chainCount());
        return total;
    }

    /** A chat session bound to this kernel's brain and config. */
    public Conversation conversation() {
        Learner learner = new BrainLearner(brain, annotator, cfg.chat.trimPeriods);
        return new Conversation(generator, learner, cfg.chat.learnFromUser);
    }

    public void saveBrain() throws IOException {
        snapshots.save(brain);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public HalConfig config() { return cfg; }
    public Brain brain() { return brain; }
    public BrainSnapshotStore snapshotStore() { return snapshots; }
    public Annotator annotator() { return annotator; }
    public TextGenerator generator() { return generator; }
    public TrainingInputParser trainingParser() { return trainingParser; }
}
