package org.calista.chainhal.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.chainhal.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * HalConfig — plain POJO config:
 * - defaults live in the field initializers
 * - loadOrCreate() writes the default file when it is missing or blank
 * - validate() clamps/normalizes values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class HalConfig {

    private static final Logger log = LoggerFactory.getLogger(HalConfig.class);

    public String baseDir = "data";
    public BrainSection brain = new BrainSection();
    public Training training = new Training();
    public Chat chat = new Chat();
    public AnnotatorSection annotator = new AnnotatorSection();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BrainSection {
        /** Snapshot file, relative to baseDir. */
        public String snapshotFile = "chainhal.brain";

        /** Times out of 256 a sentence keeps growing past a point where it could end. */
        public int continueChance = 128;

        /** 0 => seeded from the clock. */
        public long seed = 0L;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Training {
        /** Stop at the first corpus file that cannot be read; otherwise skip it. */
        public boolean failFast = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Chat {
        public boolean learnFromUser = true;

        /** Learn user sentences without their trailing period. */
        public boolean trimPeriods = true;

        /** Save the brain every N turns; 0 => only on exit. */
        public int saveEveryTurns = 0;
    }

    /** Switches of the built-in rule-based annotator; ignored when a custom annotator is supplied. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AnnotatorSection {
        public int maxTokenLength = 64;
        public boolean keepUrls = true;
        public boolean keepEmails = true;
        public boolean keepHashtags = true;
        public boolean keepMentions = true;
    }

    // -------------------- Load / Create --------------------

    public static HalConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        Optional<String> json = io.readStringIfExists(configFile);
        if (json.isEmpty()) {
            HalConfig created = new HalConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json.get().isBlank()) {
            HalConfig created = new HalConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        HalConfig cfg = mapper.readValue(json.get(), HalConfig.class);
        if (cfg == null) cfg = new HalConfig();

        cfg.validate();
        return cfg;
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, HalConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (brain == null) brain = new BrainSection();
        if (brain.snapshotFile == null || brain.snapshotFile.isBlank()) brain.snapshotFile = "chainhal.brain";
        if (brain.continueChance < 0) brain.continueChance = 0;
        if (brain.continueChance > 255) brain.continueChance = 255;

        if (training == null) training = new Training();

        if (chat == null) chat = new Chat();
        if (chat.saveEveryTurns < 0) chat.saveEveryTurns = 0;

        if (annotator == null) annotator = new AnnotatorSection();
        if (annotator.maxTokenLength < 1) annotator.maxTokenLength = 64;
    }
}
