package org.calista.clausegraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.clausegraph.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * SolverConfig: plain POJO config.
 * - defaults live in the fields
 * - loadOrCreate() writes a default file when it is missing or blank
 * - validate() normalizes values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SolverConfig {

    private static final Logger log = LoggerFactory.getLogger(SolverConfig.class);

    public String baseDir = "data";
    public Solver solver = new Solver();
    public Batch batch = new Batch();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Solver {
        public String parserVersion = SolverOptions.DEFAULT_PARSER_VERSION;

        // token decision bands
        public double abstainMarginThreshold = SolverOptions.DEFAULT_ABSTAIN_MARGIN_THRESHOLD;
        public double reviewMarginThreshold = SolverOptions.DEFAULT_REVIEW_MARGIN_THRESHOLD;
        public double minTop1Score = SolverOptions.DEFAULT_MIN_TOP1_SCORE;
        public double singleCandidateGap = SolverOptions.DEFAULT_SINGLE_CANDIDATE_GAP;

        // section verdict
        public double sectionAbstainRatioThreshold = SolverOptions.DEFAULT_SECTION_ABSTAIN_RATIO_THRESHOLD;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Batch {
        /** JSONL of section records, relative to baseDir. */
        public String inputFile = "sections.jsonl";

        /** JSONL solution sidecar, relative to baseDir. */
        public String outputFile = "solutions.jsonl";

        /** Optional JSONL of legacy link payloads, relative to baseDir. Empty => not written. */
        public String linkPayloadFile = "";

        public boolean failFast = false;

        /** Worker threads. 1 => solve on the calling thread, 0 => auto. */
        public int parallelism = 1;

        /** Bounded queue capacity (backpressure via CallerRunsPolicy). */
        public int queueCapacity = 1024;

        /** Thread name prefix for observability. */
        public String threadNamePrefix = "section-solve-";

        /** Shutdown timeout for the pool on close. */
        public long shutdownTimeoutMs = 2500;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. When the file is missing (or empty) a default one is written to disk.
     */
    public static SolverConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            SolverConfig created = new SolverConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            SolverConfig created = new SolverConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        SolverConfig cfg = mapper.readValue(json, SolverConfig.class);
        if (cfg == null) cfg = new SolverConfig();

        cfg.validate();
        return cfg;
    }

    /**
     * Overwrites the config on disk (pretty JSON).
     */
    public static void save(FileIO io, Path configFile, ObjectMapper mapper, SolverConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, SolverConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (solver == null) solver = new Solver();
        if (solver.parserVersion == null) solver.parserVersion = SolverOptions.DEFAULT_PARSER_VERSION;
        solver.abstainMarginThreshold = nonNegative(solver.abstainMarginThreshold,
                SolverOptions.DEFAULT_ABSTAIN_MARGIN_THRESHOLD);
        solver.reviewMarginThreshold = Math.max(solver.abstainMarginThreshold,
                nonNegative(solver.reviewMarginThreshold, SolverOptions.DEFAULT_REVIEW_MARGIN_THRESHOLD));
        solver.minTop1Score = nonNegative(solver.minTop1Score, SolverOptions.DEFAULT_MIN_TOP1_SCORE);
        solver.singleCandidateGap = nonNegative(solver.singleCandidateGap, SolverOptions.DEFAULT_SINGLE_CANDIDATE_GAP);
        solver.sectionAbstainRatioThreshold = nonNegative(solver.sectionAbstainRatioThreshold,
                SolverOptions.DEFAULT_SECTION_ABSTAIN_RATIO_THRESHOLD);

        if (batch == null) batch = new Batch();
        if (batch.inputFile == null || batch.inputFile.isBlank()) batch.inputFile = "sections.jsonl";
        if (batch.outputFile == null || batch.outputFile.isBlank()) batch.outputFile = "solutions.jsonl";
        if (batch.linkPayloadFile == null) batch.linkPayloadFile = "";
        if (batch.parallelism <= 0) batch.parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        if (batch.queueCapacity <= 0) batch.queueCapacity = 1024;
        if (batch.threadNamePrefix == null || batch.threadNamePrefix.isBlank()) batch.threadNamePrefix = "section-solve-";
        if (batch.shutdownTimeoutMs <= 0) batch.shutdownTimeoutMs = 2500;
    }

    private static double nonNegative(double v, double fallback) {
        return (!Double.isFinite(v) || v < 0.0) ? fallback : v;
    }
}
