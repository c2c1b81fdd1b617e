package org.calista.clausegraph.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.clausegraph.adapter.LegacyClauseAdapter;
import org.calista.clausegraph.adapter.LinkPayload;
import org.calista.clausegraph.batch.BatchReport;
import org.calista.clausegraph.batch.GraphStore;
import org.calista.clausegraph.batch.SectionBatchRunner;
import org.calista.clausegraph.batch.SectionRecord;
import org.calista.clausegraph.batch.SolutionSink;
import org.calista.clausegraph.io.FileIO;
import org.calista.clausegraph.solution.SolutionCodec;
import org.calista.clausegraph.solution.SolverSolution;
import org.calista.clausegraph.solve.CandidateGraphSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SolverKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, bind IO to baseDir, build the solver
 *   2) runBatch()        -> load sections, solve, write the solution sidecar (and link payloads)
 *   3) close()           -> release the batch pool
 */
public final class SolverKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SolverKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final SolverConfig cfg;
    private final SolverOptions options;
    private final CandidateGraphSolver solver;
    private final SectionBatchRunner runner;

    private SolverKernel(FileIO io, ObjectMapper mapper, SolverConfig cfg, CandidateGraphSolver solver) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.solver = Objects.requireNonNull(solver, "solver");
        this.options = solver.options();
        this.runner = new SectionBatchRunner(solver, options, cfg.batch);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Directory the config file and a relative baseDir are resolved against. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private CandidateGraphSolver.Builder solver = CandidateGraphSolver.builder();

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

        /** Solver settings (scorers). Options always come from the config. */
        public Builder solver(CandidateGraphSolver.Builder solver) {
            this.solver = Objects.requireNonNull(solver, "solver");
            return this;
        }

        public SolverKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : SolutionCodec.defaultMapper();

            FileIO external = new FileIO(configRoot, FileIO.Options.builder().charset(charset).build());
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            SolverConfig cfg = SolverConfig.loadOrCreate(external, cfgPath, om);

            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, FileIO.Options.builder().charset(charset).build());

            CandidateGraphSolver s = solver.options(SolverOptions.from(cfg.solver)).build();

            SolverKernel k = new SolverKernel(io, om, cfg, s);
            k.logCreated(cfgPath);
            return k;
        }
    }

    // ---------------------------------------------------------------------
    // Batch
    // ---------------------------------------------------------------------

    /**
     * Solves every section of {@code batch.inputFile} and writes {@code batch.outputFile}, both
     * relative to the base directory. When {@code batch.linkPayloadFile} is set, the legacy link
     * payload of every section goes there as well, built from the record's text and offset.
     */
    public BatchReport runBatch() throws IOException {
        Path in = io.resolve(cfg.batch.inputFile);
        Path out = io.resolve(cfg.batch.outputFile);

        GraphStore.Loaded loaded = new GraphStore(io, mapper).load(in, cfg.batch.failFast);
        List<SolverSolution> solutions = runner.run(loaded.records);

        SolutionSink sink = new SolutionSink(io, new SolutionCodec(mapper));
        sink.write(out, solutions);
        if (!cfg.batch.linkPayloadFile.isBlank()) {
            sink.writeLinkPayloads(io.resolve(cfg.batch.linkPayloadFile), linkPayloads(loaded.records, solutions));
        }

        BatchReport report = BatchReport.of(solutions, loaded.report);
        log.info("Batch done: input={}, output={}, {}", in, out, report);
        return report;
    }

    // runner output is index-aligned with its input
    private static List<LinkPayload> linkPayloads(List<SectionRecord> records, List<SolverSolution> solutions) {
        LegacyClauseAdapter adapter = new LegacyClauseAdapter();
        List<LinkPayload> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            SectionRecord r = records.get(i);
            out.add(adapter.buildLinkPayload(solutions.get(i), r.graph, r.text, r.globalOffset));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public SolverConfig config() { return cfg; }
    public SolverOptions options() { return options; }
    public CandidateGraphSolver solver() { return solver; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        runner.close();
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("SolverKernel created: config={}, baseDir={}, options={}", cfgPath, io.baseDir(), options);
    }
}
