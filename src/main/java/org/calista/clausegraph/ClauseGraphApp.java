package org.calista.clausegraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.clausegraph.batch.BatchReport;
import org.calista.clausegraph.core.SolverKernel;

import java.io.IOException;
import java.nio.file.Path;

/**
 * ClauseGraphApp: batch runner.
 *
 * Lifecycle:
 *  1) build kernel (loads or creates the config)
 *  2) solve every section of the input file and write the solution sidecar
 *  3) print the report and close the kernel (owns the batch pool)
 */
public final class ClauseGraphApp {

    private static final Logger log = LogManager.getLogger(ClauseGraphApp.class);

    public static final String DEFAULT_CONFIG = "config/solver.json";

    private final Path cfgPath;

    public ClauseGraphApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public static void main(String[] args) throws Exception {
        Path cfg = Path.of(args.length > 0 && !args[0].isBlank() ? args[0] : DEFAULT_CONFIG);
        new ClauseGraphApp(cfg).run();
    }

    public BatchReport run() throws IOException {
        try (SolverKernel kernel = SolverKernel.builder().configRoot(Path.of(".")).build(cfgPath)) {
            BatchReport report = kernel.runBatch();
            log.info("\n{}", report.toBox());
            return report;
        }
    }

    public Path getCfgPath() { return cfgPath; }
}
