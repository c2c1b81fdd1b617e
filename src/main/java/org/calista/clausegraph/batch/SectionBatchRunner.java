package org.calista.clausegraph.batch;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.clausegraph.core.SolverConfig;
import org.calista.clausegraph.core.SolverOptions;
import org.calista.clausegraph.solution.SolverSolution;
import org.calista.clausegraph.solve.CandidateGraphSolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SectionBatchRunner solves independent sections, optionally on an owned worker pool.
 *
 * Results come back in input order whatever the parallelism. The pool (when parallelism > 1) is
 * created here and released by {@link #close()}.
 */
public final class SectionBatchRunner implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(SectionBatchRunner.class);

    private final CandidateGraphSolver solver;
    private final SolverOptions options;
    private final SolverConfig.Batch cfg;
    private final ExecutorService pool; // null => caller thread

    public SectionBatchRunner(CandidateGraphSolver solver, SolverOptions options, SolverConfig.Batch cfg) {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.options = Objects.requireNonNull(options, "options");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.pool = cfg.parallelism > 1 ? createPool(cfg) : null;
        log.debug("SectionBatchRunner init: parallelism={}, queueCapacity={}", Math.max(1, cfg.parallelism), cfg.queueCapacity);
    }

    public List<SolverSolution> run(List<SectionRecord> records) {
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) return List.of();

        if (pool == null) {
            List<SolverSolution> out = new ArrayList<>(records.size());
            for (SectionRecord r : records) out.add(solveOne(r));
            return out;
        }

        List<CompletableFuture<SolverSolution>> futures = new ArrayList<>(records.size());
        for (SectionRecord r : records) {
            futures.add(CompletableFuture.supplyAsync(() -> solveOne(r), pool));
        }

        List<SolverSolution> out = new ArrayList<>(records.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("section solve failed: section={}", records.get(i).sectionKey, cause);
                if (cause instanceof RuntimeException re) throw re;
                throw e;
            }
        }
        return out;
    }

    private SolverSolution solveOne(SectionRecord r) {
        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("section", r.sectionKey)) {
            return solver.solve(r.graph, r.sectionKey, options);
        }
    }

    @Override
    public void close() {
        shutdownExecutor(pool, cfg.shutdownTimeoutMs);
    }

    private static ExecutorService createPool(SolverConfig.Batch cfg) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = Math.max(1, cfg.parallelism);

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, cfg.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        // bounded queue + CallerRunsPolicy => backpressure
        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, cfg.queueCapacity)),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        if (es == null) return;

        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }
}
