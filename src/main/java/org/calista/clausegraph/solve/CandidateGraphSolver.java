package org.calista.clausegraph.solve;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.clausegraph.core.SolverOptions;
import org.calista.clausegraph.graph.CandidateGraph;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.solution.SolvedClauseNode;
import org.calista.clausegraph.solution.SolverSolution;
import org.calista.clausegraph.solve.aggregate.SectionAggregator;
import org.calista.clausegraph.solve.decision.TokenDecisionEngine;
import org.calista.clausegraph.solve.decision.TokenDecisions;
import org.calista.clausegraph.solve.edge.EdgeResolution;
import org.calista.clausegraph.solve.edge.ParentEdgeResolver;
import org.calista.clausegraph.solve.score.EdgeScorer;
import org.calista.clausegraph.solve.score.NodeScorer;
import org.calista.clausegraph.solve.score.impl.LinearNodeScorer;
import org.calista.clausegraph.solve.score.impl.SoftPenaltyEdgeScorer;
import org.calista.clausegraph.solve.tree.ClauseTreeAssembler;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CandidateGraphSolver: one deterministic pass from a section's {@link CandidateGraph} to a
 * {@link SolverSolution}.
 *
 * Pipeline:
 *   1) token decisions (one interpretation per token, or abstain)
 *   2) parent edge resolution over the selected nodes
 *   3) tree assembly with dotted clause ids
 *   4) section aggregation (objective, verdict, run id)
 *
 * Stateless after construction and safe to share between threads.
 */
public final class CandidateGraphSolver {

    private static final Logger log = LogManager.getLogger(CandidateGraphSolver.class);

    public static final String DEFAULT_SECTION_KEY = "section::unknown";

    private final TokenDecisionEngine decisionEngine;
    private final ParentEdgeResolver edgeResolver;
    private final ClauseTreeAssembler treeAssembler;
    private final SectionAggregator aggregator;
    private final SolverOptions defaults;

    private CandidateGraphSolver(Builder b) {
        this.decisionEngine = new TokenDecisionEngine(b.nodeScorer);
        this.edgeResolver = new ParentEdgeResolver(b.edgeScorer);
        this.treeAssembler = new ClauseTreeAssembler();
        this.aggregator = new SectionAggregator();
        this.defaults = b.options;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Solver with the default scoring model and default options. */
    public static CandidateGraphSolver withDefaults() {
        return builder().build();
    }

    public SolverOptions options() {
        return defaults;
    }

    public SolverSolution solve(CandidateGraph graph) {
        return solve(graph, DEFAULT_SECTION_KEY, defaults);
    }

    public SolverSolution solve(CandidateGraph graph, String sectionKey) {
        return solve(graph, sectionKey, defaults);
    }

    public SolverSolution solve(CandidateGraph graph, String sectionKey, SolverOptions options) {
        final CandidateGraph g = graph == null ? CandidateGraph.empty() : graph;
        final String key = (sectionKey == null || sectionKey.isBlank()) ? DEFAULT_SECTION_KEY : sectionKey;
        final SolverOptions opt = options == null ? defaults : options;

        long started = System.nanoTime();

        TokenDecisions decisions = decisionEngine.decide(g.nodeCandidates, opt);
        Map<String, NodeCandidate> selected = decisions.selectedCandidates();
        EdgeResolution edges = edgeResolver.resolve(selected, g.parentEdgeCandidates);
        List<SolvedClauseNode> nodes = treeAssembler.assemble(selected, edges.selectedEdges, decisions.byTokenId());
        SolverSolution solution = aggregator.aggregate(key, g, decisions, edges, nodes, opt);

        double runtimeMs = (System.nanoTime() - started) / 1_000_000.0;
        if (log.isDebugEnabled()) {
            log.debug("solved section={} runId={} status={} nodes={} abstained={} objective={} runtimeMs={}",
                    key, solution.parseRunId, solution.sectionParseStatus.code(), solution.nodes.size(),
                    solution.abstainedTokenIds.size(), solution.objectiveScore, String.format("%.3f", runtimeMs));
        }
        if (solution.sectionParseStatus == ParseStatus.ABSTAIN) {
            log.warn("section abstained: section={} ratio={} reasons={}",
                    key, solution.criticalNodeAbstainRatio, solution.sectionReasonCodes);
        }
        return solution;
    }

    public static final class Builder {
        private NodeScorer nodeScorer = new LinearNodeScorer();
        private EdgeScorer edgeScorer = new SoftPenaltyEdgeScorer();
        private SolverOptions options = SolverOptions.defaults();

        private Builder() {}

        public Builder nodeScorer(NodeScorer scorer) {
            this.nodeScorer = Objects.requireNonNull(scorer, "nodeScorer");
            return this;
        }

        public Builder edgeScorer(EdgeScorer scorer) {
            this.edgeScorer = Objects.requireNonNull(scorer, "edgeScorer");
            return this;
        }

        public Builder options(SolverOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public CandidateGraphSolver build() {
            return new CandidateGraphSolver(this);
        }
    }
}
