package org.calista.clausegraph.solve.aggregate;

import org.calista.clausegraph.core.SolverOptions;
import org.calista.clausegraph.graph.CandidateGraph;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.graph.ParentEdgeCandidate;
import org.calista.clausegraph.solution.Alternative;
import org.calista.clausegraph.solution.ObjectiveComponents;
import org.calista.clausegraph.solution.SolvedClauseNode;
import org.calista.clausegraph.solution.SolverDiagnostics;
import org.calista.clausegraph.solution.SolverSolution;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;
import org.calista.clausegraph.solve.Scored;
import org.calista.clausegraph.solve.decision.TokenDecision;
import org.calista.clausegraph.solve.decision.TokenDecisions;
import org.calista.clausegraph.solve.edge.EdgeResolution;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import static org.calista.clausegraph.util.Scores.round6;

/**
 * SectionAggregator folds token decisions, edge resolution and the assembled tree into a
 * {@link SolverSolution}.
 *
 * <p>Section status is a one-shot classification: abstain when the abstained share of tokens
 * reaches the ratio threshold (or there are no tokens at all), review when any token is review or
 * abstained, accepted otherwise.</p>
 */
public final class SectionAggregator {

    public SolverSolution aggregate(String sectionKey,
                                    CandidateGraph graph,
                                    TokenDecisions decisions,
                                    EdgeResolution edges,
                                    List<SolvedClauseNode> nodes,
                                    SolverOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(decisions, "decisions");
        Objects.requireNonNull(edges, "edges");
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(options, "options");

        List<TokenDecision> all = decisions.decisions;

        TreeSet<String> selectedIds = new TreeSet<>();
        TreeSet<String> abstainedIds = new TreeSet<>();
        double nodeTotal = 0.0;
        double marginSum = 0.0;
        boolean anyReview = false;
        TreeSet<ReasonCode> reasons = new TreeSet<>(ReasonCode.BY_CODE);

        for (TokenDecision d : all) {
            if (d.hasSelection()) {
                selectedIds.add(d.selected.nodeCandidateId);
                nodeTotal += d.confidenceScore;
            }
            if (d.status == ParseStatus.ABSTAIN) abstainedIds.add(d.tokenId);
            if (d.status == ParseStatus.REVIEW) anyReview = true;
            marginSum += d.marginAbs;
            reasons.addAll(d.reasonCodes);
        }
        if (edges.hasConflicts()) reasons.add(ReasonCode.PARENT_CONFLICT);

        TreeSet<String> edgeIds = new TreeSet<>();
        for (ParentEdgeCandidate e : edges.selectedEdges) edgeIds.add(e.edgeId);

        double nodeScoreTotal = round6(nodeTotal);
        double objective = round6(nodeScoreTotal + edges.edgeScoreTotal);
        double avgMargin = all.isEmpty() ? 0.0 : round6(marginSum / all.size());
        double top1 = objective;
        double top2 = round6(Math.max(0.0, objective - avgMargin));
        double marginAbs = round6(Math.max(0.0, top1 - top2));
        double marginRatio = round6(top1 > 0.0 ? marginAbs / top1 : 0.0);
        double abstainRatio = round6((double) abstainedIds.size() / Math.max(1, all.size()));

        ParseStatus status;
        if (all.isEmpty() || abstainRatio >= options.sectionAbstainRatioThreshold) {
            status = ParseStatus.ABSTAIN;
            reasons.add(ReasonCode.INSUFFICIENT_CONTEXT);
        } else if (anyReview || !abstainedIds.isEmpty()) {
            status = ParseStatus.REVIEW;
        } else {
            status = ParseStatus.ACCEPTED;
        }

        TreeSet<String> warnings = new TreeSet<>(decisions.warnings);
        warnings.addAll(edges.warnings);

        SolverDiagnostics diagnostics = new SolverDiagnostics(
                graph.nodeCandidates.size(),
                graph.parentEdgeCandidates.size(),
                selectedIds.size(),
                edgeIds.size(),
                new ArrayList<>(warnings));

        return SolverSolution.builder()
                .parseRunId(RunIds.parseRunId(sectionKey, selectedIds, abstainedIds))
                .parserVersion(options.parserVersion)
                .sectionKey(sectionKey)
                .selectedNodeCandidates(new ArrayList<>(selectedIds))
                .selectedParentEdges(new ArrayList<>(edgeIds))
                .abstainedTokenIds(new ArrayList<>(abstainedIds))
                .objectiveScore(objective)
                .objectiveComponents(new ObjectiveComponents(nodeScoreTotal, edges.edgeScoreTotal, avgMargin))
                .topKAlternatives(alternatives(all))
                .solverDiagnostics(diagnostics)
                .nodes(nodes)
                .sectionParseStatus(status)
                .sectionReasonCodes(new ArrayList<>(reasons))
                .criticalNodeAbstainRatio(abstainRatio)
                .top1Score(top1)
                .top2Score(top2)
                .marginAbs(marginAbs)
                .marginRatio(marginRatio)
                .build();
    }

    static List<Alternative> alternatives(List<TokenDecision> decisions) {
        List<Alternative> out = new ArrayList<>(decisions.size() * 2);
        for (TokenDecision d : decisions) {
            int rank = 1;
            for (Scored<NodeCandidate> alt : d.alternatives) {
                out.add(new Alternative(d.tokenId, rank++, alt.item.nodeCandidateId, alt.score,
                        d.isSelected(alt.item.nodeCandidateId)));
            }
        }
        out.sort(Alternative.REPORT_ORDER);
        return out;
    }
}
