package org.calista.clausegraph.adapter;

import org.calista.clausegraph.graph.CandidateGraph;
import org.calista.clausegraph.graph.FeatureKeys;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.solution.SolvedClauseNode;
import org.calista.clausegraph.solution.SolverSolution;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;
import org.calista.clausegraph.solve.tree.ClauseTreeAssembler;
import org.calista.clausegraph.util.Scores;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * LegacyClauseAdapter maps a solution onto the older clause-row contract consumed by the
 * linking and review paths.
 *
 * <p>Spans are shifted by the section's global offset and clamped so that
 * {@code 0 <= span_start <= span_end}. The header text is the trimmed text that follows the
 * local span, at most {@value #HEADER_CHARS} chars.</p>
 */
public final class LegacyClauseAdapter {

    public static final int HEADER_CHARS = 80;
    public static final int MIN_RUN_LENGTH = 2;

    public List<LegacyClauseRow> adapt(SolverSolution solution, CandidateGraph graph, String text) {
        return adapt(solution, graph, text, 0);
    }

    public List<LegacyClauseRow> adapt(SolverSolution solution, CandidateGraph graph, String text, int globalOffset) {
        Objects.requireNonNull(solution, "solution");
        Objects.requireNonNull(graph, "graph");
        final String body = text == null ? "" : text;

        Map<String, NodeCandidate> candidateById = new HashMap<>();
        for (NodeCandidate c : graph.nodeCandidates) candidateById.put(c.nodeCandidateId, c);

        Map<String, List<String>> childrenByParent = new HashMap<>();
        Map<String, Integer> siblingCount = new HashMap<>();
        for (SolvedClauseNode n : solution.nodes) {
            siblingCount.merge(n.parentId, 1, Integer::sum);
            if (!n.parentId.isEmpty()) {
                childrenByParent.computeIfAbsent(n.parentId, k -> new ArrayList<>()).add(n.clauseId);
            }
        }
        childrenByParent.values().forEach(v -> v.sort(null));

        List<SolvedClauseNode> ordered = new ArrayList<>(solution.nodes);
        ordered.sort(ClauseTreeAssembler.OUTPUT_ORDER);

        List<LegacyClauseRow> rows = new ArrayList<>(ordered.size());
        for (SolvedClauseNode n : ordered) {
            NodeCandidate c = candidateById.get(n.nodeCandidateId);

            String label = (c != null && !c.rawLabel.isEmpty()) ? c.rawLabel : "(" + lastSegment(n.clauseId) + ")";
            double indentation = c != null ? c.featureVector.number(FeatureKeys.INDENTATION) : 0.0;
            boolean anchorOk = c != null && c.featureVector.flag(FeatureKeys.ANCHOR);

            int start = Math.max(0, n.spanStart + globalOffset);
            int end = Math.max(start, n.spanEnd + globalOffset);

            String demotion = n.parseStatus == ParseStatus.ABSTAIN
                    ? n.abstainReasonCodes.stream().map(ReasonCode::code).collect(Collectors.joining("; "))
                    : "";

            rows.add(new LegacyClauseRow(
                    n.clauseId,
                    label,
                    n.depth,
                    n.levelType.code(),
                    start,
                    end,
                    header(body, n.spanEnd),
                    n.parentId,
                    childrenByParent.getOrDefault(n.clauseId, List.of()),
                    anchorOk,
                    siblingCount.getOrDefault(n.parentId, 0) >= MIN_RUN_LENGTH,
                    true,
                    Scores.round(indentation, 4),
                    n.xrefSuspected,
                    n.structuralCandidate,
                    n.confidenceScore,
                    demotion,
                    n.parseStatus,
                    n.abstainReasonCodes,
                    n.solverMargin
            ));
        }
        return rows;
    }

    public LinkPayload buildLinkPayload(SolverSolution solution, CandidateGraph graph, String text, int globalOffset) {
        List<LegacyClauseRow> rows = adapt(solution, graph, text, globalOffset);
        return new LinkPayload(
                solution.parseRunId,
                solution.parserVersion,
                solution.sectionKey,
                solution.sectionParseStatus,
                solution.sectionReasonCodes,
                solution.criticalNodeAbstainRatio,
                solution.abstainedTokenIds,
                rows);
    }

    private static String header(String text, int localSpanEnd) {
        if (localSpanEnd >= text.length()) return "";
        int from = Math.max(0, localSpanEnd);
        int to = Math.min(text.length(), from + HEADER_CHARS);
        return text.substring(from, to).trim();
    }

    private static String lastSegment(String clauseId) {
        int dot = clauseId.lastIndexOf('.');
        return dot < 0 ? clauseId : clauseId.substring(dot + 1);
    }
}
