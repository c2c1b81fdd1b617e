package org.calista.clausegraph.solve.tree;

import org.calista.clausegraph.graph.FeatureKeys;
import org.calista.clausegraph.graph.FeatureVector;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.graph.ParentEdgeCandidate;
import org.calista.clausegraph.solution.SolvedClauseNode;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;
import org.calista.clausegraph.solve.decision.TokenDecision;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ClauseTreeAssembler turns selected nodes and edges into an ordered list of clause nodes with
 * dotted, section-unique clause ids.
 *
 * <p>Depth-first pre-order from the root list. Siblings are visited by (span_start,
 * node_candidate_id). A segment is the normalized label, suffixed {@code _2}, {@code _3}, ... when
 * the same label already appeared under the same immediate parent. The suffix keeps counting up
 * while the resulting id is already taken, so literal labels such as {@code a_2} or labels
 * containing dots never produce a second copy of an id. Nodes not reachable from a
 * root edge are not emitted. The output is re-sorted by (span_start, clause_id).</p>
 */
public final class ClauseTreeAssembler {

    public static final Comparator<SolvedClauseNode> OUTPUT_ORDER =
            Comparator.<SolvedClauseNode>comparingInt(n -> n.spanStart).thenComparing(n -> n.clauseId);

    public List<SolvedClauseNode> assemble(Map<String, NodeCandidate> selected,
                                           List<ParentEdgeCandidate> selectedEdges,
                                           Map<String, TokenDecision> decisionsByToken) {
        Objects.requireNonNull(selected, "selected");
        Objects.requireNonNull(selectedEdges, "selectedEdges");
        Objects.requireNonNull(decisionsByToken, "decisionsByToken");

        Comparator<String> siblingOrder = Comparator.<String>comparingInt(id -> selected.get(id).spanStart)
                .thenComparing(id -> id);

        List<String> roots = new ArrayList<>();
        Map<String, List<String>> childrenByParent = new HashMap<>();
        for (ParentEdgeCandidate e : selectedEdges) {
            if (!selected.containsKey(e.childCandidateId)) continue;
            if (e.root) {
                roots.add(e.childCandidateId);
            } else {
                childrenByParent.computeIfAbsent(e.parentCandidateId, k -> new ArrayList<>()).add(e.childCandidateId);
            }
        }
        roots.sort(siblingOrder);
        for (List<String> children : childrenByParent.values()) children.sort(siblingOrder);

        Walk walk = new Walk(selected, childrenByParent, decisionsByToken);
        for (String rootId : roots) walk.emit(rootId, "", 1);

        List<SolvedClauseNode> out = walk.out;
        out.sort(OUTPUT_ORDER);
        return out;
    }

    private static final class Walk {
        private final Map<String, NodeCandidate> selected;
        private final Map<String, List<String>> childrenByParent;
        private final Map<String, TokenDecision> decisionsByToken;

        // parent clause id -> label -> times used
        private final Map<String, Map<String, Integer>> labelUse = new HashMap<>();
        private final Set<String> issued = new HashSet<>();
        private final List<SolvedClauseNode> out = new ArrayList<>();

        Walk(Map<String, NodeCandidate> selected,
             Map<String, List<String>> childrenByParent,
             Map<String, TokenDecision> decisionsByToken) {
            this.selected = selected;
            this.childrenByParent = childrenByParent;
            this.decisionsByToken = decisionsByToken;
        }

        void emit(String candidateId, String parentClauseId, int depth) {
            NodeCandidate c = selected.get(candidateId);
            TokenDecision d = decisionsByToken.get(c.tokenId);
            if (d == null) return;

            Map<String, Integer> used = labelUse.computeIfAbsent(parentClauseId, k -> new HashMap<>());
            int n = used.merge(c.normalizedLabel, 1, Integer::sum);
            String clauseId = clauseId(parentClauseId, c.normalizedLabel, n);
            while (!issued.add(clauseId)) {
                n++;
                clauseId = clauseId(parentClauseId, c.normalizedLabel, n);
            }
            used.put(c.normalizedLabel, n);

            FeatureVector f = c.featureVector;
            List<ReasonCode> reasons = d.status == ParseStatus.ACCEPTED ? List.of() : d.reasonCodes;

            out.add(new SolvedClauseNode(
                    c.nodeCandidateId,
                    clauseId,
                    parentClauseId,
                    depth,
                    c.levelType,
                    c.spanStart,
                    c.spanEnd,
                    d.status != ParseStatus.ABSTAIN,
                    f.flag(FeatureKeys.XREF_KEYWORD_PRE) || f.flag(FeatureKeys.XREF_PREPOSITION_PRE),
                    d.status,
                    reasons,
                    d.marginAbs,
                    d.confidenceScore
            ));

            for (String childId : childrenByParent.getOrDefault(candidateId, List.of())) {
                emit(childId, clauseId, depth + 1);
            }
        }

        private static String clauseId(String parentClauseId, String label, int n) {
            String segment = n == 1 ? label : label + "_" + n;
            return parentClauseId.isEmpty() ? segment : parentClauseId + "." + segment;
        }
    }
}
