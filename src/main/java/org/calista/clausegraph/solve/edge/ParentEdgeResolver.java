package org.calista.clausegraph.solve.edge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.graph.ParentEdgeCandidate;
import org.calista.clausegraph.solve.Scored;
import org.calista.clausegraph.solve.score.EdgeScorer;
import org.calista.clausegraph.util.Scores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ParentEdgeResolver selects exactly one incoming edge for every selected node, or drops it.
 *
 * <p>Nodes are resolved left to right, shallow to deep: (span_start, span_end, depth_hint,
 * node_candidate_id). An edge is eligible when it is hard-valid and either a root edge or its
 * parent is a selected node candidate. Eligible edges rank by (score desc, non-root first,
 * edge_id asc).</p>
 *
 * <p>A node without any eligible edge gets a {@code parent_conflict:<id>} warning and no edge, so
 * it is left out of the assembled tree.</p>
 */
public final class ParentEdgeResolver {

    private static final Logger log = LogManager.getLogger(ParentEdgeResolver.class);

    public static final String WARN_PARENT_CONFLICT = "parent_conflict:";

    static final Comparator<NodeCandidate> RESOLUTION_ORDER =
            Comparator.<NodeCandidate>comparingInt(n -> n.spanStart)
                    .thenComparingInt(n -> n.spanEnd)
                    .thenComparingInt(n -> n.depthHint)
                    .thenComparing(n -> n.nodeCandidateId);

    static final Comparator<Scored<ParentEdgeCandidate>> EDGE_RANKING =
            Comparator.<Scored<ParentEdgeCandidate>>comparingDouble(s -> -s.score)
                    .thenComparingInt(s -> s.item.root ? 1 : 0)
                    .thenComparing(s -> s.item.edgeId);

    private final EdgeScorer scorer;

    public ParentEdgeResolver(EdgeScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public EdgeResolution resolve(Map<String, NodeCandidate> selected, List<ParentEdgeCandidate> edges) {
        Objects.requireNonNull(selected, "selected");
        if (selected.isEmpty()) return new EdgeResolution(List.of(), List.of(), 0.0);

        // edges whose child is not a selected node are never looked up, hence never selected
        Map<String, List<ParentEdgeCandidate>> edgesByChild = new HashMap<>();
        if (edges != null) {
            for (ParentEdgeCandidate e : edges) {
                edgesByChild.computeIfAbsent(e.childCandidateId, k -> new ArrayList<>(4)).add(e);
            }
        }

        List<NodeCandidate> ordered = new ArrayList<>(selected.values());
        ordered.sort(RESOLUTION_ORDER);

        List<ParentEdgeCandidate> chosen = new ArrayList<>(ordered.size());
        List<String> warnings = new ArrayList<>();
        double total = 0.0;

        for (NodeCandidate child : ordered) {
            List<Scored<ParentEdgeCandidate>> eligible = new ArrayList<>();
            for (ParentEdgeCandidate e : edgesByChild.getOrDefault(child.nodeCandidateId, List.of())) {
                if (!isEligible(e, selected)) continue;
                eligible.add(Scored.of(e, scorer.score(e)));
            }

            if (eligible.isEmpty()) {
                warnings.add(WARN_PARENT_CONFLICT + child.nodeCandidateId);
                log.debug("No eligible parent edge for {}; node dropped from tree", child.nodeCandidateId);
                continue;
            }

            eligible.sort(EDGE_RANKING);
            Scored<ParentEdgeCandidate> best = eligible.get(0);
            chosen.add(best.item);
            total += best.score;
        }

        return new EdgeResolution(chosen, warnings, Scores.round6(total));
    }

    private static boolean isEligible(ParentEdgeCandidate e, Map<String, NodeCandidate> selected) {
        if (!e.hardValid) return false;
        return e.root || selected.containsKey(e.parentCandidateId);
    }
}
