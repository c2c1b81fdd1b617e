package org.calista.clausegraph.solve.decision;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.clausegraph.core.SolverOptions;
import org.calista.clausegraph.graph.FeatureKeys;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.solve.ReasonCode;
import org.calista.clausegraph.solve.Scored;
import org.calista.clausegraph.solve.score.NodeScorer;
import org.calista.clausegraph.util.Scores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TokenDecisionEngine picks one interpretation per token, or abstains.
 *
 * <p>Tokens are processed by ascending minimum {@code token_index} of their candidates; ties keep
 * first-appearance order. Within a token, candidates rank by (score desc, depth_hint asc,
 * node_candidate_id asc).</p>
 *
 * <p>Classification of the top candidate:</p>
 * <ul>
 *   <li>abstain when score &lt; min top-1 score or margin &lt; abstain threshold
 *       ({@code low_margin}, plus {@code xref_conflict} when the preposition flag is set)</li>
 *   <li>review with exactly one reason, first match of: margin &lt; review threshold
 *       ({@code low_margin}), preposition flag ({@code xref_conflict}), no anchor
 *       ({@code layout_uncertain})</li>
 *   <li>accepted otherwise</li>
 * </ul>
 */
public final class TokenDecisionEngine {

    private static final Logger log = LogManager.getLogger(TokenDecisionEngine.class);

    public static final String WARN_AMBIGUOUS_ABSTAIN = "ambiguous_abstain:";

    private final NodeScorer scorer;

    public TokenDecisionEngine(NodeScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public TokenDecisions decide(List<NodeCandidate> candidates, SolverOptions options) {
        Objects.requireNonNull(options, "options");
        if (candidates == null || candidates.isEmpty()) return new TokenDecisions(List.of(), List.of());

        LinkedHashMap<String, List<NodeCandidate>> byToken = new LinkedHashMap<>();
        for (NodeCandidate c : candidates) {
            byToken.computeIfAbsent(c.tokenId, k -> new ArrayList<>(2)).add(c);
        }

        // stable sort: equal minimum index keeps first-appearance order
        List<Map.Entry<String, List<NodeCandidate>>> ordered = new ArrayList<>(byToken.entrySet());
        ordered.sort(Comparator.comparingInt(e -> minTokenIndex(e.getValue())));

        List<TokenDecision> decisions = new ArrayList<>(ordered.size());
        List<String> warnings = new ArrayList<>();

        for (Map.Entry<String, List<NodeCandidate>> e : ordered) {
            String tokenId = e.getKey();
            List<NodeCandidate> group = e.getValue();

            TokenDecision d = decideToken(tokenId, group, options);
            decisions.add(d);

            if (group.size() > 1 && !d.hasSelection()) {
                warnings.add(WARN_AMBIGUOUS_ABSTAIN + tokenId);
            }
            if (log.isTraceEnabled()) log.trace("token decision: {}", d);
        }
        return new TokenDecisions(decisions, warnings);
    }

    private TokenDecision decideToken(String tokenId, List<NodeCandidate> group, SolverOptions options) {
        List<Scored<NodeCandidate>> ranked = rank(group);

        Scored<NodeCandidate> top1 = ranked.get(0);
        double top1Score = top1.score;
        double top2Score = ranked.size() > 1
                ? ranked.get(1).score
                : Math.max(0.0, top1Score - options.singleCandidateGap);
        double margin = Scores.round6(Math.max(0.0, top1Score - top2Score));
        double confidence = Scores.round6(top1Score);

        List<Scored<NodeCandidate>> alternatives = ranked.subList(0, Math.min(2, ranked.size()));
        NodeCandidate best = top1.item;
        boolean xrefPreposition = best.featureVector.flag(FeatureKeys.XREF_PREPOSITION_PRE);

        if (top1Score < options.minTop1Score || margin < options.abstainMarginThreshold) {
            List<ReasonCode> reasons = new ArrayList<>(2);
            reasons.add(ReasonCode.LOW_MARGIN);
            if (xrefPreposition) reasons.add(ReasonCode.XREF_CONFLICT);
            return TokenDecision.abstain(tokenId, reasons, margin, confidence, alternatives);
        }

        if (margin < options.reviewMarginThreshold) {
            return TokenDecision.review(tokenId, best, ReasonCode.LOW_MARGIN, margin, confidence, alternatives);
        }
        if (xrefPreposition) {
            return TokenDecision.review(tokenId, best, ReasonCode.XREF_CONFLICT, margin, confidence, alternatives);
        }
        if (!best.featureVector.flag(FeatureKeys.ANCHOR)) {
            return TokenDecision.review(tokenId, best, ReasonCode.LAYOUT_UNCERTAIN, margin, confidence, alternatives);
        }
        return TokenDecision.accepted(tokenId, best, margin, confidence, alternatives);
    }

    private List<Scored<NodeCandidate>> rank(List<NodeCandidate> group) {
        List<Scored<NodeCandidate>> ranked = new ArrayList<>(group.size());
        for (NodeCandidate c : group) ranked.add(Scored.of(c, scorer.score(c)));
        ranked.sort(RANKING);
        return ranked;
    }

    static final Comparator<Scored<NodeCandidate>> RANKING =
            Comparator.<Scored<NodeCandidate>>comparingDouble(s -> -s.score)
                    .thenComparingInt(s -> s.item.depthHint)
                    .thenComparing(s -> s.item.nodeCandidateId);

    private static int minTokenIndex(List<NodeCandidate> group) {
        int min = Integer.MAX_VALUE;
        for (NodeCandidate c : group) min = Math.min(min, c.tokenIndex);
        return min;
    }
}
