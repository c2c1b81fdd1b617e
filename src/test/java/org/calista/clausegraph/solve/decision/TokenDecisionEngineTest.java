package org.calista.clausegraph.solve.decision;

import org.calista.clausegraph.core.SolverOptions;
import org.calista.clausegraph.graph.FeatureKeys;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;
import org.calista.clausegraph.solve.score.impl.LinearNodeScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.calista.clausegraph.GraphFixtures.candidate;
import static org.calista.clausegraph.GraphFixtures.features;
import static org.calista.clausegraph.GraphFixtures.strong;
import static org.calista.clausegraph.GraphFixtures.weak;

@DisplayName("TokenDecisionEngine")
class TokenDecisionEngineTest {

    private final TokenDecisionEngine engine = new TokenDecisionEngine(new LinearNodeScorer());
    private final SolverOptions options = SolverOptions.defaults();

    private TokenDecision single(NodeCandidate... candidates) {
        TokenDecisions out = engine.decide(List.of(candidates), options);
        assertThat(out.decisions).hasSize(1);
        return out.decisions.get(0);
    }

    @Test
    @DisplayName("Should accept a lone anchored candidate against the synthetic competitor")
    void shouldAccept_whenSingleAnchoredCandidate() {
        TokenDecision d = single(strong("a1", "t1", 0, "a", 1, 0));

        assertThat(d.status).isEqualTo(ParseStatus.ACCEPTED);
        assertThat(d.selected.nodeCandidateId).isEqualTo("a1");
        assertThat(d.marginAbs).isEqualTo(0.3);
        assertThat(d.confidenceScore).isEqualTo(0.7);
        assertThat(d.reasonCodes).isEmpty();
        assertThat(d.alternatives).hasSize(1);
    }

    @Test
    @DisplayName("Should abstain when binary rounding leaves the margin just under the threshold")
    void shouldAbstain_whenRoundedMarginFallsBelowThreshold() {
        // 0.20 + 0.15 + 0.0099995 is stored just below 0.3599995 and rounds down to 0.359999
        NodeCandidate indented = candidate("c_indented", "t1", 0, "a", 1, 0, features(
                FeatureKeys.LINE_START, true, FeatureKeys.INDENTATION, 0.099995));
        NodeCandidate nested = candidate("c_nested", "t1", 0, "a", 2, 0, features(FeatureKeys.LINE_START, true));

        TokenDecision d = single(indented, nested);

        assertThat(d.alternatives.get(0).score).isEqualTo(0.359999);
        assertThat(d.alternatives.get(1).score).isEqualTo(0.28);
        assertThat(d.marginAbs).isEqualTo(0.079999);
        assertThat(d.status).isEqualTo(ParseStatus.ABSTAIN);
        assertThat(d.reasonCodes).containsExactly(ReasonCode.LOW_MARGIN);
    }

    @Test
    @DisplayName("Should not abstain when the margin equals the abstain threshold exactly")
    void shouldReviewNotAbstain_whenMarginEqualsThreshold() {
        NodeCandidate top = candidate("c_top", "t1", 0, "a", 1, 0, features(FeatureKeys.ANCHOR, true));
        NodeCandidate second = candidate("c_second", "t1", 0, "a", 1, 0, features(
                FeatureKeys.LINE_START, true, FeatureKeys.INDENTATION, 0.7));

        TokenDecision d = single(second, top);

        assertThat(d.alternatives.get(0).score).isEqualTo(0.5);
        assertThat(d.alternatives.get(1).score).isEqualTo(0.42);
        assertThat(d.marginAbs).isEqualTo(0.08);
        assertThat(d.status).isEqualTo(ParseStatus.REVIEW);
        assertThat(d.reasonCodes).containsExactly(ReasonCode.LOW_MARGIN);
        assertThat(d.selected.nodeCandidateId).isEqualTo("c_top");
    }

    @Test
    @DisplayName("Should abstain when the best score is below the minimum top-1 score")
    void shouldAbstain_whenTopScoreBelowMinimum() {
        TokenDecision d = single(weak("w1", "t1", 0, "a", 0));

        assertThat(d.confidenceScore).isEqualTo(0.08);
        assertThat(d.status).isEqualTo(ParseStatus.ABSTAIN);
        assertThat(d.hasSelection()).isFalse();
        assertThat(d.reasonCodes).containsExactly(ReasonCode.LOW_MARGIN);
    }

    @Test
    @DisplayName("Should abstain once top-1 drops below 0.12 with everything else held constant")
    void shouldFlipToAbstain_whenTopScoreReducedBelowMinimum() {
        NodeCandidate c = candidate("c1", "t1", 0, "a", 1, 0, features(FeatureKeys.ANCHOR, true));

        TokenDecision atMinimum = new TokenDecisionEngine(n -> 0.12).decide(List.of(c), options).decisions.get(0);
        TokenDecision below = new TokenDecisionEngine(n -> 0.119999).decide(List.of(c), options).decisions.get(0);

        assertThat(atMinimum.status).isEqualTo(ParseStatus.REVIEW);
        assertThat(below.marginAbs).isGreaterThan(options.abstainMarginThreshold);
        assertThat(below.status).isEqualTo(ParseStatus.ABSTAIN);
        assertThat(below.reasonCodes).containsExactly(ReasonCode.LOW_MARGIN);
    }

    @Test
    @DisplayName("Should abstain with xref_conflict and warn when two readings tie")
    void shouldAbstainWithXref_whenTiedAndPrepositionFlagged() {
        NodeCandidate c1 = candidate("c1", "t1", 0, "a", 1, 0, features(
                FeatureKeys.ANCHOR, true, FeatureKeys.LINE_START, true, FeatureKeys.XREF_PREPOSITION_PRE, true));
        NodeCandidate c2 = candidate("c2", "t1", 0, "a", 1, 0, features(
                FeatureKeys.ANCHOR, true, FeatureKeys.LINE_START, true, FeatureKeys.XREF_PREPOSITION_PRE, true));

        TokenDecisions out = engine.decide(List.of(c2, c1), options);
        TokenDecision d = out.decisions.get(0);

        assertThat(d.status).isEqualTo(ParseStatus.ABSTAIN);
        assertThat(d.marginAbs).isZero();
        assertThat(d.reasonCodes).containsExactly(ReasonCode.LOW_MARGIN, ReasonCode.XREF_CONFLICT);
        assertThat(d.alternatives).extracting(s -> s.item.nodeCandidateId).containsExactly("c1", "c2");
        assertThat(out.warnings).containsExactly("ambiguous_abstain:t1");
    }

    @Test
    @DisplayName("Should not warn about ambiguity when a lone candidate abstains")
    void shouldNotWarn_whenSingleCandidateAbstains() {
        TokenDecisions out = engine.decide(List.of(weak("w1", "t1", 0, "a", 0)), options);

        assertThat(out.decisions.get(0).status).isEqualTo(ParseStatus.ABSTAIN);
        assertThat(out.warnings).isEmpty();
    }

    @Test
    @DisplayName("Should review with xref_conflict when the margin is comfortable but a preposition precedes")
    void shouldReviewXref_whenPrepositionFlagged() {
        TokenDecision d = single(candidate("c1", "t1", 0, "a", 1, 0, features(
                FeatureKeys.ANCHOR, true, FeatureKeys.LINE_START, true, FeatureKeys.XREF_PREPOSITION_PRE, true)));

        assertThat(d.confidenceScore).isEqualTo(0.5);
        assertThat(d.status).isEqualTo(ParseStatus.REVIEW);
        assertThat(d.reasonCodes).containsExactly(ReasonCode.XREF_CONFLICT);
    }

    @Test
    @DisplayName("Should review with layout_uncertain when the candidate has no anchor")
    void shouldReviewLayout_whenNoAnchor() {
        TokenDecision d = single(candidate("c1", "t1", 0, "a", 1, 0, features(
                FeatureKeys.LINE_START, true, FeatureKeys.INDENTATION, 1.0)));

        assertThat(d.confidenceScore).isEqualTo(0.45);
        assertThat(d.status).isEqualTo(ParseStatus.REVIEW);
        assertThat(d.reasonCodes).containsExactly(ReasonCode.LAYOUT_UNCERTAIN);
    }

    @Test
    @DisplayName("Should report only low_margin when several review conditions hold")
    void shouldPreferLowMargin_whenMultipleReviewConditionsHold() {
        NodeCandidate top = candidate("c1", "t1", 0, "a", 1, 0, features(
                FeatureKeys.LINE_START, true, FeatureKeys.XREF_PREPOSITION_PRE, true, FeatureKeys.INDENTATION, 2.0));
        NodeCandidate other = candidate("c2", "t1", 0, "a", 1, 0, features(FeatureKeys.INDENTATION, 0.5));

        TokenDecision d = single(top, other);

        assertThat(d.confidenceScore).isEqualTo(0.35);
        assertThat(d.marginAbs).isEqualTo(0.15);
        assertThat(d.status).isEqualTo(ParseStatus.REVIEW);
        assertThat(d.reasonCodes).containsExactly(ReasonCode.LOW_MARGIN);
    }

    @Test
    @DisplayName("Should break score ties by depth hint, then by candidate id")
    void shouldBreakTies_whenScoresEqual() {
        NodeCandidate shallow = candidate("z_shallow", "t1", 0, "a", 1, 0, features(FeatureKeys.INDENTATION, 0.0));
        NodeCandidate deep = candidate("a_deep", "t1", 0, "a", 2, 0, features(FeatureKeys.INDENTATION, 0.7));

        TokenDecision byDepth = single(deep, shallow);
        assertThat(byDepth.alternatives.get(0).score).isEqualTo(byDepth.alternatives.get(1).score);
        assertThat(byDepth.alternatives.get(0).item.nodeCandidateId).isEqualTo("z_shallow");

        TokenDecision byId = single(
                candidate("m2", "t1", 0, "a", 1, 0, features(FeatureKeys.ANCHOR, true)),
                candidate("m1", "t1", 0, "a", 1, 0, features(FeatureKeys.ANCHOR, true)));
        assertThat(byId.alternatives.get(0).item.nodeCandidateId).isEqualTo("m1");
    }

    @Test
    @DisplayName("Should keep at most two alternatives per token")
    void shouldTruncateAlternatives_whenMoreThanTwoCandidates() {
        TokenDecision d = single(
                strong("c1", "t1", 0, "a", 1, 0),
                candidate("c2", "t1", 0, "a", 1, 0, features(FeatureKeys.LINE_START, true)),
                weak("c3", "t1", 0, "a", 0));

        assertThat(d.alternatives).extracting(s -> s.item.nodeCandidateId).containsExactly("c1", "c2");
    }

    @Test
    @DisplayName("Should process tokens by minimum token index, stable on ties")
    void shouldOrderTokens_whenInputIsShuffled() {
        List<NodeCandidate> input = List.of(
                strong("c3", "t3", 7, "c", 1, 70),
                strong("c1", "t1", 2, "a", 1, 20),
                strong("c2b", "t2", 9, "b", 1, 90),
                weak("c2a", "t2", 1, "b", 10),
                strong("c4", "t4", 2, "d", 1, 25));

        TokenDecisions out = engine.decide(input, options);

        assertThat(out.decisions).extracting(d -> d.tokenId).containsExactly("t2", "t1", "t4", "t3");
        assertThat(out.selectedCandidates().keySet()).containsExactly("c2b", "c1", "c4", "c3");
    }

    @Test
    @DisplayName("Should select at most one candidate per token")
    void shouldSelectOnePerToken_whenTokensHaveSeveralReadings() {
        TokenDecisions out = engine.decide(List.of(
                strong("a1", "t1", 0, "a", 1, 0),
                weak("a2", "t1", 0, "a", 0),
                strong("b1", "t2", 1, "b", 1, 10)), options);

        assertThat(out.selectedCandidates().values()).extracting(c -> c.tokenId).doesNotHaveDuplicates();
        assertThat(out.byTokenId()).containsOnlyKeys("t1", "t2");
    }

    @Test
    @DisplayName("Should honour per-call thresholds")
    void shouldUseOverriddenThresholds_whenOptionsChanged() {
        SolverOptions strict = options.toBuilder().abstainMarginThreshold(0.35).build();

        TokenDecision d = engine.decide(List.of(strong("a1", "t1", 0, "a", 1, 0)), strict).decisions.get(0);

        assertThat(d.status).isEqualTo(ParseStatus.ABSTAIN);
        assertThat(d.reasonCodes).containsExactly(ReasonCode.LOW_MARGIN);
    }
}
