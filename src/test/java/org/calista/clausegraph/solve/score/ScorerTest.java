package org.calista.clausegraph.solve.score;

import org.calista.clausegraph.graph.FeatureKeys;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.graph.ParentEdgeCandidate;
import org.calista.clausegraph.solve.score.impl.LinearNodeScorer;
import org.calista.clausegraph.solve.score.impl.SoftPenaltyEdgeScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.calista.clausegraph.GraphFixtures.candidate;
import static org.calista.clausegraph.GraphFixtures.features;

@DisplayName("Default scorers")
class ScorerTest {

    private final NodeScorer nodes = new LinearNodeScorer();
    private final EdgeScorer edges = new SoftPenaltyEdgeScorer();

    @Test
    @DisplayName("Should apply the root depth bonus only at depth 1")
    void shouldApplyDepthBonus_whenDepthHintIsOne() {
        NodeCandidate root = candidate("n1", "t1", 0, "a", 1, 0, features(FeatureKeys.ANCHOR, true));
        NodeCandidate nested = candidate("n2", "t1", 0, "a", 3, 0, features(FeatureKeys.ANCHOR, true));

        assertThat(nodes.score(root)).isEqualTo(0.5);
        assertThat(nodes.score(nested)).isEqualTo(0.43);
    }

    @Test
    @DisplayName("Should subtract cross-reference penalties and scale indentation")
    void shouldCombineAllFeatures_whenEverySignalIsPresent() {
        NodeCandidate c = candidate("n1", "t1", 0, "a", 1, 0, features(
                FeatureKeys.ANCHOR, true,
                FeatureKeys.LINE_START, 1,
                FeatureKeys.INDENTATION, 0.5,
                FeatureKeys.XREF_KEYWORD_PRE, "see",
                FeatureKeys.XREF_PREPOSITION_PRE, true));

        // 0.35 + 0.20 + 0.15 + 0.05 - 0.12 - 0.20
        assertThat(nodes.score(c)).isEqualTo(0.43);
    }

    @Test
    @DisplayName("Should round the exact binary sum rather than its shortest decimal form")
    void shouldRoundUp_whenBinarySumLiesAboveHalf() {
        // 0.35 + 0.20 + 0.15 + 0.0000005 sums to a double just above 0.7000005
        NodeCandidate c = candidate("n1", "t1", 0, "a", 1, 0, features(
                FeatureKeys.ANCHOR, true,
                FeatureKeys.LINE_START, true,
                FeatureKeys.INDENTATION, 0.000005));

        assertThat(nodes.score(c)).isEqualTo(0.700001);
    }

    @Test
    @DisplayName("Should clamp node scores into [0, 1]")
    void shouldClampToZero_whenPenaltiesDominate() {
        NodeCandidate c = candidate("n1", "t1", 0, "a", 2, 0, features(
                FeatureKeys.XREF_KEYWORD_PRE, true,
                FeatureKeys.XREF_PREPOSITION_PRE, true));
        NodeCandidate big = candidate("n2", "t2", 1, "b", 1, 5, features(
                FeatureKeys.ANCHOR, true,
                FeatureKeys.LINE_START, true,
                FeatureKeys.INDENTATION, 9.0));

        assertThat(nodes.score(c)).isZero();
        assertThat(nodes.score(big)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should treat empty strings and zero numbers as unset flags")
    void shouldIgnoreFalsyFlags_whenValuesAreEmptyOrZero() {
        NodeCandidate c = candidate("n1", "t1", 0, "a", 1, 0, features(
                FeatureKeys.ANCHOR, "",
                FeatureKeys.LINE_START, 0,
                FeatureKeys.XREF_PREPOSITION_PRE, false));

        assertThat(nodes.score(c)).isEqualTo(0.15);
    }

    @Test
    @DisplayName("Should score edges as soft components minus penalties")
    void shouldSubtractPenalties_whenScoringEdge() {
        ParentEdgeCandidate e = ParentEdgeCandidate.toParent("e1", "c", "p",
                Map.of("layout", 0.4, "sequence", 0.3), Map.of("gap", 0.25));

        assertThat(edges.score(e)).isEqualTo(0.45);
    }

    @Test
    @DisplayName("Should allow negative edge scores")
    void shouldGoNegative_whenPenaltiesExceedSoftScore() {
        ParentEdgeCandidate e = ParentEdgeCandidate.toParent("e1", "c", "p",
                Map.of("layout", 0.1), Map.of("gap", 0.3));

        assertThat(edges.score(e)).isEqualTo(-0.2);
    }
}
