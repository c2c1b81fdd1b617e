package org.calista.clausegraph.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Candidate graph model")
class CandidateModelTest {

    @Test
    @DisplayName("Should reject node candidates that break structural preconditions")
    void shouldThrow_whenNodeInvalid() {
        assertThatThrownBy(() -> NodeCandidate.builder("n1", "t1").span(4, 4).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("span_end must be > span_start");
        assertThatThrownBy(() -> NodeCandidate.builder("n1", "t1").depthHint(0).build())
                .hasMessageContaining("depth_hint");
        assertThatThrownBy(() -> NodeCandidate.builder("n1", "t1").tokenIndex(-1).build())
                .hasMessageContaining("token_index");
        assertThatThrownBy(() -> NodeCandidate.builder(" ", "t1").build())
                .hasMessageContaining("node_candidate_id");
        assertThatThrownBy(() -> NodeCandidate.builder("n1", "t1").ordinal(0).build())
                .hasMessageContaining("ordinal");
    }

    @Test
    @DisplayName("Should reject inconsistent edge candidates")
    void shouldThrow_whenEdgeInvalid() {
        assertThatThrownBy(() -> new ParentEdgeCandidate("e1", "c", "", false, true, null, null, null))
                .hasMessageContaining("non-root edge must carry parent_candidate_id");
        assertThatThrownBy(() -> new ParentEdgeCandidate("e1", "c", "p", false, true, List.of("depth_jump"), null, null))
                .hasMessageContaining("hard_invalid_reasons");
        assertThatThrownBy(() -> ParentEdgeCandidate.toRoot("e1", "c", Map.of("x", Double.NaN)))
                .hasMessageContaining("must be finite");
    }

    @Test
    @DisplayName("Should normalize the parent id of a root edge to empty")
    void shouldClearParent_whenEdgeIsRoot() {
        ParentEdgeCandidate e = new ParentEdgeCandidate("e1", "c", "leftover", true, true, null, null, null);

        assertThat(e.parentCandidateId).isEmpty();
        assertThat(e.softScoreComponents).isEmpty();
    }

    @Test
    @DisplayName("Should evaluate feature truthiness like the graph producer")
    void shouldEvaluateTruthiness_whenMixedTypes() {
        FeatureVector f = FeatureVector.of(Map.of("a", true, "b", 0, "c", "x", "d", "", "e", 2.5));

        assertThat(f.flag("a")).isTrue();
        assertThat(f.flag("b")).isFalse();
        assertThat(f.flag("c")).isTrue();
        assertThat(f.flag("d")).isFalse();
        assertThat(f.flag("missing")).isFalse();
        assertThat(f.number("e")).isEqualTo(2.5);
        assertThat(f.number("c")).isZero();
        assertThat(f.asMap().keySet()).containsExactly("a", "b", "c", "d", "e");
    }

    @Test
    @DisplayName("Should reject nested feature values")
    void shouldThrow_whenFeatureValueNested() {
        assertThatThrownBy(() -> FeatureVector.of(Map.of("nested", List.of(1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should map unknown level codes to other")
    void shouldFallBackToOther_whenLevelCodeUnknown() {
        assertThat(LevelType.fromCode("ROMAN")).isEqualTo(LevelType.ROMAN);
        assertThat(LevelType.fromCode("bullet")).isEqualTo(LevelType.OTHER);
        assertThat(LevelType.fromCode(null)).isEqualTo(LevelType.OTHER);
    }
}
